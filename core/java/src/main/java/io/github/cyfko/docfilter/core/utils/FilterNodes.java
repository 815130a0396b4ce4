package io.github.cyfko.docfilter.core.utils;

import io.github.cyfko.docfilter.core.model.FilterDocument;
import io.github.cyfko.docfilter.core.model.FilterList;
import io.github.cyfko.docfilter.core.model.FilterNode;
import io.github.cyfko.docfilter.core.model.FilterValue;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Utility methods bridging plain Java values and {@link FilterNode} trees.
 * <p>
 * Conversion rules applied by {@link #toNode(Object)}:
 * </p>
 * <ul>
 *   <li>{@link FilterNode} → itself</li>
 *   <li>{@link Map} → {@link FilterDocument}, keys converted with {@link String#valueOf(Object)}</li>
 *   <li>{@link Collection} or array (except {@code byte[]}) → {@link FilterList}</li>
 *   <li>anything else, {@code null} included → {@link FilterValue}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FilterNodes {

    private FilterNodes() {}

    /**
     * Converts a plain Java value into a filter node, recursively.
     *
     * @param value the value to convert, may be null
     * @return the equivalent node
     */
    public static FilterNode toNode(Object value) {
        if (value instanceof FilterNode node) {
            return node;
        }
        if (value instanceof Map<?, ?> map) {
            return toDocument(map);
        }
        if (value instanceof Collection<?> collection) {
            List<FilterNode> nodes = new ArrayList<>(collection.size());
            for (Object item : collection) {
                nodes.add(toNode(item));
            }
            return FilterList.of(nodes);
        }
        if (value != null && value.getClass().isArray() && !(value instanceof byte[])) {
            int length = Array.getLength(value);
            List<FilterNode> nodes = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                nodes.add(toNode(Array.get(value, i)));
            }
            return FilterList.of(nodes);
        }
        return FilterValue.of(value);
    }

    /**
     * Converts a plain map into a filter document, recursively.
     *
     * @param map the map to convert, iteration order is kept
     * @return the equivalent document
     */
    public static FilterDocument toDocument(Map<?, ?> map) {
        Map<String, FilterNode> entries = new LinkedHashMap<>();
        map.forEach((key, value) -> entries.put(String.valueOf(key), toNode(value)));
        return FilterDocument.of(entries);
    }

    /**
     * @param value any value
     * @return true if {@code value} is a string holding at least one non-whitespace character
     */
    public static boolean isValidStr(Object value) {
        return value instanceof String s && !s.isBlank();
    }

    /**
     * @param value any value
     * @return true if {@code value} is a key/value document, either a {@link Map} or a {@link FilterDocument}
     */
    public static boolean isDocument(Object value) {
        return value instanceof Map<?, ?> || value instanceof FilterDocument;
    }

    /**
     * Structural equality of two plain or node values: recursive, order-sensitive for sequences,
     * order-insensitive for document keys.
     *
     * @return true if both values describe the same filter clause
     */
    public static boolean deepEquals(Object a, Object b) {
        return toNode(a).equals(toNode(b));
    }

    /**
     * @param values the candidates
     * @param value  the value to look up
     * @return true if one of {@code values} is structurally equal to {@code value}
     */
    public static boolean containsValue(Collection<?> values, Object value) {
        FilterNode node = toNode(value);
        for (Object candidate : values) {
            if (toNode(candidate).equals(node)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Appends {@code node} to {@code target} unless a structurally equal node is already there.
     *
     * @return true if the node was appended
     */
    public static <N extends FilterNode> boolean addDistinct(List<N> target, N node) {
        if (target.contains(node)) {
            return false;
        }
        return target.add(node);
    }
}
