package io.github.cyfko.docfilter.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable, insertion-ordered mapping from key to {@link FilterNode}.
 * <p>
 * A document plays two roles in a filter tree:
 * </p>
 * <ul>
 *   <li><strong>Filter document</strong>: keys are field names and the combinators {@code $and} /
 *       {@code $or}, e.g. {@code {status: "A", $or: [{qty: 1}, {qty: 2}]}}</li>
 *   <li><strong>Operator predicate</strong>: keys are comparison operators applied to one field,
 *       e.g. {@code {$gt: 5, $lt: 9}}</li>
 * </ul>
 * <p>
 * All mutators ({@link #with(String, FilterNode)}, {@link #without(String)}) return a new
 * document. Key order is kept for output but ignored by {@link #equals(Object)}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FilterDocument implements FilterNode {

    private static final FilterDocument EMPTY = new FilterDocument(Map.of());

    private final Map<String, FilterNode> entries;

    private FilterDocument(Map<String, FilterNode> entries) {
        this.entries = entries;
    }

    public static FilterDocument empty() {
        return EMPTY;
    }

    /**
     * Creates a single-key document.
     *
     * @param key   the field or operator name
     * @param value the associated node
     * @return a document holding exactly one entry
     */
    public static FilterDocument of(String key, FilterNode value) {
        Map<String, FilterNode> map = new LinkedHashMap<>();
        map.put(requireKey(key), Objects.requireNonNull(value, "Value of '" + key + "' cannot be null"));
        return new FilterDocument(Collections.unmodifiableMap(map));
    }

    /**
     * @param entries ordered entries; iteration order of the given map is kept
     * @return a document holding a defensive copy of {@code entries}
     */
    public static FilterDocument of(Map<String, ? extends FilterNode> entries) {
        Objects.requireNonNull(entries, "Document entries cannot be null");
        if (entries.isEmpty()) {
            return EMPTY;
        }
        Map<String, FilterNode> map = new LinkedHashMap<>();
        entries.forEach((key, value) ->
                map.put(requireKey(key), Objects.requireNonNull(value, "Value of '" + key + "' cannot be null")));
        return new FilterDocument(Collections.unmodifiableMap(map));
    }

    public FilterNode get(String key) {
        return entries.get(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    /**
     * @return the keys in insertion order
     */
    public Set<String> keys() {
        return entries.keySet();
    }

    /**
     * @return an unmodifiable, insertion-ordered view of the entries
     */
    public Map<String, FilterNode> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Returns a copy of this document where {@code key} maps to {@code value}. An existing key keeps
     * its position, a new key is appended.
     */
    public FilterDocument with(String key, FilterNode value) {
        Map<String, FilterNode> map = new LinkedHashMap<>(entries);
        map.put(requireKey(key), Objects.requireNonNull(value, "Value of '" + key + "' cannot be null"));
        return new FilterDocument(Collections.unmodifiableMap(map));
    }

    /**
     * Returns a copy of this document without {@code key}, or this document if the key is absent.
     */
    public FilterDocument without(String key) {
        if (!entries.containsKey(key)) {
            return this;
        }
        Map<String, FilterNode> map = new LinkedHashMap<>(entries);
        map.remove(key);
        return map.isEmpty() ? EMPTY : new FilterDocument(Collections.unmodifiableMap(map));
    }

    @Override
    public Map<String, Object> toRaw() {
        Map<String, Object> raw = new LinkedHashMap<>();
        entries.forEach((key, value) -> raw.put(key, value.toRaw()));
        return raw;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof FilterDocument other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private static String requireKey(String key) {
        if (key == null) {
            throw new NullPointerException("Document key cannot be null");
        }
        return key;
    }
}
