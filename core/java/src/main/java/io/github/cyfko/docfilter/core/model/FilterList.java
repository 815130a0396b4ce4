package io.github.cyfko.docfilter.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable ordered sequence of filter nodes.
 * <p>
 * Used as the value of the {@code $and}, {@code $or} and {@code $in} operators, and for array
 * literals. Equality is order-sensitive.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FilterList implements FilterNode, Iterable<FilterNode> {

    private static final FilterList EMPTY = new FilterList(List.of());

    private final List<FilterNode> nodes;

    private FilterList(List<FilterNode> nodes) {
        this.nodes = nodes;
    }

    /**
     * @param nodes the list entries, in order; duplicates are kept
     * @return a list holding a defensive copy of {@code nodes}
     * @throws NullPointerException if {@code nodes} or one of its entries is null
     */
    public static FilterList of(List<? extends FilterNode> nodes) {
        Objects.requireNonNull(nodes, "List nodes cannot be null");
        return nodes.isEmpty() ? EMPTY : new FilterList(List.copyOf(nodes));
    }

    public static FilterList of(FilterNode... nodes) {
        return of(List.of(nodes));
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * @param node the node to look up
     * @return true if a structurally equal node is part of this list
     */
    public boolean contains(FilterNode node) {
        return nodes.contains(node);
    }

    /**
     * @return an unmodifiable view of the entries
     */
    public List<FilterNode> nodes() {
        return nodes;
    }

    /**
     * Returns a list made of this list's entries followed by the entries of {@code other} that are
     * not already present. Entries keep the order of their first occurrence.
     *
     * @param other the entries to append
     * @return the union of both lists, or this list when nothing was appended
     */
    public FilterList union(FilterList other) {
        Objects.requireNonNull(other, "Other list cannot be null");
        List<FilterNode> result = new ArrayList<>(nodes);
        for (FilterNode node : other.nodes) {
            if (!result.contains(node)) {
                result.add(node);
            }
        }
        return result.size() == nodes.size() ? this : new FilterList(Collections.unmodifiableList(result));
    }

    @Override
    public Iterator<FilterNode> iterator() {
        return nodes.iterator();
    }

    @Override
    public List<Object> toRaw() {
        List<Object> raw = new ArrayList<>(nodes.size());
        for (FilterNode node : nodes) {
            raw.add(node.toRaw());
        }
        return raw;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof FilterList other && nodes.equals(other.nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return nodes.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
    }
}
