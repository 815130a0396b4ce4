package io.github.cyfko.docfilter.core.merge;

import io.github.cyfko.docfilter.core.config.FilterOperators;
import io.github.cyfko.docfilter.core.model.FilterDocument;
import io.github.cyfko.docfilter.core.model.FilterList;
import io.github.cyfko.docfilter.core.model.FilterNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Merges filter nodes that are implicitly ANDed into the smallest equivalent set of nodes.
 * <p>
 * Two documents merge key by key. A key constrained identically on both sides is kept once, a key
 * constrained on one side only is copied, and a key constrained differently on both sides is merged
 * recursively. Whatever cannot be reconciled ends up in a <em>residue</em>, to be ANDed with the
 * merged document:
 * </p>
 * <pre>{@code
 * merge({a: 1, b: {$gt: 2}}, {b: {$lt: 9}, c: 3})  →  [{a: 1, b: {$gt: 2, $lt: 9}, c: 3}]
 * merge({a: 1, b: 2},        {a: 1, b: 3})         →  [{a: 1, b: 2}, {b: 3}]
 * merge({f: {$in: [1, 2]}},  {f: {$in: [2, 3]}})   →  [{f: {$in: [1, 2, 3]}}]
 * }</pre>
 * <p>
 * Operands are never modified. This class is stateless and cannot be instantiated.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FilterMerger {

    private static final Logger log = Logger.getLogger(FilterMerger.class.getName());

    private FilterMerger() {}

    /**
     * Merges two nodes as much as possible.
     * <ul>
     *   <li>equal operands merge into one</li>
     *   <li>if neither operand is a document, both are returned unmerged</li>
     *   <li>if only one operand is a document, it comes first and the other is the residue</li>
     *   <li>two documents are merged key by key, recursively</li>
     * </ul>
     *
     * @param first  first node
     * @param second second node
     * @return the merged node and the optional residue
     */
    public static MergeResult merge(FilterNode first, FilterNode second) {
        Objects.requireNonNull(first, "First node cannot be null");
        Objects.requireNonNull(second, "Second node cannot be null");

        if (first.equals(second)) {
            return MergeResult.of(first);
        }

        boolean firstIsDocument = first instanceof FilterDocument;
        boolean secondIsDocument = second instanceof FilterDocument;
        if (!firstIsDocument && secondIsDocument) {
            return MergeResult.of(second, first);
        }
        if (!firstIsDocument || !secondIsDocument) {
            return MergeResult.of(first, second);
        }
        return mergeDocuments((FilterDocument) first, (FilterDocument) second);
    }

    /**
     * Merges all nodes as much as possible.
     * <p>
     * Nodes are merged pairwise from left to right. Residues produced along the way are merged
     * among themselves with the same algorithm, recursively.
     * </p>
     *
     * @param nodes nodes to merge, in order
     * @return the merged node first, followed by the residues that could not be merged into it;
     * empty if {@code nodes} is empty
     */
    public static List<FilterNode> mergeMany(List<? extends FilterNode> nodes) {
        Objects.requireNonNull(nodes, "Nodes to merge cannot be null");
        if (nodes.size() <= 1) {
            return new ArrayList<>(nodes);
        }

        FilterNode merged = nodes.get(0);
        List<FilterNode> residues = new ArrayList<>();
        for (int i = 1; i < nodes.size(); i++) {
            MergeResult result = merge(merged, nodes.get(i));
            merged = result.merged();
            if (result.hasResidue()) {
                residues.add(result.residue());
            }
        }

        List<FilterNode> result = mergeMany(residues);
        result.add(0, merged);
        return result;
    }

    private static MergeResult mergeDocuments(FilterDocument first, FilterDocument second) {
        Map<String, FilterNode> merged = new LinkedHashMap<>();
        Map<String, FilterNode> residue = new LinkedHashMap<>();

        for (Map.Entry<String, FilterNode> entry : first.entries().entrySet()) {
            String key = entry.getKey();
            FilterNode left = entry.getValue();
            FilterNode right = second.get(key);

            if (right == null || left.equals(right)) {
                merged.put(key, left);
                continue;
            }

            // same field on both sides with a set-membership test: fold both value lists into one
            if (inList(left) != null && inList(right) != null) {
                FilterDocument leftPredicate = (FilterDocument) left;
                FilterDocument rightPredicate = (FilterDocument) right;
                left = leftPredicate.with(FilterOperators.IN, inList(left).union(inList(right)));
                right = rightPredicate.without(FilterOperators.IN);
            }

            MergeResult children = merge(left, right);
            merged.put(key, children.merged());
            if (children.hasResidue()) {
                residue.put(key, children.residue());
            }
        }

        for (Map.Entry<String, FilterNode> entry : second.entries().entrySet()) {
            if (!first.containsKey(entry.getKey())) {
                merged.put(entry.getKey(), entry.getValue());
            }
        }

        if (residue.isEmpty()) {
            return MergeResult.of(FilterDocument.of(merged));
        }

        log.finer(() -> String.format("Unmergeable keys %s left as residue", residue.keySet()));
        return MergeResult.of(FilterDocument.of(merged), FilterDocument.of(residue));
    }

    private static FilterList inList(FilterNode node) {
        if (node instanceof FilterDocument document && document.get(FilterOperators.IN) instanceof FilterList list) {
            return list;
        }
        return null;
    }
}
