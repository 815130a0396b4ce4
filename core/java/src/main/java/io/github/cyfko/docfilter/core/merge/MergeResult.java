package io.github.cyfko.docfilter.core.merge;

import io.github.cyfko.docfilter.core.model.FilterNode;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of merging two filter nodes.
 * <p>
 * {@code merged} holds everything both operands agree on or that only one of them constrains;
 * {@code residue}, when present, holds the part of the second operand that conflicts with
 * {@code merged} on at least one key and must therefore be ANDed separately.
 * </p>
 *
 * @param merged  the merged node, never null
 * @param residue the irreconcilable remainder, null when the operands merged completely
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record MergeResult(FilterNode merged, FilterNode residue) {

    public MergeResult {
        Objects.requireNonNull(merged, "Merged node cannot be null");
    }

    public static MergeResult of(FilterNode merged) {
        return new MergeResult(merged, null);
    }

    public static MergeResult of(FilterNode merged, FilterNode residue) {
        return new MergeResult(merged, residue);
    }

    public boolean hasResidue() {
        return residue != null;
    }

    /**
     * @return {@code [merged]} or {@code [merged, residue]}
     */
    public List<FilterNode> toList() {
        return residue == null ? List.of(merged) : List.of(merged, residue);
    }
}
