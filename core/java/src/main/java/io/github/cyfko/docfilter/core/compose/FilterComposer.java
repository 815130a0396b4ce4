package io.github.cyfko.docfilter.core.compose;

import io.github.cyfko.docfilter.core.config.FilterOperators;
import io.github.cyfko.docfilter.core.exception.FilterArgumentException;
import io.github.cyfko.docfilter.core.merge.FilterMerger;
import io.github.cyfko.docfilter.core.model.FilterDocument;
import io.github.cyfko.docfilter.core.model.FilterList;
import io.github.cyfko.docfilter.core.model.FilterNode;
import io.github.cyfko.docfilter.core.utils.FilterNodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Owns a growing filter document and folds new clauses into it.
 * <p>
 * Every clause, whatever the primitive it comes from, goes through {@link #andFold(List)} or
 * {@link #orFold(List)}, which deduplicate structurally equal clauses and merge compatible ones
 * with {@link FilterMerger}. The resulting document stays flat: repeated constraints on one field
 * end up as operators of a single predicate, and only truly conflicting clauses are pushed to an
 * {@code $and} list.
 * </p>
 *
 * <pre>{@code
 * FilterComposer composer = new FilterComposer();
 * composer.compare("age", "$gte", 18);
 * composer.compare("age", "$lt", 65);
 * composer.matchesAll("status", List.of("A"));
 * composer.current();   // {age: {$gte: 18, $lt: 65}, status: "A"}
 * }</pre>
 *
 * <p>Instances are not thread-safe: a composer belongs to exactly one builder.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterComposer {

    private static final Logger log = Logger.getLogger(FilterComposer.class.getName());

    private FilterDocument q;

    public FilterComposer() {
        this(FilterDocument.empty());
    }

    /**
     * @param source the document to start from
     */
    public FilterComposer(FilterDocument source) {
        this.q = Objects.requireNonNull(source, "Source document cannot be null");
    }

    /**
     * @return the filter document built so far
     */
    public FilterDocument current() {
        return q;
    }

    /**
     * ANDs the given documents with the current filter.
     * <p>
     * The current filter (without its {@code $and}), the entries of its {@code $and} and the given
     * documents are deduplicated and merged. The merged document becomes the new filter; the
     * residues that could not be merged into it become its {@code $and} list.
     * </p>
     *
     * @param expressions documents to AND, in order
     */
    public void andFold(List<FilterDocument> expressions) {
        Objects.requireNonNull(expressions, "Expressions to AND cannot be null");

        List<FilterNode> toBeAnded = new ArrayList<>();
        FilterDocument base = q;
        if (q.get(FilterOperators.AND) instanceof FilterList existing) {
            base = q.without(FilterOperators.AND);
            if (!base.isEmpty()) {
                toBeAnded.add(base);
            }
            for (FilterNode node : existing) {
                FilterNodes.addDistinct(toBeAnded, node);
            }
        } else if (!base.isEmpty()) {
            toBeAnded.add(base);
        }
        for (FilterDocument expression : expressions) {
            FilterNodes.addDistinct(toBeAnded, expression);
        }
        if (toBeAnded.isEmpty()) {
            return;
        }

        List<FilterNode> merged = FilterMerger.mergeMany(toBeAnded);
        if (merged.get(0) instanceof FilterDocument document) {
            q = withAndEntries(document, merged.subList(1, merged.size()));
        } else {
            // only literal entries in $and: nothing to merge them into
            q = withAndEntries(FilterDocument.empty(), merged);
        }
    }

    /**
     * ORs the given documents and ANDs the disjunction with the current filter.
     * <p>
     * A single document is simply ANDed. If the current filter already holds an {@code $or}, both
     * disjunctions are moved to its {@code $and} as separate {@code {$or: [...]}} entries, since two
     * independent disjunctions cannot be merged without a cross product.
     * </p>
     *
     * @param expressions the alternatives; duplicates are dropped
     */
    public void orFold(List<FilterDocument> expressions) {
        Objects.requireNonNull(expressions, "Expressions to OR cannot be null");

        List<FilterDocument> alternatives = new ArrayList<>();
        for (FilterDocument expression : expressions) {
            FilterNodes.addDistinct(alternatives, expression);
        }
        if (alternatives.isEmpty()) {
            return;
        }
        if (alternatives.size() == 1) {
            andFold(alternatives);
            return;
        }

        FilterList disjunction = FilterList.of(alternatives);
        if (q.containsKey(FilterOperators.OR)) {
            FilterDocument existing = FilterDocument.of(FilterOperators.OR, q.get(FilterOperators.OR));
            FilterDocument added = FilterDocument.of(FilterOperators.OR, disjunction);
            q = withAndEntries(q.without(FilterOperators.OR), List.of(existing, added));
            log.finer(() -> "Existing $or demoted to $and alongside a new disjunction");
        } else {
            q = q.with(FilterOperators.OR, disjunction);
        }
    }

    /**
     * Requires {@code field} to match every one of {@code values}. Each value is either a literal
     * (implicit equality) or an operator document such as {@code {$gt: 5}}.
     *
     * @param field  the document field
     * @param values the values to match, duplicates are dropped
     * @throws FilterArgumentException if {@code field} is not a non-empty string
     */
    public void matchesAll(String field, List<?> values) {
        requireField(field);
        Objects.requireNonNull(values, "Values cannot be null");

        List<FilterDocument> queries = new ArrayList<>(values.size());
        for (Object value : values) {
            FilterNodes.addDistinct(queries, FilterDocument.of(field, FilterNodes.toNode(value)));
        }
        andFold(queries);
    }

    /**
     * Requires {@code field} to match at least one of {@code values}, expressed as an {@code $in}.
     * A single value without {@code addToExistingOr} is a plain equality.
     *
     * @param field           the document field
     * @param values          the accepted values, duplicates are dropped
     * @param addToExistingOr if true, the values are added to the field's existing {@code $in} list
     *                        instead of being ANDed with it
     * @throws FilterArgumentException if {@code field} is not a non-empty string
     */
    public void matchesAny(String field, List<?> values, boolean addToExistingOr) {
        requireField(field);
        Objects.requireNonNull(values, "Values cannot be null");

        if (values.size() == 1 && !addToExistingOr) {
            matchesAll(field, values);
            return;
        }

        List<FilterNode> accepted = new ArrayList<>();
        if (addToExistingOr
                && q.get(field) instanceof FilterDocument predicate
                && predicate.get(FilterOperators.IN) instanceof FilterList existing) {
            accepted.addAll(existing.nodes());
            // removed here, re-added below with the new values
            q = predicate.size() == 1
                    ? q.without(field)
                    : q.with(field, predicate.without(FilterOperators.IN));
        }
        for (Object value : values) {
            FilterNodes.addDistinct(accepted, FilterNodes.toNode(value));
        }
        if (!accepted.isEmpty()) {
            compare(field, FilterOperators.IN, FilterList.of(accepted));
        }
    }

    /**
     * Requires {@code field} to satisfy {@code {operator: value}}.
     *
     * @param field    the document field
     * @param operator the comparison operator, e.g. {@code $gt}
     * @param value    the operand
     * @throws FilterArgumentException if {@code field} or {@code operator} is not a non-empty string
     */
    public void compare(String field, String operator, Object value) {
        requireField(field);
        if (!FilterNodes.isValidStr(operator)) {
            throw new FilterArgumentException("Invalid comparator, should be a non-empty string: " + describe(operator), operator);
        }
        matchesAll(field, List.of(FilterDocument.of(operator, FilterNodes.toNode(value))));
    }

    /**
     * Appends {@code entries} to the {@code $and} list of {@code document}, skipping duplicates.
     */
    private static FilterDocument withAndEntries(FilterDocument document, List<? extends FilterNode> entries) {
        if (entries.isEmpty()) {
            return document;
        }
        List<FilterNode> and = new ArrayList<>();
        FilterNode existing = document.get(FilterOperators.AND);
        if (existing instanceof FilterList list) {
            and.addAll(list.nodes());
        } else if (existing != null) {
            and.add(existing);
        }
        for (FilterNode entry : entries) {
            FilterNodes.addDistinct(and, entry);
        }
        return document.with(FilterOperators.AND, FilterList.of(and));
    }

    /**
     * @throws FilterArgumentException if {@code field} is not a non-empty string
     */
    public static void requireField(String field) {
        if (!FilterNodes.isValidStr(field)) {
            throw new FilterArgumentException("Invalid field, should be a non-empty string: " + describe(field), field);
        }
    }

    private static String describe(String value) {
        return value == null ? "null" : "\"" + value + "\"";
    }
}
