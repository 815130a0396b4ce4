package io.github.cyfko.docfilter.core;

import io.github.cyfko.docfilter.core.config.SearchPolicy;
import io.github.cyfko.docfilter.core.model.FilterDocument;
import io.github.cyfko.docfilter.core.utils.FilterNodes;

import java.util.Map;

/**
 * Entry point for building efficient document-store filters.
 * <p>
 * Clauses are merged as they are added, so the resulting filter stays minimal: constraints on the
 * same field share one predicate, duplicates are dropped and only genuinely conflicting clauses
 * are split into an {@code $and}.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Map<String, Object> filter = new QueryBuilder()
 *     .field("age").is("$gte", 18)
 *     .andField().is("$lt", 65)
 *     .field("tags").matchesAny(List.of("java", "mongo"))
 *     .search("wor* \"exact phrase\"").in("title", "body")
 *     .build();
 *
 * // {age: {$gte: 18, $lt: 65}, tags: {$in: ["java", "mongo"]},
 * //  title: {$regex: /(...)|(...)/i}, body: {$regex: /(...)|(...)/i}}
 * }</pre>
 *
 * <p>When OR groups are started with {@link #either()}, the final filter must be obtained from the
 * root builder's {@link #build()}.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class QueryBuilder extends BaseQueryBuilder<QueryBuilder> {

    public QueryBuilder() {
        this(null, SearchPolicy.defaults());
    }

    /**
     * @param searchPolicy settings applied to every {@code search()} of this builder and its children
     */
    public QueryBuilder(SearchPolicy searchPolicy) {
        this(null, searchPolicy);
    }

    /**
     * @param source an existing filter to start from; ignored when null
     */
    public QueryBuilder(Map<String, ?> source) {
        this(source, SearchPolicy.defaults());
    }

    /**
     * @param source       an existing filter to start from; ignored when null
     * @param searchPolicy settings applied to every {@code search()} of this builder and its children
     */
    public QueryBuilder(Map<String, ?> source, SearchPolicy searchPolicy) {
        super(source == null ? FilterDocument.empty() : FilterNodes.toDocument(source), searchPolicy);
    }

    @Override
    protected QueryBuilder self() {
        return this;
    }
}
