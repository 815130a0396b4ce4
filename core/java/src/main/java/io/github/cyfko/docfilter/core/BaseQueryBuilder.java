package io.github.cyfko.docfilter.core;

import io.github.cyfko.docfilter.core.compose.FilterComposer;
import io.github.cyfko.docfilter.core.config.SearchPolicy;
import io.github.cyfko.docfilter.core.exception.FilterStateException;
import io.github.cyfko.docfilter.core.json.FilterJsonWriter;
import io.github.cyfko.docfilter.core.model.FilterDocument;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Chaining API shared by {@link QueryBuilder} and the {@link ChildQueryBuilder} members of an OR
 * group.
 * <p>
 * Every call is ANDed with the previous ones. Sub-builders ({@link FieldQueryBuilder},
 * {@link SearchQueryBuilder}) return the builder that created them, typed as {@code B}, so chains
 * keep their concrete builder type:
 * </p>
 * <pre>{@code
 * Map<String, Object> filter = new QueryBuilder()
 *     .field("age").is("$gte", 18)
 *     .andField().is("$lt", 65)
 *     .either()
 *         .field("status").matches("A")
 *         .or().field("qty").is("$lt", 30)
 *     .build();
 * }</pre>
 *
 * @param <B> the concrete builder type returned by chained calls
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class BaseQueryBuilder<B extends BaseQueryBuilder<B>> {

    private static final Logger log = Logger.getLogger(BaseQueryBuilder.class.getName());

    private final FilterComposer composer;
    private final SearchPolicy searchPolicy;

    private FieldQueryBuilder<B> lastFieldBuilder;
    private SearchQueryBuilder<B> lastSearchBuilder;
    private OrQueryBuilder orGroup;
    private OrGroupState orGroupState = OrGroupState.NO_ACTIVE_GROUP;

    protected BaseQueryBuilder(FilterDocument source, SearchPolicy searchPolicy) {
        this.composer = new FilterComposer(Objects.requireNonNull(source, "Source document cannot be null"));
        this.searchPolicy = Objects.requireNonNull(searchPolicy, "Search policy is required");
    }

    protected abstract B self();

    /**
     * All calls are ANDed anyway; this only improves the readability of long chains.
     *
     * @return this builder
     */
    public B and() {
        return self();
    }

    /**
     * Starts constraining a document field.
     *
     * @param field a field of the target documents
     * @return a new field builder, also remembered for {@link #andField()}
     * @throws io.github.cyfko.docfilter.core.exception.FilterArgumentException if {@code field} is not a non-empty string
     */
    public FieldQueryBuilder<B> field(String field) {
        lastFieldBuilder = new FieldQueryBuilder<>(self(), field);
        return lastFieldBuilder;
    }

    /**
     * Continues with the field builder returned by the last {@link #field(String)} call.
     *
     * @throws FilterStateException if {@link #field(String)} was never called on this builder
     */
    public FieldQueryBuilder<B> andField() {
        if (lastFieldBuilder == null) {
            throw new FilterStateException("Illegal andField() call: should be called only after field() was called");
        }
        return lastFieldBuilder;
    }

    /**
     * Starts a full-text search, matching tokens at word beginnings unless the builder's
     * {@link SearchPolicy} says otherwise.
     *
     * @param query one or more space separated tokens, {@code *} wildcards and quoted phrases
     * @return a new search builder, also remembered for {@link #andSearch()}
     */
    public SearchQueryBuilder<B> search(String query) {
        return search(query, searchPolicy.matchWithinWords());
    }

    /**
     * @param query            one or more space separated tokens, {@code *} wildcards and quoted phrases
     * @param matchWithinWords if true, tokens match anywhere instead of at word beginnings only
     * @return a new search builder, also remembered for {@link #andSearch()}
     */
    public SearchQueryBuilder<B> search(String query, boolean matchWithinWords) {
        lastSearchBuilder = new SearchQueryBuilder<>(self(), query, searchPolicy.withMatchWithinWords(matchWithinWords));
        return lastSearchBuilder;
    }

    /**
     * Continues with the search builder returned by the last {@code search()} call.
     *
     * @throws FilterStateException if {@code search()} was never called on this builder
     */
    public SearchQueryBuilder<B> andSearch() {
        if (lastSearchBuilder == null) {
            throw new FilterStateException("Illegal andSearch() call: should be called only after search() was called");
        }
        return lastSearchBuilder;
    }

    /**
     * Starts an OR group. Each member of the group is built on its own {@link ChildQueryBuilder};
     * {@link ChildQueryBuilder#or()} closes the current member and opens the next one. The group is
     * ORed into this builder's filter when a new group starts or when the filter is built.
     *
     * @return the builder of the first member of the group
     */
    public ChildQueryBuilder either() {
        if (orGroupState == OrGroupState.ACTIVE_GROUP) {
            flushOrGroup();
        }
        orGroup = new OrQueryBuilder(searchPolicy);
        orGroupState = OrGroupState.ACTIVE_GROUP;
        return orGroup.or();
    }

    /**
     * Returns the filter built so far as a plain nested mapping, ready for a document-store driver.
     * Any pending OR group is applied first.
     *
     * @return a fresh, mutable copy of the filter
     */
    public Map<String, Object> build() {
        return buildDocument().toRaw();
    }

    /**
     * Same as {@link #build()}, returning the immutable filter tree.
     */
    public FilterDocument buildDocument() {
        flushOrGroup();
        FilterDocument filter = composer.current();
        log.fine(() -> "Built filter " + filter);
        return filter;
    }

    /**
     * Same as {@link #build()}, rendered as MongoDB Extended JSON.
     *
     * @see FilterJsonWriter
     */
    public String toJson() {
        return FilterJsonWriter.write(buildDocument());
    }

    /**
     * @return the current state of this builder's OR group
     */
    public OrGroupState orGroupState() {
        return orGroupState;
    }

    B compare(String field, String operator, Object value) {
        composer.compare(field, operator, value);
        return self();
    }

    B matchesAll(String field, List<?> values) {
        composer.matchesAll(field, values);
        return self();
    }

    B matchesAny(String field, List<?> values, boolean addToExistingOr) {
        composer.matchesAny(field, values, addToExistingOr);
        return self();
    }

    private void flushOrGroup() {
        if (orGroupState == OrGroupState.NO_ACTIVE_GROUP) {
            return;
        }
        List<FilterDocument> members = orGroup.flush();
        orGroup = null;
        orGroupState = OrGroupState.NO_ACTIVE_GROUP;
        composer.orFold(members);
    }
}
