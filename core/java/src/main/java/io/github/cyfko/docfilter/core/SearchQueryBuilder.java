package io.github.cyfko.docfilter.core;

import io.github.cyfko.docfilter.core.config.FilterOperators;
import io.github.cyfko.docfilter.core.config.SearchPolicy;
import io.github.cyfko.docfilter.core.search.CompiledSearchPattern;
import io.github.cyfko.docfilter.core.search.SearchPatternCompiler;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Matches document fields against a full-text search string.
 * <p>
 * The search string is compiled once by {@link SearchPatternCompiler}; each method then applies
 * one of the compiled patterns as a {@code $regex} on the given fields:
 * </p>
 * <table>
 *   <caption>Search methods</caption>
 *   <tr><th>method</th><th>pattern</th><th>fields</th></tr>
 *   <tr><td>{@link #in}</td><td>{@link CompiledSearchPattern#any() any}</td><td>all</td></tr>
 *   <tr><td>{@link #anyIn}</td><td>{@link CompiledSearchPattern#all() all}</td><td>all</td></tr>
 *   <tr><td>{@link #inAny}</td><td>{@link CompiledSearchPattern#any() any}</td><td>at least one</td></tr>
 *   <tr><td>{@link #anyInAny}</td><td>{@link CompiledSearchPattern#all() all}</td><td>at least one</td></tr>
 * </table>
 * <p>
 * Note that {@link #in} accepts a field holding at least one of the tokens, while {@link #anyIn}
 * requires every token.
 * </p>
 * <p>
 * A search string without any token adds nothing to the filter. Use
 * {@link BaseQueryBuilder#andSearch()} to reuse this search on more fields.
 * </p>
 *
 * @param <B> type of the parent builder
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SearchQueryBuilder<B extends BaseQueryBuilder<B>> {

    private final B parent;
    private final CompiledSearchPattern patterns;

    SearchQueryBuilder(B parent, String query, SearchPolicy searchPolicy) {
        this.parent = parent;
        this.patterns = SearchPatternCompiler.compile(query, searchPolicy).orElse(null);
    }

    /**
     * @return the compiled patterns, empty if the search string holds no token
     */
    public Optional<CompiledSearchPattern> patterns() {
        return Optional.ofNullable(patterns);
    }

    /**
     * Every field must contain at least one of the tokens.
     */
    public B in(String... fields) {
        return matchAllFields(fields, true);
    }

    /**
     * Every field must contain all the tokens.
     */
    public B anyIn(String... fields) {
        return matchAllFields(fields, false);
    }

    /**
     * At least one of the fields must contain at least one of the tokens.
     */
    public B inAny(String... fields) {
        return matchAnyField(fields, true);
    }

    /**
     * At least one of the fields must contain all the tokens.
     */
    public B anyInAny(String... fields) {
        return matchAnyField(fields, false);
    }

    private B matchAllFields(String[] fields, boolean matchAnyToken) {
        if (patterns != null) {
            Pattern regex = patterns.select(matchAnyToken);
            for (String field : fields) {
                parent.field(field).is(FilterOperators.REGEX, regex);
            }
        }
        return parent;
    }

    private B matchAnyField(String[] fields, boolean matchAnyToken) {
        if (patterns != null) {
            Pattern regex = patterns.select(matchAnyToken);
            ChildQueryBuilder member = parent.either();
            for (String field : fields) {
                member = member.or().field(field).is(FilterOperators.REGEX, regex);
            }
        }
        return parent;
    }
}
