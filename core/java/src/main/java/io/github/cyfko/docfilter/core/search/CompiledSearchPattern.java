package io.github.cyfko.docfilter.core.search;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The two regular expressions compiled from one search string.
 *
 * @param all matches a subject containing every token of the search string
 * @param any matches a subject containing at least one token of the search string
 * @author Frank KOSSI
 * @since 1.0.0
 * @see SearchPatternCompiler
 */
public record CompiledSearchPattern(Pattern all, Pattern any) {

    public CompiledSearchPattern {
        Objects.requireNonNull(all, "'all' pattern cannot be null");
        Objects.requireNonNull(any, "'any' pattern cannot be null");
    }

    /**
     * @param matchAnyToken true to select {@link #any()}, false to select {@link #all()}
     * @return the selected pattern
     */
    public Pattern select(boolean matchAnyToken) {
        return matchAnyToken ? any : all;
    }
}
