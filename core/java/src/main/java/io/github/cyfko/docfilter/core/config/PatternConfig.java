package io.github.cyfko.docfilter.core.config;

import java.util.regex.Pattern;

/**
 * Pre-compiled patterns and regex fragments used to turn search strings into document-store
 * regular expressions.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class PatternConfig {
    private PatternConfig() {}

    /**
     * Splits a search string into whitespace-free runs and double-quoted phrases. Quotes are kept in
     * the token.
     * <p>
     * For example {@code hello wor*d I am "Shyam Dasgupta"} yields
     * {@code ["hello", "wor*d", "I", "am", "\"Shyam Dasgupta\""]}.
     * </p>
     */
    public static final Pattern TOKENIZE_PATTERN = Pattern.compile("(?:[^\\s\"]+|\"[^\"]*\")+");

    /** A leading or trailing double quote of a token. */
    public static final Pattern SURROUNDING_QUOTES = Pattern.compile("^\"|\"$");

    /** Regex metacharacters escaped in tokens, one per capture. {@code *} is kept for wildcards. */
    public static final Pattern REGEX_SPECIAL_CHARS = Pattern.compile("([\\\\^$.|?+()\\[{])");

    /** Replacement of the {@code *} wildcard: any run of word characters and hyphens. */
    public static final String WILDCARD_CLASS = "[A-Za-z0-9_-]*";

    /**
     * Prefix anchoring a token at a word beginning: start of subject, or after any run of characters
     * that are neither alphanumeric nor apostrophe. Stands in for {@code \b}, which the target regex
     * engine does not support. Matches after punctuation too, so {@code pot} matches {@code #pottery}.
     */
    public static final String WORD_BEGINNING_PREFIX = "(^|[^a-zA-Z0-9']+)";
}
