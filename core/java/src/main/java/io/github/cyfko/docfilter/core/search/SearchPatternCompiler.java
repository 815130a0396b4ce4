package io.github.cyfko.docfilter.core.search;

import io.github.cyfko.docfilter.core.config.PatternConfig;
import io.github.cyfko.docfilter.core.config.SearchPolicy;
import io.github.cyfko.docfilter.core.utils.FilterNodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles a free-text search string into case-insensitive regular expressions.
 * <p>
 * The search string is split into space separated tokens; {@code *} is a wildcard and a
 * double-quoted string is an exact phrase. For example:
 * </p>
 * <pre>{@code
 * hello wor*d I am "Shyam Dasgupta"
 * }</pre>
 * <p>yields the token patterns</p>
 * <pre>{@code
 * hello, wor[A-Za-z0-9_-]*d, I, am, Shyam Dasgupta
 * }</pre>
 * <p>
 * each one prefixed with {@link PatternConfig#WORD_BEGINNING_PREFIX} unless the policy matches
 * within words. With the prefix, {@code pot} matches "Potter" and "#pottery" but not "teapot".
 * The patterns only use constructs supported by the document store's regex engine ({@code \b} is
 * not one of them).
 * </p>
 *
 * <h2>Compiled Forms</h2>
 * <ul>
 *   <li><strong>all</strong>: {@code (?=.*t1)(?=.*t2)...}, every token must occur</li>
 *   <li><strong>any</strong>: {@code (t1)|(t2)|...}, at least one token must occur</li>
 * </ul>
 *
 * <p>This class is stateless and cannot be instantiated.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SearchPatternCompiler {

    private static final Logger log = Logger.getLogger(SearchPatternCompiler.class.getName());

    private SearchPatternCompiler() {}

    /**
     * Compiles {@code query} with {@link SearchPolicy#defaults()}.
     *
     * @param query the search string, may be null
     * @return the compiled patterns, empty if the query holds no token
     */
    public static Optional<CompiledSearchPattern> compile(String query) {
        return compile(query, SearchPolicy.defaults());
    }

    /**
     * @param query            the search string, may be null
     * @param matchWithinWords if true, tokens match anywhere, not only at word beginnings
     * @return the compiled patterns, empty if the query holds no token
     */
    public static Optional<CompiledSearchPattern> compile(String query, boolean matchWithinWords) {
        return compile(query, SearchPolicy.defaults().withMatchWithinWords(matchWithinWords));
    }

    /**
     * @param query  the search string, may be null
     * @param policy the regex fragments and matching mode to apply
     * @return the compiled patterns, empty if the query holds no token
     */
    public static Optional<CompiledSearchPattern> compile(String query, SearchPolicy policy) {
        Objects.requireNonNull(policy, "Search policy is required");

        List<String> tokenPatterns = new ArrayList<>();
        for (String token : tokenize(query)) {
            compileToken(token, policy).ifPresent(p -> {
                if (!tokenPatterns.contains(p)) {
                    tokenPatterns.add(p);
                }
            });
        }
        if (tokenPatterns.isEmpty()) {
            return Optional.empty();
        }

        Pattern all = Pattern.compile("(?=.*" + String.join(")(?=.*", tokenPatterns) + ")", Pattern.CASE_INSENSITIVE);
        Pattern any = Pattern.compile("(" + String.join(")|(", tokenPatterns) + ")", Pattern.CASE_INSENSITIVE);

        log.fine(() -> String.format("Search query '%s' compiled into %d token pattern(s): all=%s, any=%s",
                query, tokenPatterns.size(), all.pattern(), any.pattern()));
        return Optional.of(new CompiledSearchPattern(all, any));
    }

    /**
     * Splits a search string into whitespace-free runs and double-quoted phrases, quotes included.
     *
     * @param query the search string, may be null
     * @return the raw tokens, empty for a null or blank query
     */
    public static List<String> tokenize(String query) {
        List<String> tokens = new ArrayList<>();
        if (!FilterNodes.isValidStr(query)) {
            return tokens;
        }
        Matcher matcher = PatternConfig.TOKENIZE_PATTERN.matcher(query.trim());
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    /**
     * Turns one raw token into its regex source: surrounding quotes stripped, metacharacters
     * escaped, {@code *} expanded to the policy's wildcard class and, unless matching within words,
     * the word-beginning prefix prepended.
     *
     * @param token  a raw token as returned by {@link #tokenize(String)}
     * @param policy the regex fragments and matching mode to apply
     * @return the token regex, empty if nothing is left of the token
     */
    public static Optional<String> compileToken(String token, SearchPolicy policy) {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }
        String r = PatternConfig.SURROUNDING_QUOTES.matcher(token.trim()).replaceAll("");
        r = PatternConfig.REGEX_SPECIAL_CHARS.matcher(r).replaceAll("\\\\$1");
        r = r.replace("*", policy.wildcardClass());
        if (r.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(policy.matchWithinWords() ? r : policy.wordBeginningPrefix() + r);
    }
}
