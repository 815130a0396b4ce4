package io.github.cyfko.docfilter.core.config;

/**
 * Settings applied when a search string is compiled into regular expressions.
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default: tokens match at word beginnings only
 * SearchPolicy policy = SearchPolicy.defaults();
 *
 * // Tokens match anywhere, "pot" matches "teapot"
 * SearchPolicy policy = SearchPolicy.withinWords();
 *
 * // Custom
 * SearchPolicy policy = SearchPolicy.builder()
 *     .wildcardClass("[\\p{L}0-9_-]*")
 *     .build();
 * }</pre>
 *
 * @param policyName          descriptive name of the policy
 * @param wordBeginningPrefix regex prepended to every token unless {@code matchWithinWords}
 * @param wildcardClass       regex substituted for every {@code *} of a token
 * @param matchWithinWords    if true, tokens match anywhere instead of at word beginnings only
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SearchPolicy(
    String policyName,
    String wordBeginningPrefix,
    String wildcardClass,
    boolean matchWithinWords
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if a regex fragment is missing
     */
    public SearchPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (wordBeginningPrefix == null) {
            throw new IllegalArgumentException("wordBeginningPrefix is required");
        }
        if (wildcardClass == null || wildcardClass.isEmpty()) {
            throw new IllegalArgumentException("wildcardClass is required");
        }
    }

    /**
     * Tokens match at word beginnings, {@code *} matches word characters and hyphens.
     *
     * @return default policy
     */
    public static SearchPolicy defaults() {
        return new SearchPolicy(PolicyName.DEFAULT_POLICY.name(),
                PatternConfig.WORD_BEGINNING_PREFIX, PatternConfig.WILDCARD_CLASS, false);
    }

    /**
     * Same as {@link #defaults()} but tokens match anywhere in the subject.
     *
     * @return within-words policy
     */
    public static SearchPolicy withinWords() {
        return new SearchPolicy(PolicyName.WITHIN_WORDS_POLICY.name(),
                PatternConfig.WORD_BEGINNING_PREFIX, PatternConfig.WILDCARD_CLASS, true);
    }

    /**
     * @param matchWithinWords the new flag
     * @return this policy if the flag is unchanged, otherwise a copy with the flag replaced
     */
    public SearchPolicy withMatchWithinWords(boolean matchWithinWords) {
        if (this.matchWithinWords == matchWithinWords) {
            return this;
        }
        return new SearchPolicy(policyName, wordBeginningPrefix, wildcardClass, matchWithinWords);
    }

    /**
     * Builder parameters are initialized exactly as {@link #defaults()}.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private String _wordBeginningPrefix = PatternConfig.WORD_BEGINNING_PREFIX;
        private String _wildcardClass = PatternConfig.WILDCARD_CLASS;
        private boolean _matchWithinWords = false;

        private Builder() {}

        public SearchPolicy build() {
            return new SearchPolicy(_policyName, _wordBeginningPrefix, _wildcardClass, _matchWithinWords);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder wordBeginningPrefix(String prefix) { this._wordBeginningPrefix = prefix; return this; }
        public Builder wildcardClass(String wildcardClass) { this._wildcardClass = wildcardClass; return this; }
        public Builder matchWithinWords(boolean matchWithinWords) { this._matchWithinWords = matchWithinWords; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        WITHIN_WORDS_POLICY,
        CUSTOM_POLICY
    }
}
