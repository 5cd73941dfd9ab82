package org.pragmatica.completion.core;

import java.util.Set;

/**
 * Candidate collection options.
 *
 * @param ignoredTokens         token types never reported as candidates; the walk still passes through them
 * @param preferredRules        rule indexes reported as rule candidates instead of being expanded into tokens
 * @param translateRulesTopDown when a call stack holds several preferred rules, report the innermost one
 *                              instead of the outermost one
 * @param entryRule             rule the search starts at when no parser context is given
 */
public record CompletionConfig(
    Set<Integer> ignoredTokens,
    Set<Integer> preferredRules,
    boolean translateRulesTopDown,
    int entryRule
) {
    public static final CompletionConfig DEFAULT = new CompletionConfig(
        Set.of(),
        Set.of(),
        false,
        0
    );

    public CompletionConfig {
        ignoredTokens = Set.copyOf(ignoredTokens);
        preferredRules = Set.copyOf(preferredRules);
    }

    public CompletionConfig withIgnoredTokens(Set<Integer> ignoredTokens) {
        return new CompletionConfig(ignoredTokens, preferredRules, translateRulesTopDown, entryRule);
    }

    public CompletionConfig withPreferredRules(Set<Integer> preferredRules) {
        return new CompletionConfig(ignoredTokens, preferredRules, translateRulesTopDown, entryRule);
    }

    public CompletionConfig withTranslateRulesTopDown(boolean translateRulesTopDown) {
        return new CompletionConfig(ignoredTokens, preferredRules, translateRulesTopDown, entryRule);
    }

    public CompletionConfig withEntryRule(int entryRule) {
        return new CompletionConfig(ignoredTokens, preferredRules, translateRulesTopDown, entryRule);
    }

    public boolean isIgnored(int tokenType) {
        return ignoredTokens.contains(tokenType);
    }

    public boolean isPreferred(int ruleIndex) {
        return preferredRules.contains(ruleIndex);
    }
}
