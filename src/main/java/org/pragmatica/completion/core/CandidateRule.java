package org.pragmatica.completion.core;

import java.util.List;

/**
 * A preferred rule that can start at the caret.
 *
 * @param startTokenIndex stream index of the token the rule invocation starts at
 * @param ruleList        enclosing rule indexes leading to the rule, outermost first
 */
public record CandidateRule(int startTokenIndex, List<Integer> ruleList) {

    public CandidateRule {
        ruleList = List.copyOf(ruleList);
    }
}
