package org.pragmatica.completion.core;

/**
 * One rule invocation on the call stack.
 *
 * @param ruleIndex       invoked rule
 * @param startTokenIndex stream index of the token the invocation started at
 * @param returnState     ATN state to resume at when the rule completes, {@code -1} if there is none
 */
public record RuleFrame(int ruleIndex, int startTokenIndex, int returnState) {
    public static final int NO_RETURN_STATE = -1;
}
