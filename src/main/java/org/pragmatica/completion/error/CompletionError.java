package org.pragmatica.completion.error;

/**
 * Reason a candidate collection could not be performed.
 */
public sealed interface CompletionError {
    String message();

    /**
     * Caret token index outside of the token stream.
     */
    record InvalidCaret(
    int caretTokenIndex,
    int streamSize) implements CompletionError {
        @Override
        public String message() {
            return "Caret token index " + caretTokenIndex + " is outside of the token stream [0, " + streamSize + ")";
        }
    }

    /**
     * Rule index not known to the grammar.
     */
    record UnknownRule(
    int ruleIndex,
    int ruleCount) implements CompletionError {
        @Override
        public String message() {
            return "Unknown rule index " + ruleIndex + ", grammar has " + ruleCount + " rules";
        }
    }

    /**
     * ATN state number not known to the grammar.
     */
    record UnknownState(
    int stateNumber,
    int stateCount) implements CompletionError {
        @Override
        public String message() {
            return "Unknown ATN state " + stateNumber + ", grammar has " + stateCount + " states";
        }
    }

    /**
     * The ATN contradicts itself, e.g. a rule without start or stop state.
     */
    record MalformedAtn(
    String detail) implements CompletionError {
        @Override
        public String message() {
            return "Malformed ATN: " + detail;
        }
    }
}
