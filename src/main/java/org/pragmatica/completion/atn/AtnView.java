package org.pragmatica.completion.atn;

import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.atn.ATN;
import org.antlr.v4.runtime.atn.ATNState;
import org.antlr.v4.runtime.atn.PredicateTransition;
import org.antlr.v4.runtime.atn.RuleStartState;
import org.antlr.v4.runtime.atn.RuleStopState;
import org.antlr.v4.runtime.atn.Transition;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.pragmatica.completion.error.CompletionError;
import org.pragmatica.completion.error.CompletionException;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Read-only queries over a parser ATN.
 *
 * <p>Out-of-range rule indexes and state numbers are rejected with a {@link CompletionException};
 * the walk itself only follows references taken from the ATN.
 */
public final class AtnView {
    private final ATN atn;
    private final List<String> ruleNames;
    private final Vocabulary vocabulary;
    private final Optional<Parser> parser;
    private final IntervalSet userTokens;

    private AtnView(ATN atn, List<String> ruleNames, Vocabulary vocabulary, Optional<Parser> parser) {
        this.atn = atn;
        this.ruleNames = ruleNames;
        this.vocabulary = vocabulary;
        this.parser = parser;
        this.userTokens = IntervalSet.of(Token.MIN_USER_TOKEN_TYPE, atn.maxTokenType);
        this.userTokens.setReadonly(true);
    }

    /**
     * View over the ATN of a parser. Semantic predicates are evaluated against that parser.
     */
    public static AtnView of(Parser parser) {
        return new AtnView(parser.getATN(),
                           Arrays.asList(parser.getRuleNames()),
                           parser.getVocabulary(),
                           Optional.of(parser));
    }

    /**
     * View over a bare ATN. Semantic predicates are treated as satisfied.
     */
    public static AtnView of(ATN atn, String[] ruleNames, Vocabulary vocabulary) {
        return new AtnView(atn, Arrays.asList(ruleNames), vocabulary, Optional.empty());
    }

    // === Rules ===

    public int ruleCount() {
        return atn.ruleToStartState.length;
    }

    public RuleStartState ruleStart(int ruleIndex) {
        checkRule(ruleIndex);
        var start = atn.ruleToStartState[ruleIndex];
        if (start == null) {
            throw new CompletionException(new CompletionError.MalformedAtn("rule " + ruleIndex + " has no start state"));
        }
        return start;
    }

    public RuleStopState ruleStop(int ruleIndex) {
        checkRule(ruleIndex);
        if (atn.ruleToStopState == null || ruleIndex >= atn.ruleToStopState.length
            || atn.ruleToStopState[ruleIndex] == null) {
            throw new CompletionException(new CompletionError.MalformedAtn("rule " + ruleIndex + " has no stop state"));
        }
        return atn.ruleToStopState[ruleIndex];
    }

    /**
     * Index of the rule the state belongs to.
     */
    public int ruleOf(ATNState state) {
        return state.ruleIndex;
    }

    public String ruleName(int ruleIndex) {
        return ruleIndex >= 0 && ruleIndex < ruleNames.size()
               ? ruleNames.get(ruleIndex)
               : "<rule " + ruleIndex + ">";
    }

    private void checkRule(int ruleIndex) {
        if (ruleIndex < 0 || ruleIndex >= ruleCount()) {
            throw new CompletionException(new CompletionError.UnknownRule(ruleIndex, ruleCount()));
        }
    }

    // === States and transitions ===

    public ATNState state(int stateNumber) {
        if (stateNumber < 0 || stateNumber >= atn.states.size() || atn.states.get(stateNumber) == null) {
            throw new CompletionException(new CompletionError.UnknownState(stateNumber, atn.states.size()));
        }
        return atn.states.get(stateNumber);
    }

    public Transition[] transitionsOf(ATNState state) {
        return state.getTransitions();
    }

    /**
     * Token types a token-consuming transition matches, with negated sets and wildcards expanded
     * over the user vocabulary.
     */
    public IntervalSet tokensOf(Transition transition, TransitionKind kind) {
        return switch (kind) {
            case WILDCARD -> userTokens;
            case NOT_SET -> transition.label().complement(userTokens);
            case ATOM, SET -> transition.label();
            case EPSILON, PREDICATE, PRECEDENCE, RULE -> IntervalSet.EMPTY_SET;
        };
    }

    /**
     * Evaluate a semantic predicate outside of any parse. Without a parser every predicate holds.
     */
    public boolean evaluate(PredicateTransition transition) {
        return parser.map(p -> transition.getPredicate().eval(p, ParserRuleContext.EMPTY))
                     .orElse(true);
    }

    // === Vocabulary ===

    public int maxTokenType() {
        return atn.maxTokenType;
    }

    /**
     * All token types a wildcard can match.
     */
    public IntervalSet userTokens() {
        return userTokens;
    }

    public String tokenName(int tokenType) {
        return vocabulary.getDisplayName(tokenType);
    }
}
