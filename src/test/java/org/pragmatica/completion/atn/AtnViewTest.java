package org.pragmatica.completion.atn;

import org.antlr.v4.runtime.VocabularyImpl;
import org.antlr.v4.runtime.atn.ATN;
import org.antlr.v4.runtime.atn.ATNType;
import org.antlr.v4.runtime.atn.AtomTransition;
import org.antlr.v4.runtime.atn.BasicState;
import org.antlr.v4.runtime.atn.NotSetTransition;
import org.antlr.v4.runtime.atn.RuleStartState;
import org.antlr.v4.runtime.atn.WildcardTransition;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.junit.jupiter.api.Test;
import org.pragmatica.completion.error.CompletionError;
import org.pragmatica.completion.error.CompletionException;
import org.pragmatica.completion.grammar.ExprGrammar;
import org.pragmatica.completion.grammar.InterpretedGrammar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AtnViewTest {

    private static final InterpretedGrammar GRAMMAR = ExprGrammar.load();

    private static AtnView exprView() {
        return AtnView.of(GRAMMAR.parse("a", "expression").parser());
    }

    private static CompletionError errorOf(Throwable e) {
        return ((CompletionException) e).error();
    }

    @Test
    void ruleStart_knownRule_belongsToRule() {
        var view = exprView();
        var rule = GRAMMAR.rule("assignment");

        assertThat(view.ruleOf(view.ruleStart(rule))).isEqualTo(rule);
        assertThat(view.ruleOf(view.ruleStop(rule))).isEqualTo(rule);
        assertThat(view.ruleName(rule)).isEqualTo("assignment");
    }

    @Test
    void ruleStart_outOfRange_failsWithUnknownRule() {
        var view = exprView();

        assertThatThrownBy(() -> view.ruleStart(view.ruleCount()))
            .satisfies(e -> assertThat(errorOf(e))
                .isEqualTo(new CompletionError.UnknownRule(view.ruleCount(), view.ruleCount())));
        assertThatThrownBy(() -> view.ruleStop(-1))
            .satisfies(e -> assertThat(errorOf(e)).isInstanceOf(CompletionError.UnknownRule.class));
    }

    @Test
    void state_outOfRange_failsWithUnknownState() {
        var parser = GRAMMAR.parse("a", "expression").parser();
        var view = AtnView.of(parser);
        var count = parser.getATN().states.size();

        assertThat(view.state(0).stateNumber).isZero();
        assertThatThrownBy(() -> view.state(count))
            .satisfies(e -> assertThat(errorOf(e)).isEqualTo(new CompletionError.UnknownState(count, count)));
    }

    @Test
    void ruleStart_missingState_failsWithMalformedAtn() {
        var atn = new ATN(ATNType.PARSER, 3);
        atn.ruleToStartState = new RuleStartState[1];
        var view = AtnView.of(atn, new String[] {"broken"}, VocabularyImpl.EMPTY_VOCABULARY);

        assertThatThrownBy(() -> view.ruleStart(0))
            .satisfies(e -> assertThat(errorOf(e)).isInstanceOf(CompletionError.MalformedAtn.class));
        assertThatThrownBy(() -> view.ruleStop(0))
            .satisfies(e -> assertThat(errorOf(e)).isInstanceOf(CompletionError.MalformedAtn.class));
    }

    @Test
    void tokensOf_expandsNegatedSetsAndWildcards() {
        var atn = new ATN(ATNType.PARSER, 5);
        atn.ruleToStartState = new RuleStartState[0];
        var view = AtnView.of(atn, new String[0], VocabularyImpl.EMPTY_VOCABULARY);
        var target = new BasicState();

        assertThat(view.tokensOf(new WildcardTransition(target), TransitionKind.WILDCARD).toList())
            .containsExactly(1, 2, 3, 4, 5);
        assertThat(view.tokensOf(new NotSetTransition(target, IntervalSet.of(2, 4)), TransitionKind.NOT_SET).toList())
            .containsExactly(1, 5);
        assertThat(view.tokensOf(new AtomTransition(target, 3), TransitionKind.ATOM).toList())
            .containsExactly(3);
        assertThat(view.userTokens().isReadonly()).isTrue();
    }

    @Test
    void tokenName_usesVocabularyDisplayName() {
        var view = exprView();

        assertThat(view.tokenName(GRAMMAR.token("ID"))).isEqualTo("ID");
        assertThat(view.maxTokenType()).isEqualTo(GRAMMAR.token("WS"));
    }
}
