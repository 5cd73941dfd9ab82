package org.pragmatica.completion.core;

import org.junit.jupiter.api.Test;
import org.pragmatica.completion.error.CompletionError;
import org.pragmatica.completion.error.CompletionException;
import org.pragmatica.completion.grammar.ExprGrammar;
import org.pragmatica.completion.grammar.InterpretedGrammar;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodeCompletionCoreTest {

    private static final InterpretedGrammar GRAMMAR = ExprGrammar.load();

    private static CodeCompletionCore core(String input) {
        var parsed = GRAMMAR.parse(input, "expression");
        return CodeCompletionCore.create(parsed.parser(), CompletionConfig.DEFAULT);
    }

    @Test
    void collect_negativeCaret_failsWithInvalidCaret() {
        var core = core("var c = a");

        assertThatThrownBy(() -> core.collectCandidates(-1))
            .isInstanceOf(CompletionException.class)
            .satisfies(e -> assertThat(((CompletionException) e).error())
                .isEqualTo(new CompletionError.InvalidCaret(-1, 8)));
    }

    @Test
    void collect_caretBeyondStream_failsWithInvalidCaret() {
        var core = core("var c = a");

        assertThatThrownBy(() -> core.collectCandidates(8))
            .isInstanceOf(CompletionException.class)
            .hasMessageContaining("outside of the token stream");
    }

    @Test
    void collect_unknownEntryRule_failsWithUnknownRule() {
        var core = core("var c = a");
        core.configure(CompletionConfig.DEFAULT.withEntryRule(42));

        assertThatThrownBy(() -> core.collectCandidates(0))
            .isInstanceOf(CompletionException.class)
            .satisfies(e -> assertThat(((CompletionException) e).error())
                .isInstanceOf(CompletionError.UnknownRule.class));
    }

    @Test
    void collect_repeatedCalls_returnEqualResults() {
        var core = core("var c = a + b()");

        var first = core.collectCandidates(8);
        var second = core.collectCandidates(8);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void collect_leavesTokenStreamPositionUntouched() {
        var parsed = GRAMMAR.parse("var c = a + b()", "expression");
        var stream = parsed.parser().getInputStream();
        var before = stream.index();

        CodeCompletionCore.create(parsed.parser(), CompletionConfig.DEFAULT).collectCandidates(6);

        assertThat(stream.index()).isEqualTo(before);
    }

    @Test
    void collect_atEof_offersContinuations() {
        var core = core("var c = a");

        var candidates = core.collectCandidates(7);

        assertThat(candidates.tokens()).containsOnlyKeys(GRAMMAR.tokens("PLUS",
                                                                        "MINUS",
                                                                        "MULTIPLY",
                                                                        "DIVIDE",
                                                                        "OPEN_PAR")
                                                                .toArray(Integer[]::new));
    }

    @Test
    void setters_replaceConfigurationForLaterCalls() {
        var core = core("var c = a + b()");
        var ignored = GRAMMAR.tokens("PLUS", "MINUS");

        core.setIgnoredTokens(ignored);
        core.setPreferredRules(GRAMMAR.rules("functionRef"));
        core.setTranslateRulesTopDown(true);

        assertThat(core.config().ignoredTokens()).isEqualTo(ignored);
        assertThat(core.config().preferredRules()).containsExactly(GRAMMAR.rule("functionRef"));
        assertThat(core.config().translateRulesTopDown()).isTrue();

        var candidates = core.collectCandidates(8);
        assertThat(candidates.tokens()).containsOnlyKeys(GRAMMAR.token("MULTIPLY"), GRAMMAR.token("DIVIDE"));
        assertThat(candidates.rules()).containsOnlyKeys(GRAMMAR.rule("functionRef"));
    }

    @Test
    void configure_withDefault_restoresPlainTokens() {
        var core = core("var c = a + b()");
        core.setIgnoredTokens(Set.of(GRAMMAR.token("ID")));

        core.configure(CompletionConfig.DEFAULT);

        assertThat(core.collectCandidates(6).tokens()).containsOnlyKeys(GRAMMAR.token("ID"));
    }
}
