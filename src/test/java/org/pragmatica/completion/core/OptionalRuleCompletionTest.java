package org.pragmatica.completion.core;

import org.antlr.v4.runtime.Token;
import org.junit.jupiter.api.Test;
import org.pragmatica.completion.CodeCompletion;
import org.pragmatica.completion.grammar.DeclGrammar;
import org.pragmatica.completion.grammar.InterpretedGrammar;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Candidate collection where a rule in front of the caret can end without consuming input.
 */
class OptionalRuleCompletionTest {

    private static final InterpretedGrammar GRAMMAR = DeclGrammar.load();

    private static int token(String name) {
        return GRAMMAR.token(name);
    }

    private static CandidatesCollection collect(String input, int caretTokenIndex) {
        var parsed = GRAMMAR.parse(input, "program");
        return CodeCompletion.forParser(parsed.parser()).collectCandidates(caretTokenIndex);
    }

    @Test
    void collect_atStart_offersTokensAfterEmptyModifiers() {
        var candidates = collect("x;", 0);

        assertThat(candidates.tokens()).containsOnlyKeys(token("PUBLIC"), token("ID"), token("LET"));
        assertThat(candidates.tokens()).containsEntry(token("ID"), List.of(token("SEMI")));
        assertThat(candidates.tokens()).containsEntry(token("LET"), List.of(token("ID")));
        assertThat(candidates.tokens()).containsEntry(token("PUBLIC"), List.of());
    }

    @Test
    void collect_afterDeclaration_offersNextDeclarationOrEof() {
        var candidates = collect("x;", 2);

        assertThat(candidates.tokens()).containsOnlyKeys(token("PUBLIC"), token("ID"), token("LET"), Token.EOF);
    }

    @Test
    void collect_afterModifier_offersMoreModifiersOrName() {
        var candidates = collect("public x;", 2);

        assertThat(candidates.tokens()).containsOnlyKeys(token("PUBLIC"), token("ID"));
        assertThat(candidates.tokens()).containsEntry(token("ID"), List.of(token("SEMI")));
    }

    @Test
    void collect_atOptionalSuffix_offersSuffixAndWhatFollowsIt() {
        var candidates = collect("let x", 3);

        assertThat(candidates.tokens()).containsOnlyKeys(token("COLON"), token("SEMI"));
        assertThat(candidates.tokens()).containsEntry(token("COLON"), List.of(token("ID")));
        assertThat(candidates.rules()).isEmpty();
    }
}
