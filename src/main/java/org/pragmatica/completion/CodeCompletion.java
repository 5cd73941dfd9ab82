package org.pragmatica.completion;

import org.antlr.v4.runtime.Parser;
import org.pragmatica.completion.core.CodeCompletionCore;
import org.pragmatica.completion.core.CompletionConfig;
import org.pragmatica.completion.core.CompletionEngine;

import java.util.Set;

/**
 * Entry point for creating completion engines.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = new ExprParser(new CommonTokenStream(new ExprLexer(CharStreams.fromString("var c = a + b"))));
 * parser.expression();
 *
 * var engine = CodeCompletion.builder(parser)
 *                            .ignoredTokens(Set.of(ExprLexer.PLUS, ExprLexer.MINUS))
 *                            .preferredRules(Set.of(ExprParser.RULE_variableRef))
 *                            .build();
 *
 * var candidates = engine.collectCandidates(6);
 * }</pre>
 */
public final class CodeCompletion {
    private CodeCompletion() {}

    /**
     * Create an engine with default configuration.
     */
    public static CompletionEngine forParser(Parser parser) {
        return forParser(parser, CompletionConfig.DEFAULT);
    }

    /**
     * Create an engine with custom configuration.
     */
    public static CompletionEngine forParser(Parser parser, CompletionConfig config) {
        return CodeCompletionCore.create(parser, config);
    }

    /**
     * Create a builder for more complex engine configuration.
     */
    public static Builder builder(Parser parser) {
        return new Builder(parser);
    }

    public static final class Builder {
        private final Parser parser;
        private Set<Integer> ignoredTokens = Set.of();
        private Set<Integer> preferredRules = Set.of();
        private boolean translateRulesTopDown = false;
        private int entryRule = 0;

        private Builder(Parser parser) {
            this.parser = parser;
        }

        public Builder ignoredTokens(Set<Integer> tokenTypes) {
            this.ignoredTokens = tokenTypes;
            return this;
        }

        public Builder preferredRules(Set<Integer> ruleIndexes) {
            this.preferredRules = ruleIndexes;
            return this;
        }

        public Builder translateRulesTopDown(boolean topDown) {
            this.translateRulesTopDown = topDown;
            return this;
        }

        public Builder entryRule(int ruleIndex) {
            this.entryRule = ruleIndex;
            return this;
        }

        public CompletionEngine build() {
            var config = new CompletionConfig(ignoredTokens, preferredRules, translateRulesTopDown, entryRule);
            return forParser(parser, config);
        }
    }
}
