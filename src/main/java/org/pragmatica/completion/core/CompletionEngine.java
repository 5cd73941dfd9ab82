package org.pragmatica.completion.core;

import org.antlr.v4.runtime.ParserRuleContext;

/**
 * Code completion engine - computes what can be typed at a caret position of a parsed token stream.
 */
public interface CompletionEngine {

    /**
     * Collect candidates at the given token index, searching from the configured entry rule.
     */
    CandidatesCollection collectCandidates(int caretTokenIndex);

    /**
     * Collect candidates at the given token index, searching only inside the given context.
     * The walk starts at the context's rule and first token; candidates outside of it are not found.
     */
    CandidatesCollection collectCandidates(int caretTokenIndex, ParserRuleContext context);

    CompletionConfig config();

    /**
     * Replace the configuration. Calls already running keep the configuration they started with.
     */
    void configure(CompletionConfig config);
}
