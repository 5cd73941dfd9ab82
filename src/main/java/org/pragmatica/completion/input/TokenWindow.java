package org.pragmatica.completion.input;

import org.antlr.v4.runtime.Token;
import org.pragmatica.completion.error.CompletionError;
import org.pragmatica.completion.error.CompletionException;

import java.util.ArrayList;
import java.util.List;

/**
 * Default-channel tokens from the search start up to the caret.
 *
 * <p>The last token of the window is the caret token: the first default-channel token whose
 * stream index is at or after the caret index, or EOF. A caret on a hidden token (whitespace,
 * comments) therefore behaves like a caret on the next meaningful token.
 */
public final class TokenWindow {
    private final List<TokenInfo> tokens;
    private final int caretTokenIndex;

    private TokenWindow(List<TokenInfo> tokens, int caretTokenIndex) {
        this.tokens = tokens;
        this.caretTokenIndex = caretTokenIndex;
    }

    /**
     * Collect the window for the given caret.
     *
     * @throws CompletionException with {@link CompletionError.InvalidCaret} if the caret is outside of the stream
     */
    public static TokenWindow collect(TokenStreamView view, int startTokenIndex, int caretTokenIndex) {
        var size = view.size();
        if (caretTokenIndex < 0 || caretTokenIndex >= size) {
            throw new CompletionException(new CompletionError.InvalidCaret(caretTokenIndex, size));
        }

        var tokens = new ArrayList<TokenInfo>();
        for (int i = Math.max(startTokenIndex, 0); i < size; i++) {
            var token = view.tokenAt(i);
            if (!token.isDefaultChannel()) {
                continue;
            }
            tokens.add(token);
            if (token.index() >= caretTokenIndex || token.isEof()) {
                return new TokenWindow(List.copyOf(tokens), caretTokenIndex);
            }
        }
        // Stream without EOF token: the caret sits past the last real token.
        tokens.add(new TokenInfo(Token.EOF, Token.DEFAULT_CHANNEL, size));
        return new TokenWindow(List.copyOf(tokens), caretTokenIndex);
    }

    public int size() {
        return tokens.size();
    }

    /**
     * Window position of the caret token.
     */
    public int caretPosition() {
        return tokens.size() - 1;
    }

    public boolean isAtCaret(int position) {
        return position >= caretPosition();
    }

    public int typeAt(int position) {
        return tokens.get(position).type();
    }

    /**
     * Stream index of the token at the given window position.
     */
    public int streamIndexAt(int position) {
        return tokens.get(position).index();
    }

    public int caretTokenIndex() {
        return caretTokenIndex;
    }
}
