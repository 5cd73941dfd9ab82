package org.pragmatica.completion.input;

import org.antlr.v4.runtime.TokenStream;

/**
 * Indexed, read-only access to a token stream.
 */
public interface TokenStreamView {

    /**
     * Token at the given stream index.
     */
    TokenInfo tokenAt(int index);

    /**
     * Number of tokens in the stream, EOF included when the stream has reached it.
     */
    int size();

    /**
     * View over an ANTLR token stream. Buffered streams are filled up front.
     */
    static TokenStreamView of(TokenStream stream) {
        return AntlrTokenStreamView.of(stream);
    }
}
