package org.pragmatica.completion.input;

import org.antlr.v4.runtime.BufferedTokenStream;
import org.antlr.v4.runtime.TokenStream;

/**
 * {@link TokenStreamView} backed by an ANTLR {@link TokenStream}.
 *
 * <p>Only {@link TokenStream#get(int)} is used after construction, so the stream position
 * the parser left behind is never touched.
 */
final class AntlrTokenStreamView implements TokenStreamView {
    private final TokenStream stream;

    private AntlrTokenStreamView(TokenStream stream) {
        this.stream = stream;
    }

    static AntlrTokenStreamView of(TokenStream stream) {
        if (stream instanceof BufferedTokenStream buffered) {
            buffered.fill();
        }
        return new AntlrTokenStreamView(stream);
    }

    @Override
    public TokenInfo tokenAt(int index) {
        return TokenInfo.of(stream.get(index));
    }

    @Override
    public int size() {
        return stream.size();
    }
}
