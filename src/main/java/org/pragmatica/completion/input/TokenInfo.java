package org.pragmatica.completion.input;

import org.antlr.v4.runtime.Token;

/**
 * The parts of a token the completion engine looks at.
 *
 * @param type    token type from the grammar vocabulary
 * @param channel channel the lexer put the token on
 * @param index   position of the token in the stream, hidden tokens included
 */
public record TokenInfo(int type, int channel, int index) {

    public static TokenInfo of(Token token) {
        return new TokenInfo(token.getType(), token.getChannel(), token.getTokenIndex());
    }

    public boolean isDefaultChannel() {
        return channel == Token.DEFAULT_CHANNEL;
    }

    public boolean isEof() {
        return type == Token.EOF;
    }
}
