package org.pragmatica.completion.grammar;

/**
 * Statement language with nested blocks, nested calls and a wildcard directive.
 */
public final class NestedGrammar {
    private NestedGrammar() {}

    public static final String LEXER = """
        lexer grammar NestedLexer;

        LBRACE: '{';
        RBRACE: '}';
        LPAREN: '(';
        RPAREN: ')';
        SEMI: ';';
        COMMA: ',';
        HASH: '#';
        NUMBER: [0-9]+;
        ID: [a-zA-Z_] [a-zA-Z0-9_]*;
        WS: [ \\n\\r\\t]+ -> channel(HIDDEN);
        """;

    public static final String PARSER = """
        parser grammar NestedParser;

        tokens { LBRACE, RBRACE, LPAREN, RPAREN, SEMI, COMMA, HASH, NUMBER, ID, WS }

        program: statement* EOF;

        statement: block | call SEMI | directive;

        block: LBRACE statement* RBRACE;

        call: ID LPAREN args? RPAREN;

        args: expr (COMMA expr)*;

        expr: call | ID | NUMBER;

        directive: HASH .;
        """;

    public static InterpretedGrammar load() {
        return InterpretedGrammar.load(LEXER, PARSER);
    }
}
