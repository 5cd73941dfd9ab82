package org.pragmatica.completion.grammar;

/**
 * Small expression language with keywords, assignments and a left-recursive expression rule.
 */
public final class ExprGrammar {
    private ExprGrammar() {}

    public static final String LEXER = """
        lexer grammar ExprLexer;

        VAR: [vV] [aA] [rR];
        LET: [lL] [eE] [tT];

        PLUS: '+';
        MINUS: '-';
        MULTIPLY: '*';
        DIVIDE: '/';
        EQUAL: '=';
        OPEN_PAR: '(';
        CLOSE_PAR: ')';
        ID: [a-zA-Z] [a-zA-Z0-9_]*;
        WS: [ \\n\\r\\t]+ -> channel(HIDDEN);
        """;

    public static final String PARSER = """
        parser grammar ExprParser;

        tokens { VAR, LET, PLUS, MINUS, MULTIPLY, DIVIDE, EQUAL, OPEN_PAR, CLOSE_PAR, ID, WS }

        expression: assignment | simpleExpression;

        assignment: (VAR | LET) ID EQUAL simpleExpression;

        simpleExpression
            : simpleExpression (PLUS | MINUS) simpleExpression
            | simpleExpression (MULTIPLY | DIVIDE) simpleExpression
            | variableRef
            | functionRef
            ;

        variableRef: ID;

        functionRef: ID OPEN_PAR CLOSE_PAR;
        """;

    public static InterpretedGrammar load() {
        return InterpretedGrammar.load(LEXER, PARSER);
    }
}
