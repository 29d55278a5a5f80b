package com.exprlab.analyzer.parser;

import java.util.Objects;

public record Token(TokenKind kind, String lexeme, int position) {

    public static final String EOF_LEXEME = "EOF";

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(lexeme, "lexeme");
    }

    public static Token eof(int position) {
        return new Token(TokenKind.EOF, EOF_LEXEME, position);
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return kind + "\"" + lexeme + "\"@" + position;
    }
}
