package com.exprlab.analyzer.dto;

import com.exprlab.analyzer.parser.Token;

public record TokenView(
    String kind,
    String lexeme,
    int position
) {

    public static TokenView from(Token token) {
        return new TokenView(token.kind().name(), token.lexeme(), token.position());
    }
}
