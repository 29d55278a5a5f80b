package com.exprlab.analyzer.exception;

public class LexicalException extends ExpressionAnalysisException {

    private final int position;
    private final char character;

    public LexicalException(int position, char character) {
        super("Lexical error: unexpected character '" + character + "' at position " + position);
        this.position = position;
        this.character = character;
    }

    @Override
    public int position() {
        return position;
    }

    public char character() {
        return character;
    }

    @Override
    public String errorType() {
        return "lexical_error";
    }
}
