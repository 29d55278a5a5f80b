package com.exprlab.analyzer.ast;

import java.util.List;
import java.util.Objects;

public final class Literal implements AstNode {

    private final String text;

    private Literal(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public static Literal of(String text) {
        return new Literal(text);
    }

    public String text() {
        return text;
    }

    @Override
    public String value() {
        return text;
    }

    @Override
    public List<AstNode> children() {
        return List.of();
    }

    @Override
    public int height() {
        return 1;
    }

    @Override
    public String toString() {
        return text;
    }
}
