package com.exprlab.analyzer.ast;

import java.util.List;
import java.util.Objects;

public final class BinaryOperation implements AstNode {

    public enum Symbol {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        POWER("^");

        private final String text;

        Symbol(String text) {
            this.text = text;
        }

        public String text() {
            return text;
        }
    }

    private final Symbol symbol;
    private final AstNode left;
    private final AstNode right;
    private final int height;

    private BinaryOperation(Symbol symbol, AstNode left, AstNode right) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.height = Math.max(left.height(), right.height()) + 1;
    }

    public static BinaryOperation of(Symbol symbol, AstNode left, AstNode right) {
        return new BinaryOperation(symbol, left, right);
    }

    public Symbol symbol() {
        return symbol;
    }

    public AstNode left() {
        return left;
    }

    public AstNode right() {
        return right;
    }

    @Override
    public String value() {
        return symbol.text();
    }

    @Override
    public List<AstNode> children() {
        return List.of(left, right);
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public String toString() {
        return symbol.text() + "(" + left + "," + right + ")";
    }
}
