package com.exprlab.analyzer.ast;

import java.util.List;
import java.util.Objects;

public final class UnaryOperation implements AstNode {

    public enum Symbol {
        SIN("sin"),
        COS("cos"),
        FACTORIAL("!");

        private final String text;

        Symbol(String text) {
            this.text = text;
        }

        public String text() {
            return text;
        }
    }

    private final Symbol symbol;
    private final AstNode operand;
    private final int height;

    private UnaryOperation(Symbol symbol, AstNode operand) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.operand = Objects.requireNonNull(operand, "operand");
        this.height = operand.height() + 1;
    }

    public static UnaryOperation of(Symbol symbol, AstNode operand) {
        return new UnaryOperation(symbol, operand);
    }

    public Symbol symbol() {
        return symbol;
    }

    public AstNode operand() {
        return operand;
    }

    @Override
    public String value() {
        return symbol.text();
    }

    @Override
    public List<AstNode> children() {
        return List.of(operand);
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public String toString() {
        return symbol.text() + "(" + operand + ")";
    }
}
