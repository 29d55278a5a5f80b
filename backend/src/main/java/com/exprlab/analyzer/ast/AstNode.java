package com.exprlab.analyzer.ast;

import java.util.List;

/**
 * Node of an expression tree. Implementations are immutable, own their children exclusively and
 * compare by identity, so two literals with the same text are still different vertices.
 */
public sealed interface AstNode permits Literal, UnaryOperation, BinaryOperation {

    /**
     * @return operator symbol ({@code + - * / ^ ! sin cos}) or the literal's source text
     */
    String value();

    List<AstNode> children();

    /**
     * @return number of nodes on the longest path from this node down to a literal, 1 for a literal
     */
    int height();

    /**
     * Compares value and shape, ignoring identity.
     */
    default boolean sameStructure(AstNode other) {
        if (other == null || !value().equals(other.value())) {
            return false;
        }
        List<AstNode> mine = children();
        List<AstNode> theirs = other.children();
        if (mine.size() != theirs.size()) {
            return false;
        }
        for (int i = 0; i < mine.size(); i++) {
            if (!mine.get(i).sameStructure(theirs.get(i))) {
                return false;
            }
        }
        return true;
    }
}
