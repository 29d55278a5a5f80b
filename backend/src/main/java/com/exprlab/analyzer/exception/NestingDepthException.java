package com.exprlab.analyzer.exception;

import com.exprlab.analyzer.parser.Token;

import java.util.Set;

/**
 * Raised when an expression nests deeper than the parser allows. The expression may be grammatical;
 * it is refused so that recursive walks over the tree stay within the stack.
 */
public class NestingDepthException extends SyntaxException {

    private final int maxDepth;

    public NestingDepthException(int maxDepth, Token found) {
        super("Syntax error: expression nested deeper than " + maxDepth + " levels at position "
                + found.position(), Set.of(), found);
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
