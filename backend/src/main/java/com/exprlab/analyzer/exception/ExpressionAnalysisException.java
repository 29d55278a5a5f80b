package com.exprlab.analyzer.exception;

/**
 * Base type of every failure that aborts tokenizing or parsing an expression.
 */
public abstract class ExpressionAnalysisException extends Exception {

    protected ExpressionAnalysisException(String message) {
        super(message);
    }

    /**
     * @return zero-based offset in the expression where analysis stopped
     */
    public abstract int position();

    /**
     * @return short machine-readable category, e.g. {@code lexical_error}
     */
    public abstract String errorType();
}
