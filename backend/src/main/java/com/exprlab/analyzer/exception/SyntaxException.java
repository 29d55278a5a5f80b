package com.exprlab.analyzer.exception;

import com.exprlab.analyzer.parser.Token;
import com.exprlab.analyzer.parser.TokenKind;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Raised when the current token cannot continue the parse: a wrong token, a premature end of input
 * or trailing input after a complete expression.
 */
public class SyntaxException extends ExpressionAnalysisException {

    private final Set<TokenKind> expected;
    private final Token found;

    public SyntaxException(Set<TokenKind> expected, Token found) {
        this(buildMessage(expected, found), expected, found);
    }

    protected SyntaxException(String message, Set<TokenKind> expected, Token found) {
        super(message);
        this.expected = expected.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(TokenKind.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(expected));
        this.found = found;
    }

    public SyntaxException(TokenKind expected, Token found) {
        this(EnumSet.of(expected), found);
    }

    public Set<TokenKind> expected() {
        return expected;
    }

    public Token found() {
        return found;
    }

    @Override
    public int position() {
        return found.position();
    }

    @Override
    public String errorType() {
        return "syntax_error";
    }

    private static String buildMessage(Set<TokenKind> expected, Token found) {
        String wanted = expected.size() == 1
                ? expected.iterator().next().name()
                : "one of " + expected;
        return "Syntax error: expected " + wanted + ", found " + found.kind()
                + " at position " + found.position();
    }
}
