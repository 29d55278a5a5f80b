package com.exprlab.analyzer.parser;

import java.util.regex.Pattern;

/**
 * Token kinds in lexer priority order. The lexer tries each pattern in declaration order and takes
 * the first one that matches at the current position.
 * <p>
 * Patterns use Unicode character classes: {@code \d} accepts any Unicode decimal digit.
 */
public enum TokenKind {
    NUMBER("\\d+(\\.\\d+)?"),
    PLUS("\\+"),
    MINUS("-"),
    MULTIPLY("\\*"),
    DIVIDE("/"),
    CARET("\\^"),
    FACTORIAL("!"),
    SIN("sin"),
    COS("cos"),
    LPAREN("\\("),
    RPAREN("\\)"),
    EOF(null);

    private final Pattern pattern;

    TokenKind(String regex) {
        this.pattern = regex == null ? null : Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS);
    }

    /**
     * @return the defining pattern, or {@code null} for {@link #EOF} which is never matched from text
     */
    public Pattern pattern() {
        return pattern;
    }

    public boolean isScanned() {
        return pattern != null;
    }
}
