package com.exprlab.analyzer.parser;

import com.exprlab.analyzer.exception.LexicalException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Splits an expression into tokens. Matching is anchored at the scan position and patterns are
 * tried in {@link TokenKind} declaration order.
 * <p>
 * By default whitespace is not a separator: a blank is an unexpected character like any other.
 * A lexer created with {@code skipWhitespace} drops whitespace between tokens.
 * <p>
 * Instances hold no per-call state and can be shared between threads.
 */
public class Lexer {

    private static final TokenKind[] SCANNED_KINDS = Arrays.stream(TokenKind.values())
            .filter(TokenKind::isScanned)
            .toArray(TokenKind[]::new);

    private final boolean skipWhitespace;

    public Lexer() {
        this(false);
    }

    public Lexer(boolean skipWhitespace) {
        this.skipWhitespace = skipWhitespace;
    }

    public List<Token> tokenize(String text) throws LexicalException {
        List<Token> tokens = new ArrayList<>();
        int index = 0;

        while (index < text.length()) {
            if (skipWhitespace && Character.isWhitespace(text.charAt(index))) {
                index++;
                continue;
            }

            Token token = matchAt(text, index);
            if (token == null) {
                throw new LexicalException(index, text.charAt(index));
            }
            tokens.add(token);
            index += token.lexeme().length();
        }

        tokens.add(Token.eof(text.length()));
        return tokens;
    }

    public boolean skipsWhitespace() {
        return skipWhitespace;
    }

    private static Token matchAt(String text, int index) {
        for (TokenKind kind : SCANNED_KINDS) {
            Matcher matcher = kind.pattern().matcher(text);
            matcher.region(index, text.length());
            if (matcher.lookingAt() && matcher.end() > index) {
                return new Token(kind, matcher.group(), index);
            }
        }
        return null;
    }
}
