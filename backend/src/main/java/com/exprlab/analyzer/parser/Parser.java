package com.exprlab.analyzer.parser;

import com.exprlab.analyzer.ast.AstNode;
import com.exprlab.analyzer.ast.BinaryOperation;
import com.exprlab.analyzer.ast.Literal;
import com.exprlab.analyzer.ast.UnaryOperation;
import com.exprlab.analyzer.exception.NestingDepthException;
import com.exprlab.analyzer.exception.SyntaxException;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.exprlab.analyzer.parser.TokenKind.*;

/**
 * Recursive-descent parser over the grammar in {@link Production}, recording every production it
 * applies.
 * <p>
 * {@code ^} and {@code !} never start a factor. After a factor is built, each following
 * {@code ^} or {@code !} wraps it again: {@code !} as a postfix node, {@code ^} with a complete
 * factor as right operand. This makes {@code ^} right associative and lets {@code !} stack.
 * Those wraps are discovered after their left operand, so their steps are inserted where the
 * enclosing factor started; the log stays a leftmost derivation.
 * <p>
 * Factors may nest at most {@code maxDepth} levels and no node may be taller than
 * {@code maxDepth}; deeper input fails with a {@link NestingDepthException}.
 * <p>
 * Not thread-safe. Each call to {@link #parse()} starts over from the first token.
 */
public class Parser {

    public static final int DEFAULT_MAX_DEPTH = 200;

    private static final Set<TokenKind> FACTOR_START = EnumSet.of(LPAREN, NUMBER, SIN, COS);

    private final List<Token> tokens;
    private final int maxDepth;
    private final List<Production> derivation = new ArrayList<>();
    private int index;
    private Token current;
    private int depth;

    public Parser(List<Token> tokens) {
        this(tokens, DEFAULT_MAX_DEPTH);
    }

    public Parser(List<Token> tokens, int maxDepth) {
        Objects.requireNonNull(tokens, "tokens");
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(EOF)) {
            throw new IllegalArgumentException("Token sequence must end with EOF");
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.tokens = List.copyOf(tokens);
        this.maxDepth = maxDepth;
    }

    public ParseResult parse() throws SyntaxException {
        index = 0;
        current = tokens.get(0);
        depth = 0;
        derivation.clear();

        AstNode root = parseExpression();
        if (!current.is(EOF)) {
            throw new SyntaxException(EOF, current);
        }
        return new ParseResult(root, derivation);
    }

    // E -> T E'
    private AstNode parseExpression() throws SyntaxException {
        derivation.add(Production.E_TERM);
        AstNode left = parseTerm();
        return parseExpressionTail(left);
    }

    // E' -> + T E' | - T E' | ε
    private AstNode parseExpressionTail(AstNode left) throws SyntaxException {
        AstNode node = left;
        while (true) {
            BinaryOperation.Symbol symbol;
            if (current.is(PLUS)) {
                derivation.add(Production.E_PRIME_PLUS);
                symbol = BinaryOperation.Symbol.ADD;
            } else if (current.is(MINUS)) {
                derivation.add(Production.E_PRIME_MINUS);
                symbol = BinaryOperation.Symbol.SUBTRACT;
            } else {
                derivation.add(Production.E_PRIME_EMPTY);
                return node;
            }
            advance();
            node = limited(BinaryOperation.of(symbol, node, parseTerm()));
        }
    }

    // T -> F T'
    private AstNode parseTerm() throws SyntaxException {
        derivation.add(Production.T_FACTOR);
        AstNode left = parseFactor();
        return parseTermTail(left);
    }

    // T' -> * F T' | / F T' | ε
    private AstNode parseTermTail(AstNode left) throws SyntaxException {
        AstNode node = left;
        while (true) {
            BinaryOperation.Symbol symbol;
            if (current.is(MULTIPLY)) {
                derivation.add(Production.T_PRIME_MULTIPLY);
                symbol = BinaryOperation.Symbol.MULTIPLY;
            } else if (current.is(DIVIDE)) {
                derivation.add(Production.T_PRIME_DIVIDE);
                symbol = BinaryOperation.Symbol.DIVIDE;
            } else {
                derivation.add(Production.T_PRIME_EMPTY);
                return node;
            }
            advance();
            node = limited(BinaryOperation.of(symbol, node, parseFactor()));
        }
    }

    // F -> ( E ) | NUMBER | sin F | cos F | F ^ F | F !
    private AstNode parseFactor() throws SyntaxException {
        if (++depth > maxDepth) {
            throw new NestingDepthException(maxDepth, current);
        }
        try {
            return parseFactorAtDepth();
        } finally {
            depth--;
        }
    }

    private AstNode parseFactorAtDepth() throws SyntaxException {
        int start = derivation.size();
        AstNode node = parsePrimary();

        while (current.is(CARET) || current.is(FACTORIAL)) {
            if (current.is(FACTORIAL)) {
                derivation.add(start, Production.F_FACTORIAL);
                advance();
                node = limited(UnaryOperation.of(UnaryOperation.Symbol.FACTORIAL, node));
            } else {
                derivation.add(start, Production.F_POWER);
                advance();
                node = limited(BinaryOperation.of(BinaryOperation.Symbol.POWER, node, parseFactor()));
            }
        }
        return node;
    }

    private AstNode parsePrimary() throws SyntaxException {
        return switch (current.kind()) {
            case LPAREN -> {
                derivation.add(Production.F_PARENTHESIZED);
                match(LPAREN);
                AstNode inner = parseExpression();
                match(RPAREN);
                yield inner;
            }
            case NUMBER -> {
                derivation.add(Production.F_NUMBER);
                yield Literal.of(match(NUMBER));
            }
            case SIN -> {
                derivation.add(Production.F_SIN);
                match(SIN);
                yield limited(UnaryOperation.of(UnaryOperation.Symbol.SIN, parseFactor()));
            }
            case COS -> {
                derivation.add(Production.F_COS);
                match(COS);
                yield limited(UnaryOperation.of(UnaryOperation.Symbol.COS, parseFactor()));
            }
            case PLUS, MINUS, MULTIPLY, DIVIDE, CARET, FACTORIAL, RPAREN, EOF ->
                    throw new SyntaxException(FACTOR_START, current);
        };
    }

    private AstNode limited(AstNode node) throws NestingDepthException {
        if (node.height() > maxDepth) {
            throw new NestingDepthException(maxDepth, current);
        }
        return node;
    }

    private String match(TokenKind expected) throws SyntaxException {
        if (!current.is(expected)) {
            throw new SyntaxException(expected, current);
        }
        String lexeme = current.lexeme();
        advance();
        return lexeme;
    }

    private void advance() {
        if (index < tokens.size() - 1) {
            index++;
        }
        current = tokens.get(index);
    }
}
