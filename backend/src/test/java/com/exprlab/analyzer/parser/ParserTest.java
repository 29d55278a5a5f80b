package com.exprlab.analyzer.parser;

import com.exprlab.analyzer.ast.AstNode;
import com.exprlab.analyzer.ast.BinaryOperation;
import com.exprlab.analyzer.ast.Literal;
import com.exprlab.analyzer.ast.UnaryOperation;
import com.exprlab.analyzer.exception.ExpressionAnalysisException;
import com.exprlab.analyzer.exception.NestingDepthException;
import com.exprlab.analyzer.exception.SyntaxException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParserTest {

    private static ParseResult parse(String expression) throws ExpressionAnalysisException {
        return new Parser(new Lexer().tokenize(expression)).parse();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "2|2",
            "2+3*4|+(2,*(3,4))",
            "2-3-4|-(-(2,3),4)",
            "8/4/2|/(/(8,4),2)",
            "(2+3)*4|*(+(2,3),4)",
            "2^3^4|^(2,^(3,4))",
            "2*3^2|*(2,^(3,2))",
            "5!|!(5)",
            "5!!|!(!(5))",
            "2^3!|^(2,!(3))",
            "5!^2|^(!(5),2)",
            "sin2|sin(2)",
            "sin2^3|sin(^(2,3))",
            "cossin0|cos(sin(0))",
            "sin(1+2)!|sin(!(+(1,2)))",
            "((1.5))|1.5"
    })
    void buildsExpectedTree(String expression, String expected) throws ExpressionAnalysisException {
        assertThat(parse(expression).root()).hasToString(expected);
    }

    @Test
    void recordsDerivationOfSum() throws ExpressionAnalysisException {
        assertThat(parse("2+3").derivationLabels()).containsExactly(
                "E -> T E'",
                "T -> F T'",
                "F -> NUMBER",
                "T' -> ε",
                "E' -> + T E'",
                "T -> F T'",
                "F -> NUMBER",
                "T' -> ε",
                "E' -> ε");
    }

    @Test
    void recordsParenthesizedDerivation() throws ExpressionAnalysisException {
        assertThat(parse("(2)").derivationLabels()).containsExactly(
                "E -> T E'",
                "T -> F T'",
                "F -> ( E )",
                "E -> T E'",
                "T -> F T'",
                "F -> NUMBER",
                "T' -> ε",
                "E' -> ε",
                "T' -> ε",
                "E' -> ε");
    }

    @Test
    void powerStepPrecedesItsOperands() throws ExpressionAnalysisException {
        assertThat(parse("2^3").derivation()).containsExactly(
                Production.E_TERM,
                Production.T_FACTOR,
                Production.F_POWER,
                Production.F_NUMBER,
                Production.F_NUMBER,
                Production.T_PRIME_EMPTY,
                Production.E_PRIME_EMPTY);
    }

    @Test
    void mixedPostfixStepsFollowLeftmostDerivation() throws ExpressionAnalysisException {
        assertThat(parse("5!^2").derivation()).containsExactly(
                Production.E_TERM,
                Production.T_FACTOR,
                Production.F_POWER,
                Production.F_FACTORIAL,
                Production.F_NUMBER,
                Production.F_NUMBER,
                Production.T_PRIME_EMPTY,
                Production.E_PRIME_EMPTY);
    }

    @Test
    void prefixFunctionStepComesBeforeItsArgument() throws ExpressionAnalysisException {
        assertThat(parse("sin2^3").derivation()).containsSubsequence(
                Production.F_SIN,
                Production.F_POWER,
                Production.F_NUMBER,
                Production.F_NUMBER);
    }

    @Test
    void incompleteSumFailsOnEof() {
        assertThatThrownBy(() -> parse("2+"))
                .isInstanceOf(SyntaxException.class)
                .hasMessage("Syntax error: expected one of [NUMBER, SIN, COS, LPAREN], found EOF at position 2")
                .satisfies(e -> {
                    SyntaxException se = (SyntaxException) e;
                    assertThat(se.found().kind()).isEqualTo(TokenKind.EOF);
                    assertThat(se.expected()).contains(TokenKind.NUMBER, TokenKind.LPAREN);
                });
    }

    @Test
    void emptyInputIsASyntaxError() {
        assertThatThrownBy(() -> parse(""))
                .isInstanceOf(SyntaxException.class)
                .satisfies(e -> assertThat(((SyntaxException) e).position()).isZero());
    }

    @Test
    void unclosedParenthesisExpectsRparen() {
        assertThatThrownBy(() -> parse("(2"))
                .isInstanceOf(SyntaxException.class)
                .hasMessage("Syntax error: expected RPAREN, found EOF at position 2");
    }

    @Test
    void trailingTokensAreRejected() {
        assertThatThrownBy(() -> parse("2)"))
                .isInstanceOf(SyntaxException.class)
                .satisfies(e -> {
                    SyntaxException se = (SyntaxException) e;
                    assertThat(se.expected()).containsExactly(TokenKind.EOF);
                    assertThat(se.found().kind()).isEqualTo(TokenKind.RPAREN);
                });
    }

    @Test
    void postfixOperatorsCannotStartAFactor() {
        assertThatThrownBy(() -> parse("^2"))
                .isInstanceOf(SyntaxException.class)
                .satisfies(e -> assertThat(((SyntaxException) e).found().kind()).isEqualTo(TokenKind.CARET));
        assertThatThrownBy(() -> parse("!"))
                .isInstanceOf(SyntaxException.class)
                .satisfies(e -> assertThat(((SyntaxException) e).found().kind()).isEqualTo(TokenKind.FACTORIAL));
        assertThatThrownBy(() -> parse("2^"))
                .isInstanceOf(SyntaxException.class)
                .satisfies(e -> assertThat(((SyntaxException) e).found().kind()).isEqualTo(TokenKind.EOF));
    }

    @Test
    void reparsingGivesSameShapeButNewNodes() throws ExpressionAnalysisException {
        Parser parser = new Parser(new Lexer().tokenize("(2+3)*4^2!"));

        ParseResult first = parser.parse();
        ParseResult second = parser.parse();

        assertThat(first.root()).isNotSameAs(second.root());
        assertThat(first.root().sameStructure(second.root())).isTrue();
        assertThat(first.derivation()).isEqualTo(second.derivation());
    }

    @Test
    void derivationIsDeterministicAcrossParsers() throws ExpressionAnalysisException {
        List<String> first = parse("sin(1)-2/cos3!").derivationLabels();
        List<String> second = parse("sin(1)-2/cos3!").derivationLabels();

        assertThat(first).isEqualTo(second).isNotEmpty();
    }

    @Test
    void equalLiteralsAreDistinctNodes() throws ExpressionAnalysisException {
        AstNode root = parse("2+2").root();

        AstNode left = root.children().get(0);
        AstNode right = root.children().get(1);
        assertThat(left).isNotSameAs(right).isNotEqualTo(right);
        assertThat(left.sameStructure(right)).isTrue();
    }

    @Test
    void typedNodesExposeParsedStructure() throws ExpressionAnalysisException {
        AstNode root = parse("sin(1+2)*3!").root();

        assertThat(root).isInstanceOf(BinaryOperation.class);
        BinaryOperation product = (BinaryOperation) root;
        assertThat(product.symbol()).isEqualTo(BinaryOperation.Symbol.MULTIPLY);

        UnaryOperation sine = (UnaryOperation) product.left();
        assertThat(sine.symbol()).isEqualTo(UnaryOperation.Symbol.SIN);
        BinaryOperation sum = (BinaryOperation) sine.operand();
        assertThat(sum.symbol()).isEqualTo(BinaryOperation.Symbol.ADD);
        assertThat(((Literal) sum.left()).text()).isEqualTo("1");
        assertThat(((Literal) sum.right()).text()).isEqualTo("2");

        UnaryOperation factorial = (UnaryOperation) product.right();
        assertThat(factorial.symbol()).isEqualTo(UnaryOperation.Symbol.FACTORIAL);
        assertThat(((Literal) factorial.operand()).text()).isEqualTo("3");
        assertThat(root.height()).isEqualTo(4);
    }

    @Test
    void acceptsNestingUpToLimit() throws ExpressionAnalysisException {
        ParseResult nested = parse("(".repeat(199) + "2" + ")".repeat(199));
        ParseResult factorials = parse("2" + "!".repeat(199));

        assertThat(nested.root()).hasToString("2");
        assertThat(factorials.root().height()).isEqualTo(Parser.DEFAULT_MAX_DEPTH);
    }

    @Test
    void rejectsParenthesesNestedPastLimit() {
        assertThatThrownBy(() -> parse("(".repeat(200) + "2" + ")".repeat(200)))
                .isInstanceOf(NestingDepthException.class)
                .isInstanceOf(SyntaxException.class)
                .hasMessage("Syntax error: expression nested deeper than 200 levels at position 200")
                .satisfies(e -> assertThat(((SyntaxException) e).expected()).isEmpty());
        assertThatThrownBy(() -> parse("(".repeat(5000) + "2" + ")".repeat(5000)))
                .isInstanceOf(NestingDepthException.class);
    }

    @Test
    void rejectsTreesTallerThanLimit() {
        assertThatThrownBy(() -> parse("2" + "!".repeat(9000)))
                .isInstanceOf(NestingDepthException.class);
        assertThatThrownBy(() -> parse("1" + "+1".repeat(300)))
                .isInstanceOf(NestingDepthException.class);
        assertThatThrownBy(() -> parse("2" + "^2".repeat(300)))
                .isInstanceOf(NestingDepthException.class);
    }

    @Test
    void honoursCustomDepth() throws ExpressionAnalysisException {
        assertThat(new Parser(new Lexer().tokenize("sinsin2"), 3).parse().root()).hasToString("sin(sin(2))");
        assertThatThrownBy(() -> new Parser(new Lexer().tokenize("sinsinsin2"), 3).parse())
                .isInstanceOf(NestingDepthException.class)
                .satisfies(e -> assertThat(((NestingDepthException) e).maxDepth()).isEqualTo(3));
        assertThatThrownBy(() -> new Parser(new Lexer().tokenize("2"), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsTokenSequenceWithoutEof() {
        assertThatThrownBy(() -> new Parser(List.of(new Token(TokenKind.NUMBER, "1", 0))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
