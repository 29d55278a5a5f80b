package com.exprlab.analyzer.service;

import com.exprlab.analyzer.config.ExpressionAnalyzerProperties;
import com.exprlab.analyzer.dto.AnalysisRequest;
import com.exprlab.analyzer.dto.AnalysisResponse;
import com.exprlab.analyzer.dto.AstNodeView;
import com.exprlab.analyzer.dto.TokenView;
import com.exprlab.analyzer.exception.ExpressionAnalysisException;
import com.exprlab.analyzer.parser.Grammar;
import com.exprlab.analyzer.parser.Lexer;
import com.exprlab.analyzer.parser.ParseResult;
import com.exprlab.analyzer.parser.Parser;
import com.exprlab.analyzer.parser.Token;
import com.exprlab.analyzer.render.AstTreePrinter;
import com.exprlab.analyzer.render.DotGraphRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ExpressionAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionAnalysisService.class);

    private final ExpressionAnalyzerProperties properties;
    private final Lexer lexer;
    private final DotGraphRenderer dotRenderer = new DotGraphRenderer();

    public ExpressionAnalysisService(ExpressionAnalyzerProperties properties) {
        this.properties = properties;
        this.lexer = new Lexer(properties.skipWhitespace());
        logger.info("Expression analyzer ready (skipWhitespace={}, renderDot={}, maxExpressionLength={}, maxNestingDepth={})",
                properties.skipWhitespace(), properties.renderDot(), properties.maxExpressionLength(),
                properties.maxNestingDepth());
    }

    public AnalysisResponse analyze(AnalysisRequest request) {
        long startTime = System.currentTimeMillis();
        String expression = request.expression();

        logger.info("Analyzing expression of {} characters", expression.length());

        if (expression.length() > properties.maxExpressionLength()) {
            logger.warn("Rejected expression of {} characters (limit {})",
                    expression.length(), properties.maxExpressionLength());
            return AnalysisResponse.validationError(
                    "Expression exceeds maximum length of " + properties.maxExpressionLength() + " characters");
        }

        List<TokenView> tokenViews = null;
        try {
            List<Token> tokens = lexer.tokenize(expression);
            tokenViews = tokens.stream().map(TokenView::from).toList();
            logger.debug("Tokens: {}", tokens);

            ParseResult result = new Parser(tokens, properties.maxNestingDepth()).parse();
            List<String> steps = result.derivationLabels();
            if (logger.isDebugEnabled()) {
                logger.debug("Derivation ({} steps): {}", steps.size(), steps);
                logger.debug("AST:\n{}", AstTreePrinter.print(result.root()));
            }

            String dot = properties.renderDot() ? dotRenderer.render(result.root()) : null;

            long analysisTime = System.currentTimeMillis() - startTime;
            logger.info("Analysis completed in {}ms: {} tokens, {} derivation steps",
                    analysisTime, tokens.size(), steps.size());

            return AnalysisResponse.success(
                    tokenViews,
                    steps,
                    AstNodeView.from(result.root()),
                    dot,
                    analysisTime);

        } catch (ExpressionAnalysisException e) {
            long analysisTime = System.currentTimeMillis() - startTime;
            logger.warn("Analysis failed ({}): {}", e.errorType(), e.getMessage());
            return AnalysisResponse.analysisError(
                    tokenViews,
                    e.getMessage(),
                    e.errorType(),
                    e.position(),
                    analysisTime);
        }
    }

    public List<Grammar.Rule> grammar() {
        return Grammar.rules();
    }
}
