package com.exprlab.analyzer.controller;

import com.exprlab.analyzer.dto.AnalysisRequest;
import com.exprlab.analyzer.dto.AnalysisResponse;
import com.exprlab.analyzer.parser.Grammar;
import com.exprlab.analyzer.service.ExpressionAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

import java.util.List;

@RestController
@RequestMapping("/api/expression")
@Validated
public class ExpressionAnalysisController {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionAnalysisController.class);

    private final ExpressionAnalysisService analysisService;

    public ExpressionAnalysisController(ExpressionAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/analyze")
    public ResponseEntity<AnalysisResponse> analyze(@Valid @RequestBody AnalysisRequest request) {
        try {
            logger.debug("Received analysis request for {} characters", request.expression().length());

            AnalysisResponse response = analysisService.analyze(request);

            logger.debug("Analysis finished: success={}, errorType={}",
                    response.success(), response.errorType());

            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Unexpected error during expression analysis", e);
            return ResponseEntity.internalServerError()
                    .body(AnalysisResponse.internalError("Internal server error: " + e.getMessage()));
        }
    }

    @GetMapping("/grammar")
    public ResponseEntity<List<Grammar.Rule>> grammar() {
        return ResponseEntity.ok(analysisService.grammar());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Expression analyzer is running");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<AnalysisResponse> handleValidationException(MethodArgumentNotValidException e) {
        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        logger.warn("Validation error: {}", errorMessage);

        return ResponseEntity.badRequest().body(AnalysisResponse.validationError(errorMessage.toString()));
    }
}
