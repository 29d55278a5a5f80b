package com.exprlab.analyzer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisResponse(
        boolean success,
        List<TokenView> tokens,
        List<String> derivationSteps,
        AstNodeView ast,
        String dot,
        String error,
        String errorType,
        Integer errorPosition,
        long analysisTimeMs
) {

    public static AnalysisResponse success(
            List<TokenView> tokens,
            List<String> derivationSteps,
            AstNodeView ast,
            String dot,
            long analysisTimeMs) {
        return new AnalysisResponse(
                true,
                tokens,
                derivationSteps,
                ast,
                dot,
                null,
                null,
                null,
                analysisTimeMs);
    }

    public static AnalysisResponse analysisError(
            List<TokenView> tokens,
            String error,
            String errorType,
            int errorPosition,
            long analysisTimeMs) {
        return new AnalysisResponse(
                false,
                tokens,
                null,
                null,
                null,
                error,
                errorType,
                errorPosition,
                analysisTimeMs);
    }

    public static AnalysisResponse validationError(String error) {
        return new AnalysisResponse(
                false,
                null,
                null,
                null,
                null,
                error,
                "validation_error",
                null,
                0);
    }

    public static AnalysisResponse internalError(String error) {
        return new AnalysisResponse(
                false,
                null,
                null,
                null,
                null,
                error,
                "internal_error",
                null,
                0);
    }
}
