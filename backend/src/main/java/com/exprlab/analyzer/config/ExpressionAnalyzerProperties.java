package com.exprlab.analyzer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;

@ConfigurationProperties(prefix = "analyzer")
@Validated
public record ExpressionAnalyzerProperties(

    @Positive
    @DefaultValue("1000")
    int maxExpressionLength,

    @DefaultValue("false")
    boolean skipWhitespace,

    @DefaultValue("true")
    boolean renderDot,

    @Positive
    @Max(500)
    @DefaultValue("200")
    int maxNestingDepth
) {
}
