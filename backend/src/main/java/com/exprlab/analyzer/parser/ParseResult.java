package com.exprlab.analyzer.parser;

import com.exprlab.analyzer.ast.AstNode;

import java.util.List;

public record ParseResult(AstNode root, List<Production> derivation) {

    public ParseResult {
        derivation = List.copyOf(derivation);
    }

    public List<String> derivationLabels() {
        return derivation.stream().map(Production::label).toList();
    }
}
