package com.exprlab.analyzer.dto;

import com.exprlab.analyzer.ast.AstNode;

import java.util.List;

public record AstNodeView(String value, List<AstNodeView> children) {

    public static AstNodeView from(AstNode node) {
        return new AstNodeView(
                node.value(),
                node.children().stream().map(AstNodeView::from).toList());
    }
}
