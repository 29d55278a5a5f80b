package com.exprlab.analyzer.render;

import com.exprlab.analyzer.ast.AstNode;

/**
 * Prints a tree one node per line, each child indented one tab deeper than its parent.
 * Values are single-quoted.
 */
public final class AstTreePrinter {

    private AstTreePrinter() {}

    public static String print(AstNode root) {
        StringBuilder sb = new StringBuilder();
        append(sb, root, 0);
        return sb.toString();
    }

    private static void append(StringBuilder sb, AstNode node, int level) {
        sb.append("\t".repeat(level)).append('\'').append(node.value()).append("'\n");
        for (AstNode child : node.children()) {
            append(sb, child, level + 1);
        }
    }
}
