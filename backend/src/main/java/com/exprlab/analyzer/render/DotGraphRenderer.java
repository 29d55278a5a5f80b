package com.exprlab.analyzer.render;

import com.exprlab.analyzer.ast.AstNode;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Renders a tree as Graphviz DOT source. Vertices are keyed by node identity and numbered in
 * depth-first pre-order, so equal values in different places get separate vertices.
 */
public class DotGraphRenderer {

    public String render(AstNode root) {
        StringBuilder sb = new StringBuilder("digraph {\n");
        Map<AstNode, String> ids = new IdentityHashMap<>();
        visit(sb, ids, root, null);
        sb.append("}\n");
        return sb.toString();
    }

    private void visit(StringBuilder sb, Map<AstNode, String> ids, AstNode node, AstNode parent) {
        String id = "n" + ids.size();
        ids.put(node, id);

        sb.append('\t').append(id).append(" [label=\"").append(escape(node.value())).append("\"]\n");
        if (parent != null) {
            sb.append('\t').append(ids.get(parent)).append(" -> ").append(id).append('\n');
        }
        for (AstNode child : node.children()) {
            visit(sb, ids, child, node);
        }
    }

    private static String escape(String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
