package com.exprlab.analyzer.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Grammar {

    public record Rule(String nonTerminal, List<String> alternatives) {

        public Rule {
            alternatives = List.copyOf(alternatives);
        }
    }

    private static final List<Rule> RULES = buildRules();

    private Grammar() {}

    /**
     * @return one rule per non-terminal in grammar order, alternatives in the order the parser tries them
     */
    public static List<Rule> rules() {
        return RULES;
    }

    private static List<Rule> buildRules() {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (Production production : Production.values()) {
            grouped.computeIfAbsent(production.nonTerminal(), k -> new ArrayList<>()).add(production.body());
        }
        return grouped.entrySet().stream()
                .map(e -> new Rule(e.getKey(), e.getValue()))
                .toList();
    }
}
