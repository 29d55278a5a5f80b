package com.exprlab.analyzer.parser;

/**
 * Grammar productions, recorded by the parser as derivation steps.
 * <pre>
 * E  -&gt; T E'
 * E' -&gt; + T E' | - T E' | ε
 * T  -&gt; F T'
 * T' -&gt; * F T' | / F T' | ε
 * F  -&gt; ( E ) | NUMBER | sin F | cos F | F ^ F | F !
 * </pre>
 */
public enum Production {
    E_TERM("E", "T E'"),
    E_PRIME_PLUS("E'", "+ T E'"),
    E_PRIME_MINUS("E'", "- T E'"),
    E_PRIME_EMPTY("E'", "ε"),
    T_FACTOR("T", "F T'"),
    T_PRIME_MULTIPLY("T'", "* F T'"),
    T_PRIME_DIVIDE("T'", "/ F T'"),
    T_PRIME_EMPTY("T'", "ε"),
    F_PARENTHESIZED("F", "( E )"),
    F_NUMBER("F", "NUMBER"),
    F_SIN("F", "sin F"),
    F_COS("F", "cos F"),
    F_POWER("F", "F ^ F"),
    F_FACTORIAL("F", "F !");

    private final String nonTerminal;
    private final String body;

    Production(String nonTerminal, String body) {
        this.nonTerminal = nonTerminal;
        this.body = body;
    }

    public String nonTerminal() {
        return nonTerminal;
    }

    public String body() {
        return body;
    }

    /**
     * @return the rule as written in the grammar, e.g. {@code E -> T E'}
     */
    public String label() {
        return nonTerminal + " -> " + body;
    }
}
