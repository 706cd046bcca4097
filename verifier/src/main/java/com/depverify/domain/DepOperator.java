package com.depverify.domain;

/**
 * Version comparison operator of a dependency rule. {@link #NONE} means the rule is unversioned.
 */
public enum DepOperator {
    NONE(""),
    EQUAL("="),
    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">=");

    private final String symbol;

    DepOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Parse an operator symbol. A null or blank symbol is {@link #NONE}; "==" is accepted as equality.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static DepOperator fromSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) return NONE;
        String s = symbol.trim();
        if ("==".equals(s)) return EQUAL;
        for (DepOperator op : values()) {
            if (op != NONE && op.symbol.equals(s)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown dependency operator: " + symbol);
    }
}
