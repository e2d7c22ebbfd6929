package org.featuretree.script;

/**
 * 一元运算符。
 */
public enum UnaryOperator {
    NEG("-"),
    POS("+"),
    INVERT("~"),
    NOT("not ");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
