package org.featuretree.script;

/**
 * 二元运算符，带优先级（数值越大绑定越紧）。
 */
public enum BinaryOperator {
    BIT_OR("|", 6),
    BIT_XOR("^", 7),
    BIT_AND("&", 8),
    LSHIFT("<<", 9),
    RSHIFT(">>", 9),
    ADD("+", 10),
    SUB("-", 10),
    MULT("*", 11),
    MATMULT("@", 11),
    DIV("/", 11),
    FLOORDIV("//", 11),
    MOD("%", 11),
    POW("**", 13);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    /** 按符号查找；不是二元运算符时返回 null。 */
    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        return null;
    }
}
