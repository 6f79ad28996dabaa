package dev.nodalis.st.ast;

/**
 * Binary operators in Structured Text spelling.
 */
public enum BinaryOperator {
    POWER("**"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("MOD"),
    ADD("+"),
    SUBTRACT("-"),
    LESS("<"),
    GREATER(">"),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    EQUAL("="),
    NOT_EQUAL("<>"),
    AND("AND"),
    XOR("XOR"),
    OR("OR");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
