package dev.nodalis.st.ast;

public enum UnaryOperator {
    NEGATE("-"),
    PLUS("+"),
    NOT("NOT");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
