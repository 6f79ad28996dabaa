package dev.nodalis.backend;

/**
 * How a backend lowers {@code AND}, {@code OR} and {@code NOT}.
 * <p>
 * {@link #BITWISE} keeps negation logical: bitwise complement of a C++
 * {@code bool} promotes to {@code int} and is never zero.
 */
public enum LogicalOperatorStyle {
    SHORT_CIRCUIT("&&", "||", "!"),
    BITWISE("&", "|", "!");

    private final String and;
    private final String or;
    private final String not;

    LogicalOperatorStyle(String and, String or, String not) {
        this.and = and;
        this.or = or;
        this.not = not;
    }

    public String and() {
        return and;
    }

    public String or() {
        return or;
    }

    public String not() {
        return not;
    }
}
