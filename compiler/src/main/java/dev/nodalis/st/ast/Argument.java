package dev.nodalis.st.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * A call argument: positional ({@code f(x)}), named input ({@code IN := x})
 * or named output ({@code Q => y}).
 */
public final class Argument extends Node {

    private final String name;
    private final Expression value;
    private final boolean output;

    public Argument(int line, String name, Expression value, boolean output) {
        super(line);
        this.name = name;
        this.value = Objects.requireNonNull(value, "value");
        this.output = output;
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public Expression getValue() {
        return value;
    }

    public boolean isOutput() {
        return output;
    }
}
