package dev.nodalis.st.ast;

import java.util.Objects;

public final class VariableReference extends Expression {

    private final String name;

    public VariableReference(int line, String name) {
        super(line);
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitVariableReference(this);
    }
}
