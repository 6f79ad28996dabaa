package dev.nodalis.st.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A call of a function, program or function block instance.
 */
public final class CallExpression extends Expression {

    private final String callee;
    private final ImmutableList<Argument> arguments;

    public CallExpression(int line, String callee, List<Argument> arguments) {
        super(line);
        this.callee = Objects.requireNonNull(callee, "callee");
        this.arguments = ImmutableList.copyOf(arguments);
    }

    public String getCallee() {
        return callee;
    }

    public ImmutableList<Argument> getArguments() {
        return arguments;
    }

    public boolean hasNamedArguments() {
        return arguments.stream().anyMatch(a -> a.getName().isPresent());
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
