package dev.nodalis.st.ast;

import java.util.Objects;

public final class ParenthesizedExpression extends Expression {

    private final Expression inner;

    public ParenthesizedExpression(int line, Expression inner) {
        super(line);
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    public Expression getInner() {
        return inner;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitParenthesized(this);
    }
}
