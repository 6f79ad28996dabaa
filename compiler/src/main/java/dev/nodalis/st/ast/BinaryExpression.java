package dev.nodalis.st.ast;

import java.util.Objects;

public final class BinaryExpression extends Expression {

    private final BinaryOperator operator;
    private final Expression left;
    private final Expression right;

    public BinaryExpression(int line, BinaryOperator operator, Expression left, Expression right) {
        super(line);
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
