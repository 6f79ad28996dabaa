package dev.nodalis.st.ast;

import java.util.Objects;

public final class UnaryExpression extends Expression {

    private final UnaryOperator operator;
    private final Expression operand;

    public UnaryExpression(int line, UnaryOperator operator, Expression operand) {
        super(line);
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
