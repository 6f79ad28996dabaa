package dev.nodalis.st.ast;

import java.util.Objects;

/**
 * {@code target := value;}. The target is a variable reference, member
 * access, bit access or direct address.
 */
public final class Assignment extends Statement {

    private final Expression target;
    private final Expression value;

    public Assignment(int line, Expression target, Expression value) {
        super(line);
        this.target = Objects.requireNonNull(target, "target");
        this.value = Objects.requireNonNull(value, "value");
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitAssignment(this);
    }
}
