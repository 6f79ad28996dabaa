package dev.nodalis.st.ast;

import java.util.Objects;

/**
 * {@code target.n}, selecting bit {@code n} of an integer variable.
 */
public final class BitAccess extends Expression {

    private final Expression target;
    private final int bit;

    public BitAccess(int line, Expression target, int bit) {
        super(line);
        this.target = Objects.requireNonNull(target, "target");
        this.bit = bit;
    }

    public Expression getTarget() {
        return target;
    }

    public int getBit() {
        return bit;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBitAccess(this);
    }
}
