package dev.nodalis.st.ast;

import java.util.Objects;

/**
 * A directly represented variable such as {@code %IX0.1} or {@code %QW4}.
 */
public final class DirectAddress extends Expression {

    private final String address;

    public DirectAddress(int line, String address) {
        super(line);
        this.address = Objects.requireNonNull(address, "address");
    }

    public String getAddress() {
        return address;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitDirectAddress(this);
    }
}
