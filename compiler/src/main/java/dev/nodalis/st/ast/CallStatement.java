package dev.nodalis.st.ast;

import java.util.Objects;

public final class CallStatement extends Statement {

    private final CallExpression call;

    public CallStatement(int line, CallExpression call) {
        super(line);
        this.call = Objects.requireNonNull(call, "call");
    }

    public CallExpression getCall() {
        return call;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCallStatement(this);
    }
}
