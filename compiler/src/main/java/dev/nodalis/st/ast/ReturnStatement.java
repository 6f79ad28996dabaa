package dev.nodalis.st.ast;

public final class ReturnStatement extends Statement {

    public ReturnStatement(int line) {
        super(line);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitReturn(this);
    }
}
