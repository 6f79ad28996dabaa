package dev.nodalis.st.ast;

public final class ExitStatement extends Statement {

    public ExitStatement(int line) {
        super(line);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitExit(this);
    }
}
