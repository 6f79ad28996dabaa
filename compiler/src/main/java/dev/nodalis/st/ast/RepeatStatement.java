package dev.nodalis.st.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * {@code REPEAT body UNTIL condition END_REPEAT}: the body runs at least once
 * and stops once the condition holds.
 */
public final class RepeatStatement extends Statement {

    private final ImmutableList<Statement> body;
    private final Expression until;

    public RepeatStatement(int line, List<Statement> body, Expression until) {
        super(line);
        this.body = ImmutableList.copyOf(body);
        this.until = Objects.requireNonNull(until, "until");
    }

    public ImmutableList<Statement> getBody() {
        return body;
    }

    public Expression getUntil() {
        return until;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRepeat(this);
    }
}
