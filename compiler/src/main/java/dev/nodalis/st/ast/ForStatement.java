package dev.nodalis.st.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class ForStatement extends Statement {

    private final String control;
    private final Expression from;
    private final Expression to;
    private final Expression step;
    private final ImmutableList<Statement> body;

    public ForStatement(int line, String control, Expression from, Expression to, Expression step,
                        List<Statement> body) {
        super(line);
        this.control = Objects.requireNonNull(control, "control");
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.step = step;
        this.body = ImmutableList.copyOf(body);
    }

    public String getControl() {
        return control;
    }

    public Expression getFrom() {
        return from;
    }

    public Expression getTo() {
        return to;
    }

    /**
     * The BY expression; absent means a step of 1.
     */
    public Optional<Expression> getStep() {
        return Optional.ofNullable(step);
    }

    public ImmutableList<Statement> getBody() {
        return body;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitFor(this);
    }
}
