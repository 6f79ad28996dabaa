package dev.nodalis.st.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

public final class WhileStatement extends Statement {

    private final Expression condition;
    private final ImmutableList<Statement> body;

    public WhileStatement(int line, Expression condition, List<Statement> body) {
        super(line);
        this.condition = Objects.requireNonNull(condition, "condition");
        this.body = ImmutableList.copyOf(body);
    }

    public Expression getCondition() {
        return condition;
    }

    public ImmutableList<Statement> getBody() {
        return body;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitWhile(this);
    }
}
