package dev.nodalis.st.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * One guarded arm of an IF statement (the IF arm or an ELSIF arm).
 */
public final class ConditionalBranch {

    private final Expression condition;
    private final ImmutableList<Statement> body;

    public ConditionalBranch(Expression condition, List<Statement> body) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.body = ImmutableList.copyOf(body);
    }

    public Expression getCondition() {
        return condition;
    }

    public ImmutableList<Statement> getBody() {
        return body;
    }
}
