package dev.nodalis.st.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

public final class CaseStatement extends Statement {

    private final Expression selector;
    private final ImmutableList<CaseBranch> branches;
    private final ImmutableList<Statement> elseBody;

    public CaseStatement(int line, Expression selector, List<CaseBranch> branches, List<Statement> elseBody) {
        super(line);
        this.selector = Objects.requireNonNull(selector, "selector");
        this.branches = ImmutableList.copyOf(branches);
        this.elseBody = ImmutableList.copyOf(elseBody);
    }

    public Expression getSelector() {
        return selector;
    }

    public ImmutableList<CaseBranch> getBranches() {
        return branches;
    }

    public ImmutableList<Statement> getElseBody() {
        return elseBody;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCase(this);
    }
}
