package dev.nodalis.st.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

public final class IfStatement extends Statement {

    private final ImmutableList<ConditionalBranch> branches;
    private final ImmutableList<Statement> elseBody;

    /**
     * @param branches the IF arm followed by every ELSIF arm, never empty
     * @param elseBody ELSE statements, empty when there is no ELSE
     */
    public IfStatement(int line, List<ConditionalBranch> branches, List<Statement> elseBody) {
        super(line);
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("IF statement needs at least one branch");
        }
        this.branches = ImmutableList.copyOf(branches);
        this.elseBody = ImmutableList.copyOf(elseBody);
    }

    public ImmutableList<ConditionalBranch> getBranches() {
        return branches;
    }

    public ImmutableList<Statement> getElseBody() {
        return elseBody;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
