package dev.nodalis.st.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A {@code VAR_GLOBAL ... END_VAR} block at unit level.
 */
public final class GlobalVariableBlock extends Declaration {

    private final ImmutableList<VariableDeclaration> variables;

    public GlobalVariableBlock(int line, List<VariableDeclaration> variables) {
        super(line);
        this.variables = ImmutableList.copyOf(variables);
    }

    public ImmutableList<VariableDeclaration> getVariables() {
        return variables;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitGlobalVariables(this);
    }
}
