package dev.nodalis.st.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Common shape of the three program organisation units: a name, the
 * variables declared in its VAR blocks and a statement body.
 */
public abstract class PouDeclaration extends Declaration {

    private final String name;
    private final ImmutableList<VariableDeclaration> variables;
    private final ImmutableList<Statement> body;

    protected PouDeclaration(int line, String name, List<VariableDeclaration> variables, List<Statement> body) {
        super(line);
        this.name = Objects.requireNonNull(name, "name");
        this.variables = ImmutableList.copyOf(variables);
        this.body = ImmutableList.copyOf(body);
    }

    public String getName() {
        return name;
    }

    public ImmutableList<VariableDeclaration> getVariables() {
        return variables;
    }

    public ImmutableList<Statement> getBody() {
        return body;
    }
}
