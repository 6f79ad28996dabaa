package dev.nodalis.project;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A program or function block declared in the project's global namespace.
 */
public abstract class PouDefinition {

    private final String name;
    private final ImmutableList<ProjectVariable> variables;
    private final PouBody body;

    protected PouDefinition(String name, List<ProjectVariable> variables, PouBody body) {
        this.name = Objects.requireNonNull(name, "name");
        this.variables = ImmutableList.copyOf(variables);
        this.body = Objects.requireNonNull(body, "body");
    }

    public String getName() {
        return name;
    }

    public ImmutableList<ProjectVariable> getVariables() {
        return variables;
    }

    public PouBody getBody() {
        return body;
    }

    /**
     * The complete declaration, from the opening keyword to its END keyword.
     */
    public abstract String toSourceText() throws UnrenderableResourceException;

    protected static void appendSection(StringBuilder st, String keyword, List<ProjectVariable> variables) {
        st.append("    ").append(keyword).append('\n');
        for (ProjectVariable variable : variables) {
            st.append("        ").append(variable.toDeclaration()).append('\n');
        }
        st.append("    END_VAR\n");
    }

    protected static void appendBody(StringBuilder st, PouBody body) throws UnrenderableResourceException {
        for (String line : body.toSourceText().split("\\r?\\n")) {
            st.append("    ").append(line).append('\n');
        }
    }
}
