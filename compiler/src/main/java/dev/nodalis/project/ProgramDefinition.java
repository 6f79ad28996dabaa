package dev.nodalis.project;

import java.util.List;

/**
 * A {@code <Program>}. External variables are not rendered; they are
 * expected among the resource's globals.
 */
public final class ProgramDefinition extends PouDefinition {

    public ProgramDefinition(String name, List<ProjectVariable> variables, PouBody body) {
        super(name, variables, body);
    }

    @Override
    public String toSourceText() throws UnrenderableResourceException {
        StringBuilder st = new StringBuilder("PROGRAM ").append(getName()).append('\n');
        appendSection(st, "VAR", getVariables());
        appendBody(st, getBody());
        return st.append("END_PROGRAM\n").toString();
    }
}
