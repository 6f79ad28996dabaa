package dev.nodalis.project;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import java.util.List;

public final class FunctionBlockDefinition extends PouDefinition {

    private static final Ordering<ProjectVariable> BY_ORDER =
            Ordering.<Integer>natural().onResultOf(ProjectVariable::getOrder);

    private final ImmutableList<ProjectVariable> inputs;
    private final ImmutableList<ProjectVariable> outputs;

    public FunctionBlockDefinition(String name, List<ProjectVariable> inputs, List<ProjectVariable> outputs,
                                   List<ProjectVariable> variables, PouBody body) {
        super(name, variables, body);
        this.inputs = BY_ORDER.immutableSortedCopy(inputs);
        this.outputs = BY_ORDER.immutableSortedCopy(outputs);
    }

    /**
     * Input parameters sorted by their position in the parameter set.
     */
    public ImmutableList<ProjectVariable> getInputs() {
        return inputs;
    }

    public ImmutableList<ProjectVariable> getOutputs() {
        return outputs;
    }

    @Override
    public String toSourceText() throws UnrenderableResourceException {
        StringBuilder st = new StringBuilder("FUNCTION_BLOCK ").append(getName()).append('\n');
        appendSection(st, "VAR_INPUT", inputs);
        appendSection(st, "VAR_OUTPUT", outputs);
        appendSection(st, "VAR", getVariables());
        appendBody(st, getBody());
        return st.append("END_FUNCTION_BLOCK\n").toString();
    }
}
