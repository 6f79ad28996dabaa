package dev.nodalis.project;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * The programs and function blocks declared in the project's global
 * namespace, in document order.
 */
public final class ProjectTypes {

    private final ImmutableList<ProgramDefinition> programs;
    private final ImmutableList<FunctionBlockDefinition> functionBlocks;

    public ProjectTypes(List<ProgramDefinition> programs, List<FunctionBlockDefinition> functionBlocks) {
        this.programs = ImmutableList.copyOf(programs);
        this.functionBlocks = ImmutableList.copyOf(functionBlocks);
    }

    public ImmutableList<ProgramDefinition> getPrograms() {
        return programs;
    }

    public ImmutableList<FunctionBlockDefinition> getFunctionBlocks() {
        return functionBlocks;
    }

    public Optional<ProgramDefinition> findProgram(String name) {
        return programs.stream().filter(p -> p.getName().equals(name)).findFirst();
    }
}
