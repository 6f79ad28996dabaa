package dev.nodalis.project;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.google.common.collect.ImmutableList;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A controller unit of a configuration: its globals, tasks and program
 * instances, plus access to the project-wide types and mapping table it
 * draws on when rendered as Structured Text.
 */
public final class Resource {

    private final String name;
    private final String resourceTypeName;
    private final ImmutableList<ProjectVariable> globals;
    private final ImmutableList<TaskDeclaration> tasks;
    private final ImmutableList<ProgramInstanceDeclaration> instances;
    private final ProjectTypes types;
    private final MappingTable mappingTable;

    public Resource(String name,
                    String resourceTypeName,
                    List<ProjectVariable> globals,
                    List<TaskDeclaration> tasks,
                    List<ProgramInstanceDeclaration> instances,
                    ProjectTypes types,
                    MappingTable mappingTable) {
        this.name = Objects.requireNonNull(name, "name");
        this.resourceTypeName = Objects.requireNonNull(resourceTypeName, "resourceTypeName");
        this.globals = ImmutableList.copyOf(globals);
        this.tasks = ImmutableList.copyOf(tasks);
        this.instances = ImmutableList.copyOf(instances);
        this.types = Objects.requireNonNull(types, "types");
        this.mappingTable = Objects.requireNonNull(mappingTable, "mappingTable");
    }

    public String getName() {
        return name;
    }

    public String getResourceTypeName() {
        return resourceTypeName;
    }

    public ImmutableList<ProjectVariable> getGlobals() {
        return globals;
    }

    public ImmutableList<TaskDeclaration> getTasks() {
        return tasks;
    }

    public ImmutableList<ProgramInstanceDeclaration> getInstances() {
        return instances;
    }

    /**
     * Renders this resource as one Structured Text source: the {@code //Map=}
     * directives of its mapping entries, one {@code //Task=} and one
     * {@code //Instance=} directive per task and instance, the globals (each
     * located global followed by its {@code //Global=} directive), every
     * function block of the project and finally each program an instance
     * refers to, once.
     *
     * @throws UnrenderableResourceException if an instance names an unknown
     *                                       program or a body has no textual form
     */
    public String toSourceText() throws UnrenderableResourceException {
        StringBuilder st = new StringBuilder();
        for (MappingEntry entry : mappingTable.entriesFor(name)) {
            st.append(entry.toDirective()).append('\n');
        }
        for (TaskDeclaration task : tasks) {
            st.append("//Task=").append(JsonNodeFactory.instance.objectNode()
                    .put("Name", task.getName())
                    .put("Interval", task.getInterval())
                    .put("Priority", task.getPriority())).append('\n');
        }
        for (ProgramInstanceDeclaration instance : instances) {
            st.append("//Instance=").append(JsonNodeFactory.instance.objectNode()
                    .put("TypeName", instance.getTypeName())
                    .put("Name", instance.getName())
                    .put("AssociatedTaskName", instance.getAssociatedTaskName())).append('\n');
        }

        st.append("VAR_GLOBAL\n");
        for (ProjectVariable global : globals) {
            st.append("    ").append(global.toDeclaration()).append('\n');
            Optional<Address> address = global.getAddress();
            if (address.isPresent()) {
                st.append("    //Global=").append(JsonNodeFactory.instance.objectNode()
                        .put("Name", global.getName())
                        .put("Address", address.get().toDirectReference())).append('\n');
            }
        }
        st.append("END_VAR\n");

        for (FunctionBlockDefinition functionBlock : types.getFunctionBlocks()) {
            st.append(functionBlock.toSourceText()).append('\n');
        }

        Set<String> included = new LinkedHashSet<>();
        for (ProgramInstanceDeclaration instance : instances) {
            if (!included.add(instance.getTypeName())) {
                continue;
            }
            ProgramDefinition program = types.findProgram(instance.getTypeName())
                    .orElseThrow(() -> new UnrenderableResourceException("Resource " + name + " instantiates "
                            + instance.getTypeName() + " but the project declares no such program"));
            st.append(program.toSourceText()).append('\n');
        }
        return st.toString();
    }
}
