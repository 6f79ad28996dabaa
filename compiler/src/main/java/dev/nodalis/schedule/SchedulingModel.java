package dev.nodalis.schedule;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Scheduling metadata read from the directive comments of one source text:
 * tasks with their instances, opaque I/O map payloads, global bindings, the
 * programs declared in the text and any diagnostics raised on the way.
 */
public final class SchedulingModel {

    private final ImmutableList<TaskDefinition> tasks;
    private final ImmutableList<String> ioMaps;
    private final ImmutableList<GlobalBinding> globals;
    private final ImmutableList<String> programs;
    private final ImmutableList<Diagnostic> diagnostics;

    public SchedulingModel(List<TaskDefinition> tasks,
                           List<String> ioMaps,
                           List<GlobalBinding> globals,
                           List<String> programs,
                           List<Diagnostic> diagnostics) {
        this.tasks = ImmutableList.copyOf(tasks);
        this.ioMaps = ImmutableList.copyOf(ioMaps);
        this.globals = ImmutableList.copyOf(globals);
        this.programs = ImmutableList.copyOf(programs);
        this.diagnostics = ImmutableList.copyOf(diagnostics);
    }

    public ImmutableList<TaskDefinition> getTasks() {
        return tasks;
    }

    public boolean hasTasks() {
        return !tasks.isEmpty();
    }

    /**
     * {@code //Map=} payloads, verbatim and in source order.
     */
    public ImmutableList<String> getIoMaps() {
        return ioMaps;
    }

    public ImmutableList<GlobalBinding> getGlobals() {
        return globals;
    }

    /**
     * Names of the {@code PROGRAM} declarations in source order.
     */
    public ImmutableList<String> getPrograms() {
        return programs;
    }

    public ImmutableList<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
