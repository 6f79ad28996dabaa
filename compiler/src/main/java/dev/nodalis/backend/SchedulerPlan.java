package dev.nodalis.backend;

import com.google.common.collect.ImmutableList;
import dev.nodalis.schedule.ProgramInstance;
import dev.nodalis.schedule.SchedulingModel;
import dev.nodalis.schedule.TaskDefinition;

import java.util.List;
import java.util.Objects;

/**
 * What the generated scheduler loop runs on each tick. With tasks present,
 * each task becomes a gate {@code tick % interval == 0} over its instances;
 * without tasks every declared program runs on every tick.
 */
public final class SchedulerPlan {

    /**
     * One task's guard and the programs it invokes, in instance order.
     */
    public static final class Gate {
        private final String taskName;
        private final long interval;
        private final ImmutableList<String> programs;

        Gate(String taskName, long interval, List<String> programs) {
            this.taskName = Objects.requireNonNull(taskName, "taskName");
            this.interval = interval;
            this.programs = ImmutableList.copyOf(programs);
        }

        public String getTaskName() {
            return taskName;
        }

        public long getInterval() {
            return interval;
        }

        public ImmutableList<String> getPrograms() {
            return programs;
        }
    }

    private final ImmutableList<Gate> gates;
    private final ImmutableList<String> fallbackPrograms;

    private SchedulerPlan(List<Gate> gates, List<String> fallbackPrograms) {
        this.gates = ImmutableList.copyOf(gates);
        this.fallbackPrograms = ImmutableList.copyOf(fallbackPrograms);
    }

    public static SchedulerPlan from(SchedulingModel model) {
        Objects.requireNonNull(model, "model");
        if (!model.hasTasks()) {
            return new SchedulerPlan(ImmutableList.of(), model.getPrograms());
        }
        ImmutableList.Builder<Gate> gates = ImmutableList.builder();
        for (TaskDefinition task : model.getTasks()) {
            ImmutableList.Builder<String> programs = ImmutableList.builder();
            for (ProgramInstance instance : task.getInstances()) {
                programs.add(instance.getTypeName());
            }
            gates.add(new Gate(task.getName(), task.getInterval(), programs.build()));
        }
        return new SchedulerPlan(gates.build(), ImmutableList.of());
    }

    public boolean isGated() {
        return !gates.isEmpty();
    }

    public ImmutableList<Gate> getGates() {
        return gates;
    }

    /**
     * Programs run unconditionally on every tick when no task is declared.
     */
    public ImmutableList<String> getFallbackPrograms() {
        return fallbackPrograms;
    }
}
