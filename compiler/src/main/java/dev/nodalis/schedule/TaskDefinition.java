package dev.nodalis.schedule;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * A periodic task. It fires on every tick whose number is a multiple of
 * {@link #getInterval()} and runs its instances in declaration order.
 */
public final class TaskDefinition {

    private final String name;
    private final long interval;
    private final Integer priority;
    private final ImmutableList<ProgramInstance> instances;

    public TaskDefinition(String name, long interval, Integer priority, List<ProgramInstance> instances) {
        this.name = Objects.requireNonNull(name, "name");
        if (interval <= 0) {
            throw new IllegalArgumentException("task interval must be positive: " + interval);
        }
        this.interval = interval;
        this.priority = priority;
        this.instances = ImmutableList.copyOf(instances);
    }

    public String getName() {
        return name;
    }

    public long getInterval() {
        return interval;
    }

    public OptionalInt getPriority() {
        return priority == null ? OptionalInt.empty() : OptionalInt.of(priority);
    }

    public ImmutableList<ProgramInstance> getInstances() {
        return instances;
    }
}
