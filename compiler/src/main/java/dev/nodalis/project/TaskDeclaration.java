package dev.nodalis.project;

import java.util.Objects;

/**
 * A {@code <Task>} of a resource. Interval and priority are kept as written;
 * they are validated when the rendered directive is extracted.
 */
public final class TaskDeclaration {

    private final String name;
    private final String interval;
    private final String priority;

    public TaskDeclaration(String name, String interval, String priority) {
        this.name = Objects.requireNonNull(name, "name");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.priority = Objects.requireNonNull(priority, "priority");
    }

    public String getName() {
        return name;
    }

    public String getInterval() {
        return interval;
    }

    public String getPriority() {
        return priority;
    }
}
