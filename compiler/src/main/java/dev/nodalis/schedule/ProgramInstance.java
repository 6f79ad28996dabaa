package dev.nodalis.schedule;

import java.util.Objects;
import java.util.Optional;

/**
 * A program bound to a task by an {@code //Instance=} directive.
 */
public final class ProgramInstance {

    private final String typeName;
    private final String name;
    private final String taskName;

    public ProgramInstance(String typeName, String name, String taskName) {
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.name = name;
        this.taskName = Objects.requireNonNull(taskName, "taskName");
    }

    /**
     * The program that is invoked when the owning task fires.
     */
    public String getTypeName() {
        return typeName;
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public String getTaskName() {
        return taskName;
    }
}
