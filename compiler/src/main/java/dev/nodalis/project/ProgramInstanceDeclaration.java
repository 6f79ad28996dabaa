package dev.nodalis.project;

import java.util.Objects;

public final class ProgramInstanceDeclaration {

    private final String name;
    private final String typeName;
    private final String associatedTaskName;

    public ProgramInstanceDeclaration(String name, String typeName, String associatedTaskName) {
        this.name = Objects.requireNonNull(name, "name");
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.associatedTaskName = Objects.requireNonNull(associatedTaskName, "associatedTaskName");
    }

    public String getName() {
        return name;
    }

    public String getTypeName() {
        return typeName;
    }

    public String getAssociatedTaskName() {
        return associatedTaskName;
    }
}
