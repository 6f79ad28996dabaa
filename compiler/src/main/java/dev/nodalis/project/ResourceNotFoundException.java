package dev.nodalis.project;

import dev.nodalis.NodalisException;

public final class ResourceNotFoundException extends NodalisException {

    private final String resourceName;

    public ResourceNotFoundException(String resourceName) {
        super("No resource named " + resourceName + " exists in the project");
        this.resourceName = resourceName;
    }

    public String getResourceName() {
        return resourceName;
    }
}
