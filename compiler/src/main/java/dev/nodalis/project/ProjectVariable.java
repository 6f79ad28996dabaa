package dev.nodalis.project;

import java.util.Objects;
import java.util.Optional;

/**
 * A variable declared in a project file: resource globals, POU locals and
 * function block parameters.
 */
public final class ProjectVariable {

    private final String name;
    private final String typeName;
    private final Address address;
    private final int order;

    public ProjectVariable(String name, String typeName, Address address, int order) {
        this.name = Objects.requireNonNull(name, "name");
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.address = address;
        this.order = order;
    }

    public String getName() {
        return name;
    }

    public String getTypeName() {
        return typeName;
    }

    public Optional<Address> getAddress() {
        return Optional.ofNullable(address);
    }

    /**
     * Position within a parameter set; 0 when the file does not say.
     */
    public int getOrder() {
        return order;
    }

    String toDeclaration() {
        StringBuilder out = new StringBuilder(name);
        if (address != null) {
            out.append(" AT ").append(address.toDirectReference());
        }
        return out.append(" : ").append(typeName).append(';').toString();
    }
}
