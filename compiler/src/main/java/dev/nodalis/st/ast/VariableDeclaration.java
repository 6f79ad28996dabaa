package dev.nodalis.st.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * One declared variable. A declaration list such as {@code a, b : INT;} is
 * split into one node per name.
 */
public final class VariableDeclaration extends Node {

    private final String name;
    private final String typeName;
    private final VariableSection section;
    private final boolean constant;
    private final String address;
    private final Expression initialValue;

    public VariableDeclaration(int line, String name, String typeName, VariableSection section,
                               boolean constant, String address, Expression initialValue) {
        super(line);
        this.name = Objects.requireNonNull(name, "name");
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.section = Objects.requireNonNull(section, "section");
        this.constant = constant;
        this.address = address;
        this.initialValue = initialValue;
    }

    public String getName() {
        return name;
    }

    public String getTypeName() {
        return typeName;
    }

    public VariableSection getSection() {
        return section;
    }

    public boolean isConstant() {
        return constant;
    }

    /**
     * The {@code AT %IX0.0} location, if the variable is located.
     */
    public Optional<String> getAddress() {
        return Optional.ofNullable(address);
    }

    public Optional<Expression> getInitialValue() {
        return Optional.ofNullable(initialValue);
    }
}
