package dev.nodalis.schedule;

import java.util.Objects;

/**
 * A global variable bound to a protocol address at runtime start-up.
 */
public final class GlobalBinding {

    private final String name;
    private final String address;

    public GlobalBinding(String name, String address) {
        this.name = Objects.requireNonNull(name, "name");
        this.address = Objects.requireNonNull(address, "address");
        if (address.isEmpty()) {
            throw new IllegalArgumentException("global " + name + " has an empty address");
        }
    }

    public String getName() {
        return name;
    }

    public String getAddress() {
        return address;
    }
}
