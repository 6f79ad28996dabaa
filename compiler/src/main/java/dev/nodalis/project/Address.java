package dev.nodalis.project;

import java.util.Objects;

/**
 * A located variable's address split the way project files store it:
 * location {@code I}/{@code Q}/{@code M}, size {@code X}/{@code B}/{@code W}/{@code D}/{@code L}
 * and the numeric part, e.g. {@code 0.3}.
 */
public final class Address {

    private final String location;
    private final String size;
    private final String address;

    public Address(String location, String size, String address) {
        this.location = Objects.requireNonNull(location, "location");
        this.size = Objects.requireNonNull(size, "size");
        this.address = Objects.requireNonNull(address, "address");
    }

    public String getLocation() {
        return location;
    }

    public String getSize() {
        return size;
    }

    public String getAddress() {
        return address;
    }

    /**
     * {@code %IX0.3}
     */
    public String toDirectReference() {
        return "%" + location + size + address;
    }

    @Override
    public String toString() {
        return toDirectReference();
    }
}
