package dev.nodalis.toolchain;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * What to upload and where: a built artifact or folder, and a destination
 * such as an address, folder or URI.
 */
public final class ProgramRequest {

    private final Path source;
    private final String destination;
    private final String username;
    private final String password;

    public ProgramRequest(Path source, String destination, String username, String password) {
        this.source = Objects.requireNonNull(source, "source");
        this.destination = Objects.requireNonNull(destination, "destination");
        this.username = username;
        this.password = password;
    }

    public Path getSource() {
        return source;
    }

    public String getDestination() {
        return destination;
    }

    public Optional<String> getUsername() {
        return Optional.ofNullable(username);
    }

    public Optional<String> getPassword() {
        return Optional.ofNullable(password);
    }

    @Override
    public String toString() {
        return source + " -> " + destination;
    }
}
