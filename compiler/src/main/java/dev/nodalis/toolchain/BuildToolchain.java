package dev.nodalis.toolchain;

import dev.nodalis.NodalisException;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns generated C++ into an executable. Implementations run the native
 * compiler; the compiler core only calls through this interface.
 */
public interface BuildToolchain {

    ToolchainHandle detect(TargetPlatform target, ToolchainSettings settings) throws NodalisException;

    /**
     * Compiles one translation unit and returns the object file.
     */
    Path compileObject(ToolchainHandle handle, Path source, List<Path> includeDirectories, Path outputDirectory)
            throws NodalisException;

    Path linkExecutable(ToolchainHandle handle, List<Path> objects, Path executable) throws NodalisException;
}
