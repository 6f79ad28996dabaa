package dev.nodalis.toolchain;

import java.util.Objects;

/**
 * A detected native compiler for one target.
 */
public final class ToolchainHandle {

    private final TargetPlatform target;
    private final String compiler;

    public ToolchainHandle(TargetPlatform target, String compiler) {
        this.target = Objects.requireNonNull(target, "target");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
    }

    public TargetPlatform getTarget() {
        return target;
    }

    /**
     * Executable name or path of the compiler driver.
     */
    public String getCompiler() {
        return compiler;
    }

    @Override
    public String toString() {
        return compiler + " (" + target + ")";
    }
}
