package dev.nodalis.toolchain;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Objects;

/**
 * A native {@code <os>-<arch>} target such as {@code linux-arm64}.
 */
public final class TargetPlatform {

    private static final ImmutableMap<String, String> OS_ALIASES = ImmutableMap.of(
            "darwin", "macos",
            "osx", "macos",
            "win32", "windows",
            "win", "windows");

    private static final ImmutableMap<String, String> ARCH_ALIASES = ImmutableMap.of(
            "amd64", "x64",
            "x86_64", "x64",
            "aarch64", "arm64",
            "armhf", "arm");

    private final String os;
    private final String arch;

    public TargetPlatform(String os, String arch) {
        this.os = Objects.requireNonNull(os, "os");
        this.arch = Objects.requireNonNull(arch, "arch");
    }

    /**
     * Parses a device id, normalising the common operating system and
     * architecture aliases.
     */
    public static TargetPlatform parse(String device) {
        String id = device.trim().toLowerCase(Locale.ROOT);
        int dash = id.indexOf('-');
        if (dash <= 0 || dash == id.length() - 1) {
            throw new IllegalArgumentException("not an <os>-<arch> target: " + device);
        }
        String os = id.substring(0, dash);
        String arch = id.substring(dash + 1);
        return new TargetPlatform(OS_ALIASES.getOrDefault(os, os), ARCH_ALIASES.getOrDefault(arch, arch));
    }

    public String getOs() {
        return os;
    }

    public String getArch() {
        return arch;
    }

    public boolean isWindows() {
        return os.equals("windows");
    }

    public String key() {
        return os + "-" + arch;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TargetPlatform)) {
            return false;
        }
        TargetPlatform that = (TargetPlatform) o;
        return os.equals(that.os) && arch.equals(that.arch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(os, arch);
    }

    @Override
    public String toString() {
        return key();
    }
}
