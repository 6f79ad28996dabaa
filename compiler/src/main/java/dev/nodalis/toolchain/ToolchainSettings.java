package dev.nodalis.toolchain;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import dev.nodalis.NodalisException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Cross-compiler per native target. The built-in table can be overridden
 * entry by entry with a {@code toolchain.json} object next to the source.
 */
public final class ToolchainSettings {

    public static final String FILE_NAME = "toolchain.json";

    private static final Logger logger = LogManager.getLogger(ToolchainSettings.class);

    private static final ImmutableMap<String, String> DEFAULTS = ImmutableMap.<String, String>builder()
            .put("linux-arm", "arm-linux-gnueabi-g++")
            .put("linux-arm64", "aarch64-linux-gnu-g++")
            .put("linux-x64", "x86_64-linux-gnu-g++")
            .put("macos-arm64", "clang++")
            .put("macos-x64", "clang++")
            .put("windows-x64", "x86_64-w64-mingw32-g++")
            .put("windows-arm64", "/opt/llvm-mingw/bin/aarch64-w64-mingw32-g++")
            .build();

    private final ImmutableMap<String, String> compilers;

    private ToolchainSettings(Map<String, String> compilers) {
        this.compilers = ImmutableMap.copyOf(compilers);
    }

    public static ToolchainSettings defaults() {
        return new ToolchainSettings(DEFAULTS);
    }

    /**
     * The defaults merged with {@code toolchain.json} in {@code sourceDirectory},
     * if that file exists.
     */
    public static ToolchainSettings load(Path sourceDirectory, ObjectMapper mapper) throws NodalisException {
        Path file = sourceDirectory.resolve(FILE_NAME);
        if (!Files.isRegularFile(file)) {
            return defaults();
        }
        Map<String, String> overrides;
        try {
            overrides = mapper.readValue(file.toFile(), new TypeReference<Map<String, String>>() {
            });
        } catch (IOException e) {
            throw new NodalisException("Failed to load toolchain configuration from " + file + ": " + e.getMessage(), e);
        }
        if (overrides == null) {
            throw new NodalisException("The toolchain configuration in " + file + " must be a JSON object");
        }
        Map<String, String> merged = new LinkedHashMap<>(DEFAULTS);
        for (Map.Entry<String, String> entry : overrides.entrySet()) {
            merged.put(TargetPlatform.parse(entry.getKey()).key(), entry.getValue());
        }
        logger.debug("Loaded {} toolchain overrides from {}", overrides.size(), file);
        return new ToolchainSettings(merged);
    }

    public Optional<String> compilerFor(TargetPlatform target) {
        return Optional.ofNullable(compilers.get(target.key()));
    }

    public ImmutableMap<String, String> getCompilers() {
        return compilers;
    }
}
