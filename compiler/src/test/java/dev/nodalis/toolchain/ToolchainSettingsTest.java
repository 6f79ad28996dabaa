package dev.nodalis.toolchain;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.nodalis.NodalisException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolchainSettingsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path dir;

    @Test
    void knowsTheStandardCrossCompilers() {
        ToolchainSettings settings = ToolchainSettings.defaults();

        assertThat(settings.compilerFor(TargetPlatform.parse("linux-arm"))).contains("arm-linux-gnueabi-g++");
        assertThat(settings.compilerFor(TargetPlatform.parse("osx-x86_64"))).contains("clang++");
        assertThat(settings.compilerFor(TargetPlatform.parse("windows-x64"))).contains("x86_64-w64-mingw32-g++");
        assertThat(settings.compilerFor(TargetPlatform.parse("solaris-sparc"))).isEmpty();
    }

    @Test
    void fallsBackToDefaultsWithoutConfigurationFile() throws NodalisException {
        assertThat(ToolchainSettings.load(dir, mapper).getCompilers())
                .isEqualTo(ToolchainSettings.defaults().getCompilers());
    }

    @Test
    void mergesOverridesUnderNormalisedKeys() throws Exception {
        Files.writeString(dir.resolve(ToolchainSettings.FILE_NAME),
                "{\"darwin-aarch64\": \"/usr/local/bin/g++-13\", \"linux-riscv64\": \"riscv64-linux-gnu-g++\"}");

        ToolchainSettings settings = ToolchainSettings.load(dir, mapper);

        assertThat(settings.compilerFor(new TargetPlatform("macos", "arm64"))).contains("/usr/local/bin/g++-13");
        assertThat(settings.compilerFor(new TargetPlatform("linux", "riscv64"))).contains("riscv64-linux-gnu-g++");
        assertThat(settings.compilerFor(new TargetPlatform("linux", "x64"))).contains("x86_64-linux-gnu-g++");
    }

    @Test
    void reportsUnreadableConfiguration() throws Exception {
        Files.writeString(dir.resolve(ToolchainSettings.FILE_NAME), "{ not json");

        assertThatThrownBy(() -> ToolchainSettings.load(dir, mapper))
                .isInstanceOf(NodalisException.class)
                .hasMessageStartingWith("Failed to load toolchain configuration from");
    }

    @Test
    void rejectsNullConfiguration() throws Exception {
        Files.writeString(dir.resolve(ToolchainSettings.FILE_NAME), "null");

        assertThatThrownBy(() -> ToolchainSettings.load(dir, mapper))
                .isInstanceOf(NodalisException.class)
                .hasMessageContaining("must be a JSON object");
    }
}
