package dev.nodalis.toolchain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TargetPlatformTest {

    @Test
    void normalisesAliases() {
        assertThat(TargetPlatform.parse("Darwin-AArch64")).isEqualTo(new TargetPlatform("macos", "arm64"));
        assertThat(TargetPlatform.parse("linux-x86_64").key()).isEqualTo("linux-x64");
        assertThat(TargetPlatform.parse("win32-amd64").isWindows()).isTrue();
        assertThat(TargetPlatform.parse("linux-armhf")).hasToString("linux-arm");
    }

    @Test
    void rejectsDevicesWithoutArchitecture() {
        assertThatThrownBy(() -> TargetPlatform.parse("nodejs")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TargetPlatform.parse("linux-")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TargetPlatform.parse("-x64")).isInstanceOf(IllegalArgumentException.class);
    }
}
