package dev.nodalis.backend;

import dev.nodalis.backend.cpp.CppBackend;
import dev.nodalis.backend.cpp.GenericCppBackend;
import dev.nodalis.backend.js.JavaScriptBackend;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendRegistryTest {

    private final BackendRegistry registry = BackendRegistry.standard();

    @Test
    void selectsBackendByDevice() throws Exception {
        assertThat(registry.select("linux-x64", OutputKind.EXECUTABLE, SourceLanguage.ST).getName())
                .isEqualTo(CppBackend.NAME);
        assertThat(registry.select("generic", OutputKind.SOURCE_CODE, SourceLanguage.ST).getName())
                .isEqualTo(GenericCppBackend.NAME);
        assertThat(registry.select("nodejs", OutputKind.SOURCE_CODE, SourceLanguage.LD).getName())
                .isEqualTo(JavaScriptBackend.NAME);
        assertThat(registry.select("jint", OutputKind.LIBRARY, SourceLanguage.ST).getName())
                .isEqualTo(JavaScriptBackend.NAME);
    }

    @Test
    void firstRegisteredBackendWins() throws Exception {
        Backend first = new GenericCppBackend();
        BackendRegistry ordered = BackendRegistry.of(first, new GenericCppBackend());

        assertThat(ordered.select("generic", OutputKind.EXECUTABLE, SourceLanguage.ST)).isSameAs(first);
    }

    @Test
    void reportsUnsupportedTriple() {
        assertThatThrownBy(() -> registry.select("plc-9000", OutputKind.EXECUTABLE, SourceLanguage.ST))
                .isInstanceOfSatisfying(NoCompilerFoundException.class, e -> {
                    assertThat(e.getDevice()).isEqualTo("plc-9000");
                    assertThat(e.getOutputKind()).isEqualTo(OutputKind.EXECUTABLE);
                    assertThat(e.getLanguage()).isEqualTo(SourceLanguage.ST);
                    assertThat(e.getMessage()).contains("plc-9000", "executable");
                });
    }

    @Test
    void emptyRegistrySupportsNothing() {
        assertThatThrownBy(() -> BackendRegistry.of().select("nodejs", OutputKind.SOURCE_CODE, SourceLanguage.ST))
                .isInstanceOf(NoCompilerFoundException.class);
    }

    @Test
    void describesBackendsInRegistrationOrder() {
        assertThat(registry.describe()).extracting(BackendDescriptor::getName)
                .containsExactly(CppBackend.NAME, GenericCppBackend.NAME, JavaScriptBackend.NAME);
        assertThat(registry.describe().get(1).getProtocols()).containsExactly(Protocol.MODBUS);
        assertThat(registry.describe().get(0).toString()).contains("outputs=code, executable, library");
    }

    @Test
    void parsesOutputKindsAndLanguages() {
        assertThat(OutputKind.parse("code")).isEqualTo(OutputKind.SOURCE_CODE);
        assertThat(OutputKind.parse("LIBRARY")).isEqualTo(OutputKind.LIBRARY);
        assertThat(SourceLanguage.parse("ld")).isEqualTo(SourceLanguage.LD);
        assertThatThrownBy(() -> OutputKind.parse("firmware")).isInstanceOf(IllegalArgumentException.class);
    }
}
