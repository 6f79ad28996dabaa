package dev.nodalis.compiler;

import dev.nodalis.NodalisException;
import dev.nodalis.backend.BackendRegistry;
import dev.nodalis.backend.NoCompilerFoundException;
import dev.nodalis.backend.OutputKind;
import dev.nodalis.backend.Protocol;
import dev.nodalis.backend.SourceLanguage;
import dev.nodalis.backend.cpp.CppBackend;
import dev.nodalis.backend.js.JavaScriptBackend;
import dev.nodalis.project.ResourceNotFoundException;
import dev.nodalis.schedule.Diagnostic;
import dev.nodalis.st.StructuredTextSyntaxException;
import dev.nodalis.toolchain.BuildToolchain;
import dev.nodalis.toolchain.DeviceProgrammer;
import dev.nodalis.toolchain.ProgramRequest;
import dev.nodalis.toolchain.TargetPlatform;
import dev.nodalis.toolchain.ToolchainHandle;
import dev.nodalis.toolchain.ToolchainSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodalisCompilerTest {

    private final NodalisCompiler compiler =
            new NodalisCompiler(BackendRegistry.standard(), new CompilerSettings("DefaultPLC", 1, 100));

    @TempDir
    Path workDir;

    private static String fixture(String name) throws IOException {
        try (InputStream in = NodalisCompilerTest.class.getResourceAsStream("/fixtures/" + name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static CompileRequest.Builder request(String name, String text, String device) {
        return CompileRequest.builder().sourceText(name, text).device(device);
    }

    @Test
    void compilesStructuredTextFile() throws Exception {
        Path source = workDir.resolve("pump.st");
        Files.writeString(source, fixture("pump.st"));

        CompilationResult result = compiler.compile(CompileRequest.builder()
                .sourceFile(source)
                .device("linux-arm64")
                .outputKind(OutputKind.EXECUTABLE)
                .language(SourceLanguage.ST)
                .build());

        assertThat(result.getBackendName()).isEqualTo(CppBackend.NAME);
        assertThat(result.getPrimary().getFileName()).isEqualTo("pump.cpp");
        assertThat(result.getPrimary().getContent())
                .contains("if (PROGRAM_COUNT % 2 == 0) {", "opcServer.mapVariable(\"Temp1\", \"40001\");",
                        "DefaultPLC is running!");
        assertThat(result.getStructuredText()).isEmpty();
        assertThat(result.getDiagnostics()).isEmpty();
    }

    @Test
    void namesTheRuntimeAfterTheResourceNameForStructuredText() throws Exception {
        CompilationResult result = compiler.compile(
                request("main.st", "PROGRAM Main END_PROGRAM", "nodejs").resourceName("Cell7").build());

        assertThat(result.getPrimary().getContent()).contains("Cell7 is running!");
    }

    @Test
    void compilesProjectResourceAndKeepsTheStructuredText() throws Exception {
        CompilationResult result = compiler.compile(request("plant.iec", fixture("plant.iec"), "nodejs")
                .language(SourceLanguage.LD)
                .resourceName("Line1")
                .build());

        assertThat(result.getBackendName()).isEqualTo(JavaScriptBackend.NAME);
        assertThat(result.getPrimary().getContent()).contains(
                "Line1 is running!",
                "if (PROGRAM_COUNT % 10 == 0) {",
                "opcServer.mapVariable(\"Motor\", \"%QX0.0\");",
                "Motor.value = ");
        assertThat(result.getStructuredText()).hasValueSatisfying(st -> {
            assertThat(st.getFileName()).isEqualTo("plant.st");
            assertThat(st.getContent()).contains("PROGRAM Interlock");
        });
        assertThat(result.getArtifacts()).extracting(a -> a.getFileName())
                .containsExactly("plant.js", "package.json", "plant.st");
    }

    @Test
    void requiresResourceNameForProjects() {
        assertThatThrownBy(() -> compiler.compile(request("plant.iec", fixture("plant.iec"), "linux-x64").build()))
                .isInstanceOf(MissingResourceNameException.class)
                .hasMessageContaining("plant.iec");
    }

    @Test
    void reportsUnknownResource() {
        assertThatThrownBy(() -> compiler.compile(
                request("plant.xml", fixture("plant.iec"), "linux-x64").resourceName("Nope").build()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void validatesExtensionAgainstLanguage() {
        assertThatThrownBy(() -> compiler.compile(
                request("main.st", "PROGRAM Main END_PROGRAM", "nodejs").language(SourceLanguage.LD).build()))
                .isInstanceOf(NodalisException.class)
                .hasMessage("Invalid file extension for language 'ld'. Expected '.iec', got '.st'");
        assertThatThrownBy(() -> compiler.compile(
                request("main.txt", "PROGRAM Main END_PROGRAM", "nodejs").build()))
                .isInstanceOf(NodalisException.class)
                .hasMessage("Invalid file extension for language 'st'. Expected '.st' or '.iec', got '.txt'");
    }

    @Test
    void reportsMissingBackend() {
        assertThatThrownBy(() -> compiler.compile(request("main.st", "PROGRAM Main END_PROGRAM", "zx81").build()))
                .isInstanceOf(NoCompilerFoundException.class);
    }

    @Test
    void rejectsProtocolsTheBackendLacks() {
        assertThatThrownBy(() -> compiler.compile(request("main.st", "PROGRAM Main END_PROGRAM", "generic")
                .protocols(Set.of(Protocol.OPC_UA))
                .build()))
                .isInstanceOf(NodalisException.class)
                .hasMessageContaining("OPC_UA");
    }

    @Test
    void propagatesSyntaxErrors() {
        assertThatThrownBy(() -> compiler.compile(request("bad.st", "PROGRAM Main x := ; END_PROGRAM", "nodejs").build()))
                .isInstanceOf(StructuredTextSyntaxException.class);
    }

    @Test
    void keepsExtractorDiagnostics() throws Exception {
        CompilationResult result = compiler.compile(request("main.st", String.join("\n",
                "//Instance={\"TypeName\":\"Main\",\"Name\":\"M1\",\"AssociatedTaskName\":\"Nowhere\"}",
                "PROGRAM Main END_PROGRAM"), "nodejs").build());

        assertThat(result.getDiagnostics()).extracting(Diagnostic::getKind)
                .containsExactly(Diagnostic.Kind.UNRESOLVED_TASK_REFERENCE);
    }

    @Test
    void compilesSourceWithCommentedOutProgram() throws Exception {
        CompilationResult result = compiler.compile(request("main.st", String.join("\n",
                "PROGRAM A END_PROGRAM",
                "(*",
                "PROGRAM Old",
                "END_PROGRAM",
                "*)"), "linux-x64").build());

        assertThat(result.getPrimary().getContent()).contains("A();").doesNotContain("Old();");
        assertThat(result.getDiagnostics()).extracting(Diagnostic::getKind)
                .containsExactly(Diagnostic.Kind.UNDECLARED_PROGRAM);
    }

    @Test
    void writesArtifactsToDirectory() throws Exception {
        CompilationResult result = compiler.compile(request("main.st", "PROGRAM Main END_PROGRAM", "nodejs").build());

        List<Path> written = result.writeTo(workDir.resolve("out"));

        assertThat(written).extracting(p -> p.getFileName().toString()).containsExactly("main.js", "package.json");
        assertThat(Files.readString(workDir.resolve("out/main.js"))).isEqualTo(result.getPrimary().getContent());
    }

    @Test
    void buildsExecutableThroughTheToolchain() throws Exception {
        CompilationResult result = compiler.compile(request("main.st", "PROGRAM Main END_PROGRAM", "windows-x64")
                .outputKind(OutputKind.EXECUTABLE)
                .build());
        Path out = workDir.resolve("build");
        Files.createDirectories(out);
        Files.writeString(out.resolve("nodalis.cpp"), "// runtime");
        RecordingToolchain toolchain = new RecordingToolchain();

        Path executable = compiler.buildExecutable(result, out, toolchain, ToolchainSettings.defaults());

        assertThat(executable).isEqualTo(out.resolve("main.exe"));
        assertThat(toolchain.target).isEqualTo(new TargetPlatform("windows", "x64"));
        assertThat(toolchain.compiled).extracting(p -> p.getFileName().toString())
                .containsExactly("main.cpp", "nodalis.cpp");
    }

    @Test
    void refusesToLinkJavaScript() throws Exception {
        CompilationResult result = compiler.compile(request("main.st", "PROGRAM Main END_PROGRAM", "nodejs").build());

        assertThatThrownBy(() -> compiler.buildExecutable(result, workDir, new RecordingToolchain(),
                ToolchainSettings.defaults()))
                .isInstanceOf(NodalisException.class)
                .hasMessageContaining("main.js");
    }

    @Test
    void deploysThroughMatchingProgrammer() throws Exception {
        ProgramRequest request = new ProgramRequest(workDir.resolve("main"), "192.168.1.20", null, null);
        List<ProgramRequest> seen = new ArrayList<>();
        DeviceProgrammer accepting = programmer("MTI", seen, true);

        compiler.deploy(request, "mti", List.of(programmer("OTHER", seen, true), accepting));

        assertThat(seen).containsExactly(request);
        assertThatThrownBy(() -> compiler.deploy(request, "MTI", List.of(programmer("MTI", seen, false))))
                .isInstanceOf(NodalisException.class)
                .hasMessageContaining("192.168.1.20");
        assertThatThrownBy(() -> compiler.deploy(request, "ACME", List.of(accepting)))
                .isInstanceOf(NodalisException.class)
                .hasMessageContaining("ACME");
    }

    private static DeviceProgrammer programmer(String target, List<ProgramRequest> seen, boolean accept) {
        return new DeviceProgrammer() {
            @Override
            public String target() {
                return target;
            }

            @Override
            public boolean program(ProgramRequest request) {
                seen.add(request);
                return accept;
            }
        };
    }

    private static final class RecordingToolchain implements BuildToolchain {
        TargetPlatform target;
        final List<Path> compiled = new ArrayList<>();

        @Override
        public ToolchainHandle detect(TargetPlatform target, ToolchainSettings settings) throws NodalisException {
            this.target = target;
            String compiler = settings.compilerFor(target)
                    .orElseThrow(() -> new NodalisException("no compiler for " + target));
            return new ToolchainHandle(target, compiler);
        }

        @Override
        public Path compileObject(ToolchainHandle handle, Path source, List<Path> includeDirectories,
                                  Path outputDirectory) {
            compiled.add(source);
            return outputDirectory.resolve(source.getFileName() + ".o");
        }

        @Override
        public Path linkExecutable(ToolchainHandle handle, List<Path> objects, Path executable) {
            return executable;
        }
    }
}
