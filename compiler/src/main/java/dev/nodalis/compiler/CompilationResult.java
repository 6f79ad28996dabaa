package dev.nodalis.compiler;

import com.google.common.collect.ImmutableList;
import dev.nodalis.backend.GeneratedArtifact;
import dev.nodalis.backend.GeneratedCode;
import dev.nodalis.schedule.Diagnostic;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything one successful compile produced, held in memory until
 * {@link #writeTo(Path)}.
 */
public final class CompilationResult {

    private static final Logger logger = LogManager.getLogger(CompilationResult.class);

    private final String backendName;
    private final String device;
    private final GeneratedCode code;
    private final GeneratedArtifact structuredText;
    private final ImmutableList<Diagnostic> diagnostics;

    CompilationResult(String backendName, String device, GeneratedCode code, GeneratedArtifact structuredText,
                      List<Diagnostic> diagnostics) {
        this.backendName = Objects.requireNonNull(backendName, "backendName");
        this.device = Objects.requireNonNull(device, "device");
        this.code = Objects.requireNonNull(code, "code");
        this.structuredText = structuredText;
        this.diagnostics = ImmutableList.copyOf(diagnostics);
    }

    public String getBackendName() {
        return backendName;
    }

    public String getDevice() {
        return device;
    }

    public GeneratedArtifact getPrimary() {
        return code.getPrimary();
    }

    /**
     * The Structured Text reconstructed from a project resource, when the
     * source was a project file.
     */
    public Optional<GeneratedArtifact> getStructuredText() {
        return Optional.ofNullable(structuredText);
    }

    /**
     * Primary artifact, backend companions, then the reconstructed source.
     */
    public ImmutableList<GeneratedArtifact> getArtifacts() {
        ImmutableList.Builder<GeneratedArtifact> artifacts = ImmutableList.builder();
        artifacts.add(code.getPrimary());
        artifacts.addAll(code.getCompanions());
        if (structuredText != null) {
            artifacts.add(structuredText);
        }
        return artifacts.build();
    }

    /**
     * Static runtime files the caller copies next to the primary artifact.
     */
    public ImmutableList<String> getSupportFiles() {
        return code.getSupportFiles();
    }

    public ImmutableList<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public ImmutableList<Path> writeTo(Path directory) throws IOException {
        Files.createDirectories(directory);
        ImmutableList.Builder<Path> written = ImmutableList.builder();
        for (GeneratedArtifact artifact : getArtifacts()) {
            Path file = directory.resolve(artifact.getFileName());
            Files.writeString(file, artifact.getContent(), StandardCharsets.UTF_8);
            logger.debug("Wrote {}", file);
            written.add(file);
        }
        return written.build();
    }
}
