package dev.nodalis.backend;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Output of one backend run: the primary source file, any companion files the
 * backend writes itself, and the names of the static support files that must
 * be placed next to the primary file before an external build.
 */
public final class GeneratedCode {

    private final GeneratedArtifact primary;
    private final ImmutableList<GeneratedArtifact> companions;
    private final ImmutableList<String> supportFiles;

    public GeneratedCode(GeneratedArtifact primary, List<GeneratedArtifact> companions, List<String> supportFiles) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.companions = ImmutableList.copyOf(companions);
        this.supportFiles = ImmutableList.copyOf(supportFiles);
    }

    public GeneratedArtifact getPrimary() {
        return primary;
    }

    public ImmutableList<GeneratedArtifact> getCompanions() {
        return companions;
    }

    public ImmutableList<String> getSupportFiles() {
        return supportFiles;
    }
}
