package dev.nodalis.compiler;

import com.google.common.collect.ImmutableSet;
import dev.nodalis.backend.OutputKind;
import dev.nodalis.backend.Protocol;
import dev.nodalis.backend.SourceLanguage;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One immutable compile request: the source, the target triple, and for
 * project files the resource to compile.
 */
public final class CompileRequest {

    private final String sourceName;
    private final Path sourcePath;
    private final String sourceText;
    private final String device;
    private final OutputKind outputKind;
    private final SourceLanguage language;
    private final String resourceName;
    private final ImmutableSet<Protocol> protocols;

    private CompileRequest(Builder builder) {
        this.sourceName = Objects.requireNonNull(builder.sourceName, "source");
        this.sourcePath = builder.sourcePath;
        this.sourceText = builder.sourceText;
        this.device = Objects.requireNonNull(builder.device, "device");
        this.outputKind = Objects.requireNonNull(builder.outputKind, "outputKind");
        this.language = Objects.requireNonNull(builder.language, "language");
        this.resourceName = builder.resourceName == null || builder.resourceName.isBlank()
                ? null : builder.resourceName.trim();
        this.protocols = ImmutableSet.copyOf(builder.protocols);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * File name of the source; its extension selects how it is read.
     */
    public String getSourceName() {
        return sourceName;
    }

    public Optional<Path> getSourcePath() {
        return Optional.ofNullable(sourcePath);
    }

    /**
     * Source text supplied in memory, if any; otherwise it is read from
     * {@link #getSourcePath()}.
     */
    public Optional<String> getSourceText() {
        return Optional.ofNullable(sourceText);
    }

    public String getDevice() {
        return device;
    }

    public OutputKind getOutputKind() {
        return outputKind;
    }

    public SourceLanguage getLanguage() {
        return language;
    }

    public Optional<String> getResourceName() {
        return Optional.ofNullable(resourceName);
    }

    public ImmutableSet<Protocol> getProtocols() {
        return protocols;
    }

    /**
     * Source file name without its extension.
     */
    public String getBaseName() {
        int dot = sourceName.lastIndexOf('.');
        return dot > 0 ? sourceName.substring(0, dot) : sourceName;
    }

    public static final class Builder {
        private String sourceName;
        private Path sourcePath;
        private String sourceText;
        private String device;
        private OutputKind outputKind = OutputKind.SOURCE_CODE;
        private SourceLanguage language = SourceLanguage.ST;
        private String resourceName;
        private Set<Protocol> protocols = ImmutableSet.of();

        private Builder() {
        }

        public Builder sourceFile(Path path) {
            this.sourcePath = Objects.requireNonNull(path, "path");
            this.sourceName = path.getFileName().toString();
            this.sourceText = null;
            return this;
        }

        public Builder sourceText(String name, String text) {
            this.sourceName = Objects.requireNonNull(name, "name");
            this.sourceText = Objects.requireNonNull(text, "text");
            this.sourcePath = null;
            return this;
        }

        public Builder device(String device) {
            this.device = device;
            return this;
        }

        public Builder outputKind(OutputKind outputKind) {
            this.outputKind = outputKind;
            return this;
        }

        public Builder language(SourceLanguage language) {
            this.language = language;
            return this;
        }

        public Builder resourceName(String resourceName) {
            this.resourceName = resourceName;
            return this;
        }

        public Builder protocols(Set<Protocol> protocols) {
            this.protocols = Objects.requireNonNull(protocols, "protocols");
            return this;
        }

        public CompileRequest build() {
            return new CompileRequest(this);
        }
    }
}
