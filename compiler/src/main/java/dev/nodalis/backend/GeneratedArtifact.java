package dev.nodalis.backend;

import java.util.Objects;

/**
 * A named text file produced by a compile.
 */
public final class GeneratedArtifact {

    private final String fileName;
    private final String content;

    public GeneratedArtifact(String fileName, String content) {
        this.fileName = Objects.requireNonNull(fileName, "fileName");
        this.content = Objects.requireNonNull(content, "content");
    }

    public String getFileName() {
        return fileName;
    }

    public String getContent() {
        return content;
    }

    @Override
    public String toString() {
        return fileName + " (" + content.length() + " chars)";
    }
}
