package dev.nodalis.backend;

import dev.nodalis.NodalisException;

import java.util.Objects;

/**
 * No registered backend supports the requested device, output kind and
 * source language together.
 */
public final class NoCompilerFoundException extends NodalisException {

    private final String device;
    private final OutputKind outputKind;
    private final SourceLanguage language;

    public NoCompilerFoundException(String device, OutputKind outputKind, SourceLanguage language) {
        super("no compiler found for target '" + device + "', output '" + outputKind
                + "' and language '" + language + "'");
        this.device = Objects.requireNonNull(device, "device");
        this.outputKind = Objects.requireNonNull(outputKind, "outputKind");
        this.language = Objects.requireNonNull(language, "language");
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
}
