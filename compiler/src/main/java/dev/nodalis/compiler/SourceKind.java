package dev.nodalis.compiler;

import dev.nodalis.NodalisException;
import dev.nodalis.backend.SourceLanguage;

import java.util.Locale;

/**
 * How a source file is read, decided by its extension.
 */
enum SourceKind {
    STRUCTURED_TEXT,
    PROJECT;

    static SourceKind of(String sourceName, SourceLanguage language) throws NodalisException {
        String name = sourceName.toLowerCase(Locale.ROOT);
        boolean project = name.endsWith(".iec") || name.endsWith(".xml");
        if (language == SourceLanguage.LD) {
            if (!project) {
                throw new NodalisException("Invalid file extension for language 'ld'. Expected '.iec', got '"
                        + extension(name) + "'");
            }
            return PROJECT;
        }
        if (project) {
            return PROJECT;
        }
        if (!name.endsWith(".st")) {
            throw new NodalisException("Invalid file extension for language 'st'. Expected '.st' or '.iec', got '"
                    + extension(name) + "'");
        }
        return STRUCTURED_TEXT;
    }

    private static String extension(String name) {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot);
    }
}
