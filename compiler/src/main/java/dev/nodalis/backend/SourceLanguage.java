package dev.nodalis.backend;

import java.util.Locale;

/**
 * Languages a compile request may be written in. Ladder Diagram sources are
 * converted to Structured Text by the project model before they reach a
 * backend.
 */
public enum SourceLanguage {
    ST,
    LD;

    public static SourceLanguage parse(String text) {
        return valueOf(text.trim().toUpperCase(Locale.ROOT));
    }
}
