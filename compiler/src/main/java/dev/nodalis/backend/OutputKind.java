package dev.nodalis.backend;

import java.util.Locale;

/**
 * What a compile request asks for. {@link #LIBRARY} is the logic-only
 * configuration of a backend: the same renderer, without the start-up and
 * scheduler scaffolding.
 */
public enum OutputKind {
    SOURCE_CODE("code"),
    EXECUTABLE("executable"),
    LIBRARY("library");

    private final String id;

    OutputKind(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public boolean includesRuntime() {
        return this != LIBRARY;
    }

    /**
     * Accepts either the short id ({@code code}) or the constant name
     * ({@code SOURCE_CODE}), ignoring case.
     */
    public static OutputKind parse(String text) {
        String value = text.trim();
        for (OutputKind kind : values()) {
            if (kind.id.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown output kind: " + text);
    }

    @Override
    public String toString() {
        return id;
    }

    static String describe(Iterable<OutputKind> kinds) {
        StringBuilder builder = new StringBuilder();
        for (OutputKind kind : kinds) {
            if (builder.length() > 0) {
                builder.append(", ");
            }
            builder.append(kind.id.toLowerCase(Locale.ROOT));
        }
        return builder.toString();
    }
}
