package dev.nodalis.backend;

import dev.nodalis.NodalisException;

/**
 * A construct the selected backend has no rendering rule for.
 */
public final class UnrenderableConstructException extends NodalisException {

    private final String backend;
    private final String construct;
    private final int line;

    public UnrenderableConstructException(String backend, String construct, int line, String detail) {
        super(backend + " cannot render " + construct + " at line " + line + ": " + detail);
        this.backend = backend;
        this.construct = construct;
        this.line = line;
    }

    public String getBackend() {
        return backend;
    }

    /**
     * Kind of the offending node, as reported by {@code Node.kind()}.
     */
    public String getConstruct() {
        return construct;
    }

    public int getLine() {
        return line;
    }
}
