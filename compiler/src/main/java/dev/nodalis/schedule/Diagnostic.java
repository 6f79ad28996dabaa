package dev.nodalis.schedule;

import java.util.Objects;

/**
 * A non-fatal anomaly found while extracting scheduling metadata. The
 * compile proceeds; the offending directive is left out of the model.
 */
public final class Diagnostic {

    public enum Kind {
        UNRESOLVED_TASK_REFERENCE,
        MALFORMED_DIRECTIVE,
        INVALID_INTERVAL,
        DUPLICATE_TASK,
        UNDECLARED_PROGRAM
    }

    private final Kind kind;
    private final int line;
    private final String message;

    public Diagnostic(Kind kind, int line, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.line = line;
        this.message = Objects.requireNonNull(message, "message");
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 1-based source line of the directive.
     */
    public int getLine() {
        return line;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return kind + " at line " + line + ": " + message;
    }
}
