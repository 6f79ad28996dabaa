package dev.nodalis.project;

import dev.nodalis.NodalisException;

/**
 * The project text is not well-formed XML or lacks the structure a project
 * needs (at least one configuration, uniquely named resources).
 */
public final class MalformedProjectException extends NodalisException {

    public MalformedProjectException(String message) {
        super(message);
    }

    public MalformedProjectException(String message, Throwable cause) {
        super(message, cause);
    }
}
