package dev.nodalis;

/**
 * Base type of every failure that aborts a compile request. Subclasses carry
 * the context a caller needs to act on the failure.
 */
public class NodalisException extends Exception {

    public NodalisException(String message) {
        super(message);
    }

    public NodalisException(String message, Throwable cause) {
        super(message, cause);
    }
}
