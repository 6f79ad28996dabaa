package dev.nodalis.project;

import dev.nodalis.NodalisException;

/**
 * A resource references a body that cannot be expressed as Structured Text,
 * such as a function block diagram or a ladder rung wired through blocks.
 */
public final class UnrenderableResourceException extends NodalisException {

    public UnrenderableResourceException(String message) {
        super(message);
    }
}
