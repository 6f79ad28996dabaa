package dev.nodalis.compiler;

import dev.nodalis.NodalisException;

/**
 * A project file was submitted without naming the resource to compile.
 */
public final class MissingResourceNameException extends NodalisException {

    public MissingResourceNameException(String sourceName) {
        super("You must provide a resource name to compile the IEC project file " + sourceName);
    }
}
