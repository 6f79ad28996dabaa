package dev.nodalis.toolchain;

import dev.nodalis.NodalisException;

/**
 * Uploads a compiled runtime to a controller over a vendor protocol.
 */
public interface DeviceProgrammer {

    /**
     * Programming target this programmer serves, for example {@code MTI}.
     */
    String target();

    /**
     * @return whether the device accepted the program
     */
    boolean program(ProgramRequest request) throws NodalisException;
}
