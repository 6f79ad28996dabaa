package dev.nodalis.project;

/**
 * The {@code <MainBody>} of a program or function block, in whichever
 * graphical or textual language it was authored.
 */
public interface PouBody {

    String language();

    /**
     * The body as Structured Text statements.
     *
     * @throws UnrenderableResourceException if the body has no Structured Text form
     */
    String toSourceText() throws UnrenderableResourceException;
}
