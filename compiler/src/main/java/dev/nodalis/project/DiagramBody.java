package dev.nodalis.project;

/**
 * A function block diagram body. Networks are recognised but not converted.
 */
public final class DiagramBody implements PouBody {

    private final String owner;
    private final int networkCount;

    public DiagramBody(String owner, int networkCount) {
        this.owner = owner;
        this.networkCount = networkCount;
    }

    @Override
    public String language() {
        return "FBD";
    }

    public int getNetworkCount() {
        return networkCount;
    }

    @Override
    public String toSourceText() throws UnrenderableResourceException {
        throw new UnrenderableResourceException(
                owner + " has a function block diagram body (" + networkCount + " network(s)) which cannot be converted to Structured Text");
    }
}
