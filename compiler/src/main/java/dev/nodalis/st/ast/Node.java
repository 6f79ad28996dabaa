package dev.nodalis.st.ast;

/**
 * Base type of every Structured Text syntax node. Nodes are immutable and
 * remember the source line they were parsed from so that later stages can
 * report problems against the original text.
 */
public abstract class Node {

    private final int line;

    protected Node(int line) {
        this.line = line;
    }

    public int getLine() {
        return line;
    }

    /**
     * Short, human readable name of the construct, used in diagnostics.
     */
    public String kind() {
        return getClass().getSimpleName();
    }
}
