package dev.nodalis.st;

import dev.nodalis.NodalisException;

/**
 * First lexical or grammatical error found in a Structured Text source.
 * Lines are 1-based, columns 0-based.
 */
public final class StructuredTextSyntaxException extends NodalisException {

    private final int line;
    private final int column;
    private final String detail;

    public StructuredTextSyntaxException(int line, int column, String detail) {
        super("line " + line + ":" + column + " " + detail);
        this.line = line;
        this.column = column;
        this.detail = detail;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getDetail() {
        return detail;
    }
}
