package dev.nodalis.backend;

/**
 * Line-oriented emitter with two-space indentation.
 */
public final class CodeWriter {

    private final StringBuilder out = new StringBuilder();
    private int level;

    public CodeWriter line(String text) {
        if (!text.isEmpty()) {
            indent(out, level);
            out.append(text);
        }
        out.append('\n');
        return this;
    }

    public CodeWriter blank() {
        out.append('\n');
        return this;
    }

    /**
     * Writes {@code text} and indents everything after it one level.
     */
    public CodeWriter open(String text) {
        line(text);
        level++;
        return this;
    }

    /**
     * Drops one indentation level and writes {@code text}.
     */
    public CodeWriter close(String text) {
        if (level == 0) {
            throw new IllegalStateException("unbalanced close: " + text);
        }
        level--;
        line(text);
        return this;
    }

    /**
     * Closes the current block and opens the next one, for {@code else} and
     * {@code else if} arms.
     */
    public CodeWriter reopen(String text) {
        close(text);
        level++;
        return this;
    }

    public CodeWriter indent() {
        level++;
        return this;
    }

    public CodeWriter outdent() {
        if (level == 0) {
            throw new IllegalStateException("unbalanced outdent");
        }
        level--;
        return this;
    }

    /**
     * Copies a pre-rendered block, re-indenting each of its lines.
     */
    public CodeWriter block(String text) {
        for (String line : text.split("\n", -1)) {
            line(line);
        }
        return this;
    }

    public int level() {
        return level;
    }

    @Override
    public String toString() {
        return out.toString();
    }

    private static void indent(StringBuilder builder, int level) {
        for (int i = 0; i < level; i++) {
            builder.append("  ");
        }
    }
}
