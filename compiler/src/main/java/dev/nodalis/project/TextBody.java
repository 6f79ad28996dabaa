package dev.nodalis.project;

import java.util.Objects;

/**
 * A body written directly in Structured Text.
 */
public final class TextBody implements PouBody {

    private final String text;

    public TextBody(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    @Override
    public String language() {
        return "ST";
    }

    @Override
    public String toSourceText() {
        return text.trim();
    }
}
