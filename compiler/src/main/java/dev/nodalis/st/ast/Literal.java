package dev.nodalis.st.ast;

import java.util.Objects;

/**
 * A literal value. The lexeme is kept exactly as written so that backends can
 * reproduce it or convert it faithfully.
 */
public final class Literal extends Expression {

    public enum Kind {
        INTEGER,
        BASED_INTEGER,
        REAL,
        BOOLEAN,
        STRING,
        WIDE_STRING,
        TYPED
    }

    private final Kind literalKind;
    private final String lexeme;

    public Literal(int line, Kind literalKind, String lexeme) {
        super(line);
        this.literalKind = Objects.requireNonNull(literalKind, "literalKind");
        this.lexeme = Objects.requireNonNull(lexeme, "lexeme");
    }

    public Kind getLiteralKind() {
        return literalKind;
    }

    public String getLexeme() {
        return lexeme;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
