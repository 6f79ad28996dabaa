package dev.nodalis.st.ast;

import java.util.Objects;

/**
 * {@code target.member}, typically a function block instance field.
 */
public final class MemberAccess extends Expression {

    private final Expression target;
    private final String member;

    public MemberAccess(int line, Expression target, String member) {
        super(line);
        this.target = Objects.requireNonNull(target, "target");
        this.member = Objects.requireNonNull(member, "member");
    }

    public Expression getTarget() {
        return target;
    }

    public String getMember() {
        return member;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMemberAccess(this);
    }
}
