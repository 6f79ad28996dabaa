package dev.nodalis.st.ast;

/**
 * An expression node. Backends render expressions through {@link Visitor}.
 */
public abstract class Expression extends Node {

    protected Expression(int line) {
        super(line);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitLiteral(Literal literal);

        R visitVariableReference(VariableReference reference);

        R visitDirectAddress(DirectAddress address);

        R visitMemberAccess(MemberAccess access);

        R visitBitAccess(BitAccess access);

        R visitUnary(UnaryExpression expression);

        R visitBinary(BinaryExpression expression);

        R visitParenthesized(ParenthesizedExpression expression);

        R visitCall(CallExpression call);
    }
}
