package dev.nodalis.st.ast;

/**
 * A statement node. Backends render statements through {@link Visitor}.
 */
public abstract class Statement extends Node {

    protected Statement(int line) {
        super(line);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitAssignment(Assignment assignment);

        R visitCallStatement(CallStatement statement);

        R visitIf(IfStatement statement);

        R visitCase(CaseStatement statement);

        R visitFor(ForStatement statement);

        R visitWhile(WhileStatement statement);

        R visitRepeat(RepeatStatement statement);

        R visitReturn(ReturnStatement statement);

        R visitExit(ExitStatement statement);
    }
}
