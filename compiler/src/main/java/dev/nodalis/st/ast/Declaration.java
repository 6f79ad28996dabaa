package dev.nodalis.st.ast;

/**
 * A top-level element of a compilation unit.
 */
public abstract class Declaration extends Node {

    protected Declaration(int line) {
        super(line);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitProgram(ProgramDeclaration program);

        R visitFunction(FunctionDeclaration function);

        R visitFunctionBlock(FunctionBlockDeclaration functionBlock);

        R visitGlobalVariables(GlobalVariableBlock block);
    }
}
