package dev.nodalis.st.ast;

import java.util.List;

public final class ProgramDeclaration extends PouDeclaration {

    public ProgramDeclaration(int line, String name, List<VariableDeclaration> variables, List<Statement> body) {
        super(line, name, variables, body);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitProgram(this);
    }
}
