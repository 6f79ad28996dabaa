package dev.nodalis.st.ast;

import java.util.List;
import java.util.Objects;

public final class FunctionDeclaration extends PouDeclaration {

    private final String returnType;

    public FunctionDeclaration(int line, String name, String returnType,
                               List<VariableDeclaration> variables, List<Statement> body) {
        super(line, name, variables, body);
        this.returnType = Objects.requireNonNull(returnType, "returnType");
    }

    public String getReturnType() {
        return returnType;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}
