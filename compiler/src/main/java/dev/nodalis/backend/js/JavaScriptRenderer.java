package dev.nodalis.backend.js;

import dev.nodalis.backend.AbstractRenderer;
import dev.nodalis.backend.ElementaryTypes;
import dev.nodalis.backend.Literals;
import dev.nodalis.backend.LogicalOperatorStyle;
import dev.nodalis.st.ast.BitAccess;
import dev.nodalis.st.ast.FunctionBlockDeclaration;
import dev.nodalis.st.ast.FunctionDeclaration;
import dev.nodalis.st.ast.GlobalVariableBlock;
import dev.nodalis.st.ast.ProgramDeclaration;
import dev.nodalis.st.ast.VariableDeclaration;
import dev.nodalis.st.ast.VariableSection;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders Structured Text as JavaScript. A program is a function closed over
 * its variables, so they keep their values between ticks; a function block
 * is a class whose {@code call()} runs the body against {@code this}; located
 * variables are runtime references read and written through {@code .value}.
 */
final class JavaScriptRenderer extends AbstractRenderer {

    private final JavaScriptDialect dialect;

    JavaScriptRenderer(JavaScriptDialect dialect) {
        super(JavaScriptBackend.NAME, LogicalOperatorStyle.SHORT_CIRCUIT);
        this.dialect = dialect;
    }

    private String exported() {
        return dialect.usesModules() ? "export " : "";
    }

    @Override
    public Void visitGlobalVariables(GlobalVariableBlock block) {
        for (VariableDeclaration variable : block.getVariables()) {
            out.line(exported() + keyword(variable) + " " + variable.getName() + " = "
                    + initializer(variable, variable.getName()) + ";");
        }
        out.blank();
        return null;
    }

    @Override
    public Void visitFunctionBlock(FunctionBlockDeclaration functionBlock) {
        enter(functionBlock);
        out.open(exported() + "class " + functionBlock.getName() + " {");
        out.open("constructor() {");
        for (VariableDeclaration variable : functionBlock.getVariables()) {
            if (variable.getSection() != VariableSection.VAR_EXTERNAL) {
                out.line("this." + variable.getName() + " = " + initializer(variable, null) + ";");
            }
        }
        out.close("}");
        out.blank();
        out.open("call() {");
        renderBody(functionBlock.getBody());
        out.close("}");
        out.close("}");
        out.blank();
        leave();
        return null;
    }

    @Override
    public Void visitFunction(FunctionDeclaration function) {
        enter(function);
        StringJoiner parameters = new StringJoiner(", ", "(", ")");
        for (VariableDeclaration parameter : parametersOf(function)) {
            parameters.add(parameter.getName());
        }
        out.open(exported() + "function " + function.getName() + parameters + " {");
        out.line("let " + resultName(function) + " = " + defaultValue(function.getReturnType()) + ";");
        for (VariableDeclaration variable : function.getVariables()) {
            if (!isParameter(variable) && variable.getSection() != VariableSection.VAR_EXTERNAL) {
                out.line(keyword(variable) + " " + variable.getName() + " = "
                        + initializer(variable, function.getName() + "." + variable.getName()) + ";");
            }
        }
        renderBody(function.getBody());
        out.line("return " + resultName(function) + ";");
        out.close("}");
        out.blank();
        leave();
        return null;
    }

    @Override
    public Void visitProgram(ProgramDeclaration program) {
        enter(program);
        List<VariableDeclaration> temporaries = new ArrayList<>();
        out.open(exported() + "const " + program.getName() + " = (() => {");
        for (VariableDeclaration variable : program.getVariables()) {
            if (variable.getSection() == VariableSection.VAR_TEMP) {
                temporaries.add(variable);
            } else if (variable.getSection() != VariableSection.VAR_EXTERNAL) {
                out.line(keyword(variable) + " " + variable.getName() + " = "
                        + initializer(variable, program.getName() + "." + variable.getName()) + ";");
            }
        }
        out.open("return function " + program.getName() + "() {");
        for (VariableDeclaration variable : temporaries) {
            out.line("let " + variable.getName() + " = " + initializer(variable, null) + ";");
        }
        renderBody(program.getBody());
        out.close("};");
        out.close("})();");
        out.blank();
        leave();
        return null;
    }

    private static String keyword(VariableDeclaration variable) {
        boolean fixed = variable.isConstant() || isLocated(variable) || isInstance(variable);
        return fixed ? "const" : "let";
    }

    /**
     * Initial value of a variable. Function block instances outside a class
     * are shared through {@code newStatic} under {@code staticKey}.
     */
    private String initializer(VariableDeclaration variable, String staticKey) {
        if (isLocated(variable)) {
            return "createReference(" + Literals.quote(variable.getAddress().orElseThrow()) + ")";
        }
        if (isInstance(variable)) {
            String type = variable.getTypeName().trim();
            if (staticKey == null) {
                return "new " + type + "()";
            }
            return "newStatic(" + Literals.quote(staticKey) + ", " + type + ")";
        }
        return initialValue(variable).orElse(defaultValue(variable.getTypeName()));
    }

    private static String defaultValue(String typeName) {
        switch (ElementaryTypes.baseName(typeName)) {
            case "BOOL":
                return "false";
            case "STRING":
            case "WSTRING":
            case "DATE":
            case "TIME_OF_DAY":
            case "TOD":
            case "DATE_AND_TIME":
            case "DT":
                return "\"\"";
            default:
                return "0";
        }
    }

    @Override
    protected String variableName(VariableDeclaration declaration, String lexeme) {
        if (declaration != null && scope() != null && scope().isFunctionBlock() && isLocal(declaration)) {
            return "this." + lexeme;
        }
        return lexeme;
    }

    @Override
    protected String readLocated(VariableDeclaration variable, String reference) {
        return reference + ".value";
    }

    @Override
    protected String writeLocated(VariableDeclaration variable, String reference, String value) {
        return reference + ".value = " + value + ";";
    }

    @Override
    protected String readBit(BitAccess access, String target) {
        if (declarationOf(access.getTarget()).filter(variable -> isLocated(variable)).isPresent()) {
            return "getBit(" + target + ", " + access.getBit() + ")";
        }
        return "(((" + target + " >> " + access.getBit() + ") & 1) === 1)";
    }

    @Override
    protected String writeBit(BitAccess access, String target, String value) {
        if (declarationOf(access.getTarget()).filter(variable -> isLocated(variable)).isPresent()) {
            return "setBit(" + target + ", " + access.getBit() + ", " + value + ");";
        }
        String mask = "(1 << " + access.getBit() + ")";
        return target + " = (" + value + ") ? (" + target + " | " + mask + ") : (" + target + " & ~" + mask + ");";
    }

    @Override
    protected String power(String base, String exponent) {
        return "Math.pow(" + base + ", " + exponent + ")";
    }

    @Override
    protected String stringLiteral(String value, boolean wide) {
        return Literals.quote(value);
    }

    @Override
    protected String invokeInstance(String instance) {
        return instance + ".call();";
    }

    @Override
    protected String declareTemporary(String name, String value) {
        return "const " + name + " = " + value + ";";
    }
}
