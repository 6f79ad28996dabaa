package dev.nodalis.backend.cpp;

import com.google.common.collect.ImmutableMap;
import dev.nodalis.backend.AbstractRenderer;
import dev.nodalis.backend.ElementaryTypes;
import dev.nodalis.backend.Literals;
import dev.nodalis.backend.LogicalOperatorStyle;
import dev.nodalis.st.ast.BitAccess;
import dev.nodalis.st.ast.CompilationUnit;
import dev.nodalis.st.ast.Declaration;
import dev.nodalis.st.ast.FunctionBlockDeclaration;
import dev.nodalis.st.ast.FunctionDeclaration;
import dev.nodalis.st.ast.GlobalVariableBlock;
import dev.nodalis.st.ast.ProgramDeclaration;
import dev.nodalis.st.ast.VariableDeclaration;
import dev.nodalis.st.ast.VariableSection;

import java.util.Optional;
import java.util.StringJoiner;

/**
 * Renders Structured Text as C++ against the {@code nodalis.h} runtime.
 * Programs become functions whose variables are {@code static}, function
 * blocks become classes with public members and an {@code operator()}, and
 * located variables become {@code RefVar<T>} references.
 */
public class CppRenderer extends AbstractRenderer {

    private static final ImmutableMap<String, String> TYPES = ImmutableMap.<String, String>builder()
            .put("BOOL", "bool")
            .put("BYTE", "uint8_t")
            .put("WORD", "uint16_t")
            .put("DWORD", "uint32_t")
            .put("LWORD", "uint64_t")
            .put("SINT", "int8_t")
            .put("INT", "int16_t")
            .put("DINT", "int32_t")
            .put("LINT", "int64_t")
            .put("USINT", "uint8_t")
            .put("UINT", "uint16_t")
            .put("UDINT", "uint32_t")
            .put("ULINT", "uint64_t")
            .put("REAL", "float")
            .put("LREAL", "double")
            .put("TIME", "uint32_t")
            .put("LTIME", "uint64_t")
            .put("DATE", "std::string")
            .put("TIME_OF_DAY", "std::string")
            .put("TOD", "std::string")
            .put("DATE_AND_TIME", "std::string")
            .put("DT", "std::string")
            .put("STRING", "std::string")
            .put("WSTRING", "std::wstring")
            .build();

    public CppRenderer() {
        this(CppBackend.NAME, LogicalOperatorStyle.SHORT_CIRCUIT);
    }

    protected CppRenderer(String backendName, LogicalOperatorStyle logicalStyle) {
        super(backendName, logicalStyle);
    }

    /**
     * C++ spelling of a declared type; function block types keep their name.
     */
    public static String typeOf(String typeName) {
        String type = TYPES.get(ElementaryTypes.baseName(typeName));
        return type != null ? type : typeName.trim();
    }

    @Override
    protected void beginUnit(CompilationUnit unit) {
        boolean any = false;
        for (Declaration declaration : unit.getDeclarations()) {
            if (declaration instanceof FunctionDeclaration) {
                out.line(signature((FunctionDeclaration) declaration) + ";");
                any = true;
            }
        }
        if (any) {
            out.blank();
        }
    }

    @Override
    public Void visitGlobalVariables(GlobalVariableBlock block) {
        for (VariableDeclaration variable : block.getVariables()) {
            declare(variable, "").ifPresent(out::line);
        }
        out.blank();
        return null;
    }

    @Override
    public Void visitFunctionBlock(FunctionBlockDeclaration functionBlock) {
        enter(functionBlock);
        out.open("class " + functionBlock.getName() + " {");
        out.line("public:");
        for (VariableDeclaration variable : functionBlock.getVariables()) {
            declare(variable, "").ifPresent(out::line);
        }
        out.blank();
        out.open("void operator()() {");
        renderBody(functionBlock.getBody());
        out.close("}");
        out.close("};");
        out.blank();
        leave();
        return null;
    }

    @Override
    public Void visitFunction(FunctionDeclaration function) {
        enter(function);
        out.open(signature(function) + " {");
        out.line(typeOf(function.getReturnType()) + " " + resultName(function) + "{};");
        for (VariableDeclaration variable : function.getVariables()) {
            if (!isParameter(variable)) {
                declare(variable, "").ifPresent(out::line);
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
        out.open("void " + program.getName() + "() {");
        for (VariableDeclaration variable : program.getVariables()) {
            String storage = variable.getSection() == VariableSection.VAR_TEMP ? "" : "static ";
            declare(variable, storage).ifPresent(out::line);
        }
        renderBody(program.getBody());
        out.close("}");
        out.blank();
        leave();
        return null;
    }

    private String signature(FunctionDeclaration function) {
        StringJoiner parameters = new StringJoiner(", ", "(", ")");
        for (VariableDeclaration parameter : parametersOf(function)) {
            String reference = parameter.getSection() == VariableSection.VAR_IN_OUT ? "& " : " ";
            parameters.add(typeOf(parameter.getTypeName()) + reference + parameter.getName());
        }
        return typeOf(function.getReturnType()) + " " + function.getName() + parameters;
    }

    /**
     * Declaration of one variable with the given storage prefix, or empty
     * when the variable is declared elsewhere.
     */
    protected Optional<String> declare(VariableDeclaration variable, String storage) {
        if (variable.getSection() == VariableSection.VAR_EXTERNAL) {
            return Optional.empty();
        }
        String type = typeOf(variable.getTypeName());
        if (isLocated(variable)) {
            return Optional.of(storage + "RefVar<" + type + "> " + variable.getName()
                    + "{" + Literals.quote(variable.getAddress().orElseThrow()) + "};");
        }
        if (isInstance(variable)) {
            return Optional.of(storage + type + " " + variable.getName() + ";");
        }
        String constant = variable.isConstant() ? "const " : "";
        String initializer = initialValue(variable).map(value -> " = " + value).orElse("{}");
        return Optional.of(storage + constant + type + " " + variable.getName() + initializer + ";");
    }

    @Override
    protected String readLocated(VariableDeclaration variable, String reference) {
        return reference;
    }

    @Override
    protected String writeLocated(VariableDeclaration variable, String reference, String value) {
        return reference + " = " + value + ";";
    }

    @Override
    protected String readBit(BitAccess access, String target) {
        return "getBit(&" + target + ", " + access.getBit() + ")";
    }

    @Override
    protected String writeBit(BitAccess access, String target, String value) {
        return "setBit(&" + target + ", " + access.getBit() + ", " + value + ");";
    }

    @Override
    protected String power(String base, String exponent) {
        return "pow(" + base + ", " + exponent + ")";
    }

    @Override
    protected String stringLiteral(String value, boolean wide) {
        return (wide ? "L" : "") + Literals.quote(value);
    }

    @Override
    protected String invokeInstance(String instance) {
        return instance + "();";
    }

    @Override
    protected String declareTemporary(String name, String value) {
        return "const auto " + name + " = " + value + ";";
    }
}
