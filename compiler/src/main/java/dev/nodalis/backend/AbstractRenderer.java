package dev.nodalis.backend;

import dev.nodalis.st.ast.Argument;
import dev.nodalis.st.ast.Assignment;
import dev.nodalis.st.ast.BinaryExpression;
import dev.nodalis.st.ast.BinaryOperator;
import dev.nodalis.st.ast.BitAccess;
import dev.nodalis.st.ast.CallExpression;
import dev.nodalis.st.ast.CallStatement;
import dev.nodalis.st.ast.CaseBranch;
import dev.nodalis.st.ast.CaseLabel;
import dev.nodalis.st.ast.CaseStatement;
import dev.nodalis.st.ast.CompilationUnit;
import dev.nodalis.st.ast.ConditionalBranch;
import dev.nodalis.st.ast.Declaration;
import dev.nodalis.st.ast.DirectAddress;
import dev.nodalis.st.ast.ExitStatement;
import dev.nodalis.st.ast.Expression;
import dev.nodalis.st.ast.ForStatement;
import dev.nodalis.st.ast.FunctionBlockDeclaration;
import dev.nodalis.st.ast.FunctionDeclaration;
import dev.nodalis.st.ast.GlobalVariableBlock;
import dev.nodalis.st.ast.IfStatement;
import dev.nodalis.st.ast.Literal;
import dev.nodalis.st.ast.MemberAccess;
import dev.nodalis.st.ast.Node;
import dev.nodalis.st.ast.ParenthesizedExpression;
import dev.nodalis.st.ast.PouDeclaration;
import dev.nodalis.st.ast.ProgramDeclaration;
import dev.nodalis.st.ast.RepeatStatement;
import dev.nodalis.st.ast.ReturnStatement;
import dev.nodalis.st.ast.Statement;
import dev.nodalis.st.ast.UnaryExpression;
import dev.nodalis.st.ast.UnaryOperator;
import dev.nodalis.st.ast.VariableDeclaration;
import dev.nodalis.st.ast.VariableReference;
import dev.nodalis.st.ast.VariableSection;
import dev.nodalis.st.ast.WhileStatement;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Tree-walking renderer shared by the C-family backends. Statements and
 * expressions have one rendering rule each here; subclasses supply the
 * declaration syntax and the few constructs whose spelling differs between
 * targets (located variables, bit access, power, strings, instance calls).
 * <p>
 * A renderer instance renders exactly one compilation unit.
 */
public abstract class AbstractRenderer
        implements Declaration.Visitor<Void>, Statement.Visitor<Void>, Expression.Visitor<String> {

    /**
     * Variables visible inside the program organisation unit being rendered.
     */
    protected static final class Scope {
        private final PouDeclaration pou;
        private final Map<String, VariableDeclaration> variables = new HashMap<>();

        Scope(PouDeclaration pou) {
            this.pou = pou;
            for (VariableDeclaration variable : pou.getVariables()) {
                variables.put(key(variable.getName()), variable);
            }
        }

        public PouDeclaration getPou() {
            return pou;
        }

        public boolean isFunction() {
            return pou instanceof FunctionDeclaration;
        }

        public boolean isFunctionBlock() {
            return pou instanceof FunctionBlockDeclaration;
        }

        public Optional<VariableDeclaration> find(String name) {
            return Optional.ofNullable(variables.get(key(name)));
        }

        boolean isResult(String name) {
            return isFunction() && pou.getName().equalsIgnoreCase(name);
        }
    }

    /**
     * Carries an unrenderable construct out of the visitor methods, which
     * cannot throw checked exceptions.
     */
    private static final class RenderFailure extends RuntimeException {
        private final String construct;
        private final int line;

        RenderFailure(Node node, String detail) {
            super(detail);
            this.construct = node.kind();
            this.line = node.getLine();
        }
    }

    protected final CodeWriter out = new CodeWriter();

    private final String backendName;
    private final LogicalOperatorStyle logicalStyle;
    private final Map<String, VariableDeclaration> globals = new HashMap<>();
    private final Map<String, FunctionDeclaration> functions = new HashMap<>();
    private final Map<String, FunctionBlockDeclaration> functionBlocks = new HashMap<>();
    private Scope scope;
    private int loopDepth;
    private int temporaries;
    private boolean rendered;

    protected AbstractRenderer(String backendName, LogicalOperatorStyle logicalStyle) {
        this.backendName = backendName;
        this.logicalStyle = logicalStyle;
    }

    public final String render(CompilationUnit unit) throws UnrenderableConstructException {
        if (rendered) {
            throw new IllegalStateException("renderer already used");
        }
        rendered = true;
        index(unit);
        try {
            beginUnit(unit);
            for (Declaration declaration : declarationOrder(unit)) {
                declaration.accept(this);
            }
        } catch (RenderFailure failure) {
            throw new UnrenderableConstructException(backendName, failure.construct, failure.line, failure.getMessage());
        }
        return out.toString();
    }

    private void index(CompilationUnit unit) {
        for (Declaration declaration : unit.getDeclarations()) {
            if (declaration instanceof GlobalVariableBlock) {
                for (VariableDeclaration variable : ((GlobalVariableBlock) declaration).getVariables()) {
                    globals.put(key(variable.getName()), variable);
                }
            } else if (declaration instanceof FunctionDeclaration) {
                FunctionDeclaration function = (FunctionDeclaration) declaration;
                functions.put(key(function.getName()), function);
            } else if (declaration instanceof FunctionBlockDeclaration) {
                FunctionBlockDeclaration functionBlock = (FunctionBlockDeclaration) declaration;
                functionBlocks.put(key(functionBlock.getName()), functionBlock);
            }
        }
    }

    /**
     * Global variables first, then function blocks, functions and programs,
     * each group in source order, so that every name is defined before the
     * code that uses it runs.
     */
    protected List<Declaration> declarationOrder(CompilationUnit unit) {
        List<Declaration> ordered = new ArrayList<>();
        addAll(ordered, unit, GlobalVariableBlock.class);
        addAll(ordered, unit, FunctionBlockDeclaration.class);
        addAll(ordered, unit, FunctionDeclaration.class);
        addAll(ordered, unit, ProgramDeclaration.class);
        return ordered;
    }

    private static void addAll(List<Declaration> ordered, CompilationUnit unit, Class<? extends Declaration> type) {
        for (Declaration declaration : unit.getDeclarations()) {
            if (type.isInstance(declaration)) {
                ordered.add(declaration);
            }
        }
    }

    /**
     * Called once before the first declaration is rendered.
     */
    protected void beginUnit(CompilationUnit unit) {
    }

    // -----------------------------------------------------------------------
    // Target-specific spelling
    // -----------------------------------------------------------------------

    /**
     * Read of a variable declared {@code AT} a direct address.
     */
    protected abstract String readLocated(VariableDeclaration variable, String reference);

    protected abstract String writeLocated(VariableDeclaration variable, String reference, String value);

    protected abstract String readBit(BitAccess access, String target);

    protected abstract String writeBit(BitAccess access, String target, String value);

    protected abstract String power(String base, String exponent);

    protected abstract String stringLiteral(String value, boolean wide);

    protected abstract String invokeInstance(String instance);

    protected abstract String declareTemporary(String name, String value);

    /**
     * How a variable of the current scope or a global is spelled.
     */
    protected String variableName(VariableDeclaration declaration, String lexeme) {
        return lexeme;
    }

    protected String resultName(FunctionDeclaration function) {
        return function.getName() + "_result";
    }

    // -----------------------------------------------------------------------
    // Helpers for subclasses
    // -----------------------------------------------------------------------

    protected final void enter(PouDeclaration pou) {
        if (scope != null) {
            throw new IllegalStateException("nested scope for " + pou.getName());
        }
        scope = new Scope(pou);
        loopDepth = 0;
    }

    protected final void leave() {
        scope = null;
    }

    protected final Scope scope() {
        return scope;
    }

    protected final void renderBody(List<Statement> body) {
        for (Statement statement : body) {
            statement.accept(this);
        }
    }

    protected final String expression(Expression expression) {
        return expression.accept(this);
    }

    protected final Optional<String> initialValue(VariableDeclaration variable) {
        return variable.getInitialValue().map(this::expression);
    }

    protected final RuntimeException unrenderable(Node node, String detail) {
        return new RenderFailure(node, detail);
    }

    /**
     * Resolves a name against the current scope, then the globals. A
     * {@code VAR_EXTERNAL} declaration resolves to the global it names.
     */
    protected final Optional<VariableDeclaration> lookup(String name) {
        VariableDeclaration global = globals.get(key(name));
        if (scope != null) {
            Optional<VariableDeclaration> local = scope.find(name);
            if (local.isPresent()) {
                if (local.get().getSection() == VariableSection.VAR_EXTERNAL && global != null) {
                    return Optional.of(global);
                }
                return local;
            }
        }
        return Optional.ofNullable(global);
    }

    protected final boolean isLocal(VariableDeclaration variable) {
        return scope != null && scope.find(variable.getName()).orElse(null) == variable;
    }

    protected static boolean isLocated(VariableDeclaration variable) {
        return variable.getAddress().isPresent();
    }

    protected static boolean isInstance(VariableDeclaration variable) {
        return !ElementaryTypes.isElementary(variable.getTypeName());
    }

    protected final Optional<FunctionBlockDeclaration> findFunctionBlock(String typeName) {
        return Optional.ofNullable(functionBlocks.get(key(typeName)));
    }

    /**
     * {@code VAR_INPUT} and {@code VAR_IN_OUT} variables in declaration order;
     * the parameter list of a function and the positional inputs of a
     * function block.
     */
    protected static List<VariableDeclaration> parametersOf(PouDeclaration pou) {
        List<VariableDeclaration> parameters = new ArrayList<>();
        for (VariableDeclaration variable : pou.getVariables()) {
            if (isParameter(variable)) {
                parameters.add(variable);
            }
        }
        return parameters;
    }

    protected static boolean isParameter(VariableDeclaration variable) {
        return variable.getSection() == VariableSection.VAR_INPUT
                || variable.getSection() == VariableSection.VAR_IN_OUT;
    }

    /**
     * The declaration behind a plain variable reference, if any.
     */
    protected final Optional<VariableDeclaration> declarationOf(Expression target) {
        if (target instanceof VariableReference) {
            return lookup(((VariableReference) target).getName());
        }
        return Optional.empty();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    // -----------------------------------------------------------------------
    // Statements
    // -----------------------------------------------------------------------

    @Override
    public Void visitAssignment(Assignment assignment) {
        out.line(store(assignment.getTarget(), expression(assignment.getValue())));
        return null;
    }

    private String store(Expression target, String value) {
        if (target instanceof VariableReference) {
            String name = ((VariableReference) target).getName();
            if (scope != null && scope.isResult(name)) {
                return resultName((FunctionDeclaration) scope.getPou()) + " = " + value + ";";
            }
            Optional<VariableDeclaration> declaration = lookup(name);
            String reference = variableName(declaration.orElse(null), name);
            if (declaration.isPresent() && isLocated(declaration.get())) {
                return writeLocated(declaration.get(), reference, value);
            }
            return reference + " = " + value + ";";
        }
        if (target instanceof DirectAddress) {
            return "writeAddress(" + Literals.quote(((DirectAddress) target).getAddress()) + ", " + value + ");";
        }
        if (target instanceof MemberAccess) {
            return expression(target) + " = " + value + ";";
        }
        if (target instanceof BitAccess) {
            BitAccess access = (BitAccess) target;
            return writeBit(access, bitTarget(access), value);
        }
        throw unrenderable(target, "not an assignable target");
    }

    @Override
    public Void visitCallStatement(CallStatement statement) {
        CallExpression call = statement.getCall();
        Optional<VariableDeclaration> callee = lookup(call.getCallee());
        if (callee.isPresent() && isInstance(callee.get())) {
            callInstance(call, callee.get());
        } else {
            out.line(expression(call) + ";");
        }
        return null;
    }

    private void callInstance(CallExpression call, VariableDeclaration instance) {
        String reference = variableName(instance, call.getCallee());
        List<Argument> outputs = new ArrayList<>();
        List<Argument> positional = new ArrayList<>();
        for (Argument argument : call.getArguments()) {
            if (argument.isOutput()) {
                outputs.add(argument);
            } else if (argument.getName().isPresent()) {
                out.line(reference + "." + argument.getName().get() + " = " + expression(argument.getValue()) + ";");
            } else {
                positional.add(argument);
            }
        }
        if (!positional.isEmpty()) {
            FunctionBlockDeclaration type = findFunctionBlock(instance.getTypeName())
                    .orElseThrow(() -> unrenderable(call,
                            "positional arguments to " + instance.getTypeName() + " need its declaration"));
            List<VariableDeclaration> inputs = parametersOf(type);
            if (positional.size() > inputs.size()) {
                throw unrenderable(call, "too many arguments for " + type.getName());
            }
            for (int i = 0; i < positional.size(); i++) {
                out.line(reference + "." + inputs.get(i).getName() + " = "
                        + expression(positional.get(i).getValue()) + ";");
            }
        }
        out.line(invokeInstance(reference));
        for (Argument output : outputs) {
            out.line(store(output.getValue(), reference + "." + output.getName().orElseThrow()));
        }
    }

    @Override
    public Void visitIf(IfStatement statement) {
        boolean first = true;
        for (ConditionalBranch branch : statement.getBranches()) {
            String condition = expression(branch.getCondition());
            if (first) {
                out.open("if (" + condition + ") {");
                first = false;
            } else {
                out.reopen("} else if (" + condition + ") {");
            }
            renderBody(branch.getBody());
        }
        if (!statement.getElseBody().isEmpty()) {
            out.reopen("} else {");
            renderBody(statement.getElseBody());
        }
        out.close("}");
        return null;
    }

    @Override
    public Void visitCase(CaseStatement statement) {
        String selector = "_case" + (++temporaries);
        out.line(declareTemporary(selector, expression(statement.getSelector())));
        if (statement.getBranches().isEmpty()) {
            if (!statement.getElseBody().isEmpty()) {
                out.open("{");
                renderBody(statement.getElseBody());
                out.close("}");
            }
            return null;
        }
        boolean first = true;
        for (CaseBranch branch : statement.getBranches()) {
            String condition = caseCondition(statement, selector, branch.getLabels());
            if (first) {
                out.open("if (" + condition + ") {");
                first = false;
            } else {
                out.reopen("} else if (" + condition + ") {");
            }
            renderBody(branch.getBody());
        }
        if (!statement.getElseBody().isEmpty()) {
            out.reopen("} else {");
            renderBody(statement.getElseBody());
        }
        out.close("}");
        return null;
    }

    private String caseCondition(CaseStatement statement, String selector, List<CaseLabel> labels) {
        StringJoiner condition = new StringJoiner(" || ");
        for (CaseLabel label : labels) {
            long low = labelValue(statement, label.getLow());
            if (label.isRange()) {
                long high = labelValue(statement, label.getHigh().orElseThrow());
                condition.add("(" + selector + " >= " + low + " && " + selector + " <= " + high + ")");
            } else {
                condition.add(selector + " == " + low);
            }
        }
        return condition.toString();
    }

    private long labelValue(CaseStatement statement, String lexeme) {
        try {
            return Literals.integerValue(lexeme);
        } catch (NumberFormatException e) {
            throw unrenderable(statement, "case label out of range: " + lexeme);
        }
    }

    @Override
    public Void visitFor(ForStatement statement) {
        String control = lookup(statement.getControl())
                .map(variable -> variableName(variable, statement.getControl()))
                .orElse(statement.getControl());
        String from = expression(statement.getFrom());
        String to = expression(statement.getTo());
        String step = statement.getStep().map(this::expression).orElse("1");
        int sign = statement.getStep().map(AbstractRenderer::signOf).orElse(1);
        String condition;
        if (sign > 0) {
            condition = control + " <= " + to;
        } else if (sign < 0) {
            condition = control + " >= " + to;
        } else {
            condition = "(" + step + " >= 0 ? " + control + " <= " + to + " : " + control + " >= " + to + ")";
        }
        out.open("for (" + control + " = " + from + "; " + condition + "; " + control + " += " + step + ") {");
        loop(statement.getBody());
        out.close("}");
        return null;
    }

    /**
     * Sign of a constant step, or 0 when it is only known at run time.
     */
    private static int signOf(Expression step) {
        if (step instanceof Literal) {
            return 1;
        }
        if (step instanceof UnaryExpression) {
            UnaryExpression unary = (UnaryExpression) step;
            if (unary.getOperand() instanceof Literal) {
                if (unary.getOperator() == UnaryOperator.NEGATE) {
                    return -1;
                }
                if (unary.getOperator() == UnaryOperator.PLUS) {
                    return 1;
                }
            }
        }
        return 0;
    }

    @Override
    public Void visitWhile(WhileStatement statement) {
        out.open("while (" + expression(statement.getCondition()) + ") {");
        loop(statement.getBody());
        out.close("}");
        return null;
    }

    @Override
    public Void visitRepeat(RepeatStatement statement) {
        out.open("do {");
        loop(statement.getBody());
        out.close("} while (" + logicalStyle.not() + "(" + expression(statement.getUntil()) + "));");
        return null;
    }

    private void loop(List<Statement> body) {
        loopDepth++;
        try {
            renderBody(body);
        } finally {
            loopDepth--;
        }
    }

    @Override
    public Void visitReturn(ReturnStatement statement) {
        if (scope != null && scope.isFunction()) {
            out.line("return " + resultName((FunctionDeclaration) scope.getPou()) + ";");
        } else {
            out.line("return;");
        }
        return null;
    }

    @Override
    public Void visitExit(ExitStatement statement) {
        if (loopDepth == 0) {
            throw unrenderable(statement, "EXIT outside of a loop");
        }
        out.line("break;");
        return null;
    }

    // -----------------------------------------------------------------------
    // Expressions
    // -----------------------------------------------------------------------

    @Override
    public String visitLiteral(Literal literal) {
        String lexeme = literal.getLexeme();
        switch (literal.getLiteralKind()) {
            case INTEGER:
            case REAL:
                return Literals.decimal(lexeme);
            case BASED_INTEGER:
                try {
                    return Literals.hex(Literals.basedValue(lexeme));
                } catch (NumberFormatException e) {
                    throw unrenderable(literal, "invalid based literal " + lexeme);
                }
            case BOOLEAN:
                return lexeme.toLowerCase(Locale.ROOT);
            case STRING:
                return stringLiteral(Literals.unquote(lexeme), false);
            case WIDE_STRING:
                return stringLiteral(Literals.unquote(lexeme), true);
            case TYPED:
                return typedLiteral(literal);
            default:
                throw unrenderable(literal, "unknown literal " + lexeme);
        }
    }

    private String typedLiteral(Literal literal) {
        String lexeme = literal.getLexeme();
        int hash = lexeme.indexOf('#');
        String type = lexeme.substring(0, hash).toUpperCase(Locale.ROOT);
        String value = lexeme.substring(hash + 1);
        switch (type) {
            case "T":
            case "TIME":
            case "LT":
            case "LTIME":
                try {
                    return Long.toString(Literals.durationMillis(lexeme));
                } catch (IllegalArgumentException | ArithmeticException e) {
                    throw unrenderable(literal, "invalid duration " + lexeme);
                }
            case "D":
            case "DATE":
            case "TOD":
            case "TIME_OF_DAY":
            case "DT":
            case "DATE_AND_TIME":
                return stringLiteral(value, false);
            default:
                if (value.equalsIgnoreCase("TRUE") || value.equalsIgnoreCase("FALSE")) {
                    return value.toLowerCase(Locale.ROOT);
                }
                return Literals.decimal(value);
        }
    }

    @Override
    public String visitVariableReference(VariableReference reference) {
        String name = reference.getName();
        if (scope != null && scope.isResult(name)) {
            return resultName((FunctionDeclaration) scope.getPou());
        }
        Optional<VariableDeclaration> declaration = lookup(name);
        String rendered = variableName(declaration.orElse(null), name);
        if (declaration.isPresent() && isLocated(declaration.get())) {
            return readLocated(declaration.get(), rendered);
        }
        return rendered;
    }

    @Override
    public String visitDirectAddress(DirectAddress address) {
        return "readAddress(" + Literals.quote(address.getAddress()) + ")";
    }

    @Override
    public String visitMemberAccess(MemberAccess access) {
        return expression(access.getTarget()) + "." + access.getMember();
    }

    @Override
    public String visitBitAccess(BitAccess access) {
        return readBit(access, bitTarget(access));
    }

    /**
     * The bit source without located-variable dereferencing; the runtime bit
     * helpers accept the reference itself.
     */
    private String bitTarget(BitAccess access) {
        Expression target = access.getTarget();
        if (target instanceof VariableReference) {
            String name = ((VariableReference) target).getName();
            if (scope != null && scope.isResult(name)) {
                return resultName((FunctionDeclaration) scope.getPou());
            }
            return variableName(lookup(name).orElse(null), name);
        }
        if (target instanceof DirectAddress) {
            throw unrenderable(access, "bit selector on a direct address");
        }
        return expression(target);
    }

    @Override
    public String visitUnary(UnaryExpression expression) {
        String operand = operand(expression.getOperand());
        switch (expression.getOperator()) {
            case NEGATE:
                // "--x" would be a decrement
                return operand.startsWith("-") ? "-(" + operand + ")" : "-" + operand;
            case PLUS:
                return operand;
            case NOT:
                return logicalStyle.not() + operand;
            default:
                throw unrenderable(expression, "unknown operator " + expression.getOperator());
        }
    }

    @Override
    public String visitBinary(BinaryExpression expression) {
        if (expression.getOperator() == BinaryOperator.POWER) {
            return power(expression(expression.getLeft()), expression(expression.getRight()));
        }
        String left = operand(expression.getLeft());
        String right = operand(expression.getRight());
        switch (expression.getOperator()) {
            case MULTIPLY:
                return left + " * " + right;
            case DIVIDE:
                return left + " / " + right;
            case MODULO:
                return left + " % " + right;
            case ADD:
                return left + " + " + right;
            case SUBTRACT:
                return left + " - " + right;
            case LESS:
                return left + " < " + right;
            case GREATER:
                return left + " > " + right;
            case LESS_EQUAL:
                return left + " <= " + right;
            case GREATER_EQUAL:
                return left + " >= " + right;
            case EQUAL:
                return left + " == " + right;
            case NOT_EQUAL:
                return left + " != " + right;
            case AND:
                return left + " " + logicalStyle.and() + " " + right;
            case XOR:
                return left + " ^ " + right;
            case OR:
                return left + " " + logicalStyle.or() + " " + right;
            default:
                throw unrenderable(expression, "unknown operator " + expression.getOperator());
        }
    }

    /**
     * Nested binary operands are parenthesized; power renders as a call and
     * needs no parentheses.
     */
    private String operand(Expression operand) {
        String rendered = expression(operand);
        boolean nested = operand instanceof BinaryExpression
                && ((BinaryExpression) operand).getOperator() != BinaryOperator.POWER;
        return nested ? "(" + rendered + ")" : rendered;
    }

    @Override
    public String visitParenthesized(ParenthesizedExpression expression) {
        return "(" + expression(expression.getInner()) + ")";
    }

    @Override
    public String visitCall(CallExpression call) {
        Optional<VariableDeclaration> callee = lookup(call.getCallee());
        if (callee.isPresent() && isInstance(callee.get())) {
            throw unrenderable(call, "function block instance " + call.getCallee() + " called inside an expression");
        }
        for (Argument argument : call.getArguments()) {
            if (argument.isOutput()) {
                throw unrenderable(call, "output argument in a call of " + call.getCallee());
            }
        }
        StringJoiner arguments = new StringJoiner(", ", call.getCallee() + "(", ")");
        if (!call.hasNamedArguments()) {
            for (Argument argument : call.getArguments()) {
                arguments.add(expression(argument.getValue()));
            }
            return arguments.toString();
        }
        FunctionDeclaration function = Optional.ofNullable(functions.get(key(call.getCallee())))
                .orElseThrow(() -> unrenderable(call, "named arguments to undeclared function " + call.getCallee()));
        Map<String, Argument> named = new HashMap<>();
        for (Argument argument : call.getArguments()) {
            String name = argument.getName()
                    .orElseThrow(() -> unrenderable(call, "positional and named arguments mixed"));
            named.put(key(name), argument);
        }
        for (VariableDeclaration parameter : parametersOf(function)) {
            Argument argument = named.remove(key(parameter.getName()));
            if (argument == null) {
                throw unrenderable(call, "missing argument " + parameter.getName() + " for " + function.getName());
            }
            arguments.add(expression(argument.getValue()));
        }
        if (!named.isEmpty()) {
            throw unrenderable(call, "unknown arguments " + named.keySet() + " for " + function.getName());
        }
        return arguments.toString();
    }

    // -----------------------------------------------------------------------
    // Declarations are target syntax
    // -----------------------------------------------------------------------

    @Override
    public abstract Void visitProgram(ProgramDeclaration program);

    @Override
    public abstract Void visitFunction(FunctionDeclaration function);

    @Override
    public abstract Void visitFunctionBlock(FunctionBlockDeclaration functionBlock);

    @Override
    public abstract Void visitGlobalVariables(GlobalVariableBlock block);
}
