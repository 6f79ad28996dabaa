package dev.nodalis.st;

import dev.nodalis.st.ast.Argument;
import dev.nodalis.st.ast.Assignment;
import dev.nodalis.st.ast.BinaryExpression;
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
import dev.nodalis.st.ast.ParenthesizedExpression;
import dev.nodalis.st.ast.PouDeclaration;
import dev.nodalis.st.ast.ProgramDeclaration;
import dev.nodalis.st.ast.RepeatStatement;
import dev.nodalis.st.ast.ReturnStatement;
import dev.nodalis.st.ast.Statement;
import dev.nodalis.st.ast.UnaryExpression;
import dev.nodalis.st.ast.VariableDeclaration;
import dev.nodalis.st.ast.VariableReference;
import dev.nodalis.st.ast.WhileStatement;

import java.util.List;

/**
 * Renders an AST as a LISP-style S-expression, e.g.
 * <pre>
 * (unit (program Pump (var VAR Speed INT) (:= Speed (+ Speed 1))))
 * </pre>
 * Two structurally equal trees print identically.
 */
public final class AstPrinter implements Declaration.Visitor<String>, Statement.Visitor<String>, Expression.Visitor<String> {

    public String print(CompilationUnit unit) {
        StringBuilder out = new StringBuilder("(unit");
        for (Declaration declaration : unit.getDeclarations()) {
            out.append(' ').append(declaration.accept(this));
        }
        return out.append(')').toString();
    }

    @Override
    public String visitProgram(ProgramDeclaration program) {
        return pou("program", program, null);
    }

    @Override
    public String visitFunction(FunctionDeclaration function) {
        return pou("function", function, function.getReturnType());
    }

    @Override
    public String visitFunctionBlock(FunctionBlockDeclaration functionBlock) {
        return pou("function-block", functionBlock, null);
    }

    @Override
    public String visitGlobalVariables(GlobalVariableBlock block) {
        StringBuilder out = new StringBuilder("(globals");
        for (VariableDeclaration variable : block.getVariables()) {
            out.append(' ').append(variable(variable));
        }
        return out.append(')').toString();
    }

    private String pou(String tag, PouDeclaration pou, String returnType) {
        StringBuilder out = new StringBuilder("(").append(tag).append(' ').append(pou.getName());
        if (returnType != null) {
            out.append(" : ").append(returnType);
        }
        for (VariableDeclaration variable : pou.getVariables()) {
            out.append(' ').append(variable(variable));
        }
        appendStatements(out, pou.getBody());
        return out.append(')').toString();
    }

    private String variable(VariableDeclaration variable) {
        StringBuilder out = new StringBuilder("(var ")
                .append(variable.getSection())
                .append(' ').append(variable.getName())
                .append(' ').append(variable.getTypeName());
        if (variable.isConstant()) {
            out.append(" constant");
        }
        variable.getAddress().ifPresent(a -> out.append(" (at ").append(a).append(')'));
        variable.getInitialValue().ifPresent(v -> out.append(" (init ").append(v.accept(this)).append(')'));
        return out.append(')').toString();
    }

    private void appendStatements(StringBuilder out, List<Statement> statements) {
        for (Statement statement : statements) {
            out.append(' ').append(statement.accept(this));
        }
    }

    private String block(String tag, List<Statement> statements) {
        StringBuilder out = new StringBuilder("(").append(tag);
        appendStatements(out, statements);
        return out.append(')').toString();
    }

    @Override
    public String visitAssignment(Assignment assignment) {
        return "(:= " + assignment.getTarget().accept(this) + " " + assignment.getValue().accept(this) + ")";
    }

    @Override
    public String visitCallStatement(CallStatement statement) {
        return statement.getCall().accept(this);
    }

    @Override
    public String visitIf(IfStatement statement) {
        StringBuilder out = new StringBuilder("(if");
        for (ConditionalBranch branch : statement.getBranches()) {
            out.append(" (").append(branch.getCondition().accept(this))
                    .append(' ').append(block("then", branch.getBody())).append(')');
        }
        if (!statement.getElseBody().isEmpty()) {
            out.append(' ').append(block("else", statement.getElseBody()));
        }
        return out.append(')').toString();
    }

    @Override
    public String visitCase(CaseStatement statement) {
        StringBuilder out = new StringBuilder("(case ").append(statement.getSelector().accept(this));
        for (CaseBranch branch : statement.getBranches()) {
            out.append(" ((");
            for (int i = 0; i < branch.getLabels().size(); i++) {
                CaseLabel label = branch.getLabels().get(i);
                if (i > 0) {
                    out.append(' ');
                }
                out.append(label.getLow());
                label.getHigh().ifPresent(h -> out.append("..").append(h));
            }
            out.append(')');
            appendStatements(out, branch.getBody());
            out.append(')');
        }
        if (!statement.getElseBody().isEmpty()) {
            out.append(' ').append(block("else", statement.getElseBody()));
        }
        return out.append(')').toString();
    }

    @Override
    public String visitFor(ForStatement statement) {
        StringBuilder out = new StringBuilder("(for ").append(statement.getControl())
                .append(' ').append(statement.getFrom().accept(this))
                .append(' ').append(statement.getTo().accept(this));
        statement.getStep().ifPresent(s -> out.append(" (by ").append(s.accept(this)).append(')'));
        out.append(' ').append(block("do", statement.getBody()));
        return out.append(')').toString();
    }

    @Override
    public String visitWhile(WhileStatement statement) {
        return "(while " + statement.getCondition().accept(this) + " " + block("do", statement.getBody()) + ")";
    }

    @Override
    public String visitRepeat(RepeatStatement statement) {
        return "(repeat " + block("do", statement.getBody()) + " (until " + statement.getUntil().accept(this) + "))";
    }

    @Override
    public String visitReturn(ReturnStatement statement) {
        return "(return)";
    }

    @Override
    public String visitExit(ExitStatement statement) {
        return "(exit)";
    }

    @Override
    public String visitLiteral(Literal literal) {
        return literal.getLexeme();
    }

    @Override
    public String visitVariableReference(VariableReference reference) {
        return reference.getName();
    }

    @Override
    public String visitDirectAddress(DirectAddress address) {
        return address.getAddress();
    }

    @Override
    public String visitMemberAccess(MemberAccess access) {
        return "(. " + access.getTarget().accept(this) + " " + access.getMember() + ")";
    }

    @Override
    public String visitBitAccess(BitAccess access) {
        return "(bit " + access.getTarget().accept(this) + " " + access.getBit() + ")";
    }

    @Override
    public String visitUnary(UnaryExpression expression) {
        return "(" + expression.getOperator().getSymbol() + " " + expression.getOperand().accept(this) + ")";
    }

    @Override
    public String visitBinary(BinaryExpression expression) {
        return "(" + expression.getOperator().getSymbol() + " "
                + expression.getLeft().accept(this) + " "
                + expression.getRight().accept(this) + ")";
    }

    @Override
    public String visitParenthesized(ParenthesizedExpression expression) {
        return expression.getInner().accept(this);
    }

    @Override
    public String visitCall(CallExpression call) {
        StringBuilder out = new StringBuilder("(call ").append(call.getCallee());
        for (Argument argument : call.getArguments()) {
            out.append(' ');
            if (argument.getName().isPresent()) {
                out.append('(').append(argument.isOutput() ? "=> " : ":= ")
                        .append(argument.getName().get()).append(' ')
                        .append(argument.getValue().accept(this)).append(')');
            } else {
                out.append(argument.getValue().accept(this));
            }
        }
        return out.append(')').toString();
    }
}
