package dev.nodalis.st;

import dev.nodalis.antlr.StructuredTextBaseVisitor;
import dev.nodalis.antlr.StructuredTextParser;
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
import dev.nodalis.st.ast.ParenthesizedExpression;
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
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns the ANTLR parse tree into the immutable AST. Expressions go through
 * the generated visitor; declarations and statements are walked directly.
 */
final class AstBuilder extends StructuredTextBaseVisitor<Expression> {

    CompilationUnit build(StructuredTextParser.CompilationUnitContext tree) {
        Objects.requireNonNull(tree, "tree");
        List<Declaration> declarations = new ArrayList<>();
        for (StructuredTextParser.UnitElementContext element : tree.unitElement()) {
            declarations.add(buildDeclaration(element));
        }
        return new CompilationUnit(declarations);
    }

    private Declaration buildDeclaration(StructuredTextParser.UnitElementContext element) {
        if (element.programDecl() != null) {
            StructuredTextParser.ProgramDeclContext ctx = element.programDecl();
            return new ProgramDeclaration(line(ctx), ctx.name.getText(),
                    buildVarBlocks(ctx.varBlock()), buildStatements(ctx.statementList()));
        }
        if (element.functionDecl() != null) {
            StructuredTextParser.FunctionDeclContext ctx = element.functionDecl();
            return new FunctionDeclaration(line(ctx), ctx.name.getText(), ctx.typeName().getText(),
                    buildVarBlocks(ctx.varBlock()), buildStatements(ctx.statementList()));
        }
        if (element.functionBlockDecl() != null) {
            StructuredTextParser.FunctionBlockDeclContext ctx = element.functionBlockDecl();
            return new FunctionBlockDeclaration(line(ctx), ctx.name.getText(),
                    buildVarBlocks(ctx.varBlock()), buildStatements(ctx.statementList()));
        }
        StructuredTextParser.GlobalVarBlockContext ctx = element.globalVarBlock();
        List<VariableDeclaration> variables = new ArrayList<>();
        boolean constant = ctx.CONSTANT() != null;
        for (StructuredTextParser.VarDeclContext decl : ctx.varDecl()) {
            addVariables(variables, decl, VariableSection.VAR_GLOBAL, constant);
        }
        return new GlobalVariableBlock(line(ctx), variables);
    }

    private List<VariableDeclaration> buildVarBlocks(List<StructuredTextParser.VarBlockContext> blocks) {
        List<VariableDeclaration> variables = new ArrayList<>();
        for (StructuredTextParser.VarBlockContext block : blocks) {
            VariableSection section = VariableSection.fromKeyword(block.section.getText());
            boolean constant = block.CONSTANT() != null;
            for (StructuredTextParser.VarDeclContext decl : block.varDecl()) {
                addVariables(variables, decl, section, constant);
            }
        }
        return variables;
    }

    private void addVariables(List<VariableDeclaration> into,
                              StructuredTextParser.VarDeclContext decl,
                              VariableSection section,
                              boolean constant) {
        String typeName = decl.typeName().getText();
        String address = decl.DIRECT_ADDRESS() != null ? decl.DIRECT_ADDRESS().getText() : null;
        Expression initial = decl.expression() != null ? visit(decl.expression()) : null;
        for (TerminalNode name : decl.IDENTIFIER()) {
            into.add(new VariableDeclaration(name.getSymbol().getLine(), name.getText(), typeName,
                    section, constant, address, initial));
        }
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    private List<Statement> buildStatements(StructuredTextParser.StatementListContext list) {
        List<Statement> statements = new ArrayList<>();
        if (list == null) {
            return statements;
        }
        for (StructuredTextParser.StatementContext statement : list.statement()) {
            Statement built = buildStatement(statement);
            if (built != null) {
                statements.add(built);
            }
        }
        return statements;
    }

    private Statement buildStatement(StructuredTextParser.StatementContext statement) {
        if (statement.assignmentStatement() != null) {
            StructuredTextParser.AssignmentStatementContext ctx = statement.assignmentStatement();
            return new Assignment(line(ctx), buildVariable(ctx.variable()), visit(ctx.expression()));
        }
        if (statement.callStatement() != null) {
            StructuredTextParser.CallStatementContext ctx = statement.callStatement();
            return new CallStatement(line(ctx), buildCall(ctx.call()));
        }
        if (statement.ifStatement() != null) {
            return buildIf(statement.ifStatement());
        }
        if (statement.caseStatement() != null) {
            return buildCase(statement.caseStatement());
        }
        if (statement.forStatement() != null) {
            StructuredTextParser.ForStatementContext ctx = statement.forStatement();
            Expression step = ctx.step != null ? visit(ctx.step) : null;
            return new ForStatement(line(ctx), ctx.control.getText(), visit(ctx.from), visit(ctx.to), step,
                    buildStatements(ctx.statementList()));
        }
        if (statement.whileStatement() != null) {
            StructuredTextParser.WhileStatementContext ctx = statement.whileStatement();
            return new WhileStatement(line(ctx), visit(ctx.expression()), buildStatements(ctx.statementList()));
        }
        if (statement.repeatStatement() != null) {
            StructuredTextParser.RepeatStatementContext ctx = statement.repeatStatement();
            return new RepeatStatement(line(ctx), buildStatements(ctx.statementList()), visit(ctx.expression()));
        }
        if (statement.returnStatement() != null) {
            return new ReturnStatement(line(statement));
        }
        if (statement.exitStatement() != null) {
            return new ExitStatement(line(statement));
        }
        // empty statement
        return null;
    }

    private Statement buildIf(StructuredTextParser.IfStatementContext ctx) {
        List<ConditionalBranch> branches = new ArrayList<>();
        branches.add(new ConditionalBranch(visit(ctx.expression()), buildStatements(ctx.statementList())));
        for (StructuredTextParser.ElsifClauseContext elsif : ctx.elsifClause()) {
            branches.add(new ConditionalBranch(visit(elsif.expression()), buildStatements(elsif.statementList())));
        }
        return new IfStatement(line(ctx), branches, buildElse(ctx.elseClause()));
    }

    private Statement buildCase(StructuredTextParser.CaseStatementContext ctx) {
        List<CaseBranch> branches = new ArrayList<>();
        for (StructuredTextParser.CaseElementContext element : ctx.caseElement()) {
            List<CaseLabel> labels = new ArrayList<>();
            for (StructuredTextParser.CaseLabelContext label : element.caseLabel()) {
                labels.add(new CaseLabel(label.low.getText(), label.high != null ? label.high.getText() : null));
            }
            branches.add(new CaseBranch(labels, buildStatements(element.statementList())));
        }
        return new CaseStatement(line(ctx), visit(ctx.expression()), branches, buildElse(ctx.elseClause()));
    }

    private List<Statement> buildElse(StructuredTextParser.ElseClauseContext ctx) {
        return ctx == null ? List.of() : buildStatements(ctx.statementList());
    }

    private CallExpression buildCall(StructuredTextParser.CallContext ctx) {
        List<Argument> arguments = new ArrayList<>();
        for (StructuredTextParser.ArgumentContext argument : ctx.argument()) {
            if (argument instanceof StructuredTextParser.NamedArgumentContext) {
                StructuredTextParser.NamedArgumentContext named = (StructuredTextParser.NamedArgumentContext) argument;
                arguments.add(new Argument(line(named), named.IDENTIFIER().getText(), visit(named.expression()), false));
            } else if (argument instanceof StructuredTextParser.OutputArgumentContext) {
                StructuredTextParser.OutputArgumentContext output = (StructuredTextParser.OutputArgumentContext) argument;
                arguments.add(new Argument(line(output), output.IDENTIFIER().getText(), buildVariable(output.variable()), true));
            } else {
                StructuredTextParser.PositionalArgumentContext positional = (StructuredTextParser.PositionalArgumentContext) argument;
                arguments.add(new Argument(line(positional), null, visit(positional.expression()), false));
            }
        }
        return new CallExpression(line(ctx), ctx.IDENTIFIER().getText(), arguments);
    }

    private Expression buildVariable(StructuredTextParser.VariableContext ctx) {
        if (ctx instanceof StructuredTextParser.DirectVariableContext) {
            StructuredTextParser.DirectVariableContext direct = (StructuredTextParser.DirectVariableContext) ctx;
            return new DirectAddress(line(direct), direct.DIRECT_ADDRESS().getText());
        }
        StructuredTextParser.SymbolicVariableContext symbolic = (StructuredTextParser.SymbolicVariableContext) ctx;
        int line = line(symbolic);
        Expression current = new VariableReference(line, symbolic.IDENTIFIER().getText());
        for (StructuredTextParser.SelectorContext selector : symbolic.selector()) {
            if (selector instanceof StructuredTextParser.BitSelectorContext) {
                String digits = ((StructuredTextParser.BitSelectorContext) selector).INTEGER().getText().replace("_", "");
                current = new BitAccess(line, current, Integer.parseInt(digits));
            } else {
                String member = ((StructuredTextParser.MemberSelectorContext) selector).IDENTIFIER().getText();
                current = new MemberAccess(line, current, member);
            }
        }
        return current;
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    @Override
    public Expression visitPrimaryExpression(StructuredTextParser.PrimaryExpressionContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public Expression visitPowerExpression(StructuredTextParser.PowerExpressionContext ctx) {
        return binary(ctx, BinaryOperator.POWER, ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Expression visitUnaryExpression(StructuredTextParser.UnaryExpressionContext ctx) {
        UnaryOperator operator;
        switch (ctx.op.getType()) {
            case StructuredTextParser.MINUS:
                operator = UnaryOperator.NEGATE;
                break;
            case StructuredTextParser.PLUS:
                operator = UnaryOperator.PLUS;
                break;
            default:
                operator = UnaryOperator.NOT;
                break;
        }
        return new UnaryExpression(line(ctx), operator, visit(ctx.expression()));
    }

    @Override
    public Expression visitMultiplicativeExpression(StructuredTextParser.MultiplicativeExpressionContext ctx) {
        BinaryOperator operator;
        switch (ctx.op.getType()) {
            case StructuredTextParser.STAR:
                operator = BinaryOperator.MULTIPLY;
                break;
            case StructuredTextParser.SLASH:
                operator = BinaryOperator.DIVIDE;
                break;
            default:
                operator = BinaryOperator.MODULO;
                break;
        }
        return binary(ctx, operator, ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Expression visitAdditiveExpression(StructuredTextParser.AdditiveExpressionContext ctx) {
        BinaryOperator operator = ctx.op.getType() == StructuredTextParser.PLUS
                ? BinaryOperator.ADD
                : BinaryOperator.SUBTRACT;
        return binary(ctx, operator, ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Expression visitRelationalExpression(StructuredTextParser.RelationalExpressionContext ctx) {
        BinaryOperator operator;
        switch (ctx.op.getType()) {
            case StructuredTextParser.LT:
                operator = BinaryOperator.LESS;
                break;
            case StructuredTextParser.GT:
                operator = BinaryOperator.GREATER;
                break;
            case StructuredTextParser.LE:
                operator = BinaryOperator.LESS_EQUAL;
                break;
            default:
                operator = BinaryOperator.GREATER_EQUAL;
                break;
        }
        return binary(ctx, operator, ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Expression visitEqualityExpression(StructuredTextParser.EqualityExpressionContext ctx) {
        BinaryOperator operator = ctx.op.getType() == StructuredTextParser.EQ
                ? BinaryOperator.EQUAL
                : BinaryOperator.NOT_EQUAL;
        return binary(ctx, operator, ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Expression visitAndExpression(StructuredTextParser.AndExpressionContext ctx) {
        return binary(ctx, BinaryOperator.AND, ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Expression visitXorExpression(StructuredTextParser.XorExpressionContext ctx) {
        return binary(ctx, BinaryOperator.XOR, ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Expression visitOrExpression(StructuredTextParser.OrExpressionContext ctx) {
        return binary(ctx, BinaryOperator.OR, ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Expression visitParenthesizedPrimary(StructuredTextParser.ParenthesizedPrimaryContext ctx) {
        return new ParenthesizedExpression(line(ctx), visit(ctx.expression()));
    }

    @Override
    public Expression visitCallPrimary(StructuredTextParser.CallPrimaryContext ctx) {
        return buildCall(ctx.call());
    }

    @Override
    public Expression visitVariablePrimary(StructuredTextParser.VariablePrimaryContext ctx) {
        return buildVariable(ctx.variable());
    }

    @Override
    public Expression visitLiteralPrimary(StructuredTextParser.LiteralPrimaryContext ctx) {
        Token token = ctx.literal().getStart();
        Literal.Kind kind;
        switch (token.getType()) {
            case StructuredTextParser.INTEGER:
                kind = Literal.Kind.INTEGER;
                break;
            case StructuredTextParser.BASED_INTEGER:
                kind = Literal.Kind.BASED_INTEGER;
                break;
            case StructuredTextParser.REAL:
                kind = Literal.Kind.REAL;
                break;
            case StructuredTextParser.TRUE:
            case StructuredTextParser.FALSE:
                kind = Literal.Kind.BOOLEAN;
                break;
            case StructuredTextParser.STRING_LITERAL:
                kind = Literal.Kind.STRING;
                break;
            case StructuredTextParser.WSTRING_LITERAL:
                kind = Literal.Kind.WIDE_STRING;
                break;
            default:
                kind = Literal.Kind.TYPED;
                break;
        }
        return new Literal(token.getLine(), kind, token.getText());
    }

    private Expression binary(ParserRuleContext ctx,
                              BinaryOperator operator,
                              StructuredTextParser.ExpressionContext left,
                              StructuredTextParser.ExpressionContext right) {
        return new BinaryExpression(line(ctx), operator, visit(left), visit(right));
    }

    private static int line(ParserRuleContext ctx) {
        return ctx.getStart().getLine();
    }
}
