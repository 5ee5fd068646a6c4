package com.flatline.compiler.formatter;

import com.flatline.compiler.ast.AstNode;
import com.flatline.compiler.ast.AstVisitor;
import com.flatline.compiler.ast.Modifier;
import com.flatline.compiler.ast.decl.*;
import com.flatline.compiler.ast.expr.*;
import com.flatline.compiler.ast.stmt.*;
import com.flatline.compiler.ast.type.TypeRef;

import java.math.BigDecimal;
import java.util.List;

/**
 * Flatline 源码输出器
 *
 * <p>遍历 AST 输出可重新解析的源码。表达式按运算符优先级补齐括号，
 * 因此替换进来的子树保持原有含义；if/循环分支总是输出为块。</p>
 */
public class SourcePrinter implements AstVisitor<Void, FormatterContext> {

    // 表达式优先级（越大绑定越紧）
    private static final int PREC_LOWEST = 0;
    private static final int PREC_TERNARY = 1;
    private static final int PREC_PREFIX = 8;
    private static final int PREC_POSTFIX = 9;
    private static final int PREC_PRIMARY = 10;

    public String print(Program program, FormatConfig config) {
        FormatterContext ctx = new FormatterContext(config);
        visitProgram(program, ctx);
        return ctx.getOutput();
    }

    public String print(Program program) {
        return print(program, new FormatConfig());
    }

    /**
     * 输出任意节点（声明、语句或表达式）
     */
    public String print(AstNode node) {
        FormatterContext ctx = new FormatterContext(new FormatConfig());
        node.accept(this, ctx);
        return ctx.getOutput();
    }

    /**
     * 输出语句列表，每条一行
     */
    public String printStatements(List<Statement> statements) {
        FormatterContext ctx = new FormatterContext(new FormatConfig());
        for (Statement stmt : statements) {
            stmt.accept(this, ctx);
            ctx.newLine();
        }
        return ctx.getOutput();
    }

    // ============ 声明 ============

    @Override
    public Void visitProgram(Program node, FormatterContext ctx) {
        List<Declaration> decls = node.getDeclarations();
        for (int i = 0; i < decls.size(); i++) {
            decls.get(i).accept(this, ctx);
            ctx.newLine();
            // 顶层声明之间空一行
            if (i < decls.size() - 1) {
                ctx.newLine();
            }
        }
        return null;
    }

    @Override
    public Void visitClassDecl(ClassDecl node, FormatterContext ctx) {
        appendModifiers(node, ctx);
        ctx.append("class ");
        ctx.append(node.getName());
        ctx.append(" {");
        ctx.newLine();
        ctx.indent();
        List<Declaration> members = node.getMembers();
        for (int i = 0; i < members.size(); i++) {
            if (i > 0 && (members.get(i) instanceof FunDecl)) {
                ctx.newLine();
            }
            members.get(i).accept(this, ctx);
            ctx.newLine();
        }
        ctx.dedent();
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitFunDecl(FunDecl node, FormatterContext ctx) {
        appendModifiers(node, ctx);
        ctx.append("fun ");
        if (!node.getTypeParams().isEmpty()) {
            ctx.append("<");
            ctx.append(String.join(", ", node.getTypeParams()));
            ctx.append("> ");
        }
        ctx.append(node.getName());
        ctx.append("(");
        List<Parameter> params = node.getParams();
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) ctx.append(", ");
            visitParameter(params.get(i), ctx);
        }
        ctx.append(")");
        if (node.getReturnType() != null) {
            ctx.append(": ");
            appendType(node.getReturnType(), ctx);
        }
        if (node.getBody() != null) {
            ctx.append(" ");
            visitBlock(node.getBody(), ctx);
        } else if (node.getExpressionBody() != null) {
            ctx.append(" = ");
            printExpr(node.getExpressionBody(), PREC_LOWEST, ctx);
        }
        return null;
    }

    @Override
    public Void visitParameter(Parameter node, FormatterContext ctx) {
        ctx.append(node.getName());
        ctx.append(": ");
        appendType(node.getType(), ctx);
        return null;
    }

    @Override
    public Void visitPropertyDecl(PropertyDecl node, FormatterContext ctx) {
        appendModifiers(node, ctx);
        ctx.append(node.isMutable() ? "var " : "val ");
        ctx.append(node.getName());
        if (node.getType() != null) {
            ctx.append(": ");
            appendType(node.getType(), ctx);
        }
        if (node.getInitializer() != null) {
            ctx.append(" = ");
            printExpr(node.getInitializer(), PREC_LOWEST, ctx);
        }
        return null;
    }

    private void appendModifiers(Declaration node, FormatterContext ctx) {
        for (Modifier m : Modifier.values()) {
            if (node.hasModifier(m)) {
                ctx.append(m.toSourceString());
                ctx.append(" ");
            }
        }
    }

    private void appendType(TypeRef type, FormatterContext ctx) {
        ctx.append(type.toSourceString());
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, FormatterContext ctx) {
        if (node.getStatements().isEmpty()) {
            ctx.append("{}");
            return null;
        }
        ctx.append("{");
        ctx.newLine();
        ctx.indent();
        for (Statement stmt : node.getStatements()) {
            stmt.accept(this, ctx);
            ctx.newLine();
        }
        ctx.dedent();
        ctx.append("}");
        return null;
    }

    /** 分支体总是按块输出，避免悬挂 else 歧义 */
    private void appendBody(Statement body, FormatterContext ctx) {
        if (body instanceof Block) {
            visitBlock((Block) body, ctx);
        } else {
            ctx.append("{");
            ctx.newLine();
            ctx.indent();
            body.accept(this, ctx);
            ctx.newLine();
            ctx.dedent();
            ctx.append("}");
        }
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, FormatterContext ctx) {
        printExpr(node.getExpression(), PREC_LOWEST, ctx);
        return null;
    }

    @Override
    public Void visitDeclarationStmt(DeclarationStmt node, FormatterContext ctx) {
        return visitPropertyDecl(node.getDeclaration(), ctx);
    }

    @Override
    public Void visitIfStmt(IfStmt node, FormatterContext ctx) {
        ctx.append("if (");
        printExpr(node.getCondition(), PREC_LOWEST, ctx);
        ctx.append(") ");
        appendBody(node.getThenBranch(), ctx);
        if (node.hasElse()) {
            ctx.append(" else ");
            if (node.getElseBranch() instanceof IfStmt) {
                node.getElseBranch().accept(this, ctx);
            } else {
                appendBody(node.getElseBranch(), ctx);
            }
        }
        return null;
    }

    @Override
    public Void visitWhenStmt(WhenStmt node, FormatterContext ctx) {
        ctx.append("when ");
        if (node.getSubject() != null) {
            ctx.append("(");
            printExpr(node.getSubject(), PREC_LOWEST, ctx);
            ctx.append(") ");
        }
        ctx.append("{");
        ctx.newLine();
        ctx.indent();
        for (WhenStmt.WhenBranch branch : node.getBranches()) {
            List<Expression> conditions = branch.getConditions();
            for (int i = 0; i < conditions.size(); i++) {
                if (i > 0) ctx.append(", ");
                // 分支条件中的 lambda 必须加括号
                printExpr(conditions.get(i), PREC_TERNARY, ctx);
            }
            ctx.append(" -> ");
            appendBody(branch.getBody(), ctx);
            ctx.newLine();
        }
        if (node.hasElse()) {
            ctx.append("else -> ");
            appendBody(node.getElseBranch(), ctx);
            ctx.newLine();
        }
        ctx.dedent();
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, FormatterContext ctx) {
        ctx.append("while (");
        printExpr(node.getCondition(), PREC_LOWEST, ctx);
        ctx.append(") ");
        appendBody(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, FormatterContext ctx) {
        ctx.append("for (");
        ctx.append(node.getVariable());
        if (node.getVariableType() != null) {
            ctx.append(": ");
            appendType(node.getVariableType(), ctx);
        }
        ctx.append(" in ");
        printExpr(node.getIterable(), PREC_LOWEST, ctx);
        ctx.append(") ");
        appendBody(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitClassicForStmt(ClassicForStmt node, FormatterContext ctx) {
        ctx.append("for (");
        if (node.getInitializer() != null) {
            node.getInitializer().accept(this, ctx);
        }
        ctx.append("; ");
        if (node.getCondition() != null) {
            printExpr(node.getCondition(), PREC_LOWEST, ctx);
        }
        ctx.append("; ");
        if (node.getUpdate() != null) {
            printExpr(node.getUpdate(), PREC_LOWEST, ctx);
        }
        ctx.append(") ");
        appendBody(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, FormatterContext ctx) {
        ctx.append("return");
        if (node.getValue() != null) {
            ctx.append(" ");
            printExpr(node.getValue(), PREC_LOWEST, ctx);
        }
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, FormatterContext ctx) {
        ctx.append("break");
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, FormatterContext ctx) {
        ctx.append("continue");
        return null;
    }

    // ============ 表达式 ============

    private void printExpr(Expression expr, int minPrecedence, FormatterContext ctx) {
        if (precedence(expr) < minPrecedence) {
            ctx.append("(");
            expr.accept(this, ctx);
            ctx.append(")");
        } else {
            expr.accept(this, ctx);
        }
    }

    private static int precedence(Expression expr) {
        if (expr instanceof AssignExpr || expr instanceof LambdaExpr) {
            return PREC_LOWEST;
        }
        if (expr instanceof ConditionalExpr) {
            return PREC_TERNARY;
        }
        if (expr instanceof BinaryExpr) {
            return ((BinaryExpr) expr).getOperator().getPrecedence() + 1;
        }
        if (expr instanceof UnaryExpr) {
            return ((UnaryExpr) expr).isPrefix() ? PREC_PREFIX : PREC_POSTFIX;
        }
        if (expr instanceof CallExpr || expr instanceof MemberExpr || expr instanceof IndexExpr) {
            return PREC_POSTFIX;
        }
        if (expr instanceof Literal && isNegativeNumber((Literal) expr)) {
            return PREC_PREFIX;
        }
        return PREC_PRIMARY;
    }

    private static boolean isNegativeNumber(Literal literal) {
        Object value = literal.getValue();
        if (value instanceof Integer) return (Integer) value < 0;
        if (value instanceof Double) return (Double) value < 0 || 1 / (Double) value < 0;
        return false;
    }

    @Override
    public Void visitLiteral(Literal node, FormatterContext ctx) {
        switch (node.getKind()) {
            case STRING:
                ctx.append(quote((String) node.getValue()));
                break;
            case DOUBLE:
                ctx.append(formatDouble((Double) node.getValue()));
                break;
            case NULL:
                ctx.append("null");
                break;
            default:
                ctx.append(String.valueOf(node.getValue()));
                break;
        }
        return null;
    }

    private static String formatDouble(double value) {
        String text = BigDecimal.valueOf(value).toPlainString();
        return text.indexOf('.') >= 0 ? text : text + ".0";
    }

    static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                case '\r': sb.append("\\r"); break;
                case '\0': sb.append("\\0"); break;
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                default: sb.append(c); break;
            }
        }
        return sb.append('"').toString();
    }

    @Override
    public Void visitIdentifier(Identifier node, FormatterContext ctx) {
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitThisExpr(ThisExpr node, FormatterContext ctx) {
        ctx.append("this");
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, FormatterContext ctx) {
        int prec = precedence(node);
        printExpr(node.getLeft(), prec, ctx);
        ctx.append(" ");
        ctx.append(node.getOperator().toSourceString());
        ctx.append(" ");
        printExpr(node.getRight(), prec + 1, ctx);
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, FormatterContext ctx) {
        if (node.isPrefix()) {
            ctx.append(node.getOperator().toSourceString());
            Expression operand = node.getOperand();
            // 避免 - -x 粘连成 --x
            boolean sticky = (operand instanceof UnaryExpr && ((UnaryExpr) operand).isPrefix())
                    || (operand instanceof Literal && isNegativeNumber((Literal) operand));
            if (sticky) {
                ctx.append("(");
                operand.accept(this, ctx);
                ctx.append(")");
            } else {
                printExpr(operand, PREC_PREFIX, ctx);
            }
        } else {
            printExpr(node.getOperand(), PREC_POSTFIX, ctx);
            ctx.append(node.getOperator().toSourceString());
        }
        return null;
    }

    @Override
    public Void visitAssignExpr(AssignExpr node, FormatterContext ctx) {
        printExpr(node.getTarget(), PREC_POSTFIX, ctx);
        ctx.append(" ");
        ctx.append(node.getOperator().toSourceString());
        ctx.append(" ");
        printExpr(node.getValue(), PREC_LOWEST, ctx);
        return null;
    }

    @Override
    public Void visitConditionalExpr(ConditionalExpr node, FormatterContext ctx) {
        printExpr(node.getCondition(), PREC_TERNARY + 1, ctx);
        ctx.append(" ? ");
        printExpr(node.getThenExpr(), PREC_TERNARY, ctx);
        ctx.append(" : ");
        printExpr(node.getElseExpr(), PREC_TERNARY, ctx);
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, FormatterContext ctx) {
        printExpr(node.getCallee(), PREC_POSTFIX, ctx);
        if (!node.getTypeArgs().isEmpty()) {
            ctx.append("<");
            for (int i = 0; i < node.getTypeArgs().size(); i++) {
                if (i > 0) ctx.append(", ");
                appendType(node.getTypeArgs().get(i), ctx);
            }
            ctx.append(">");
        }
        ctx.append("(");
        List<Expression> args = node.getArgs();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) ctx.append(", ");
            printExpr(args.get(i), PREC_LOWEST, ctx);
        }
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitMemberExpr(MemberExpr node, FormatterContext ctx) {
        printExpr(node.getTarget(), PREC_POSTFIX, ctx);
        ctx.append(".");
        ctx.append(node.getMember());
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, FormatterContext ctx) {
        printExpr(node.getTarget(), PREC_POSTFIX, ctx);
        ctx.append("[");
        printExpr(node.getIndex(), PREC_LOWEST, ctx);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitLambdaExpr(LambdaExpr node, FormatterContext ctx) {
        List<LambdaExpr.LambdaParam> params = node.getParams();
        if (params.size() == 1 && params.get(0).getType() == null) {
            ctx.append(params.get(0).getName());
        } else {
            ctx.append("(");
            for (int i = 0; i < params.size(); i++) {
                if (i > 0) ctx.append(", ");
                ctx.append(params.get(i).getName());
                if (params.get(i).getType() != null) {
                    ctx.append(": ");
                    appendType(params.get(i).getType(), ctx);
                }
            }
            ctx.append(")");
        }
        ctx.append(" -> ");
        if (node.isBlockBody()) {
            visitBlock(node.getBlockBody(), ctx);
        } else {
            printExpr(node.getExpressionBody(), PREC_LOWEST, ctx);
        }
        return null;
    }
}
