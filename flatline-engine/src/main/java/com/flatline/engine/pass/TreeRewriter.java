package com.flatline.engine.pass;

import com.flatline.compiler.ast.decl.PropertyDecl;
import com.flatline.compiler.ast.expr.*;
import com.flatline.compiler.ast.stmt.*;
import com.flatline.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.List;

/**
 * 语句树恒等变换基类（copy-on-change）。
 * 递归遍历所有节点，子节点无变化时返回原节点，否则构造新节点。
 *
 * <p>子类覆盖 {@link #rewriteIdentifier}、{@link #rewriteType} 或 {@link #declare}
 * 等钩子实现具体的 pass；{@link #enterScope()}/{@link #exitScope()} 在块、分支、
 * 循环和 lambda 边界成对调用。</p>
 */
public abstract class TreeRewriter {

    // ==================== 钩子 ====================

    protected Expression rewriteIdentifier(Identifier id) {
        return id;
    }

    protected TypeRef rewriteType(TypeRef type) {
        return type;
    }

    /** 局部名字（变量、循环变量、lambda 参数）在当前作用域声明，返回新名字 */
    protected String declare(String name) {
        return name;
    }

    protected void enterScope() {
    }

    protected void exitScope() {
    }

    // ==================== 语句 ====================

    /** 在当前作用域中变换语句序列（不新开作用域） */
    public List<Statement> rewriteAll(List<Statement> statements) {
        List<Statement> result = new ArrayList<Statement>(statements.size());
        for (Statement stmt : statements) {
            result.add(rewrite(stmt));
        }
        return result;
    }

    public Statement rewrite(Statement stmt) {
        if (stmt == null) return null;
        if (stmt instanceof ExpressionStmt) {
            ExpressionStmt es = (ExpressionStmt) stmt;
            Expression e = rewrite(es.getExpression());
            return e == es.getExpression() ? stmt : new ExpressionStmt(stmt.getLocation(), e);
        }
        if (stmt instanceof DeclarationStmt) {
            PropertyDecl decl = ((DeclarationStmt) stmt).getDeclaration();
            PropertyDecl rewritten = rewriteLocal(decl);
            return rewritten == decl ? stmt : new DeclarationStmt(stmt.getLocation(), rewritten);
        }
        if (stmt instanceof Block) {
            Block block = (Block) stmt;
            enterScope();
            try {
                return new Block(block.getLocation(), rewriteAll(block.getStatements()));
            } finally {
                exitScope();
            }
        }
        if (stmt instanceof IfStmt) {
            IfStmt s = (IfStmt) stmt;
            Expression c = rewrite(s.getCondition());
            Statement t = rewriteBranch(s.getThenBranch());
            Statement e = rewriteBranch(s.getElseBranch());
            return new IfStmt(s.getLocation(), c, t, e);
        }
        if (stmt instanceof WhenStmt) {
            WhenStmt s = (WhenStmt) stmt;
            Expression subject = rewrite(s.getSubject());
            List<WhenStmt.WhenBranch> branches = new ArrayList<WhenStmt.WhenBranch>();
            for (WhenStmt.WhenBranch branch : s.getBranches()) {
                branches.add(new WhenStmt.WhenBranch(rewriteExprs(branch.getConditions()),
                        rewriteBranch(branch.getBody())));
            }
            return new WhenStmt(s.getLocation(), subject, branches, rewriteBranch(s.getElseBranch()));
        }
        if (stmt instanceof WhileStmt) {
            WhileStmt s = (WhileStmt) stmt;
            return new WhileStmt(s.getLocation(), rewrite(s.getCondition()), rewriteBranch(s.getBody()));
        }
        if (stmt instanceof ForStmt) {
            ForStmt s = (ForStmt) stmt;
            Expression iterable = rewrite(s.getIterable());
            enterScope();
            try {
                String var = declare(s.getVariable());
                TypeRef varType = s.getVariableType() != null ? rewriteType(s.getVariableType()) : null;
                return new ForStmt(s.getLocation(), var, varType, iterable, rewriteBranch(s.getBody()));
            } finally {
                exitScope();
            }
        }
        if (stmt instanceof ClassicForStmt) {
            ClassicForStmt s = (ClassicForStmt) stmt;
            enterScope();
            try {
                Statement init = rewrite(s.getInitializer());
                Expression cond = rewrite(s.getCondition());
                Expression update = rewrite(s.getUpdate());
                return new ClassicForStmt(s.getLocation(), init, cond, update, rewriteBranch(s.getBody()));
            } finally {
                exitScope();
            }
        }
        if (stmt instanceof ReturnStmt) {
            ReturnStmt s = (ReturnStmt) stmt;
            Expression v = rewrite(s.getValue());
            return v == s.getValue() ? stmt : new ReturnStmt(s.getLocation(), v);
        }
        // break / continue
        return stmt;
    }

    /** 分支与循环体各自构成作用域，即使不是块 */
    protected Statement rewriteBranch(Statement stmt) {
        if (stmt == null) return null;
        if (stmt instanceof Block) {
            return rewrite(stmt);
        }
        enterScope();
        try {
            return rewrite(stmt);
        } finally {
            exitScope();
        }
    }

    protected PropertyDecl rewriteLocal(PropertyDecl decl) {
        Expression init = rewrite(decl.getInitializer());
        TypeRef type = decl.getType() != null ? rewriteType(decl.getType()) : null;
        String name = declare(decl.getName());
        if (init == decl.getInitializer() && type == decl.getType() && name.equals(decl.getName())) {
            return decl;
        }
        return new PropertyDecl(decl.getLocation(), decl.getModifiers(), name, decl.isMutable(), type, init);
    }

    // ==================== 表达式 ====================

    public Expression rewrite(Expression expr) {
        if (expr == null) return null;
        if (expr instanceof Identifier) {
            return rewriteIdentifier((Identifier) expr);
        }
        if (expr instanceof Literal || expr instanceof ThisExpr) {
            return expr;
        }
        if (expr instanceof BinaryExpr) {
            BinaryExpr b = (BinaryExpr) expr;
            Expression l = rewrite(b.getLeft());
            Expression r = rewrite(b.getRight());
            if (l == b.getLeft() && r == b.getRight()) return expr;
            return new BinaryExpr(b.getLocation(), l, b.getOperator(), r);
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr u = (UnaryExpr) expr;
            Expression operand = rewrite(u.getOperand());
            if (operand == u.getOperand()) return expr;
            return new UnaryExpr(u.getLocation(), u.getOperator(), operand, u.isPrefix());
        }
        if (expr instanceof AssignExpr) {
            AssignExpr a = (AssignExpr) expr;
            Expression target = rewrite(a.getTarget());
            Expression value = rewrite(a.getValue());
            if (target == a.getTarget() && value == a.getValue()) return expr;
            return new AssignExpr(a.getLocation(), target, a.getOperator(), value);
        }
        if (expr instanceof ConditionalExpr) {
            ConditionalExpr c = (ConditionalExpr) expr;
            Expression cond = rewrite(c.getCondition());
            Expression t = rewrite(c.getThenExpr());
            Expression e = rewrite(c.getElseExpr());
            if (cond == c.getCondition() && t == c.getThenExpr() && e == c.getElseExpr()) return expr;
            return new ConditionalExpr(c.getLocation(), cond, t, e);
        }
        if (expr instanceof CallExpr) {
            return rewriteCall((CallExpr) expr);
        }
        if (expr instanceof MemberExpr) {
            MemberExpr m = (MemberExpr) expr;
            Expression target = rewrite(m.getTarget());
            if (target == m.getTarget()) return expr;
            return new MemberExpr(m.getLocation(), target, m.getMember());
        }
        if (expr instanceof IndexExpr) {
            IndexExpr i = (IndexExpr) expr;
            Expression target = rewrite(i.getTarget());
            Expression index = rewrite(i.getIndex());
            if (target == i.getTarget() && index == i.getIndex()) return expr;
            return new IndexExpr(i.getLocation(), target, index);
        }
        if (expr instanceof LambdaExpr) {
            return rewriteLambda((LambdaExpr) expr);
        }
        throw new IllegalStateException("Unsupported expression: " + expr.getClass().getSimpleName());
    }

    protected Expression rewriteCall(CallExpr call) {
        Expression callee = rewrite(call.getCallee());
        List<Expression> args = rewriteExprs(call.getArgs());
        List<TypeRef> typeArgs = rewriteTypes(call.getTypeArgs());
        return new CallExpr(call.getLocation(), callee, typeArgs, args);
    }

    protected Expression rewriteLambda(LambdaExpr lambda) {
        enterScope();
        try {
            List<LambdaExpr.LambdaParam> params = new ArrayList<LambdaExpr.LambdaParam>();
            for (LambdaExpr.LambdaParam p : lambda.getParams()) {
                TypeRef type = p.getType() != null ? rewriteType(p.getType()) : null;
                params.add(new LambdaExpr.LambdaParam(declare(p.getName()), type));
            }
            if (lambda.isBlockBody()) {
                Block body = lambda.getBlockBody();
                return new LambdaExpr(lambda.getLocation(), params,
                        new Block(body.getLocation(), rewriteAll(body.getStatements())));
            }
            return new LambdaExpr(lambda.getLocation(), params, rewrite(lambda.getExpressionBody()));
        } finally {
            exitScope();
        }
    }

    protected List<Expression> rewriteExprs(List<Expression> exprs) {
        List<Expression> result = new ArrayList<Expression>(exprs.size());
        for (Expression e : exprs) {
            result.add(rewrite(e));
        }
        return result;
    }

    private List<TypeRef> rewriteTypes(List<TypeRef> types) {
        if (types == null) return null;
        List<TypeRef> result = new ArrayList<TypeRef>(types.size());
        for (TypeRef t : types) {
            result.add(rewriteType(t));
        }
        return result;
    }
}
