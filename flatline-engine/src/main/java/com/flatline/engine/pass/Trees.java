package com.flatline.engine.pass;

import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.decl.PropertyDecl;
import com.flatline.compiler.ast.expr.*;
import com.flatline.compiler.ast.stmt.*;
import com.flatline.compiler.ast.type.TypeRef;
import com.flatline.compiler.ast.type.Types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 合成节点的工厂方法与结构查询
 */
public final class Trees {

    private static final SourceLocation NOWHERE = SourceLocation.UNKNOWN;

    private Trees() {
    }

    // ==================== 构造 ====================

    public static Identifier ident(String name) {
        return new Identifier(NOWHERE, name);
    }

    public static Statement val(String name, Expression init) {
        return new DeclarationStmt(NOWHERE, new PropertyDecl(NOWHERE, name, false, null, init));
    }

    public static Statement var(String name, TypeRef type, Expression init) {
        return new DeclarationStmt(NOWHERE, new PropertyDecl(NOWHERE, name, true, type, init));
    }

    public static Statement assign(String name, Expression value) {
        return new ExpressionStmt(NOWHERE, new AssignExpr(NOWHERE, ident(name), AssignExpr.AssignOp.ASSIGN, value));
    }

    public static Statement stmt(Expression expr) {
        return new ExpressionStmt(NOWHERE, expr);
    }

    public static Block block(List<Statement> statements) {
        return new Block(NOWHERE, statements);
    }

    public static Expression not(Expression expr) {
        return new UnaryExpr(NOWHERE, UnaryExpr.UnaryOp.NOT, expr, true);
    }

    public static Statement breakStmt() {
        return new BreakStmt(NOWHERE);
    }

    /** {@code if (cond) break} */
    public static Statement breakIf(Expression cond) {
        return new IfStmt(NOWHERE, cond, block(Collections.singletonList(breakStmt())), null);
    }

    /** 类型默认值字面量：Int 0，Double 0.0，Boolean false，其余 null */
    public static Literal defaultValue(TypeRef type) {
        if (Types.INT.equals(type)) return Literal.ofInt(NOWHERE, 0);
        if (Types.DOUBLE.equals(type)) return new Literal(NOWHERE, 0.0, Literal.LiteralKind.DOUBLE);
        if (Types.BOOLEAN.equals(type)) return Literal.ofBoolean(NOWHERE, false);
        return Literal.ofNull(NOWHERE);
    }

    /** 块展开为语句列表，其它语句包成单元素列表 */
    public static List<Statement> flatten(Statement stmt) {
        if (stmt == null) return Collections.emptyList();
        if (stmt instanceof Block) return ((Block) stmt).getStatements();
        return Collections.singletonList(stmt);
    }

    public static List<Statement> concat(List<Statement> first, List<Statement> second) {
        List<Statement> result = new ArrayList<Statement>(first.size() + second.size());
        result.addAll(first);
        result.addAll(second);
        return result;
    }

    /** 单条语句直接返回，多条包成块 */
    public static Statement asStatement(List<Statement> statements) {
        return statements.size() == 1 ? statements.get(0) : block(statements);
    }

    // ==================== 查询 ====================

    /**
     * 简单表达式：标识符、this、字面量，以及其上的成员访问和以简单值为下标的索引
     */
    public static boolean isSimple(Expression expr) {
        if (expr instanceof Identifier || expr instanceof ThisExpr || expr instanceof Literal) {
            return true;
        }
        if (expr instanceof MemberExpr) {
            return isSimple(((MemberExpr) expr).getTarget());
        }
        if (expr instanceof IndexExpr) {
            IndexExpr index = (IndexExpr) expr;
            return isSimple(index.getTarget())
                    && (index.getIndex() instanceof Identifier || index.getIndex() instanceof Literal);
        }
        return false;
    }

    /** 求值没有副作用，丢弃时不必保留为语句 */
    public static boolean isPure(Expression expr) {
        if (expr == null || expr instanceof Identifier || expr instanceof ThisExpr
                || expr instanceof Literal || expr instanceof LambdaExpr) {
            return true;
        }
        if (expr instanceof MemberExpr) {
            return isPure(((MemberExpr) expr).getTarget());
        }
        return false;
    }

    /**
     * 语句中是否含有 return（不进入 lambda，lambda 的 return 属于 lambda 自身）
     */
    public static boolean containsReturn(Statement stmt) {
        if (stmt == null) return false;
        if (stmt instanceof ReturnStmt) return true;
        if (stmt instanceof Block) {
            for (Statement s : ((Block) stmt).getStatements()) {
                if (containsReturn(s)) return true;
            }
            return false;
        }
        if (stmt instanceof IfStmt) {
            IfStmt s = (IfStmt) stmt;
            return containsReturn(s.getThenBranch()) || containsReturn(s.getElseBranch());
        }
        if (stmt instanceof WhenStmt) {
            WhenStmt s = (WhenStmt) stmt;
            for (WhenStmt.WhenBranch branch : s.getBranches()) {
                if (containsReturn(branch.getBody())) return true;
            }
            return containsReturn(s.getElseBranch());
        }
        if (stmt instanceof WhileStmt) return containsReturn(((WhileStmt) stmt).getBody());
        if (stmt instanceof ForStmt) return containsReturn(((ForStmt) stmt).getBody());
        if (stmt instanceof ClassicForStmt) return containsReturn(((ClassicForStmt) stmt).getBody());
        return false;
    }

    public static boolean containsReturn(List<Statement> statements) {
        for (Statement s : statements) {
            if (containsReturn(s)) return true;
        }
        return false;
    }

    public static boolean isLoop(Statement stmt) {
        return stmt instanceof WhileStmt || stmt instanceof ForStmt || stmt instanceof ClassicForStmt;
    }

    /**
     * 语句中被赋值或自增自减的变量名（包括 lambda 体内）
     */
    public static Set<String> assignedNames(List<Statement> statements) {
        final Set<String> names = new LinkedHashSet<String>();
        TreeRewriter collector = new TreeRewriter() {
            @Override
            public Expression rewrite(Expression expr) {
                if (expr instanceof AssignExpr && ((AssignExpr) expr).getTarget() instanceof Identifier) {
                    names.add(((Identifier) ((AssignExpr) expr).getTarget()).getName());
                } else if (expr instanceof UnaryExpr && ((UnaryExpr) expr).isMutating()
                        && ((UnaryExpr) expr).getOperand() instanceof Identifier) {
                    names.add(((Identifier) ((UnaryExpr) expr).getOperand()).getName());
                }
                return super.rewrite(expr);
            }
        };
        collector.rewriteAll(statements);
        return names;
    }
}
