package com.flatline.engine.expand;

import com.flatline.compiler.analysis.ProgramIndex;
import com.flatline.compiler.analysis.Scope;
import com.flatline.compiler.analysis.TypeInferencer;
import com.flatline.compiler.ast.decl.ClassDecl;
import com.flatline.compiler.ast.decl.Declaration;
import com.flatline.compiler.ast.decl.FunDecl;
import com.flatline.compiler.ast.decl.Program;
import com.flatline.compiler.ast.decl.PropertyDecl;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.stmt.Block;
import com.flatline.compiler.ast.stmt.ExpressionStmt;
import com.flatline.compiler.ast.stmt.ReturnStmt;
import com.flatline.compiler.ast.stmt.Statement;
import com.flatline.compiler.ast.type.TypeRef;
import com.flatline.compiler.ast.type.Types;
import com.flatline.engine.diag.DiagnosticCode;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 展开一个编译单元的所有声明
 *
 * <p>每个声明独立处理：意外失败时回滚该声明产生的诊断与辅助函数，报告 FL0006，原样输出该声明。
 * 提取出的辅助函数追加到所在类的成员末尾，顶层代码的追加到单元末尾。</p>
 */
public final class UnitExpander {

    private static final Logger LOG = Logger.getLogger(UnitExpander.class.getName());

    private final ExpansionContext ctx;
    private final TypeInferencer inferencer;
    private final ProgramIndex index;
    private final TemplateCallRewriter rewriter;

    public UnitExpander(ExpansionContext ctx) {
        this.ctx = ctx;
        this.inferencer = ctx.getInferencer();
        this.index = inferencer.getIndex();
        this.rewriter = new TemplateCallRewriter(ctx);
    }

    public Program expand(Program unit) {
        Scope global = index.globalScope(inferencer);
        List<Declaration> out = new ArrayList<Declaration>();
        List<FunDecl> generated = new ArrayList<FunDecl>();
        for (Declaration decl : unit.getDeclarations()) {
            if (isStripped(decl)) {
                continue;
            }
            out.add(expandIsolated(decl, global));
            generated.addAll(ctx.drainGenerated());
        }
        out.addAll(generated);
        return new Program(unit.getLocation(), unit.getFileName(), out);
    }

    private boolean isStripped(Declaration decl) {
        return ctx.getOptions().isStripTemplates()
                && decl instanceof FunDecl
                && ctx.getTemplates().templateOf((FunDecl) decl) != null;
    }

    private Declaration expandIsolated(Declaration decl, Scope scope) {
        ExpansionContext.Mark mark = ctx.mark();
        try {
            return expandDeclaration(decl, scope);
        } catch (RuntimeException e) {
            ctx.rollback(mark);
            ctx.report(DiagnosticCode.DECLARATION_FAILED, decl.getLocation(), decl.getName(), String.valueOf(e.getMessage()));
            LOG.log(Level.WARNING, "Expansion of '" + decl.getName() + "' failed, emitted unchanged", e);
            return decl;
        }
    }

    private Declaration expandDeclaration(Declaration decl, Scope scope) {
        if (decl instanceof FunDecl) {
            return expandFunction((FunDecl) decl, scope);
        }
        if (decl instanceof PropertyDecl) {
            return expandProperty((PropertyDecl) decl, scope);
        }
        if (decl instanceof ClassDecl) {
            return expandClass((ClassDecl) decl, scope);
        }
        return decl;
    }

    private FunDecl expandFunction(FunDecl fn, Scope parent) {
        if (!fn.hasBody()) {
            return fn;
        }
        Scope scope = index.functionScope(fn, parent);
        if (fn.getBody() != null) {
            List<Statement> body = rewriter.rewriteStatements(fn.getBody().getStatements(),
                    scope.child(Scope.ScopeType.BLOCK));
            return fn.withBody(new Block(fn.getBody().getLocation(), body));
        }

        // 表达式主体：需要提升语句时改为块主体
        Expression expr = fn.getExpressionBody();
        List<Statement> hoists = new ArrayList<Statement>();
        Expression value = rewriter.rewriteExpr(expr, scope, hoists);
        if (hoists.isEmpty()) {
            return value == expr ? fn : new FunDecl(fn.getLocation(), fn.getModifiers(), fn.getName(),
                    fn.getTypeParams(), fn.getParams(), fn.getReturnType(), null, value);
        }
        TypeRef returnType = inferencer.returnTypeOf(fn);
        List<Statement> body = new ArrayList<Statement>(hoists);
        if (Types.UNIT.equals(returnType)) {
            body.add(new ExpressionStmt(value.getLocation(), value));
        } else {
            body.add(new ReturnStmt(value.getLocation(), value));
        }
        LOG.fine("Converted expression body of '" + fn.getName() + "' to a block");
        return new FunDecl(fn.getLocation(), fn.getModifiers(), fn.getName(), fn.getTypeParams(),
                fn.getParams(), returnType, new Block(expr.getLocation(), body), null);
    }

    /** 属性初始化无法容纳提升语句：需要时放弃展开并报告 */
    private PropertyDecl expandProperty(PropertyDecl property, Scope scope) {
        Expression init = property.getInitializer();
        if (init == null) {
            return property;
        }
        ExpansionContext.Mark mark = ctx.mark();
        List<Statement> hoists = new ArrayList<Statement>();
        Expression value = rewriter.rewriteExpr(init, scope, hoists);
        if (hoists.isEmpty()) {
            return value == init ? property : property.withInitializer(value);
        }
        ctx.rollback(mark);
        ctx.report(DiagnosticCode.LEFT_UNEXPANDED, init.getLocation(),
                HoistingRewriter.expandedCallName(init), "property initializer would need hoisted statements");
        return property;
    }

    private ClassDecl expandClass(ClassDecl cls, Scope parent) {
        Scope scope = index.classScope(cls, parent, inferencer);
        List<Declaration> members = new ArrayList<Declaration>();
        for (Declaration member : cls.getMembers()) {
            members.add(expandIsolated(member, scope));
        }
        members.addAll(ctx.drainGenerated());
        return cls.withMembers(members);
    }
}
