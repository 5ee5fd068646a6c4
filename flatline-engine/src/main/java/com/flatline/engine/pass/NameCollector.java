package com.flatline.engine.pass;

import com.flatline.compiler.ast.decl.ClassDecl;
import com.flatline.compiler.ast.decl.Declaration;
import com.flatline.compiler.ast.decl.FunDecl;
import com.flatline.compiler.ast.decl.Parameter;
import com.flatline.compiler.ast.decl.Program;
import com.flatline.compiler.ast.decl.PropertyDecl;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.expr.Identifier;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 收集程序中出现的所有名字（声明与引用），作为命名分配器的保留名
 */
public final class NameCollector extends TreeRewriter {

    private final Set<String> names = new LinkedHashSet<String>();

    public static Set<String> collect(Iterable<Program> programs) {
        NameCollector collector = new NameCollector();
        for (Program program : programs) {
            for (Declaration decl : program.getDeclarations()) {
                collector.visitDeclaration(decl);
            }
        }
        return collector.names;
    }

    private void visitDeclaration(Declaration decl) {
        names.add(decl.getName());
        if (decl instanceof ClassDecl) {
            for (Declaration member : ((ClassDecl) decl).getMembers()) {
                visitDeclaration(member);
            }
        } else if (decl instanceof PropertyDecl) {
            Expression init = ((PropertyDecl) decl).getInitializer();
            if (init != null) {
                rewrite(init);
            }
        } else if (decl instanceof FunDecl) {
            FunDecl fn = (FunDecl) decl;
            for (Parameter p : fn.getParams()) {
                names.add(p.getName());
            }
            if (fn.getBody() != null) {
                rewriteAll(fn.getBody().getStatements());
            } else if (fn.getExpressionBody() != null) {
                rewrite(fn.getExpressionBody());
            }
        }
    }

    @Override
    protected Expression rewriteIdentifier(Identifier id) {
        names.add(id.getName());
        return id;
    }

    @Override
    protected String declare(String name) {
        names.add(name);
        return name;
    }
}
