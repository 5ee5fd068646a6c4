package com.flatline.engine.expand;

import com.flatline.compiler.analysis.CallBinding;
import com.flatline.compiler.analysis.ProgramIndex;
import com.flatline.compiler.analysis.Scope;
import com.flatline.compiler.analysis.Symbol;
import com.flatline.compiler.analysis.SymbolKind;
import com.flatline.compiler.analysis.TypeInferencer;
import com.flatline.compiler.ast.decl.ClassDecl;
import com.flatline.compiler.ast.decl.FunDecl;
import com.flatline.compiler.ast.expr.CallExpr;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.expr.Identifier;
import com.flatline.compiler.ast.expr.MemberExpr;
import com.flatline.compiler.ast.type.TypeRef;
import com.flatline.engine.template.Template;
import com.flatline.engine.template.TemplateLibrary;

import java.util.ArrayList;
import java.util.List;

/**
 * 调用点解析：判断调用是否指向已知模板
 *
 * <p>{@code recv.f(args)} 在接收者类型没有方法 {@code f} 时按扩展调用处理，
 * 接收者作为第一个实参；{@code f(recv, args)} 在名字未被局部变量或所在类的方法遮蔽时处理。
 * 重载选择与泛型绑定交给 {@link TypeInferencer#selectOverload}。
 * 不是模板调用时返回 null，这不是错误。</p>
 */
public final class CallSiteResolver {

    private final TemplateLibrary templates;
    private final TypeInferencer inferencer;

    public CallSiteResolver(TemplateLibrary templates, TypeInferencer inferencer) {
        this.templates = templates;
        this.inferencer = inferencer;
    }

    public CallSite resolve(CallExpr call, Scope scope) {
        Expression callee = call.getCallee();
        String name;
        Expression receiver;
        List<Expression> args;

        if (callee instanceof MemberExpr) {
            MemberExpr member = (MemberExpr) callee;
            name = member.getMember();
            if (!templates.hasTemplate(name)) {
                return null;
            }
            receiver = member.getTarget();
            TypeRef receiverType = inferencer.typeOf(receiver, scope);
            if (inferencer.getIndex().methodOf(receiverType, name) != null) {
                return null;
            }
            args = call.getArgs();
        } else if (callee instanceof Identifier) {
            name = ((Identifier) callee).getName();
            if (!templates.hasTemplate(name) || call.getArgs().isEmpty() || isShadowed(name, scope)) {
                return null;
            }
            receiver = call.getArgs().get(0);
            args = call.getArgs().subList(1, call.getArgs().size());
        } else {
            return null;
        }

        List<FunDecl> candidates = new ArrayList<FunDecl>();
        for (Template template : templates.find(name)) {
            candidates.add(template.getDeclaration());
        }
        CallBinding binding = inferencer.selectOverload(candidates, receiver, args, call.getTypeArgs(), scope);
        if (binding == null) {
            return null;
        }
        Template template = templates.templateOf(binding.getFunction());
        return new CallSite(call, template, receiver, new ArrayList<Expression>(args), binding);
    }

    private boolean isShadowed(String name, Scope scope) {
        Symbol symbol = scope.resolve(name);
        if (symbol != null && symbol.getKind() != SymbolKind.FUNCTION) {
            return true;
        }
        ProgramIndex index = inferencer.getIndex();
        String owner = scope.getEnclosingTypeName();
        ClassDecl cls = owner != null ? index.getClass(owner) : null;
        return cls != null && cls.findMethod(name) != null;
    }
}
