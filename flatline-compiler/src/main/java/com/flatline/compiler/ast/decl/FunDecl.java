package com.flatline.compiler.ast.decl;

import com.flatline.compiler.ast.AstVisitor;
import com.flatline.compiler.ast.Modifier;
import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.stmt.Block;
import com.flatline.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 函数声明
 *
 * <p>主体二选一：块主体或表达式主体（{@code fun f() = expr}）。</p>
 */
public class FunDecl extends Declaration {
    private final List<String> typeParams;
    private final List<Parameter> params;
    private final TypeRef returnType;  // 可能为 null（Unit 或由表达式推断）
    private final Block body;
    private final Expression expressionBody;

    public FunDecl(SourceLocation location, Set<Modifier> modifiers, String name, List<String> typeParams,
                   List<Parameter> params, TypeRef returnType, Block body, Expression expressionBody) {
        super(location, modifiers, name);
        this.typeParams = Collections.unmodifiableList(new ArrayList<String>(typeParams));
        this.params = Collections.unmodifiableList(new ArrayList<Parameter>(params));
        this.returnType = returnType;
        this.body = body;
        this.expressionBody = expressionBody;
    }

    public List<String> getTypeParams() {
        return typeParams;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public Block getBody() {
        return body;
    }

    public Expression getExpressionBody() {
        return expressionBody;
    }

    public boolean hasBody() {
        return body != null || expressionBody != null;
    }

    public boolean isInline() {
        return hasModifier(Modifier.INLINE);
    }

    /** 替换主体，保留签名 */
    public FunDecl withBody(Block newBody) {
        return new FunDecl(location, modifiers, name, typeParams, params, returnType, newBody, null);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunDecl(this, context);
    }
}
