package com.flatline.compiler.ast.expr;

import com.flatline.compiler.ast.AstVisitor;
import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数调用表达式
 *
 * <p>方法调用和扩展调用的被调用者是 {@link MemberExpr}。</p>
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<TypeRef> typeArgs;
    private final List<Expression> args;

    public CallExpr(SourceLocation location, Expression callee, List<TypeRef> typeArgs, List<Expression> args) {
        super(location);
        this.callee = callee;
        this.typeArgs = typeArgs == null ? Collections.<TypeRef>emptyList()
                : Collections.unmodifiableList(new ArrayList<TypeRef>(typeArgs));
        this.args = Collections.unmodifiableList(new ArrayList<Expression>(args));
    }

    public CallExpr(SourceLocation location, Expression callee, List<Expression> args) {
        this(location, callee, null, args);
    }

    public Expression getCallee() {
        return callee;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    public List<Expression> getArgs() {
        return args;
    }

    /** 被调用者为简单名字时返回名字，否则返回 null */
    public String getCalleeName() {
        if (callee instanceof Identifier) {
            return ((Identifier) callee).getName();
        }
        if (callee instanceof MemberExpr) {
            return ((MemberExpr) callee).getMember();
        }
        return null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
