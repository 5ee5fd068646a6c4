package com.flatline.compiler.ast.decl;

import com.flatline.compiler.ast.AstVisitor;
import com.flatline.compiler.ast.Modifier;
import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.type.TypeRef;

import java.util.Set;

/**
 * 属性 / 变量声明（val/var）
 */
public class PropertyDecl extends Declaration {
    private final boolean mutable;
    private final TypeRef type;              // 可能为 null
    private final Expression initializer;    // 可能为 null

    public PropertyDecl(SourceLocation location, Set<Modifier> modifiers, String name,
                        boolean mutable, TypeRef type, Expression initializer) {
        super(location, modifiers, name);
        this.mutable = mutable;
        this.type = type;
        this.initializer = initializer;
    }

    public PropertyDecl(SourceLocation location, String name, boolean mutable,
                        TypeRef type, Expression initializer) {
        this(location, null, name, mutable, type, initializer);
    }

    public boolean isMutable() {
        return mutable;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public PropertyDecl withInitializer(Expression newInitializer) {
        return new PropertyDecl(location, modifiers, name, mutable, type, newInitializer);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPropertyDecl(this, context);
    }
}
