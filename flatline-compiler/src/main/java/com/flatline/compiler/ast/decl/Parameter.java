package com.flatline.compiler.ast.decl;

import com.flatline.compiler.ast.AstNode;
import com.flatline.compiler.ast.AstVisitor;
import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.type.TypeRef;

/**
 * 函数参数
 */
public class Parameter extends AstNode {
    private final String name;
    private final TypeRef type;

    public Parameter(SourceLocation location, String name, TypeRef type) {
        super(location);
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
