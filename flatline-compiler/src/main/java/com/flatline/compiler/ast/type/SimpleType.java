package com.flatline.compiler.ast.type;

import com.flatline.compiler.ast.AstVisitor;
import com.flatline.compiler.ast.SourceLocation;

import java.util.Map;
import java.util.Set;

/**
 * 简单类型（Int、String、类名或类型参数）
 */
public class SimpleType extends TypeRef {
    private final String name;

    public SimpleType(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public TypeRef substitute(Map<String, TypeRef> bindings) {
        TypeRef bound = bindings.get(name);
        return bound != null ? bound : this;
    }

    @Override
    public boolean mentions(Set<String> names) {
        return names.contains(name);
    }

    @Override
    public String toSourceString() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSimpleType(this, context);
    }
}
