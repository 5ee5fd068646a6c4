package com.flatline.compiler.ast.type;

import com.flatline.compiler.ast.AstVisitor;
import com.flatline.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 函数类型 (A, B) -> R
 */
public class FunctionType extends TypeRef {
    private final List<TypeRef> paramTypes;
    private final TypeRef returnType;

    public FunctionType(SourceLocation location, List<TypeRef> paramTypes, TypeRef returnType) {
        super(location);
        this.paramTypes = Collections.unmodifiableList(new ArrayList<TypeRef>(paramTypes));
        this.returnType = returnType;
    }

    public List<TypeRef> getParamTypes() {
        return paramTypes;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    @Override
    public TypeRef substitute(Map<String, TypeRef> bindings) {
        List<TypeRef> params = new ArrayList<TypeRef>(paramTypes.size());
        boolean changed = false;
        for (TypeRef p : paramTypes) {
            TypeRef sub = p.substitute(bindings);
            changed |= sub != p;
            params.add(sub);
        }
        TypeRef ret = returnType.substitute(bindings);
        changed |= ret != returnType;
        return changed ? new FunctionType(location, params, ret) : this;
    }

    @Override
    public boolean mentions(Set<String> names) {
        for (TypeRef p : paramTypes) {
            if (p.mentions(names)) return true;
        }
        return returnType.mentions(names);
    }

    @Override
    public String toSourceString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < paramTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(paramTypes.get(i).toSourceString());
        }
        return sb.append(") -> ").append(returnType.toSourceString()).toString();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionType(this, context);
    }
}
