package com.flatline.compiler.ast.type;

import com.flatline.compiler.ast.AstVisitor;
import com.flatline.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 泛型类型（如 Array&lt;Int&gt;）
 */
public class GenericType extends TypeRef {
    private final String name;
    private final List<TypeRef> typeArgs;

    public GenericType(SourceLocation location, String name, List<TypeRef> typeArgs) {
        super(location);
        this.name = name;
        this.typeArgs = Collections.unmodifiableList(new ArrayList<TypeRef>(typeArgs));
    }

    public String getName() {
        return name;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    @Override
    public TypeRef substitute(Map<String, TypeRef> bindings) {
        List<TypeRef> args = new ArrayList<TypeRef>(typeArgs.size());
        boolean changed = false;
        for (TypeRef arg : typeArgs) {
            TypeRef sub = arg.substitute(bindings);
            changed |= sub != arg;
            args.add(sub);
        }
        return changed ? new GenericType(location, name, args) : this;
    }

    @Override
    public boolean mentions(Set<String> names) {
        for (TypeRef arg : typeArgs) {
            if (arg.mentions(names)) return true;
        }
        return false;
    }

    @Override
    public String toSourceString() {
        StringBuilder sb = new StringBuilder(name).append('<');
        for (int i = 0; i < typeArgs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(typeArgs.get(i).toSourceString());
        }
        return sb.append('>').toString();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGenericType(this, context);
    }
}
