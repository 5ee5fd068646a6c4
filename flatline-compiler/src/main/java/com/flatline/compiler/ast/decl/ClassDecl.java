package com.flatline.compiler.ast.decl;

import com.flatline.compiler.ast.AstVisitor;
import com.flatline.compiler.ast.Modifier;
import com.flatline.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 类声明（字段与方法）
 */
public class ClassDecl extends Declaration {
    private final List<Declaration> members;

    public ClassDecl(SourceLocation location, Set<Modifier> modifiers, String name, List<Declaration> members) {
        super(location, modifiers, name);
        this.members = Collections.unmodifiableList(new ArrayList<Declaration>(members));
    }

    public List<Declaration> getMembers() {
        return members;
    }

    public List<PropertyDecl> getFields() {
        List<PropertyDecl> fields = new ArrayList<PropertyDecl>();
        for (Declaration m : members) {
            if (m instanceof PropertyDecl) fields.add((PropertyDecl) m);
        }
        return fields;
    }

    public List<FunDecl> getMethods() {
        List<FunDecl> methods = new ArrayList<FunDecl>();
        for (Declaration m : members) {
            if (m instanceof FunDecl) methods.add((FunDecl) m);
        }
        return methods;
    }

    public PropertyDecl findField(String fieldName) {
        for (PropertyDecl f : getFields()) {
            if (f.getName().equals(fieldName)) return f;
        }
        return null;
    }

    public FunDecl findMethod(String methodName) {
        for (FunDecl m : getMethods()) {
            if (m.getName().equals(methodName)) return m;
        }
        return null;
    }

    public ClassDecl withMembers(List<Declaration> newMembers) {
        return new ClassDecl(location, modifiers, name, newMembers);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitClassDecl(this, context);
    }
}
