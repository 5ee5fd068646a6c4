package com.flatline.compiler.ast.decl;

import com.flatline.compiler.ast.AstNode;
import com.flatline.compiler.ast.Modifier;
import com.flatline.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 声明基类
 */
public abstract class Declaration extends AstNode {
    protected final Set<Modifier> modifiers;
    protected final String name;

    protected Declaration(SourceLocation location, Set<Modifier> modifiers, String name) {
        super(location);
        this.modifiers = modifiers == null || modifiers.isEmpty()
                ? Collections.<Modifier>emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(modifiers));
        this.name = name;
    }

    public Set<Modifier> getModifiers() {
        return modifiers;
    }

    public boolean hasModifier(Modifier modifier) {
        return modifiers.contains(modifier);
    }

    public String getName() {
        return name;
    }
}
