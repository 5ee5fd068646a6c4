package com.flatline.engine.pass;

import com.flatline.compiler.ast.type.TypeRef;

/**
 * 行为体引用的外部局部绑定
 */
public final class Capture {

    private final String name;
    private final TypeRef type;      // 未知时为 null
    private final boolean mutated;   // 行为体内对其赋值

    public Capture(String name, TypeRef type, boolean mutated) {
        this.name = name;
        this.type = type;
        this.mutated = mutated;
    }

    public String getName() { return name; }
    public TypeRef getType() { return type; }
    public boolean isMutated() { return mutated; }

    @Override
    public String toString() {
        return name + (type != null ? ": " + type.toSourceString() : "") + (mutated ? " (mutated)" : "");
    }
}
