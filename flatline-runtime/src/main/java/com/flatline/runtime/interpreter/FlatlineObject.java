package com.flatline.runtime.interpreter;

import com.flatline.compiler.ast.decl.ClassDecl;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 类实例
 */
public final class FlatlineObject {

    private final ClassDecl classDecl;
    private final Map<String, Object> fields = new LinkedHashMap<String, Object>();

    public FlatlineObject(ClassDecl classDecl) {
        this.classDecl = classDecl;
    }

    public ClassDecl getClassDecl() {
        return classDecl;
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    public Object getField(String name) {
        if (!fields.containsKey(name)) {
            throw new FlatlineRuntimeException("Unknown field '" + name + "' on " + classDecl.getName());
        }
        return fields.get(name);
    }

    public void setField(String name, Object value) {
        fields.put(name, value);
    }

    @Override
    public String toString() {
        return classDecl.getName() + fields;
    }
}
