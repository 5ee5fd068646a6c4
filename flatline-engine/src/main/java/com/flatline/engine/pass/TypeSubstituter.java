package com.flatline.engine.pass;

import com.flatline.compiler.ast.type.TypeRef;

import java.util.Map;

/**
 * 类型参数替换：只改写类型位置（局部声明、循环变量、lambda 参数、显式类型实参），
 * 与类型参数同名的值标识符不受影响
 */
public final class TypeSubstituter extends TreeRewriter {

    private final Map<String, TypeRef> bindings;

    public TypeSubstituter(Map<String, TypeRef> bindings) {
        this.bindings = bindings;
    }

    @Override
    protected TypeRef rewriteType(TypeRef type) {
        return type.substitute(bindings);
    }
}
