package com.flatline.runtime.interpreter;

import com.flatline.compiler.ast.decl.FunDecl;

import java.util.List;

/**
 * 函数引用（顶层函数或绑定到实例的方法）
 */
final class FunctionValue implements FlatlineCallable {

    private final FunDecl function;
    private final FlatlineObject self;

    FunctionValue(FunDecl function, FlatlineObject self) {
        this.function = function;
        this.self = self;
    }

    @Override
    public int arity() {
        return function.getParams().size();
    }

    @Override
    public Object call(Interpreter interpreter, List<Object> args) {
        return interpreter.invoke(function, self, args);
    }

    @Override
    public String toString() {
        return "<fun " + function.getName() + ">";
    }
}
