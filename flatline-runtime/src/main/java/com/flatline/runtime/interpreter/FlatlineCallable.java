package com.flatline.runtime.interpreter;

import java.util.List;

/**
 * 可调用值（函数引用、lambda 闭包）
 */
public interface FlatlineCallable {

    int arity();

    Object call(Interpreter interpreter, List<Object> args);
}
