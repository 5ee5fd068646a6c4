package com.flatline.compiler.analysis;

/**
 * 符号类型
 */
public enum SymbolKind {
    LOCAL,      // val/var 局部变量、for 循环变量
    PARAMETER,  // 函数参数、lambda 参数
    FIELD,      // 类字段
    GLOBAL,     // 顶层属性
    FUNCTION,   // 顶层函数或方法
    CLASS       // 类
}
