package com.flatline.compiler.ast;

/**
 * 声明修饰符
 */
public enum Modifier {
    INLINE("inline"),
    PRIVATE("private"),
    PUBLIC("public");

    private final String source;

    Modifier(String source) {
        this.source = source;
    }

    public String toSourceString() {
        return source;
    }
}
