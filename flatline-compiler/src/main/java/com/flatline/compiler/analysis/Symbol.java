package com.flatline.compiler.analysis;

import com.flatline.compiler.ast.AstNode;
import com.flatline.compiler.ast.type.TypeRef;

/**
 * 符号表中的符号
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final TypeRef type;           // 未知时为 null
    private final boolean mutable;        // true = var, false = val/param
    private final AstNode declaration;    // 声明的 AST 节点，合成符号为 null

    public Symbol(String name, SymbolKind kind, TypeRef type, boolean mutable, AstNode declaration) {
        this.name = name;
        this.kind = kind;
        this.type = type;
        this.mutable = mutable;
        this.declaration = declaration;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public TypeRef getType() { return type; }
    public boolean isMutable() { return mutable; }
    public AstNode getDeclaration() { return declaration; }

    /** 是否为局部绑定（局部变量或参数），即可被 lambda 捕获的变量 */
    public boolean isLocalBinding() {
        return kind == SymbolKind.LOCAL || kind == SymbolKind.PARAMETER;
    }

    @Override
    public String toString() {
        return kind + " " + name + (type != null ? ": " + type : "");
    }
}
