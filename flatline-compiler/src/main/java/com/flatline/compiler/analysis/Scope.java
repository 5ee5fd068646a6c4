package com.flatline.compiler.analysis;

import com.flatline.compiler.ast.type.TypeRef;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 作用域
 */
public final class Scope {

    public enum ScopeType {
        GLOBAL,     // 顶层
        CLASS,      // class body
        FUNCTION,   // function body
        BLOCK,      // if/for/while block
        LAMBDA      // lambda body
    }

    private final ScopeType type;
    private final Scope parent;
    private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();

    // 所属类型名（class scope 中 = 类名，用于 this 类型推断）
    private String ownerTypeName;

    public Scope(ScopeType type, Scope parent) {
        this.type = type;
        this.parent = parent;
    }

    public ScopeType getType() { return type; }
    public Scope getParent() { return parent; }
    public Map<String, Symbol> getSymbols() { return symbols; }

    public String getOwnerTypeName() { return ownerTypeName; }
    public void setOwnerTypeName(String ownerTypeName) { this.ownerTypeName = ownerTypeName; }

    /** 创建子作用域 */
    public Scope child(ScopeType childType) {
        return new Scope(childType, this);
    }

    /** 注册符号到当前作用域 */
    public void define(Symbol symbol) {
        symbols.put(symbol.getName(), symbol);
    }

    public void defineLocal(String name, TypeRef symbolType, boolean mutable) {
        define(new Symbol(name, SymbolKind.LOCAL, symbolType, mutable, null));
    }

    public void defineParameter(String name, TypeRef symbolType) {
        define(new Symbol(name, SymbolKind.PARAMETER, symbolType, false, null));
    }

    /** 从当前作用域向上查找 */
    public Symbol resolve(String name) {
        Symbol s = symbols.get(name);
        if (s != null) return s;
        if (parent != null) return parent.resolve(name);
        return null;
    }

    /** 仅查找当前作用域 */
    public Symbol resolveLocal(String name) {
        return symbols.get(name);
    }

    /** 查找最近的类作用域的 ownerTypeName（用于 this 推断） */
    public String getEnclosingTypeName() {
        if (type == ScopeType.CLASS) return ownerTypeName;
        if (parent != null) return parent.getEnclosingTypeName();
        return null;
    }
}
