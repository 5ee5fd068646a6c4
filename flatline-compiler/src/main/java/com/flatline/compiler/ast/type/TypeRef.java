package com.flatline.compiler.ast.type;

import com.flatline.compiler.ast.AstNode;
import com.flatline.compiler.ast.SourceLocation;

import java.util.Map;
import java.util.Set;

/**
 * 类型引用基类
 *
 * <p>类型引用按结构比较相等（忽略源码位置），可作为 Map 键使用。</p>
 */
public abstract class TypeRef extends AstNode {

    protected TypeRef(SourceLocation location) {
        super(location);
    }

    /**
     * 将类型参数名替换为绑定的类型，未绑定的名字保持原样
     */
    public abstract TypeRef substitute(Map<String, TypeRef> bindings);

    /**
     * 是否引用了给定的类型参数名之一
     */
    public abstract boolean mentions(Set<String> names);

    /** 返回 Flatline 源码形式 */
    public abstract String toSourceString();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeRef)) return false;
        return toSourceString().equals(((TypeRef) o).toSourceString());
    }

    @Override
    public int hashCode() {
        return toSourceString().hashCode();
    }

    @Override
    public String toString() {
        return toSourceString();
    }
}
