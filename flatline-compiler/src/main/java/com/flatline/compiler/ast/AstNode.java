package com.flatline.compiler.ast;

/**
 * AST 节点基类
 *
 * <p>节点不可变：所有字段为 final，子节点列表不可修改。变换总是构造新节点。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
