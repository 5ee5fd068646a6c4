package com.flatline.compiler.ast.expr;

import com.flatline.compiler.ast.AstNode;
import com.flatline.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
