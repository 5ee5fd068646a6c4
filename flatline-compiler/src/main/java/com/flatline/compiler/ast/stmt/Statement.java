package com.flatline.compiler.ast.stmt;

import com.flatline.compiler.ast.AstNode;
import com.flatline.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
