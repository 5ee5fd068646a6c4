package com.flatline.compiler.ast.stmt;

import com.flatline.compiler.ast.AstVisitor;
import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.type.TypeRef;

/**
 * for-in 循环 for (x in array)
 */
public class ForStmt extends Statement {
    private final String variable;
    private final TypeRef variableType;  // 可能为 null
    private final Expression iterable;
    private final Statement body;

    public ForStmt(SourceLocation location, String variable, TypeRef variableType,
                   Expression iterable, Statement body) {
        super(location);
        this.variable = variable;
        this.variableType = variableType;
        this.iterable = iterable;
        this.body = body;
    }

    public String getVariable() {
        return variable;
    }

    public TypeRef getVariableType() {
        return variableType;
    }

    public Expression getIterable() {
        return iterable;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
