package com.flatline.compiler.ast.stmt;

import com.flatline.compiler.ast.AstVisitor;
import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.expr.Expression;

/**
 * 三段式 for 循环 for (init; condition; update)
 */
public class ClassicForStmt extends Statement {
    private final Statement initializer;  // 可能为 null
    private final Expression condition;   // 可能为 null
    private final Expression update;      // 可能为 null
    private final Statement body;

    public ClassicForStmt(SourceLocation location, Statement initializer, Expression condition,
                          Expression update, Statement body) {
        super(location);
        this.initializer = initializer;
        this.condition = condition;
        this.update = update;
        this.body = body;
    }

    public Statement getInitializer() {
        return initializer;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getUpdate() {
        return update;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitClassicForStmt(this, context);
    }
}
