package com.flatline.compiler.ast.expr;

import com.flatline.compiler.ast.AstVisitor;
import com.flatline.compiler.ast.SourceLocation;

/**
 * 一元表达式（前缀 ! - ++ --，后缀 ++ --）
 */
public class UnaryExpr extends Expression {
    private final UnaryOp operator;
    private final Expression operand;
    private final boolean prefix;

    public UnaryExpr(SourceLocation location, UnaryOp operator, Expression operand, boolean prefix) {
        super(location);
        this.operator = operator;
        this.operand = operand;
        this.prefix = prefix;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    public boolean isPrefix() {
        return prefix;
    }

    /** 是否修改操作数（++ / --） */
    public boolean isMutating() {
        return operator == UnaryOp.INC || operator == UnaryOp.DEC;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpr(this, context);
    }

    public enum UnaryOp {
        NEG("-"),
        NOT("!"),
        INC("++"),
        DEC("--");

        private final String source;

        UnaryOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }
    }
}
