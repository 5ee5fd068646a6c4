package com.flatline.compiler.ast.expr;

import com.flatline.compiler.ast.AstVisitor;
import com.flatline.compiler.ast.SourceLocation;

/**
 * 赋值表达式
 */
public class AssignExpr extends Expression {
    private final Expression target;
    private final AssignOp operator;
    private final Expression value;

    public AssignExpr(SourceLocation location, Expression target, AssignOp operator, Expression value) {
        super(location);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public AssignOp getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignExpr(this, context);
    }

    public enum AssignOp {
        ASSIGN("=", null),
        ADD_ASSIGN("+=", BinaryExpr.BinaryOp.ADD),
        SUB_ASSIGN("-=", BinaryExpr.BinaryOp.SUB),
        MUL_ASSIGN("*=", BinaryExpr.BinaryOp.MUL),
        DIV_ASSIGN("/=", BinaryExpr.BinaryOp.DIV),
        MOD_ASSIGN("%=", BinaryExpr.BinaryOp.MOD);

        private final String source;
        private final BinaryExpr.BinaryOp binaryOp;

        AssignOp(String source, BinaryExpr.BinaryOp binaryOp) {
            this.source = source;
            this.binaryOp = binaryOp;
        }

        public String toSourceString() {
            return source;
        }

        /** 复合赋值对应的二元运算，普通赋值返回 null */
        public BinaryExpr.BinaryOp getBinaryOp() {
            return binaryOp;
        }
    }
}
