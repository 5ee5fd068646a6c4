package com.flatline.compiler.ast.expr;

import com.flatline.compiler.ast.AstVisitor;
import com.flatline.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符（precedence 越大绑定越紧）
     */
    public enum BinaryOp {
        // 算术
        ADD("+", 5),
        SUB("-", 5),
        MUL("*", 6),
        DIV("/", 6),
        MOD("%", 6),

        // 比较
        EQ("==", 3),
        NE("!=", 3),
        LT("<", 4),
        GT(">", 4),
        LE("<=", 4),
        GE(">=", 4),

        // 逻辑
        AND("&&", 2),
        OR("||", 1);

        private final String source;
        private final int precedence;

        BinaryOp(String source, int precedence) {
            this.source = source;
            this.precedence = precedence;
        }

        /** 返回 Flatline 源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public int getPrecedence() {
            return precedence;
        }

        public boolean isShortCircuit() {
            return this == AND || this == OR;
        }
    }
}
