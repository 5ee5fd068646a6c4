package com.flatline.runtime.interpreter;

import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.expr.BinaryExpr.BinaryOp;

import java.util.function.DoubleBinaryOperator;
import java.util.function.IntBinaryOperator;

/**
 * 二元运算的统一实现（短路运算由调用方处理）
 *
 * <p>Int 与 Double 混合时提升为 Double；任一侧为 String 时 {@code +} 为拼接。</p>
 */
final class BinaryOps {

    private BinaryOps() {}

    static Object apply(BinaryOp op, Object left, Object right, SourceLocation location) {
        switch (op) {
            case ADD:
                if (left instanceof String || right instanceof String) {
                    return Interpreter.stringify(left) + Interpreter.stringify(right);
                }
                return numericPromote(op, left, right, location, (a, b) -> a + b, (a, b) -> a + b);
            case SUB:
                return numericPromote(op, left, right, location, (a, b) -> a - b, (a, b) -> a - b);
            case MUL:
                return numericPromote(op, left, right, location, (a, b) -> a * b, (a, b) -> a * b);
            case DIV:
                checkDivisor(right, location);
                return numericPromote(op, left, right, location, (a, b) -> a / b, (a, b) -> a / b);
            case MOD:
                checkDivisor(right, location);
                return numericPromote(op, left, right, location, (a, b) -> a % b, (a, b) -> a % b);
            case EQ:
                return Interpreter.valueEquals(left, right);
            case NE:
                return !Interpreter.valueEquals(left, right);
            case LT:
                return compare(op, left, right, location) < 0;
            case GT:
                return compare(op, left, right, location) > 0;
            case LE:
                return compare(op, left, right, location) <= 0;
            case GE:
                return compare(op, left, right, location) >= 0;
            default:
                throw new FlatlineRuntimeException("Unsupported operator " + op.toSourceString(), location);
        }
    }

    static Object negate(Object value, SourceLocation location) {
        if (value instanceof Integer) {
            return -(Integer) value;
        }
        if (value instanceof Double) {
            return -(Double) value;
        }
        throw new FlatlineRuntimeException("Cannot negate " + Interpreter.stringify(value), location);
    }

    // ============ 数值类型提升 ============

    private static Object numericPromote(BinaryOp op, Object left, Object right, SourceLocation location,
                                         IntBinaryOperator intOp, DoubleBinaryOperator doubleOp) {
        if (!(left instanceof Number) || !(right instanceof Number)) {
            throw operandError(op, left, right, location);
        }
        if (left instanceof Double || right instanceof Double) {
            return doubleOp.applyAsDouble(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        return intOp.applyAsInt(((Number) left).intValue(), ((Number) right).intValue());
    }

    private static int compare(BinaryOp op, Object left, Object right, SourceLocation location) {
        if (left instanceof Number && right instanceof Number) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        if (left instanceof String && right instanceof String) {
            return ((String) left).compareTo((String) right);
        }
        throw operandError(op, left, right, location);
    }

    private static void checkDivisor(Object right, SourceLocation location) {
        if (right instanceof Integer && (Integer) right == 0) {
            throw new FlatlineRuntimeException("Division by zero", location);
        }
    }

    private static FlatlineRuntimeException operandError(BinaryOp op, Object left, Object right,
                                                         SourceLocation location) {
        return new FlatlineRuntimeException("Operator " + op.toSourceString() + " cannot be applied to "
                + Interpreter.stringify(left) + " and " + Interpreter.stringify(right), location);
    }
}
