package com.flatline.runtime.interpreter;

/**
 * 控制流异常
 *
 * <p>用于实现 return、break、continue 语句。
 * 这些不是真正的错误，而是用于跳出正常执行流程的机制。</p>
 */
public class ControlFlow extends RuntimeException {

    /**
     * 控制流类型
     */
    public enum Type {
        RETURN,
        BREAK,
        CONTINUE
    }

    private final Type type;
    private final transient Object value;

    private ControlFlow(Type type, Object value) {
        super(null, null, false, false);  // 禁用堆栈跟踪以提高性能
        this.type = type;
        this.value = value;
    }

    public Type getType() {
        return type;
    }

    public Object getValue() {
        return value;
    }

    // ============ 工厂方法 ============

    public static ControlFlow returnValue(Object value) {
        return new ControlFlow(Type.RETURN, value);
    }

    public static ControlFlow breakLoop() {
        return new ControlFlow(Type.BREAK, null);
    }

    public static ControlFlow continueLoop() {
        return new ControlFlow(Type.CONTINUE, null);
    }
}
