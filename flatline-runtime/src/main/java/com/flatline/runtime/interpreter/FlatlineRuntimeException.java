package com.flatline.runtime.interpreter;

import com.flatline.compiler.ast.SourceLocation;

/**
 * Flatline 运行时异常，携带出错位置
 */
public class FlatlineRuntimeException extends RuntimeException {

    private final SourceLocation location;

    public FlatlineRuntimeException(String message) {
        super(message);
        this.location = null;
    }

    public FlatlineRuntimeException(String message, SourceLocation location) {
        super(message);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 返回不含位置信息的纯错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (location != null && location.getLine() > 0) {
            return super.getMessage() + " (at " + location + ")";
        }
        return super.getMessage();
    }
}
