package com.flatline.cli;

import com.flatline.engine.ExpansionResult;
import com.flatline.engine.diag.Severity;

import java.nio.file.Path;

/**
 * 批处理中一个文件的结果：展开结果，或读取失败的原因
 */
public final class UnitOutcome {

    private final Path file;
    private final ExpansionResult result;
    private final String ioError;

    private UnitOutcome(Path file, ExpansionResult result, String ioError) {
        this.file = file;
        this.result = result;
        this.ioError = ioError;
    }

    public static UnitOutcome expanded(Path file, ExpansionResult result) {
        return new UnitOutcome(file, result, null);
    }

    public static UnitOutcome unreadable(Path file, String reason) {
        return new UnitOutcome(file, null, reason);
    }

    public Path getFile() { return file; }

    /** 读取失败时为 null */
    public ExpansionResult getResult() { return result; }

    public String getIoError() { return ioError; }

    /** 是否有可写出的源码 */
    public boolean hasOutput() {
        return result != null && result.isParsed();
    }

    public boolean isFailed(boolean strict) {
        if (result == null) {
            return true;
        }
        return result.hasErrors() || (strict && result.count(Severity.WARNING) > 0);
    }
}
