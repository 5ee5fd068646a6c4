package com.flatline.cli;

import java.util.List;

/**
 * 进程退出码
 */
public final class ExitCode {

    /** 成功 */
    public static final int OK = 0;
    /** 有错误诊断（--strict 下警告也算） */
    public static final int FAILED = 1;
    /** 用法错误或读写失败 */
    public static final int USAGE = 2;

    private ExitCode() {
    }

    /**
     * 汇总一批编译单元的退出码；读写失败优先于诊断
     */
    public static int of(List<UnitOutcome> outcomes, boolean strict) {
        int code = OK;
        for (UnitOutcome outcome : outcomes) {
            if (outcome.getIoError() != null) {
                return USAGE;
            }
            if (outcome.isFailed(strict)) {
                code = FAILED;
            }
        }
        return code;
    }
}
