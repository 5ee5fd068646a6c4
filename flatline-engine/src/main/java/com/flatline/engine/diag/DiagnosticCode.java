package com.flatline.engine.diag;

/**
 * 诊断代码
 *
 * <p>FL0001 与 FL0002 是对外稳定的两个代码：前者表示输出可能不正确，
 * 后者表示行为体被提取为辅助函数（结果正确但不够简洁）。</p>
 */
public enum DiagnosticCode {
    UNRESOLVED_BEHAVIOR("FL0001", Severity.WARNING,
            "behavior body of '%s' could not be resolved; placeholder emitted, output may be incorrect"),
    BEHAVIOR_EXTRACTED("FL0002", Severity.INFO,
            "behavior body extracted to auxiliary function '%s'"),
    MALFORMED_TEMPLATE("FL0003", Severity.WARNING,
            "template '%s' refused: %s"),
    UNRESOLVED_TYPE_PARAMETER("FL0004", Severity.WARNING,
            "type parameter '%s' of template '%s' could not be resolved; left as-is"),
    LEFT_UNEXPANDED("FL0005", Severity.WARNING,
            "call to template '%s' left unexpanded: %s"),
    DECLARATION_FAILED("FL0006", Severity.ERROR,
            "failed to expand declaration '%s': %s"),
    PARSE_FAILED("FL0007", Severity.ERROR,
            "%s"),
    REPEATED_ARGUMENT("FL0008", Severity.INFO,
            "argument for parameter '%s' of template '%s' is substituted %d times");

    private final String code;
    private final Severity severity;
    private final String format;

    DiagnosticCode(String code, Severity severity, String format) {
        this.code = code;
        this.severity = severity;
        this.format = format;
    }

    public String getCode() {
        return code;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String format(Object... args) {
        return String.format(format, args);
    }
}
