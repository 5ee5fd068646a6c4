package com.flatline.engine.diag;

import com.flatline.compiler.ast.SourceLocation;

/**
 * 展开诊断条目：(code, severity, message, location)
 */
public final class Diagnostic {

    private final DiagnosticCode code;
    private final String message;
    private final SourceLocation location;

    public Diagnostic(DiagnosticCode code, String message, SourceLocation location) {
        this.code = code;
        this.message = message;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public DiagnosticCode getCode() { return code; }
    public Severity getSeverity() { return code.getSeverity(); }
    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }

    @Override
    public String toString() {
        return location + ": " + getSeverity().name().toLowerCase() + " " + code.getCode() + ": " + message;
    }
}
