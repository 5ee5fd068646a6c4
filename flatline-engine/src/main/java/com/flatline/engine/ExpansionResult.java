package com.flatline.engine;

import com.flatline.compiler.ast.decl.Program;
import com.flatline.engine.diag.Diagnostic;
import com.flatline.engine.diag.DiagnosticCode;
import com.flatline.engine.diag.Severity;

import java.util.Collections;
import java.util.List;

/**
 * 一个编译单元的展开结果
 */
public final class ExpansionResult {
    private final String fileName;
    private final Program program;
    private final String source;
    private final List<Diagnostic> diagnostics;
    private final List<String> generatedFunctions;

    public ExpansionResult(String fileName, Program program, String source,
                           List<Diagnostic> diagnostics, List<String> generatedFunctions) {
        this.fileName = fileName;
        this.program = program;
        this.source = source;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
        this.generatedFunctions = Collections.unmodifiableList(generatedFunctions);
    }

    public String getFileName() { return fileName; }

    /** 展开后的语法树；源码无法解析时为 null */
    public Program getProgram() { return program; }

    /** 重新输出的源码；源码无法解析时为 null */
    public String getSource() { return source; }

    public List<Diagnostic> getDiagnostics() { return diagnostics; }

    /** 提取出的辅助函数名，按生成顺序 */
    public List<String> getGeneratedFunctions() { return generatedFunctions; }

    public boolean isParsed() {
        return program != null;
    }

    public boolean hasErrors() {
        return count(Severity.ERROR) > 0;
    }

    public int count(Severity severity) {
        int n = 0;
        for (Diagnostic d : diagnostics) {
            if (d.getSeverity() == severity) n++;
        }
        return n;
    }

    public int count(DiagnosticCode code) {
        int n = 0;
        for (Diagnostic d : diagnostics) {
            if (d.getCode() == code) n++;
        }
        return n;
    }
}
