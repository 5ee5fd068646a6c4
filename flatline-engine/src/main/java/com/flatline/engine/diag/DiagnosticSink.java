package com.flatline.engine.diag;

import com.flatline.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个编译单元的诊断收集器
 *
 * <p>每次展开运行独占一个实例，不在线程间共享。</p>
 */
public final class DiagnosticSink {

    private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

    public Diagnostic report(DiagnosticCode code, SourceLocation location, Object... args) {
        Diagnostic diagnostic = new Diagnostic(code, code.format(args), location);
        diagnostics.add(diagnostic);
        return diagnostic;
    }

    public void addAll(List<Diagnostic> others) {
        diagnostics.addAll(others);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public int size() {
        return diagnostics.size();
    }

    /** 丢弃 mark 之后报告的诊断 */
    public void truncate(int mark) {
        while (diagnostics.size() > mark) {
            diagnostics.remove(diagnostics.size() - 1);
        }
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
