package com.flatline.engine.diag;

import com.flatline.compiler.ast.SourceLocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * DiagnosticSink 单元测试
 */
class DiagnosticSinkTest {

    private static final SourceLocation AT = new SourceLocation("main.fl", 3, 7, 40, 5);

    @Test
    @DisplayName("按代码格式化消息，严重级别取自代码")
    void testReport() {
        DiagnosticSink sink = new DiagnosticSink();
        Diagnostic d = sink.report(DiagnosticCode.LEFT_UNEXPANDED, AT, "sum", "recursive instantiation");

        assertEquals("call to template 'sum' left unexpanded: recursive instantiation", d.getMessage());
        assertEquals(Severity.WARNING, d.getSeverity());
        assertThat(d.toString()).contains("warning FL0005").contains("main.fl");
    }

    @Test
    @DisplayName("截断丢弃标记之后的诊断")
    void testTruncate() {
        DiagnosticSink sink = new DiagnosticSink();
        sink.report(DiagnosticCode.BEHAVIOR_EXTRACTED, AT, "__lambda_1");
        int mark = sink.size();
        sink.report(DiagnosticCode.DECLARATION_FAILED, AT, "main", "boom");
        sink.report(DiagnosticCode.UNRESOLVED_BEHAVIOR, AT, "__f_2");

        assertTrue(sink.hasErrors());
        sink.truncate(mark);

        assertEquals(1, sink.size());
        assertFalse(sink.hasErrors());
        assertEquals(1, sink.count(DiagnosticCode.BEHAVIOR_EXTRACTED));
        assertEquals(0, sink.count(Severity.WARNING));
    }

    @Test
    @DisplayName("FL0001 与 FL0002 的代码保持稳定")
    void testStableCodes() {
        assertEquals("FL0001", DiagnosticCode.UNRESOLVED_BEHAVIOR.getCode());
        assertEquals("FL0002", DiagnosticCode.BEHAVIOR_EXTRACTED.getCode());
        assertEquals(Severity.INFO, DiagnosticCode.BEHAVIOR_EXTRACTED.getSeverity());
    }
}
