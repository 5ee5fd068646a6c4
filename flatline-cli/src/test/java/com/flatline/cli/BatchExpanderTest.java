package com.flatline.cli;

import com.flatline.compiler.parser.Parser;
import com.flatline.engine.ExpansionEngine;
import com.flatline.engine.diag.DiagnosticCode;
import com.flatline.engine.template.TemplateLibrary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 批量展开与退出码测试
 */
class BatchExpanderTest {

    @TempDir
    Path dir;

    private ExpansionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ExpansionEngine(TemplateLibrary.of(Parser.parseSource(MainTest.LIBRARY, "lib.fl")));
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    @DisplayName("结果按输入顺序返回，相同输入得到相同输出")
    void testOrderAndDeterminism() throws Exception {
        List<Path> files = new ArrayList<Path>();
        for (int i = 0; i < 8; i++) {
            files.add(write("unit" + i + ".fl", MainTest.OK));
        }

        List<UnitOutcome> outcomes = new BatchExpander(engine, 3).expandAll(files);

        assertEquals(8, outcomes.size());
        String expected = outcomes.get(0).getResult().getSource();
        for (int i = 0; i < 8; i++) {
            UnitOutcome outcome = outcomes.get(i);
            assertEquals(files.get(i), outcome.getFile());
            assertTrue(outcome.hasOutput());
            assertEquals(expected, outcome.getResult().getSource());
        }
        assertEquals(ExitCode.OK, ExitCode.of(outcomes, true));
    }

    @Test
    @DisplayName("无法读取的文件记为 I/O 错误")
    void testUnreadable() throws Exception {
        Path ok = write("ok.fl", MainTest.OK);
        Path missing = dir.resolve("missing.fl");

        List<UnitOutcome> outcomes = new BatchExpander(engine, 0).expandAll(Arrays.asList(ok, missing));

        assertNull(outcomes.get(0).getIoError());
        assertNull(outcomes.get(1).getResult());
        assertFalse(outcomes.get(1).hasOutput());
        assertThat(outcomes.get(1).getIoError()).startsWith("NoSuchFileException");
        assertEquals(ExitCode.USAGE, ExitCode.of(outcomes, false));
    }

    @Test
    @DisplayName("警告只在严格模式下算失败，错误总是失败")
    void testExitCodes() throws Exception {
        Path warn = write("warn.fl", MainTest.WARN);
        Path broken = write("broken.fl", "fun (");

        List<UnitOutcome> warned = new BatchExpander(engine, 1).expandAll(Collections.singletonList(warn));
        assertEquals(1, warned.get(0).getResult().count(DiagnosticCode.LEFT_UNEXPANDED));
        assertEquals(ExitCode.OK, ExitCode.of(warned, false));
        assertEquals(ExitCode.FAILED, ExitCode.of(warned, true));

        List<UnitOutcome> failed = new BatchExpander(engine, 1).expandAll(Collections.singletonList(broken));
        assertFalse(failed.get(0).hasOutput());
        assertEquals(ExitCode.FAILED, ExitCode.of(failed, false));
    }

    @Test
    @DisplayName("空输入")
    void testEmpty() throws Exception {
        List<UnitOutcome> outcomes = new BatchExpander(engine, 2).expandAll(Collections.<Path>emptyList());
        assertTrue(outcomes.isEmpty());
        assertEquals(ExitCode.OK, ExitCode.of(outcomes, true));
    }
}
