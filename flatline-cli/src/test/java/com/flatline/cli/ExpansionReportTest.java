package com.flatline.cli;

import com.flatline.compiler.parser.Parser;
import com.flatline.engine.ExpansionEngine;
import com.flatline.engine.template.TemplateLibrary;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JSON 报告测试
 */
class ExpansionReportTest {

    @TempDir
    Path dir;

    private final ExpansionEngine engine =
            new ExpansionEngine(TemplateLibrary.of(Parser.parseSource(MainTest.LIBRARY, "lib.fl")));

    @Test
    @DisplayName("展开结果的字段与汇总")
    void testExpandedUnit() {
        ExpansionReport report = new ExpansionReport();
        UnitOutcome outcome = UnitOutcome.expanded(Paths.get("warn.fl"), engine.expandSource(MainTest.WARN, "warn.fl"));
        report.add(outcome, Paths.get("out", "warn.fl"));

        JsonObject json = report.toJson();
        JsonObject unit = json.getAsJsonArray("units").get(0).getAsJsonObject();
        assertEquals("warn.fl", unit.get("file").getAsString());
        assertEquals(Paths.get("out", "warn.fl").toString(), unit.get("output").getAsString());
        assertTrue(unit.get("parsed").getAsBoolean());

        JsonObject diagnostic = unit.getAsJsonArray("diagnostics").get(0).getAsJsonObject();
        assertEquals("FL0005", diagnostic.get("code").getAsString());
        assertEquals("WARNING", diagnostic.get("severity").getAsString());
        assertEquals("warn.fl", diagnostic.get("file").getAsString());
        assertEquals(1, diagnostic.get("line").getAsInt());
        assertEquals(0, unit.getAsJsonArray("generatedFunctions").size());

        JsonObject summary = json.getAsJsonObject("summary");
        assertEquals(1, summary.get("units").getAsInt());
        assertEquals(0, summary.get("errors").getAsInt());
        assertEquals(1, summary.get("warnings").getAsInt());
    }

    @Test
    @DisplayName("读取失败与解析失败都计为错误")
    void testErrors() {
        ExpansionReport report = new ExpansionReport();
        report.add(UnitOutcome.unreadable(Paths.get("gone.fl"), "NoSuchFileException: gone.fl"), null);
        report.add(UnitOutcome.expanded(Paths.get("broken.fl"), engine.expandSource("fun (", "broken.fl")), null);

        JsonObject json = report.toJson();
        JsonObject gone = json.getAsJsonArray("units").get(0).getAsJsonObject();
        assertTrue(gone.get("output").isJsonNull());
        assertEquals("NoSuchFileException: gone.fl", gone.get("error").getAsString());
        assertFalse(gone.has("diagnostics"));

        JsonObject broken = json.getAsJsonArray("units").get(1).getAsJsonObject();
        assertFalse(broken.get("parsed").getAsBoolean());
        assertEquals(2, json.getAsJsonObject("summary").get("errors").getAsInt());
    }

    @Test
    @DisplayName("写出时创建父目录，内容可重新解析")
    void testWrite() throws IOException {
        ExpansionReport report = new ExpansionReport();
        report.add(UnitOutcome.expanded(Paths.get("ok.fl"), engine.expandSource(MainTest.OK, "ok.fl")), null);
        Path target = dir.resolve("nested/dir/report.json");

        report.write(target);

        String text = new String(Files.readAllBytes(target), StandardCharsets.UTF_8);
        assertTrue(text.contains("\n  \"units\""));
        assertEquals(report.toJson(), JsonParser.parseString(text));
    }
}
