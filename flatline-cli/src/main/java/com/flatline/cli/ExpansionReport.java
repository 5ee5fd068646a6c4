package com.flatline.cli;

import com.flatline.compiler.ast.SourceLocation;
import com.flatline.engine.ExpansionResult;
import com.flatline.engine.diag.Diagnostic;
import com.flatline.engine.diag.Severity;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 批量展开的 JSON 报告（Gson）
 *
 * <pre>
 * {
 *   "units": [
 *     { "file": ..., "output": ..., "parsed": true,
 *       "diagnostics": [ { "code": "FL0002", "severity": "INFO", "message": ..., "line": 3, "column": 7 } ],
 *       "generatedFunctions": [ "__lambda_4" ] }
 *   ],
 *   "summary": { "units": 1, "errors": 0, "warnings": 0, "infos": 1 }
 * }
 * </pre>
 */
public final class ExpansionReport {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();
    private final JsonArray units = new JsonArray();
    private int errors;
    private int warnings;
    private int infos;

    /**
     * @param output 写出的文件；没有写出时为 null
     */
    public void add(UnitOutcome outcome, Path output) {
        JsonObject unit = new JsonObject();
        unit.addProperty("file", outcome.getFile().toString());
        if (output != null) {
            unit.addProperty("output", output.toString());
        } else {
            unit.add("output", JsonNull.INSTANCE);
        }
        if (outcome.getIoError() != null) {
            unit.addProperty("error", outcome.getIoError());
            errors++;
            units.add(unit);
            return;
        }

        ExpansionResult result = outcome.getResult();
        unit.addProperty("parsed", result.isParsed());
        JsonArray diagnostics = new JsonArray();
        for (Diagnostic d : result.getDiagnostics()) {
            diagnostics.add(toJson(d));
            count(d.getSeverity());
        }
        unit.add("diagnostics", diagnostics);
        JsonArray generated = new JsonArray();
        for (String name : result.getGeneratedFunctions()) {
            generated.add(name);
        }
        unit.add("generatedFunctions", generated);
        units.add(unit);
    }

    private static JsonObject toJson(Diagnostic d) {
        JsonObject json = new JsonObject();
        json.addProperty("code", d.getCode().getCode());
        json.addProperty("severity", d.getSeverity().name());
        json.addProperty("message", d.getMessage());
        SourceLocation location = d.getLocation();
        json.addProperty("file", location.getFile());
        json.addProperty("line", location.getLine());
        json.addProperty("column", location.getColumn());
        return json;
    }

    private void count(Severity severity) {
        switch (severity) {
            case ERROR:   errors++; break;
            case WARNING: warnings++; break;
            default:      infos++; break;
        }
    }

    public JsonObject toJson() {
        JsonObject summary = new JsonObject();
        summary.addProperty("units", units.size());
        summary.addProperty("errors", errors);
        summary.addProperty("warnings", warnings);
        summary.addProperty("infos", infos);

        JsonObject root = new JsonObject();
        root.add("units", units.deepCopy());
        root.add("summary", summary);
        return root;
    }

    public String render() {
        return gson.toJson(toJson());
    }

    public void write(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(file, render().getBytes(StandardCharsets.UTF_8));
    }
}
