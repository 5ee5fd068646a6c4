package com.flatline.cli;

import com.flatline.compiler.parser.ParseException;
import com.flatline.engine.ExpansionEngine;
import com.flatline.engine.ExpansionOptions;
import com.flatline.engine.diag.Diagnostic;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 各子命令共用的选项（picocli mixin）
 */
public class CommonOptions {

    @Option(names = {"-l", "--library"}, paramLabel = "FILE", description = "模板库文件（可重复）")
    List<Path> libraries = new ArrayList<Path>();

    @Option(names = "--strict", description = "严格模式：警告也视为失败")
    boolean strict;

    @Option(names = {"-v", "--verbose"}, description = "输出每个调用点的展开过程")
    boolean verbose;

    @Option(names = "--keep-templates", description = "输出中保留源文件自身声明的模板")
    boolean keepTemplates;

    @Option(names = "--indent-size", defaultValue = "4", description = "输出缩进空格数（默认 4）")
    int indentSize;

    ExpansionOptions toExpansionOptions() {
        return new ExpansionOptions()
                .setStripTemplates(!keepTemplates)
                .setIndentSize(indentSize);
    }

    void applyLogging() {
        if (verbose) {
            Main.enableVerboseLogging();
        }
    }

    /**
     * 加载模板库并创建引擎；库无法读取或解析时输出错误并返回 null
     */
    ExpansionEngine createEngine(PrintWriter err) {
        try {
            return new ExpansionEngine(TemplateLibraryCache.shared().library(libraries), toExpansionOptions());
        } catch (IOException e) {
            err.println("错误: 无法读取模板库 - " + e.getMessage());
        } catch (ParseException e) {
            err.println("错误: 模板库解析失败 - " + e.getMessage());
        } catch (IllegalArgumentException e) {
            err.println("错误: " + e.getMessage());
        }
        return null;
    }

    static void printDiagnostics(UnitOutcome outcome, PrintWriter writer) {
        if (outcome.getIoError() != null) {
            writer.println("错误: 无法读取 " + outcome.getFile() + " - " + outcome.getIoError());
            return;
        }
        for (Diagnostic d : outcome.getResult().getDiagnostics()) {
            writer.println(d);
        }
    }
}
