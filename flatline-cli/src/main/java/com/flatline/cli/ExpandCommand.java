package com.flatline.cli;

import com.flatline.engine.ExpansionEngine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * picocli expand 子命令：展开模板调用并输出源码
 */
@Command(name = "expand", description = "展开模板调用并输出源码")
public class ExpandCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    CommonOptions common;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "待展开的源码文件")
    List<Path> files;

    @Option(names = {"-o", "--output"}, paramLabel = "DIR", description = "输出目录（默认输出到标准输出）")
    Path outputDir;

    @Option(names = "--report", paramLabel = "FILE", description = "写出 JSON 报告")
    Path report;

    @Option(names = "--threads", defaultValue = "0", description = "并行线程数（默认按处理器数）")
    int threads;

    @Override
    public Integer call() throws InterruptedException {
        common.applyLogging();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ExpansionEngine engine = common.createEngine(err);
        if (engine == null) {
            return ExitCode.USAGE;
        }
        List<UnitOutcome> outcomes = new BatchExpander(engine, threads).expandAll(files);

        ExpansionReport summary = new ExpansionReport();
        try {
            for (UnitOutcome outcome : outcomes) {
                CommonOptions.printDiagnostics(outcome, err);
                Path written = null;
                if (outcome.hasOutput()) {
                    written = emit(outcome, out);
                }
                summary.add(outcome, written);
            }
            if (report != null) {
                summary.write(report);
            }
        } catch (IOException e) {
            err.println("错误: 写出失败 - " + e.getMessage());
            return ExitCode.USAGE;
        }
        return ExitCode.of(outcomes, common.strict);
    }

    /**
     * 写到输出目录（与源文件同名），未指定目录时输出到标准输出
     */
    private Path emit(UnitOutcome outcome, PrintWriter out) throws IOException {
        String source = outcome.getResult().getSource();
        if (outputDir == null) {
            out.print(source);
            out.flush();
            return null;
        }
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(outcome.getFile().getFileName().toString());
        Files.write(target, source.getBytes(StandardCharsets.UTF_8));
        return target;
    }
}
