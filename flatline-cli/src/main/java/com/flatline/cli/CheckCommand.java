package com.flatline.cli;

import com.flatline.engine.ExpansionEngine;
import com.flatline.engine.diag.Severity;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * picocli check 子命令：只展开并报告诊断，不写出源码
 */
@Command(name = "check", description = "检查模板调用能否展开，只输出诊断")
public class CheckCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    CommonOptions common;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "待检查的源码文件")
    List<Path> files;

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

        int errors = 0;
        int warnings = 0;
        for (UnitOutcome outcome : outcomes) {
            CommonOptions.printDiagnostics(outcome, out);
            if (outcome.getResult() != null) {
                errors += outcome.getResult().count(Severity.ERROR);
                warnings += outcome.getResult().count(Severity.WARNING);
            }
        }
        out.println(String.format("已检查 %d 个文件: %d 个错误, %d 个警告", outcomes.size(), errors, warnings));
        out.flush();
        return ExitCode.of(outcomes, common.strict);
    }
}
