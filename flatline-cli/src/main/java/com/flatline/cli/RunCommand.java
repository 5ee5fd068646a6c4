package com.flatline.cli;

import com.flatline.compiler.ast.decl.Program;
import com.flatline.compiler.parser.ParseException;
import com.flatline.compiler.parser.Parser;
import com.flatline.engine.ExpansionEngine;
import com.flatline.engine.ExpansionResult;
import com.flatline.runtime.interpreter.FlatlineRuntimeException;
import com.flatline.runtime.interpreter.Interpreter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * picocli run 子命令：展开后在解释器中执行入口函数
 *
 * <p>模板库同时加载到解释器中，未能展开的模板调用（FL0005）仍按普通函数执行。</p>
 */
@Command(name = "run", description = "展开后执行入口函数")
public class RunCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    CommonOptions common;

    @Parameters(index = "0", paramLabel = "FILE", description = "源码文件")
    Path file;

    @Option(names = "--entry", defaultValue = "main", description = "入口函数（默认 main）")
    String entry;

    @Option(names = "--no-expand", description = "不展开，直接执行")
    boolean noExpand;

    @Override
    public Integer call() throws IOException {
        common.applyLogging();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ExpansionEngine engine = common.createEngine(err);
        if (engine == null) {
            return ExitCode.USAGE;
        }
        String source;
        try {
            source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("错误: 无法读取 " + file + " - " + e.getMessage());
            return ExitCode.USAGE;
        }
        String fileName = file.getFileName().toString();

        List<Program> programs = new ArrayList<Program>(engine.getLibrary().getPrograms());
        int code = ExitCode.OK;
        try {
            if (noExpand) {
                programs.add(Parser.parseSource(source, fileName));
            } else {
                UnitOutcome outcome = UnitOutcome.expanded(file, engine.expandSource(source, fileName));
                CommonOptions.printDiagnostics(outcome, err);
                ExpansionResult result = outcome.getResult();
                if (!result.isParsed()) {
                    return ExitCode.FAILED;
                }
                if (outcome.isFailed(common.strict)) {
                    code = ExitCode.FAILED;
                }
                programs.add(Parser.parseSource(result.getSource(), fileName));
            }
        } catch (ParseException e) {
            err.println("错误: " + e.getMessage());
            return ExitCode.FAILED;
        }

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream captured = new PrintStream(buffer, true, StandardCharsets.UTF_8.name());
        try {
            // 顶层属性在构造时初始化，也可能抛出运行时错误
            Interpreter interpreter = new Interpreter(programs);
            interpreter.setOut(captured);
            Object value = interpreter.call(entry);
            out.print(new String(buffer.toByteArray(), StandardCharsets.UTF_8));
            if (value != null) {
                out.println(Interpreter.stringify(value));
            }
        } catch (FlatlineRuntimeException e) {
            out.print(new String(buffer.toByteArray(), StandardCharsets.UTF_8));
            err.println("运行时错误: " + e.getMessage());
            code = ExitCode.FAILED;
        }
        out.flush();
        err.flush();
        return code;
    }
}
