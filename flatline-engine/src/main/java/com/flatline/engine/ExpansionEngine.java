package com.flatline.engine;

import com.flatline.compiler.analysis.ProgramIndex;
import com.flatline.compiler.analysis.TypeInferencer;
import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.decl.Program;
import com.flatline.compiler.formatter.SourcePrinter;
import com.flatline.compiler.lexer.Token;
import com.flatline.compiler.parser.ParseException;
import com.flatline.compiler.parser.Parser;
import com.flatline.engine.diag.DiagnosticCode;
import com.flatline.engine.diag.DiagnosticSink;
import com.flatline.engine.diag.Severity;
import com.flatline.engine.expand.ExpansionContext;
import com.flatline.engine.expand.UnitExpander;
import com.flatline.engine.pass.NameCollector;
import com.flatline.engine.template.TemplateLibrary;

import java.util.Collections;
import java.util.logging.Logger;

/**
 * 内联展开引擎入口
 *
 * <p>模板库在构造时给定且不可变，同一个引擎可以被多个线程同时用于不同的编译单元：
 * 每次 {@link #expand} 都新建命名计数器、诊断收集器与类型推断器。</p>
 *
 * <pre>
 * ExpansionEngine engine = new ExpansionEngine(TemplateLibrary.of(library));
 * ExpansionResult result = engine.expandSource(source, "main.fl");
 * </pre>
 */
public class ExpansionEngine {

    private static final Logger LOG = Logger.getLogger(ExpansionEngine.class.getName());

    private final TemplateLibrary library;
    private final ExpansionOptions options;

    public ExpansionEngine(TemplateLibrary library) {
        this(library, new ExpansionOptions());
    }

    public ExpansionEngine(TemplateLibrary library, ExpansionOptions options) {
        this.library = library;
        this.options = options;
    }

    public TemplateLibrary getLibrary() {
        return library;
    }

    public ExpansionOptions getOptions() {
        return options;
    }

    /**
     * 展开一个已解析的编译单元。单元中声明的模板与库中的模板一起参与展开。
     */
    public ExpansionResult expand(Program unit) {
        TemplateLibrary templates = library.extendWith(unit);
        DiagnosticSink sink = new DiagnosticSink();
        sink.addAll(templates.getDiagnostics());

        TypeInferencer inferencer = new TypeInferencer(new ProgramIndex(templates.getPrograms()));
        ExpansionContext ctx = new ExpansionContext(templates, inferencer, sink, options);
        // 生成的名字不得与单元或模板库中已有的名字相同
        ctx.getNames().reserve(NameCollector.collect(templates.getPrograms()));
        Program expanded = new UnitExpander(ctx).expand(unit);
        String source = new SourcePrinter().print(expanded, options.toFormatConfig());

        LOG.info(String.format("Expanded %s: %d warning(s), %d auxiliary function(s)",
                unit.getFileName(), sink.count(Severity.WARNING), ctx.getGeneratedNames().size()));
        return new ExpansionResult(unit.getFileName(), expanded, source,
                sink.getDiagnostics(), ctx.getGeneratedNames());
    }

    /**
     * 解析并展开源码；解析失败时返回带 FL0007 诊断、没有输出的结果
     */
    public ExpansionResult expandSource(String source, String fileName) {
        Program unit;
        try {
            unit = Parser.parseSource(source, fileName);
        } catch (ParseException e) {
            Token token = e.getToken();
            SourceLocation location = token != null
                    ? new SourceLocation(fileName, token.getLine(), token.getColumn(), token.getOffset(),
                            token.getLexeme() != null ? token.getLexeme().length() : 0)
                    : SourceLocation.UNKNOWN;
            DiagnosticSink sink = new DiagnosticSink();
            sink.report(DiagnosticCode.PARSE_FAILED, location, e.getMessage());
            LOG.info("Parse of " + fileName + " failed: " + e.getMessage());
            return new ExpansionResult(fileName, null, null, sink.getDiagnostics(),
                    Collections.<String>emptyList());
        }
        return expand(unit);
    }
}
