package com.flatline.engine.expand;

import com.flatline.compiler.analysis.TypeInferencer;
import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.decl.FunDecl;
import com.flatline.engine.ExpansionOptions;
import com.flatline.engine.diag.DiagnosticCode;
import com.flatline.engine.diag.DiagnosticSink;
import com.flatline.engine.pass.NameAllocator;
import com.flatline.engine.template.TemplateLibrary;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * 单个编译单元的展开状态：命名计数器、诊断、待追加的辅助函数和实例化栈
 *
 * <p>每次展开运行新建一个实例，不在单元之间共享，也不跨线程使用。</p>
 */
public final class ExpansionContext {

    private final TemplateLibrary templates;
    private final TypeInferencer inferencer;
    private final DiagnosticSink diagnostics;
    private final ExpansionOptions options;
    private final NameAllocator names = new NameAllocator();

    private final List<FunDecl> pendingFunctions = new ArrayList<FunDecl>();
    private final List<String> generatedNames = new ArrayList<String>();
    private final Deque<FunDecl> instantiating = new ArrayDeque<FunDecl>();

    public ExpansionContext(TemplateLibrary templates, TypeInferencer inferencer,
                            DiagnosticSink diagnostics, ExpansionOptions options) {
        this.templates = templates;
        this.inferencer = inferencer;
        this.diagnostics = diagnostics;
        this.options = options;
    }

    public TemplateLibrary getTemplates() { return templates; }
    public TypeInferencer getInferencer() { return inferencer; }
    public DiagnosticSink getDiagnostics() { return diagnostics; }
    public ExpansionOptions getOptions() { return options; }
    public NameAllocator getNames() { return names; }

    public void report(DiagnosticCode code, SourceLocation location, Object... args) {
        diagnostics.report(code, location, args);
    }

    // ==================== 辅助函数 ====================

    public void addGeneratedFunction(FunDecl fn) {
        pendingFunctions.add(fn);
    }

    /** 取出当前声明生成的辅助函数 */
    public List<FunDecl> drainGenerated() {
        List<FunDecl> drained = new ArrayList<FunDecl>(pendingFunctions);
        pendingFunctions.clear();
        for (FunDecl fn : drained) {
            generatedNames.add(fn.getName());
        }
        return drained;
    }

    public List<String> getGeneratedNames() {
        return Collections.unmodifiableList(generatedNames);
    }

    // ==================== 回滚 ====================

    /** 记录当前诊断与待追加函数的位置，供放弃一次尝试时回滚 */
    public Mark mark() {
        return new Mark(diagnostics.size(), pendingFunctions.size());
    }

    public void rollback(Mark mark) {
        diagnostics.truncate(mark.diagnostics);
        while (pendingFunctions.size() > mark.functions) {
            pendingFunctions.remove(pendingFunctions.size() - 1);
        }
    }

    public static final class Mark {
        private final int diagnostics;
        private final int functions;

        private Mark(int diagnostics, int functions) {
            this.diagnostics = diagnostics;
            this.functions = functions;
        }
    }

    // ==================== 实例化栈 ====================

    public boolean isInstantiating(FunDecl template) {
        for (FunDecl fn : instantiating) {
            if (fn == template) return true;
        }
        return false;
    }

    public void enter(FunDecl template) {
        instantiating.push(template);
    }

    public void exit() {
        instantiating.pop();
    }
}
