package com.flatline.engine.template;

import com.flatline.compiler.ast.decl.ClassDecl;
import com.flatline.compiler.ast.decl.Declaration;
import com.flatline.compiler.ast.decl.FunDecl;
import com.flatline.compiler.ast.decl.Program;
import com.flatline.compiler.ast.type.Types;
import com.flatline.engine.diag.Diagnostic;
import com.flatline.engine.diag.DiagnosticCode;
import com.flatline.engine.pass.Trees;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 模板库：从一组程序中发现 inline 函数
 *
 * <p>发现时校验模板形状，不合格的模板不注册并记录 FL0003，其余模板照常使用。
 * 构建后不可变，可在多个编译单元的展开之间共享。</p>
 */
public final class TemplateLibrary {

    private static final Logger LOG = Logger.getLogger(TemplateLibrary.class.getName());

    private final List<Program> programs;
    private final Map<String, List<Template>> byName = new LinkedHashMap<String, List<Template>>();
    private final Map<FunDecl, Template> byDeclaration = new IdentityHashMap<FunDecl, Template>();
    private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

    public TemplateLibrary(List<Program> programs) {
        this.programs = Collections.unmodifiableList(new ArrayList<Program>(programs));
        for (Program program : programs) {
            discover(program);
        }
        LOG.fine("Discovered " + byDeclaration.size() + " templates in " + programs.size() + " programs");
    }

    public static TemplateLibrary empty() {
        return new TemplateLibrary(Collections.<Program>emptyList());
    }

    public static TemplateLibrary of(Program... programs) {
        List<Program> list = new ArrayList<Program>();
        Collections.addAll(list, programs);
        return new TemplateLibrary(list);
    }

    /** 加入待展开单元自身声明的模板 */
    public TemplateLibrary extendWith(Program unit) {
        List<Program> all = new ArrayList<Program>(programs);
        all.add(unit);
        return new TemplateLibrary(all);
    }

    private void discover(Program program) {
        for (Declaration decl : program.getDeclarations()) {
            if (decl instanceof FunDecl && ((FunDecl) decl).isInline()) {
                register((FunDecl) decl);
            } else if (decl instanceof ClassDecl) {
                for (FunDecl method : ((ClassDecl) decl).getMethods()) {
                    if (method.isInline()) {
                        refuse(method, "templates must be top-level functions");
                    }
                }
            }
        }
    }

    private void register(FunDecl fn) {
        if (fn.getParams().isEmpty()) {
            refuse(fn, "no receiver parameter");
            return;
        }
        if (!fn.hasBody()) {
            refuse(fn, "no body");
            return;
        }
        if (fn.getBody() != null && !Types.isUnit(fn.getReturnType())
                && !Trees.containsReturn(fn.getBody().getStatements())) {
            refuse(fn, "declares " + fn.getReturnType().toSourceString() + " but never returns a value");
            return;
        }
        Template template = new Template(fn);
        List<Template> overloads = byName.get(fn.getName());
        if (overloads == null) {
            overloads = new ArrayList<Template>();
            byName.put(fn.getName(), overloads);
        }
        overloads.add(template);
        byDeclaration.put(fn, template);
    }

    private void refuse(FunDecl fn, String reason) {
        String message = DiagnosticCode.MALFORMED_TEMPLATE.format(fn.getName(), reason);
        diagnostics.add(new Diagnostic(DiagnosticCode.MALFORMED_TEMPLATE, message, fn.getLocation()));
        LOG.fine(message);
    }

    public List<Program> getPrograms() {
        return programs;
    }

    public List<Template> find(String name) {
        List<Template> overloads = byName.get(name);
        return overloads != null ? overloads : Collections.<Template>emptyList();
    }

    public boolean hasTemplate(String name) {
        return byName.containsKey(name);
    }

    /** 声明对应的模板，非模板或被拒绝的声明返回 null */
    public Template templateOf(FunDecl fn) {
        return byDeclaration.get(fn);
    }

    public int size() {
        return byDeclaration.size();
    }

    /** 发现阶段的诊断（FL0003） */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
