package com.flatline.engine.expand;

import com.flatline.compiler.analysis.Scope;
import com.flatline.compiler.analysis.TypeInferencer;
import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.decl.FunDecl;
import com.flatline.compiler.ast.decl.Parameter;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.expr.LambdaExpr;
import com.flatline.compiler.ast.stmt.ReturnStmt;
import com.flatline.compiler.ast.stmt.Statement;
import com.flatline.compiler.ast.type.FunctionType;
import com.flatline.compiler.ast.type.TypeRef;
import com.flatline.compiler.ast.type.Types;
import com.flatline.engine.diag.DiagnosticCode;
import com.flatline.engine.pass.EarlyReturnNormalizer;
import com.flatline.engine.pass.NameAllocator;
import com.flatline.engine.pass.ParameterSubstituter;
import com.flatline.engine.pass.ScopedRenamer;
import com.flatline.engine.pass.Trees;
import com.flatline.engine.pass.TypeSubstituter;
import com.flatline.engine.template.Template;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 模板实例化：把一个已解析的调用点展开为提升语句与结果表达式
 *
 * <p>步骤：</p>
 * <ol>
 *   <li>接收者先展开（链式调用），非简单接收者存入临时变量，保证只求值一次</li>
 *   <li>主体类型位置上的类型参数替换为调用点推断出的类型</li>
 *   <li>主体局部变量与形参统一改为新名字</li>
 *   <li>普通形参替换为实参；行为参数在调用以外的位置替换为 lambda 本身（转发）</li>
 *   <li>多出口主体规范化为单出口</li>
 *   <li>展开主体中的嵌套模板调用，再内联行为参数调用</li>
 * </ol>
 */
public final class TemplateInstantiator {

    private static final Logger LOG = Logger.getLogger(TemplateInstantiator.class.getName());

    private final ExpansionContext ctx;
    private final HoistingRewriter outer;
    private final TypeInferencer inferencer;
    private final NameAllocator names;

    /**
     * @param outer 展开调用方代码的改写器，用于接收者、实参、lambda 主体与嵌套模板调用
     */
    public TemplateInstantiator(ExpansionContext ctx, HoistingRewriter outer) {
        this.ctx = ctx;
        this.outer = outer;
        this.inferencer = ctx.getInferencer();
        this.names = ctx.getNames();
    }

    /**
     * @return 展开结果；调用因歧义或递归无法展开时返回 null
     */
    public Expansion instantiate(CallSite site, Scope scope, boolean statementPosition) {
        Template template = site.getTemplate();
        FunDecl decl = template.getDeclaration();
        SourceLocation location = site.getCall().getLocation();

        if (site.isAmbiguous()) {
            ctx.report(DiagnosticCode.LEFT_UNEXPANDED, location, template.getName(), "ambiguous overload");
            return null;
        }
        if (ctx.isInstantiating(decl)) {
            ctx.report(DiagnosticCode.LEFT_UNEXPANDED, location, template.getName(), "recursive instantiation");
            return null;
        }

        Map<String, TypeRef> bindings = site.getBinding().getTypeBindings();
        Set<String> unbound = new HashSet<String>();
        for (String typeParam : decl.getTypeParams()) {
            if (!bindings.containsKey(typeParam)) {
                unbound.add(typeParam);
                ctx.report(DiagnosticCode.UNRESOLVED_TYPE_PARAMETER, location, typeParam, template.getName());
            }
        }
        LOG.fine("Instantiating " + template + " at " + location);

        List<Statement> hoisted = new ArrayList<Statement>();
        List<Parameter> params = decl.getParams();

        // 形参改名的种子与替换表
        Map<String, String> seeds = new LinkedHashMap<String, String>();
        for (Parameter p : params) {
            seeds.put(p.getName(), names.fresh(p.getName()));
        }
        Map<String, Expression> values = new LinkedHashMap<String, Expression>();
        Map<String, Behavior> behaviors = new LinkedHashMap<String, Behavior>();
        Set<String> checkedArgs = new HashSet<String>();

        values.put(seeds.get(params.get(0).getName()), bindReceiver(site.getReceiver(), scope, hoisted));
        for (int i = 1; i < params.size(); i++) {
            Parameter param = params.get(i);
            String seed = seeds.get(param.getName());
            Expression arg = site.getArgs().get(i - 1);
            if (template.isBehaviorParam(i) && arg instanceof LambdaExpr) {
                FunctionType fnType = (FunctionType) param.getType().substitute(bindings);
                List<TypeRef> paramTypes = new ArrayList<TypeRef>();
                for (TypeRef t : fnType.getParamTypes()) {
                    paramTypes.add(known(t, unbound));
                }
                LambdaExpr lambda = outer.rewriteLambda((LambdaExpr) arg, scope, paramTypes);
                behaviors.put(seed, new Behavior(seed, lambda, paramTypes, known(fnType.getReturnType(), unbound), scope));
                values.put(seed, lambda);
            } else {
                List<Statement> argHoists = new ArrayList<Statement>();
                Expression value = outer.rewriteExpr(arg, scope, argHoists);
                hoisted.addAll(argHoists);
                if (!argHoists.isEmpty() && !Trees.isSimple(value)) {
                    value = spill("arg", value, arg, scope, hoisted);
                } else if (!Trees.isSimple(value)) {
                    checkedArgs.add(seed);
                }
                values.put(seed, value);
            }
        }

        TypeRef resultType = resultType(site, scope, unbound);
        boolean returnsValue = !Types.UNIT.equals(resultType);

        List<Statement> body = template.bodyStatements(returnsValue);
        body = new TypeSubstituter(bindings).rewriteAll(body);
        body = ScopedRenamer.rename(body, names, seeds);
        ParameterSubstituter substituter = new ParameterSubstituter(values, behaviors.keySet());
        body = substituter.rewriteAll(body);
        for (String seed : checkedArgs) {
            int count = substituter.getCounts().get(seed);
            if (count != 1) {
                ctx.report(DiagnosticCode.REPEATED_ARGUMENT, location, paramNameOf(seeds, seed), template.getName(), count);
            }
        }

        EarlyReturnNormalizer.Mode mode = !returnsValue ? EarlyReturnNormalizer.Mode.VOID
                : statementPosition ? EarlyReturnNormalizer.Mode.DISCARD
                : EarlyReturnNormalizer.Mode.VALUE;
        body = new EarlyReturnNormalizer(names).normalize(body, mode, resultType);

        // 主体语句提升到调用点所在的语句列表，局部变量直接登记在调用点作用域中（名字都是新的）
        ctx.enter(decl);
        try {
            body = outer.rewriteStatements(body, scope);
            if (!behaviors.isEmpty()) {
                body = new BehaviorInliner(ctx, behaviors).rewriteStatements(body, scope);
            }
        } finally {
            ctx.exit();
        }

        Expression value = null;
        if (mode == EarlyReturnNormalizer.Mode.VALUE) {
            Statement last = body.isEmpty() ? null : body.get(body.size() - 1);
            if (last instanceof ReturnStmt && ((ReturnStmt) last).getValue() != null) {
                value = ((ReturnStmt) last).getValue();
                body = body.subList(0, body.size() - 1);
            } else {
                value = Trees.defaultValue(resultType);
            }
        }
        hoisted.addAll(body);
        return new Expansion(hoisted, value);
    }

    /**
     * 接收者：链式调用先展开；结果不是简单引用时存入临时变量
     */
    private Expression bindReceiver(Expression receiver, Scope scope, List<Statement> hoisted) {
        List<Statement> hoists = new ArrayList<Statement>();
        Expression value = outer.rewriteExpr(receiver, scope, hoists);
        hoisted.addAll(hoists);
        if (Trees.isSimple(value)) {
            return value;
        }
        return spill(hoists.isEmpty() ? "receiver" : "chain", value, receiver, scope, hoisted);
    }

    private Expression spill(String base, Expression value, Expression original, Scope scope,
                             List<Statement> hoisted) {
        String name = names.fresh(base);
        hoisted.add(Trees.val(name, value));
        scope.defineLocal(name, inferencer.typeOf(original, scope), false);
        return Trees.ident(name);
    }

    /**
     * 调用结果类型：声明的返回类型按绑定替换；表达式主体未声明时按调用推断
     */
    private TypeRef resultType(CallSite site, Scope scope, Set<String> unbound) {
        FunDecl decl = site.getTemplate().getDeclaration();
        if (decl.getReturnType() != null) {
            return known(site.getBinding().substitutedReturnType(decl.getReturnType()), unbound);
        }
        if (site.getTemplate().getForm() == Template.Form.BLOCK) {
            return Types.UNIT;
        }
        return inferencer.typeOf(site.getCall(), scope);
    }

    private static TypeRef known(TypeRef type, Set<String> unbound) {
        return type == null || type.mentions(unbound) ? null : type;
    }

    private static String paramNameOf(Map<String, String> seeds, String seed) {
        for (Map.Entry<String, String> entry : seeds.entrySet()) {
            if (entry.getValue().equals(seed)) {
                return entry.getKey();
            }
        }
        return seed;
    }
}
