package com.flatline.engine.expand;

import com.flatline.compiler.analysis.Scope;
import com.flatline.compiler.ast.Modifier;
import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.decl.FunDecl;
import com.flatline.compiler.ast.decl.Parameter;
import com.flatline.compiler.ast.expr.CallExpr;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.expr.Identifier;
import com.flatline.compiler.ast.expr.LambdaExpr;
import com.flatline.compiler.ast.stmt.Statement;
import com.flatline.compiler.ast.type.TypeRef;
import com.flatline.engine.diag.DiagnosticCode;
import com.flatline.engine.pass.Capture;
import com.flatline.engine.pass.CaptureAnalyzer;
import com.flatline.engine.pass.EarlyReturnNormalizer;
import com.flatline.engine.pass.ParameterSubstituter;
import com.flatline.engine.pass.ReturnSplitter;
import com.flatline.engine.pass.ScopedRenamer;
import com.flatline.engine.pass.TreeRewriter;
import com.flatline.engine.pass.Trees;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 行为参数内联：模板主体中每个行为参数调用替换为 lambda 主体
 *
 * <ul>
 *   <li>表达式形态：参数直接替换为实参，替换结果代替调用</li>
 *   <li>块形态、语句位置：参数绑定到临时变量，主体改名后原地展开</li>
 *   <li>块形态、表达式位置：参数绑定到临时变量，主体拆分为前缀语句与条件表达式</li>
 *   <li>无法拆分时提取为辅助函数，捕获变量作为额外参数传入</li>
 * </ul>
 */
final class BehaviorInliner extends HoistingRewriter {

    private static final Logger LOG = Logger.getLogger(BehaviorInliner.class.getName());

    private final Map<String, Behavior> behaviors;

    BehaviorInliner(ExpansionContext ctx, Map<String, Behavior> behaviors) {
        super(ctx);
        this.behaviors = behaviors;
    }

    @Override
    protected Expansion expandCall(CallExpr call, Scope scope, boolean statementPosition) {
        if (!(call.getCallee() instanceof Identifier)) {
            return null;
        }
        Behavior behavior = behaviors.get(((Identifier) call.getCallee()).getName());
        if (behavior == null) {
            return null;
        }
        if (behavior.arity() != call.getArgs().size()) {
            ctx.report(DiagnosticCode.UNRESOLVED_BEHAVIOR, behavior.getLambda().getLocation(), behavior.getName());
            return null;
        }

        List<Statement> hoists = new ArrayList<Statement>();
        List<Expression> actuals = rewriteOperands(call.getArgs(), scope, hoists);

        switch (behavior.getForm()) {
            case EXPRESSION:
                LOG.fine("Substituting expression behavior " + behavior.getName());
                return new Expansion(hoists, substituteExpression(behavior, actuals, scope, hoists));
            case BLOCK:
            default:
                if (statementPosition) {
                    LOG.fine("Splicing block behavior " + behavior.getName());
                    List<Statement> body = bindAndRename(behavior, actuals, scope, hoists);
                    hoists.addAll(new EarlyReturnNormalizer(names).normalize(body,
                            EarlyReturnNormalizer.Mode.DISCARD, behavior.getReturnType()));
                    return new Expansion(hoists, null);
                }
                return new Expansion(hoists, inlineBlockValue(behavior, actuals, scope, hoists));
        }
    }

    // ==================== 表达式形态 ====================

    private Expression substituteExpression(Behavior behavior, List<Expression> actuals, Scope scope,
                                            List<Statement> hoists) {
        LambdaExpr lambda = behavior.getLambda();
        Expression body = lambda.getExpressionBody();

        Map<String, Expression> probe = new LinkedHashMap<String, Expression>();
        for (LambdaExpr.LambdaParam param : lambda.getParams()) {
            probe.put(param.getName(), new Identifier(SourceLocation.UNKNOWN, param.getName()));
        }
        ParameterSubstituter counter = new ParameterSubstituter(probe);
        counter.rewrite(body);
        Set<String> inner = declaredNames(body);

        Map<String, Expression> replacements = new LinkedHashMap<String, Expression>();
        for (int i = 0; i < actuals.size(); i++) {
            String param = lambda.getParams().get(i).getName();
            Expression actual = actuals.get(i);
            boolean reused = !Trees.isSimple(actual) && counter.getCounts().get(param) != 1;
            if (reused || mentionsAny(actual, inner)) {
                String temp = names.fresh("p");
                hoists.add(Trees.val(temp, actual));
                scope.defineLocal(temp, behavior.paramType(i), false);
                actual = Trees.ident(temp);
            }
            replacements.put(param, actual);
        }
        return ParameterSubstituter.substitute(body, replacements);
    }

    // ==================== 块形态 ====================

    /**
     * 参数绑定到临时变量（提升语句加入 hoists），返回改名后的主体
     */
    private List<Statement> bindAndRename(Behavior behavior, List<Expression> actuals, Scope scope,
                                          List<Statement> hoists) {
        LambdaExpr lambda = behavior.getLambda();
        Map<String, String> seeds = new LinkedHashMap<String, String>();
        for (int i = 0; i < actuals.size(); i++) {
            String temp = names.fresh(lambda.getParams().get(i).getName());
            seeds.put(lambda.getParams().get(i).getName(), temp);
            hoists.add(Trees.val(temp, actuals.get(i)));
            scope.defineLocal(temp, behavior.paramType(i), false);
        }
        return ScopedRenamer.rename(lambda.getBlockBody().getStatements(), names, seeds);
    }

    private Expression inlineBlockValue(Behavior behavior, List<Expression> actuals, Scope scope,
                                        List<Statement> hoists) {
        List<Statement> bindings = new ArrayList<Statement>();
        List<Statement> body = bindAndRename(behavior, actuals, scope, bindings);
        ReturnSplitter.Split split = ReturnSplitter.split(body);
        if (split != null) {
            LOG.fine("Linearized block behavior " + behavior.getName());
            hoists.addAll(bindings);
            hoists.addAll(split.getPrefix());
            return split.getValue();
        }
        return extract(behavior, actuals, bindings, body, hoists);
    }

    /**
     * 提取为辅助函数；类型或捕获无法确定时退回原样提升并以默认值占位。
     * 诊断位置取调用方 lambda 的位置，而不是模板主体中的调用。
     */
    private Expression extract(Behavior behavior, List<Expression> actuals, List<Statement> bindings,
                               List<Statement> renamedBody, List<Statement> hoists) {
        SourceLocation location = behavior.getLambda().getLocation();
        if (behavior.getExtractedName() == null) {
            FunDecl fn = buildAuxiliary(behavior);
            if (fn == null) {
                ctx.report(DiagnosticCode.UNRESOLVED_BEHAVIOR, location, behavior.getName());
                hoists.addAll(bindings);
                hoists.addAll(renamedBody);
                return Trees.defaultValue(behavior.getReturnType());
            }
            behavior.setExtractedName(fn.getName());
            ctx.addGeneratedFunction(fn);
            ctx.report(DiagnosticCode.BEHAVIOR_EXTRACTED, location, fn.getName());
        }

        List<Expression> args = new ArrayList<Expression>(actuals);
        for (Capture capture : behavior.getCaptures()) {
            args.add(Trees.ident(capture.getName()));
        }
        return new CallExpr(location, Trees.ident(behavior.getExtractedName()), args);
    }

    private FunDecl buildAuxiliary(Behavior behavior) {
        LambdaExpr lambda = behavior.getLambda();
        List<Capture> captures = new CaptureAnalyzer().analyze(lambda, behavior.getScope());
        behavior.setCaptures(captures);

        List<Parameter> params = new ArrayList<Parameter>();
        for (int i = 0; i < behavior.arity(); i++) {
            TypeRef type = behavior.paramType(i);
            if (type == null) {
                return null;
            }
            params.add(new Parameter(SourceLocation.UNKNOWN, lambda.getParams().get(i).getName(), type));
        }
        for (Capture capture : captures) {
            // 按值传入，无法回写外层变量
            if (capture.getType() == null || capture.isMutated()) {
                return null;
            }
            params.add(new Parameter(SourceLocation.UNKNOWN, capture.getName(), capture.getType()));
        }

        TypeRef returnType = behavior.getReturnType();
        if (returnType == null) {
            Scope lambdaScope = behavior.getScope().child(Scope.ScopeType.LAMBDA);
            for (Parameter p : params) {
                lambdaScope.defineParameter(p.getName(), p.getType());
            }
            returnType = inferencer.lambdaBodyType(lambda, lambdaScope);
            if (returnType == null) {
                return null;
            }
        }
        return new FunDecl(lambda.getLocation(), EnumSet.of(Modifier.PRIVATE), names.fresh("lambda"),
                Collections.<String>emptyList(), params, returnType, lambda.getBlockBody(), null);
    }

    // ==================== 工具 ====================

    /** 表达式内部（嵌套 lambda）声明的名字 */
    private static Set<String> declaredNames(Expression expr) {
        final Set<String> declared = new HashSet<String>();
        new TreeRewriter() {
            @Override
            protected String declare(String name) {
                declared.add(name);
                return name;
            }
        }.rewrite(expr);
        return declared;
    }

    private static boolean mentionsAny(Expression expr, final Set<String> names) {
        if (names.isEmpty()) {
            return false;
        }
        final boolean[] found = new boolean[1];
        new TreeRewriter() {
            @Override
            protected Expression rewriteIdentifier(Identifier id) {
                if (names.contains(id.getName())) {
                    found[0] = true;
                }
                return id;
            }
        }.rewrite(expr);
        return found[0];
    }
}
