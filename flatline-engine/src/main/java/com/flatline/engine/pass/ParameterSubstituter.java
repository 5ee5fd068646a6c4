package com.flatline.engine.pass;

import com.flatline.compiler.ast.expr.CallExpr;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.expr.Identifier;
import com.flatline.compiler.ast.stmt.Statement;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 形参替换 pass：把形参标识符替换为实参表达式（结构替换，不引入临时变量）
 *
 * <p>树中重新声明同名局部变量或 lambda 参数时，内层引用不被替换。
 * 替换次数按形参统计，供调用方判断非简单实参是否被重复求值。</p>
 */
public final class ParameterSubstituter extends TreeRewriter {

    private final Map<String, Expression> replacements;
    private final Set<String> keepCallees;
    private final Map<String, Integer> counts = new LinkedHashMap<String, Integer>();
    private final Deque<Set<String>> shadowed = new ArrayDeque<Set<String>>();

    /**
     * @param keepCallees 作为被调函数出现时不替换的名字（行为参数的调用留给内联器）
     */
    public ParameterSubstituter(Map<String, Expression> replacements, Set<String> keepCallees) {
        this.replacements = replacements;
        this.keepCallees = keepCallees;
        for (String name : replacements.keySet()) {
            counts.put(name, 0);
        }
        shadowed.push(new HashSet<String>());
    }

    public ParameterSubstituter(Map<String, Expression> replacements) {
        this(replacements, Collections.<String>emptySet());
    }

    public static Expression substitute(Expression expr, Map<String, Expression> replacements) {
        return new ParameterSubstituter(replacements).rewrite(expr);
    }

    public static List<Statement> substitute(List<Statement> statements, Map<String, Expression> replacements) {
        return new ParameterSubstituter(replacements).rewriteAll(statements);
    }

    /** 每个形参被替换的次数 */
    public Map<String, Integer> getCounts() {
        return counts;
    }

    @Override
    protected String declare(String name) {
        if (replacements.containsKey(name)) {
            shadowed.peek().add(name);
        }
        return name;
    }

    @Override
    protected void enterScope() {
        shadowed.push(new HashSet<String>());
    }

    @Override
    protected void exitScope() {
        shadowed.pop();
    }

    @Override
    protected Expression rewriteIdentifier(Identifier id) {
        String name = id.getName();
        Expression replacement = replacements.get(name);
        if (replacement == null || isShadowed(name)) {
            return id;
        }
        counts.put(name, counts.get(name) + 1);
        return replacement;
    }

    @Override
    protected Expression rewriteCall(CallExpr call) {
        if (call.getCallee() instanceof Identifier
                && keepCallees.contains(((Identifier) call.getCallee()).getName())) {
            return new CallExpr(call.getLocation(), call.getCallee(), call.getTypeArgs(), rewriteExprs(call.getArgs()));
        }
        return super.rewriteCall(call);
    }

    private boolean isShadowed(String name) {
        for (Set<String> frame : shadowed) {
            if (frame.contains(name)) return true;
        }
        return false;
    }
}
