package com.flatline.engine.pass;

import com.flatline.compiler.analysis.Scope;
import com.flatline.compiler.analysis.Symbol;
import com.flatline.compiler.ast.expr.AssignExpr;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.expr.Identifier;
import com.flatline.compiler.ast.expr.LambdaExpr;
import com.flatline.compiler.ast.expr.UnaryExpr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 捕获分析：找出 lambda 体中引用的、绑定在 lambda 外部的局部变量与参数
 *
 * <p>字段、全局变量和函数不算捕获（提取出的辅助函数仍能直接访问它们）。
 * 结果按首次出现的顺序排列。</p>
 */
public final class CaptureAnalyzer {

    public List<Capture> analyze(LambdaExpr lambda, Scope enclosing) {
        Walker walker = new Walker(enclosing);
        walker.rewrite(lambda);
        List<Capture> captures = new ArrayList<Capture>();
        for (Map.Entry<String, Symbol> entry : walker.found.entrySet()) {
            Symbol symbol = entry.getValue();
            captures.add(new Capture(entry.getKey(), symbol.getType(), walker.assigned.contains(entry.getKey())));
        }
        return captures;
    }

    private static final class Walker extends TreeRewriter {
        private final Scope enclosing;
        private final Deque<Set<String>> bound = new ArrayDeque<Set<String>>();
        private final Map<String, Symbol> found = new LinkedHashMap<String, Symbol>();
        private final Set<String> assigned = new LinkedHashSet<String>();

        Walker(Scope enclosing) {
            this.enclosing = enclosing;
            bound.push(new HashSet<String>());
        }

        @Override
        protected String declare(String name) {
            bound.peek().add(name);
            return name;
        }

        @Override
        protected void enterScope() {
            bound.push(new HashSet<String>());
        }

        @Override
        protected void exitScope() {
            bound.pop();
        }

        @Override
        public Expression rewrite(Expression expr) {
            Expression target = null;
            if (expr instanceof AssignExpr) {
                target = ((AssignExpr) expr).getTarget();
            } else if (expr instanceof UnaryExpr && ((UnaryExpr) expr).isMutating()) {
                target = ((UnaryExpr) expr).getOperand();
            }
            if (target instanceof Identifier && !isBound(((Identifier) target).getName())) {
                assigned.add(((Identifier) target).getName());
            }
            return super.rewrite(expr);
        }

        @Override
        protected Expression rewriteIdentifier(Identifier id) {
            String name = id.getName();
            if (!isBound(name) && !found.containsKey(name)) {
                Symbol symbol = enclosing.resolve(name);
                if (symbol != null && symbol.isLocalBinding()) {
                    found.put(name, symbol);
                }
            }
            return id;
        }

        private boolean isBound(String name) {
            for (Set<String> frame : bound) {
                if (frame.contains(name)) return true;
            }
            return false;
        }
    }
}
