package com.flatline.engine.pass;

import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.expr.Identifier;
import com.flatline.compiler.ast.stmt.Statement;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 作用域感知的重命名 pass
 *
 * <p>树中每个局部声明（val/var、for 循环变量、lambda 参数）都换成
 * {@link NameAllocator} 分配的新名字，引用按词法作用域解析到最近的声明。
 * 兄弟作用域中同名的声明得到不同的名字。未在树中声明的名字先查种子表，
 * 仍未命中则保持原样（调用方的变量、全局函数等）。</p>
 */
public final class ScopedRenamer extends TreeRewriter {

    private final NameAllocator names;
    private final Deque<Map<String, String>> frames = new ArrayDeque<Map<String, String>>();

    /**
     * @param seeds 外层绑定的重命名（例如模板形参），作为最底层作用域
     */
    public ScopedRenamer(NameAllocator names, Map<String, String> seeds) {
        this.names = names;
        frames.push(new HashMap<String, String>(seeds));
        frames.push(new HashMap<String, String>());
    }

    public static List<Statement> rename(List<Statement> statements, NameAllocator names,
                                         Map<String, String> seeds) {
        return new ScopedRenamer(names, seeds).rewriteAll(statements);
    }

    public static Expression rename(Expression expr, NameAllocator names, Map<String, String> seeds) {
        return new ScopedRenamer(names, seeds).rewrite(expr);
    }

    @Override
    protected String declare(String name) {
        String renamed = names.fresh(name);
        frames.peek().put(name, renamed);
        return renamed;
    }

    @Override
    protected void enterScope() {
        frames.push(new HashMap<String, String>());
    }

    @Override
    protected void exitScope() {
        frames.pop();
    }

    @Override
    protected Expression rewriteIdentifier(Identifier id) {
        String renamed = lookup(id.getName());
        return renamed == null ? id : new Identifier(id.getLocation(), renamed);
    }

    private String lookup(String name) {
        for (Map<String, String> frame : frames) {
            String renamed = frame.get(name);
            if (renamed != null) return renamed;
        }
        return null;
    }
}
