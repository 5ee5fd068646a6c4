package com.flatline.engine.pass;

import com.flatline.compiler.ast.expr.ConditionalExpr;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.stmt.Block;
import com.flatline.compiler.ast.stmt.IfStmt;
import com.flatline.compiler.ast.stmt.ReturnStmt;
import com.flatline.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 返回值拆分：把语句序列拆成不含 return 的前缀和一个等价的值表达式
 *
 * <p>第一个与 return 相关的语句之前的语句进入前缀；{@code return e} 给出值；
 * 含 return 的 if 拆成条件表达式，无 else 时以 if 之后的语句作为 else 值。
 * 分支内部只能由 return 或嵌套 if 构成，循环等其它结构中的 return 使拆分失败。</p>
 */
public final class ReturnSplitter {

    /** 拆分结果 */
    public static final class Split {
        private final List<Statement> prefix;
        private final Expression value;

        Split(List<Statement> prefix, Expression value) {
            this.prefix = Collections.unmodifiableList(prefix);
            this.value = value;
        }

        public List<Statement> getPrefix() { return prefix; }
        public Expression getValue() { return value; }
    }

    private ReturnSplitter() {
    }

    /**
     * @return 拆分结果，无法拆分时返回 null
     */
    public static Split split(List<Statement> statements) {
        List<Statement> prefix = new ArrayList<Statement>();
        Expression value = walk(statements, prefix);
        return value == null ? null : new Split(prefix, value);
    }

    /**
     * 依次处理语句；prefix 为 null 时不允许出现与 return 无关的语句（分支内部）
     */
    private static Expression walk(List<Statement> statements, List<Statement> prefix) {
        for (int i = 0; i < statements.size(); i++) {
            Statement s = statements.get(i);
            List<Statement> rest = statements.subList(i + 1, statements.size());
            if (s instanceof ReturnStmt) {
                return ((ReturnStmt) s).getValue();
            }
            if (!Trees.containsReturn(s)) {
                if (prefix == null) {
                    return null;
                }
                prefix.add(s);
                continue;
            }
            if (s instanceof Block) {
                return walk(Trees.concat(((Block) s).getStatements(), rest), prefix);
            }
            if (s instanceof IfStmt) {
                return conditional((IfStmt) s, rest);
            }
            return null;
        }
        return null;
    }

    private static Expression conditional(IfStmt ifStmt, List<Statement> rest) {
        Expression thenValue = walk(Trees.flatten(ifStmt.getThenBranch()), null);
        if (thenValue == null) {
            return null;
        }
        Expression elseValue = ifStmt.hasElse()
                ? walk(Trees.flatten(ifStmt.getElseBranch()), null)
                : walk(rest, null);
        if (elseValue == null) {
            return null;
        }
        return new ConditionalExpr(ifStmt.getLocation(), ifStmt.getCondition(), thenValue, elseValue);
    }
}
