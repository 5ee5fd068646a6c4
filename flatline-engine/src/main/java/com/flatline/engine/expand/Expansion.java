package com.flatline.engine.expand;

import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.stmt.Statement;

import java.util.Collections;
import java.util.List;

/**
 * 内联展开结果：需提升到调用点之前的语句，以及可选的结果表达式
 *
 * <p>结果表达式只在语句位置调用无值模板（或丢弃结果）时缺省。</p>
 */
public final class Expansion {

    private final List<Statement> hoisted;
    private final Expression value;

    public Expansion(List<Statement> hoisted, Expression value) {
        this.hoisted = Collections.unmodifiableList(hoisted);
        this.value = value;
    }

    public List<Statement> getHoisted() {
        return hoisted;
    }

    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }
}
