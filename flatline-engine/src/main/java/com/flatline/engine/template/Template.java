package com.flatline.engine.template;

import com.flatline.compiler.ast.decl.FunDecl;
import com.flatline.compiler.ast.decl.Parameter;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.stmt.ExpressionStmt;
import com.flatline.compiler.ast.stmt.ReturnStmt;
import com.flatline.compiler.ast.stmt.Statement;
import com.flatline.compiler.ast.type.FunctionType;

import java.util.Collections;
import java.util.List;

/**
 * 模板：带 inline 标记的顶层函数，调用点处展开为其主体
 *
 * <p>第一个形参是接收者绑定；函数类型的形参是行为参数，其余是普通值参数。</p>
 */
public final class Template {

    /** 主体形态 */
    public enum Form {
        EXPRESSION,
        BLOCK
    }

    private final FunDecl declaration;

    Template(FunDecl declaration) {
        this.declaration = declaration;
    }

    public FunDecl getDeclaration() {
        return declaration;
    }

    public String getName() {
        return declaration.getName();
    }

    public Parameter getReceiver() {
        return declaration.getParams().get(0);
    }

    public List<Parameter> getParams() {
        return declaration.getParams();
    }

    public boolean isBehaviorParam(int index) {
        return declaration.getParams().get(index).getType() instanceof FunctionType;
    }

    public Form getForm() {
        return declaration.getBody() != null ? Form.BLOCK : Form.EXPRESSION;
    }

    /**
     * 主体语句。表达式主体转为单条 return（无值模板转为表达式语句）
     */
    public List<Statement> bodyStatements(boolean returnsValue) {
        if (getForm() == Form.BLOCK) {
            return declaration.getBody().getStatements();
        }
        Expression body = declaration.getExpressionBody();
        Statement stmt = returnsValue
                ? new ReturnStmt(body.getLocation(), body)
                : new ExpressionStmt(body.getLocation(), body);
        return Collections.singletonList(stmt);
    }

    @Override
    public String toString() {
        return "template " + getName() + "/" + declaration.getParams().size();
    }
}
