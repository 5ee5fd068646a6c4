package com.flatline.compiler.ast.expr;

import com.flatline.compiler.ast.AstVisitor;
import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.stmt.Block;
import com.flatline.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lambda 表达式
 *
 * <p>主体二选一：表达式形式 {@code x -> x * 2} 或块形式 {@code x -> { ... }}。</p>
 */
public class LambdaExpr extends Expression {
    private final List<LambdaParam> params;
    private final Expression expressionBody;
    private final Block blockBody;

    public LambdaExpr(SourceLocation location, List<LambdaParam> params, Expression expressionBody) {
        super(location);
        this.params = Collections.unmodifiableList(new ArrayList<LambdaParam>(params));
        this.expressionBody = expressionBody;
        this.blockBody = null;
    }

    public LambdaExpr(SourceLocation location, List<LambdaParam> params, Block blockBody) {
        super(location);
        this.params = Collections.unmodifiableList(new ArrayList<LambdaParam>(params));
        this.expressionBody = null;
        this.blockBody = blockBody;
    }

    public List<LambdaParam> getParams() {
        return params;
    }

    public List<String> getParamNames() {
        List<String> names = new ArrayList<String>(params.size());
        for (LambdaParam p : params) {
            names.add(p.getName());
        }
        return names;
    }

    public boolean isBlockBody() {
        return blockBody != null;
    }

    public Expression getExpressionBody() {
        return expressionBody;
    }

    public Block getBlockBody() {
        return blockBody;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLambdaExpr(this, context);
    }

    /**
     * Lambda 参数（类型可省略）
     */
    public static class LambdaParam {
        private final String name;
        private final TypeRef type;

        public LambdaParam(String name, TypeRef type) {
            this.name = name;
            this.type = type;
        }

        public String getName() {
            return name;
        }

        public TypeRef getType() {
            return type;
        }
    }
}
