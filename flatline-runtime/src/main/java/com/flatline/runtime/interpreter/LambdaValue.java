package com.flatline.runtime.interpreter;

import com.flatline.compiler.ast.expr.LambdaExpr;

import java.util.List;

/**
 * lambda 闭包：lambda 节点 + 定义处环境 + 定义处的 this
 */
final class LambdaValue implements FlatlineCallable {

    private final LambdaExpr lambda;
    private final Environment closure;
    private final FlatlineObject self;

    LambdaValue(LambdaExpr lambda, Environment closure, FlatlineObject self) {
        this.lambda = lambda;
        this.closure = closure;
        this.self = self;
    }

    @Override
    public int arity() {
        return lambda.getParams().size();
    }

    @Override
    public Object call(Interpreter interpreter, List<Object> args) {
        Environment env = new Environment(closure);
        for (int i = 0; i < lambda.getParams().size(); i++) {
            env.define(lambda.getParams().get(i).getName(), args.get(i));
        }
        if (!lambda.isBlockBody()) {
            return interpreter.evaluate(lambda.getExpressionBody(), env, self);
        }
        try {
            interpreter.executeBlock(lambda.getBlockBody().getStatements(), env, self);
        } catch (ControlFlow flow) {
            if (flow.getType() == ControlFlow.Type.RETURN) {
                return flow.getValue();
            }
            throw flow;
        }
        return null;
    }

    @Override
    public String toString() {
        return "<lambda/" + arity() + ">";
    }
}
