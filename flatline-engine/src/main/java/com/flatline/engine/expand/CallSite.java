package com.flatline.engine.expand;

import com.flatline.compiler.analysis.CallBinding;
import com.flatline.compiler.ast.expr.CallExpr;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.expr.LambdaExpr;
import com.flatline.engine.template.Template;

import java.util.Collections;
import java.util.List;

/**
 * 已解析的模板调用点：接收者、其余实参与选中的模板
 */
public final class CallSite {

    private final CallExpr call;
    private final Template template;
    private final Expression receiver;
    private final List<Expression> args;
    private final CallBinding binding;

    CallSite(CallExpr call, Template template, Expression receiver, List<Expression> args, CallBinding binding) {
        this.call = call;
        this.template = template;
        this.receiver = receiver;
        this.args = Collections.unmodifiableList(args);
        this.binding = binding;
    }

    public CallExpr getCall() { return call; }
    public Template getTemplate() { return template; }
    public Expression getReceiver() { return receiver; }
    public List<Expression> getArgs() { return args; }
    public CallBinding getBinding() { return binding; }

    public boolean isAmbiguous() {
        return binding.isAmbiguous();
    }

    /** 实参是否为行为字面量（按语法形状判断） */
    public boolean isBehavior(int argIndex) {
        return args.get(argIndex) instanceof LambdaExpr;
    }
}
