package com.flatline.engine.expand;

import com.flatline.compiler.analysis.Scope;
import com.flatline.compiler.ast.expr.CallExpr;

/**
 * 调用方代码的改写器：展开其中的模板调用
 */
public final class TemplateCallRewriter extends HoistingRewriter {

    private final CallSiteResolver resolver;
    private final TemplateInstantiator instantiator;

    public TemplateCallRewriter(ExpansionContext ctx) {
        super(ctx);
        this.resolver = new CallSiteResolver(ctx.getTemplates(), ctx.getInferencer());
        this.instantiator = new TemplateInstantiator(ctx, this);
    }

    @Override
    protected Expansion expandCall(CallExpr call, Scope scope, boolean statementPosition) {
        CallSite site = resolver.resolve(call, scope);
        if (site == null) {
            return null;
        }
        return instantiator.instantiate(site, scope, statementPosition);
    }
}
