package com.flatline.compiler.analysis;

import com.flatline.compiler.ast.decl.FunDecl;
import com.flatline.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 重载选择结果：选中的函数与类型参数绑定
 */
public final class CallBinding {

    private final FunDecl function;
    private final Map<String, TypeRef> typeBindings;
    private final boolean ambiguous;

    private CallBinding(FunDecl function, Map<String, TypeRef> typeBindings, boolean ambiguous) {
        this.function = function;
        this.typeBindings = Collections.unmodifiableMap(new LinkedHashMap<String, TypeRef>(typeBindings));
        this.ambiguous = ambiguous;
    }

    public static CallBinding resolved(FunDecl function, Map<String, TypeRef> typeBindings) {
        return new CallBinding(function, typeBindings, false);
    }

    public static CallBinding ambiguous(FunDecl first) {
        return new CallBinding(first, Collections.<String, TypeRef>emptyMap(), true);
    }

    public FunDecl getFunction() {
        return function;
    }

    public Map<String, TypeRef> getTypeBindings() {
        return typeBindings;
    }

    public boolean isAmbiguous() {
        return ambiguous;
    }

    /** 所有类型参数都已绑定 */
    public boolean isFullyBound() {
        return typeBindings.keySet().containsAll(function.getTypeParams());
    }

    /** 用绑定替换后的返回类型 */
    public TypeRef substitutedReturnType(TypeRef declared) {
        return declared == null ? null : declared.substitute(typeBindings);
    }
}
