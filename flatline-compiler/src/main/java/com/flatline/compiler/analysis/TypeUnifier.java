package com.flatline.compiler.analysis;

import com.flatline.compiler.ast.type.FunctionType;
import com.flatline.compiler.ast.type.GenericType;
import com.flatline.compiler.ast.type.SimpleType;
import com.flatline.compiler.ast.type.TypeRef;
import com.flatline.compiler.ast.type.Types;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 泛型统一：把声明的参数类型与实际类型对齐，绑定类型参数。
 */
public final class TypeUnifier {

    private TypeUnifier() {
    }

    /**
     * 统一 pattern 与 actual，新绑定写入 bindings。
     *
     * @param actual 实际类型，null 表示未知（视为兼容，不产生绑定）
     * @return 两者是否兼容
     */
    public static boolean unify(TypeRef pattern, TypeRef actual, Set<String> typeParams,
                                Map<String, TypeRef> bindings) {
        if (pattern == null || actual == null) {
            return true;
        }

        if (pattern instanceof SimpleType) {
            String name = ((SimpleType) pattern).getName();
            if (typeParams.contains(name)) {
                TypeRef bound = bindings.get(name);
                if (bound == null) {
                    bindings.put(name, actual);
                    return true;
                }
                return bound.equals(actual) || Types.ANY.equals(bound);
            }
            return Types.ANY.equals(pattern) || pattern.equals(actual);
        }

        if (pattern instanceof GenericType) {
            if (!(actual instanceof GenericType)) {
                return false;
            }
            GenericType p = (GenericType) pattern;
            GenericType a = (GenericType) actual;
            if (!p.getName().equals(a.getName()) || p.getTypeArgs().size() != a.getTypeArgs().size()) {
                return false;
            }
            return unifyAll(p.getTypeArgs(), a.getTypeArgs(), typeParams, bindings);
        }

        if (pattern instanceof FunctionType) {
            if (!(actual instanceof FunctionType)) {
                return false;
            }
            FunctionType p = (FunctionType) pattern;
            FunctionType a = (FunctionType) actual;
            if (p.getParamTypes().size() != a.getParamTypes().size()) {
                return false;
            }
            return unifyAll(p.getParamTypes(), a.getParamTypes(), typeParams, bindings)
                    && unify(p.getReturnType(), a.getReturnType(), typeParams, bindings);
        }
        return false;
    }

    private static boolean unifyAll(List<TypeRef> patterns, List<TypeRef> actuals, Set<String> typeParams,
                                    Map<String, TypeRef> bindings) {
        for (int i = 0; i < patterns.size(); i++) {
            if (!unify(patterns.get(i), actuals.get(i), typeParams, bindings)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 两个分支类型的公共类型（数值提升，否则 Any）
     */
    public static TypeRef commonType(TypeRef a, TypeRef b) {
        if (a == null) return b;
        if (b == null) return a;
        if (a.equals(b)) return a;
        if (Types.isNumeric(a) && Types.isNumeric(b)) return Types.DOUBLE;
        return Types.ANY;
    }
}
