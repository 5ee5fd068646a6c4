package com.flatline.compiler.ast.type;

import com.flatline.compiler.ast.SourceLocation;

import java.util.Collections;

/**
 * 内置类型常量与工具方法
 */
public final class Types {

    public static final String ARRAY = "Array";

    public static final SimpleType INT = builtin("Int");
    public static final SimpleType DOUBLE = builtin("Double");
    public static final SimpleType BOOLEAN = builtin("Boolean");
    public static final SimpleType STRING = builtin("String");
    public static final SimpleType UNIT = builtin("Unit");
    public static final SimpleType ANY = builtin("Any");

    private Types() {
    }

    private static SimpleType builtin(String name) {
        return new SimpleType(SourceLocation.UNKNOWN, name);
    }

    public static SimpleType named(String name) {
        return new SimpleType(SourceLocation.UNKNOWN, name);
    }

    public static GenericType arrayOf(TypeRef element) {
        return new GenericType(SourceLocation.UNKNOWN, ARRAY, Collections.singletonList(element));
    }

    public static boolean isArray(TypeRef type) {
        return type instanceof GenericType
                && ARRAY.equals(((GenericType) type).getName())
                && ((GenericType) type).getTypeArgs().size() == 1;
    }

    /** 数组元素类型，非数组返回 null */
    public static TypeRef elementType(TypeRef type) {
        return isArray(type) ? ((GenericType) type).getTypeArgs().get(0) : null;
    }

    public static boolean isUnit(TypeRef type) {
        return type == null || UNIT.equals(type);
    }

    public static boolean isNumeric(TypeRef type) {
        return INT.equals(type) || DOUBLE.equals(type);
    }

    public static boolean isBuiltinName(String name) {
        return "Int".equals(name) || "Double".equals(name) || "Boolean".equals(name)
                || "String".equals(name) || "Unit".equals(name) || "Any".equals(name)
                || ARRAY.equals(name);
    }
}
