package com.flatline.compiler.analysis;

import com.flatline.compiler.ast.decl.ClassDecl;
import com.flatline.compiler.ast.decl.Declaration;
import com.flatline.compiler.ast.decl.FunDecl;
import com.flatline.compiler.ast.decl.Parameter;
import com.flatline.compiler.ast.decl.Program;
import com.flatline.compiler.ast.decl.PropertyDecl;
import com.flatline.compiler.ast.type.FunctionType;
import com.flatline.compiler.ast.type.TypeRef;
import com.flatline.compiler.ast.type.Types;
import com.flatline.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 顶层声明索引：函数（含重载）、顶层属性、类
 *
 * <p>由调用方编译单元与模板库共同构建，供类型推断与作用域构建使用。</p>
 */
public final class ProgramIndex {

    private final Map<String, List<FunDecl>> functions = new LinkedHashMap<String, List<FunDecl>>();
    private final Map<String, PropertyDecl> globals = new LinkedHashMap<String, PropertyDecl>();
    private final Map<String, ClassDecl> classes = new LinkedHashMap<String, ClassDecl>();

    public ProgramIndex(List<Program> programs) {
        for (Program program : programs) {
            for (Declaration decl : program.getDeclarations()) {
                if (decl instanceof FunDecl) {
                    List<FunDecl> overloads = functions.get(decl.getName());
                    if (overloads == null) {
                        overloads = new ArrayList<FunDecl>();
                        functions.put(decl.getName(), overloads);
                    }
                    overloads.add((FunDecl) decl);
                } else if (decl instanceof PropertyDecl) {
                    globals.put(decl.getName(), (PropertyDecl) decl);
                } else if (decl instanceof ClassDecl) {
                    classes.put(decl.getName(), (ClassDecl) decl);
                }
            }
        }
    }

    public static ProgramIndex of(Program... programs) {
        List<Program> list = new ArrayList<Program>();
        Collections.addAll(list, programs);
        return new ProgramIndex(list);
    }

    public List<FunDecl> getFunctions(String name) {
        List<FunDecl> overloads = functions.get(name);
        return overloads != null ? overloads : Collections.<FunDecl>emptyList();
    }

    public PropertyDecl getGlobal(String name) {
        return globals.get(name);
    }

    public ClassDecl getClass(String name) {
        return classes.get(name);
    }

    /** 类型对应的类声明（非类类型返回 null） */
    public ClassDecl classOf(TypeRef type) {
        return type == null ? null : classes.get(type.toSourceString());
    }

    /**
     * 构建顶层作用域：函数、顶层属性、类
     */
    public Scope globalScope(TypeInferencer inferencer) {
        Scope scope = new Scope(Scope.ScopeType.GLOBAL, null);
        for (ClassDecl cls : classes.values()) {
            scope.define(new Symbol(cls.getName(), SymbolKind.CLASS, Types.named(cls.getName()), false, cls));
        }
        for (List<FunDecl> overloads : functions.values()) {
            FunDecl fn = overloads.get(0);
            scope.define(new Symbol(fn.getName(), SymbolKind.FUNCTION, functionType(fn, inferencer), false, fn));
        }
        for (PropertyDecl global : globals.values()) {
            TypeRef type = global.getType();
            if (type == null && global.getInitializer() != null) {
                type = inferencer.typeOf(global.getInitializer(), scope);
            }
            scope.define(new Symbol(global.getName(), SymbolKind.GLOBAL, type, global.isMutable(), global));
        }
        return scope;
    }

    /**
     * 构建类作用域：字段（不含方法，方法通过 {@link #methodOf} 查找）
     */
    public Scope classScope(ClassDecl cls, Scope parent, TypeInferencer inferencer) {
        Scope scope = parent.child(Scope.ScopeType.CLASS);
        scope.setOwnerTypeName(cls.getName());
        for (PropertyDecl field : cls.getFields()) {
            TypeRef type = field.getType();
            if (type == null && field.getInitializer() != null) {
                type = inferencer.typeOf(field.getInitializer(), scope);
            }
            scope.define(new Symbol(field.getName(), SymbolKind.FIELD, type, field.isMutable(), field));
        }
        return scope;
    }

    /**
     * 构建函数作用域：参数
     */
    public Scope functionScope(FunDecl fn, Scope parent) {
        Scope scope = parent.child(Scope.ScopeType.FUNCTION);
        for (Parameter param : fn.getParams()) {
            scope.define(new Symbol(param.getName(), SymbolKind.PARAMETER, param.getType(), false, param));
        }
        return scope;
    }

    public FunDecl methodOf(TypeRef receiverType, String name) {
        ClassDecl cls = classOf(receiverType);
        return cls != null ? cls.findMethod(name) : null;
    }

    /** 非泛型函数的函数类型，泛型函数返回 null */
    private static TypeRef functionType(FunDecl fn, TypeInferencer inferencer) {
        if (!fn.getTypeParams().isEmpty()) {
            return null;
        }
        List<TypeRef> params = new ArrayList<TypeRef>();
        for (Parameter p : fn.getParams()) {
            params.add(p.getType());
        }
        TypeRef ret = fn.getReturnType() != null ? fn.getReturnType() : Types.UNIT;
        if (fn.getReturnType() == null && fn.getExpressionBody() != null) {
            ret = null;
        }
        return ret == null ? null : new FunctionType(SourceLocation.UNKNOWN, params, ret);
    }
}
