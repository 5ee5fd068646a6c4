package com.flatline.engine.expand;

import com.flatline.compiler.analysis.Scope;
import com.flatline.compiler.ast.expr.LambdaExpr;
import com.flatline.compiler.ast.type.TypeRef;
import com.flatline.engine.pass.Capture;

import java.util.Collections;
import java.util.List;

/**
 * 一次实例化中绑定到行为参数的 lambda 实参
 */
final class Behavior {

    /** 行为字面量的主体形态 */
    enum Form {
        EXPRESSION,
        BLOCK
    }

    private final String name;
    private final LambdaExpr lambda;
    private final List<TypeRef> paramTypes;
    private final TypeRef returnType;
    private final Scope scope;

    private List<Capture> captures;
    private String extractedName;

    /**
     * @param name       模板主体中行为参数改名后的名字
     * @param lambda     已展开内部模板调用的 lambda
     * @param paramTypes 按函数类型替换后的参数类型，未知为 null
     * @param returnType 替换后的返回类型，未知为 null
     * @param scope      调用点作用域，自由变量在其中解析
     */
    Behavior(String name, LambdaExpr lambda, List<TypeRef> paramTypes, TypeRef returnType, Scope scope) {
        this.name = name;
        this.lambda = lambda;
        this.paramTypes = Collections.unmodifiableList(paramTypes);
        this.returnType = returnType;
        this.scope = scope;
    }

    String getName() { return name; }
    LambdaExpr getLambda() { return lambda; }
    TypeRef getReturnType() { return returnType; }
    Scope getScope() { return scope; }

    Form getForm() {
        return lambda.isBlockBody() ? Form.BLOCK : Form.EXPRESSION;
    }

    int arity() {
        return lambda.getParams().size();
    }

    /** 第 i 个参数的类型：lambda 上的标注优先 */
    TypeRef paramType(int i) {
        TypeRef declared = lambda.getParams().get(i).getType();
        if (declared != null) {
            return declared;
        }
        return i < paramTypes.size() ? paramTypes.get(i) : null;
    }

    List<TypeRef> getParamTypes() {
        return paramTypes;
    }

    List<Capture> getCaptures() { return captures; }
    void setCaptures(List<Capture> captures) { this.captures = captures; }

    String getExtractedName() { return extractedName; }
    void setExtractedName(String extractedName) { this.extractedName = extractedName; }
}
