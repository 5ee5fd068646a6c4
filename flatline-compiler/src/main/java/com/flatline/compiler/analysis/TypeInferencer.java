package com.flatline.compiler.analysis;

import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.decl.ClassDecl;
import com.flatline.compiler.ast.decl.FunDecl;
import com.flatline.compiler.ast.decl.Parameter;
import com.flatline.compiler.ast.decl.PropertyDecl;
import com.flatline.compiler.ast.expr.*;
import com.flatline.compiler.ast.stmt.*;
import com.flatline.compiler.ast.type.FunctionType;
import com.flatline.compiler.ast.type.GenericType;
import com.flatline.compiler.ast.type.TypeRef;
import com.flatline.compiler.ast.type.Types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 静态类型推断
 *
 * <p>在给定作用域中计算表达式类型；无法确定时返回 null，从不抛出异常。
 * 扩展调用 {@code recv.f(args)} 在接收者类型没有方法 f 时解析为顶层函数 {@code f(recv, args)}。</p>
 */
public class TypeInferencer {

    private final ProgramIndex index;

    /** 正在推断返回类型的表达式体函数，防止递归 */
    private final Map<FunDecl, Boolean> inProgress = new IdentityHashMap<FunDecl, Boolean>();

    public TypeInferencer(ProgramIndex index) {
        this.index = index;
    }

    public ProgramIndex getIndex() {
        return index;
    }

    // ============ 表达式类型 ============

    public TypeRef typeOf(Expression expr, Scope scope) {
        if (expr instanceof Literal) {
            return literalType((Literal) expr);
        }
        if (expr instanceof Identifier) {
            Symbol symbol = scope.resolve(((Identifier) expr).getName());
            return symbol != null && symbol.getKind() != SymbolKind.CLASS ? symbol.getType() : null;
        }
        if (expr instanceof ThisExpr) {
            String owner = scope.getEnclosingTypeName();
            return owner != null ? Types.named(owner) : null;
        }
        if (expr instanceof BinaryExpr) {
            return binaryType((BinaryExpr) expr, scope);
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) expr;
            if (unary.getOperator() == UnaryExpr.UnaryOp.NOT) {
                return Types.BOOLEAN;
            }
            return typeOf(unary.getOperand(), scope);
        }
        if (expr instanceof AssignExpr) {
            return typeOf(((AssignExpr) expr).getTarget(), scope);
        }
        if (expr instanceof ConditionalExpr) {
            ConditionalExpr cond = (ConditionalExpr) expr;
            return TypeUnifier.commonType(typeOf(cond.getThenExpr(), scope), typeOf(cond.getElseExpr(), scope));
        }
        if (expr instanceof IndexExpr) {
            IndexExpr indexExpr = (IndexExpr) expr;
            return Types.elementType(typeOf(indexExpr.getTarget(), scope));
        }
        if (expr instanceof MemberExpr) {
            return memberType((MemberExpr) expr, scope);
        }
        if (expr instanceof CallExpr) {
            return callType((CallExpr) expr, scope);
        }
        if (expr instanceof LambdaExpr) {
            return lambdaType((LambdaExpr) expr, scope);
        }
        return null;
    }

    private static TypeRef literalType(Literal literal) {
        switch (literal.getKind()) {
            case INT: return Types.INT;
            case DOUBLE: return Types.DOUBLE;
            case BOOLEAN: return Types.BOOLEAN;
            case STRING: return Types.STRING;
            default: return null;
        }
    }

    private TypeRef binaryType(BinaryExpr expr, Scope scope) {
        switch (expr.getOperator()) {
            case EQ:
            case NE:
            case LT:
            case GT:
            case LE:
            case GE:
            case AND:
            case OR:
                return Types.BOOLEAN;
            default:
                break;
        }
        TypeRef left = typeOf(expr.getLeft(), scope);
        TypeRef right = typeOf(expr.getRight(), scope);
        if (expr.getOperator() == BinaryExpr.BinaryOp.ADD
                && (Types.STRING.equals(left) || Types.STRING.equals(right))) {
            return Types.STRING;
        }
        if (Types.isNumeric(left) && Types.isNumeric(right)) {
            return left.equals(right) ? left : Types.DOUBLE;
        }
        return null;
    }

    private TypeRef memberType(MemberExpr expr, Scope scope) {
        TypeRef targetType = typeOf(expr.getTarget(), scope);
        if (targetType == null) {
            return null;
        }
        if (Types.isArray(targetType) && "size".equals(expr.getMember())) {
            return Types.INT;
        }
        if (Types.STRING.equals(targetType) && "length".equals(expr.getMember())) {
            return Types.INT;
        }
        ClassDecl cls = index.classOf(targetType);
        if (cls != null) {
            PropertyDecl field = cls.findField(expr.getMember());
            if (field != null) {
                if (field.getType() != null) {
                    return field.getType();
                }
                return field.getInitializer() != null ? typeOf(field.getInitializer(), fieldScope(cls)) : null;
            }
        }
        return null;
    }

    private Scope fieldScope(ClassDecl cls) {
        Scope scope = new Scope(Scope.ScopeType.CLASS, null);
        scope.setOwnerTypeName(cls.getName());
        return scope;
    }

    private TypeRef lambdaType(LambdaExpr lambda, Scope scope) {
        List<TypeRef> params = new ArrayList<TypeRef>();
        Scope lambdaScope = scope.child(Scope.ScopeType.LAMBDA);
        for (LambdaExpr.LambdaParam p : lambda.getParams()) {
            if (p.getType() == null) {
                return null;
            }
            params.add(p.getType());
            lambdaScope.defineParameter(p.getName(), p.getType());
        }
        TypeRef ret = lambdaBodyType(lambda, lambdaScope);
        return new FunctionType(SourceLocation.UNKNOWN, params, ret != null ? ret : Types.UNIT);
    }

    // ============ 调用 ============

    private TypeRef callType(CallExpr call, Scope scope) {
        Expression callee = call.getCallee();

        if (callee instanceof Identifier) {
            String name = ((Identifier) callee).getName();
            TypeRef builtin = builtinCallType(name, call, scope);
            if (builtin != null) {
                return builtin;
            }

            Symbol symbol = scope.resolve(name);
            if (symbol != null && symbol.getKind() != SymbolKind.FUNCTION && symbol.getKind() != SymbolKind.CLASS) {
                // 函数类型的变量调用
                return symbol.getType() instanceof FunctionType
                        ? ((FunctionType) symbol.getType()).getReturnType() : null;
            }
            if (index.getClass(name) != null && index.getFunctions(name).isEmpty()) {
                return Types.named(name);
            }

            // 当前类的方法
            String owner = scope.getEnclosingTypeName();
            if (owner != null) {
                FunDecl method = index.methodOf(Types.named(owner), name);
                if (method != null) {
                    return bindAndReturn(Collections.singletonList(method), null, call, scope);
                }
            }
            return bindAndReturn(index.getFunctions(name), null, call, scope);
        }

        if (callee instanceof MemberExpr) {
            MemberExpr member = (MemberExpr) callee;
            TypeRef targetType = typeOf(member.getTarget(), scope);
            if ("toString".equals(member.getMember()) && call.getArgs().isEmpty()) {
                return Types.STRING;
            }
            FunDecl method = index.methodOf(targetType, member.getMember());
            if (method != null) {
                return bindAndReturn(Collections.singletonList(method), null, call, scope);
            }
            return bindAndReturn(index.getFunctions(member.getMember()), member.getTarget(), call, scope);
        }
        return null;
    }

    private TypeRef builtinCallType(String name, CallExpr call, Scope scope) {
        if (("println".equals(name) || "print".equals(name)) && scope.resolve(name) == null) {
            return Types.UNIT;
        }
        if (Types.ARRAY.equals(name) && call.getTypeArgs().size() == 1) {
            return Types.arrayOf(call.getTypeArgs().get(0));
        }
        if ("arrayOf".equals(name) && index.getFunctions(name).isEmpty()) {
            if (call.getTypeArgs().size() == 1) {
                return Types.arrayOf(call.getTypeArgs().get(0));
            }
            TypeRef element = null;
            for (Expression arg : call.getArgs()) {
                element = TypeUnifier.commonType(element, typeOf(arg, scope));
            }
            return element != null ? Types.arrayOf(element) : null;
        }
        return null;
    }

    private TypeRef bindAndReturn(List<FunDecl> candidates, Expression receiver, CallExpr call, Scope scope) {
        CallBinding binding = selectOverload(candidates, receiver, call.getArgs(), call.getTypeArgs(), scope);
        if (binding == null || binding.isAmbiguous()) {
            return null;
        }
        TypeRef ret = returnTypeOf(binding.getFunction());
        if (ret == null) {
            return null;
        }
        TypeRef substituted = ret.substitute(binding.getTypeBindings());
        return substituted.mentions(new HashSet<String>(binding.getFunction().getTypeParams())) ? null : substituted;
    }

    /**
     * 函数声明的返回类型：显式声明、块主体为 Unit、表达式主体按表达式推断
     */
    public TypeRef returnTypeOf(FunDecl fn) {
        if (fn.getReturnType() != null) {
            return fn.getReturnType();
        }
        if (fn.getExpressionBody() == null) {
            return Types.UNIT;
        }
        if (inProgress.containsKey(fn) || !fn.getTypeParams().isEmpty()) {
            return null;
        }
        inProgress.put(fn, Boolean.TRUE);
        try {
            Scope scope = index.functionScope(fn, new Scope(Scope.ScopeType.GLOBAL, null));
            return typeOf(fn.getExpressionBody(), scope);
        } finally {
            inProgress.remove(fn);
        }
    }

    /**
     * 在候选函数中选择与实参匹配的重载并推断类型参数。
     *
     * @param receiver 扩展调用的接收者（作为第一个实参），普通调用传 null
     * @return 无匹配返回 null；多个同等匹配返回 {@link CallBinding#isAmbiguous()} 为 true 的结果
     */
    public CallBinding selectOverload(List<FunDecl> candidates, Expression receiver, List<Expression> args,
                                      List<TypeRef> explicitTypeArgs, Scope scope) {
        List<Expression> allArgs = new ArrayList<Expression>();
        if (receiver != null) {
            allArgs.add(receiver);
        }
        allArgs.addAll(args);

        List<CallBinding> matches = new ArrayList<CallBinding>();
        for (FunDecl fn : candidates) {
            if (fn.getParams().size() != allArgs.size()) {
                continue;
            }
            Map<String, TypeRef> bindings = inferTypeArguments(fn, allArgs, explicitTypeArgs, scope);
            if (bindings != null) {
                matches.add(CallBinding.resolved(fn, bindings));
            }
        }
        if (matches.isEmpty()) {
            return null;
        }
        if (matches.size() == 1) {
            return matches.get(0);
        }

        // 多个候选：选择具体参数最多的一个
        CallBinding best = null;
        int bestScore = -1;
        boolean tie = false;
        for (CallBinding match : matches) {
            int score = specificity(match.getFunction());
            if (score > bestScore) {
                best = match;
                bestScore = score;
                tie = false;
            } else if (score == bestScore) {
                tie = true;
            }
        }
        return tie ? CallBinding.ambiguous(best.getFunction()) : best;
    }

    private static int specificity(FunDecl fn) {
        Set<String> typeParams = new HashSet<String>(fn.getTypeParams());
        int score = 0;
        for (Parameter p : fn.getParams()) {
            if (!p.getType().mentions(typeParams)) {
                score++;
            }
        }
        return score;
    }

    /**
     * 推断类型实参：先显式实参，再非 lambda 实参，最后按已绑定的参数类型推断 lambda 主体。
     *
     * @return 绑定表（可能不完整）；实参与形参不兼容时返回 null
     */
    public Map<String, TypeRef> inferTypeArguments(FunDecl fn, List<Expression> allArgs,
                                                   List<TypeRef> explicitTypeArgs, Scope scope) {
        Set<String> typeParams = new HashSet<String>(fn.getTypeParams());
        Map<String, TypeRef> bindings = new LinkedHashMap<String, TypeRef>();

        if (explicitTypeArgs != null && !explicitTypeArgs.isEmpty()) {
            if (explicitTypeArgs.size() != fn.getTypeParams().size()) {
                return null;
            }
            for (int i = 0; i < explicitTypeArgs.size(); i++) {
                bindings.put(fn.getTypeParams().get(i), explicitTypeArgs.get(i));
            }
        }

        // 非 lambda 实参
        for (int i = 0; i < allArgs.size(); i++) {
            Expression arg = allArgs.get(i);
            TypeRef paramType = fn.getParams().get(i).getType();
            if (arg instanceof LambdaExpr) {
                if (!(paramType instanceof FunctionType)
                        || ((FunctionType) paramType).getParamTypes().size() != ((LambdaExpr) arg).getParams().size()) {
                    return null;
                }
                continue;
            }
            if (!TypeUnifier.unify(paramType, typeOf(arg, scope), typeParams, bindings)) {
                return null;
            }
        }

        // lambda 实参
        for (int i = 0; i < allArgs.size(); i++) {
            if (!(allArgs.get(i) instanceof LambdaExpr)) {
                continue;
            }
            LambdaExpr lambda = (LambdaExpr) allArgs.get(i);
            FunctionType fnType = (FunctionType) fn.getParams().get(i).getType();
            Scope lambdaScope = scope.child(Scope.ScopeType.LAMBDA);
            for (int p = 0; p < lambda.getParams().size(); p++) {
                LambdaExpr.LambdaParam param = lambda.getParams().get(p);
                TypeRef expected = fnType.getParamTypes().get(p).substitute(bindings);
                if (param.getType() != null) {
                    if (!TypeUnifier.unify(fnType.getParamTypes().get(p), param.getType(), typeParams, bindings)) {
                        return null;
                    }
                    expected = param.getType();
                }
                lambdaScope.defineParameter(param.getName(), expected.mentions(typeParams) ? null : expected);
            }
            if (!Types.isUnit(fnType.getReturnType())) {
                TypeRef bodyType = lambdaBodyType(lambda, lambdaScope);
                if (!TypeUnifier.unify(fnType.getReturnType(), bodyType, typeParams, bindings)) {
                    return null;
                }
            }
        }
        return bindings;
    }

    /**
     * lambda 主体的值类型（块主体取第一个带值 return 的类型）
     */
    public TypeRef lambdaBodyType(LambdaExpr lambda, Scope lambdaScope) {
        if (!lambda.isBlockBody()) {
            return typeOf(lambda.getExpressionBody(), lambdaScope);
        }
        return returnTypeIn(lambda.getBlockBody().getStatements(), lambdaScope.child(Scope.ScopeType.BLOCK));
    }

    /**
     * 语句序列中第一个带值 return 的类型，沿途声明的局部变量加入作用域
     */
    public TypeRef returnTypeIn(List<Statement> statements, Scope scope) {
        for (Statement stmt : statements) {
            TypeRef found = returnTypeIn(stmt, scope);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private TypeRef returnTypeIn(Statement stmt, Scope scope) {
        if (stmt instanceof ReturnStmt) {
            Expression value = ((ReturnStmt) stmt).getValue();
            return value != null ? typeOf(value, scope) : null;
        }
        if (stmt instanceof DeclarationStmt) {
            declare(((DeclarationStmt) stmt).getDeclaration(), scope);
            return null;
        }
        if (stmt instanceof Block) {
            return returnTypeIn(((Block) stmt).getStatements(), scope.child(Scope.ScopeType.BLOCK));
        }
        if (stmt instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) stmt;
            TypeRef t = returnTypeIn(ifStmt.getThenBranch(), scope.child(Scope.ScopeType.BLOCK));
            if (t == null && ifStmt.hasElse()) {
                t = returnTypeIn(ifStmt.getElseBranch(), scope.child(Scope.ScopeType.BLOCK));
            }
            return t;
        }
        if (stmt instanceof WhenStmt) {
            WhenStmt when = (WhenStmt) stmt;
            for (WhenStmt.WhenBranch branch : when.getBranches()) {
                TypeRef t = returnTypeIn(branch.getBody(), scope.child(Scope.ScopeType.BLOCK));
                if (t != null) return t;
            }
            return when.hasElse() ? returnTypeIn(when.getElseBranch(), scope.child(Scope.ScopeType.BLOCK)) : null;
        }
        if (stmt instanceof WhileStmt) {
            return returnTypeIn(((WhileStmt) stmt).getBody(), scope.child(Scope.ScopeType.BLOCK));
        }
        if (stmt instanceof ForStmt) {
            ForStmt forStmt = (ForStmt) stmt;
            Scope loopScope = scope.child(Scope.ScopeType.BLOCK);
            loopScope.defineLocal(forStmt.getVariable(), loopVariableType(forStmt, scope), false);
            return returnTypeIn(forStmt.getBody(), loopScope);
        }
        if (stmt instanceof ClassicForStmt) {
            ClassicForStmt forStmt = (ClassicForStmt) stmt;
            Scope loopScope = scope.child(Scope.ScopeType.BLOCK);
            if (forStmt.getInitializer() != null) {
                returnTypeIn(forStmt.getInitializer(), loopScope);
            }
            return returnTypeIn(forStmt.getBody(), loopScope);
        }
        return null;
    }

    /**
     * 把局部变量声明加入作用域（类型取声明类型，否则推断初始值）
     */
    public void declare(PropertyDecl decl, Scope scope) {
        TypeRef type = decl.getType();
        if (type == null && decl.getInitializer() != null) {
            type = typeOf(decl.getInitializer(), scope);
        }
        scope.defineLocal(decl.getName(), type, decl.isMutable());
    }

    /** for-in 循环变量的类型 */
    public TypeRef loopVariableType(ForStmt forStmt, Scope scope) {
        if (forStmt.getVariableType() != null) {
            return forStmt.getVariableType();
        }
        TypeRef iterable = typeOf(forStmt.getIterable(), scope);
        return iterable instanceof GenericType ? Types.elementType(iterable) : null;
    }
}
