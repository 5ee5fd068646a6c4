package com.flatline.runtime.interpreter;

import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.decl.ClassDecl;
import com.flatline.compiler.ast.decl.Declaration;
import com.flatline.compiler.ast.decl.FunDecl;
import com.flatline.compiler.ast.decl.Parameter;
import com.flatline.compiler.ast.decl.Program;
import com.flatline.compiler.ast.decl.PropertyDecl;
import com.flatline.compiler.ast.expr.*;
import com.flatline.compiler.ast.stmt.*;
import com.flatline.compiler.ast.type.TypeRef;
import com.flatline.compiler.ast.type.Types;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Flatline 树遍历解释器
 *
 * <p>直接执行 AST。扩展调用 {@code recv.f(args)} 在接收者没有方法 f 时
 * 调用顶层函数 {@code f(recv, args)}，因此模板展开前后的程序都能执行。</p>
 */
public class Interpreter {

    private static final Logger LOG = Logger.getLogger(Interpreter.class.getName());

    private final Map<String, List<FunDecl>> functions = new LinkedHashMap<String, List<FunDecl>>();
    private final Map<String, ClassDecl> classes = new LinkedHashMap<String, ClassDecl>();
    private final Environment globals = new Environment(null);
    private PrintStream out = System.out;

    public Interpreter(Program program) {
        this(Arrays.asList(program));
    }

    /**
     * @param programs 一个或多个编译单元（如调用方与模板库），共享顶层命名空间
     */
    public Interpreter(List<Program> programs) {
        List<PropertyDecl> globalDecls = new ArrayList<PropertyDecl>();
        for (Program program : programs) {
            for (Declaration decl : program.getDeclarations()) {
                if (decl instanceof FunDecl) {
                    List<FunDecl> overloads = functions.get(decl.getName());
                    if (overloads == null) {
                        overloads = new ArrayList<FunDecl>();
                        functions.put(decl.getName(), overloads);
                    }
                    overloads.add((FunDecl) decl);
                } else if (decl instanceof ClassDecl) {
                    classes.put(decl.getName(), (ClassDecl) decl);
                } else if (decl instanceof PropertyDecl) {
                    globalDecls.add((PropertyDecl) decl);
                }
            }
        }
        // 顶层属性按声明顺序初始化
        for (PropertyDecl global : globalDecls) {
            globals.define(global.getName(), initialValue(global, globals, null));
        }
        LOG.fine("Loaded " + functions.size() + " functions, " + classes.size() + " classes");
    }

    public void setOut(PrintStream out) {
        this.out = out;
    }

    public Object getGlobal(String name) {
        return globals.get(name);
    }

    /**
     * 调用顶层函数
     */
    public Object call(String functionName, Object... args) {
        List<Object> argList = Arrays.asList(args);
        FunDecl fn = selectFunction(functionName, argList, null);
        if (fn == null) {
            throw new FlatlineRuntimeException("Undefined function '" + functionName + "'");
        }
        return invoke(fn, null, argList);
    }

    /**
     * 执行函数或方法体
     */
    Object invoke(FunDecl fn, FlatlineObject self, List<Object> args) {
        if (!fn.hasBody()) {
            throw new FlatlineRuntimeException("Function '" + fn.getName() + "' has no body", fn.getLocation());
        }
        Environment env = new Environment(globals);
        for (int i = 0; i < fn.getParams().size(); i++) {
            env.define(fn.getParams().get(i).getName(), args.get(i));
        }
        if (fn.getExpressionBody() != null) {
            return evaluate(fn.getExpressionBody(), env, self);
        }
        try {
            executeBlock(fn.getBody().getStatements(), env, self);
        } catch (ControlFlow flow) {
            if (flow.getType() == ControlFlow.Type.RETURN) {
                return flow.getValue();
            }
            throw new FlatlineRuntimeException(flow.getType() + " outside of loop", fn.getLocation());
        }
        return null;
    }

    private Object initialValue(PropertyDecl decl, Environment env, FlatlineObject self) {
        if (decl.getInitializer() != null) {
            return evaluate(decl.getInitializer(), env, self);
        }
        return defaultValue(decl.getType());
    }

    static Object defaultValue(TypeRef type) {
        if (Types.INT.equals(type)) return 0;
        if (Types.DOUBLE.equals(type)) return 0.0;
        if (Types.BOOLEAN.equals(type)) return Boolean.FALSE;
        return null;
    }

    // ============ 语句 ============

    void executeBlock(List<Statement> statements, Environment env, FlatlineObject self) {
        for (Statement stmt : statements) {
            execute(stmt, env, self);
        }
    }

    private void execute(Statement stmt, Environment env, FlatlineObject self) {
        if (stmt instanceof ExpressionStmt) {
            evaluate(((ExpressionStmt) stmt).getExpression(), env, self);
        } else if (stmt instanceof DeclarationStmt) {
            PropertyDecl decl = ((DeclarationStmt) stmt).getDeclaration();
            env.define(decl.getName(), initialValue(decl, env, self));
        } else if (stmt instanceof Block) {
            executeBlock(((Block) stmt).getStatements(), new Environment(env), self);
        } else if (stmt instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) stmt;
            if (truthy(evaluate(ifStmt.getCondition(), env, self), ifStmt.getCondition())) {
                execute(ifStmt.getThenBranch(), new Environment(env), self);
            } else if (ifStmt.hasElse()) {
                execute(ifStmt.getElseBranch(), new Environment(env), self);
            }
        } else if (stmt instanceof WhenStmt) {
            executeWhen((WhenStmt) stmt, env, self);
        } else if (stmt instanceof WhileStmt) {
            WhileStmt loop = (WhileStmt) stmt;
            while (truthy(evaluate(loop.getCondition(), env, self), loop.getCondition())) {
                if (!runLoopBody(loop.getBody(), new Environment(env), self)) {
                    break;
                }
            }
        } else if (stmt instanceof ForStmt) {
            executeFor((ForStmt) stmt, env, self);
        } else if (stmt instanceof ClassicForStmt) {
            executeClassicFor((ClassicForStmt) stmt, env, self);
        } else if (stmt instanceof ReturnStmt) {
            Expression value = ((ReturnStmt) stmt).getValue();
            throw ControlFlow.returnValue(value != null ? evaluate(value, env, self) : null);
        } else if (stmt instanceof BreakStmt) {
            throw ControlFlow.breakLoop();
        } else if (stmt instanceof ContinueStmt) {
            throw ControlFlow.continueLoop();
        } else {
            throw new FlatlineRuntimeException("Unsupported statement " + stmt.getClass().getSimpleName(),
                    stmt.getLocation());
        }
    }

    /**
     * 执行一次循环体
     *
     * @return false 表示遇到 break
     */
    private boolean runLoopBody(Statement body, Environment env, FlatlineObject self) {
        try {
            execute(body, env, self);
        } catch (ControlFlow flow) {
            if (flow.getType() == ControlFlow.Type.BREAK) {
                return false;
            }
            if (flow.getType() != ControlFlow.Type.CONTINUE) {
                throw flow;
            }
        }
        return true;
    }

    private void executeWhen(WhenStmt when, Environment env, FlatlineObject self) {
        Object subject = when.getSubject() != null ? evaluate(when.getSubject(), env, self) : null;
        for (WhenStmt.WhenBranch branch : when.getBranches()) {
            for (Expression condition : branch.getConditions()) {
                Object value = evaluate(condition, env, self);
                boolean matched = when.getSubject() != null ? valueEquals(subject, value) : truthy(value, condition);
                if (matched) {
                    execute(branch.getBody(), new Environment(env), self);
                    return;
                }
            }
        }
        if (when.hasElse()) {
            execute(when.getElseBranch(), new Environment(env), self);
        }
    }

    private void executeFor(ForStmt loop, Environment env, FlatlineObject self) {
        Object iterable = evaluate(loop.getIterable(), env, self);
        if (!(iterable instanceof FlatlineArray)) {
            throw new FlatlineRuntimeException("Cannot iterate over " + stringify(iterable), loop.getLocation());
        }
        FlatlineArray array = (FlatlineArray) iterable;
        for (int i = 0; i < array.size(); i++) {
            Environment iterationEnv = new Environment(env);
            iterationEnv.define(loop.getVariable(), array.get(i));
            if (!runLoopBody(loop.getBody(), iterationEnv, self)) {
                break;
            }
        }
    }

    private void executeClassicFor(ClassicForStmt loop, Environment env, FlatlineObject self) {
        Environment loopEnv = new Environment(env);
        if (loop.getInitializer() != null) {
            execute(loop.getInitializer(), loopEnv, self);
        }
        while (loop.getCondition() == null
                || truthy(evaluate(loop.getCondition(), loopEnv, self), loop.getCondition())) {
            if (!runLoopBody(loop.getBody(), new Environment(loopEnv), self)) {
                break;
            }
            if (loop.getUpdate() != null) {
                evaluate(loop.getUpdate(), loopEnv, self);
            }
        }
    }

    // ============ 表达式 ============

    Object evaluate(Expression expr, Environment env, FlatlineObject self) {
        if (expr instanceof Literal) {
            return ((Literal) expr).getValue();
        }
        if (expr instanceof Identifier) {
            return lookup(((Identifier) expr).getName(), env, self, expr.getLocation());
        }
        if (expr instanceof ThisExpr) {
            if (self == null) {
                throw new FlatlineRuntimeException("'this' outside of a class", expr.getLocation());
            }
            return self;
        }
        if (expr instanceof BinaryExpr) {
            return evaluateBinary((BinaryExpr) expr, env, self);
        }
        if (expr instanceof UnaryExpr) {
            return evaluateUnary((UnaryExpr) expr, env, self);
        }
        if (expr instanceof AssignExpr) {
            return evaluateAssign((AssignExpr) expr, env, self);
        }
        if (expr instanceof ConditionalExpr) {
            ConditionalExpr cond = (ConditionalExpr) expr;
            return truthy(evaluate(cond.getCondition(), env, self), cond.getCondition())
                    ? evaluate(cond.getThenExpr(), env, self)
                    : evaluate(cond.getElseExpr(), env, self);
        }
        if (expr instanceof IndexExpr) {
            IndexExpr index = (IndexExpr) expr;
            FlatlineArray array = asArray(evaluate(index.getTarget(), env, self), index.getTarget());
            return array.get(asInt(evaluate(index.getIndex(), env, self), index.getIndex()));
        }
        if (expr instanceof MemberExpr) {
            MemberExpr member = (MemberExpr) expr;
            return readMember(evaluate(member.getTarget(), env, self), member.getMember(), member.getLocation());
        }
        if (expr instanceof CallExpr) {
            return evaluateCall((CallExpr) expr, env, self);
        }
        if (expr instanceof LambdaExpr) {
            return new LambdaValue((LambdaExpr) expr, env, self);
        }
        throw new FlatlineRuntimeException("Unsupported expression " + expr.getClass().getSimpleName(),
                expr.getLocation());
    }

    private Object lookup(String name, Environment env, FlatlineObject self, SourceLocation location) {
        if (env.isDefined(name)) {
            return env.get(name);
        }
        if (self != null && self.hasField(name)) {
            return self.getField(name);
        }
        if (self != null && self.getClassDecl().findMethod(name) != null) {
            return new FunctionValue(self.getClassDecl().findMethod(name), self);
        }
        List<FunDecl> overloads = functions.get(name);
        if (overloads != null && overloads.size() == 1) {
            return new FunctionValue(overloads.get(0), null);
        }
        throw new FlatlineRuntimeException("Undefined variable '" + name + "'", location);
    }

    private Object readMember(Object target, String member, SourceLocation location) {
        if (target instanceof FlatlineArray && "size".equals(member)) {
            return ((FlatlineArray) target).size();
        }
        if (target instanceof String && "length".equals(member)) {
            return ((String) target).length();
        }
        if (target instanceof FlatlineObject) {
            return ((FlatlineObject) target).getField(member);
        }
        throw new FlatlineRuntimeException("Unknown member '" + member + "' on " + stringify(target), location);
    }

    private Object evaluateBinary(BinaryExpr expr, Environment env, FlatlineObject self) {
        BinaryExpr.BinaryOp op = expr.getOperator();
        Object left = evaluate(expr.getLeft(), env, self);
        if (op == BinaryExpr.BinaryOp.AND) {
            return truthy(left, expr.getLeft()) && truthy(evaluate(expr.getRight(), env, self), expr.getRight());
        }
        if (op == BinaryExpr.BinaryOp.OR) {
            return truthy(left, expr.getLeft()) || truthy(evaluate(expr.getRight(), env, self), expr.getRight());
        }
        Object right = evaluate(expr.getRight(), env, self);
        return BinaryOps.apply(op, left, right, expr.getLocation());
    }

    private Object evaluateUnary(UnaryExpr expr, Environment env, FlatlineObject self) {
        switch (expr.getOperator()) {
            case NOT:
                return !truthy(evaluate(expr.getOperand(), env, self), expr.getOperand());
            case NEG:
                return BinaryOps.negate(evaluate(expr.getOperand(), env, self), expr.getLocation());
            default: {
                Object old = evaluate(expr.getOperand(), env, self);
                BinaryExpr.BinaryOp op = expr.getOperator() == UnaryExpr.UnaryOp.INC
                        ? BinaryExpr.BinaryOp.ADD : BinaryExpr.BinaryOp.SUB;
                Object updated = BinaryOps.apply(op, old, 1, expr.getLocation());
                store(expr.getOperand(), updated, env, self);
                return expr.isPrefix() ? updated : old;
            }
        }
    }

    private Object evaluateAssign(AssignExpr expr, Environment env, FlatlineObject self) {
        Object value;
        if (expr.getOperator().getBinaryOp() == null) {
            value = evaluate(expr.getValue(), env, self);
        } else {
            Object current = evaluate(expr.getTarget(), env, self);
            value = BinaryOps.apply(expr.getOperator().getBinaryOp(), current,
                    evaluate(expr.getValue(), env, self), expr.getLocation());
        }
        store(expr.getTarget(), value, env, self);
        return value;
    }

    private void store(Expression target, Object value, Environment env, FlatlineObject self) {
        if (target instanceof Identifier) {
            String name = ((Identifier) target).getName();
            if (env.isDefined(name)) {
                env.assign(name, value);
            } else if (self != null && self.hasField(name)) {
                self.setField(name, value);
            } else {
                throw new FlatlineRuntimeException("Undefined variable '" + name + "'", target.getLocation());
            }
        } else if (target instanceof MemberExpr) {
            MemberExpr member = (MemberExpr) target;
            Object obj = evaluate(member.getTarget(), env, self);
            if (!(obj instanceof FlatlineObject)) {
                throw new FlatlineRuntimeException("Cannot assign member of " + stringify(obj), target.getLocation());
            }
            ((FlatlineObject) obj).setField(member.getMember(), value);
        } else if (target instanceof IndexExpr) {
            IndexExpr index = (IndexExpr) target;
            FlatlineArray array = asArray(evaluate(index.getTarget(), env, self), index.getTarget());
            array.set(asInt(evaluate(index.getIndex(), env, self), index.getIndex()), value);
        } else {
            throw new FlatlineRuntimeException("Invalid assignment target", target.getLocation());
        }
    }

    // ============ 调用 ============

    private Object evaluateCall(CallExpr call, Environment env, FlatlineObject self) {
        Expression callee = call.getCallee();

        if (callee instanceof MemberExpr) {
            MemberExpr member = (MemberExpr) callee;
            Object receiver = evaluate(member.getTarget(), env, self);
            List<Object> args = evaluateArgs(call.getArgs(), env, self);
            String name = member.getMember();

            if (receiver instanceof FlatlineObject) {
                FlatlineObject obj = (FlatlineObject) receiver;
                FunDecl method = obj.getClassDecl().findMethod(name);
                if (method != null) {
                    return invoke(method, obj, args);
                }
                if (obj.hasField(name)) {
                    return callValue(obj.getField(name), args, call.getLocation());
                }
            }
            if ("toString".equals(name) && args.isEmpty()) {
                return stringify(receiver);
            }

            // 扩展调用：顶层函数，接收者作为第一个实参
            List<Object> extArgs = new ArrayList<Object>(args.size() + 1);
            extArgs.add(receiver);
            extArgs.addAll(args);
            FunDecl fn = selectFunction(name, extArgs, call);
            if (fn == null) {
                throw new FlatlineRuntimeException("Unknown method '" + name + "' on " + stringify(receiver),
                        call.getLocation());
            }
            return invoke(fn, null, extArgs);
        }

        if (callee instanceof Identifier) {
            String name = ((Identifier) callee).getName();
            if (env.isDefined(name)) {
                return callValue(env.get(name), evaluateArgs(call.getArgs(), env, self), call.getLocation());
            }
            if (self != null && self.hasField(name)) {
                return callValue(self.getField(name), evaluateArgs(call.getArgs(), env, self), call.getLocation());
            }
            List<Object> args = evaluateArgs(call.getArgs(), env, self);
            if (self != null && self.getClassDecl().findMethod(name) != null) {
                return invoke(self.getClassDecl().findMethod(name), self, args);
            }
            if (functions.containsKey(name)) {
                FunDecl fn = selectFunction(name, args, call);
                if (fn == null) {
                    throw new FlatlineRuntimeException("No overload of '" + name + "' accepts "
                            + args.size() + " arguments", call.getLocation());
                }
                return invoke(fn, null, args);
            }
            if (classes.containsKey(name)) {
                return instantiate(classes.get(name));
            }
            return callBuiltin(name, call, args);
        }

        Object target = evaluate(callee, env, self);
        return callValue(target, evaluateArgs(call.getArgs(), env, self), call.getLocation());
    }

    private List<Object> evaluateArgs(List<Expression> args, Environment env, FlatlineObject self) {
        List<Object> values = new ArrayList<Object>(args.size());
        for (Expression arg : args) {
            values.add(evaluate(arg, env, self));
        }
        return values;
    }

    private Object callValue(Object target, List<Object> args, SourceLocation location) {
        if (!(target instanceof FlatlineCallable)) {
            throw new FlatlineRuntimeException(stringify(target) + " is not callable", location);
        }
        FlatlineCallable callable = (FlatlineCallable) target;
        if (callable.arity() != args.size()) {
            throw new FlatlineRuntimeException("Expected " + callable.arity() + " arguments but got "
                    + args.size(), location);
        }
        return callable.call(this, args);
    }

    private FlatlineObject instantiate(ClassDecl cls) {
        FlatlineObject obj = new FlatlineObject(cls);
        for (PropertyDecl field : cls.getFields()) {
            obj.setField(field.getName(), initialValue(field, new Environment(globals), obj));
        }
        return obj;
    }

    private Object callBuiltin(String name, CallExpr call, List<Object> args) {
        if ("println".equals(name) || "print".equals(name)) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(stringify(args.get(i)));
            }
            if ("println".equals(name)) {
                out.println(sb);
            } else {
                out.print(sb);
            }
            return null;
        }
        if ("arrayOf".equals(name)) {
            return new FlatlineArray(args.toArray());
        }
        if (Types.ARRAY.equals(name) && args.size() == 1) {
            int size = asInt(args.get(0), call.getArgs().get(0));
            Object[] elements = new Object[size];
            TypeRef elementType = call.getTypeArgs().size() == 1 ? call.getTypeArgs().get(0) : null;
            Arrays.fill(elements, defaultValue(elementType));
            return new FlatlineArray(elements);
        }
        throw new FlatlineRuntimeException("Undefined function '" + name + "'", call.getLocation());
    }

    /**
     * 按实参个数与运行时值选择重载
     */
    private FunDecl selectFunction(String name, List<Object> args, CallExpr call) {
        List<FunDecl> overloads = functions.get(name);
        if (overloads == null) {
            return null;
        }
        FunDecl fallback = null;
        for (FunDecl fn : overloads) {
            if (fn.getParams().size() != args.size()) {
                continue;
            }
            if (fallback == null) {
                fallback = fn;
            }
            if (accepts(fn, args)) {
                return fn;
            }
        }
        if (fallback != null && call != null) {
            LOG.fine("No exact overload of " + name + " at " + call.getLocation() + ", using first by arity");
        }
        return fallback;
    }

    private static boolean accepts(FunDecl fn, List<Object> args) {
        for (int i = 0; i < args.size(); i++) {
            Parameter p = fn.getParams().get(i);
            if (!valueMatches(p.getType(), args.get(i), fn.getTypeParams())) {
                return false;
            }
        }
        return true;
    }

    private static boolean valueMatches(TypeRef type, Object value, List<String> typeParams) {
        if (value == null || type == null || typeParams.contains(type.toSourceString())) {
            return true;
        }
        if (Types.INT.equals(type)) return value instanceof Integer;
        if (Types.DOUBLE.equals(type)) return value instanceof Double;
        if (Types.BOOLEAN.equals(type)) return value instanceof Boolean;
        if (Types.STRING.equals(type)) return value instanceof String;
        if (Types.isArray(type)) {
            if (!(value instanceof FlatlineArray)) return false;
            FlatlineArray array = (FlatlineArray) value;
            TypeRef element = Types.elementType(type);
            for (int i = 0; i < array.size(); i++) {
                if (!valueMatches(element, array.get(i), typeParams)) return false;
            }
            return true;
        }
        return true;
    }

    // ============ 值工具 ============

    private static boolean truthy(Object value, Expression source) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new FlatlineRuntimeException("Expected Boolean but got " + stringify(value), source.getLocation());
    }

    private static FlatlineArray asArray(Object value, Expression source) {
        if (value instanceof FlatlineArray) {
            return (FlatlineArray) value;
        }
        throw new FlatlineRuntimeException("Expected array but got " + stringify(value), source.getLocation());
    }

    private static int asInt(Object value, Expression source) {
        if (value instanceof Integer) {
            return (Integer) value;
        }
        throw new FlatlineRuntimeException("Expected Int but got " + stringify(value), source.getLocation());
    }

    static boolean valueEquals(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return ((Number) a).doubleValue() == ((Number) b).doubleValue();
        }
        return Objects.equals(a, b);
    }

    /** 值的显示形式 */
    public static String stringify(Object value) {
        return value == null ? "null" : value.toString();
    }
}
