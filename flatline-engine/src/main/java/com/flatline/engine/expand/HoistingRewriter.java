package com.flatline.engine.expand;

import com.flatline.compiler.analysis.Scope;
import com.flatline.compiler.analysis.TypeInferencer;
import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.decl.PropertyDecl;
import com.flatline.compiler.ast.expr.*;
import com.flatline.compiler.ast.stmt.*;
import com.flatline.compiler.ast.type.TypeRef;
import com.flatline.compiler.ast.type.Types;
import com.flatline.engine.diag.DiagnosticCode;
import com.flatline.engine.pass.NameAllocator;
import com.flatline.engine.pass.Trees;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 带语句提升的树遍历基类
 *
 * <p>按作用域遍历语句，在每个调用处询问 {@link #expandCall}；展开结果中需要先执行的语句
 * 提升到最近的语句列表中调用点之前。只能容纳单个表达式的位置按原有求值语义改写：</p>
 * <ul>
 *   <li>{@code while (c)} 改为 {@code while (true) { 提升语句; if (!(c)) break; 循环体 }}，
 *       经典 for 的条件同样移入循环体</li>
 *   <li>{@code a && b}、{@code a || b} 右侧有提升语句时引入临时布尔变量，右侧只在需要时求值</li>
 *   <li>三元表达式的分支有提升语句时改为 if/else 赋值临时变量</li>
 *   <li>when 的后续分支条件有提升语句时改为主语临时变量上的 if/else 链</li>
 *   <li>后面的操作数有提升语句时，前面不稳定的操作数先存入临时变量</li>
 * </ul>
 *
 * <p>子类决定哪些调用需要展开：调用方代码中的模板调用，或模板体中的行为参数调用。</p>
 */
public abstract class HoistingRewriter {

    protected final ExpansionContext ctx;
    protected final NameAllocator names;
    protected final TypeInferencer inferencer;

    protected HoistingRewriter(ExpansionContext ctx) {
        this.ctx = ctx;
        this.names = ctx.getNames();
        this.inferencer = ctx.getInferencer();
    }

    /**
     * 展开一个调用
     *
     * @param statementPosition 调用构成整条表达式语句，结果值不被使用
     * @return 展开结果；不需要展开时返回 null
     */
    protected abstract Expansion expandCall(CallExpr call, Scope scope, boolean statementPosition);

    // ==================== 语句 ====================

    /**
     * 在给定作用域中改写语句序列，局部声明按顺序加入该作用域
     */
    public List<Statement> rewriteStatements(List<Statement> statements, Scope scope) {
        List<Statement> out = new ArrayList<Statement>();
        for (Statement stmt : statements) {
            rewriteStatement(stmt, scope, out);
        }
        return out;
    }

    protected void rewriteStatement(Statement stmt, Scope scope, List<Statement> out) {
        if (stmt instanceof ExpressionStmt) {
            rewriteExpressionStmt((ExpressionStmt) stmt, scope, out);
        } else if (stmt instanceof DeclarationStmt) {
            PropertyDecl decl = ((DeclarationStmt) stmt).getDeclaration();
            List<Statement> hoists = new ArrayList<Statement>();
            Expression init = rewriteExpr(decl.getInitializer(), scope, hoists);
            out.addAll(hoists);
            out.add(init == decl.getInitializer() ? stmt
                    : new DeclarationStmt(stmt.getLocation(), decl.withInitializer(init)));
            inferencer.declare(decl, scope);
        } else if (stmt instanceof Block) {
            Block block = (Block) stmt;
            out.add(new Block(block.getLocation(),
                    rewriteStatements(block.getStatements(), scope.child(Scope.ScopeType.BLOCK))));
        } else if (stmt instanceof IfStmt) {
            IfStmt s = (IfStmt) stmt;
            List<Statement> hoists = new ArrayList<Statement>();
            Expression cond = rewriteExpr(s.getCondition(), scope, hoists);
            out.addAll(hoists);
            out.add(new IfStmt(s.getLocation(), cond, rewriteBranch(s.getThenBranch(), scope),
                    rewriteBranch(s.getElseBranch(), scope)));
        } else if (stmt instanceof WhenStmt) {
            rewriteWhen((WhenStmt) stmt, scope, out);
        } else if (stmt instanceof WhileStmt) {
            rewriteWhile((WhileStmt) stmt, scope, out);
        } else if (stmt instanceof ForStmt) {
            ForStmt s = (ForStmt) stmt;
            List<Statement> hoists = new ArrayList<Statement>();
            Expression iterable = rewriteExpr(s.getIterable(), scope, hoists);
            out.addAll(hoists);
            Scope loopScope = scope.child(Scope.ScopeType.BLOCK);
            loopScope.defineLocal(s.getVariable(), inferencer.loopVariableType(s, scope), false);
            out.add(new ForStmt(s.getLocation(), s.getVariable(), s.getVariableType(), iterable,
                    rewriteBranch(s.getBody(), loopScope)));
        } else if (stmt instanceof ClassicForStmt) {
            rewriteClassicFor((ClassicForStmt) stmt, scope, out);
        } else if (stmt instanceof ReturnStmt) {
            ReturnStmt s = (ReturnStmt) stmt;
            List<Statement> hoists = new ArrayList<Statement>();
            Expression value = rewriteExpr(s.getValue(), scope, hoists);
            out.addAll(hoists);
            out.add(value == s.getValue() ? stmt : new ReturnStmt(s.getLocation(), value));
        } else {
            out.add(stmt);
        }
    }

    private void rewriteExpressionStmt(ExpressionStmt stmt, Scope scope, List<Statement> out) {
        Expression expr = stmt.getExpression();
        List<Statement> hoists = new ArrayList<Statement>();
        Expression result;
        if (expr instanceof CallExpr) {
            Expansion expansion = expandCall((CallExpr) expr, scope, true);
            if (expansion != null) {
                out.addAll(expansion.getHoisted());
                if (!Trees.isPure(expansion.getValue())) {
                    out.add(new ExpressionStmt(stmt.getLocation(), expansion.getValue()));
                }
                return;
            }
            result = rewritePlainCall((CallExpr) expr, scope, hoists);
        } else {
            result = rewriteExpr(expr, scope, hoists);
        }
        out.addAll(hoists);
        out.add(result == expr ? stmt : new ExpressionStmt(stmt.getLocation(), result));
    }

    /** 分支与循环体在子作用域中改写；非块分支展开成多条语句时包成块 */
    protected Statement rewriteBranch(Statement stmt, Scope scope) {
        if (stmt == null) {
            return null;
        }
        Scope branchScope = scope.child(Scope.ScopeType.BLOCK);
        if (stmt instanceof Block) {
            return new Block(stmt.getLocation(), rewriteStatements(((Block) stmt).getStatements(), branchScope));
        }
        List<Statement> out = new ArrayList<Statement>();
        rewriteStatement(stmt, branchScope, out);
        return Trees.asStatement(out);
    }

    private void rewriteWhile(WhileStmt stmt, Scope scope, List<Statement> out) {
        List<Statement> hoists = new ArrayList<Statement>();
        Expression cond = rewriteExpr(stmt.getCondition(), scope, hoists);
        Statement body = rewriteBranch(stmt.getBody(), scope);
        if (hoists.isEmpty()) {
            out.add(new WhileStmt(stmt.getLocation(), cond, body));
            return;
        }
        out.add(new WhileStmt(stmt.getLocation(), Literal.ofBoolean(stmt.getLocation(), true),
                detachCondition(hoists, cond, body)));
    }

    /** 循环条件移入循环体：提升语句、条件不成立时 break，然后是原循环体 */
    private static Block detachCondition(List<Statement> hoists, Expression cond, Statement body) {
        List<Statement> inner = new ArrayList<Statement>(hoists);
        inner.add(Trees.breakIf(Trees.not(cond)));
        inner.addAll(Trees.flatten(body));
        return Trees.block(inner);
    }

    private void rewriteClassicFor(ClassicForStmt stmt, Scope scope, List<Statement> out) {
        Scope loopScope = scope.child(Scope.ScopeType.BLOCK);
        List<Statement> init = new ArrayList<Statement>();
        if (stmt.getInitializer() != null) {
            rewriteStatement(stmt.getInitializer(), loopScope, init);
        }

        List<Statement> condHoists = new ArrayList<Statement>();
        Expression cond = rewriteExpr(stmt.getCondition(), loopScope, condHoists);

        // 更新子句中的提升语句会被 continue 跳过，保留原样
        Expression update = stmt.getUpdate();
        if (update != null) {
            ExpansionContext.Mark mark = ctx.mark();
            List<Statement> updateHoists = new ArrayList<Statement>();
            Expression rewritten = rewriteExpr(update, loopScope, updateHoists);
            if (updateHoists.isEmpty()) {
                update = rewritten;
            } else {
                ctx.rollback(mark);
                ctx.report(DiagnosticCode.LEFT_UNEXPANDED, update.getLocation(),
                        expandedCallName(update), "loop update clause would need hoisted statements");
            }
        }

        Statement body = rewriteBranch(stmt.getBody(), loopScope);
        if (!condHoists.isEmpty()) {
            body = detachCondition(condHoists, cond, body);
            cond = null;
        }
        if (init.size() <= 1) {
            out.add(new ClassicForStmt(stmt.getLocation(), init.isEmpty() ? null : init.get(0), cond, update, body));
            return;
        }
        // 初始化语句带有提升语句：整个循环放进块中，循环变量仍只在块内可见
        List<Statement> wrapped = new ArrayList<Statement>(init);
        wrapped.add(new ClassicForStmt(stmt.getLocation(), null, cond, update, body));
        out.add(Trees.block(wrapped));
    }

    private void rewriteWhen(WhenStmt stmt, Scope scope, List<Statement> out) {
        List<Statement> subjectHoists = new ArrayList<Statement>();
        Expression subject = rewriteExpr(stmt.getSubject(), scope, subjectHoists);

        List<List<Expression>> conditions = new ArrayList<List<Expression>>();
        List<List<List<Statement>>> conditionHoists = new ArrayList<List<List<Statement>>>();
        boolean needsChain = false;
        for (int b = 0; b < stmt.getBranches().size(); b++) {
            List<Expression> conds = new ArrayList<Expression>();
            List<List<Statement>> hoists = new ArrayList<List<Statement>>();
            List<Expression> original = stmt.getBranches().get(b).getConditions();
            for (int c = 0; c < original.size(); c++) {
                List<Statement> h = new ArrayList<Statement>();
                conds.add(rewriteExpr(original.get(c), scope, h));
                hoists.add(h);
                // 第一个条件紧跟主语求值，主语简单时它的提升语句可以直接放在 when 之前
                if (!h.isEmpty() && (b > 0 || c > 0 || (subject != null && !Trees.isSimple(subject)))) {
                    needsChain = true;
                }
            }
            conditions.add(conds);
            conditionHoists.add(hoists);
        }

        List<Statement> bodies = new ArrayList<Statement>();
        for (WhenStmt.WhenBranch branch : stmt.getBranches()) {
            bodies.add(rewriteBranch(branch.getBody(), scope));
        }
        Statement elseBody = rewriteBranch(stmt.getElseBranch(), scope);

        out.addAll(subjectHoists);
        if (!needsChain) {
            if (!conditionHoists.isEmpty() && !conditionHoists.get(0).isEmpty()) {
                out.addAll(conditionHoists.get(0).get(0));
            }
            List<WhenStmt.WhenBranch> branches = new ArrayList<WhenStmt.WhenBranch>();
            for (int b = 0; b < bodies.size(); b++) {
                branches.add(new WhenStmt.WhenBranch(conditions.get(b), bodies.get(b)));
            }
            out.add(new WhenStmt(stmt.getLocation(), subject, branches, elseBody));
            return;
        }

        Expression subjectRef = null;
        if (subject != null) {
            String name = names.fresh("subject");
            out.add(Trees.val(name, subject));
            scope.defineLocal(name, inferencer.typeOf(stmt.getSubject(), scope), false);
            subjectRef = Trees.ident(name);
        }
        out.addAll(whenChain(0, subjectRef, conditions, conditionHoists, bodies, elseBody, stmt.getLocation()));
    }

    /** 从第 index 个分支开始构造 if/else 链 */
    private List<Statement> whenChain(int index, Expression subject, List<List<Expression>> conditions,
                                      List<List<List<Statement>>> hoists, List<Statement> bodies,
                                      Statement elseBody, SourceLocation location) {
        if (index == bodies.size()) {
            return elseBody != null ? Trees.flatten(elseBody) : Collections.<Statement>emptyList();
        }
        List<Expression> conds = conditions.get(index);
        List<Statement> out = new ArrayList<Statement>();
        Expression test;
        if (conds.size() == 1) {
            out.addAll(hoists.get(index).get(0));
            test = matches(subject, conds.get(0));
        } else {
            String match = names.fresh("match");
            out.add(Trees.var(match, Types.BOOLEAN, Literal.ofBoolean(location, false)));
            for (int c = 0; c < conds.size(); c++) {
                List<Statement> step = new ArrayList<Statement>(hoists.get(index).get(c));
                step.add(Trees.assign(match, matches(subject, conds.get(c))));
                if (c == 0) {
                    out.addAll(step);
                } else {
                    out.add(new IfStmt(location, Trees.not(Trees.ident(match)), Trees.block(step), null));
                }
            }
            test = Trees.ident(match);
        }
        List<Statement> rest = whenChain(index + 1, subject, conditions, hoists, bodies, elseBody, location);
        out.add(new IfStmt(location, test, bodies.get(index), rest.isEmpty() ? null : Trees.block(rest)));
        return out;
    }

    private static Expression matches(Expression subject, Expression condition) {
        if (subject == null) {
            return condition;
        }
        return new BinaryExpr(condition.getLocation(), subject, BinaryExpr.BinaryOp.EQ, condition);
    }

    // ==================== 表达式 ====================

    /**
     * 改写表达式，需要先执行的语句追加到 hoists
     */
    public Expression rewriteExpr(Expression expr, Scope scope, List<Statement> hoists) {
        if (expr == null || expr instanceof Identifier || expr instanceof Literal || expr instanceof ThisExpr) {
            return expr;
        }
        if (expr instanceof BinaryExpr) {
            BinaryExpr b = (BinaryExpr) expr;
            if (b.getOperator().isShortCircuit()) {
                return rewriteShortCircuit(b, scope, hoists);
            }
            List<Expression> ops = rewriteOperands(Arrays.asList(b.getLeft(), b.getRight()), scope, hoists);
            if (ops.get(0) == b.getLeft() && ops.get(1) == b.getRight()) return expr;
            return new BinaryExpr(b.getLocation(), ops.get(0), b.getOperator(), ops.get(1));
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr u = (UnaryExpr) expr;
            Expression operand = u.isMutating()
                    ? rewriteTarget(u.getOperand(), Collections.<Expression>emptyList(), scope, hoists).get(0)
                    : rewriteExpr(u.getOperand(), scope, hoists);
            if (operand == u.getOperand()) return expr;
            return new UnaryExpr(u.getLocation(), u.getOperator(), operand, u.isPrefix());
        }
        if (expr instanceof AssignExpr) {
            AssignExpr a = (AssignExpr) expr;
            List<Expression> rewritten = rewriteTarget(a.getTarget(), Collections.singletonList(a.getValue()),
                    scope, hoists);
            Expression target = rewritten.get(0);
            Expression value = rewritten.get(1);
            if (target == a.getTarget() && value == a.getValue()) return expr;
            return new AssignExpr(a.getLocation(), target, a.getOperator(), value);
        }
        if (expr instanceof ConditionalExpr) {
            return rewriteConditional((ConditionalExpr) expr, scope, hoists);
        }
        if (expr instanceof CallExpr) {
            CallExpr call = (CallExpr) expr;
            Expansion expansion = expandCall(call, scope, false);
            if (expansion == null) {
                return rewritePlainCall(call, scope, hoists);
            }
            hoists.addAll(expansion.getHoisted());
            return expansion.hasValue() ? expansion.getValue() : Literal.ofNull(call.getLocation());
        }
        if (expr instanceof MemberExpr) {
            MemberExpr m = (MemberExpr) expr;
            Expression target = rewriteExpr(m.getTarget(), scope, hoists);
            if (target == m.getTarget()) return expr;
            return new MemberExpr(m.getLocation(), target, m.getMember());
        }
        if (expr instanceof IndexExpr) {
            IndexExpr i = (IndexExpr) expr;
            List<Expression> ops = rewriteOperands(Arrays.asList(i.getTarget(), i.getIndex()), scope, hoists);
            if (ops.get(0) == i.getTarget() && ops.get(1) == i.getIndex()) return expr;
            return new IndexExpr(i.getLocation(), ops.get(0), ops.get(1));
        }
        if (expr instanceof LambdaExpr) {
            return rewriteLambda((LambdaExpr) expr, scope, null);
        }
        throw new IllegalStateException("Unsupported expression: " + expr.getClass().getSimpleName());
    }

    /** 不展开的调用：被调对象与实参按从左到右的顺序改写 */
    protected Expression rewritePlainCall(CallExpr call, Scope scope, List<Statement> hoists) {
        Expression callee = call.getCallee();
        List<Expression> operands = new ArrayList<Expression>();
        boolean member = callee instanceof MemberExpr;
        boolean named = callee instanceof Identifier;
        if (member) {
            operands.add(((MemberExpr) callee).getTarget());
        } else if (!named) {
            operands.add(callee);
        }
        operands.addAll(call.getArgs());
        List<Expression> rewritten = rewriteOperands(operands, scope, hoists);

        int argStart = named ? 0 : 1;
        Expression newCallee = callee;
        if (member) {
            MemberExpr m = (MemberExpr) callee;
            if (rewritten.get(0) != m.getTarget()) {
                newCallee = new MemberExpr(m.getLocation(), rewritten.get(0), m.getMember());
            }
        } else if (!named) {
            newCallee = rewritten.get(0);
        }
        List<Expression> args = rewritten.subList(argStart, rewritten.size());
        if (newCallee == callee && sameElements(args, call.getArgs())) {
            return call;
        }
        return new CallExpr(call.getLocation(), newCallee, call.getTypeArgs(), new ArrayList<Expression>(args));
    }

    /**
     * 改写赋值目标与其后的操作数。标识符目标不参与暂存；成员、索引目标的对象和下标作为操作数。
     *
     * @return 第一个元素是新目标，其后是改写后的 trailing 操作数
     */
    private List<Expression> rewriteTarget(Expression target, List<Expression> trailing, Scope scope,
                                           List<Statement> hoists) {
        List<Expression> operands = new ArrayList<Expression>();
        if (target instanceof MemberExpr) {
            operands.add(((MemberExpr) target).getTarget());
        } else if (target instanceof IndexExpr) {
            operands.add(((IndexExpr) target).getTarget());
            operands.add(((IndexExpr) target).getIndex());
        }
        int parts = operands.size();
        operands.addAll(trailing);
        List<Expression> rewritten = rewriteOperands(operands, scope, hoists);

        Expression newTarget = target;
        if (target instanceof MemberExpr && rewritten.get(0) != ((MemberExpr) target).getTarget()) {
            newTarget = new MemberExpr(target.getLocation(), rewritten.get(0), ((MemberExpr) target).getMember());
        } else if (target instanceof IndexExpr) {
            IndexExpr index = (IndexExpr) target;
            if (rewritten.get(0) != index.getTarget() || rewritten.get(1) != index.getIndex()) {
                newTarget = new IndexExpr(target.getLocation(), rewritten.get(0), rewritten.get(1));
            }
        }
        List<Expression> result = new ArrayList<Expression>();
        result.add(newTarget);
        result.addAll(rewritten.subList(parts, rewritten.size()));
        return result;
    }

    /**
     * 按从左到右改写一组操作数。若某个操作数带有提升语句，它之前不稳定的操作数先存入临时变量，
     * 保证原有求值顺序。
     */
    protected List<Expression> rewriteOperands(List<Expression> operands, Scope scope, List<Statement> hoists) {
        List<Expression> values = new ArrayList<Expression>(operands.size());
        List<List<Statement>> pending = new ArrayList<List<Statement>>(operands.size());
        int last = -1;
        for (int i = 0; i < operands.size(); i++) {
            List<Statement> h = new ArrayList<Statement>();
            values.add(rewriteExpr(operands.get(i), scope, h));
            pending.add(h);
            if (!h.isEmpty()) {
                last = i;
            }
        }
        List<Expression> result = new ArrayList<Expression>(operands.size());
        for (int i = 0; i < values.size(); i++) {
            hoists.addAll(pending.get(i));
            Expression value = values.get(i);
            if (i < last && !isStable(value, pending.subList(i + 1, last + 1))) {
                String temp = names.fresh("tmp");
                hoists.add(Trees.val(temp, value));
                scope.defineLocal(temp, inferencer.typeOf(operands.get(i), scope), false);
                value = Trees.ident(temp);
            }
            result.add(value);
        }
        return result;
    }

    /** 字面量、this、lambda 以及未被后续提升语句赋值的标识符可以原地保留 */
    private static boolean isStable(Expression value, List<List<Statement>> later) {
        if (value == null || value instanceof Literal || value instanceof ThisExpr || value instanceof LambdaExpr) {
            return true;
        }
        if (!(value instanceof Identifier)) {
            return false;
        }
        String name = ((Identifier) value).getName();
        for (List<Statement> statements : later) {
            Set<String> assigned = Trees.assignedNames(statements);
            if (assigned.contains(name)) {
                return false;
            }
        }
        return true;
    }

    private Expression rewriteShortCircuit(BinaryExpr b, Scope scope, List<Statement> hoists) {
        List<Statement> leftHoists = new ArrayList<Statement>();
        Expression left = rewriteExpr(b.getLeft(), scope, leftHoists);
        List<Statement> rightHoists = new ArrayList<Statement>();
        Expression right = rewriteExpr(b.getRight(), scope, rightHoists);
        hoists.addAll(leftHoists);
        if (rightHoists.isEmpty()) {
            if (left == b.getLeft() && right == b.getRight()) return b;
            return new BinaryExpr(b.getLocation(), left, b.getOperator(), right);
        }
        boolean and = b.getOperator() == BinaryExpr.BinaryOp.AND;
        String scratch = names.fresh(and ? "and" : "or");
        hoists.add(Trees.var(scratch, Types.BOOLEAN, left));
        List<Statement> inner = new ArrayList<Statement>(rightHoists);
        inner.add(Trees.assign(scratch, right));
        Expression guard = and ? Trees.ident(scratch) : Trees.not(Trees.ident(scratch));
        hoists.add(new IfStmt(b.getLocation(), guard, Trees.block(inner), null));
        scope.defineLocal(scratch, Types.BOOLEAN, true);
        return Trees.ident(scratch);
    }

    private Expression rewriteConditional(ConditionalExpr c, Scope scope, List<Statement> hoists) {
        Expression cond = rewriteExpr(c.getCondition(), scope, hoists);
        List<Statement> thenHoists = new ArrayList<Statement>();
        Expression thenExpr = rewriteExpr(c.getThenExpr(), scope, thenHoists);
        List<Statement> elseHoists = new ArrayList<Statement>();
        Expression elseExpr = rewriteExpr(c.getElseExpr(), scope, elseHoists);
        if (thenHoists.isEmpty() && elseHoists.isEmpty()) {
            if (cond == c.getCondition() && thenExpr == c.getThenExpr() && elseExpr == c.getElseExpr()) return c;
            return new ConditionalExpr(c.getLocation(), cond, thenExpr, elseExpr);
        }
        TypeRef type = inferencer.typeOf(c, scope);
        String scratch = names.fresh("ternary");
        hoists.add(Trees.var(scratch, type, Trees.defaultValue(type)));
        thenHoists.add(Trees.assign(scratch, thenExpr));
        elseHoists.add(Trees.assign(scratch, elseExpr));
        hoists.add(new IfStmt(c.getLocation(), cond, Trees.block(thenHoists), Trees.block(elseHoists)));
        scope.defineLocal(scratch, type, true);
        return Trees.ident(scratch);
    }

    /**
     * 改写 lambda 主体。表达式主体需要提升语句时转为块主体。
     *
     * @param paramTypes 未标注类型的参数使用的类型，可为 null
     */
    public LambdaExpr rewriteLambda(LambdaExpr lambda, Scope scope, List<TypeRef> paramTypes) {
        Scope lambdaScope = scope.child(Scope.ScopeType.LAMBDA);
        for (int i = 0; i < lambda.getParams().size(); i++) {
            LambdaExpr.LambdaParam param = lambda.getParams().get(i);
            TypeRef type = param.getType();
            if (type == null && paramTypes != null && i < paramTypes.size()) {
                type = paramTypes.get(i);
            }
            lambdaScope.defineParameter(param.getName(), type);
        }
        if (lambda.isBlockBody()) {
            Block body = lambda.getBlockBody();
            List<Statement> statements = rewriteStatements(body.getStatements(),
                    lambdaScope.child(Scope.ScopeType.BLOCK));
            return new LambdaExpr(lambda.getLocation(), lambda.getParams(), new Block(body.getLocation(), statements));
        }
        List<Statement> hoists = new ArrayList<Statement>();
        Expression body = rewriteExpr(lambda.getExpressionBody(), lambdaScope, hoists);
        if (hoists.isEmpty()) {
            return body == lambda.getExpressionBody() ? lambda
                    : new LambdaExpr(lambda.getLocation(), lambda.getParams(), body);
        }
        hoists.add(new ReturnStmt(body.getLocation(), body));
        return new LambdaExpr(lambda.getLocation(), lambda.getParams(), Trees.block(hoists));
    }

    // ==================== 工具 ====================

    /** 表达式中第一个被调名字，用于诊断信息 */
    protected static String expandedCallName(Expression expr) {
        final String[] found = new String[1];
        new com.flatline.engine.pass.TreeRewriter() {
            @Override
            protected Expression rewriteCall(CallExpr call) {
                if (found[0] == null && call.getCalleeName() != null) {
                    found[0] = call.getCalleeName();
                }
                return super.rewriteCall(call);
            }
        }.rewrite(expr);
        return found[0] != null ? found[0] : "?";
    }

    private static boolean sameElements(List<Expression> a, List<Expression> b) {
        if (a.size() != b.size()) return false;
        for (int i = 0; i < a.size(); i++) {
            if (a.get(i) != b.get(i)) return false;
        }
        return true;
    }
}
