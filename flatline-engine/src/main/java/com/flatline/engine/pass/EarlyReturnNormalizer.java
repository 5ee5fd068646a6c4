package com.flatline.engine.pass;

import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.expr.Literal;
import com.flatline.compiler.ast.stmt.*;
import com.flatline.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 提前返回规范化：把含多个 return 的语句序列改写为单出口形式
 *
 * <p>VALUE 模式下声明结果变量，每个 {@code return x} 变为赋值，
 * 其后的语句并入可能正常结束的分支；输出以唯一的 {@code return result} 结尾。
 * VOID 与 DISCARD 模式不产生结果变量，输出不含 return
 * （DISCARD 保留有副作用的返回值表达式）。</p>
 *
 * <p>循环内的 return 改为赋值、置完成标志并 break；外层循环在内层循环之后
 * 检查标志，循环之后的语句只在标志未置位时执行。</p>
 */
public final class EarlyReturnNormalizer {

    public enum Mode {
        VALUE,
        VOID,
        DISCARD
    }

    private final NameAllocator names;

    public EarlyReturnNormalizer(NameAllocator names) {
        this.names = names;
    }

    /**
     * 只有序列最后一条顶层语句是 return（或没有 return）
     */
    public static boolean isSingleExit(List<Statement> statements) {
        for (int i = 0; i < statements.size(); i++) {
            Statement s = statements.get(i);
            boolean last = i == statements.size() - 1;
            if (last && s instanceof ReturnStmt) {
                return true;
            }
            if (Trees.containsReturn(s)) {
                return false;
            }
        }
        return true;
    }

    public List<Statement> normalize(List<Statement> statements, Mode mode, TypeRef resultType) {
        if (isSingleExit(statements)) {
            return normalizeSingleExit(statements, mode);
        }
        Run run = new Run(mode);
        List<Statement> body = run.sequence(statements);

        List<Statement> out = new ArrayList<Statement>();
        if (mode == Mode.VALUE) {
            out.add(Trees.var(run.resultName, resultType, Trees.defaultValue(resultType)));
        }
        if (run.doneName != null) {
            out.add(Trees.var(run.doneName, null, Literal.ofBoolean(SourceLocation.UNKNOWN, false)));
        }
        out.addAll(body);
        if (mode == Mode.VALUE) {
            out.add(new ReturnStmt(SourceLocation.UNKNOWN, Trees.ident(run.resultName)));
        }
        return out;
    }

    private static List<Statement> normalizeSingleExit(List<Statement> statements, Mode mode) {
        if (mode == Mode.VALUE || statements.isEmpty()) {
            return statements;
        }
        Statement last = statements.get(statements.size() - 1);
        if (!(last instanceof ReturnStmt)) {
            return statements;
        }
        List<Statement> out = new ArrayList<Statement>(statements.subList(0, statements.size() - 1));
        Expression value = ((ReturnStmt) last).getValue();
        if (mode == Mode.DISCARD && !Trees.isPure(value)) {
            out.add(Trees.stmt(value));
        }
        return out;
    }

    /** 一次规范化的状态：结果变量名与按需分配的完成标志名 */
    private final class Run {
        private final Mode mode;
        private final String resultName;
        private String doneName;

        Run(Mode mode) {
            this.mode = mode;
            this.resultName = mode == Mode.VALUE ? names.fresh("result") : null;
        }

        List<Statement> sequence(List<Statement> statements) {
            List<Statement> out = new ArrayList<Statement>();
            for (int i = 0; i < statements.size(); i++) {
                Statement s = statements.get(i);
                if (!Trees.containsReturn(s)) {
                    out.add(s);
                    continue;
                }
                List<Statement> rest = statements.subList(i + 1, statements.size());
                if (s instanceof ReturnStmt) {
                    out.addAll(terminal((ReturnStmt) s));
                    return out;
                }
                if (s instanceof Block) {
                    out.addAll(sequence(Trees.concat(((Block) s).getStatements(), rest)));
                    return out;
                }
                if (s instanceof IfStmt) {
                    IfStmt ifStmt = (IfStmt) s;
                    Block thenBranch = branch(ifStmt.getThenBranch(), rest);
                    Block elseBranch = branch(ifStmt.getElseBranch(), rest);
                    out.add(new IfStmt(s.getLocation(), ifStmt.getCondition(), thenBranch,
                            elseBranch.getStatements().isEmpty() ? null : elseBranch));
                    return out;
                }
                if (s instanceof WhenStmt) {
                    WhenStmt when = (WhenStmt) s;
                    List<WhenStmt.WhenBranch> branches = new ArrayList<WhenStmt.WhenBranch>();
                    for (WhenStmt.WhenBranch b : when.getBranches()) {
                        branches.add(new WhenStmt.WhenBranch(b.getConditions(), branch(b.getBody(), rest)));
                    }
                    out.add(new WhenStmt(s.getLocation(), when.getSubject(), branches,
                            branch(when.getElseBranch(), rest)));
                    return out;
                }
                if (Trees.isLoop(s)) {
                    if (doneName == null) {
                        doneName = names.fresh("done");
                    }
                    out.add(loop(s));
                    List<Statement> after = sequence(rest);
                    if (!after.isEmpty()) {
                        out.add(new IfStmt(s.getLocation(), Trees.not(Trees.ident(doneName)),
                                Trees.block(after), null));
                    }
                    return out;
                }
                throw new IllegalStateException("Unexpected return inside " + s.getClass().getSimpleName());
            }
            return out;
        }

        /** 分支语句后接续剩余语句 */
        private Block branch(Statement stmt, List<Statement> rest) {
            return Trees.block(sequence(Trees.concat(Trees.flatten(stmt), rest)));
        }

        private List<Statement> terminal(ReturnStmt ret) {
            Expression value = ret.getValue();
            if (mode == Mode.VALUE && value != null) {
                return Collections.singletonList(Trees.assign(resultName, value));
            }
            if (mode == Mode.DISCARD && !Trees.isPure(value)) {
                return Collections.singletonList(Trees.stmt(value));
            }
            return Collections.emptyList();
        }

        // ==================== 循环内的 return ====================

        private Statement loop(Statement loop) {
            if (loop instanceof WhileStmt) {
                WhileStmt w = (WhileStmt) loop;
                return new WhileStmt(w.getLocation(), w.getCondition(), inLoop(w.getBody()));
            }
            if (loop instanceof ForStmt) {
                ForStmt f = (ForStmt) loop;
                return new ForStmt(f.getLocation(), f.getVariable(), f.getVariableType(), f.getIterable(),
                        inLoop(f.getBody()));
            }
            ClassicForStmt f = (ClassicForStmt) loop;
            return new ClassicForStmt(f.getLocation(), f.getInitializer(), f.getCondition(), f.getUpdate(),
                    inLoop(f.getBody()));
        }

        private Statement inLoop(Statement stmt) {
            return Trees.asStatement(transformInLoop(stmt));
        }

        private List<Statement> transformInLoop(Statement s) {
            if (!Trees.containsReturn(s)) {
                return Collections.singletonList(s);
            }
            if (s instanceof ReturnStmt) {
                List<Statement> out = new ArrayList<Statement>(terminal((ReturnStmt) s));
                out.add(Trees.assign(doneName, Literal.ofBoolean(s.getLocation(), true)));
                out.add(Trees.breakStmt());
                return Collections.<Statement>singletonList(Trees.block(out));
            }
            if (s instanceof Block) {
                List<Statement> out = new ArrayList<Statement>();
                for (Statement inner : ((Block) s).getStatements()) {
                    out.addAll(transformInLoop(inner));
                }
                return Collections.<Statement>singletonList(new Block(s.getLocation(), out));
            }
            if (s instanceof IfStmt) {
                IfStmt ifStmt = (IfStmt) s;
                Statement elseBranch = ifStmt.hasElse() ? inLoop(ifStmt.getElseBranch()) : null;
                return Collections.<Statement>singletonList(new IfStmt(s.getLocation(), ifStmt.getCondition(),
                        inLoop(ifStmt.getThenBranch()), elseBranch));
            }
            if (s instanceof WhenStmt) {
                WhenStmt when = (WhenStmt) s;
                List<WhenStmt.WhenBranch> branches = new ArrayList<WhenStmt.WhenBranch>();
                for (WhenStmt.WhenBranch b : when.getBranches()) {
                    branches.add(new WhenStmt.WhenBranch(b.getConditions(), inLoop(b.getBody())));
                }
                Statement elseBranch = when.hasElse() ? inLoop(when.getElseBranch()) : null;
                return Collections.<Statement>singletonList(
                        new WhenStmt(s.getLocation(), when.getSubject(), branches, elseBranch));
            }
            if (Trees.isLoop(s)) {
                List<Statement> out = new ArrayList<Statement>();
                out.add(loop(s));
                out.add(Trees.breakIf(Trees.ident(doneName)));
                return out;
            }
            throw new IllegalStateException("Unexpected return inside " + s.getClass().getSimpleName());
        }
    }
}
