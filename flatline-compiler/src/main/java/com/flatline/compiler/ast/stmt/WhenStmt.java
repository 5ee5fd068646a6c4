package com.flatline.compiler.ast.stmt;

import com.flatline.compiler.ast.AstVisitor;
import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * when 语句（多分支选择，分支之间不贯穿）
 *
 * <p>有主体时分支条件与主体比较相等；无主体时分支条件为布尔表达式。</p>
 */
public class WhenStmt extends Statement {
    private final Expression subject;  // 可能为 null
    private final List<WhenBranch> branches;
    private final Statement elseBranch;  // 可能为 null

    public WhenStmt(SourceLocation location, Expression subject, List<WhenBranch> branches, Statement elseBranch) {
        super(location);
        this.subject = subject;
        this.branches = Collections.unmodifiableList(new ArrayList<WhenBranch>(branches));
        this.elseBranch = elseBranch;
    }

    public Expression getSubject() {
        return subject;
    }

    public List<WhenBranch> getBranches() {
        return branches;
    }

    public Statement getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhenStmt(this, context);
    }

    /**
     * when 分支
     */
    public static class WhenBranch {
        private final List<Expression> conditions;
        private final Statement body;

        public WhenBranch(List<Expression> conditions, Statement body) {
            this.conditions = Collections.unmodifiableList(new ArrayList<Expression>(conditions));
            this.body = body;
        }

        public List<Expression> getConditions() {
            return conditions;
        }

        public Statement getBody() {
            return body;
        }
    }
}
