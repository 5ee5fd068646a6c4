package com.flatline.compiler.parser;

import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.expr.*;
import com.flatline.compiler.ast.stmt.Block;
import com.flatline.compiler.ast.type.TypeRef;
import com.flatline.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.flatline.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 */
class ExprParser {

    final Parser parser;

    /** when 分支条件中 {@code a -> ...} 的箭头属于分支，不能解析为 lambda */
    private boolean noLambda;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseAssignExpr();
    }

    /**
     * 解析 when 分支条件
     */
    Expression parseBranchCondition() {
        boolean saved = noLambda;
        noLambda = true;
        try {
            return parseExpression();
        } finally {
            noLambda = saved;
        }
    }

    // 赋值表达式（最低优先级，右结合）
    private Expression parseAssignExpr() {
        Expression left = parseTernaryExpr();

        if (parser.checkAny(ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, MUL_ASSIGN, DIV_ASSIGN, MOD_ASSIGN)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            if (!(left instanceof Identifier || left instanceof MemberExpr || left instanceof IndexExpr)) {
                throw new ParseException("Invalid assignment target", op);
            }
            parser.skipNewlines();
            Expression right = parseAssignExpr();  // 右结合

            AssignExpr.AssignOp assignOp;
            switch (op.getType()) {
                case ASSIGN: assignOp = AssignExpr.AssignOp.ASSIGN; break;
                case PLUS_ASSIGN: assignOp = AssignExpr.AssignOp.ADD_ASSIGN; break;
                case MINUS_ASSIGN: assignOp = AssignExpr.AssignOp.SUB_ASSIGN; break;
                case MUL_ASSIGN: assignOp = AssignExpr.AssignOp.MUL_ASSIGN; break;
                case DIV_ASSIGN: assignOp = AssignExpr.AssignOp.DIV_ASSIGN; break;
                case MOD_ASSIGN: assignOp = AssignExpr.AssignOp.MOD_ASSIGN; break;
                default: throw new ParseException("Unexpected assignment operator", op);
            }
            return new AssignExpr(loc, left, assignOp, right);
        }

        return left;
    }

    // 三元表达式 condition ? thenExpr : elseExpr（右结合）
    private Expression parseTernaryExpr() {
        Expression condition = parseDisjunctionExpr();

        if (parser.match(QUESTION)) {
            SourceLocation loc = parser.previousLocation();
            parser.skipNewlines();
            Expression thenExpr = parseTernaryExpr();
            parser.skipNewlines();
            parser.expect(COLON, "Expected ':' in ternary expression");
            parser.skipNewlines();
            Expression elseExpr = parseTernaryExpr();
            return new ConditionalExpr(loc, condition, thenExpr, elseExpr);
        }

        return condition;
    }

    // 逻辑或 ||
    private Expression parseDisjunctionExpr() {
        Expression left = parseConjunctionExpr();

        while (parser.match(OR)) {
            SourceLocation loc = parser.previousLocation();
            parser.skipNewlines();
            Expression right = parseConjunctionExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.OR, right);
        }

        return left;
    }

    // 逻辑与 &&
    private Expression parseConjunctionExpr() {
        Expression left = parseEqualityExpr();

        while (parser.match(AND)) {
            SourceLocation loc = parser.previousLocation();
            parser.skipNewlines();
            Expression right = parseEqualityExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.AND, right);
        }

        return left;
    }

    // 相等性 == !=
    private Expression parseEqualityExpr() {
        Expression left = parseComparisonExpr();

        while (parser.checkAny(EQ, NE)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            parser.skipNewlines();
            Expression right = parseComparisonExpr();
            left = new BinaryExpr(loc, left,
                    op.is(EQ) ? BinaryExpr.BinaryOp.EQ : BinaryExpr.BinaryOp.NE, right);
        }

        return left;
    }

    // 比较 < > <= >=
    private Expression parseComparisonExpr() {
        Expression left = parseAdditiveExpr();

        while (parser.checkAny(LT, GT, LE, GE)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            parser.skipNewlines();
            Expression right = parseAdditiveExpr();
            BinaryExpr.BinaryOp binOp;
            switch (op.getType()) {
                case LT: binOp = BinaryExpr.BinaryOp.LT; break;
                case GT: binOp = BinaryExpr.BinaryOp.GT; break;
                case LE: binOp = BinaryExpr.BinaryOp.LE; break;
                default: binOp = BinaryExpr.BinaryOp.GE; break;
            }
            left = new BinaryExpr(loc, left, binOp, right);
        }

        return left;
    }

    // 加减 + -
    private Expression parseAdditiveExpr() {
        Expression left = parseMultiplicativeExpr();

        while (parser.checkAny(PLUS, MINUS)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            parser.skipNewlines();
            Expression right = parseMultiplicativeExpr();
            left = new BinaryExpr(loc, left,
                    op.is(PLUS) ? BinaryExpr.BinaryOp.ADD : BinaryExpr.BinaryOp.SUB, right);
        }

        return left;
    }

    // 乘除取模 * / %
    private Expression parseMultiplicativeExpr() {
        Expression left = parsePrefixExpr();

        while (parser.checkAny(MUL, DIV, MOD)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            parser.skipNewlines();
            Expression right = parsePrefixExpr();
            BinaryExpr.BinaryOp binOp;
            switch (op.getType()) {
                case MUL: binOp = BinaryExpr.BinaryOp.MUL; break;
                case DIV: binOp = BinaryExpr.BinaryOp.DIV; break;
                default: binOp = BinaryExpr.BinaryOp.MOD; break;
            }
            left = new BinaryExpr(loc, left, binOp, right);
        }

        return left;
    }

    // 前缀 ! - ++ --
    private Expression parsePrefixExpr() {
        SourceLocation loc = parser.location();
        if (parser.match(NOT)) {
            return new UnaryExpr(loc, UnaryExpr.UnaryOp.NOT, parsePrefixExpr(), true);
        }
        if (parser.match(MINUS)) {
            Expression operand = parsePrefixExpr();
            // 负数字面量直接折叠
            if (operand instanceof Literal && ((Literal) operand).getKind() == Literal.LiteralKind.INT) {
                return Literal.ofInt(loc, -((Integer) ((Literal) operand).getValue()));
            }
            if (operand instanceof Literal && ((Literal) operand).getKind() == Literal.LiteralKind.DOUBLE) {
                return new Literal(loc, -((Double) ((Literal) operand).getValue()), Literal.LiteralKind.DOUBLE);
            }
            return new UnaryExpr(loc, UnaryExpr.UnaryOp.NEG, operand, true);
        }
        if (parser.match(INC)) {
            return new UnaryExpr(loc, UnaryExpr.UnaryOp.INC, parsePrefixExpr(), true);
        }
        if (parser.match(DEC)) {
            return new UnaryExpr(loc, UnaryExpr.UnaryOp.DEC, parsePrefixExpr(), true);
        }
        return parsePostfixExpr();
    }

    // 后缀：调用、成员、索引、++ --
    private Expression parsePostfixExpr() {
        Expression expr = parsePrimaryExpr();

        while (true) {
            SourceLocation loc = parser.location();
            if (parser.check(LPAREN)) {
                expr = new CallExpr(loc, expr, null, parseCallArgs());
            } else if (parser.check(LT) && (expr instanceof Identifier || expr instanceof MemberExpr)) {
                List<TypeRef> typeArgs = parser.typeParser.tryParseCallTypeArgs();
                if (typeArgs == null) {
                    break;
                }
                expr = new CallExpr(loc, expr, typeArgs, parseCallArgs());
            } else if (parser.match(DOT)) {
                expr = new MemberExpr(loc, expr, parser.expectMemberName());
            } else if (parser.match(LBRACKET)) {
                Expression index = parseExpression();
                parser.expect(RBRACKET, "Expected ']' after index");
                expr = new IndexExpr(loc, expr, index);
            } else if (parser.match(INC)) {
                expr = new UnaryExpr(loc, UnaryExpr.UnaryOp.INC, expr, false);
            } else if (parser.match(DEC)) {
                expr = new UnaryExpr(loc, UnaryExpr.UnaryOp.DEC, expr, false);
            } else if (parser.check(NEWLINE) && continuesOnNextLine()) {
                parser.skipNewlines();
            } else {
                break;
            }
        }

        return expr;
    }

    /**
     * 下一行以 '.' 开头时视为链式调用的延续
     */
    private boolean continuesOnNextLine() {
        int mark = parser.mark();
        parser.skipNewlines();
        boolean dot = parser.check(DOT);
        parser.reset(mark);
        return dot;
    }

    private List<Expression> parseCallArgs() {
        parser.expect(LPAREN, "Expected '('");
        boolean saved = noLambda;
        noLambda = false;
        List<Expression> args = new ArrayList<Expression>();
        try {
            if (!parser.check(RPAREN)) {
                do {
                    args.add(parseExpression());
                } while (parser.match(COMMA));
            }
        } finally {
            noLambda = saved;
        }
        parser.expect(RPAREN, "Expected ')' after arguments");
        return args;
    }

    private Expression parsePrimaryExpr() {
        SourceLocation loc = parser.location();
        Token token = parser.current;

        switch (token.getType()) {
            case INT_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.INT);
            case DOUBLE_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.DOUBLE);
            case STRING_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.STRING);
            case KW_TRUE:
                parser.advance();
                return Literal.ofBoolean(loc, true);
            case KW_FALSE:
                parser.advance();
                return Literal.ofBoolean(loc, false);
            case KW_NULL:
                parser.advance();
                return Literal.ofNull(loc);
            case KW_THIS:
                parser.advance();
                return new ThisExpr(loc);
            case IDENTIFIER:
                if (!noLambda && parser.peek().is(ARROW)) {
                    String name = parser.advance().getLexeme();
                    List<LambdaExpr.LambdaParam> params = new ArrayList<LambdaExpr.LambdaParam>();
                    params.add(new LambdaExpr.LambdaParam(name, null));
                    return parseLambdaBody(loc, params);
                }
                parser.advance();
                return new Identifier(loc, token.getLexeme());
            case LPAREN: {
                LambdaExpr lambda = noLambda ? null : tryParseParenLambda(loc);
                if (lambda != null) {
                    return lambda;
                }
                parser.advance();
                boolean saved = noLambda;
                noLambda = false;
                try {
                    Expression inner = parseExpression();
                    parser.expect(RPAREN, "Expected ')'");
                    return inner;
                } finally {
                    noLambda = saved;
                }
            }
            default:
                throw new ParseException("Expected expression", token);
        }
    }

    /**
     * 尝试解析 {@code (a, b: Int) -> body}，参数表后不是箭头时回溯并返回 null
     */
    private LambdaExpr tryParseParenLambda(SourceLocation loc) {
        int mark = parser.mark();
        parser.advance(); // (
        List<LambdaExpr.LambdaParam> params = new ArrayList<LambdaExpr.LambdaParam>();
        if (!parser.check(RPAREN)) {
            do {
                if (!parser.check(IDENTIFIER)) {
                    parser.reset(mark);
                    return null;
                }
                String name = parser.advance().getLexeme();
                TypeRef type = null;
                if (parser.match(COLON)) {
                    try {
                        type = parser.parseType();
                    } catch (ParseException e) {
                        // 不是参数类型，按括号表达式处理
                        parser.reset(mark);
                        return null;
                    }
                }
                params.add(new LambdaExpr.LambdaParam(name, type));
            } while (parser.match(COMMA));
        }
        if (!parser.match(RPAREN) || !parser.check(ARROW)) {
            parser.reset(mark);
            return null;
        }
        return parseLambdaBody(loc, params);
    }

    private LambdaExpr parseLambdaBody(SourceLocation loc, List<LambdaExpr.LambdaParam> params) {
        parser.expect(ARROW, "Expected '->' in lambda");
        parser.skipNewlines();
        if (parser.check(LBRACE)) {
            Block body = parser.stmtParser.parseBlock();
            return new LambdaExpr(loc, params, body);
        }
        boolean saved = noLambda;
        noLambda = false;
        try {
            return new LambdaExpr(loc, params, parseExpression());
        } finally {
            noLambda = saved;
        }
    }
}
