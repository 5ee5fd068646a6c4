package com.flatline.compiler.parser;

import com.flatline.compiler.ast.Modifier;
import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.stmt.*;
import com.flatline.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static com.flatline.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Statement parseStatement() {
        SourceLocation loc = parser.location();
        switch (parser.current.getType()) {
            case LBRACE:
                return parseBlock();
            case KW_IF:
                return parseIfStmt();
            case KW_WHEN:
                return parseWhenStmt();
            case KW_WHILE:
                return parseWhileStmt();
            case KW_FOR:
                return parseForStmt();
            case KW_RETURN: {
                parser.advance();
                Expression value = null;
                if (!parser.checkAny(NEWLINE, SEMICOLON, RBRACE, EOF)) {
                    value = parser.parseExpressionInternal();
                }
                return new ReturnStmt(loc, value);
            }
            case KW_BREAK:
                parser.advance();
                return new BreakStmt(loc);
            case KW_CONTINUE:
                parser.advance();
                return new ContinueStmt(loc);
            case KW_VAL:
            case KW_VAR:
                return new DeclarationStmt(loc,
                        parser.declParser.parsePropertyDecl(loc, EnumSet.noneOf(Modifier.class)));
            default:
                return new ExpressionStmt(loc, parser.parseExpressionInternal());
        }
    }

    Block parseBlock() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{'");
        List<Statement> statements = new ArrayList<Statement>();
        parser.skipSeparators();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            statements.add(parseStatement());
            parser.expectStatementEnd();
            parser.skipSeparators();
        }
        parser.expect(RBRACE, "Expected '}'");
        return new Block(loc, statements);
    }

    private IfStmt parseIfStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IF, "Expected 'if'");
        parser.expect(LPAREN, "Expected '(' after 'if'");
        Expression condition = parser.parseExpressionInternal();
        parser.expect(RPAREN, "Expected ')' after if condition");
        parser.skipNewlines();
        Statement thenBranch = parseStatement();

        Statement elseBranch = null;
        int mark = parser.mark();
        parser.skipSeparators();
        if (parser.match(KW_ELSE)) {
            parser.skipNewlines();
            elseBranch = parseStatement();
        } else {
            parser.reset(mark);
        }
        return new IfStmt(loc, condition, thenBranch, elseBranch);
    }

    private WhenStmt parseWhenStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_WHEN, "Expected 'when'");
        Expression subject = null;
        if (parser.match(LPAREN)) {
            subject = parser.parseExpressionInternal();
            parser.expect(RPAREN, "Expected ')' after when subject");
        }
        parser.skipNewlines();
        parser.expect(LBRACE, "Expected '{' after when");

        List<WhenStmt.WhenBranch> branches = new ArrayList<WhenStmt.WhenBranch>();
        Statement elseBranch = null;
        parser.skipSeparators();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            if (parser.match(KW_ELSE)) {
                if (elseBranch != null) {
                    throw new ParseException("Duplicate else branch in when", parser.previous);
                }
                parser.expect(ARROW, "Expected '->' after else");
                parser.skipNewlines();
                elseBranch = parseStatement();
            } else {
                List<Expression> conditions = new ArrayList<Expression>();
                do {
                    parser.skipNewlines();
                    conditions.add(parser.exprParser.parseBranchCondition());
                } while (parser.match(COMMA));
                parser.expect(ARROW, "Expected '->' after when condition");
                parser.skipNewlines();
                branches.add(new WhenStmt.WhenBranch(conditions, parseStatement()));
            }
            parser.expectStatementEnd();
            parser.skipSeparators();
        }
        parser.expect(RBRACE, "Expected '}' after when branches");
        return new WhenStmt(loc, subject, branches, elseBranch);
    }

    private WhileStmt parseWhileStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_WHILE, "Expected 'while'");
        parser.expect(LPAREN, "Expected '(' after 'while'");
        Expression condition = parser.parseExpressionInternal();
        parser.expect(RPAREN, "Expected ')' after while condition");
        parser.skipNewlines();
        return new WhileStmt(loc, condition, parseStatement());
    }

    private Statement parseForStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FOR, "Expected 'for'");
        parser.expect(LPAREN, "Expected '(' after 'for'");

        // for (x in xs) / for (x: T in xs)
        if (parser.check(IDENTIFIER) && (parser.peek().is(KW_IN) || parser.peek().is(COLON))) {
            String variable = parser.advance().getLexeme();
            TypeRef variableType = null;
            if (parser.match(COLON)) {
                variableType = parser.parseType();
            }
            parser.expect(KW_IN, "Expected 'in' in for loop");
            Expression iterable = parser.parseExpressionInternal();
            parser.expect(RPAREN, "Expected ')' after for header");
            parser.skipNewlines();
            return new ForStmt(loc, variable, variableType, iterable, parseStatement());
        }

        // for (init; condition; update)
        Statement initializer = null;
        if (!parser.check(SEMICOLON)) {
            SourceLocation initLoc = parser.location();
            if (parser.checkAny(KW_VAL, KW_VAR)) {
                initializer = new DeclarationStmt(initLoc,
                        parser.declParser.parsePropertyDecl(initLoc, EnumSet.noneOf(Modifier.class)));
            } else {
                initializer = new ExpressionStmt(initLoc, parser.parseExpressionInternal());
            }
        }
        parser.expect(SEMICOLON, "Expected ';' after for initializer");
        Expression condition = parser.check(SEMICOLON) ? null : parser.parseExpressionInternal();
        parser.expect(SEMICOLON, "Expected ';' after for condition");
        Expression update = parser.check(RPAREN) ? null : parser.parseExpressionInternal();
        parser.expect(RPAREN, "Expected ')' after for header");
        parser.skipNewlines();
        return new ClassicForStmt(loc, initializer, condition, update, parseStatement());
    }
}
