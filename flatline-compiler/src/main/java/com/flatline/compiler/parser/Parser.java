package com.flatline.compiler.parser;

import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.decl.Declaration;
import com.flatline.compiler.ast.decl.Program;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.stmt.Statement;
import com.flatline.compiler.ast.type.TypeRef;
import com.flatline.compiler.lexer.Lexer;
import com.flatline.compiler.lexer.Token;
import com.flatline.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.flatline.compiler.lexer.TokenType.*;

/**
 * Flatline 语法分析器（递归下降）
 */
@SuppressWarnings("this-escape")
public class Parser {

    final String fileName;
    private final List<Token> tokens;
    private int position;
    Token current;
    Token previous;

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer, String fileName) {
        this.fileName = fileName;
        this.tokens = lexer.scanTokens();
        this.position = 0;
        this.current = tokens.get(0);
        checkLexerErrors();
    }

    /**
     * 解析源码文本
     */
    public static Program parseSource(String source, String fileName) {
        return new Parser(new Lexer(source, fileName), fileName).parse();
    }

    private void checkLexerErrors() {
        for (Token token : tokens) {
            if (token.getType() == ERROR) {
                throw new ParseException(String.valueOf(token.getLiteral()), token);
            }
        }
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        if (position < tokens.size() - 1) {
            position++;
        }
        current = tokens.get(position);
        return previous;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        return tokens.get(Math.min(position + 1, tokens.size() - 1));
    }

    /**
     * 标记当前位置，用于回溯
     */
    int mark() {
        return position;
    }

    /**
     * 回溯到标记的位置
     */
    void reset(int mark) {
        position = mark;
        current = tokens.get(position);
        previous = position > 0 ? tokens.get(position - 1) : null;
    }

    boolean check(TokenType type) {
        return current.getType() == type;
    }

    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    boolean matchAny(TokenType... types) {
        for (TokenType type : types) {
            if (match(type)) return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    /**
     * 解析成员名：标识符或关键字
     */
    String expectMemberName() {
        if (check(IDENTIFIER) || current.getType().isKeyword()) {
            return advance().getLexeme();
        }
        throw new ParseException("Expected member name", current, "IDENTIFIER");
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return new SourceLocation(fileName, current.getLine(), current.getColumn(),
                current.getOffset(), current.getLexeme().length());
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return new SourceLocation(fileName, previous.getLine(), previous.getColumn(),
                previous.getOffset(), previous.getLexeme().length());
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    void skipNewlines() {
        while (match(NEWLINE)) {
            // 跳过
        }
    }

    void skipSeparators() {
        while (matchAny(NEWLINE, SEMICOLON)) {
            // 跳过换行符和分号
        }
    }

    /**
     * 语句结束：换行、分号、右花括号或文件末尾
     */
    void expectStatementEnd() {
        if (checkAny(NEWLINE, SEMICOLON, RBRACE, EOF)) {
            return;
        }
        throw new ParseException("Expected newline or ';' after statement", current);
    }

    // ============ 程序解析 ============

    /**
     * 解析整个编译单元
     */
    public Program parse() {
        SourceLocation loc = location();
        List<Declaration> declarations = new ArrayList<Declaration>();
        skipSeparators();
        while (!isAtEnd()) {
            declarations.add(declParser.parseDeclaration());
            expectStatementEnd();
            skipSeparators();
        }
        return new Program(loc, fileName, declarations);
    }

    /**
     * 解析单个表达式（测试与工具使用）
     */
    public Expression parseExpression() {
        skipNewlines();
        Expression expr = exprParser.parseExpression();
        skipSeparators();
        if (!isAtEnd()) {
            throw new ParseException("Unexpected token after expression", current);
        }
        return expr;
    }

    Statement parseStatement() {
        return stmtParser.parseStatement();
    }

    Expression parseExpressionInternal() {
        return exprParser.parseExpression();
    }

    TypeRef parseType() {
        return typeParser.parseType();
    }
}
