package com.flatline.compiler.lexer;

/**
 * 词法单元类型
 */
public enum TokenType {
    // 字面量
    INT_LITERAL,
    DOUBLE_LITERAL,
    STRING_LITERAL,
    IDENTIFIER,

    // 声明
    KW_VAL,
    KW_VAR,
    KW_FUN,
    KW_CLASS,

    // 修饰符
    KW_INLINE,
    KW_PRIVATE,
    KW_PUBLIC,

    // 控制流
    KW_IF,
    KW_ELSE,
    KW_WHEN,
    KW_FOR,
    KW_WHILE,
    KW_RETURN,
    KW_BREAK,
    KW_CONTINUE,
    KW_IN,

    // 常量
    KW_TRUE,
    KW_FALSE,
    KW_NULL,
    KW_THIS,

    // 算术
    PLUS,
    MINUS,
    MUL,
    DIV,
    MOD,
    INC,
    DEC,

    // 赋值
    ASSIGN,
    PLUS_ASSIGN,
    MINUS_ASSIGN,
    MUL_ASSIGN,
    DIV_ASSIGN,
    MOD_ASSIGN,

    // 比较与逻辑
    EQ,
    NE,
    LT,
    GT,
    LE,
    GE,
    AND,
    OR,
    NOT,

    // 符号
    ARROW,
    QUESTION,
    COLON,
    DOT,
    COMMA,
    SEMICOLON,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,

    NEWLINE,
    ERROR,
    EOF;

    public boolean isKeyword() {
        return name().startsWith("KW_");
    }
}
