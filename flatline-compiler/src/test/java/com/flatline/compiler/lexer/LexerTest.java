package com.flatline.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回所有 token（含 EOF） */
    private List<Token> scan(String source) {
        return new Lexer(source, "<test>").scanTokens();
    }

    /** 返回非 EOF 的 token 类型 */
    private List<TokenType> types(String source) {
        return scan(source).stream()
                .map(Token::getType)
                .filter(t -> t != TokenType.EOF)
                .collect(Collectors.toList());
    }

    private void assertSingleToken(String source, TokenType expectedType, Object expectedLiteral) {
        List<Token> toks = scan(source);
        assertEquals(2, toks.size(), "Expected single token from: " + source);
        assertEquals(expectedType, toks.get(0).getType());
        assertEquals(expectedLiteral, toks.get(0).getLiteral());
    }

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        @Test
        @DisplayName("整数与浮点")
        void testNumbers() {
            assertSingleToken("42", TokenType.INT_LITERAL, 42);
            assertSingleToken("3.25", TokenType.DOUBLE_LITERAL, 3.25);
        }

        @Test
        @DisplayName("整数后的点是成员访问")
        void testIntFollowedByMember() {
            assertEquals(Arrays.asList(TokenType.INT_LITERAL, TokenType.DOT, TokenType.IDENTIFIER), types("1.foo"));
        }

        @Test
        @DisplayName("字符串转义")
        void testStringEscapes() {
            assertSingleToken("\"a\\n\\\"b\\\"\"", TokenType.STRING_LITERAL, "a\n\"b\"");
        }

        @Test
        @DisplayName("未闭合字符串产生 ERROR token")
        void testUnterminatedString() {
            List<Token> toks = scan("\"abc");
            assertEquals(TokenType.ERROR, toks.get(0).getType());
            assertTrue(String.valueOf(toks.get(0).getLiteral()).contains("Unterminated string"));
        }
    }

    @Nested
    @DisplayName("运算符与关键词")
    class OperatorTests {

        @Test
        @DisplayName("复合运算符最长匹配")
        void testCompoundOperators() {
            assertEquals(Arrays.asList(TokenType.INC, TokenType.PLUS_ASSIGN, TokenType.ARROW,
                    TokenType.DEC, TokenType.AND, TokenType.OR, TokenType.NE, TokenType.LE),
                    types("++ += -> -- && || != <="));
        }

        @Test
        @DisplayName("inline fun 为关键词")
        void testKeywords() {
            assertEquals(Arrays.asList(TokenType.KW_INLINE, TokenType.KW_FUN, TokenType.IDENTIFIER),
                    types("inline fun select"));
        }

        @Test
        @DisplayName("单个 & 报错")
        void testSingleAmpersand() {
            assertEquals(TokenType.ERROR, scan("a & b").get(1).getType());
        }
    }

    @Nested
    @DisplayName("换行与注释")
    class NewlineTests {

        @Test
        @DisplayName("圆括号内的换行被抑制")
        void testNewlineInsideParens() {
            assertEquals(Arrays.asList(TokenType.IDENTIFIER, TokenType.LPAREN, TokenType.INT_LITERAL,
                    TokenType.COMMA, TokenType.INT_LITERAL, TokenType.RPAREN),
                    types("f(1,\n 2)"));
        }

        @Test
        @DisplayName("括号内的花括号恢复换行")
        void testNewlineInsideLambdaBlock() {
            List<TokenType> result = types("f(x -> {\na\n})");
            assertTrue(result.contains(TokenType.NEWLINE));
        }

        @Test
        @DisplayName("注释被跳过，行号继续递增")
        void testComments() {
            List<Token> toks = scan("// line\n/* block\n comment */ x");
            Token x = toks.stream().filter(t -> t.getType() == TokenType.IDENTIFIER).findFirst().get();
            assertEquals(3, x.getLine());
        }
    }
}
