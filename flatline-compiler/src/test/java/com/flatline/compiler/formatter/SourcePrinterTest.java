package com.flatline.compiler.formatter;

import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.decl.Program;
import com.flatline.compiler.ast.expr.BinaryExpr;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.expr.Identifier;
import com.flatline.compiler.ast.expr.Literal;
import com.flatline.compiler.ast.expr.UnaryExpr;
import com.flatline.compiler.lexer.Lexer;
import com.flatline.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SourcePrinter 单元测试
 */
class SourcePrinterTest {

    private final SourcePrinter printer = new SourcePrinter();

    private String printExpr(String source) {
        return printer.print(new Parser(new Lexer(source, "t.fl"), "t.fl").parseExpression());
    }

    private static Identifier id(String name) {
        return new Identifier(SourceLocation.UNKNOWN, name);
    }

    @Nested
    @DisplayName("表达式括号")
    class ParenthesesTests {

        @Test
        @DisplayName("只保留必要的括号")
        void testMinimalParentheses() {
            assertThat(printExpr("(a + b) * c")).isEqualTo("(a + b) * c");
            assertThat(printExpr("a + (b * c)")).isEqualTo("a + b * c");
            assertThat(printExpr("a - (b - c)")).isEqualTo("a - (b - c)");
        }

        @Test
        @DisplayName("替换进来的子树按优先级加括号")
        void testSubstitutedSubtree() {
            Expression sum = new BinaryExpr(SourceLocation.UNKNOWN, id("x"), BinaryExpr.BinaryOp.ADD, id("y"));
            Expression product = new BinaryExpr(SourceLocation.UNKNOWN, sum, BinaryExpr.BinaryOp.MUL,
                    Literal.ofInt(SourceLocation.UNKNOWN, 2));
            assertThat(printer.print(product)).isEqualTo("(x + y) * 2");
        }

        @Test
        @DisplayName("取负的负数字面量不粘连")
        void testNegation() {
            Expression neg = new UnaryExpr(SourceLocation.UNKNOWN, UnaryExpr.UnaryOp.NEG,
                    Literal.ofInt(SourceLocation.UNKNOWN, -3), true);
            assertThat(printer.print(neg)).isEqualTo("-(-3)");
        }

        @Test
        @DisplayName("lambda 实参与三元")
        void testLambdaAndTernary() {
            assertThat(printExpr("xs.where(x -> x > 0 && x < 10)")).isEqualTo("xs.where(x -> x > 0 && x < 10)");
            assertThat(printExpr("c ? (a ? 1 : 2) : 3")).isEqualTo("c ? a ? 1 : 2 : 3");
        }

        @Test
        @DisplayName("字符串转义与浮点")
        void testLiterals() {
            assertThat(printExpr("\"a\\\"b\\n\"")).isEqualTo("\"a\\\"b\\n\"");
            assertThat(printExpr("2.0")).isEqualTo("2.0");
        }
    }

    @Nested
    @DisplayName("程序输出")
    class ProgramTests {

        @Test
        @DisplayName("分支总是输出为块")
        void testBranchesAsBlocks() {
            Program program = Parser.parseSource("fun f(x: Int) {\n"
                    + "    if (x > 0) println(x) else if (x < 0) println(-x) else return\n"
                    + "}\n", "t.fl");
            assertThat(printer.print(program)).isEqualTo("fun f(x: Int) {\n"
                    + "    if (x > 0) {\n"
                    + "        println(x)\n"
                    + "    } else if (x < 0) {\n"
                    + "        println(-x)\n"
                    + "    } else {\n"
                    + "        return\n"
                    + "    }\n"
                    + "}\n");
        }

        @Test
        @DisplayName("输出可以重新解析且结果稳定")
        void testReparseStable() {
            String source = "inline fun <T> count(xs: Array<T>, p: (T) -> Boolean): Int {\n"
                    + "    var n = 0\n"
                    + "    for (x in xs) {\n"
                    + "        if (p(x)) n++\n"
                    + "    }\n"
                    + "    return n\n"
                    + "}\n"
                    + "class Acc {\n"
                    + "    var total: Double = 0.0\n"
                    + "    fun add(v: Double) {\n"
                    + "        total += v\n"
                    + "    }\n"
                    + "}\n"
                    + "fun main() {\n"
                    + "    val xs = arrayOf(1, 2, 3)\n"
                    + "    when (xs.size) {\n"
                    + "        0, 1 -> println(\"few\")\n"
                    + "        else -> println(xs.count(x -> x % 2 == 1))\n"
                    + "    }\n"
                    + "    for (var i = 0; i < xs.size; i++) {\n"
                    + "        xs[i] *= 2\n"
                    + "    }\n"
                    + "}\n";
            String first = printer.print(Parser.parseSource(source, "t.fl"));
            String second = printer.print(Parser.parseSource(first, "t.fl"));
            assertThat(second).isEqualTo(first);
            assertThat(first).contains("inline fun <T> count(xs: Array<T>, p: (T) -> Boolean): Int {");
        }
    }
}
