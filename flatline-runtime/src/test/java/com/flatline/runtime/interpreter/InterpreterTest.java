package com.flatline.runtime.interpreter;

import com.flatline.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 解释器单元测试
 */
class InterpreterTest {

    private static Interpreter load(String source) {
        return new Interpreter(Parser.parseSource(source, "test.fl"));
    }

    private static String output(String source, String entry) {
        Interpreter interpreter = load(source);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        interpreter.setOut(new PrintStream(buffer, true));
        interpreter.call(entry);
        return new String(buffer.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    // ============ 运算 ============

    @Nested
    @DisplayName("运算")
    class OperatorTests {

        @Test
        @DisplayName("整数与浮点混合运算提升为 Double")
        void testNumericPromotion() {
            Interpreter interpreter = load("fun f(): Double = 1 + 2.5 * 2");
            assertEquals(6.0, interpreter.call("f"));
        }

        @Test
        @DisplayName("整数除法截断")
        void testIntDivision() {
            assertEquals(3, load("fun f(): Int = 7 / 2").call("f"));
            assertEquals(1, load("fun f(): Int = 7 % 3").call("f"));
        }

        @Test
        @DisplayName("字符串拼接")
        void testStringConcat() {
            assertEquals("n=3", load("fun f(): String = \"n=\" + 3").call("f"));
        }

        @Test
        @DisplayName("&& 短路不求值右侧")
        void testShortCircuit() {
            String source = "var hits: Int = 0\n"
                    + "fun touch(): Boolean {\n"
                    + "    hits = hits + 1\n"
                    + "    return true\n"
                    + "}\n"
                    + "fun f(): Boolean = false && touch()\n";
            Interpreter interpreter = load(source);
            assertEquals(false, interpreter.call("f"));
            assertEquals(0, interpreter.getGlobal("hits"));
        }

        @Test
        @DisplayName("复合赋值与自增")
        void testCompoundAssign() {
            String source = "fun f(): Int {\n"
                    + "    var x = 5\n"
                    + "    x += 3\n"
                    + "    x *= 2\n"
                    + "    val old = x++\n"
                    + "    return old * 100 + x\n"
                    + "}\n";
            assertEquals(1617, load(source).call("f"));
        }

        @Test
        @DisplayName("整数除零报错")
        void testDivisionByZero() {
            Interpreter interpreter = load("fun f(x: Int): Int = 10 / x");
            FlatlineRuntimeException e = assertThrows(FlatlineRuntimeException.class,
                    () -> interpreter.call("f", 0));
            assertTrue(e.getRawMessage().contains("Division by zero"));
        }
    }

    // ============ 控制流 ============

    @Nested
    @DisplayName("控制流")
    class ControlFlowTests {

        @Test
        @DisplayName("if / else if 链")
        void testIfChain() {
            String source = "fun sign(x: Int): Int {\n"
                    + "    if (x < 0) {\n"
                    + "        return -1\n"
                    + "    } else if (x == 0) {\n"
                    + "        return 0\n"
                    + "    }\n"
                    + "    return 1\n"
                    + "}\n";
            Interpreter interpreter = load(source);
            assertEquals(-1, interpreter.call("sign", -5));
            assertEquals(0, interpreter.call("sign", 0));
            assertEquals(1, interpreter.call("sign", 9));
        }

        @Test
        @DisplayName("带主语的 when")
        void testWhenWithSubject() {
            String source = "fun name(x: Int): String {\n"
                    + "    var r = \"many\"\n"
                    + "    when (x) {\n"
                    + "        0 -> r = \"zero\"\n"
                    + "        1, 2 -> r = \"few\"\n"
                    + "        else -> r = \"many\"\n"
                    + "    }\n"
                    + "    return r\n"
                    + "}\n";
            Interpreter interpreter = load(source);
            assertEquals("zero", interpreter.call("name", 0));
            assertEquals("few", interpreter.call("name", 2));
            assertEquals("many", interpreter.call("name", 7));
        }

        @Test
        @DisplayName("while 中的 break 与 continue")
        void testWhileBreakContinue() {
            String source = "fun f(): Int {\n"
                    + "    var i = 0\n"
                    + "    var sum = 0\n"
                    + "    while (true) {\n"
                    + "        i++\n"
                    + "        if (i > 10) break\n"
                    + "        if (i % 2 == 0) continue\n"
                    + "        sum += i\n"
                    + "    }\n"
                    + "    return sum\n"
                    + "}\n";
            assertEquals(25, load(source).call("f"));
        }

        @Test
        @DisplayName("经典 for 循环")
        void testClassicFor() {
            String source = "fun f(): Int {\n"
                    + "    var total = 0\n"
                    + "    for (var i = 0; i < 4; i++) {\n"
                    + "        total += i\n"
                    + "    }\n"
                    + "    return total\n"
                    + "}\n";
            assertEquals(6, load(source).call("f"));
        }

        @Test
        @DisplayName("for-in 遍历数组")
        void testForIn() {
            String source = "fun main() {\n"
                    + "    for (x in arrayOf(1, 2, 3)) {\n"
                    + "        print(x)\n"
                    + "    }\n"
                    + "}\n";
            assertEquals("123", output(source, "main"));
        }

        @Test
        @DisplayName("循环内 return 直接返回函数")
        void testReturnInsideLoop() {
            String source = "fun find(xs: Array<Int>, v: Int): Int {\n"
                    + "    for (var i = 0; i < xs.size; i++) {\n"
                    + "        if (xs[i] == v) return i\n"
                    + "    }\n"
                    + "    return -1\n"
                    + "}\n"
                    + "fun f(): Int = find(arrayOf(4, 5, 6), 6)\n";
            assertEquals(2, load(source).call("f"));
        }
    }

    // ============ 函数与 lambda ============

    @Nested
    @DisplayName("函数与 lambda")
    class FunctionTests {

        @Test
        @DisplayName("扩展调用回退到顶层函数")
        void testExtensionCall() {
            String source = "fun twice(x: Int): Int = x * 2\n"
                    + "fun f(): Int = 21.twice()\n";
            assertEquals(42, load(source).call("f"));
        }

        @Test
        @DisplayName("lambda 捕获外层可变变量")
        void testLambdaCapture() {
            String source = "fun each(xs: Array<Int>, action: (Int) -> Unit) {\n"
                    + "    for (x in xs) action(x)\n"
                    + "}\n"
                    + "fun f(): Int {\n"
                    + "    var total = 0\n"
                    + "    arrayOf(1, 2, 3).each(x -> { total += x })\n"
                    + "    return total\n"
                    + "}\n";
            assertEquals(6, load(source).call("f"));
        }

        @Test
        @DisplayName("块 lambda 的 return 只返回 lambda")
        void testBlockLambdaReturn() {
            String source = "fun apply(x: Int, g: (Int) -> Int): Int = g(x)\n"
                    + "fun f(): Int {\n"
                    + "    val r = apply(3, n -> {\n"
                    + "        if (n > 2) return n * 10\n"
                    + "        return n\n"
                    + "    })\n"
                    + "    return r + 1\n"
                    + "}\n";
            assertEquals(31, load(source).call("f"));
        }

        @Test
        @DisplayName("按运行时类型选择重载")
        void testOverloadByValue() {
            String source = "fun describe(x: Int): String = \"int\"\n"
                    + "fun describe(x: String): String = \"string\"\n"
                    + "fun f(): String = describe(\"a\") + describe(1)\n";
            assertEquals("stringint", load(source).call("f"));
        }

        @Test
        @DisplayName("调用未定义函数报错")
        void testUndefinedFunction() {
            assertThrows(FlatlineRuntimeException.class, () -> load("fun f(): Int = 1").call("missing"));
        }
    }

    // ============ 类与数组 ============

    @Nested
    @DisplayName("类与数组")
    class ClassTests {

        @Test
        @DisplayName("字段初始化与方法访问 this")
        void testClassFieldsAndMethods() {
            String source = "class Counter {\n"
                    + "    var count: Int = 10\n"
                    + "    fun bump(by: Int): Int {\n"
                    + "        count += by\n"
                    + "        return this.count\n"
                    + "    }\n"
                    + "}\n"
                    + "fun f(): Int {\n"
                    + "    val c = Counter()\n"
                    + "    c.bump(5)\n"
                    + "    return c.bump(1)\n"
                    + "}\n";
            assertEquals(16, load(source).call("f"));
        }

        @Test
        @DisplayName("Array<T>(n) 以元素类型默认值填充")
        void testSizedArray() {
            String source = "fun main() {\n"
                    + "    val xs = Array<Int>(3)\n"
                    + "    xs[1] = 7\n"
                    + "    println(xs)\n"
                    + "    println(xs.size)\n"
                    + "}\n";
            assertEquals("[0, 7, 0]\n3\n", output(source, "main"));
        }

        @Test
        @DisplayName("数组越界报错")
        void testIndexOutOfBounds() {
            Interpreter interpreter = load("fun f(): Int = arrayOf(1)[3]");
            assertThrows(FlatlineRuntimeException.class, () -> interpreter.call("f"));
        }

        @Test
        @DisplayName("字符串 length 与 toString")
        void testStringMembers() {
            assertEquals(5, load("fun f(): Int = \"hello\".length").call("f"));
            assertEquals("12", load("fun f(): String = 12.toString()").call("f"));
        }
    }
}
