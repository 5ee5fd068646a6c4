package com.flatline.engine.pass;

import com.flatline.compiler.ast.stmt.ReturnStmt;
import com.flatline.compiler.ast.stmt.Statement;
import com.flatline.compiler.ast.type.Types;
import com.flatline.runtime.interpreter.Interpreter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static com.flatline.engine.pass.PassFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * EarlyReturnNormalizer 单元测试
 */
class EarlyReturnNormalizerTest {

    private static final String CLASSIFY = "fun f(x: Int): Int {\n"
            + "    if (x > 10) return 2\n"
            + "    if (x > 0) return 1\n"
            + "    return 0\n"
            + "}\n";

    private static final String FIND = "fun f(lim: Int): Int {\n"
            + "    val xs = arrayOf(3, 8, 12)\n"
            + "    for (x in xs) {\n"
            + "        if (x > lim) return x\n"
            + "    }\n"
            + "    return -1\n"
            + "}\n";

    private static final String PAIR = "fun f(t: Int): Int {\n"
            + "    val xs = arrayOf(1, 2, 3, 4)\n"
            + "    for (a in xs) {\n"
            + "        for (b in xs) {\n"
            + "            if (a + b == t) return a * 10 + b\n"
            + "        }\n"
            + "    }\n"
            + "    return 0\n"
            + "}\n";

    private static final String WHILE = "fun f(n: Int): Int {\n"
            + "    var i = 0\n"
            + "    var acc = 0\n"
            + "    while (i < n) {\n"
            + "        i++\n"
            + "        if (i == 3) return acc\n"
            + "        acc += i\n"
            + "    }\n"
            + "    acc = acc * 100\n"
            + "    return acc\n"
            + "}\n";

    private static final String WHEN = "fun f(x: Int): String {\n"
            + "    when (x) {\n"
            + "        1 -> return \"one\"\n"
            + "        2 -> return \"two\"\n"
            + "    }\n"
            + "    return \"many\"\n"
            + "}\n";

    private static List<Statement> normalize(String source, EarlyReturnNormalizer.Mode mode) {
        return new EarlyReturnNormalizer(new NameAllocator()).normalize(body(source), mode,
                mode == EarlyReturnNormalizer.Mode.VALUE ? Types.INT : null);
    }

    private static void assertSingleExit(List<Statement> statements) {
        assertThat(statements.get(statements.size() - 1)).isInstanceOf(ReturnStmt.class);
        for (Statement s : statements.subList(0, statements.size() - 1)) {
            assertFalse(Trees.containsReturn(s), () -> print(statements));
        }
    }

    private static void assertSameResult(String source, List<Statement> normalized, Object arg) {
        Object expected = original(source).call("f", arg);
        Object actual = replaced(source, normalized).call("f", arg);
        assertEquals(Interpreter.stringify(expected), Interpreter.stringify(actual), print(normalized));
    }

    @Nested
    @DisplayName("单出口判断")
    class SingleExitTests {

        @Test
        @DisplayName("只在末尾 return 的序列是单出口")
        void testTrailingReturn() {
            assertTrue(EarlyReturnNormalizer.isSingleExit(body("fun f(x: Int): Int {\n val y = x + 1\n return y\n}\n")));
        }

        @Test
        @DisplayName("没有 return 的序列是单出口")
        void testNoReturn() {
            assertTrue(EarlyReturnNormalizer.isSingleExit(body("fun f(x: Int) {\n val y = x + 1\n}\n")));
        }

        @Test
        @DisplayName("条件中的 return 不是单出口")
        void testEarlyReturn() {
            assertFalse(EarlyReturnNormalizer.isSingleExit(body(CLASSIFY)));
        }

        @Test
        @DisplayName("单出口序列在 VALUE 模式下原样返回")
        void testUnchanged() {
            List<Statement> statements = body("fun f(x: Int): Int {\n val y = x + 1\n return y\n}\n");
            assertSame(statements, new EarlyReturnNormalizer(new NameAllocator())
                    .normalize(statements, EarlyReturnNormalizer.Mode.VALUE, Types.INT));
        }
    }

    @Nested
    @DisplayName("VALUE 模式")
    class ValueModeTests {

        @ParameterizedTest(name = "x = {0}")
        @ValueSource(ints = {15, 5, -3})
        @DisplayName("条件链中的多个 return")
        void testConditionChain(int x) {
            List<Statement> normalized = normalize(CLASSIFY, EarlyReturnNormalizer.Mode.VALUE);
            assertSingleExit(normalized);
            assertSameResult(CLASSIFY, normalized, x);
        }

        @ParameterizedTest(name = "lim = {0}")
        @ValueSource(ints = {0, 5, 100})
        @DisplayName("循环内的 return 改为完成标志与 break")
        void testLoop(int lim) {
            List<Statement> normalized = normalize(FIND, EarlyReturnNormalizer.Mode.VALUE);
            assertSingleExit(normalized);
            assertThat(print(normalized)).contains("__done_").contains("break");
            assertSameResult(FIND, normalized, lim);
        }

        @ParameterizedTest(name = "t = {0}")
        @ValueSource(ints = {5, 8, 100})
        @DisplayName("嵌套循环逐层退出")
        void testNestedLoops(int t) {
            List<Statement> normalized = normalize(PAIR, EarlyReturnNormalizer.Mode.VALUE);
            assertSingleExit(normalized);
            assertSameResult(PAIR, normalized, t);
        }

        @ParameterizedTest(name = "n = {0}")
        @ValueSource(ints = {2, 5})
        @DisplayName("循环之后的语句只在未提前返回时执行")
        void testStatementsAfterLoop(int n) {
            List<Statement> normalized = normalize(WHILE, EarlyReturnNormalizer.Mode.VALUE);
            assertSingleExit(normalized);
            assertSameResult(WHILE, normalized, n);
        }

        @ParameterizedTest(name = "x = {0}")
        @ValueSource(ints = {1, 2, 3})
        @DisplayName("when 分支中的 return")
        void testWhen(int x) {
            List<Statement> normalized = new EarlyReturnNormalizer(new NameAllocator())
                    .normalize(body(WHEN), EarlyReturnNormalizer.Mode.VALUE, Types.STRING);
            assertSingleExit(normalized);
            assertSameResult(WHEN, normalized, x);
        }
    }

    @Nested
    @DisplayName("VOID 与 DISCARD 模式")
    class StatementModeTests {

        private static final String VOID = "var total: Int = 0\n"
                + "fun f(n: Int) {\n"
                + "    var i = 0\n"
                + "    while (i < n) {\n"
                + "        i++\n"
                + "        if (i % 2 == 0) continue\n"
                + "        if (i > 5) return\n"
                + "        total += i\n"
                + "    }\n"
                + "    total = total * 10\n"
                + "}\n";

        @ParameterizedTest(name = "n = {0}")
        @ValueSource(ints = {4, 10})
        @DisplayName("VOID 模式去掉所有 return")
        void testVoid(int n) {
            List<Statement> normalized = normalize(VOID, EarlyReturnNormalizer.Mode.VOID);
            assertFalse(Trees.containsReturn(normalized), print(normalized));

            Interpreter expected = original(VOID);
            expected.call("f", n);
            Interpreter actual = replaced(VOID, normalized);
            actual.call("f", n);
            assertEquals(expected.getGlobal("total"), actual.getGlobal("total"));
        }

        @Test
        @DisplayName("DISCARD 模式保留有副作用的返回值表达式")
        void testDiscard() {
            String source = "fun g(): Int = 7\n"
                    + "fun f(x: Int): Int {\n"
                    + "    if (x > 0) return g()\n"
                    + "    return 0\n"
                    + "}\n";
            List<Statement> normalized = normalize(source, EarlyReturnNormalizer.Mode.DISCARD);

            String printed = print(normalized);
            assertFalse(Trees.containsReturn(normalized), printed);
            assertThat(printed).contains("g()").doesNotContain("__result_");
        }

        @Test
        @DisplayName("单出口序列的末尾 return 在 VOID 模式下被去掉")
        void testTrailingReturnDropped() {
            List<Statement> normalized = normalize("fun f(x: Int): Int {\n val y = x + 1\n return y\n}\n",
                    EarlyReturnNormalizer.Mode.VOID);
            assertEquals(1, normalized.size());
        }
    }
}
