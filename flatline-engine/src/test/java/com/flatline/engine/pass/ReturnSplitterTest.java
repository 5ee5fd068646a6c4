package com.flatline.engine.pass;

import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.expr.ConditionalExpr;
import com.flatline.compiler.ast.stmt.ReturnStmt;
import com.flatline.compiler.ast.stmt.Statement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static com.flatline.engine.pass.PassFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ReturnSplitter 单元测试
 */
class ReturnSplitterTest {

    /** 前缀加 return 值重新组成主体，执行结果应与原主体一致 */
    private static void assertSameResult(String source, ReturnSplitter.Split split, Object arg) {
        List<Statement> rebuilt = new ArrayList<Statement>(split.getPrefix());
        rebuilt.add(new ReturnStmt(SourceLocation.UNKNOWN, split.getValue()));
        assertEquals(original(source).call("f", arg), replaced(source, rebuilt).call("f", arg));
    }

    @Nested
    @DisplayName("可以拆分")
    class SplitTests {

        @Test
        @DisplayName("前缀语句与末尾 return")
        void testPrefix() {
            ReturnSplitter.Split split = ReturnSplitter.split(body(
                    "fun f(x: Int): Int {\n    val y = x * 2\n    return y + 1\n}\n"));

            assertNotNull(split);
            assertEquals(1, split.getPrefix().size());
            assertEquals("y + 1", print(split.getValue()));
        }

        @ParameterizedTest(name = "x = {0}")
        @ValueSource(ints = {15, 5, -3})
        @DisplayName("if 链拆成嵌套条件表达式")
        void testConditionChain(int x) {
            String source = "fun f(x: Int): Int {\n"
                    + "    val y = x\n"
                    + "    if (y > 10) return 2\n"
                    + "    if (y > 0) return 1\n"
                    + "    return 0\n"
                    + "}\n";
            ReturnSplitter.Split split = ReturnSplitter.split(body(source));

            assertNotNull(split);
            assertThat(split.getValue()).isInstanceOf(ConditionalExpr.class);
            assertEquals(1, split.getPrefix().size());
            assertSameResult(source, split, x);
        }

        @ParameterizedTest(name = "x = {0}")
        @ValueSource(ints = {200, 50, -1})
        @DisplayName("带 else 的 if 与嵌套 if")
        void testNestedIf(int x) {
            String source = "fun f(x: Int): Int {\n"
                    + "    if (x > 0) {\n"
                    + "        if (x > 100) return 3\n"
                    + "        return 2\n"
                    + "    } else {\n"
                    + "        return 1\n"
                    + "    }\n"
                    + "}\n";
            ReturnSplitter.Split split = ReturnSplitter.split(body(source));

            assertNotNull(split);
            assertTrue(split.getPrefix().isEmpty());
            assertSameResult(source, split, x);
        }
    }

    @Nested
    @DisplayName("无法拆分")
    class FailureTests {

        @Test
        @DisplayName("循环中的 return")
        void testLoop() {
            assertNull(ReturnSplitter.split(body("fun f(x: Int): Boolean {\n"
                    + "    for (y in arrayOf(1, 2)) {\n"
                    + "        if (y > x) return true\n"
                    + "    }\n"
                    + "    return false\n"
                    + "}\n")));
        }

        @Test
        @DisplayName("分支内部有非 return 语句")
        void testBranchStatement() {
            assertNull(ReturnSplitter.split(body("fun f(x: Int): Int {\n"
                    + "    if (x > 0) {\n"
                    + "        val z = x * 2\n"
                    + "        return z\n"
                    + "    }\n"
                    + "    return 0\n"
                    + "}\n")));
        }

        @Test
        @DisplayName("if 之后有非 return 语句")
        void testStatementAfterIf() {
            assertNull(ReturnSplitter.split(body("fun f(x: Int): Int {\n"
                    + "    if (x > 0) return 1\n"
                    + "    val z = 2\n"
                    + "    return z\n"
                    + "}\n")));
        }

        @Test
        @DisplayName("没有 return")
        void testNoReturn() {
            assertNull(ReturnSplitter.split(body("fun f(x: Int) {\n    val z = x\n}\n")));
        }

        @Test
        @DisplayName("不带值的 return")
        void testBareReturn() {
            assertNull(ReturnSplitter.split(body("fun f(x: Int) {\n    if (x > 0) return\n    return\n}\n")));
        }
    }
}
