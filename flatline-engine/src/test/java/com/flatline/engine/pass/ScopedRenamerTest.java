package com.flatline.engine.pass;

import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.stmt.Statement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.flatline.engine.pass.PassFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ScopedRenamer 单元测试
 */
class ScopedRenamerTest {

    private static final String SIBLINGS = "fun f(x: Int): Int {\n"
            + "    var n = 0\n"
            + "    if (x > 0) {\n"
            + "        val t = x * 2\n"
            + "        n += t\n"
            + "    } else {\n"
            + "        val t = x * 3\n"
            + "        n += t\n"
            + "    }\n"
            + "    for (i in arrayOf(1, 2)) n += i\n"
            + "    return n\n"
            + "}\n";

    private static Map<String, String> seeds(String from, String to) {
        Map<String, String> seeds = new HashMap<String, String>();
        seeds.put(from, to);
        return seeds;
    }

    @Test
    @DisplayName("分配器生成的名字单调递增")
    void testAllocator() {
        NameAllocator names = new NameAllocator();
        assertEquals("__t_1", names.fresh("t"));
        assertEquals("__t_2", names.fresh("t"));
        assertEquals(2, names.current());
    }

    @Test
    @DisplayName("分配器跳过保留名")
    void testAllocatorSkipsReserved() {
        NameAllocator names = new NameAllocator();
        names.reserve(Arrays.asList("__t_1", "__t_2", "t"));

        assertEquals("__t_3", names.fresh("t"));
        assertTrue(names.isReserved("__t_2"));
        assertFalse(names.isReserved("__t_3"));
    }

    @Test
    @DisplayName("再次改名生成的名字时不叠加前缀")
    void testRenameGeneratedName() {
        NameAllocator names = new NameAllocator();
        assertEquals("__x_1", names.fresh("____x_3_7"));
        assertEquals("__result_2", names.fresh("__result_6"));

        List<Statement> renamed = ScopedRenamer.rename(
                body("fun f() {\n    val __t_3 = 1\n    val y = __t_3 + 1\n}\n"),
                new NameAllocator(), Collections.<String, String>emptyMap());
        assertThat(print(renamed)).contains("val __t_1 = 1").contains("val __y_2 = __t_1 + 1");
    }

    @Test
    @DisplayName("兄弟作用域中的同名声明得到不同名字，引用跟随最近的声明")
    void testSiblingScopes() {
        List<Statement> renamed = ScopedRenamer.rename(body(SIBLINGS), new NameAllocator(), seeds("x", "arg"));
        String printed = print(renamed);

        assertThat(printed)
                .contains("var __n_1 = 0")
                .contains("val __t_2 = arg * 2")
                .contains("__n_1 += __t_2")
                .contains("val __t_3 = arg * 3")
                .contains("__n_1 += __t_3")
                .contains("for (__i_4 in arrayOf(1, 2))")
                .contains("__n_1 += __i_4")
                .doesNotContain(" t ")
                .doesNotContain("x");
    }

    @ParameterizedTest(name = "x = {0}")
    @ValueSource(ints = {4, -4})
    @DisplayName("改名不改变执行结果")
    void testSemanticsPreserved(int x) {
        List<Statement> renamed = ScopedRenamer.rename(body(SIBLINGS), new NameAllocator(),
                Collections.<String, String>emptyMap());
        assertEquals(original(SIBLINGS).call("f", x), replaced(SIBLINGS, renamed).call("f", x));
    }

    @Test
    @DisplayName("lambda 参数遮蔽外层同名变量")
    void testLambdaShadow() {
        List<Statement> renamed = ScopedRenamer.rename(
                body("fun f() {\n    val v = 1\n    val g = v -> v + 1\n    val h = v * 2\n}\n"),
                new NameAllocator(), Collections.<String, String>emptyMap());
        String printed = print(renamed);

        Matcher lambda = Pattern.compile("(\\w+) -> (\\w+) \\+ 1").matcher(printed);
        assertTrue(lambda.find(), printed);
        assertEquals(lambda.group(1), lambda.group(2));
        assertNotEquals("__v_1", lambda.group(1));
        assertThat(printed).contains("val __v_1 = 1").contains("__v_1 * 2");
    }

    @Test
    @DisplayName("未声明且不在种子表中的名字保持原样")
    void testFreeNames() {
        Expression renamed = ScopedRenamer.rename(expr("total + x + size(ys)"), new NameAllocator(),
                seeds("x", "__x_9"));
        assertEquals("total + __x_9 + size(ys)", print(renamed));
    }

    @Test
    @DisplayName("同一个分配器上两次改名结果互不相交")
    void testRepeatedRename() {
        NameAllocator names = new NameAllocator();
        String first = print(ScopedRenamer.rename(body(SIBLINGS), names, seeds("x", "a")));
        String second = print(ScopedRenamer.rename(body(SIBLINGS), names, seeds("x", "b")));

        assertThat(first).contains("__t_2");
        assertThat(second).doesNotContain("__t_2").contains("__t_6");
    }
}
