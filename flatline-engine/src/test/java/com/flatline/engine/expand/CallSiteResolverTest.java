package com.flatline.engine.expand;

import com.flatline.compiler.analysis.ProgramIndex;
import com.flatline.compiler.analysis.Scope;
import com.flatline.compiler.analysis.TypeInferencer;
import com.flatline.compiler.ast.expr.CallExpr;
import com.flatline.compiler.ast.type.Types;
import com.flatline.compiler.lexer.Lexer;
import com.flatline.compiler.parser.Parser;
import com.flatline.engine.ExpansionFixtures;
import com.flatline.engine.template.TemplateLibrary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CallSiteResolver 单元测试
 */
class CallSiteResolverTest {

    private static final String UNIT = ""
            + "inline fun <T> pick(a: T, b: Int): T = a\n"
            + "inline fun <T> pick(a: Int, b: T): T = b\n"
            + "class Bag {\n"
            + "    fun where(p: (Int) -> Boolean): Bag = this\n"
            + "}\n";

    private CallSiteResolver resolver;
    private Scope scope;

    @BeforeEach
    void setUp() {
        TemplateLibrary library = ExpansionFixtures.library().extendWith(Parser.parseSource(UNIT, "main.fl"));
        TypeInferencer inferencer = new TypeInferencer(new ProgramIndex(library.getPrograms()));
        resolver = new CallSiteResolver(library, inferencer);
        scope = inferencer.getIndex().globalScope(inferencer).child(Scope.ScopeType.FUNCTION);
        scope.defineLocal("ints", Types.arrayOf(Types.INT), false);
        scope.defineLocal("doubles", Types.arrayOf(Types.DOUBLE), false);
        scope.defineLocal("bag", Types.named("Bag"), false);
        scope.defineLocal("n", Types.INT, false);
    }

    private CallSite resolve(String source) {
        return resolver.resolve((CallExpr) new Parser(new Lexer(source, "t.fl"), "t.fl").parseExpression(), scope);
    }

    @Test
    @DisplayName("扩展调用形式：接收者作为第一个实参")
    void testExtensionCall() {
        CallSite site = resolve("ints.where(x -> x > 1)");

        assertNotNull(site);
        assertEquals("where", site.getTemplate().getName());
        assertEquals(1, site.getArgs().size());
        assertTrue(site.isBehavior(0));
        assertEquals(Types.INT, site.getBinding().getTypeBindings().get("T"));
    }

    @Test
    @DisplayName("普通调用形式：第一个实参是接收者")
    void testPlainCall() {
        CallSite site = resolve("count(ints, x -> x > 1)");

        assertNotNull(site);
        assertEquals("count", site.getTemplate().getName());
        assertEquals(1, site.getArgs().size());
    }

    @Test
    @DisplayName("按接收者类型选择重载")
    void testOverload() {
        CallSite ints = resolve("ints.sum()");
        CallSite doubles = resolve("doubles.sum()");

        assertNotSame(ints.getTemplate(), doubles.getTemplate());
        assertEquals(Types.DOUBLE, doubles.getTemplate().getDeclaration().getReturnType());
    }

    @Test
    @DisplayName("接收者类型自己有同名方法时不是模板调用")
    void testMethodWins() {
        assertNull(resolve("bag.where(x -> x > 1)"));
    }

    @Test
    @DisplayName("局部变量遮蔽模板名")
    void testShadowedByLocal() {
        scope.defineLocal("twice", Types.INT, false);
        assertNull(resolve("twice(n)"));
    }

    @Test
    @DisplayName("未知函数与无实参调用不是模板调用")
    void testNotTemplate() {
        assertNull(resolve("println(n)"));
        assertNull(resolve("ints.missing()"));
    }

    @Test
    @DisplayName("歧义重载标记为 ambiguous")
    void testAmbiguous() {
        CallSite site = resolve("pick(1, 2)");

        assertNotNull(site);
        assertTrue(site.isAmbiguous());
    }
}
