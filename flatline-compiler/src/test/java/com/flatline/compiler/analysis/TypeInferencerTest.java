package com.flatline.compiler.analysis;

import com.flatline.compiler.ast.decl.FunDecl;
import com.flatline.compiler.ast.decl.Program;
import com.flatline.compiler.ast.expr.CallExpr;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.expr.MemberExpr;
import com.flatline.compiler.ast.stmt.ForStmt;
import com.flatline.compiler.ast.type.TypeRef;
import com.flatline.compiler.ast.type.Types;
import com.flatline.compiler.lexer.Lexer;
import com.flatline.compiler.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TypeInferencer 单元测试
 */
class TypeInferencerTest {

    private static final String LIBRARY = ""
            + "inline fun <T, R> select(xs: Array<T>, f: (T) -> R): Array<R> {\n"
            + "    val out = Array<R>(xs.size)\n"
            + "    return out\n"
            + "}\n"
            + "inline fun <T> where(xs: Array<T>, p: (T) -> Boolean): Array<T> = xs\n"
            + "inline fun <T> first(xs: Array<T>): T = xs[0]\n"
            + "inline fun sum(xs: Array<Int>): Int = 0\n"
            + "inline fun sum(xs: Array<Double>): Double = 0.0\n"
            + "inline fun <T> pick(a: T, b: Int): T = a\n"
            + "inline fun <T> pick(a: Int, b: T): T = b\n"
            + "class Point {\n"
            + "    var x: Int = 0\n"
            + "    val label = \"p\"\n"
            + "    fun norm(): Double = 1.0\n"
            + "}\n";

    private TypeInferencer inferencer;
    private Scope scope;

    @BeforeEach
    void setUp() {
        Program library = Parser.parseSource(LIBRARY, "lib.fl");
        inferencer = new TypeInferencer(ProgramIndex.of(library));
        scope = inferencer.getIndex().globalScope(inferencer).child(Scope.ScopeType.FUNCTION);
        scope.defineLocal("ints", Types.arrayOf(Types.INT), false);
        scope.defineLocal("p", Types.named("Point"), true);
    }

    private Expression expr(String source) {
        return new Parser(new Lexer(source, "t.fl"), "t.fl").parseExpression();
    }

    private String typeOf(String source) {
        TypeRef type = inferencer.typeOf(expr(source), scope);
        return type == null ? null : type.toSourceString();
    }

    @Nested
    @DisplayName("表达式类型")
    class ExpressionTypeTests {

        @Test
        @DisplayName("数值提升与字符串拼接")
        void testBinary() {
            assertThat(typeOf("1 + 2")).isEqualTo("Int");
            assertThat(typeOf("1 + 2.0")).isEqualTo("Double");
            assertThat(typeOf("\"a\" + 1")).isEqualTo("String");
            assertThat(typeOf("1 < 2 && true")).isEqualTo("Boolean");
        }

        @Test
        @DisplayName("成员、索引与内置调用")
        void testMembers() {
            assertThat(typeOf("ints.size")).isEqualTo("Int");
            assertThat(typeOf("ints[0]")).isEqualTo("Int");
            assertThat(typeOf("p.x")).isEqualTo("Int");
            assertThat(typeOf("p.label")).isEqualTo("String");
            assertThat(typeOf("p.norm()")).isEqualTo("Double");
            assertThat(typeOf("arrayOf(1, 2)")).isEqualTo("Array<Int>");
            assertThat(typeOf("Array<String>(3)")).isEqualTo("Array<String>");
            assertThat(typeOf("Point()")).isEqualTo("Point");
        }

        @Test
        @DisplayName("未知标识符返回 null")
        void testUnknown() {
            assertThat(typeOf("missing + 1")).isNull();
        }
    }

    @Nested
    @DisplayName("泛型调用")
    class GenericCallTests {

        @Test
        @DisplayName("从 lambda 主体推断返回类型参数")
        void testInferFromLambda() {
            assertThat(typeOf("ints.select(x -> x * 1.5)")).isEqualTo("Array<Double>");
            assertThat(typeOf("ints.select(x -> \"#\" + x).first()")).isEqualTo("String");
        }

        @Test
        @DisplayName("链式扩展调用")
        void testChain() {
            assertThat(typeOf("ints.where(x -> x > 1).select(x -> x > 2)")).isEqualTo("Array<Boolean>");
        }

        @Test
        @DisplayName("按实参类型选择重载")
        void testOverloadByArgumentType() {
            assertThat(typeOf("ints.sum()")).isEqualTo("Int");
            assertThat(typeOf("arrayOf(1.0).sum()")).isEqualTo("Double");
        }

        @Test
        @DisplayName("lambda 参数个数不符时不匹配")
        void testLambdaArityMismatch() {
            CallExpr call = (CallExpr) expr("ints.where((a, b) -> true)");
            CallBinding binding = inferencer.selectOverload(inferencer.getIndex().getFunctions("where"),
                    ((MemberExpr) call.getCallee()).getTarget(), call.getArgs(), call.getTypeArgs(), scope);
            assertThat(binding).isNull();
        }

        @Test
        @DisplayName("同等具体的候选标记为歧义")
        void testAmbiguous() {
            CallExpr call = (CallExpr) expr("pick(1, 2)");
            CallBinding binding = inferencer.selectOverload(inferencer.getIndex().getFunctions("pick"),
                    null, call.getArgs(), call.getTypeArgs(), scope);
            assertThat(binding).isNotNull();
            assertThat(binding.isAmbiguous()).isTrue();
        }

        @Test
        @DisplayName("显式类型实参")
        void testExplicitTypeArgs() {
            CallExpr call = (CallExpr) expr("first<Int>(ints)");
            CallBinding binding = inferencer.selectOverload(inferencer.getIndex().getFunctions("first"),
                    null, call.getArgs(), call.getTypeArgs(), scope);
            assertThat(binding.isFullyBound()).isTrue();
            assertThat(binding.getTypeBindings().get("T").toSourceString()).isEqualTo("Int");
        }
    }

    @Nested
    @DisplayName("语句与声明")
    class StatementTests {

        @Test
        @DisplayName("表达式主体函数的返回类型")
        void testExpressionBodyReturnType() {
            Program program = Parser.parseSource("fun twice(x: Int) = x * 2\nfun loop() = loop()\n", "t.fl");
            TypeInferencer local = new TypeInferencer(ProgramIndex.of(program));
            assertThat(local.returnTypeOf(program.findFunction("twice")).toSourceString()).isEqualTo("Int");
            assertThat(local.returnTypeOf(program.findFunction("loop"))).isNull();
        }

        @Test
        @DisplayName("块中第一个带值 return 的类型")
        void testReturnTypeIn() {
            Program program = Parser.parseSource("fun f(xs: Array<Int>) {\n"
                    + "    val d = 2.5\n"
                    + "    for (x in xs) {\n"
                    + "        if (x > 0) return d\n"
                    + "    }\n"
                    + "    return 0\n"
                    + "}\n", "t.fl");
            FunDecl fn = program.findFunction("f");
            TypeInferencer local = new TypeInferencer(ProgramIndex.of(program));
            Scope fnScope = local.getIndex().functionScope(fn, new Scope(Scope.ScopeType.GLOBAL, null));
            TypeRef type = local.returnTypeIn(fn.getBody().getStatements(), fnScope.child(Scope.ScopeType.BLOCK));
            assertThat(type.toSourceString()).isEqualTo("Double");
        }

        @Test
        @DisplayName("for-in 循环变量取数组元素类型")
        void testLoopVariable() {
            Program program = Parser.parseSource("fun f(xs: Array<String>) {\n"
                    + "    for (s in xs) println(s)\n"
                    + "}\n", "t.fl");
            FunDecl fn = program.findFunction("f");
            TypeInferencer local = new TypeInferencer(ProgramIndex.of(program));
            Scope fnScope = local.getIndex().functionScope(fn, new Scope(Scope.ScopeType.GLOBAL, null));
            ForStmt loop = (ForStmt) fn.getBody().getStatements().get(0);
            assertThat(local.loopVariableType(loop, fnScope).toSourceString()).isEqualTo("String");
        }
    }
}
