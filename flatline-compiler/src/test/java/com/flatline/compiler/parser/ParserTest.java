package com.flatline.compiler.parser;

import com.flatline.compiler.ast.Modifier;
import com.flatline.compiler.ast.decl.ClassDecl;
import com.flatline.compiler.ast.decl.FunDecl;
import com.flatline.compiler.ast.decl.Program;
import com.flatline.compiler.ast.decl.PropertyDecl;
import com.flatline.compiler.ast.expr.*;
import com.flatline.compiler.ast.stmt.*;
import com.flatline.compiler.ast.type.FunctionType;
import com.flatline.compiler.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Program parse(String source) {
        return Parser.parseSource(source, "test.fl");
    }

    private Expression expr(String source) {
        return new Parser(new Lexer(source, "test.fl"), "test.fl").parseExpression();
    }

    private FunDecl onlyFunction(String source) {
        Program program = parse(source);
        assertEquals(1, program.getDeclarations().size());
        return (FunDecl) program.getDeclarations().get(0);
    }

    @Nested
    @DisplayName("声明")
    class DeclarationTests {

        @Test
        @DisplayName("inline 泛型函数")
        void testInlineGenericFunction() {
            FunDecl fn = onlyFunction(
                    "inline fun <T, R> select(xs: Array<T>, f: (T) -> R): Array<R> {\n"
                    + "    return Array<R>(xs.size)\n"
                    + "}\n");
            assertTrue(fn.isInline());
            assertTrue(fn.hasModifier(Modifier.INLINE));
            assertEquals("select", fn.getName());
            assertEquals(2, fn.getTypeParams().size());
            assertTrue(fn.getParams().get(1).getType() instanceof FunctionType);
            assertEquals("Array<R>", fn.getReturnType().toSourceString());
        }

        @Test
        @DisplayName("表达式主体函数")
        void testExpressionBody() {
            FunDecl fn = onlyFunction("fun twice(x: Int): Int = x * 2");
            assertNull(fn.getBody());
            assertTrue(fn.getExpressionBody() instanceof BinaryExpr);
        }

        @Test
        @DisplayName("类的字段与方法")
        void testClass() {
            Program program = parse("class Box {\n"
                    + "    var value: Int = 0\n"
                    + "    fun get(): Int = value\n"
                    + "}\n");
            ClassDecl cls = program.findClass("Box");
            assertNotNull(cls);
            assertEquals(1, cls.getFields().size());
            assertNotNull(cls.findMethod("get"));
        }

        @Test
        @DisplayName("无类型无初始值的属性报错")
        void testPropertyNeedsTypeOrInitializer() {
            assertThrows(ParseException.class, () -> parse("val x"));
        }

        @Test
        @DisplayName("顶层语句报错")
        void testTopLevelStatementRejected() {
            assertThrows(ParseException.class, () -> parse("println(1)"));
        }

        @Test
        @DisplayName("嵌套类报错")
        void testNestedClassRejected() {
            assertThrows(ParseException.class, () -> parse("class A {\n class B {}\n}"));
        }
    }

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("下一行的 else 属于前一个 if")
        void testElseOnNextLine() {
            FunDecl fn = onlyFunction("fun f(x: Int) {\n"
                    + "    if (x > 0) {\n"
                    + "        println(x)\n"
                    + "    }\n"
                    + "    else {\n"
                    + "        println(0)\n"
                    + "    }\n"
                    + "}\n");
            assertEquals(1, fn.getBody().getStatements().size());
            assertTrue(((IfStmt) fn.getBody().getStatements().get(0)).hasElse());
        }

        @Test
        @DisplayName("when 分支条件中的箭头不解析为 lambda")
        void testWhenBranches() {
            FunDecl fn = onlyFunction("fun f(x: Int) {\n"
                    + "    when {\n"
                    + "        x > 1 -> println(1)\n"
                    + "        x -> println(2)\n"
                    + "        else -> println(3)\n"
                    + "    }\n"
                    + "}\n");
            WhenStmt when = (WhenStmt) fn.getBody().getStatements().get(0);
            assertNull(when.getSubject());
            assertEquals(2, when.getBranches().size());
            assertTrue(when.getBranches().get(1).getConditions().get(0) instanceof Identifier);
            assertTrue(when.hasElse());
        }

        @Test
        @DisplayName("for-in 与经典 for")
        void testForLoops() {
            FunDecl fn = onlyFunction("fun f(xs: Array<Int>) {\n"
                    + "    for (x: Int in xs) println(x)\n"
                    + "    for (var i = 0; i < 3; i++) println(i)\n"
                    + "}\n");
            ForStmt forIn = (ForStmt) fn.getBody().getStatements().get(0);
            assertEquals("x", forIn.getVariable());
            assertEquals("Int", forIn.getVariableType().toSourceString());
            ClassicForStmt classic = (ClassicForStmt) fn.getBody().getStatements().get(1);
            assertTrue(classic.getInitializer() instanceof DeclarationStmt);
            assertTrue(classic.getUpdate() instanceof UnaryExpr);
        }

        @Test
        @DisplayName("裸 return")
        void testBareReturn() {
            FunDecl fn = onlyFunction("fun f() {\n    return\n}\n");
            assertNull(((ReturnStmt) fn.getBody().getStatements().get(0)).getValue());
        }

        @Test
        @DisplayName("局部 val 声明")
        void testLocalDeclaration() {
            FunDecl fn = onlyFunction("fun f() {\n    val s: String = \"a\"\n}\n");
            PropertyDecl decl = ((DeclarationStmt) fn.getBody().getStatements().get(0)).getDeclaration();
            assertFalse(decl.isMutable());
            assertEquals("String", decl.getType().toSourceString());
        }
    }

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testPrecedence() {
            BinaryExpr add = (BinaryExpr) expr("1 + 2 * 3");
            assertEquals(BinaryExpr.BinaryOp.ADD, add.getOperator());
            assertTrue(add.getRight() instanceof BinaryExpr);
        }

        @Test
        @DisplayName("负数字面量折叠")
        void testNegativeLiteral() {
            Literal literal = (Literal) expr("-5");
            assertEquals(-5, literal.getValue());
        }

        @Test
        @DisplayName("单参数 lambda 与带类型参数的 lambda")
        void testLambdas() {
            CallExpr call = (CallExpr) expr("xs.where(x -> x > 1).select((a: Int, b: Int) -> a + b)");
            LambdaExpr typed = (LambdaExpr) call.getArgs().get(0);
            assertEquals(2, typed.getParams().size());
            assertEquals("Int", typed.getParams().get(0).getType().toSourceString());

            MemberExpr select = (MemberExpr) call.getCallee();
            CallExpr where = (CallExpr) select.getTarget();
            LambdaExpr untyped = (LambdaExpr) where.getArgs().get(0);
            assertNull(untyped.getParams().get(0).getType());
            assertFalse(untyped.isBlockBody());
        }

        @Test
        @DisplayName("括号表达式不被误认为 lambda")
        void testParenthesizedExpression() {
            assertTrue(expr("(a + b) * c") instanceof BinaryExpr);
        }

        @Test
        @DisplayName("显式类型实参调用与比较运算区分")
        void testExplicitTypeArgs() {
            CallExpr call = (CallExpr) expr("Array<Int>(3)");
            assertEquals(1, call.getTypeArgs().size());
            assertTrue(expr("a < b") instanceof BinaryExpr);
        }

        @Test
        @DisplayName("下一行以点开头的链式调用")
        void testChainOnNextLine() {
            FunDecl fn = onlyFunction("fun f(xs: Array<Int>) {\n"
                    + "    xs\n"
                    + "        .where(x -> x > 0)\n"
                    + "        .forEach(x -> println(x))\n"
                    + "}\n");
            assertEquals(1, fn.getBody().getStatements().size());
        }

        @Test
        @DisplayName("三元与赋值")
        void testTernaryAndAssign() {
            AssignExpr assign = (AssignExpr) expr("x = a > b ? a : b");
            assertTrue(assign.getValue() instanceof ConditionalExpr);
        }
    }
}
