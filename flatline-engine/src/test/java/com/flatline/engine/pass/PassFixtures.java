package com.flatline.engine.pass;

import com.flatline.compiler.ast.decl.Declaration;
import com.flatline.compiler.ast.decl.FunDecl;
import com.flatline.compiler.ast.decl.Program;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.stmt.Block;
import com.flatline.compiler.ast.stmt.Statement;
import com.flatline.compiler.formatter.SourcePrinter;
import com.flatline.compiler.lexer.Lexer;
import com.flatline.compiler.parser.Parser;
import com.flatline.runtime.interpreter.Interpreter;

import java.util.ArrayList;
import java.util.List;

/**
 * pass 测试共用：解析片段、替换函数主体后执行
 */
final class PassFixtures {

    private PassFixtures() {
    }

    static Expression expr(String source) {
        return new Parser(new Lexer(source, "t.fl"), "t.fl").parseExpression();
    }

    static Program program(String source) {
        return Parser.parseSource(source, "t.fl");
    }

    /** 源码中名为 f 的函数主体 */
    static List<Statement> body(String source) {
        return program(source).findFunction("f").getBody().getStatements();
    }

    static String print(List<Statement> statements) {
        return new SourcePrinter().printStatements(statements);
    }

    static String print(Expression expr) {
        return new SourcePrinter().print(expr);
    }

    /** 执行原始源码中的 f */
    static Interpreter original(String source) {
        return new Interpreter(program(source));
    }

    /** 把 f 的主体替换为给定语句后得到的解释器 */
    static Interpreter replaced(String source, List<Statement> newBody) {
        Program program = program(source);
        List<Declaration> decls = new ArrayList<Declaration>();
        for (Declaration decl : program.getDeclarations()) {
            if (decl instanceof FunDecl && decl.getName().equals("f")) {
                FunDecl fn = (FunDecl) decl;
                decls.add(fn.withBody(new Block(fn.getBody().getLocation(), newBody)));
            } else {
                decls.add(decl);
            }
        }
        return new Interpreter(new Program(program.getLocation(), program.getFileName(), decls));
    }
}
