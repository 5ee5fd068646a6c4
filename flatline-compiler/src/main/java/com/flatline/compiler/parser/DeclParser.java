package com.flatline.compiler.parser;

import com.flatline.compiler.ast.Modifier;
import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.decl.ClassDecl;
import com.flatline.compiler.ast.decl.Declaration;
import com.flatline.compiler.ast.decl.FunDecl;
import com.flatline.compiler.ast.decl.Parameter;
import com.flatline.compiler.ast.decl.PropertyDecl;
import com.flatline.compiler.ast.expr.Expression;
import com.flatline.compiler.ast.stmt.Block;
import com.flatline.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.flatline.compiler.lexer.TokenType.*;

/**
 * 声明解析辅助类
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    Declaration parseDeclaration() {
        SourceLocation loc = parser.location();
        Set<Modifier> modifiers = parseModifiers();

        if (parser.check(KW_FUN)) {
            return parseFunDecl(loc, modifiers);
        }
        if (parser.check(KW_CLASS)) {
            return parseClassDecl(loc, modifiers);
        }
        if (parser.checkAny(KW_VAL, KW_VAR)) {
            return parsePropertyDecl(loc, modifiers);
        }
        throw new ParseException("Expected declaration", parser.current, "fun, class, val or var");
    }

    private Set<Modifier> parseModifiers() {
        Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
        while (true) {
            if (parser.match(KW_INLINE)) {
                modifiers.add(Modifier.INLINE);
            } else if (parser.match(KW_PRIVATE)) {
                modifiers.add(Modifier.PRIVATE);
            } else if (parser.match(KW_PUBLIC)) {
                modifiers.add(Modifier.PUBLIC);
            } else {
                break;
            }
            parser.skipNewlines();
        }
        return modifiers;
    }

    FunDecl parseFunDecl(SourceLocation loc, Set<Modifier> modifiers) {
        parser.expect(KW_FUN, "Expected 'fun'");
        List<String> typeParams = parser.typeParser.parseTypeParams();
        String name = parser.expect(IDENTIFIER, "Expected function name").getLexeme();

        parser.expect(LPAREN, "Expected '(' after function name");
        List<Parameter> params = new ArrayList<Parameter>();
        if (!parser.check(RPAREN)) {
            do {
                SourceLocation paramLoc = parser.location();
                String paramName = parser.expect(IDENTIFIER, "Expected parameter name").getLexeme();
                parser.expect(COLON, "Expected ':' after parameter name");
                TypeRef paramType = parser.parseType();
                params.add(new Parameter(paramLoc, paramName, paramType));
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expected ')' after parameters");

        TypeRef returnType = null;
        if (parser.match(COLON)) {
            returnType = parser.parseType();
        }

        Block body = null;
        Expression expressionBody = null;
        if (parser.check(LBRACE)) {
            body = parser.stmtParser.parseBlock();
        } else if (parser.match(ASSIGN)) {
            parser.skipNewlines();
            expressionBody = parser.parseExpressionInternal();
        }
        return new FunDecl(loc, modifiers, name, typeParams, params, returnType, body, expressionBody);
    }

    private ClassDecl parseClassDecl(SourceLocation loc, Set<Modifier> modifiers) {
        parser.expect(KW_CLASS, "Expected 'class'");
        String name = parser.expect(IDENTIFIER, "Expected class name").getLexeme();
        parser.skipNewlines();
        parser.expect(LBRACE, "Expected '{' after class name");

        List<Declaration> members = new ArrayList<Declaration>();
        parser.skipSeparators();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            Declaration member = parseDeclaration();
            if (member instanceof ClassDecl) {
                throw new ParseException("Nested classes are not supported", parser.previous);
            }
            members.add(member);
            parser.expectStatementEnd();
            parser.skipSeparators();
        }
        parser.expect(RBRACE, "Expected '}' after class body");
        return new ClassDecl(loc, modifiers, name, members);
    }

    PropertyDecl parsePropertyDecl(SourceLocation loc, Set<Modifier> modifiers) {
        boolean mutable = parser.match(KW_VAR);
        if (!mutable) {
            parser.expect(KW_VAL, "Expected 'val' or 'var'");
        }
        String name = parser.expect(IDENTIFIER, "Expected variable name").getLexeme();

        TypeRef type = null;
        if (parser.match(COLON)) {
            type = parser.parseType();
        }

        Expression initializer = null;
        if (parser.match(ASSIGN)) {
            parser.skipNewlines();
            initializer = parser.parseExpressionInternal();
        }
        if (type == null && initializer == null) {
            throw new ParseException("Variable '" + name + "' needs a type or an initializer", parser.previous);
        }
        return new PropertyDecl(loc, modifiers, name, mutable, type, initializer);
    }
}
