package com.flatline.compiler.parser;

import com.flatline.compiler.ast.SourceLocation;
import com.flatline.compiler.ast.type.FunctionType;
import com.flatline.compiler.ast.type.GenericType;
import com.flatline.compiler.ast.type.SimpleType;
import com.flatline.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.List;

import static com.flatline.compiler.lexer.TokenType.*;

/**
 * 类型解析辅助类
 */
class TypeParser {

    final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    TypeRef parseType() {
        SourceLocation loc = parser.location();

        // 函数类型 (A, B) -> R
        if (parser.match(LPAREN)) {
            List<TypeRef> params = new ArrayList<TypeRef>();
            if (!parser.check(RPAREN)) {
                do {
                    params.add(parseType());
                } while (parser.match(COMMA));
            }
            parser.expect(RPAREN, "Expected ')' in function type");
            parser.expect(ARROW, "Expected '->' in function type");
            TypeRef returnType = parseType();
            return new FunctionType(loc, params, returnType);
        }

        String name = parser.expect(IDENTIFIER, "Expected type name").getLexeme();
        if (parser.match(LT)) {
            List<TypeRef> args = parseTypeList();
            parser.expect(GT, "Expected '>' after type arguments");
            return new GenericType(loc, name, args);
        }
        return new SimpleType(loc, name);
    }

    private List<TypeRef> parseTypeList() {
        List<TypeRef> types = new ArrayList<TypeRef>();
        do {
            types.add(parseType());
        } while (parser.match(COMMA));
        return types;
    }

    /**
     * 尝试解析调用处的显式类型实参 {@code f<Int>(...)}。
     * 只有紧跟 '(' 时才算成功，否则回溯并返回 null（此时 '<' 是比较运算符）。
     */
    List<TypeRef> tryParseCallTypeArgs() {
        if (!parser.check(LT)) {
            return null;
        }
        int mark = parser.mark();
        try {
            parser.advance();
            List<TypeRef> args = parseTypeList();
            if (parser.match(GT) && parser.check(LPAREN)) {
                return args;
            }
        } catch (ParseException e) {
            // 不是类型实参，回溯为比较运算
            parser.reset(mark);
            return null;
        }
        parser.reset(mark);
        return null;
    }

    /**
     * 解析声明上的类型参数列表 {@code <T, R>}
     */
    List<String> parseTypeParams() {
        List<String> names = new ArrayList<String>();
        if (parser.match(LT)) {
            do {
                names.add(parser.expect(IDENTIFIER, "Expected type parameter name").getLexeme());
            } while (parser.match(COMMA));
            parser.expect(GT, "Expected '>' after type parameters");
        }
        return names;
    }
}
