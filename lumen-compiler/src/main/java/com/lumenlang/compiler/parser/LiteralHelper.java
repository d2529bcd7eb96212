package com.lumenlang.compiler.parser;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.expr.Literal;
import com.lumenlang.compiler.ast.expr.Literal.LiteralKind;
import com.lumenlang.compiler.ast.type.LumenType;
import com.lumenlang.compiler.lexer.Token;

/**
 * 字面量与类型名解析辅助类
 */
class LiteralHelper {

    final Parser parser;

    LiteralHelper(Parser parser) {
        this.parser = parser;
    }

    Literal parseLiteral() {
        SourceLocation loc = parser.location();
        Token token = parser.current;
        LiteralKind kind;
        switch (token.getType()) {
            case INT_LITERAL:    kind = LiteralKind.INT; break;
            case FLOAT_LITERAL:  kind = LiteralKind.FLOAT; break;
            case KW_TRUE:
            case KW_FALSE:       kind = LiteralKind.BOOL; break;
            case CHAR_LITERAL:   kind = LiteralKind.CHAR; break;
            case STRING_LITERAL: kind = LiteralKind.STRING; break;
            default:
                throw parser.error("Expected a literal", "literal");
        }
        parser.advance();
        return new Literal(loc, token.getLiteral(), kind);
    }

    /**
     * 类型名：int float bool char string unit
     */
    LumenType parseType() {
        LumenType type = Grammar.toType(parser.current.getType());
        if (type == null) {
            throw parser.error("Expected a type", "type");
        }
        parser.advance();
        return type;
    }
}
