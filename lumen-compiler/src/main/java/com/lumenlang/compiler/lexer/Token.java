package com.lumenlang.compiler.lexer;

import com.lumenlang.compiler.ast.SourceLocation;

/**
 * 词法单元：类型、原文、解析后的字面量值，以及起点的行列和偏移（行列从 1 开始）
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String lexeme, Object literal, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType() { return type; }
    public String getLexeme() { return lexeme; }
    /** Integer/Double/Character/String/Boolean；ERROR token 为错误消息 */
    public Object getLiteral() { return literal; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getOffset() { return offset; }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /** 覆盖整个原文的源码位置 */
    public SourceLocation toLocation(String fileName) {
        return new SourceLocation(fileName, line, column, offset, lexeme.length());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.name()).append(" '").append(lexeme).append('\'');
        if (literal != null && type != TokenType.IDENTIFIER) {
            sb.append(" = ").append(literal);
        }
        return sb.append(" @").append(line).append(':').append(column).toString();
    }
}
