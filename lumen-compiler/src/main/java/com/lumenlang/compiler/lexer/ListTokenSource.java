package com.lumenlang.compiler.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于预先扫描好的 token 列表的 token 流。列表末尾没有 EOF 时自动补一个。
 */
public final class ListTokenSource implements TokenSource {
    private final List<Token> tokens;
    private int index;

    public ListTokenSource(List<Token> tokens) {
        List<Token> copy = new ArrayList<Token>(tokens);
        if (copy.isEmpty() || !copy.get(copy.size() - 1).is(TokenType.EOF)) {
            Token last = copy.isEmpty() ? null : copy.get(copy.size() - 1);
            int line = last != null ? last.getLine() : 1;
            int column = last != null ? last.getColumn() + last.getLexeme().length() : 1;
            int offset = last != null ? last.getOffset() + last.getLexeme().length() : 0;
            copy.add(new Token(TokenType.EOF, "", null, line, column, offset));
        }
        this.tokens = copy;
    }

    @Override
    public Token nextToken() {
        Token token = tokens.get(index);
        if (index < tokens.size() - 1) {
            index++;
        }
        return token;
    }
}
