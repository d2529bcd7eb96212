package com.lumenlang.compiler.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Lumen 词法分析器。
 *
 * <p>按需产出 token：每次 {@link #nextToken()} 先跳过空白和注释，再从当前位置切出一个 token。
 * 符号按拼写长度降序逐个尝试，因此 {@code +=}、{@code <=} 之类总是取最长匹配。</p>
 *
 * <p>词法错误不抛异常，而是产生 {@link TokenType#ERROR} token（literal 为错误消息），
 * 交给解析器报告。</p>
 */
public class Lexer implements TokenSource {
    private static final Logger LOG = Logger.getLogger(Lexer.class.getName());

    private static final Map<String, TokenType> WORDS;
    private static final List<TokenType> SYMBOLS;

    static {
        Map<String, TokenType> words = new HashMap<String, TokenType>();
        List<TokenType> symbols = new ArrayList<TokenType>();
        for (TokenType type : TokenType.values()) {
            if (type.getSpelling() == null) {
                continue;
            }
            if (type.isKeyword()) {
                words.put(type.getSpelling(), type);
            } else {
                symbols.add(type);
            }
        }
        symbols.sort((a, b) -> b.getSpelling().length() - a.getSpelling().length());
        WORDS = Collections.unmodifiableMap(words);
        SYMBOLS = Collections.unmodifiableList(symbols);
    }

    /** 保留字（关键词与内置类型名） */
    public static Set<String> getKeywords() {
        return WORDS.keySet();
    }

    private final String text;
    private final String fileName;

    // 读取位置
    private int pos;
    private int line = 1;
    private int col = 1;

    // 当前 token 起点
    private int markPos;
    private int markLine;
    private int markCol;

    public Lexer(String text, String fileName) {
        this.text = text;
        this.fileName = fileName;
    }

    public Lexer(String text) {
        this(text, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    @Override
    public Token nextToken() {
        Token commentError = skipTrivia();
        if (commentError != null) {
            return commentError;
        }
        mark();
        if (atEnd()) {
            return emit(TokenType.EOF, null);
        }

        char c = look(0);
        if (isDigit(c)) {
            return scanNumber();
        }
        if (isWordStart(c)) {
            return scanWord();
        }
        if (c == '"') {
            return scanString();
        }
        if (c == '\'') {
            return scanChar();
        }
        return scanSymbol();
    }

    /** 一次扫完，末尾带 EOF */
    public List<Token> scanTokens() {
        List<Token> out = new ArrayList<Token>();
        while (true) {
            Token token = nextToken();
            out.add(token);
            if (token.is(TokenType.EOF)) {
                return out;
            }
        }
    }

    // ---- 空白与注释 ----

    /** 跳过空白、行注释和可嵌套的块注释；块注释未闭合时返回 ERROR token */
    private Token skipTrivia() {
        while (!atEnd()) {
            char c = look(0);
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                step();
            } else if (c == '/' && look(1) == '/') {
                while (!atEnd() && look(0) != '\n') {
                    step();
                }
            } else if (c == '/' && look(1) == '*') {
                mark();
                if (!skipBlockComment()) {
                    return fail("Unterminated block comment");
                }
            } else {
                return null;
            }
        }
        return null;
    }

    private boolean skipBlockComment() {
        skip(2);
        int depth = 1;
        while (depth > 0) {
            if (atEnd()) {
                return false;
            }
            if (look(0) == '/' && look(1) == '*') {
                skip(2);
                depth++;
            } else if (look(0) == '*' && look(1) == '/') {
                skip(2);
                depth--;
            } else {
                step();
            }
        }
        return true;
    }

    // ---- 各类 token ----

    private Token scanSymbol() {
        for (TokenType type : SYMBOLS) {
            if (text.startsWith(type.getSpelling(), pos)) {
                skip(type.getSpelling().length());
                return emit(type, null);
            }
        }
        char c = step();
        if (c == '&' || c == '|') {
            return fail("Unexpected character '" + c + "'. Did you mean '" + c + c + "'?");
        }
        return fail("Unexpected character: " + c);
    }

    private Token scanNumber() {
        skipDigits();
        boolean fraction = look(0) == '.' && isDigit(look(1));
        if (fraction) {
            step();
            skipDigits();
        }
        String digits = text.substring(markPos, pos);
        try {
            if (fraction) {
                return emit(TokenType.FLOAT_LITERAL, Double.valueOf(digits));
            }
            return emit(TokenType.INT_LITERAL, Integer.valueOf(digits));
        } catch (NumberFormatException e) {
            return fail((fraction ? "Invalid float literal: " : "Invalid integer literal: ") + digits);
        }
    }

    private Token scanWord() {
        while (!atEnd() && (isWordStart(look(0)) || isDigit(look(0)))) {
            step();
        }
        TokenType type = WORDS.get(text.substring(markPos, pos));
        if (type == null) {
            return emit(TokenType.IDENTIFIER, null);
        }
        switch (type) {
            case KW_TRUE:
                return emit(type, Boolean.TRUE);
            case KW_FALSE:
                return emit(type, Boolean.FALSE);
            default:
                return emit(type, null);
        }
    }

    private Token scanString() {
        step();
        StringBuilder value = new StringBuilder();
        while (true) {
            if (atEnd() || look(0) == '\n') {
                return fail("Unterminated string");
            }
            char c = step();
            if (c == '"') {
                return emit(TokenType.STRING_LITERAL, value.toString());
            }
            if (c != '\\') {
                value.append(c);
                continue;
            }
            if (atEnd()) {
                return fail("Unterminated string");
            }
            char code = step();
            int decoded = unescape(code);
            if (decoded < 0) {
                return fail("Invalid escape character: \\" + code);
            }
            value.append((char) decoded);
        }
    }

    private Token scanChar() {
        step();
        if (atEnd() || look(0) == '\'') {
            return fail("Empty or unterminated character literal");
        }
        char value = step();
        if (value == '\\') {
            if (atEnd()) {
                return fail("Unterminated character literal");
            }
            char code = step();
            int decoded = unescape(code);
            if (decoded < 0) {
                return fail("Invalid escape character: \\" + code);
            }
            value = (char) decoded;
        }
        if (look(0) != '\'') {
            return fail("Unterminated character literal");
        }
        step();
        return emit(TokenType.CHAR_LITERAL, value);
    }

    /** 转义码对应的字符；未知转义返回 -1 */
    private static int unescape(char code) {
        switch (code) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case '0': return 0;
            case '\\':
            case '\'':
            case '"':
                return code;
            default:
                return -1;
        }
    }

    // ---- 游标 ----

    private boolean atEnd() {
        return pos >= text.length();
    }

    private char look(int ahead) {
        int at = pos + ahead;
        return at < text.length() ? text.charAt(at) : '\0';
    }

    /** 前进一个字符，同时维护行列 */
    private char step() {
        char c = text.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private void skip(int count) {
        for (int i = 0; i < count; i++) {
            step();
        }
    }

    private void skipDigits() {
        while (isDigit(look(0))) {
            step();
        }
    }

    private void mark() {
        markPos = pos;
        markLine = line;
        markCol = col;
    }

    private Token emit(TokenType type, Object literal) {
        return new Token(type, text.substring(markPos, pos), literal, markLine, markCol, markPos);
    }

    private Token fail(String message) {
        LOG.fine(String.format("[%s:%d:%d] Lexer error: %s", fileName, markLine, markCol, message));
        return emit(TokenType.ERROR, message);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWordStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
