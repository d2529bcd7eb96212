package com.lumenlang.compiler.lexer;

/**
 * Lumen 词法单元类型。
 *
 * <p>关键词和符号带有固定拼写，{@link Lexer} 据此生成关键词表和符号表；
 * 字面量、标识符等没有固定拼写的类型 {@link #getSpelling()} 为 null。</p>
 */
public enum TokenType {
    INT_LITERAL(null),
    FLOAT_LITERAL(null),
    CHAR_LITERAL(null),
    STRING_LITERAL(null),
    IDENTIFIER(null),

    KW_IF("if"),
    KW_ELSE("else"),
    KW_WHILE("while"),
    KW_FOR("for"),
    KW_LET("let"),
    KW_FUN("fun"),
    KW_TRUE("true"),
    KW_FALSE("false"),

    // 内置类型名也是保留字
    KW_INT("int"),
    KW_FLOAT("float"),
    KW_BOOL("bool"),
    KW_CHAR("char"),
    KW_STRING("string"),
    KW_UNIT("unit"),

    // 运算符，PLUS..MINUS_ASSIGN 必须连续
    PLUS("+"),
    MINUS("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    EQ("=="),
    NE("!="),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    AND("&&"),
    OR("||"),
    NOT("!"),
    ASSIGN("="),
    PLUS_ASSIGN("+="),
    MINUS_ASSIGN("-="),

    LPAREN("("),
    RPAREN(")"),
    LBRACE("{"),
    RBRACE("}"),
    LBRACKET("["),
    RBRACKET("]"),
    COMMA(","),
    COLON(":"),
    SEMICOLON(";"),

    EOF(null),
    /** 词法错误，literal 为错误消息 */
    ERROR(null);

    private final String spelling;

    TokenType(String spelling) {
        this.spelling = spelling;
    }

    public String getSpelling() {
        return spelling;
    }

    public boolean isKeyword() {
        return spelling != null && Character.isLetter(spelling.charAt(0));
    }

    public boolean isTypeName() {
        return ordinal() >= KW_INT.ordinal() && ordinal() <= KW_UNIT.ordinal();
    }

    public boolean isOperator() {
        return ordinal() >= PLUS.ordinal() && ordinal() <= MINUS_ASSIGN.ordinal();
    }

    /** 布尔字面量以关键词形式出现，也算字面量 */
    public boolean isLiteral() {
        return ordinal() <= STRING_LITERAL.ordinal() || this == KW_TRUE || this == KW_FALSE;
    }
}
