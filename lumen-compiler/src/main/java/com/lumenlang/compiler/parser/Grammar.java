package com.lumenlang.compiler.parser;

import com.lumenlang.compiler.ast.Operator;
import com.lumenlang.compiler.ast.type.LumenType;
import com.lumenlang.compiler.lexer.TokenType;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.lumenlang.compiler.ast.Operator.*;

/**
 * 语法常量表：终结符、运算符映射、二元运算符优先级。全部不可变。
 */
final class Grammar {

    private Grammar() {}

    /** 终结符：表达式/语句遇到即结束，但不消费 */
    static final Set<TokenType> TERMINATORS = Collections.unmodifiableSet(EnumSet.of(
            TokenType.SEMICOLON,
            TokenType.RPAREN,
            TokenType.RBRACE,
            TokenType.RBRACKET,
            TokenType.KW_ELSE,
            TokenType.COMMA,
            TokenType.EOF));

    static final Set<Operator> UNARY_OPERATORS = Collections.unmodifiableSet(EnumSet.of(MINUS, NOT));

    /**
     * 二元运算符优先级，从最紧到最松。解析时从最松的一层开始拆分。
     */
    static final List<Set<Operator>> BINARY_OP_PRECEDENCE = Collections.unmodifiableList(Arrays.<Set<Operator>>asList(
            Collections.unmodifiableSet(EnumSet.of(MULTIPLY, DIVIDE, MODULO)),
            Collections.unmodifiableSet(EnumSet.of(PLUS, MINUS)),
            Collections.unmodifiableSet(EnumSet.of(LESS_THAN, GREATER_THAN, LESS_OR_EQUALS, GREATER_OR_EQUALS)),
            Collections.unmodifiableSet(EnumSet.of(EQUALS, NOT_EQUALS)),
            Collections.unmodifiableSet(EnumSet.of(AND)),
            Collections.unmodifiableSet(EnumSet.of(OR)),
            Collections.unmodifiableSet(EnumSet.of(ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN))));

    private static final Map<TokenType, Operator> OPERATORS;
    private static final Map<TokenType, LumenType> TYPE_NAMES;

    static {
        Map<TokenType, Operator> ops = new EnumMap<TokenType, Operator>(TokenType.class);
        ops.put(TokenType.PLUS, PLUS);
        ops.put(TokenType.MINUS, MINUS);
        ops.put(TokenType.MUL, MULTIPLY);
        ops.put(TokenType.DIV, DIVIDE);
        ops.put(TokenType.MOD, MODULO);
        ops.put(TokenType.LT, LESS_THAN);
        ops.put(TokenType.GT, GREATER_THAN);
        ops.put(TokenType.LE, LESS_OR_EQUALS);
        ops.put(TokenType.GE, GREATER_OR_EQUALS);
        ops.put(TokenType.EQ, EQUALS);
        ops.put(TokenType.NE, NOT_EQUALS);
        ops.put(TokenType.AND, AND);
        ops.put(TokenType.OR, OR);
        ops.put(TokenType.NOT, NOT);
        ops.put(TokenType.ASSIGN, ASSIGN);
        ops.put(TokenType.PLUS_ASSIGN, PLUS_ASSIGN);
        ops.put(TokenType.MINUS_ASSIGN, MINUS_ASSIGN);
        OPERATORS = Collections.unmodifiableMap(ops);

        Map<TokenType, LumenType> types = new EnumMap<TokenType, LumenType>(TokenType.class);
        types.put(TokenType.KW_INT, LumenType.INT);
        types.put(TokenType.KW_FLOAT, LumenType.FLOAT);
        types.put(TokenType.KW_BOOL, LumenType.BOOL);
        types.put(TokenType.KW_CHAR, LumenType.CHAR);
        types.put(TokenType.KW_STRING, LumenType.STRING);
        types.put(TokenType.KW_UNIT, LumenType.UNIT);
        TYPE_NAMES = Collections.unmodifiableMap(types);
    }

    /** token 对应的运算符；不是运算符时返回 null */
    static Operator toOperator(TokenType type) {
        return OPERATORS.get(type);
    }

    /** 类型名 token 对应的类型；不是类型名时返回 null */
    static LumenType toType(TokenType type) {
        return TYPE_NAMES.get(type);
    }
}
