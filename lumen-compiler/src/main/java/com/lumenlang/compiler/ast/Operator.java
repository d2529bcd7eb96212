package com.lumenlang.compiler.ast;

/**
 * 运算符。
 *
 * <p>MINUS 同时是一元和二元运算符，由解析位置区分，而不是由 token 区分。</p>
 */
public enum Operator {
    // 算术
    PLUS("+"),
    MINUS("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("%"),

    // 比较
    LESS_THAN("<"),
    GREATER_THAN(">"),
    LESS_OR_EQUALS("<="),
    GREATER_OR_EQUALS(">="),
    EQUALS("=="),
    NOT_EQUALS("!="),

    // 逻辑
    AND("&&"),
    OR("||"),
    NOT("!"),

    // 赋值
    ASSIGN("="),
    PLUS_ASSIGN("+="),
    MINUS_ASSIGN("-=");

    private final String source;

    Operator(String source) {
        this.source = source;
    }

    /** 返回 Lumen 源码中对应的运算符 */
    public String toSourceString() {
        return source;
    }

    public boolean isArithmetic() {
        switch (this) {
            case PLUS:
            case MINUS:
            case MULTIPLY:
            case DIVIDE:
            case MODULO:
                return true;
            default:
                return false;
        }
    }

    public boolean isComparison() {
        switch (this) {
            case LESS_THAN:
            case GREATER_THAN:
            case LESS_OR_EQUALS:
            case GREATER_OR_EQUALS:
                return true;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return source;
    }
}
