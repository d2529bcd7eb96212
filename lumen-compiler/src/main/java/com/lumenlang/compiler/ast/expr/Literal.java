package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.AstVisitor;
import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.type.LumenType;

/**
 * 字面量表达式
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceLocation location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public static Literal ofInt(SourceLocation location, int value) {
        return new Literal(location, value, LiteralKind.INT);
    }

    /** unit 没有源码写法，只在内部合成 */
    public static Literal unit(SourceLocation location) {
        return new Literal(location, null, LiteralKind.UNIT);
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    /** 数值字面量的 double 值，用于 for 循环方向判断 */
    public double numericValue() {
        if (!kind.isNumeric()) {
            throw new IllegalStateException("Not a numeric literal: " + kind);
        }
        return ((Number) value).doubleValue();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    @Override
    public String toString() {
        switch (kind) {
            case CHAR:   return "'" + escape(String.valueOf(value)) + "'";
            case STRING: return "\"" + escape((String) value) + "\"";
            case UNIT:   return "()";
            default:     return String.valueOf(value);
        }
    }

    /** 还原词法分析器认识的转义 */
    private static String escape(String text) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\n':  sb.append("\\n"); break;
                case '\t':  sb.append("\\t"); break;
                case '\r':  sb.append("\\r"); break;
                case '\0':  sb.append("\\0"); break;
                case '\\': sb.append("\\\\"); break;
                case '\'': sb.append("\\'"); break;
                case '"':  sb.append("\\\""); break;
                default:   sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INT(LumenType.INT),
        FLOAT(LumenType.FLOAT),
        BOOL(LumenType.BOOL),
        CHAR(LumenType.CHAR),
        STRING(LumenType.STRING),
        UNIT(LumenType.UNIT);

        private final LumenType type;

        LiteralKind(LumenType type) {
            this.type = type;
        }

        public LumenType getType() {
            return type;
        }

        public boolean isNumeric() {
            return this == INT || this == FLOAT;
        }
    }
}
