package com.lumenlang.compiler.ast.type;

/**
 * Lumen 的全部静态类型。
 *
 * <p>{@link #ANY} 只是"尚未推断"的占位：仅允许出现在未标注返回类型、
 * 且函数体尚未检查过的函数上，永远不会成为表达式的最终类型。</p>
 */
public enum LumenType {
    INT("int"),
    FLOAT("float"),
    BOOL("bool"),
    CHAR("char"),
    STRING("string"),
    UNIT("unit"),
    ANY("any");

    private final String sourceName;

    LumenType(String sourceName) {
        this.sourceName = sourceName;
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }

    @Override
    public String toString() {
        return sourceName;
    }
}
