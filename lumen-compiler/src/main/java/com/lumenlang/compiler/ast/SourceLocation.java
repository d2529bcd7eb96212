package com.lumenlang.compiler.ast;

/**
 * 节点在源码中的位置，打印为 {@code file:line:col}。
 * 只用于诊断，AST 的结构比较不看位置。
 */
public final class SourceLocation {

    /** 合成节点或无从定位时使用，line 为 0 */
    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0, 0);

    private final String file;
    private final int line;
    private final int column;
    private final int offset;
    private final int length;

    public SourceLocation(String file, int line, int column, int offset, int length) {
        this.file = file == null ? "<input>" : file;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.length = length;
    }

    public static SourceLocation at(String file, int line, int column) {
        return new SourceLocation(file, line, column, 0, 0);
    }

    public String getFile() { return file; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getOffset() { return offset; }
    public int getLength() { return length; }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
