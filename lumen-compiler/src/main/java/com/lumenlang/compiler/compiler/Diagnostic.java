package com.lumenlang.compiler.compiler;

import com.lumenlang.compiler.CompileException;
import com.lumenlang.compiler.analysis.TypeCheckException;
import com.lumenlang.compiler.ast.SourceLocation;

/**
 * 诊断条目：一次解析/检查最多产生一条
 */
public final class Diagnostic {

    public enum Kind {
        SYNTAX("syntax"),
        TYPE("type");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String getLabel() { return label; }
    }

    private final Kind kind;
    private final String message;
    private final SourceLocation location;

    public Diagnostic(Kind kind, String message, SourceLocation location) {
        this.kind = kind;
        this.message = message;
        this.location = location;
    }

    static Diagnostic of(CompileException e) {
        Kind kind = e instanceof TypeCheckException ? Kind.TYPE : Kind.SYNTAX;
        return new Diagnostic(kind, e.getRawMessage(), e.getLocation());
    }

    public Kind getKind() { return kind; }
    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }

    /** file:line:col: kind error: message；位置未知时省略前缀 */
    public String format() {
        String prefix = location != null && location.isKnown() ? location + ": " : "";
        return prefix + kind.getLabel() + " error: " + message;
    }

    @Override
    public String toString() {
        return format();
    }
}
