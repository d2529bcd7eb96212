package com.lumenlang.compiler.compiler;

import com.lumenlang.compiler.ast.expr.BlockExpr;
import com.lumenlang.compiler.ast.type.LumenType;

/**
 * 检查结果：成功时带程序类型，失败时带诊断。解析成功时 program 非空。
 */
public final class CheckResult {
    private final BlockExpr program;
    private final LumenType type;
    private final Diagnostic diagnostic;

    private CheckResult(BlockExpr program, LumenType type, Diagnostic diagnostic) {
        this.program = program;
        this.type = type;
        this.diagnostic = diagnostic;
    }

    static CheckResult success(BlockExpr program, LumenType type) {
        return new CheckResult(program, type, null);
    }

    static CheckResult failure(BlockExpr program, Diagnostic diagnostic) {
        return new CheckResult(program, null, diagnostic);
    }

    public boolean isSuccess() { return diagnostic == null; }
    public BlockExpr getProgram() { return program; }
    public LumenType getType() { return type; }
    public Diagnostic getDiagnostic() { return diagnostic; }
}
