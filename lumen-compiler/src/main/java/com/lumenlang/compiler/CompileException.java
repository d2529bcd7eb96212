package com.lumenlang.compiler;

import com.lumenlang.compiler.ast.SourceLocation;

/**
 * 编译期错误基类：消息 + 源码位置。
 *
 * <p>首个错误即中止整个解析/检查，不做错误恢复。</p>
 */
public class CompileException extends RuntimeException {
    private final String rawMessage;
    private final SourceLocation location;

    public CompileException(String message, SourceLocation location) {
        super(message);
        this.rawMessage = message;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 不带位置后缀的原始消息 */
    public String getRawMessage() {
        return rawMessage;
    }

    @Override
    public String getMessage() {
        return rawMessage + " at " + location;
    }
}
