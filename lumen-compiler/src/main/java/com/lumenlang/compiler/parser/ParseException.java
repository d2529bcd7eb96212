package com.lumenlang.compiler.parser;

import com.lumenlang.compiler.CompileException;
import com.lumenlang.compiler.ast.SourceLocation;

/**
 * 语法错误
 */
public class ParseException extends CompileException {
    private final String expected;

    public ParseException(String message, SourceLocation location) {
        this(message, location, null);
    }

    public ParseException(String message, SourceLocation location, String expected) {
        super(expected == null ? message : message + ", expected " + expected, location);
        this.expected = expected;
    }

    /** 期望出现的 token 描述，可能为 null */
    public String getExpected() {
        return expected;
    }
}
