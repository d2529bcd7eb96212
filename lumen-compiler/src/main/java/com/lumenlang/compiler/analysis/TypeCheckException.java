package com.lumenlang.compiler.analysis;

import com.lumenlang.compiler.CompileException;
import com.lumenlang.compiler.ast.SourceLocation;

/**
 * 类型错误
 */
public class TypeCheckException extends CompileException {

    public TypeCheckException(String message, SourceLocation location) {
        super(message, location);
    }
}
