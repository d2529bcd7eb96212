package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.AstVisitor;
import com.lumenlang.compiler.ast.SourceLocation;

/**
 * 表达式基类。Lumen 中语句也是表达式（let、while 等求值为 unit）。
 */
public abstract class Expression {
    protected final SourceLocation location;

    protected Expression(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
