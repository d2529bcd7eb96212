package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.AstVisitor;
import com.lumenlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 函数调用 f(a, b)
 */
public class CallExpr extends Expression {
    private final String callee;
    private final List<Expression> args;

    public CallExpr(SourceLocation location, String callee, List<Expression> args) {
        super(location);
        this.callee = callee;
        this.args = Collections.unmodifiableList(args);
    }

    public String getCallee() {
        return callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
