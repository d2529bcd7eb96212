package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.AstVisitor;
import com.lumenlang.compiler.ast.SourceLocation;

/**
 * let 声明：在当前作用域引入变量，类型取自初值
 */
public class LetExpr extends Expression {
    private final String name;
    private final Expression value;

    public LetExpr(SourceLocation location, String name, Expression value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLetExpr(this, context);
    }
}
