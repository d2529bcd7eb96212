package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.AstVisitor;
import com.lumenlang.compiler.ast.Operator;
import com.lumenlang.compiler.ast.SourceLocation;

/**
 * 二元表达式（包括 = += -= 赋值），位置为运算符所在位置
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final Operator operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, Operator operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }
}
