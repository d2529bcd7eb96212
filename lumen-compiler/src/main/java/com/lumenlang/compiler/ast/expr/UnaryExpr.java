package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.AstVisitor;
import com.lumenlang.compiler.ast.Operator;
import com.lumenlang.compiler.ast.SourceLocation;

/**
 * 一元表达式：-x、!x
 */
public class UnaryExpr extends Expression {
    private final Operator operator;
    private final Expression operand;

    public UnaryExpr(SourceLocation location, Operator operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpr(this, context);
    }
}
