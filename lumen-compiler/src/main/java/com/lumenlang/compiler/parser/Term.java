package com.lumenlang.compiler.parser;

import com.lumenlang.compiler.ast.Operator;
import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.expr.Expression;

/**
 * 表达式展平后的一项：操作数，或带位置的运算符
 */
final class Term {
    private final Expression operand;
    private final Operator operator;
    private final SourceLocation location;

    private Term(Expression operand, Operator operator, SourceLocation location) {
        this.operand = operand;
        this.operator = operator;
        this.location = location;
    }

    static Term operand(Expression expr) {
        return new Term(expr, null, expr.getLocation());
    }

    static Term operator(Operator op, SourceLocation location) {
        return new Term(null, op, location);
    }

    boolean isOperator() {
        return operator != null;
    }

    Expression getOperand() {
        return operand;
    }

    Operator getOperator() {
        return operator;
    }

    SourceLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return isOperator() ? operator.toSourceString() : String.valueOf(operand);
    }
}
