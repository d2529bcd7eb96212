package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.AstVisitor;
import com.lumenlang.compiler.ast.SourceLocation;

/**
 * if 表达式，else 分支可选
 */
public class IfExpr extends Expression {
    private final Expression condition;
    private final Expression thenBranch;
    private final Expression elseBranch;

    public IfExpr(SourceLocation location, Expression condition,
                  Expression thenBranch, Expression elseBranch) {
        super(location);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getThenBranch() {
        return thenBranch;
    }

    /** 可能为 null */
    public Expression getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfExpr(this, context);
    }
}
