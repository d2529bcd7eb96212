package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.AstVisitor;
import com.lumenlang.compiler.ast.SourceLocation;

/**
 * 脱糖后的 for 循环：let 初始化 + 条件 + 自增赋值 + 循环体。
 *
 * <p>两种源码形式（索引式、计数式）都由解析器降为这一种节点。</p>
 */
public class ForExpr extends Expression {
    private final LetExpr init;
    private final Expression condition;
    private final Expression increment;
    private final Expression body;

    public ForExpr(SourceLocation location, LetExpr init, Expression condition,
                   Expression increment, Expression body) {
        super(location);
        this.init = init;
        this.condition = condition;
        this.increment = increment;
        this.body = body;
    }

    public LetExpr getInit() {
        return init;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getIncrement() {
        return increment;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForExpr(this, context);
    }
}
