package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.AstVisitor;
import com.lumenlang.compiler.ast.SourceLocation;

/**
 * 函数声明占位：只标记函数在语句序列中的文本位置，
 * 函数体在所属 {@link BlockExpr} 的函数表中。
 */
public class FunDeclExpr extends Expression {
    private final String name;

    public FunDeclExpr(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunDeclExpr(this, context);
    }
}
