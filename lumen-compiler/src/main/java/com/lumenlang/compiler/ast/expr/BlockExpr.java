package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.AstVisitor;
import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.decl.Function;

import java.util.Collections;
import java.util.List;

/**
 * 代码块：有序语句列表 + 本块直接声明的函数表。
 *
 * <p>每个局部函数在语句列表中留有一个 {@link FunDeclExpr} 占位，
 * 函数体本身只存放在 {@link #getFunctions()} 中。两个列表都保持源码顺序。</p>
 */
public class BlockExpr extends Expression {
    private final List<Expression> statements;
    private final List<Function> functions;

    public BlockExpr(SourceLocation location, List<Expression> statements, List<Function> functions) {
        super(location);
        this.statements = Collections.unmodifiableList(statements);
        this.functions = Collections.unmodifiableList(functions);
    }

    public List<Expression> getStatements() {
        return statements;
    }

    public List<Function> getFunctions() {
        return functions;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBlockExpr(this, context);
    }
}
