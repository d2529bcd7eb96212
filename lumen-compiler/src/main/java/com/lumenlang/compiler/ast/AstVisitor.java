package com.lumenlang.compiler.ast;

import com.lumenlang.compiler.ast.expr.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitLetExpr(LetExpr node, C ctx) { return null; }

    default R visitIfExpr(IfExpr node, C ctx) { return null; }

    default R visitWhileExpr(WhileExpr node, C ctx) { return null; }

    default R visitForExpr(ForExpr node, C ctx) { return null; }

    default R visitBlockExpr(BlockExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitFunDeclExpr(FunDeclExpr node, C ctx) { return null; }
}
