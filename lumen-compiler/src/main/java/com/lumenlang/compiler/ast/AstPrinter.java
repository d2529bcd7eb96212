package com.lumenlang.compiler.ast;

import com.lumenlang.compiler.ast.decl.Function;
import com.lumenlang.compiler.ast.expr.*;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把 AST 打印为全括号 S 表达式，例如 {@code (+ 1 (* 2 3))}。
 *
 * <p>用于测试断言树形状，以及 CLI 的 parse 子命令。代码块中的函数声明占位
 * 会展开成完整的函数（签名与函数体）。</p>
 */
public final class AstPrinter implements AstVisitor<String, Void> {

    /** 已进入的代码块中，占位 → 对应的函数 */
    private final Map<FunDeclExpr, Function> declarations = new IdentityHashMap<FunDeclExpr, Function>();

    public static String print(Expression expr) {
        return expr.accept(new AstPrinter(), null);
    }

    public static String print(Function function) {
        return new AstPrinter().function(function);
    }

    /** (fun f (a:int b:int) int body) */
    private String function(Function function) {
        StringBuilder sb = new StringBuilder("(fun ").append(function.getName()).append(" (");
        for (int i = 0; i < function.getArity(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(function.getParamNames().get(i)).append(':').append(function.getParamTypes().get(i));
        }
        sb.append(") ").append(function.getReturnType()).append(' ');
        sb.append(function.getBody().accept(this, null)).append(')');
        return sb.toString();
    }

    private String group(String head, Expression... children) {
        StringBuilder sb = new StringBuilder("(").append(head);
        for (Expression child : children) {
            sb.append(' ').append(child.accept(this, null));
        }
        return sb.append(')').toString();
    }

    @Override
    public String visitBinaryExpr(BinaryExpr node, Void ctx) {
        return group(node.getOperator().toSourceString(), node.getLeft(), node.getRight());
    }

    @Override
    public String visitUnaryExpr(UnaryExpr node, Void ctx) {
        return group(node.getOperator().toSourceString(), node.getOperand());
    }

    @Override
    public String visitLiteral(Literal node, Void ctx) {
        return node.toString();
    }

    @Override
    public String visitIdentifier(Identifier node, Void ctx) {
        return node.getName();
    }

    @Override
    public String visitLetExpr(LetExpr node, Void ctx) {
        return group("let " + node.getName(), node.getValue());
    }

    @Override
    public String visitIfExpr(IfExpr node, Void ctx) {
        if (node.hasElse()) {
            return group("if", node.getCondition(), node.getThenBranch(), node.getElseBranch());
        }
        return group("if", node.getCondition(), node.getThenBranch());
    }

    @Override
    public String visitWhileExpr(WhileExpr node, Void ctx) {
        return group("while", node.getCondition(), node.getBody());
    }

    @Override
    public String visitForExpr(ForExpr node, Void ctx) {
        return group("for", node.getInit(), node.getCondition(), node.getIncrement(), node.getBody());
    }

    @Override
    public String visitBlockExpr(BlockExpr node, Void ctx) {
        // 第 k 个占位对应函数表中第 k 个函数
        List<Function> functions = node.getFunctions();
        int next = 0;
        for (Expression statement : node.getStatements()) {
            if (statement instanceof FunDeclExpr && next < functions.size()) {
                declarations.put((FunDeclExpr) statement, functions.get(next++));
            }
        }
        return group("block", node.getStatements().toArray(new Expression[0]));
    }

    @Override
    public String visitCallExpr(CallExpr node, Void ctx) {
        return group("call " + node.getCallee(), node.getArgs().toArray(new Expression[0]));
    }

    @Override
    public String visitFunDeclExpr(FunDeclExpr node, Void ctx) {
        Function function = declarations.get(node);
        return function != null ? function(function) : "(fun " + node.getName() + ")";
    }
}
