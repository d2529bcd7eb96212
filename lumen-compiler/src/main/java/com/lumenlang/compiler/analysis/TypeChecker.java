package com.lumenlang.compiler.analysis;

import com.lumenlang.compiler.ast.AstVisitor;
import com.lumenlang.compiler.ast.Operator;
import com.lumenlang.compiler.ast.decl.Function;
import com.lumenlang.compiler.ast.expr.*;
import com.lumenlang.compiler.ast.type.LumenType;

import java.util.List;
import java.util.logging.Logger;

/**
 * 类型检查器：遍历 AST，为每个节点求出类型，遇到第一个错误即抛出 {@link TypeCheckException}。
 *
 * <p>函数采用"先注册、再链接同级、按需检查"的方式：代码块进入时注册全部局部函数，
 * 调用点发现被调函数尚未检查时，在其声明处的环境中立即检查函数体。
 * 这使前向引用和相互递归（显式标注返回类型时）成立。</p>
 *
 * <p>检查过程会把推断出的返回类型写回未标注的 {@link Function}。</p>
 */
public class TypeChecker implements AstVisitor<LumenType, Environment> {

    private static final Logger LOG = Logger.getLogger(TypeChecker.class.getName());

    /**
     * 检查整棵树
     *
     * @param root 根节点，通常是 {@link com.lumenlang.compiler.parser.Parser#parse()} 的结果
     * @param env  全新的环境
     * @return 程序的类型
     */
    public LumenType check(Expression root, Environment env) {
        return root.accept(this, env);
    }

    // ============ 字面量与变量 ============

    @Override
    public LumenType visitLiteral(Literal node, Environment env) {
        if (node.getKind() == Literal.LiteralKind.UNIT) {
            throw new IllegalStateException("Unit literal reached the type checker at " + node.getLocation());
        }
        return node.getKind().getType();
    }

    @Override
    public LumenType visitIdentifier(Identifier node, Environment env) {
        LumenType type = env.lookupVar(node.getName());
        if (type == null) {
            throw new TypeCheckException("Variable '" + node.getName() + "' does not exist here", node.getLocation());
        }
        return type;
    }

    @Override
    public LumenType visitLetExpr(LetExpr node, Environment env) {
        if (env.varExistInScope(node.getName())) {
            throw new TypeCheckException("Variable '" + node.getName() + "' already exists in this scope",
                    node.getLocation());
        }
        LumenType value = node.getValue().accept(this, env);
        env.pushVariable(node.getName(), value);
        return LumenType.UNIT;
    }

    // ============ 运算符 ============

    @Override
    public LumenType visitBinaryExpr(BinaryExpr node, Environment env) {
        Operator op = node.getOperator();
        switch (op) {
            case ASSIGN:
                return checkAssign(node, env);
            case PLUS_ASSIGN:
            case MINUS_ASSIGN:
                return checkCompoundAssign(node, env);
            case NOT:
                throw new IllegalStateException("Not a binary operator: " + op);
            default:
                break;
        }

        LumenType left = node.getLeft().accept(this, env);
        LumenType right = node.getRight().accept(this, env);

        if (op.isArithmetic()) {
            if (left == LumenType.INT && right == LumenType.INT) {
                return LumenType.INT;
            }
            if (left.isNumeric() && right.isNumeric()) {
                return LumenType.FLOAT;
            }
        } else if (op.isComparison()) {
            if (left.isNumeric() && right.isNumeric()) {
                return LumenType.BOOL;
            }
        } else if (op == Operator.EQUALS || op == Operator.NOT_EQUALS) {
            // char/string 不支持相等比较
            if (left == right && (left.isNumeric() || left == LumenType.BOOL)) {
                return LumenType.BOOL;
            }
        } else if (op == Operator.AND || op == Operator.OR) {
            if (left == LumenType.BOOL && right == LumenType.BOOL) {
                return LumenType.BOOL;
            }
        }
        throw new TypeCheckException("Invalid operation " + op + " for " + left + " and " + right, node.getLocation());
    }

    private LumenType checkAssign(BinaryExpr node, Environment env) {
        String id = assignee(node);
        LumenType target = env.lookupVar(id);
        if (target == null) {
            throw new TypeCheckException("Variable '" + id + "' does not exist here", node.getLeft().getLocation());
        }
        LumenType value = node.getRight().accept(this, env);
        if (value != target) {
            throw new TypeCheckException("Cannot assign " + value + " to " + id + " which is " + target,
                    node.getLocation());
        }
        return LumenType.UNIT;
    }

    private LumenType checkCompoundAssign(BinaryExpr node, Environment env) {
        String id = assignee(node);
        LumenType target = env.lookupVar(id);
        if (target == null) {
            throw new TypeCheckException("Variable '" + id + "' does not exist here", node.getLeft().getLocation());
        }
        LumenType value = node.getRight().accept(this, env);
        if (!target.isNumeric() || value != target) {
            throw new TypeCheckException("Cannot add " + value + " to " + id + " because it is " + target,
                    node.getLocation());
        }
        return LumenType.UNIT;
    }

    private static String assignee(BinaryExpr node) {
        if (!(node.getLeft() instanceof Identifier)) {
            throw new TypeCheckException("Left side of '" + node.getOperator() + "' must be a variable",
                    node.getLeft().getLocation());
        }
        return ((Identifier) node.getLeft()).getName();
    }

    @Override
    public LumenType visitUnaryExpr(UnaryExpr node, Environment env) {
        LumenType type = node.getOperand().accept(this, env);
        switch (node.getOperator()) {
            case MINUS:
                if (type.isNumeric()) return type;
                break;
            case NOT:
                if (type == LumenType.BOOL) return type;
                break;
            default:
                throw new IllegalStateException("Not a unary operator: " + node.getOperator());
        }
        throw new TypeCheckException("Unary operator " + node.getOperator() + " is not valid for " + type,
                node.getLocation());
    }

    // ============ 控制流 ============

    @Override
    public LumenType visitIfExpr(IfExpr node, Environment env) {
        LumenType condition = node.getCondition().accept(this, env);
        if (condition != LumenType.BOOL) {
            throw new TypeCheckException("Condition for if must be boolean, got " + condition, node.getLocation());
        }
        LumenType thenType = node.getThenBranch().accept(this, env);
        if (!node.hasElse()) {
            return LumenType.UNIT;
        }
        LumenType elseType = node.getElseBranch().accept(this, env);
        if (thenType != elseType) {
            throw new TypeCheckException("If and else branch must have same type, got "
                    + thenType + " and " + elseType, node.getLocation());
        }
        return thenType;
    }

    @Override
    public LumenType visitWhileExpr(WhileExpr node, Environment env) {
        LumenType condition = node.getCondition().accept(this, env);
        if (condition != LumenType.BOOL) {
            throw new TypeCheckException("Condition for while must be boolean, got " + condition, node.getLocation());
        }
        node.getBody().accept(this, env);
        return LumenType.UNIT;
    }

    @Override
    public LumenType visitForExpr(ForExpr node, Environment env) {
        env.enterScope();
        node.getInit().accept(this, env);
        LumenType condition = node.getCondition().accept(this, env);
        if (condition != LumenType.BOOL) {
            throw new TypeCheckException("Condition for for must be boolean, got " + condition,
                    node.getCondition().getLocation());
        }
        node.getIncrement().accept(this, env);
        node.getBody().accept(this, env);
        env.leaveScope();
        return LumenType.UNIT;
    }

    @Override
    public LumenType visitBlockExpr(BlockExpr node, Environment env) {
        env.enterScope();

        for (Function fun : node.getFunctions()) {
            if (env.funExistInScope(fun.getName())) {
                throw new TypeCheckException("Function '" + fun.getName() + "' already exists in this scope",
                        fun.getLocation());
            }
            env.pushFunction(fun.getName(), fun);
        }
        env.updateFunEnvirs();

        LumenType result = LumenType.UNIT;
        for (Expression statement : node.getStatements()) {
            result = statement.accept(this, env);
        }

        env.leaveScope();
        return result;
    }

    // ============ 函数 ============

    @Override
    public LumenType visitCallExpr(CallExpr node, Environment env) {
        String name = node.getCallee();
        Closure closure = env.lookupFun(name);
        if (closure == null) {
            throw new TypeCheckException("Function '" + name + "' does not exist here", node.getLocation());
        }

        Function fun = closure.getFunction();
        if (fun.getReturnType() == LumenType.ANY) {
            throw new TypeCheckException("Recursive function '" + name
                    + "' needs an explicit return type annotation", node.getLocation());
        }

        List<Expression> args = node.getArgs();
        if (args.size() != fun.getArity()) {
            throw new TypeCheckException("Function '" + name + "' expects " + fun.getArity()
                    + " arguments, got " + args.size(), node.getLocation());
        }
        for (int i = 0; i < args.size(); i++) {
            LumenType expected = fun.getParamTypes().get(i);
            LumenType actual = args.get(i).accept(this, env);
            if (actual != expected) {
                throw new TypeCheckException("Argument " + (i + 1) + " of '" + name + "' must be "
                        + expected + ", got " + actual, args.get(i).getLocation());
            }
        }

        if (closure.getState() == Closure.CheckState.UNCHECKED) {
            LOG.fine("按需检查函数 " + name + "（声明作用域 #" + closure.getDeclScope() + "）");
            closure.setState(Closure.CheckState.CHECKING);
            checkFunction(fun, env.getScope(closure.getDeclScope()));
            closure.setState(Closure.CheckState.CHECKED);
        }

        return fun.getReturnType();
    }

    @Override
    public LumenType visitFunDeclExpr(FunDeclExpr node, Environment env) {
        Closure closure = env.declareFun(node.getName());
        if (closure == null) {
            throw new IllegalStateException("Function '" + node.getName() + "' was not registered in its block");
        }
        LOG.fine("检查函数声明 " + node.getName());
        LumenType body = checkFunction(closure.getFunction(), closure.getEnvironment().copy());
        closure.setState(Closure.CheckState.CHECKED);
        // 声明占位的类型就是函数体类型，作为代码块末尾语句时成为代码块类型
        return body;
    }

    /**
     * 检查函数体：新帧中绑定参数后检查函数体。
     * 未标注返回类型时写入推断结果，否则函数体类型必须与标注一致。
     *
     * @return 函数体类型
     */
    public LumenType checkFunction(Function fun, Environment env) {
        env.enterScope();
        List<String> names = fun.getParamNames();
        for (int i = 0; i < names.size(); i++) {
            env.pushVariable(names.get(i), fun.getParamTypes().get(i));
        }
        LumenType body = fun.getBody().accept(this, env);
        env.leaveScope();

        if (fun.getReturnType() == LumenType.ANY) {
            fun.inferReturnType(body);
            LOG.fine("推断 " + fun.getName() + " 的返回类型为 " + body);
        } else if (fun.getReturnType() != body) {
            throw new TypeCheckException("Return type does not match annotation, got " + body
                    + " and " + fun.getReturnType() + " was annotated", fun.getLocation());
        }
        return body;
    }
}
