package com.lumenlang.compiler.parser;

import com.lumenlang.compiler.ast.Operator;
import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.decl.Function;
import com.lumenlang.compiler.ast.expr.*;
import com.lumenlang.compiler.ast.type.LumenType;

import java.util.ArrayList;
import java.util.List;

import static com.lumenlang.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类：代码块、let、if、while、for（脱糖）以及函数声明
 */
class StmtParser {

    /** 计数式 for 的隐藏计数器名，词法上不可能是标识符 */
    static final String HIDDEN_COUNTER = ".for";

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseStatement() {
        switch (parser.current.getType()) {
            case LBRACE:   return parseBlock();
            case KW_WHILE: return parseWhile();
            case KW_FOR:   return parseFor();
            case KW_LET:   return parseLet();
            case KW_IF:    return parseIf();
            default:       return parser.parseExpression();
        }
    }

    /**
     * 语句序列，直到遇到终结符。函数声明单独收集到函数表，并在语句中留下占位。
     */
    BlockExpr parseStatements() {
        SourceLocation loc = parser.location();
        List<Expression> statements = new ArrayList<Expression>();
        List<Function> functions = new ArrayList<Function>();

        while (!parser.isTerminator()) {
            if (parser.check(KW_FUN)) {
                Function fun = parseFunDecl();
                statements.add(new FunDeclExpr(fun.getLocation(), fun.getName()));
                functions.add(fun);
            } else {
                statements.add(parseStatement());
            }
            parser.match(SEMICOLON); // 分号可选
        }

        return new BlockExpr(loc, statements, functions);
    }

    BlockExpr parseBlock() {
        parser.expect(LBRACE, "'{'");
        BlockExpr block = parseStatements();
        parser.expect(RBRACE, "'}'");
        return block;
    }

    IfExpr parseIf() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IF, "'if'");
        Expression condition = parser.exprParser.parseParenthesized();
        Expression thenBranch = parseStatement();

        Expression elseBranch = null;
        if (parser.match(KW_ELSE)) {
            elseBranch = parseStatement();
        }

        return new IfExpr(loc, condition, thenBranch, elseBranch);
    }

    private LetExpr parseLet() {
        SourceLocation loc = parser.location();
        parser.expect(KW_LET, "'let'");
        String name = parser.expect(IDENTIFIER, "an identifier").getLexeme();
        parser.expect(ASSIGN, "'='");
        Expression value = parser.parseExpression();
        return new LetExpr(loc, name, value);
    }

    private WhileExpr parseWhile() {
        SourceLocation loc = parser.location();
        parser.expect(KW_WHILE, "'while'");
        Expression condition = parser.exprParser.parseParenthesized();
        Expression body = parseStatement();
        return new WhileExpr(loc, condition, body);
    }

    /**
     * for 循环，两种形式都脱糖为 {@link ForExpr}：
     * <ul>
     *   <li>索引式 {@code for (i, from, to[, step])}：from/to 必须是 int 或 float 字面量</li>
     *   <li>计数式 {@code for (n)}：隐藏计数器从 0 递增到 n</li>
     * </ul>
     */
    private ForExpr parseFor() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FOR, "'for'");
        parser.expect(LPAREN, "'('");

        // 标识符后紧跟逗号才是索引式；for (n) 中的 n 是计数上限
        if (parser.check(IDENTIFIER) && parser.peek().is(COMMA)) {
            return parseIndexedFor(loc);
        }

        LetExpr init = new LetExpr(loc, HIDDEN_COUNTER, Literal.ofInt(loc, 0));
        Expression bound = parser.parseExpression();
        Expression condition = new BinaryExpr(loc, new Identifier(loc, HIDDEN_COUNTER), Operator.LESS_THAN, bound);
        Expression increment = new BinaryExpr(loc, new Identifier(loc, HIDDEN_COUNTER),
                Operator.PLUS_ASSIGN, Literal.ofInt(loc, 1));
        parser.expect(RPAREN, "')'");
        Expression body = parseStatement();

        return new ForExpr(loc, init, condition, increment, body);
    }

    private ForExpr parseIndexedFor(SourceLocation loc) {
        String id = parser.advance().getLexeme();
        parser.expect(COMMA, "','");

        Literal from = parser.literalHelper.parseLiteral();
        if (!from.getKind().isNumeric()) {
            throw new ParseException("From in for must be int or float, got " + from, from.getLocation());
        }
        LetExpr init = new LetExpr(from.getLocation(), id, from);

        parser.expect(COMMA, "','");

        Literal to = parser.literalHelper.parseLiteral();
        if (!to.getKind().isNumeric()) {
            throw new ParseException("To in for must be int or float, got " + to, to.getLocation());
        }

        boolean ascending = to.numericValue() > from.numericValue();
        Operator comparison = ascending ? Operator.LESS_THAN : Operator.GREATER_THAN;
        Expression condition = new BinaryExpr(to.getLocation(),
                new Identifier(from.getLocation(), id), comparison, to);

        Expression step;
        if (parser.match(COMMA)) {
            step = parser.parseExpression();
            if (!ascending) {
                step = new UnaryExpr(loc, Operator.MINUS, step);
            }
        } else {
            step = unitStep(from, to.getLocation(), ascending);
        }
        Expression increment = new BinaryExpr(to.getLocation(),
                new Identifier(to.getLocation(), id), Operator.PLUS_ASSIGN, step);

        parser.expect(RPAREN, "')'");
        Expression body = parseStatement();

        return new ForExpr(loc, init, condition, increment, body);
    }

    /** 默认步长 ±1，与循环变量（from）同为 int 或 float */
    private static Literal unitStep(Literal from, SourceLocation loc, boolean ascending) {
        if (from.getKind() == Literal.LiteralKind.FLOAT) {
            return new Literal(loc, ascending ? 1.0 : -1.0, Literal.LiteralKind.FLOAT);
        }
        return Literal.ofInt(loc, ascending ? 1 : -1);
    }

    /**
     * fun name(a: int, b: float): int = body
     */
    Function parseFunDecl() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FUN, "'fun'");
        String name = parser.expect(IDENTIFIER, "an identifier").getLexeme();
        parser.expect(LPAREN, "'('");

        List<String> paramNames = new ArrayList<String>();
        List<LumenType> paramTypes = new ArrayList<LumenType>();
        while (parser.check(IDENTIFIER)) {
            paramNames.add(parser.advance().getLexeme());
            parser.expect(COLON, "':'");
            paramTypes.add(parser.literalHelper.parseType());
            if (!parser.match(COMMA)) {
                break;
            }
        }
        parser.expect(RPAREN, "')'");

        LumenType returnType = LumenType.ANY;
        if (parser.match(COLON)) {
            returnType = parser.literalHelper.parseType();
        }

        parser.expect(ASSIGN, "'='");
        Expression body = parseStatement();

        return new Function(loc, name, paramNames, paramTypes, returnType, body);
    }
}
