package com.lumenlang.compiler.parser;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.expr.BlockExpr;
import com.lumenlang.compiler.ast.expr.Expression;
import com.lumenlang.compiler.lexer.Lexer;
import com.lumenlang.compiler.lexer.Token;
import com.lumenlang.compiler.lexer.TokenSource;
import com.lumenlang.compiler.lexer.TokenType;

import static com.lumenlang.compiler.lexer.TokenType.*;

/**
 * Lumen 语法分析器入口。
 *
 * <p>语句由 {@link StmtParser} 递归下降解析，表达式由 {@link ExprParser} 先收集项再按优先级拆分，
 * 字面量交给 {@link LiteralHelper}。本类只维护 token 游标（当前 token 加一个前瞻）。</p>
 *
 * <p>实例只能用一次。第一个错误即抛出 {@link ParseException}，不做恢复。</p>
 */
public class Parser {

    final TokenSource source;
    final String fileName;

    /** 正在看的 token */
    Token current;
    /** peek() 取出但尚未成为 current 的 token */
    private Token lookahead;

    final LiteralHelper literalHelper = new LiteralHelper(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(TokenSource source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Parser(Lexer lexer) {
        this(lexer, lexer.getFileName());
    }

    /**
     * 解析整个程序，返回根代码块。根代码块之后只允许 EOF。
     */
    public BlockExpr parse() {
        if (current != null) {
            throw new IllegalStateException("Parser instances are single-use");
        }
        advance();
        BlockExpr program = stmtParser.parseStatements();
        if (!isAtEnd()) {
            throw new ParseException("Unexpected '" + current.getLexeme() + "'", location());
        }
        return program;
    }

    // ---- 游标 ----

    /** 消费 current 并返回它 */
    Token advance() {
        Token consumed = current;
        current = lookahead != null ? lookahead : pull();
        lookahead = null;
        return consumed;
    }

    Token peek() {
        if (lookahead == null) {
            lookahead = pull();
        }
        return lookahead;
    }

    /** 词法错误 token 在这里转成语法错误 */
    private Token pull() {
        Token next = source.nextToken();
        if (next.is(ERROR)) {
            throw new ParseException(String.valueOf(next.getLiteral()), next.toLocation(fileName));
        }
        return next;
    }

    boolean check(TokenType type) {
        return current.is(type);
    }

    boolean match(TokenType type) {
        boolean hit = check(type);
        if (hit) {
            advance();
        }
        return hit;
    }

    Token expect(TokenType type, String what) {
        if (!check(type)) {
            throw error("Expected " + what, what);
        }
        return advance();
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    /** ; ) } ] else , EOF：结束表达式但不消费 */
    boolean isTerminator() {
        return Grammar.TERMINATORS.contains(current.getType());
    }

    SourceLocation location() {
        return current.toLocation(fileName);
    }

    // ---- 错误 ----

    /**
     * 指向 current 的语法错误；已到末尾时一律报告 "Unexpected end of input"
     */
    ParseException error(String message, String expected) {
        return isAtEnd()
                ? new ParseException("Unexpected end of input", location(), expected)
                : new ParseException(message, location());
    }

    ParseException error(String message) {
        return error(message, null);
    }

    Expression parseExpression() {
        return exprParser.parseExpression();
    }
}
