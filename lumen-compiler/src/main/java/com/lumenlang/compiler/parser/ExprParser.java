package com.lumenlang.compiler.parser;

import com.lumenlang.compiler.ast.Operator;
import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.expr.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.lumenlang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类。
 *
 * <p>两阶段：先把表达式展平为操作数/运算符交替的 {@link Term} 序列，
 * 再由 {@link #precedence(List)} 按优先级递归拆分。</p>
 *
 * <p>同一优先级层内在<b>第一个</b>运算符处拆分，因此同层链式运算是右倾的：
 * {@code 1 - 2 - 3} 解析为 {@code 1 - (2 - 3)}。</p>
 *
 * <p>拆分点还要求处于二元位置（前一项是操作数），所以 {@code 1 * -2} 中的 {@code -}
 * 留给一元运算处理，解析为 {@code (* 1 (- 2))}；只看下标是否为 0 的规则会在这里报
 * "Unexpected operator '*'"。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        List<Term> terms = new ArrayList<Term>();

        // 收集项
        while (!parser.isTerminator()) {
            Operator op = Grammar.toOperator(parser.current.getType());
            if (op != null) {
                terms.add(Term.operator(op, parser.location()));
                parser.advance();
            } else {
                if (!terms.isEmpty() && !terms.get(terms.size() - 1).isOperator()) {
                    throw parser.error("Expected operator or ';'");
                }
                terms.add(Term.operand(parseTerm()));
            }
        }

        if (terms.isEmpty()) {
            throw parser.error("Expected an expression", "expression");
        }

        return precedence(terms);
    }

    /**
     * 对项序列施加优先级与结合性
     */
    Expression precedence(List<Term> terms) {
        // 末尾不能是运算符
        Term last = terms.get(terms.size() - 1);
        if (last.isOperator()) {
            throw new ParseException("Unexpected operator '" + last.getOperator() + "'", last.getLocation());
        }

        if (terms.size() == 1) {
            return last.getOperand();
        }

        // 二元运算符：从最松的一层开始，在该层第一个处于二元位置（前一项是操作数）的运算符处拆分
        for (int tier = Grammar.BINARY_OP_PRECEDENCE.size() - 1; tier >= 0; tier--) {
            Set<Operator> operators = Grammar.BINARY_OP_PRECEDENCE.get(tier);
            for (int i = 1; i < terms.size(); i++) {
                Term term = terms.get(i);
                if (term.isOperator() && operators.contains(term.getOperator())
                        && !terms.get(i - 1).isOperator()) {
                    Expression left = precedence(terms.subList(0, i));
                    Expression right = precedence(terms.subList(i + 1, terms.size()));
                    return new BinaryExpr(term.getLocation(), left, term.getOperator(), right);
                }
            }
        }

        // 一元运算符
        Term first = terms.get(0);
        if (first.isOperator()) {
            if (!Grammar.UNARY_OPERATORS.contains(first.getOperator())) {
                throw new ParseException("Not a unary operator '" + first.getOperator() + "'", first.getLocation());
            }
            return new UnaryExpr(first.getLocation(), first.getOperator(),
                    precedence(terms.subList(1, terms.size())));
        }

        // 操作数后面紧跟的运算符不是二元运算符（如 a ! b）
        Term second = terms.get(1);
        throw new ParseException("Not a binary operator '" + second.getOperator() + "'", second.getLocation());
    }

    /**
     * 项：代码块、if、括号表达式、字面量、变量或函数调用
     */
    Expression parseTerm() {
        if (parser.current.getType().isLiteral()) {
            return parser.literalHelper.parseLiteral();
        }
        switch (parser.current.getType()) {
            case LBRACE:
                return parser.stmtParser.parseBlock();
            case KW_IF:
                return parser.stmtParser.parseIf();
            case LPAREN:
                return parseParenthesized();
            case IDENTIFIER:
                return parseVarOrCall();
            default:
                throw parser.error("Expected a term", "term");
        }
    }

    Expression parseParenthesized() {
        parser.expect(LPAREN, "'('");
        Expression expr = parseExpression();
        parser.expect(RPAREN, "')'");
        return expr;
    }

    private Expression parseVarOrCall() {
        SourceLocation loc = parser.location();
        String name = parser.expect(IDENTIFIER, "an identifier").getLexeme();

        if (!parser.check(LPAREN)) {
            return new Identifier(loc, name);
        }

        parser.advance(); // (
        List<Expression> args = new ArrayList<Expression>();
        while (!parser.isTerminator()) {
            args.add(parseExpression());
            parser.match(COMMA); // 允许尾逗号
        }
        parser.expect(RPAREN, "')'");

        return new CallExpr(loc, name, args);
    }
}
