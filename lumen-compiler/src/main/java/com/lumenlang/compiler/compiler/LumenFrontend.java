package com.lumenlang.compiler.compiler;

import com.lumenlang.compiler.analysis.Environment;
import com.lumenlang.compiler.analysis.TypeCheckException;
import com.lumenlang.compiler.analysis.TypeChecker;
import com.lumenlang.compiler.ast.expr.BlockExpr;
import com.lumenlang.compiler.ast.type.LumenType;
import com.lumenlang.compiler.lexer.Lexer;
import com.lumenlang.compiler.parser.ParseException;
import com.lumenlang.compiler.parser.Parser;

import java.util.logging.Logger;

/**
 * 前端入口：源码 → token → AST → 类型。
 *
 * <p>{@link #parse} 直接抛出语法错误；{@link #check} 把首个错误包装成 {@link Diagnostic} 返回。</p>
 */
public class LumenFrontend {

    private static final Logger LOG = Logger.getLogger(LumenFrontend.class.getName());

    /**
     * 解析源码
     *
     * @throws ParseException 语法错误（含词法错误）
     */
    public BlockExpr parse(String source, String fileName) {
        LOG.fine("解析 " + fileName);
        return new Parser(new Lexer(source, fileName)).parse();
    }

    /**
     * 解析并检查源码，不抛出编译错误
     */
    public CheckResult check(String source, String fileName) {
        BlockExpr program;
        try {
            program = parse(source, fileName);
        } catch (ParseException e) {
            LOG.fine("语法错误: " + e.getMessage());
            return CheckResult.failure(null, Diagnostic.of(e));
        }

        try {
            LOG.fine("类型检查 " + fileName);
            LumenType type = new TypeChecker().check(program, new Environment());
            return CheckResult.success(program, type);
        } catch (TypeCheckException e) {
            LOG.fine("类型错误: " + e.getMessage());
            return CheckResult.failure(program, Diagnostic.of(e));
        }
    }
}
