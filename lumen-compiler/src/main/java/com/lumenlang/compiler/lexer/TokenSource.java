package com.lumenlang.compiler.lexer;

/**
 * 解析器消费的 token 流。
 *
 * <p>流以 {@link TokenType#EOF} 结束；到达末尾后每次调用都返回 EOF。</p>
 */
public interface TokenSource {

    Token nextToken();
}
