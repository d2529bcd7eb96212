package com.lumenlang.compiler.analysis;

import com.lumenlang.compiler.ast.decl.Function;

/**
 * 类型检查期的函数闭包：函数声明 + 捕获的作用域快照 + 检查状态。
 *
 * <p>快照中的闭包与原环境共享同一实例，因此检查状态和推断出的返回类型
 * 在所有快照中可见。</p>
 */
public final class Closure {

    public enum CheckState {
        UNCHECKED,  // 已注册，函数体尚未检查
        CHECKING,   // 正在检查（递归调用不会再次触发检查）
        CHECKED
    }

    private final Function function;
    private final int declScope;
    private Environment environment;
    private CheckState state = CheckState.UNCHECKED;

    Closure(Function function, Environment environment, int declScope) {
        this.function = function;
        this.environment = environment;
        this.declScope = declScope;
    }

    public Function getFunction() { return function; }
    public int getDeclScope() { return declScope; }
    public CheckState getState() { return state; }

    /** 捕获的环境（同级函数链接后包含全部同级函数） */
    public Environment getEnvironment() { return environment; }

    void setEnvironment(Environment environment) { this.environment = environment; }

    void setState(CheckState state) { this.state = state; }

    @Override
    public String toString() {
        return "Closure(" + function.getName() + ", " + state + ", scope=" + declScope + ")";
    }
}
