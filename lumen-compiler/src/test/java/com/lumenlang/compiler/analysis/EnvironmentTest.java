package com.lumenlang.compiler.analysis;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.decl.Function;
import com.lumenlang.compiler.ast.expr.Literal;
import com.lumenlang.compiler.ast.type.LumenType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Environment 测试")
class EnvironmentTest {

    private static final SourceLocation LOC = SourceLocation.at("<test>", 1, 1);

    private Environment env;

    @BeforeEach
    void setUp() {
        env = new Environment();
    }

    private static Function constant(String name) {
        return new Function(LOC, name, Collections.<String>emptyList(), Collections.<LumenType>emptyList(),
                LumenType.INT, Literal.ofInt(LOC, 1));
    }

    @Test
    @DisplayName("变量由内向外查找")
    void testLookupVar() {
        env.pushVariable("x", LumenType.INT);
        env.enterScope();
        env.pushVariable("y", LumenType.BOOL);

        assertThat(env.lookupVar("x")).isEqualTo(LumenType.INT);
        assertThat(env.lookupVar("y")).isEqualTo(LumenType.BOOL);
        assertThat(env.lookupVar("z")).isNull();
    }

    @Test
    @DisplayName("varExistInScope 只看当前帧")
    void testVarExistInScope() {
        env.pushVariable("x", LumenType.INT);
        env.enterScope();
        assertThat(env.varExistInScope("x")).isFalse();
        env.pushVariable("x", LumenType.FLOAT);
        assertThat(env.varExistInScope("x")).isTrue();
        assertThat(env.lookupVar("x")).isEqualTo(LumenType.FLOAT);
        assertThat(env.currentFrame().getVariables()).containsOnlyKeys("x");
        assertThat(env.depth()).isEqualTo(2);

        env.leaveScope();
        assertThat(env.lookupVar("x")).isEqualTo(LumenType.INT);
    }

    @Test
    @DisplayName("不能离开全局帧")
    void testUnbalancedLeave() {
        assertThatThrownBy(() -> env.leaveScope()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("帧 id 唯一且递增")
    void testFrameIds() {
        int global = env.currentFrame().getId();
        env.enterScope();
        int first = env.currentFrame().getId();
        env.leaveScope();
        env.enterScope();
        assertThat(env.currentFrame().getId()).isGreaterThan(first).isGreaterThan(global);
    }

    @Test
    @DisplayName("注册函数为未检查闭包")
    void testPushFunction() {
        env.enterScope();
        Closure closure = env.pushFunction("f", constant("f"));

        assertThat(closure.getState()).isEqualTo(Closure.CheckState.UNCHECKED);
        assertThat(closure.getDeclScope()).isEqualTo(env.currentFrame().getId());
        assertThat(env.funExistInScope("f")).isTrue();
        assertThat(env.currentFrame().getFunctions()).containsKey("f");
        assertThat(env.lookupFun("f")).isSameAs(closure);
        assertThat(env.lookupFun("g")).isNull();
    }

    @Test
    @DisplayName("declareFun 标记为检查中")
    void testDeclareFun() {
        env.pushFunction("f", constant("f"));
        Closure closure = env.declareFun("f");
        assertThat(closure.getState()).isEqualTo(Closure.CheckState.CHECKING);
        assertThat(env.declareFun("missing")).isNull();
    }

    @Test
    @DisplayName("同级链接后每个闭包都能看到全部同级函数")
    void testSiblingLinking() {
        env.enterScope();
        Closure f = env.pushFunction("f", constant("f"));
        Closure g = env.pushFunction("g", constant("g"));

        // 注册 f 时 g 还不存在
        assertThat(f.getEnvironment().lookupFun("g")).isNull();

        env.updateFunEnvirs();
        assertThat(f.getEnvironment().lookupFun("g")).isSameAs(g);
        assertThat(g.getEnvironment().lookupFun("f")).isSameAs(f);
    }

    @Test
    @DisplayName("快照独立于原环境，但共享闭包")
    void testCopyIsIndependent() {
        env.pushVariable("x", LumenType.INT);
        Closure f = env.pushFunction("f", constant("f"));
        Environment copy = env.copy();

        env.pushVariable("y", LumenType.BOOL);
        copy.pushVariable("z", LumenType.CHAR);

        assertThat(copy.lookupVar("y")).isNull();
        assertThat(env.lookupVar("z")).isNull();
        assertThat(copy.lookupVar("x")).isEqualTo(LumenType.INT);
        assertThat(copy.lookupFun("f")).isSameAs(f);
    }

    @Test
    @DisplayName("getScope 取回声明时的环境")
    void testGetScope() {
        env.pushVariable("outer", LumenType.INT);
        env.enterScope();
        Closure f = env.pushFunction("f", constant("f"));
        env.updateFunEnvirs();
        env.pushVariable("later", LumenType.BOOL);

        Environment declared = env.getScope(f.getDeclScope());
        assertThat(declared.lookupVar("outer")).isEqualTo(LumenType.INT);
        assertThat(declared.lookupVar("later")).isNull();
        assertThat(declared.lookupFun("f")).isSameAs(f);

        // 每次都是新副本
        declared.pushVariable("tmp", LumenType.INT);
        assertThat(env.getScope(f.getDeclScope()).lookupVar("tmp")).isNull();
    }

    @Test
    @DisplayName("未登记的作用域 id")
    void testGetScopeUnknown() {
        assertThatThrownBy(() -> env.getScope(42))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("42");
    }

    @Test
    @DisplayName("快照中新建的帧 id 不与原环境冲突")
    void testIdsSharedAcrossCopies() {
        Environment copy = env.copy();
        copy.enterScope();
        env.enterScope();
        assertThat(env.currentFrame().getId()).isNotEqualTo(copy.currentFrame().getId());
    }
}
