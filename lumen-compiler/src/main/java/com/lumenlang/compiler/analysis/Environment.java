package com.lumenlang.compiler.analysis;

import com.lumenlang.compiler.ast.decl.Function;
import com.lumenlang.compiler.ast.type.LumenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 类型检查用的词法作用域环境：帧栈，最内层在末尾。
 *
 * <p>每个帧有唯一 id，保存变量绑定（名称 → 类型）和函数闭包。
 * 同一次检查派生出的所有快照共享 id 计数器和"已声明作用域"登记表，
 * 因此快照中创建的帧 id 也不会冲突，延迟检查时可以按 id 取回声明处的环境。</p>
 */
public final class Environment {

    /**
     * 单个作用域帧
     */
    public static final class Frame {
        private final int id;
        private final Map<String, LumenType> variables;
        private final Map<String, Closure> functions;

        Frame(int id) {
            this(id, new LinkedHashMap<String, LumenType>(), new LinkedHashMap<String, Closure>());
        }

        private Frame(int id, Map<String, LumenType> variables, Map<String, Closure> functions) {
            this.id = id;
            this.variables = variables;
            this.functions = functions;
        }

        public int getId() { return id; }

        public Map<String, LumenType> getVariables() {
            return Collections.unmodifiableMap(variables);
        }

        public Map<String, Closure> getFunctions() {
            return Collections.unmodifiableMap(functions);
        }

        /** 复制绑定表；闭包实例共享 */
        Frame copy() {
            return new Frame(id, new LinkedHashMap<String, LumenType>(variables),
                    new LinkedHashMap<String, Closure>(functions));
        }
    }

    /** 同一次检查的所有快照共享 */
    private static final class Registry {
        int nextId;
        final Map<Integer, Environment> declaredScopes = new HashMap<Integer, Environment>();
    }

    private final Registry registry;
    private final List<Frame> frames;

    /**
     * 新环境，包含一个全局帧
     */
    public Environment() {
        this.registry = new Registry();
        this.frames = new ArrayList<Frame>();
        enterScope();
    }

    private Environment(Registry registry, List<Frame> frames) {
        this.registry = registry;
        this.frames = frames;
    }

    // ============ 帧管理 ============

    public void enterScope() {
        frames.add(new Frame(registry.nextId++));
    }

    public void leaveScope() {
        if (frames.size() <= 1) {
            throw new IllegalStateException("Cannot leave the global scope");
        }
        frames.remove(frames.size() - 1);
    }

    public int depth() {
        return frames.size();
    }

    public Frame currentFrame() {
        return frames.get(frames.size() - 1);
    }

    /**
     * 独立副本：帧的绑定表被复制，闭包共享
     */
    public Environment copy() {
        List<Frame> copied = new ArrayList<Frame>(frames.size());
        for (Frame frame : frames) {
            copied.add(frame.copy());
        }
        return new Environment(registry, copied);
    }

    // ============ 变量 ============

    public boolean varExistInScope(String id) {
        return currentFrame().variables.containsKey(id);
    }

    public void pushVariable(String id, LumenType type) {
        currentFrame().variables.put(id, type);
    }

    /**
     * 由内向外查找变量，不存在时返回 null
     */
    public LumenType lookupVar(String id) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            LumenType type = frames.get(i).variables.get(id);
            if (type != null) {
                return type;
            }
        }
        return null;
    }

    // ============ 函数 ============

    public boolean funExistInScope(String id) {
        return currentFrame().functions.containsKey(id);
    }

    /**
     * 在当前帧注册一个未检查的闭包，捕获此刻的环境快照
     */
    public Closure pushFunction(String name, Function function) {
        Closure closure = new Closure(function, copy(), currentFrame().id);
        currentFrame().functions.put(name, closure);
        return closure;
    }

    /**
     * 同级函数链接：当前帧的所有闭包改为捕获包含全部同级函数的快照，
     * 并把该快照登记为当前帧 id 的声明环境。
     */
    public void updateFunEnvirs() {
        Frame frame = currentFrame();
        Environment linked = copy();
        for (Closure closure : frame.functions.values()) {
            closure.setEnvironment(linked);
        }
        registry.declaredScopes.put(frame.id, linked);
    }

    /**
     * 由内向外查找函数，不存在时返回 null
     */
    public Closure lookupFun(String id) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            Closure closure = frames.get(i).functions.get(id);
            if (closure != null) {
                return closure;
            }
        }
        return null;
    }

    /**
     * 查找函数并标记为检查中
     */
    public Closure declareFun(String id) {
        Closure closure = lookupFun(id);
        if (closure != null) {
            closure.setState(Closure.CheckState.CHECKING);
        }
        return closure;
    }

    /**
     * 取回某帧登记的声明环境（副本），用于在声明处上下文中延迟检查函数体
     */
    public Environment getScope(int scopeId) {
        Environment declared = registry.declaredScopes.get(scopeId);
        if (declared == null) {
            throw new IllegalStateException("No declared environment for scope " + scopeId);
        }
        return declared.copy();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Environment[");
        for (int i = 0; i < frames.size(); i++) {
            Frame frame = frames.get(i);
            if (i > 0) sb.append(", ");
            sb.append('#').append(frame.id).append(frame.variables.keySet()).append(frame.functions.keySet());
        }
        return sb.append(']').toString();
    }
}
