package com.lumenlang.compiler.ast.decl;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.expr.Expression;
import com.lumenlang.compiler.ast.type.LumenType;

import java.util.Collections;
import java.util.List;

/**
 * 函数声明。
 *
 * <p>除返回类型外不可变。未标注返回类型时为 {@link LumenType#ANY}，
 * 在函数体第一次检查后写入推断结果，此后不再改变。</p>
 */
public final class Function {
    private final String name;
    private final List<String> paramNames;
    private final List<LumenType> paramTypes;
    private LumenType returnType;
    private final Expression body;
    private final SourceLocation location;

    public Function(SourceLocation location, String name, List<String> paramNames,
                    List<LumenType> paramTypes, LumenType returnType, Expression body) {
        if (paramNames.size() != paramTypes.size()) {
            throw new IllegalArgumentException("Parameter names and types differ in length for '" + name + "'");
        }
        this.location = location;
        this.name = name;
        this.paramNames = Collections.unmodifiableList(paramNames);
        this.paramTypes = Collections.unmodifiableList(paramTypes);
        this.returnType = returnType != null ? returnType : LumenType.ANY;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public List<String> getParamNames() {
        return paramNames;
    }

    public List<LumenType> getParamTypes() {
        return paramTypes;
    }

    public int getArity() {
        return paramTypes.size();
    }

    public LumenType getReturnType() {
        return returnType;
    }

    public boolean hasInferredReturnType() {
        return returnType != LumenType.ANY;
    }

    /**
     * 写入推断出的返回类型（只允许一次，且仅当原先为 ANY）
     */
    public void inferReturnType(LumenType type) {
        if (returnType != LumenType.ANY) {
            throw new IllegalStateException("Return type of '" + name + "' is already " + returnType);
        }
        if (type == LumenType.ANY) {
            throw new IllegalStateException("Cannot infer 'any' as return type of '" + name + "'");
        }
        this.returnType = type;
    }

    public Expression getBody() {
        return body;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
