package com.dangle.engine.sval;

import com.dangle.ast.expr.Expression;

/**
 * 无法精确求值的调用结果（或失效标记），记住产生它的表达式
 */
public final class SymbolConjured extends SymbolData {
    private final Expression origin;

    public SymbolConjured(int id, Expression origin) {
        super(id);
        this.origin = origin;
    }

    /** 产生该符号的表达式，可能为 null */
    public Expression getOrigin() {
        return origin;
    }

    @Override
    public String toString() {
        return "conj_$" + getId();
    }
}
