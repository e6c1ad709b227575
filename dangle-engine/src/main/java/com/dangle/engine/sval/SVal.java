package com.dangle.engine.sval;

/**
 * 符号值：未知值、具体整数（nil 即 0）或符号表达式
 */
public abstract class SVal {

    public boolean isUnknown() {
        return false;
    }

    /** 若为符号值则返回其符号表达式，否则 null */
    public SymExpr getAsSymbolicExpression() {
        return null;
    }

    /** 若为原子符号（非复合表达式）则返回它，否则 null */
    public SymbolData getAsSymbol() {
        SymExpr sym = getAsSymbolicExpression();
        return sym instanceof SymbolData ? (SymbolData) sym : null;
    }
}
