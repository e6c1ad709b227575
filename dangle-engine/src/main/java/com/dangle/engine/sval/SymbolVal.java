package com.dangle.engine.sval;

/**
 * 包装符号表达式的值
 */
public final class SymbolVal extends SVal {
    private final SymExpr symbol;

    public SymbolVal(SymExpr symbol) {
        this.symbol = symbol;
    }

    @Override
    public SymExpr getAsSymbolicExpression() {
        return symbol;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SymbolVal && ((SymbolVal) o).symbol.equals(symbol);
    }

    @Override
    public int hashCode() {
        return symbol.hashCode();
    }

    @Override
    public String toString() {
        return symbol.toString();
    }
}
