package com.dangle.engine.sval;

/**
 * 原子符号，按编号区分（编号由 {@code SValBuilder} 分配）
 */
public abstract class SymbolData extends SymExpr {
    private final int id;

    protected SymbolData(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        return o != null && o.getClass() == getClass() && ((SymbolData) o).id == id;
    }

    @Override
    public int hashCode() {
        return id;
    }
}
