package com.dangle.engine.sval;

/**
 * 区域在分析开始时的初始值，例如 {@code reg_$0<self>}
 */
public final class SymbolRegionValue extends SymbolData {
    private final MemRegion region;

    public SymbolRegionValue(int id, MemRegion region) {
        super(id);
        this.region = region;
    }

    public MemRegion getRegion() {
        return region;
    }

    @Override
    public String toString() {
        return "reg_$" + getId() + "<" + region + ">";
    }
}
