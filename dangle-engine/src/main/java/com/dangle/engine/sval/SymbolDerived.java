package com.dangle.engine.sval;

/**
 * 区域在失效（parent 符号标记的调用）之后的值，例如
 * {@code derived_$6{conj_$2,ivar{_worker2}}}
 */
public final class SymbolDerived extends SymbolData {
    private final SymbolData parent;
    private final MemRegion region;

    public SymbolDerived(int id, SymbolData parent, MemRegion region) {
        super(id);
        this.parent = parent;
        this.region = region;
    }

    public SymbolData getParent() {
        return parent;
    }

    public MemRegion getRegion() {
        return region;
    }

    @Override
    public String toString() {
        return "derived_$" + getId() + "{" + parent + "," + region + "}";
    }
}
