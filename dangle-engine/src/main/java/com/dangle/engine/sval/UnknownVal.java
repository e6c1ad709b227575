package com.dangle.engine.sval;

public final class UnknownVal extends SVal {
    public static final UnknownVal INSTANCE = new UnknownVal();

    private UnknownVal() {}

    @Override
    public boolean isUnknown() {
        return true;
    }

    @Override
    public String toString() {
        return "Unknown";
    }
}
