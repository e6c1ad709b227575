package com.dangle.engine.sval;

/**
 * 具体整数值；指针上下文中 0 表示 nil
 */
public final class ConcreteInt extends SVal {
    public static final ConcreteInt ZERO = new ConcreteInt(0);
    public static final ConcreteInt ONE = new ConcreteInt(1);

    private final long value;

    private ConcreteInt(long value) {
        this.value = value;
    }

    public static ConcreteInt of(long value) {
        if (value == 0) return ZERO;
        if (value == 1) return ONE;
        return new ConcreteInt(value);
    }

    public static ConcreteInt of(boolean value) {
        return value ? ONE : ZERO;
    }

    public long getValue() {
        return value;
    }

    public boolean isZero() {
        return value == 0;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ConcreteInt && ((ConcreteInt) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return value + "U";
    }
}
