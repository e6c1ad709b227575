package com.dangle.engine.sval;

import com.dangle.engine.StackFrame;

/**
 * 某个栈帧中隐式参数 self 所在的区域
 */
public final class SelfRegion extends MemRegion {
    private final StackFrame frame;

    public SelfRegion(StackFrame frame) {
        this.frame = frame;
    }

    public StackFrame getFrame() {
        return frame;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SelfRegion && ((SelfRegion) o).frame == frame;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(frame);
    }

    @Override
    public String toString() {
        return "self";
    }
}
