package com.dangle.engine.sval;

import com.dangle.ast.decl.VarDecl;
import com.dangle.engine.StackFrame;

/**
 * 栈帧中的参数或局部变量
 */
public final class VarRegion extends MemRegion {
    private final VarDecl decl;
    private final StackFrame frame;

    public VarRegion(VarDecl decl, StackFrame frame) {
        this.decl = decl;
        this.frame = frame;
    }

    public VarDecl getDecl() {
        return decl;
    }

    public StackFrame getFrame() {
        return frame;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof VarRegion)) return false;
        VarRegion other = (VarRegion) o;
        return other.decl == decl && other.frame == frame;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(decl) + System.identityHashCode(frame);
    }

    @Override
    public String toString() {
        return decl.getName();
    }
}
