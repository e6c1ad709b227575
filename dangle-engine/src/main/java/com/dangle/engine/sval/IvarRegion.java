package com.dangle.engine.sval;

import com.dangle.ast.decl.FieldDecl;

/**
 * self 对象的实例变量区域。只有发给 self/super 的消息会被内联，
 * 所以同一路径上的实例变量区域总是属于同一个对象。
 */
public final class IvarRegion extends MemRegion {
    private final FieldDecl decl;

    public IvarRegion(FieldDecl decl) {
        this.decl = decl;
    }

    public FieldDecl getDecl() {
        return decl;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IvarRegion && ((IvarRegion) o).decl == decl;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(decl);
    }

    @Override
    public String toString() {
        return "ivar{SymRegion{self}," + decl.getName() + "}";
    }
}
