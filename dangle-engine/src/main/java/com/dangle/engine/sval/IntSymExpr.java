package com.dangle.engine.sval;

import com.dangle.ast.expr.BinaryExpr.BinaryOp;

import java.util.Objects;

/**
 * 整数常量在左侧的比较：{@code n op sym}
 */
public final class IntSymExpr extends SymExpr {
    private final long lhs;
    private final BinaryOp opcode;
    private final SymExpr rhs;

    public IntSymExpr(long lhs, BinaryOp opcode, SymExpr rhs) {
        this.lhs = lhs;
        this.opcode = opcode;
        this.rhs = rhs;
    }

    public long getLHS() { return lhs; }
    public BinaryOp getOpcode() { return opcode; }
    public SymExpr getRHS() { return rhs; }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof IntSymExpr)) return false;
        IntSymExpr other = (IntSymExpr) o;
        return opcode == other.opcode && lhs == other.lhs && rhs.equals(other.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lhs, opcode, rhs);
    }

    @Override
    public String toString() {
        return lhs + "U " + opcode.toSourceString() + " (" + rhs + ")";
    }
}
