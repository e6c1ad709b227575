package com.dangle.engine.sval;

import com.dangle.ast.expr.BinaryExpr.BinaryOp;

import java.util.Objects;

/**
 * 符号与整数常量的比较：{@code sym op n}
 */
public final class SymIntExpr extends SymExpr {
    private final SymExpr lhs;
    private final BinaryOp opcode;
    private final long rhs;

    public SymIntExpr(SymExpr lhs, BinaryOp opcode, long rhs) {
        this.lhs = lhs;
        this.opcode = opcode;
        this.rhs = rhs;
    }

    public SymExpr getLHS() { return lhs; }
    public BinaryOp getOpcode() { return opcode; }
    public long getRHS() { return rhs; }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof SymIntExpr)) return false;
        SymIntExpr other = (SymIntExpr) o;
        return opcode == other.opcode && rhs == other.rhs && lhs.equals(other.lhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lhs, opcode, rhs);
    }

    @Override
    public String toString() {
        return "(" + lhs + ") " + opcode.toSourceString() + " " + rhs + "U";
    }
}
