package com.dangle.engine.sval;

import com.dangle.ast.expr.BinaryExpr.BinaryOp;

import java.util.Objects;

/**
 * 两个符号之间的比较：{@code lhs op rhs}
 */
public final class SymSymExpr extends SymExpr {
    private final SymExpr lhs;
    private final BinaryOp opcode;
    private final SymExpr rhs;

    public SymSymExpr(SymExpr lhs, BinaryOp opcode, SymExpr rhs) {
        this.lhs = lhs;
        this.opcode = opcode;
        this.rhs = rhs;
    }

    public SymExpr getLHS() { return lhs; }
    public BinaryOp getOpcode() { return opcode; }
    public SymExpr getRHS() { return rhs; }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof SymSymExpr)) return false;
        SymSymExpr other = (SymSymExpr) o;
        return opcode == other.opcode && lhs.equals(other.lhs) && rhs.equals(other.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lhs, opcode, rhs);
    }

    @Override
    public String toString() {
        return "(" + lhs + ") " + opcode.toSourceString() + " (" + rhs + ")";
    }
}
