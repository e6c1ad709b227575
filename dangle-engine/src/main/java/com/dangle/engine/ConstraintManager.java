package com.dangle.engine;

import com.dangle.ast.expr.BinaryExpr.BinaryOp;
import com.dangle.engine.sval.*;

/**
 * 空值约束管理器：只跟踪原子符号是否为 nil。
 *
 * <p>{@link #assume} 返回加入假设后的状态，假设不可满足时返回 null。</p>
 */
public class ConstraintManager {

    public ProgramState assume(ProgramState state, SVal cond, boolean assumption) {
        if (cond.isUnknown()) return state;
        if (cond instanceof ConcreteInt) {
            return ((ConcreteInt) cond).isZero() != assumption ? state : null;
        }
        SymExpr sym = cond.getAsSymbolicExpression();
        if (sym instanceof SymbolData) {
            // 指针/整数真值：非零即真
            return assumeNull(state, (SymbolData) sym, !assumption);
        }
        if (sym instanceof SymIntExpr) {
            SymIntExpr e = (SymIntExpr) sym;
            return assumeCompareWithInt(state, e.getLHS(), e.getOpcode(), e.getRHS(), assumption);
        }
        if (sym instanceof IntSymExpr) {
            IntSymExpr e = (IntSymExpr) sym;
            return assumeCompareWithInt(state, e.getRHS(), e.getOpcode(), e.getLHS(), assumption);
        }
        if (sym instanceof SymSymExpr) {
            return assumeSymSym(state, (SymSymExpr) sym, assumption);
        }
        return state;
    }

    /** 值是否确定为 nil（或 0） */
    public boolean isNull(ProgramState state, SVal value) {
        if (value instanceof ConcreteInt) return ((ConcreteInt) value).isZero();
        SymbolData sym = value.getAsSymbol();
        return sym != null && Boolean.TRUE.equals(state.getNullness(sym));
    }

    private ProgramState assumeNull(ProgramState state, SymbolData sym, boolean isNull) {
        Boolean known = state.getNullness(sym);
        if (known != null) {
            return known == isNull ? state : null;
        }
        return state.setNullness(sym, isNull);
    }

    private ProgramState assumeCompareWithInt(ProgramState state, SymExpr sym, BinaryOp op,
                                              long value, boolean assumption) {
        if (value != 0 || !(sym instanceof SymbolData)) {
            return state;
        }
        boolean equal = op == BinaryOp.EQ ? assumption : !assumption;
        return assumeNull(state, (SymbolData) sym, equal);
    }

    private ProgramState assumeSymSym(ProgramState state, SymSymExpr e, boolean assumption) {
        boolean wantEqual = e.getOpcode() == BinaryOp.EQ ? assumption : !assumption;
        if (e.getLHS().equals(e.getRHS())) {
            return wantEqual ? state : null;
        }
        if (e.getLHS() instanceof SymbolData && e.getRHS() instanceof SymbolData) {
            Boolean l = state.getNullness((SymbolData) e.getLHS());
            Boolean r = state.getNullness((SymbolData) e.getRHS());
            if (l != null && r != null) {
                if (l && r) {
                    return wantEqual ? state : null;
                }
                if (l != r && wantEqual) {
                    return null;
                }
            }
        }
        return state;
    }
}
