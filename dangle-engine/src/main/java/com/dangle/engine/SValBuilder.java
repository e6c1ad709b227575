package com.dangle.engine;

import com.dangle.ast.expr.BinaryExpr.BinaryOp;
import com.dangle.ast.expr.Expression;
import com.dangle.engine.sval.*;

import java.util.HashMap;
import java.util.Map;

/**
 * 创建符号并计算比较、取反。
 *
 * <p>区域初始值与派生值按区域缓存，同一区域多次读取得到同一个符号。</p>
 */
public class SValBuilder {
    private int nextSymbolId = 0;
    private final Map<MemRegion, SymbolRegionValue> regionValues = new HashMap<>();
    private final Map<SymbolData, Map<MemRegion, SymbolDerived>> derivedValues = new HashMap<>();

    public SymbolRegionValue regionValue(MemRegion region) {
        SymbolRegionValue sym = regionValues.get(region);
        if (sym == null) {
            sym = new SymbolRegionValue(nextSymbolId++, region);
            regionValues.put(region, sym);
        }
        return sym;
    }

    public SymbolConjured conjure(Expression origin) {
        return new SymbolConjured(nextSymbolId++, origin);
    }

    public SymbolDerived derived(SymbolData parent, MemRegion region) {
        Map<MemRegion, SymbolDerived> byRegion = derivedValues.computeIfAbsent(parent, k -> new HashMap<>());
        SymbolDerived sym = byRegion.get(region);
        if (sym == null) {
            sym = new SymbolDerived(nextSymbolId++, parent, region);
            byRegion.put(region, sym);
        }
        return sym;
    }

    /** 求值 {@code ==} / {@code !=} */
    public SVal evalComparison(BinaryOp op, SVal lhs, SVal rhs) {
        if (lhs.isUnknown() || rhs.isUnknown()) return UnknownVal.INSTANCE;
        if (lhs instanceof ConcreteInt && rhs instanceof ConcreteInt) {
            boolean eq = ((ConcreteInt) lhs).getValue() == ((ConcreteInt) rhs).getValue();
            return ConcreteInt.of(op == BinaryOp.EQ ? eq : !eq);
        }
        if (rhs instanceof ConcreteInt) {
            return new SymbolVal(new SymIntExpr(lhs.getAsSymbolicExpression(), op,
                    ((ConcreteInt) rhs).getValue()));
        }
        if (lhs instanceof ConcreteInt) {
            return new SymbolVal(new IntSymExpr(((ConcreteInt) lhs).getValue(), op,
                    rhs.getAsSymbolicExpression()));
        }
        SymExpr l = lhs.getAsSymbolicExpression();
        SymExpr r = rhs.getAsSymbolicExpression();
        if (l.equals(r)) {
            return ConcreteInt.of(op == BinaryOp.EQ);
        }
        return new SymbolVal(new SymSymExpr(l, op, r));
    }

    /** 逻辑非：比较取反运算符，原子符号变为 {@code sym == 0} */
    public SVal evalNot(SVal value) {
        if (value.isUnknown()) return value;
        if (value instanceof ConcreteInt) {
            return ConcreteInt.of(((ConcreteInt) value).isZero());
        }
        SymExpr sym = value.getAsSymbolicExpression();
        if (sym instanceof SymIntExpr) {
            SymIntExpr e = (SymIntExpr) sym;
            return new SymbolVal(new SymIntExpr(e.getLHS(), negate(e.getOpcode()), e.getRHS()));
        }
        if (sym instanceof IntSymExpr) {
            IntSymExpr e = (IntSymExpr) sym;
            return new SymbolVal(new IntSymExpr(e.getLHS(), negate(e.getOpcode()), e.getRHS()));
        }
        if (sym instanceof SymSymExpr) {
            SymSymExpr e = (SymSymExpr) sym;
            return new SymbolVal(new SymSymExpr(e.getLHS(), negate(e.getOpcode()), e.getRHS()));
        }
        return new SymbolVal(new SymIntExpr(sym, BinaryOp.EQ, 0));
    }

    private static BinaryOp negate(BinaryOp op) {
        switch (op) {
            case EQ: return BinaryOp.NE;
            case NE: return BinaryOp.EQ;
            default:
                throw new IllegalArgumentException("不可取反的运算符: " + op);
        }
    }
}
