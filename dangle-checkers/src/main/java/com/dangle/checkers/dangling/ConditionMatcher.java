package com.dangle.checkers.dangling;

import com.dangle.ast.decl.FieldDecl;
import com.dangle.ast.decl.PropertyDecl;
import com.dangle.ast.expr.BinaryExpr.BinaryOp;
import com.dangle.ast.expr.Expression;
import com.dangle.ast.expr.MessageExpr;
import com.dangle.engine.sval.*;

/**
 * 在符号值层面识别分支条件惯用写法。
 *
 * <p>被识别的符号形状：</p>
 * <pre>
 *   conj_$5 != reg_$0&lt;self&gt;          _x.delegate != self       （两侧顺序任意）
 *   conj_$5 == 0                         _x.delegate == nil / self.x == nil
 *   reg_$1&lt;ivar{_x}&gt; == 0              _x == nil
 *   derived_$6{conj_$2,ivar{_x}} == 0    _x == nil（实例变量曾失效）
 * </pre>
 * <p>{@code ==}/{@code !=} 与假设真/假的四种组合都按语义归一。</p>
 */
public final class ConditionMatcher {
    private final TypeFacts facts;

    public ConditionMatcher(TypeFacts facts) {
        this.facts = facts;
    }

    /** 没有匹配的惯用写法时返回 null */
    public ConditionPattern match(SVal cond, boolean assumption) {
        SymExpr sym = cond.getAsSymbolicExpression();
        if (sym == null) return null;

        ConditionPattern p = matchPropertyNotEqualSelf(sym, assumption);
        if (p != null) return p;

        SymExpr comparedWithNil = matchEqualToNil(sym, assumption);
        if (comparedWithNil == null) return null;
        p = matchPropertyEqualNil(comparedWithNil);
        if (p != null) return p;
        p = matchFieldGetterEqualNil(comparedWithNil);
        if (p != null) return p;
        return matchFieldEqualNil(comparedWithNil);
    }

    /** 运算符与假设结合后是否表达了 wantEquality 所要求的（不）相等 */
    static boolean matchOpcode(BinaryOp op, boolean assumption, boolean wantEquality) {
        switch (op) {
            case EQ:
                return assumption == wantEquality;
            case NE:
                return assumption != wantEquality;
            default:
                return false;
        }
    }

    private ConditionPattern matchPropertyNotEqualSelf(SymExpr sym, boolean assumption) {
        if (!(sym instanceof SymSymExpr)) return null;
        SymSymExpr e = (SymSymExpr) sym;
        if (!matchOpcode(e.getOpcode(), assumption, false)) return null;

        SymbolConjured conj;
        SymExpr other;
        if (e.getLHS() instanceof SymbolConjured) {
            conj = (SymbolConjured) e.getLHS();
            other = e.getRHS();
        } else if (e.getRHS() instanceof SymbolConjured) {
            conj = (SymbolConjured) e.getRHS();
            other = e.getLHS();
        } else {
            return null;
        }
        if (!isSelfSymbol(other)) return null;

        PropertyDecl property = null;
        FieldDecl field = null;
        if (conj.getOrigin() instanceof MessageExpr) {
            MessageExpr msg = (MessageExpr) conj.getOrigin();
            field = matchInterestingField(msg.getInstanceReceiver());
            property = field != null ? matchAssignGetter(msg) : null;
        }
        return property != null ? ConditionPattern.propertyNotEqualSelf(field, property.getName()) : null;
    }

    private static boolean isSelfSymbol(SymExpr sym) {
        return sym instanceof SymbolRegionValue && ((SymbolRegionValue) sym).getRegion() instanceof SelfRegion;
    }

    /** {@code sym == 0}（在给定假设下）时返回 sym */
    private static SymExpr matchEqualToNil(SymExpr sym, boolean assumption) {
        if (sym instanceof SymIntExpr) {
            SymIntExpr e = (SymIntExpr) sym;
            if (e.getRHS() == 0 && matchOpcode(e.getOpcode(), assumption, true)) return e.getLHS();
        } else if (sym instanceof IntSymExpr) {
            IntSymExpr e = (IntSymExpr) sym;
            if (e.getLHS() == 0 && matchOpcode(e.getOpcode(), assumption, true)) return e.getRHS();
        }
        return null;
    }

    /** {@code _x.p == nil}：p 是值得关注的字段上的 assign 属性 */
    private ConditionPattern matchPropertyEqualNil(SymExpr sym) {
        if (!(sym instanceof SymbolConjured)) return null;
        Expression origin = ((SymbolConjured) sym).getOrigin();
        if (!(origin instanceof MessageExpr)) return null;
        MessageExpr msg = (MessageExpr) origin;
        FieldDecl field = matchInterestingField(msg.getInstanceReceiver());
        if (field == null) return null;
        PropertyDecl property = matchAssignGetter(msg);
        return property != null ? ConditionPattern.propertyEqualNil(field, property.getName()) : null;
    }

    /** {@code self.x == nil}：读取整个字段的 getter 结果为 nil */
    private ConditionPattern matchFieldGetterEqualNil(SymExpr sym) {
        if (!(sym instanceof SymbolConjured)) return null;
        Expression origin = ((SymbolConjured) sym).getOrigin();
        if (origin == null) return null;
        FieldDecl field = ExprMatchers.matchFieldLValue(origin);
        if (field == null && origin instanceof MessageExpr) {
            PropertyDecl property = ExprMatchers.matchPropertyGetter((MessageExpr) origin);
            if (property != null) field = property.getIvarDecl();
        }
        return facts.isInteresting(field) ? ConditionPattern.fieldEqualNil(field) : null;
    }

    /** {@code _x == nil}：实例变量的初始值或失效后的派生值为 nil */
    private ConditionPattern matchFieldEqualNil(SymExpr sym) {
        MemRegion region = null;
        if (sym instanceof SymbolRegionValue) {
            region = ((SymbolRegionValue) sym).getRegion();
        } else if (sym instanceof SymbolDerived) {
            region = ((SymbolDerived) sym).getRegion();
        }
        if (!(region instanceof IvarRegion)) return null;
        FieldDecl field = ((IvarRegion) region).getDecl();
        return facts.isInteresting(field) ? ConditionPattern.fieldEqualNil(field) : null;
    }

    private FieldDecl matchInterestingField(Expression receiver) {
        FieldDecl field = ExprMatchers.matchFieldLValue(receiver);
        return facts.isInteresting(field) ? field : null;
    }

    private static PropertyDecl matchAssignGetter(MessageExpr msg) {
        PropertyDecl property = ExprMatchers.matchPropertyGetter(msg);
        return property != null && property.isAssign() ? property : null;
    }
}
