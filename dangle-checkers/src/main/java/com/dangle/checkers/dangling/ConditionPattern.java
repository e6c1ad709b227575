package com.dangle.checkers.dangling;

import com.dangle.ast.decl.FieldDecl;

/**
 * 分支条件中被识别的惯用写法。假设成立后，在该路径余下部分一直有效，
 * 不局限于被保护的代码块。
 */
public final class ConditionPattern {

    public enum Kind {
        /** {@code _x.p != self} 为真 */
        PROPERTY_NOT_EQUAL_SELF,
        /** {@code _x.p == nil} 为真 */
        PROPERTY_EQUAL_NIL,
        /** {@code _x == nil} 或 {@code self.x == nil} 为真 */
        FIELD_EQUAL_NIL
    }

    private final Kind kind;
    private final FieldDecl field;
    private final String property;

    private ConditionPattern(Kind kind, FieldDecl field, String property) {
        this.kind = kind;
        this.field = field;
        this.property = property;
    }

    public static ConditionPattern propertyNotEqualSelf(FieldDecl field, String property) {
        return new ConditionPattern(Kind.PROPERTY_NOT_EQUAL_SELF, field, property);
    }

    public static ConditionPattern propertyEqualNil(FieldDecl field, String property) {
        return new ConditionPattern(Kind.PROPERTY_EQUAL_NIL, field, property);
    }

    public static ConditionPattern fieldEqualNil(FieldDecl field) {
        return new ConditionPattern(Kind.FIELD_EQUAL_NIL, field, null);
    }

    public Kind getKind() {
        return kind;
    }

    public FieldDecl getField() {
        return field;
    }

    /** FIELD_EQUAL_NIL 时为 null */
    public String getProperty() {
        return property;
    }

    /** 把该条件的结论并入清除表 */
    public ClearanceMap apply(ClearanceMap map, TypeFacts facts) {
        switch (kind) {
            case PROPERTY_NOT_EQUAL_SELF:
            case PROPERTY_EQUAL_NIL:
                return map.set(field, map.get(field).withClearedProperty(property));
            case FIELD_EQUAL_NIL:
                return map.set(field, ClearanceRecord.fullyCleared(facts.getFieldFacts(field)));
            default:
                throw new IllegalStateException("未知条件: " + kind);
        }
    }

    @Override
    public String toString() {
        return kind + "(" + field.getName() + (property != null ? "." + property : "") + ")";
    }
}
