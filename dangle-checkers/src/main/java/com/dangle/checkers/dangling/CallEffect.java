package com.dangle.checkers.dangling;

import com.dangle.ast.decl.PropertyDecl;
import com.dangle.ast.expr.MessageExpr;

/**
 * 一次消息发送对接收者的作用分类，每个调用点只计算一次。
 */
public final class CallEffect {

    public enum Kind {
        /** {@code release} / {@code autorelease} */
        RELEASE,
        /** 属性 setter，见 {@link #getProperty()} */
        PROPERTY_SET,
        ADD_TARGET,
        ADD_OBSERVER,
        REMOVE_TARGET,
        REMOVE_OBSERVER,
        UNRECOGNIZED
    }

    private final Kind kind;
    private final PropertyDecl property;
    private final boolean argIsSubject;

    private CallEffect(Kind kind, PropertyDecl property, boolean argIsSubject) {
        this.kind = kind;
        this.property = property;
        this.argIsSubject = argIsSubject;
    }

    public static CallEffect classify(MessageExpr msg) {
        boolean argIsSubject = ExprMatchers.isSelfExpr(ExprMatchers.getArg(msg, 0));
        String selector = msg.getSelector();
        if ("release".equals(selector) || "autorelease".equals(selector)) {
            return new CallEffect(Kind.RELEASE, null, argIsSubject);
        }
        PropertyDecl property = ExprMatchers.matchPropertySetter(msg);
        if (property != null) {
            return new CallEffect(Kind.PROPERTY_SET, property, argIsSubject);
        }
        if (selector.startsWith("addTarget:")) {
            return new CallEffect(Kind.ADD_TARGET, null, argIsSubject);
        }
        if (selector.startsWith("addObserver:")) {
            return new CallEffect(Kind.ADD_OBSERVER, null, argIsSubject);
        }
        if (selector.startsWith("removeTarget:")) {
            return new CallEffect(Kind.REMOVE_TARGET, null, argIsSubject);
        }
        if (selector.startsWith("removeObserver:")) {
            return new CallEffect(Kind.REMOVE_OBSERVER, null, argIsSubject);
        }
        return new CallEffect(Kind.UNRECOGNIZED, null, argIsSubject);
    }

    public Kind getKind() {
        return kind;
    }

    /** PROPERTY_SET 时为被设置的属性，否则 null */
    public PropertyDecl getProperty() {
        return property;
    }

    /** 第一个实参是否为 self */
    public boolean isArgSubject() {
        return argIsSubject;
    }

    /** 是否为不持有引用的属性（assign / unsafe_unretained）的 setter */
    public boolean isAssignPropertySet() {
        return kind == Kind.PROPERTY_SET && property.isAssign();
    }

    @Override
    public String toString() {
        return property != null ? kind + "(" + property.getName() + ")" : kind.toString();
    }
}
