package com.dangle.checkers.dangling;

import com.dangle.ast.decl.FieldDecl;
import com.dangle.ast.decl.InterfaceDecl;
import com.dangle.ast.decl.MethodDecl;
import com.dangle.ast.decl.PropertyDecl;
import com.dangle.ast.expr.*;
import com.dangle.engine.CheckerContext;
import com.dangle.engine.sval.SVal;

/**
 * 无状态的语法匹配工具：识别 self、属性存取消息、实例变量左值以及
 * 可观察的全局单例。匹配失败一律返回 null / false，不抛异常。
 */
public final class ExprMatchers {

    private ExprMatchers() {}

    public static boolean isSelfExpr(Expression expr) {
        return expr != null && expr.ignoreCasts() instanceof SelfExpr;
    }

    /** 第 index 个实参，不存在时返回 null */
    public static Expression getArg(MessageExpr msg, int index) {
        return index < msg.getNumArgs() ? msg.getArg(index) : null;
    }

    /**
     * 从 setter 选择子推出属性名：{@code setDelegate:} → {@code delegate}。
     * 自定义名字的 setter 不支持，返回 null。
     */
    public static String propertyNameFromSetterSelector(String selector) {
        if (selector == null || selector.length() < 5 || !selector.startsWith("set") || !selector.endsWith(":")) {
            return null;
        }
        String name = selector.substring(3, selector.length() - 1);
        if (name.indexOf(':') >= 0) return null;
        char first = name.charAt(0);
        if (first >= 'A' && first <= 'Z') {
            name = Character.toLowerCase(first) + name.substring(1);
        }
        return name;
    }

    /** 消息是某个属性的 getter 时返回该属性 */
    public static PropertyDecl matchPropertyGetter(MessageExpr msg) {
        MethodDecl method = msg.getMethodDecl();
        if (method == null || !method.isPropertyAccessor() || method.getParamCount() != 0) {
            return null;
        }
        InterfaceDecl iface = msg.getReceiverInterface();
        if (iface == null) return null;
        return iface.findProperty(msg.getSelector());
    }

    /** 消息是某个属性的 setter 时返回该属性 */
    public static PropertyDecl matchPropertySetter(MessageExpr msg) {
        MethodDecl method = msg.getMethodDecl();
        if (method == null || !method.isPropertyAccessor() || method.getParamCount() != 1) {
            return null;
        }
        InterfaceDecl iface = msg.getReceiverInterface();
        if (iface == null) return null;
        String name = propertyNameFromSetterSelector(msg.getSelector());
        if (name == null) return null;
        return iface.findProperty(name);
    }

    /**
     * 匹配表示 self 的某个实例变量的表达式：{@code _x}，或以 self 为基址、
     * 由 @property 声明并有后备变量的 {@code self.x}（包括它合成的 getter 消息）。
     */
    public static FieldDecl matchFieldLValue(Expression expr) {
        if (expr == null) return null;
        Expression e = expr.ignoreCasts();
        if (e instanceof IvarRefExpr) {
            return ((IvarRefExpr) e).getDecl();
        }
        PropertyRefExpr ref = null;
        if (e instanceof PropertyRefExpr) {
            ref = (PropertyRefExpr) e;
        } else if (e instanceof MessageExpr && ((MessageExpr) e).getSyntacticForm() instanceof PropertyRefExpr) {
            ref = (PropertyRefExpr) ((MessageExpr) e).getSyntacticForm();
        }
        if (ref == null || ref.isImplicitProperty() || !isSelfExpr(ref.getBase())) {
            return null;
        }
        return ref.getExplicitProperty().getIvarDecl();
    }

    /**
     * 匹配 {@code [NSNotificationCenter defaultCenter]} 这类全局单例，
     * 返回其描述字符串（如 {@code +[NSNotificationCenter defaultCenter]}），否则 null
     */
    public static String matchObservableSingleton(Expression expr) {
        if (expr == null) return null;
        Expression e = expr.ignoreCasts();
        if (!(e instanceof MessageExpr)) return null;
        MessageExpr msg = (MessageExpr) e;
        if (msg.getReceiverKind() != MessageExpr.ReceiverKind.CLASS) return null;
        String className = msg.getReceiverClassName();
        if ("NSNotificationCenter".equals(className) && "defaultCenter".equals(msg.getSelector())) {
            return "+[" + className + " " + msg.getSelector() + "]";
        }
        return null;
    }

    /** 在当前路径上值是否不可能非 nil */
    public static boolean isKnownToBeNil(SVal value, CheckerContext context) {
        return context.getConstraintManager().assume(context.getState(), value, true) == null;
    }

    /** 顶层栈帧（内联调用之外）所在方法的类接口 */
    public static InterfaceDecl getCurrentTopClassInterface(CheckerContext context) {
        return context.getStackFrame().getTopFrame().getClassInterface();
    }
}
