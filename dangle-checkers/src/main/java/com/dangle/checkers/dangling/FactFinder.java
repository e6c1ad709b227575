package com.dangle.checkers.dangling;

import com.dangle.ast.AstScanner;
import com.dangle.ast.decl.FieldDecl;
import com.dangle.ast.decl.ImplementationDecl;
import com.dangle.ast.decl.MethodDecl;
import com.dangle.ast.decl.MethodFamily;
import com.dangle.ast.expr.Expression;
import com.dangle.ast.expr.MessageExpr;

import java.util.Locale;

/**
 * 第一遍：纯语法地扫描一个类实现的全部方法，收集 {@link TypeFacts}。
 *
 * <p>方法预分类：</p>
 * <ul>
 *   <li>init 族方法是伪构造方法</li>
 *   <li>{@code dealloc} 标记显式析构</li>
 *   <li>名字以 {@link #PSEUDO_CONSTRUCTOR_PREFIXES} 之一开头（忽略大小写）的方法是伪构造方法</li>
 * </ul>
 * <p>方法体中第一个实参为 self 的消息：</p>
 * <ul>
 *   <li>接收者是实例变量且消息是 assign 属性的 setter：记为危险属性</li>
 *   <li>接收者是实例变量且选择子以 {@code addTarget:} / {@code addObserver:} 开头：记录登记事实</li>
 *   <li>接收者是全局单例且选择子以 {@code addObserver:} 开头：记录所在方法</li>
 * </ul>
 */
public final class FactFinder extends AstScanner<Void> {

    // 小写
    private static final String[] PSEUDO_CONSTRUCTOR_PREFIXES = {
            "_init", "setup", "_setup", "load", "_load", "viewdidload", "_viewdidload"
    };

    private final MethodDecl method;
    private final TypeFacts facts;

    private FactFinder(MethodDecl method, TypeFacts facts) {
        this.method = method;
        this.facts = facts;
    }

    public static void analyzeImplementation(ImplementationDecl impl, TypeFacts facts) {
        for (MethodDecl m : impl.getMethods()) {
            FactFinder finder = new FactFinder(m, facts);
            finder.classifyMethod();
            if (m.getBody() != null) {
                finder.scan(m.getBody(), null);
            }
        }
    }

    private void classifyMethod() {
        String name = method.getSelector();
        if (method.getMethodFamily() == MethodFamily.INIT) {
            facts.addPseudoConstructor(name);
            return;
        }
        if ("dealloc".equals(name)) {
            facts.setHasExplicitTeardown(true);
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (String prefix : PSEUDO_CONSTRUCTOR_PREFIXES) {
            if (lower.startsWith(prefix)) {
                facts.addPseudoConstructor(name);
                return;
            }
        }
    }

    @Override
    public Void visitMessageExpr(MessageExpr msg, Void ctx) {
        Expression receiver = msg.getInstanceReceiver();
        if (receiver != null && ExprMatchers.isSelfExpr(ExprMatchers.getArg(msg, 0))) {
            recordFacts(msg, receiver);
        }
        scanChildren(msg, ctx);
        return null;
    }

    private void recordFacts(MessageExpr msg, Expression receiver) {
        FieldDecl field = ExprMatchers.matchFieldLValue(receiver);
        if (field != null) {
            CallEffect effect = CallEffect.classify(msg);
            if (effect.isAssignPropertySet()) {
                facts.getOrCreateFieldFacts(field).addDangerousProperty(effect.getProperty().getName());
            } else if (effect.getKind() == CallEffect.Kind.ADD_TARGET) {
                facts.getOrCreateFieldFacts(field).markEventTarget();
            } else if (effect.getKind() == CallEffect.Kind.ADD_OBSERVER) {
                facts.getOrCreateFieldFacts(field).markEventObserver();
            }
            return;
        }

        String singleton = ExprMatchers.matchObservableSingleton(receiver);
        if (singleton != null && msg.getSelector().startsWith("addObserver:")) {
            facts.addSharedObserver(singleton, method.getSelector());
        }
    }
}
