package com.dangle.ast.expr;

import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;
import com.dangle.ast.decl.PropertyDecl;

/**
 * 点语法属性访问（{@code self.worker}、{@code _worker.delegate}）。
 *
 * <p>作为右值时等价于 getter 消息；作为赋值左值时由 {@link AssignExpr#getSetterCall()}
 * 表示 setter 消息。两种消息都由解析器合成。</p>
 */
public class PropertyRefExpr extends Expression {
    private final Expression base;
    private final String propertyName;

    private PropertyDecl explicitProperty;
    private MessageExpr getterCall;

    public PropertyRefExpr(SourceLocation location, Expression base, String propertyName) {
        super(location);
        this.base = base;
        this.propertyName = propertyName;
    }

    public Expression getBase() {
        return base;
    }

    public String getPropertyName() {
        return propertyName;
    }

    /** 用 @property 声明的属性；点语法调用普通方法时为 null */
    public PropertyDecl getExplicitProperty() {
        return explicitProperty;
    }

    public void setExplicitProperty(PropertyDecl explicitProperty) {
        this.explicitProperty = explicitProperty;
    }

    public boolean isImplicitProperty() {
        return explicitProperty == null;
    }

    public MessageExpr getGetterCall() {
        return getterCall;
    }

    public void setGetterCall(MessageExpr getterCall) {
        this.getterCall = getterCall;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPropertyRefExpr(this, context);
    }
}
