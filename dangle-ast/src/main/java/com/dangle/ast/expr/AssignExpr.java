package com.dangle.ast.expr;

import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;

/**
 * 赋值表达式
 */
public class AssignExpr extends Expression {
    private final Expression target;
    private final Expression value;

    // 左值为点语法属性时，由解析器合成的 setter 消息
    private MessageExpr setterCall;

    public AssignExpr(SourceLocation location, Expression target, Expression value) {
        super(location);
        this.target = target;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    public MessageExpr getSetterCall() {
        return setterCall;
    }

    public void setSetterCall(MessageExpr setterCall) {
        this.setterCall = setterCall;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignExpr(this, context);
    }
}
