package com.dangle.ast.expr;

import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;

/**
 * super 引用，仅作为消息接收者出现
 */
public class SuperExpr extends Expression {

    public SuperExpr(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSuperExpr(this, context);
    }
}
