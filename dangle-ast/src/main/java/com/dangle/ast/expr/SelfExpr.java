package com.dangle.ast.expr;

import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;

/**
 * self 引用（当前对象）
 */
public class SelfExpr extends Expression {

    public SelfExpr(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSelfExpr(this, context);
    }
}
