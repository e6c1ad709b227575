package com.dangle.ast.expr;

import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;

/**
 * nil 字面量
 */
public class NilLiteral extends Expression {

    public NilLiteral(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNilLiteral(this, context);
    }
}
