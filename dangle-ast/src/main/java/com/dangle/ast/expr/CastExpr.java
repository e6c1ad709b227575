package com.dangle.ast.expr;

import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;
import com.dangle.ast.type.TypeRef;

/**
 * 类型转换表达式 {@code (Type) expr}
 */
public class CastExpr extends Expression {
    private final TypeRef targetType;
    private final Expression operand;

    public CastExpr(SourceLocation location, TypeRef targetType, Expression operand) {
        super(location);
        this.targetType = targetType;
        this.operand = operand;
    }

    public TypeRef getTargetType() {
        return targetType;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCastExpr(this, context);
    }
}
