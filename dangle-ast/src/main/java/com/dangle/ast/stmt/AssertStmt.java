package com.dangle.ast.stmt;

import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;
import com.dangle.ast.expr.Expression;

/**
 * 断言语句（assert / NSAssert 一类的宏）：条件为假的路径不会返回。
 */
public class AssertStmt extends Statement {
    private final Expression condition;

    public AssertStmt(SourceLocation location, Expression condition) {
        super(location);
        this.condition = condition;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssertStmt(this, context);
    }
}
