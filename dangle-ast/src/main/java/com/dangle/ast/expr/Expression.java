package com.dangle.ast.expr;

import com.dangle.ast.AstNode;
import com.dangle.ast.SourceLocation;
import com.dangle.ast.type.TypeRef;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    /** 静态类型，解析后填充 */
    protected TypeRef staticType;

    protected Expression(SourceLocation location) {
        super(location);
    }

    public TypeRef getStaticType() {
        return staticType;
    }

    public void setStaticType(TypeRef staticType) {
        this.staticType = staticType;
    }

    /** 剥掉外层的类型转换 */
    public Expression ignoreCasts() {
        Expression e = this;
        while (e instanceof CastExpr) {
            e = ((CastExpr) e).getOperand();
        }
        return e;
    }
}
