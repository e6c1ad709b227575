package com.dangle.ast.expr;

import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;
import com.dangle.ast.decl.VarDecl;

/**
 * 局部变量或参数引用
 */
public class LocalRefExpr extends Expression {
    private final String name;

    private VarDecl decl;

    public LocalRefExpr(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public VarDecl getDecl() {
        return decl;
    }

    public void setDecl(VarDecl decl) {
        this.decl = decl;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLocalRefExpr(this, context);
    }
}
