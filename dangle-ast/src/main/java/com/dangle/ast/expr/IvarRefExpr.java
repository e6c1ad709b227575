package com.dangle.ast.expr;

import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;
import com.dangle.ast.decl.FieldDecl;

/**
 * 实例变量引用（隐式以 self 为基址，如 {@code _worker}）
 */
public class IvarRefExpr extends Expression {
    private final String name;

    private FieldDecl decl;

    public IvarRefExpr(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public FieldDecl getDecl() {
        return decl;
    }

    public void setDecl(FieldDecl decl) {
        this.decl = decl;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIvarRefExpr(this, context);
    }
}
