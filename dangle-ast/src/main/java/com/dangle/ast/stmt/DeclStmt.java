package com.dangle.ast.stmt;

import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;
import com.dangle.ast.decl.VarDecl;

/**
 * 局部变量声明语句
 */
public class DeclStmt extends Statement {
    private final VarDecl variable;

    public DeclStmt(SourceLocation location, VarDecl variable) {
        super(location);
        this.variable = variable;
    }

    public VarDecl getVariable() {
        return variable;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDeclStmt(this, context);
    }
}
