package com.dangle.ast.decl;

import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;
import com.dangle.ast.expr.Expression;
import com.dangle.ast.type.TypeRef;

/**
 * 方法参数或局部变量
 */
public class VarDecl extends Declaration {

    public enum Kind { PARAM, LOCAL }

    private final Kind kind;
    private final TypeRef type;
    private final Expression initializer;

    public VarDecl(SourceLocation location, Kind kind, String name, TypeRef type, Expression initializer) {
        super(location, name);
        this.kind = kind;
        this.type = type;
        this.initializer = initializer;
    }

    public Kind getKind() { return kind; }
    public TypeRef getType() { return type; }
    public Expression getInitializer() { return initializer; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVarDecl(this, context);
    }
}
