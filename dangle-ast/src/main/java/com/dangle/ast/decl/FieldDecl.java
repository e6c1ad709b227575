package com.dangle.ast.decl;

import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;
import com.dangle.ast.type.TypeRef;

/**
 * 实例变量（ivar）声明。
 *
 * <p>字段以对象身份区分：同名但属于不同编译单元的字段是不同的声明。</p>
 */
public class FieldDecl extends Declaration {
    private final TypeRef type;
    private final boolean implicit;
    private String containerName;

    public FieldDecl(SourceLocation location, String name, TypeRef type, boolean implicit) {
        super(location, name);
        this.type = type;
        this.implicit = implicit;
    }

    public TypeRef getType() { return type; }

    /** 是否为属性自动合成的后备变量 */
    public boolean isImplicit() { return implicit; }

    public String getContainerName() { return containerName; }
    public void setContainerName(String containerName) { this.containerName = containerName; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldDecl(this, context);
    }

    @Override
    public String toString() {
        return containerName != null ? containerName + "::" + name : name;
    }
}
