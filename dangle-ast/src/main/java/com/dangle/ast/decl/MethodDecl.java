package com.dangle.ast.decl;

import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;
import com.dangle.ast.stmt.Block;
import com.dangle.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 方法声明或定义。
 *
 * <p>名字即选择子（如 {@code setDelegate:}）。属性的隐式存取方法由解析器合成，
 * {@link #isImplicit()} 为 true 且 {@link #getAccessedProperty()} 指向对应属性。</p>
 */
public class MethodDecl extends Declaration {
    private final boolean instanceMethod;
    private final List<VarDecl> params;
    private final TypeRef returnType;
    private final Block body;
    private final boolean implicit;
    private final PropertyDecl accessedProperty;

    private String ownerName;

    public MethodDecl(SourceLocation location, String selector, boolean instanceMethod,
                      List<VarDecl> params, TypeRef returnType, Block body) {
        this(location, selector, instanceMethod, params, returnType, body, false, null);
    }

    private MethodDecl(SourceLocation location, String selector, boolean instanceMethod,
                       List<VarDecl> params, TypeRef returnType, Block body,
                       boolean implicit, PropertyDecl accessedProperty) {
        super(location, selector);
        this.instanceMethod = instanceMethod;
        this.params = new ArrayList<>(params);
        this.returnType = returnType;
        this.body = body;
        this.implicit = implicit;
        this.accessedProperty = accessedProperty;
    }

    /** 合成属性 getter */
    public static MethodDecl implicitGetter(PropertyDecl property) {
        return new MethodDecl(property.getLocation(), property.getGetterSelector(), true,
                Collections.<VarDecl>emptyList(), property.getType(), null, true, property);
    }

    /** 合成属性 setter */
    public static MethodDecl implicitSetter(PropertyDecl property) {
        VarDecl value = new VarDecl(property.getLocation(), VarDecl.Kind.PARAM, "value",
                property.getType(), null);
        return new MethodDecl(property.getLocation(), property.getSetterSelector(), true,
                Collections.singletonList(value), TypeRef.VOID, null, true, property);
    }

    public String getSelector() { return name; }
    public boolean isInstanceMethod() { return instanceMethod; }
    public List<VarDecl> getParams() { return Collections.unmodifiableList(params); }
    public int getParamCount() { return params.size(); }
    public TypeRef getReturnType() { return returnType; }
    public Block getBody() { return body; }
    public boolean hasBody() { return body != null; }
    public boolean isImplicit() { return implicit; }

    public PropertyDecl getAccessedProperty() { return accessedProperty; }

    public boolean isPropertyAccessor() { return accessedProperty != null; }

    public MethodFamily getMethodFamily() {
        return MethodFamily.of(name);
    }

    public String getOwnerName() { return ownerName; }
    public void setOwnerName(String ownerName) { this.ownerName = ownerName; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMethodDecl(this, context);
    }

    @Override
    public String toString() {
        return (instanceMethod ? "-[" : "+[") + (ownerName != null ? ownerName : "?") + " " + name + "]";
    }
}
