package com.dangle.ast.decl;

import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;
import com.dangle.ast.type.TypeRef;

/**
 * 属性声明（@property）
 */
public class PropertyDecl extends Declaration {

    /**
     * setter 语义
     */
    public enum SetterKind {
        ASSIGN,
        UNSAFE_UNRETAINED,
        WEAK,
        STRONG,
        RETAIN,
        COPY;

        public static SetterKind fromAttribute(String attr) {
            switch (attr) {
                case "assign": return ASSIGN;
                case "unsafe_unretained": return UNSAFE_UNRETAINED;
                case "weak": return WEAK;
                case "strong": return STRONG;
                case "retain": return RETAIN;
                case "copy": return COPY;
                default:
                    throw new IllegalArgumentException("未知属性修饰符: " + attr);
            }
        }
    }

    private final TypeRef type;
    private final SetterKind setterKind;
    private final String ivarName;

    // 解析后填充
    private FieldDecl ivarDecl;
    private MethodDecl getter;
    private MethodDecl setter;

    public PropertyDecl(SourceLocation location, String name, TypeRef type,
                        SetterKind setterKind, String ivarName) {
        super(location, name);
        this.type = type;
        this.setterKind = setterKind;
        this.ivarName = ivarName != null ? ivarName : "_" + name;
    }

    public TypeRef getType() { return type; }
    public SetterKind getSetterKind() { return setterKind; }
    public String getIvarName() { return ivarName; }

    /**
     * 是否为不持有引用、也不会自动置空的 setter（assign / unsafe_unretained）。
     * weak 属性在对象释放时自动置空，不属于此类。
     */
    public boolean isAssign() {
        return setterKind == SetterKind.ASSIGN || setterKind == SetterKind.UNSAFE_UNRETAINED;
    }

    public String getGetterSelector() {
        return name;
    }

    /** delegate → setDelegate: */
    public String getSetterSelector() {
        return "set" + Character.toUpperCase(name.charAt(0)) + name.substring(1) + ":";
    }

    public FieldDecl getIvarDecl() { return ivarDecl; }
    public void setIvarDecl(FieldDecl ivarDecl) { this.ivarDecl = ivarDecl; }

    public MethodDecl getGetter() { return getter; }
    public void setGetter(MethodDecl getter) { this.getter = getter; }

    public MethodDecl getSetter() { return setter; }
    public void setSetter(MethodDecl setter) { this.setter = setter; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPropertyDecl(this, context);
    }
}
