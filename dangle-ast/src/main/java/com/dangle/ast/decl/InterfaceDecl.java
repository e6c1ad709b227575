package com.dangle.ast.decl;

import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 类接口声明（@interface）：超类、实例变量、属性、方法声明。
 */
public class InterfaceDecl extends Declaration {
    private final String superName;
    private final List<FieldDecl> ivars;
    private final List<PropertyDecl> properties;
    private final List<MethodDecl> methods;
    private final boolean implicit;

    // 解析后填充
    private InterfaceDecl superInterface;
    private ImplementationDecl implementation;

    public InterfaceDecl(SourceLocation location, String name, String superName,
                         List<FieldDecl> ivars, List<PropertyDecl> properties,
                         List<MethodDecl> methods, boolean implicit) {
        super(location, name);
        this.superName = superName;
        this.ivars = new ArrayList<>(ivars);
        this.properties = new ArrayList<>(properties);
        this.methods = new ArrayList<>(methods);
        this.implicit = implicit;
    }

    public String getSuperName() { return superName; }
    public boolean isImplicit() { return implicit; }

    public List<FieldDecl> getIvars() { return Collections.unmodifiableList(ivars); }
    public List<PropertyDecl> getProperties() { return Collections.unmodifiableList(properties); }
    public List<MethodDecl> getMethods() { return Collections.unmodifiableList(methods); }

    public InterfaceDecl getSuperInterface() { return superInterface; }
    public void setSuperInterface(InterfaceDecl superInterface) { this.superInterface = superInterface; }

    public ImplementationDecl getImplementation() { return implementation; }
    public void setImplementation(ImplementationDecl implementation) { this.implementation = implementation; }

    public void addIvar(FieldDecl ivar) { ivars.add(ivar); }
    public void addMethod(MethodDecl method) { methods.add(method); }

    /** 沿继承链查找属性 */
    public PropertyDecl findProperty(String propName) {
        for (InterfaceDecl c = this; c != null; c = c.superInterface) {
            for (PropertyDecl p : c.properties) {
                if (p.getName().equals(propName)) return p;
            }
        }
        return null;
    }

    /** 沿继承链查找实例变量（包括 @implementation 中声明的） */
    public FieldDecl findIvar(String ivarName) {
        for (InterfaceDecl c = this; c != null; c = c.superInterface) {
            for (FieldDecl f : c.ivars) {
                if (f.getName().equals(ivarName)) return f;
            }
            if (c.implementation != null) {
                for (FieldDecl f : c.implementation.getIvars()) {
                    if (f.getName().equals(ivarName)) return f;
                }
            }
        }
        return null;
    }

    /** 沿继承链查找方法声明（含属性的隐式存取方法） */
    public MethodDecl findMethod(String selector) {
        for (InterfaceDecl c = this; c != null; c = c.superInterface) {
            for (MethodDecl m : c.methods) {
                if (m.getSelector().equals(selector)) return m;
            }
        }
        return null;
    }

    /** 是否为 other 自身或其子类 */
    public boolean isSubclassOf(InterfaceDecl other) {
        for (InterfaceDecl c = this; c != null; c = c.superInterface) {
            if (c == other) return true;
        }
        return false;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitInterfaceDecl(this, context);
    }
}
