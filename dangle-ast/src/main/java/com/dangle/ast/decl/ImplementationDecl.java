package com.dangle.ast.decl;

import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 类实现（@implementation）
 */
public class ImplementationDecl extends Declaration {
    private final List<FieldDecl> ivars;
    private final List<MethodDecl> methods;

    private InterfaceDecl classInterface;

    public ImplementationDecl(SourceLocation location, String name,
                              List<FieldDecl> ivars, List<MethodDecl> methods) {
        super(location, name);
        this.ivars = new ArrayList<>(ivars);
        this.methods = new ArrayList<>(methods);
    }

    public List<FieldDecl> getIvars() { return Collections.unmodifiableList(ivars); }
    public List<MethodDecl> getMethods() { return Collections.unmodifiableList(methods); }

    public InterfaceDecl getClassInterface() { return classInterface; }
    public void setClassInterface(InterfaceDecl classInterface) { this.classInterface = classInterface; }

    /** 仅在本实现中查找方法定义 */
    public MethodDecl findMethod(String selector) {
        for (MethodDecl m : methods) {
            if (m.getSelector().equals(selector)) return m;
        }
        return null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImplementationDecl(this, context);
    }
}
