package com.dangle.ast.decl;

import com.dangle.ast.AstNode;
import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 编译单元：一个源文件内的全部顶层声明。
 *
 * <p>{@code arc} 表示该单元是否以自动引用计数模式编译。</p>
 */
public final class TranslationUnit extends AstNode {
    private final String fileName;
    private final boolean arc;
    private final List<Declaration> declarations;

    private final Map<String, InterfaceDecl> interfaces = new LinkedHashMap<>();
    private final Map<String, ImplementationDecl> implementations = new LinkedHashMap<>();

    public TranslationUnit(SourceLocation location, String fileName, boolean arc,
                           List<Declaration> declarations) {
        super(location);
        this.fileName = fileName;
        this.arc = arc;
        this.declarations = new ArrayList<>(declarations);
        for (Declaration d : declarations) {
            if (d instanceof InterfaceDecl) {
                interfaces.put(d.getName(), (InterfaceDecl) d);
            } else if (d instanceof ImplementationDecl) {
                implementations.put(d.getName(), (ImplementationDecl) d);
            }
        }
    }

    public String getFileName() { return fileName; }
    public boolean isArc() { return arc; }

    public List<Declaration> getDeclarations() {
        return Collections.unmodifiableList(declarations);
    }

    public InterfaceDecl getInterface(String name) {
        return name == null ? null : interfaces.get(name);
    }

    public ImplementationDecl getImplementation(String name) {
        return name == null ? null : implementations.get(name);
    }

    public List<InterfaceDecl> getInterfaces() {
        return new ArrayList<>(interfaces.values());
    }

    public List<ImplementationDecl> getImplementations() {
        return new ArrayList<>(implementations.values());
    }

    /** 解析阶段为没有 @interface 的实现补上隐式接口声明 */
    public void addImplicitInterface(InterfaceDecl decl) {
        interfaces.put(decl.getName(), decl);
        declarations.add(0, decl);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTranslationUnit(this, context);
    }
}
