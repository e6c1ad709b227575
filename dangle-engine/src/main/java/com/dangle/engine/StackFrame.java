package com.dangle.engine;

import com.dangle.ast.decl.InterfaceDecl;
import com.dangle.ast.decl.MethodDecl;

/**
 * 调用栈帧：顶层分析的方法或被内联的方法
 */
public final class StackFrame {
    private final MethodDecl method;
    private final InterfaceDecl classInterface;
    private final StackFrame parent;
    private final int depth;

    public StackFrame(MethodDecl method, InterfaceDecl classInterface, StackFrame parent) {
        this.method = method;
        this.classInterface = classInterface;
        this.parent = parent;
        this.depth = parent == null ? 0 : parent.depth + 1;
    }

    public MethodDecl getMethod() { return method; }

    /** 方法所属类的接口声明 */
    public InterfaceDecl getClassInterface() { return classInterface; }

    public StackFrame getParent() { return parent; }

    public int getDepth() { return depth; }

    public StackFrame getTopFrame() {
        StackFrame f = this;
        while (f.parent != null) f = f.parent;
        return f;
    }

    /** 调用栈上是否已有该方法（防止递归内联） */
    public boolean isOnStack(MethodDecl m) {
        for (StackFrame f = this; f != null; f = f.parent) {
            if (f.method == m) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return method + "@" + depth;
    }
}
