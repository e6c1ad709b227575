package com.dangle.ast.decl;

import com.dangle.ast.AstNode;
import com.dangle.ast.SourceLocation;

/**
 * 声明基类
 */
public abstract class Declaration extends AstNode {
    protected final String name;

    protected Declaration(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
