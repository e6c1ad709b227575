package com.dangle.ast.stmt;

import com.dangle.ast.AstNode;
import com.dangle.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
