package com.dangle.engine.checker;

import com.dangle.ast.AstNode;
import com.dangle.engine.CheckerContext;

/**
 * 语句/表达式求值前回调：子表达式已求值，节点自身的效果尚未发生
 */
public interface PreStmtCheck extends Checker {
    void checkPreStmt(AstNode stmt, CheckerContext context);
}
