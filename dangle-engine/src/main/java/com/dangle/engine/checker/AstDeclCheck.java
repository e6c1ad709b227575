package com.dangle.engine.checker;

import com.dangle.ast.decl.ImplementationDecl;
import com.dangle.engine.AnalysisManager;
import com.dangle.engine.report.BugReporter;

/**
 * 类实现声明可用时回调（路径探索开始之前）
 */
public interface AstDeclCheck extends Checker {
    void checkAstDecl(ImplementationDecl impl, AnalysisManager manager, BugReporter reporter);
}
