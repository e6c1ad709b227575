package com.dangle.engine.checker;

import com.dangle.ast.decl.TranslationUnit;
import com.dangle.engine.AnalysisManager;
import com.dangle.engine.report.BugReporter;

/**
 * 编译单元分析完成时回调
 */
public interface EndOfTranslationUnitCheck extends Checker {
    void checkEndOfTranslationUnit(TranslationUnit unit, AnalysisManager manager, BugReporter reporter);
}
