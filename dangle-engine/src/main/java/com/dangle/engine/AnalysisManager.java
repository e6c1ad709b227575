package com.dangle.engine;

import com.dangle.ast.decl.TranslationUnit;

/**
 * 单个编译单元的分析上下文
 */
public class AnalysisManager {
    private final TranslationUnit unit;
    private final LangOptions langOptions;
    private final AnalyzerOptions analyzerOptions;

    public AnalysisManager(TranslationUnit unit, LangOptions langOptions, AnalyzerOptions analyzerOptions) {
        this.unit = unit;
        this.langOptions = langOptions;
        this.analyzerOptions = analyzerOptions;
    }

    public TranslationUnit getTranslationUnit() { return unit; }
    public LangOptions getLangOptions() { return langOptions; }
    public AnalyzerOptions getAnalyzerOptions() { return analyzerOptions; }
}
