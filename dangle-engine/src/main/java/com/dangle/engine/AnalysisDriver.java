package com.dangle.engine;

import com.dangle.ast.decl.ImplementationDecl;
import com.dangle.ast.decl.MethodDecl;
import com.dangle.ast.decl.TranslationUnit;
import com.dangle.engine.checker.Checker;
import com.dangle.engine.report.BugReport;
import com.dangle.engine.report.BugReporter;

import java.util.List;
import java.util.logging.Logger;

/**
 * 单个编译单元的分析流程：
 * <ol>
 *   <li>对每个 @implementation 运行声明级检查</li>
 *   <li>把每个有方法体的方法作为顶层入口做路径探索</li>
 *   <li>运行编译单元结束检查</li>
 * </ol>
 * 每次调用使用独立的检查器实例与报告集合，不同编译单元之间不共享状态。
 */
public class AnalysisDriver {
    private static final Logger LOG = Logger.getLogger(AnalysisDriver.class.getName());

    private final AnalyzerOptions options;

    public AnalysisDriver(AnalyzerOptions options) {
        this.options = options;
    }

    public List<BugReport> analyze(TranslationUnit unit, LangOptions langOptions, List<? extends Checker> checkers) {
        CheckerManager checkerManager = new CheckerManager();
        for (Checker checker : checkers) {
            checkerManager.registerChecker(checker);
        }
        BugReporter reporter = new BugReporter();
        AnalysisManager manager = new AnalysisManager(unit, langOptions, options);

        LOG.fine(() -> "开始分析 " + unit.getFileName() + (langOptions.isArc() ? " (ARC)" : " (MRC)"));
        for (ImplementationDecl impl : unit.getImplementations()) {
            checkerManager.runCheckersForAstDecl(impl, manager, reporter);
        }

        ExprEngine engine = new ExprEngine(manager, checkerManager, reporter);
        for (ImplementationDecl impl : unit.getImplementations()) {
            for (MethodDecl method : impl.getMethods()) {
                if (!method.hasBody()) continue;
                engine.analyzeTopLevel(method, impl.getClassInterface());
            }
        }

        checkerManager.runCheckersForEndOfTranslationUnit(unit, manager, reporter);
        LOG.fine(() -> unit.getFileName() + ": " + reporter.getReports().size() + " 条报告");
        return reporter.getReports();
    }
}
