package com.dangle.cli;

import com.dangle.ast.decl.TranslationUnit;
import com.dangle.ast.json.AstFormatException;
import com.dangle.ast.json.AstJsonReader;
import com.dangle.ast.sema.ResolveException;
import com.dangle.ast.sema.Resolver;
import com.dangle.checkers.CheckerRegistry;
import com.dangle.engine.AnalysisDriver;
import com.dangle.engine.AnalyzerOptions;
import com.dangle.engine.LangOptions;
import com.dangle.engine.report.BugReport;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 分析执行器：逐个读取、解析并分析编译单元。
 *
 * <p>单个文件出错不会中断其余文件，错误写到 err 并计入结果。</p>
 */
public class AnalyzeRunner {
    private static final Logger LOG = Logger.getLogger(AnalyzeRunner.class.getName());

    private final AnalyzerOptions options;
    private final Boolean arcOverride;
    private final List<String> checkerNames;
    private final PrintWriter err;

    /**
     * @param arcOverride 非 null 时覆盖编译单元自身的 arc 设置
     * @param checkerNames 启用的检查器名，空表示全部
     */
    public AnalyzeRunner(AnalyzerOptions options, Boolean arcOverride, List<String> checkerNames, PrintWriter err) {
        this.options = options;
        this.arcOverride = arcOverride;
        this.checkerNames = checkerNames;
        this.err = err;
    }

    public Result run(List<Path> files) {
        AnalysisDriver driver = new AnalysisDriver(options);
        List<UnitResult> units = new ArrayList<>();
        int errors = 0;
        for (Path file : files) {
            if (!Files.exists(file)) {
                err.println("错误: 文件不存在 - " + file);
                errors++;
                continue;
            }
            try {
                units.add(analyze(driver, file));
            } catch (AstFormatException | ResolveException e) {
                LOG.warning("无法分析 " + file + ": " + e.getMessage());
                LOG.log(Level.FINE, "详细原因", e);
                err.println("错误: " + file + ": " + e.getMessage());
                errors++;
            } catch (IOException e) {
                LOG.log(Level.WARNING, "无法读取 " + file, e);
                err.println("错误: 无法读取 " + file + " - " + e.getMessage());
                errors++;
            }
        }
        return new Result(units, errors);
    }

    UnitResult analyze(AnalysisDriver driver, Path file) throws IOException {
        TranslationUnit unit = Resolver.resolve(AstJsonReader.read(file));
        LangOptions lang = new LangOptions(arcOverride != null ? arcOverride : unit.isArc());
        List<BugReport> reports = driver.analyze(unit, lang, CheckerRegistry.createAll(checkerNames));
        return new UnitResult(unit.getFileName(), lang.isArc(), reports);
    }

    /** 单个编译单元的分析结果 */
    public static final class UnitResult {
        private final String fileName;
        private final boolean arc;
        private final List<BugReport> reports;

        public UnitResult(String fileName, boolean arc, List<BugReport> reports) {
            this.fileName = fileName;
            this.arc = arc;
            this.reports = Collections.unmodifiableList(new ArrayList<>(reports));
        }

        public String getFileName() { return fileName; }
        public boolean isArc() { return arc; }
        public List<BugReport> getReports() { return reports; }
    }

    public static final class Result {
        private final List<UnitResult> units;
        private final int errorCount;

        Result(List<UnitResult> units, int errorCount) {
            this.units = Collections.unmodifiableList(units);
            this.errorCount = errorCount;
        }

        public List<UnitResult> getUnits() { return units; }

        public boolean hasErrors() { return errorCount > 0; }

        public int getTotalReports() {
            int total = 0;
            for (UnitResult unit : units) {
                total += unit.getReports().size();
            }
            return total;
        }
    }
}
