package com.dangle.cli;

import com.dangle.checkers.CheckerRegistry;
import com.dangle.engine.AnalyzerOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Dangle CLI 入口点（picocli）
 */
@Command(name = "dangle", version = "Dangle v0.1.0",
         mixinStandardHelpOptions = true,
         description = "查找释放前未清空的指向 self 的非持有引用")
public class Main implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FINDINGS = 1;
    static final int EXIT_ERROR = 2;

    @Spec
    CommandSpec spec;

    @Option(names = "--format", defaultValue = "text", description = "输出格式（text, json）")
    String format;

    @Option(names = "--arc", negatable = true, description = "覆盖编译单元中的 ARC 设置")
    Boolean arc;

    @Option(names = "--no-inline", description = "不内联发给 self/super 的消息")
    boolean noInline;

    @Option(names = "--max-inline-depth", defaultValue = "4", description = "最大内联深度（默认 4）")
    int maxInlineDepth;

    @Option(names = "--max-paths", defaultValue = "256", description = "每个方法最多保留的路径数（默认 256）")
    int maxPaths;

    @Option(names = "--checker", description = "启用的检查器（可重复，默认全部）")
    List<String> checkers = new ArrayList<>();

    @Option(names = "--list-checkers", description = "列出已注册的检查器")
    boolean listCheckers;

    @Option(names = "--fail-on-findings", description = "有报告时以状态 1 退出")
    boolean failOnFindings;

    @Parameters(description = "编译单元 JSON 文件")
    List<Path> files = new ArrayList<>();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (listCheckers) {
            for (CheckerRegistry.Entry entry : CheckerRegistry.entries()) {
                out.println(entry.getName() + "  " + entry.getDescription());
            }
            return EXIT_OK;
        }
        if (files.isEmpty()) {
            err.println("错误: 未指定编译单元文件");
            return EXIT_ERROR;
        }

        ReportWriter writer;
        switch (format.toLowerCase()) {
            case "text": writer = ReportWriter.text(out); break;
            case "json": writer = ReportWriter.json(out); break;
            default:
                err.println("错误: 未知输出格式 '" + format + "'（可选: text, json）");
                return EXIT_ERROR;
        }
        for (String name : checkers) {
            if (!CheckerRegistry.has(name)) {
                err.println("错误: 未知检查器 '" + name + "'（使用 --list-checkers 查看）");
                return EXIT_ERROR;
            }
        }

        AnalyzeRunner runner = new AnalyzeRunner(buildOptions(), arc, checkers, err);
        AnalyzeRunner.Result result = runner.run(files);
        writer.write(result.getUnits());

        if (result.hasErrors()) return EXIT_ERROR;
        if (failOnFindings && result.getTotalReports() > 0) return EXIT_FINDINGS;
        return EXIT_OK;
    }

    AnalyzerOptions buildOptions() {
        AnalyzerOptions options = new AnalyzerOptions();
        options.setInlineMethods(!noInline);
        options.setMaxInlineDepth(maxInlineDepth);
        options.setMaxPathsPerFunction(maxPaths);
        return options;
    }

    public static void main(String[] args) {
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main());
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(new CommandLine(new Main()).execute(args));
        }
    }

    /**
     * 控制台实际使用的字符编码名，native.encoding 反映操作系统原生编码
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
