package com.dangle.cli;

import com.dangle.engine.AnalyzerOptions;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.*;

@DisplayName("命令行测试")
class MainTest {

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private static String fixture(String name) throws URISyntaxException {
        Path path = Paths.get(MainTest.class.getResource("/units/" + name).toURI());
        return path.toString();
    }

    @Nested
    @DisplayName("文本输出")
    class TextOutputTests {

        @Test
        @DisplayName("编译器诊断格式与汇总")
        void testTextReport() throws Exception {
            int code = run(fixture("owner_bad.json"));

            assertThat(code).isEqualTo(Main.EXIT_OK);
            assertThat(out.toString())
                    .contains("Owner.m:19:3: warning: Leaking unsafe reference to self stored in _worker.delegate. ")
                    .contains("[memory.DanglingDelegate]")
                    .contains("1 warning in 1 unit.");
        }

        @Test
        @DisplayName("没有报告")
        void testCleanUnit() throws Exception {
            int code = run("--fail-on-findings", fixture("owner_ok.json"));

            assertThat(code).isEqualTo(Main.EXIT_OK);
            assertThat(out.toString()).contains("0 warnings in 1 unit.");
        }

        @Test
        @DisplayName("--fail-on-findings 有报告时返回 1")
        void testFailOnFindings() throws Exception {
            int code = run("--fail-on-findings", fixture("owner_bad.json"), fixture("owner_ok.json"));

            assertThat(code).isEqualTo(Main.EXIT_FINDINGS);
            assertThat(out.toString()).contains("1 warning in 2 units.");
        }

        @Test
        @DisplayName("列出检查器")
        void testListCheckers() {
            assertThat(run("--list-checkers")).isEqualTo(Main.EXIT_OK);
            assertThat(out.toString()).startsWith("memory.DanglingDelegate  ");
        }
    }

    @Nested
    @DisplayName("JSON 输出")
    class JsonOutputTests {

        @Test
        @DisplayName("报告字段")
        void testJsonReport() throws Exception {
            int code = run("--format", "json", fixture("owner_bad.json"));

            assertThat(code).isEqualTo(Main.EXIT_OK);
            JsonObject root = JsonParser.parseString(out.toString()).getAsJsonObject();
            assertThat(root.get("total").getAsInt()).isEqualTo(1);

            JsonObject unit = root.getAsJsonArray("units").get(0).getAsJsonObject();
            assertThat(unit.get("file").getAsString()).isEqualTo("Owner.m");
            assertThat(unit.get("arc").getAsBoolean()).isFalse();

            JsonObject report = unit.getAsJsonArray("reports").get(0).getAsJsonObject();
            assertThat(report.get("checker").getAsString()).isEqualTo("memory.DanglingDelegate");
            assertThat(report.get("bugType").getAsString()).isEqualTo("Leaking unsafe reference to self");
            assertThat(report.get("category").getAsString()).isEqualTo("Memory error");
            assertThat(report.get("line").getAsInt()).isEqualTo(19);
            assertThat(report.get("column").getAsInt()).isEqualTo(3);
            assertThat(report.get("declaration").getAsString()).isEqualTo("-[Owner drop]");
        }

        @Test
        @DisplayName("--arc 覆盖编译单元设置")
        void testArcOverride() throws Exception {
            run("--format", "json", "--arc", fixture("owner_bad.json"));

            JsonObject root = JsonParser.parseString(out.toString()).getAsJsonObject();
            JsonObject unit = root.getAsJsonArray("units").get(0).getAsJsonObject();
            assertThat(unit.get("arc").getAsBoolean()).isTrue();

            // ARC 下缺少 dealloc 额外报告一次
            JsonArray reports = unit.getAsJsonArray("reports");
            assertThat(reports.size()).isEqualTo(2);
            assertThat(reports.get(0).getAsJsonObject().get("message").getAsString())
                    .contains("(in ARC-generated dealloc)");
        }
    }

    @Nested
    @DisplayName("错误处理")
    class ErrorTests {

        @Test
        @DisplayName("未指定文件")
        void testNoFiles() {
            assertThat(run()).isEqualTo(Main.EXIT_ERROR);
            assertThat(err.toString()).contains("未指定编译单元文件");
        }

        @Test
        @DisplayName("文件不存在")
        void testMissingFile() {
            assertThat(run("no-such-unit.json")).isEqualTo(Main.EXIT_ERROR);
            assertThat(err.toString()).contains("文件不存在 - no-such-unit.json");
        }

        @Test
        @DisplayName("格式错误的编译单元不影响其他文件")
        void testMalformedUnit() throws Exception {
            int code = run(fixture("broken.json"), fixture("owner_bad.json"));

            assertThat(code).isEqualTo(Main.EXIT_ERROR);
            assertThat(err.toString()).contains("未知声明类型 'protocol'");
            assertThat(out.toString()).contains("1 warning in 1 unit.");
        }

        @Test
        @DisplayName("字段类型错误按格式错误处理")
        void testWrongFieldType() throws Exception {
            int code = run(fixture("bad_line.json"), fixture("owner_bad.json"));

            assertThat(code).isEqualTo(Main.EXIT_ERROR);
            assertThat(err.toString()).contains("$.decls[0].line").contains("应为整数");
            assertThat(out.toString()).contains("Owner.m:19:3: warning:").contains("1 warning in 1 unit.");
        }

        @Test
        @DisplayName("未知输出格式")
        void testUnknownFormat() throws Exception {
            assertThat(run("--format", "xml", fixture("owner_ok.json"))).isEqualTo(Main.EXIT_ERROR);
            assertThat(err.toString()).contains("未知输出格式 'xml'");
        }

        @Test
        @DisplayName("未知检查器")
        void testUnknownChecker() throws Exception {
            assertThat(run("--checker", "memory.Nope", fixture("owner_ok.json"))).isEqualTo(Main.EXIT_ERROR);
            assertThat(err.toString()).contains("未知检查器 'memory.Nope'");
        }
    }

    @Test
    @DisplayName("分析选项")
    void testBuildOptions() {
        Main main = new Main();
        new CommandLine(main).parseArgs("--no-inline", "--max-inline-depth", "2", "--max-paths", "10", "a.json");
        AnalyzerOptions options = main.buildOptions();

        assertThat(options.isInlineMethods()).isFalse();
        assertThat(options.getMaxInlineDepth()).isEqualTo(2);
        assertThat(options.getMaxPathsPerFunction()).isEqualTo(10);
        assertThat(main.arc).isNull();
    }
}
