package com.dangle.checkers.dangling;

import com.dangle.ast.decl.FieldDecl;
import com.dangle.ast.decl.InterfaceDecl;
import com.dangle.ast.decl.TranslationUnit;
import com.dangle.engine.AnalysisDriver;
import com.dangle.engine.AnalyzerOptions;
import com.dangle.engine.CheckerContext;
import com.dangle.engine.LangOptions;
import com.dangle.engine.checker.EndFunctionCheck;
import com.dangle.engine.report.BugReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.dangle.checkers.dangling.UnitBuilder.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("DanglingDelegateChecker 测试")
class DanglingDelegateCheckerTest {

    private static final String WIRE = method("wire", expr(msg(W, "setDelegate:", SELF)));
    private static final String W_DELEGATE = prop(W, "delegate");

    private AnalyzerOptions options;

    @BeforeEach
    void setUp() {
        options = new AnalyzerOptions();
    }

    private List<BugReport> analyze(TranslationUnit unit) {
        return analyze(unit, new DanglingDelegateChecker());
    }

    private List<BugReport> analyze(TranslationUnit unit, DanglingDelegateChecker checker) {
        return new AnalysisDriver(options).analyze(unit, new LangOptions(unit.isArc()),
                Collections.singletonList(checker));
    }

    // ============ 典型场景 ============

    @Nested
    @DisplayName("典型场景")
    class ScenarioTests {

        @Test
        @DisplayName("在一个方法中写入 self，另一个方法释放而未清除")
        void testReleaseWithoutClearing() {
            List<BugReport> reports = analyze(owner(false, WIRE,
                    method("drop", expr(msgAt(30, W, "release")))));

            assertThat(reports).hasSize(1);
            BugReport report = reports.get(0);
            assertThat(report.getDeclaration()).isEqualTo("-[Owner drop]");
            assertThat(report.getLocation().getLine()).isEqualTo(30);
            assertThat(report.getLocation().getFile()).isEqualTo("Owner.m");
            assertThat(report.getDescription())
                    .startsWith("Leaking unsafe reference to self stored in _w.delegate. ")
                    .contains("instance of Worker");
            assertThat(report.getBugType().getCheckerName()).isEqualTo(DanglingDelegateChecker.NAME);
            assertThat(report.getBugType().getCategory()).isEqualTo("Memory error");
        }

        @Test
        @DisplayName("释放前用 setter 写入非 self 值")
        void testClearedBySetter() {
            List<BugReport> reports = analyze(owner(false, WIRE,
                    method("drop", expr(msg(W, "setDelegate:", NIL)), expr(msg(W, "release")))));
            assertThat(reports).isEmpty();
        }

        @Test
        @DisplayName("释放前用点语法清除")
        void testClearedByDotSyntax() {
            List<BugReport> reports = analyze(owner(false, WIRE,
                    method("drop", expr(assign(W_DELEGATE, NIL)), expr(msg(W, "autorelease")))));
            assertThat(reports).isEmpty();
        }

        @Test
        @DisplayName("if (_w.delegate == self) 内清除后释放")
        void testClearedInsideEqualityGuard() {
            List<BugReport> reports = analyze(owner(false, WIRE,
                    method("drop",
                            ifStmt(binary("==", W_DELEGATE, SELF), expr(assign(W_DELEGATE, NIL))),
                            expr(msg(W, "release")))));
            assertThat(reports).isEmpty();
        }

        @Test
        @DisplayName("实例变量先置为 nil 再释放")
        void testFieldResetToNil() {
            List<BugReport> reports = analyze(owner(false, WIRE,
                    method("drop", expr(assign(W, NIL)), expr(msg(W, "release")))));
            assertThat(reports).isEmpty();
        }

        @Test
        @DisplayName("伪构造方法中写入 self 后释放仍然报告")
        void testPseudoConstructorStoresThenReleases() {
            List<BugReport> reports = analyze(owner(false,
                    method("setupAgain", expr(msg(W, "setDelegate:", SELF)), expr(msg(W, "release")))));

            assertThat(reports).hasSize(1);
            assertThat(reports.get(0).getDeclaration()).isEqualTo("-[Owner setupAgain]");
        }
    }

    // ============ 路径状态 ============

    @Nested
    @DisplayName("路径状态")
    class PathStateTests {

        @Test
        @DisplayName("伪构造方法开始时全部字段视为已清除")
        void testPseudoConstructorSeeding() {
            List<BugReport> reports = analyze(owner(false, WIRE,
                    method("setupWorker", expr(msg(W, "release"))),
                    method("dropWorker", expr(msg(W, "release")))));

            assertThat(reports).extracting(BugReport::getDeclaration).containsExactly("-[Owner dropWorker]");
        }

        @Test
        @DisplayName("清除后再次写入 self 恢复为危险")
        void testReactivation() {
            List<BugReport> reports = analyze(owner(false,
                    method("cycle",
                            expr(assign(W_DELEGATE, NIL)),
                            expr(msg(W, "setDelegate:", SELF)),
                            expr(msg(W, "release")))));
            assertThat(reports).hasSize(1);
        }

        @Test
        @DisplayName("断言 _w.delegate != self 后不再报告")
        void testNotEqualSelfAssert() {
            List<BugReport> reports = analyze(owner(false, WIRE,
                    method("drop", assertStmt(binary("!=", W_DELEGATE, SELF)), expr(msg(W, "release")))));
            assertThat(reports).isEmpty();
        }

        @Test
        @DisplayName("self 在左侧同样识别")
        void testNotEqualSelfReversedOperands() {
            List<BugReport> reports = analyze(owner(false, WIRE,
                    method("drop", assertStmt(binary("!=", SELF, W_DELEGATE)), expr(msg(W, "release")))));
            assertThat(reports).isEmpty();
        }

        @Test
        @DisplayName("条件结论延续到受保护代码块之外")
        void testBranchConclusionOutlivesBlock() {
            List<BugReport> reports = analyze(owner(false, WIRE,
                    method("drop",
                            ifStmt(binary("!=", W_DELEGATE, SELF), expr(msg(W, "run"))),
                            expr(msg(W, "release")))));
            // 只有 _w.delegate == self 的路径报告
            assertThat(reports).hasSize(1);
        }

        @Test
        @DisplayName("_w.delegate == nil 为真时清除该属性")
        void testPropertyEqualNil() {
            List<BugReport> reports = analyze(owner(false, WIRE,
                    method("drop", assertStmt(binary("==", W_DELEGATE, NIL)), expr(msg(W, "release")))));
            assertThat(reports).isEmpty();
        }

        @Test
        @DisplayName("self.w == nil 为真时整个字段视为已清除")
        void testFieldEqualNil() {
            List<BugReport> reports = analyze(owner(false, WIRE,
                    method("drop", ifStmt(binary("==", prop(SELF, "w"), NIL), expr(msg(W, "release"))))));
            assertThat(reports).isEmpty();
        }

        @Test
        @DisplayName("self.w != nil 为真时没有结论")
        void testFieldNotEqualNil() {
            List<BugReport> reports = analyze(owner(false, WIRE,
                    method("drop", ifStmt(binary("!=", prop(SELF, "w"), NIL), expr(msg(W, "release"))))));
            assertThat(reports).hasSize(1);
        }

        @Test
        @DisplayName("其他对象上的调用不影响状态")
        void testUnrelatedCalls() {
            List<BugReport> reports = analyze(owner(false, WIRE,
                    method("drop",
                            expr(msg(SPARE, "setDelegate:", NIL)),
                            expr(msg(W, "run")),
                            expr(msg(W, "release")))));
            assertThat(reports).hasSize(1);
        }
    }

    // ============ 释放点 ============

    @Nested
    @DisplayName("释放点")
    class ReleaseSiteTests {

        @Test
        @DisplayName("ARC 下旧值确定为 nil 的写入不核对")
        void testNullGuardOnWrite() {
            List<BugReport> reports = analyze(owner(true, WIRE,
                    method("dealloc", expr(assign(W_DELEGATE, NIL))),
                    method("replace",
                            expr(assignAt(30, W, NIL)),
                            expr(assignAt(31, W, classMsg("Worker", "new"))))));

            assertThat(reports).hasSize(1);
            assertThat(reports.get(0).getLocation().getLine()).isEqualTo(30);
        }

        @Test
        @DisplayName("MRC 下直接写入实例变量不核对")
        void testNoWriteCheckUnderMrc() {
            List<BugReport> reports = analyze(owner(false, WIRE,
                    method("replace", expr(assign(W, classMsg("Worker", "new"))))));
            assertThat(reports).isEmpty();
        }

        @Test
        @DisplayName("通过 self 的合成 setter 替换字段时核对旧值")
        void testSelfSetterReplacesField() {
            List<BugReport> reports = analyze(owner(false, WIRE,
                    method("drop", expr(assignAt(30, prop(SELF, "w"), NIL)))));

            assertThat(reports).hasSize(1);
            assertThat(reports.get(0).getLocation().getLine()).isEqualTo(30);
        }

        @Test
        @DisplayName("setter 置 nil 之后字段完全清除")
        void testSelfSetterNilClearsField() {
            List<BugReport> reports = analyze(owner(false, WIRE,
                    method("drop",
                            expr(assign(W_DELEGATE, NIL)),
                            expr(assign(prop(SELF, "w"), NIL)),
                            expr(msg(prop(SELF, "w"), "release")))));
            assertThat(reports).isEmpty();
        }

        @Test
        @DisplayName("内联的方法中清除")
        void testClearedInInlinedMethod() {
            String clear = method("clear", expr(assign(W_DELEGATE, NIL)));
            String drop = method("drop", expr(msg(SELF, "clear")), expr(msg(W, "release")));

            assertThat(analyze(owner(false, WIRE, clear, drop))).isEmpty();

            options.setInlineMethods(false);
            assertThat(analyze(owner(false, WIRE, clear, drop))).hasSize(1);
        }
    }

    // ============ ARC ============

    @Nested
    @DisplayName("ARC 析构")
    class ArcTeardownTests {

        @Test
        @DisplayName("没有显式 dealloc 时在类实现处报告")
        void testGeneratedDealloc() {
            List<BugReport> reports = analyze(owner(true, WIRE));

            assertThat(reports).hasSize(1);
            BugReport report = reports.get(0);
            assertThat(report.getDeclaration()).isEqualTo("Owner");
            assertThat(report.getLocation().getLine()).isEqualTo(20);
            assertThat(report.getDescription()).contains("_w.delegate (in ARC-generated dealloc)");
        }

        @Test
        @DisplayName("dealloc 结束时仍未清除")
        void testDeallocExit() {
            List<BugReport> reports = analyze(owner(true, WIRE, method("dealloc", expr(msg(W, "run")))));

            assertThat(reports).hasSize(1);
            BugReport report = reports.get(0);
            assertThat(report.getDeclaration()).isEqualTo("-[Owner dealloc]");
            assertThat(report.getLocation().getLine()).isEqualTo(21);
            assertThat(report.getDescription()).contains("_w.delegate (in ARC-generated code)");
        }

        @Test
        @DisplayName("dealloc 中清除后不报告")
        void testDeallocClears() {
            List<BugReport> reports = analyze(owner(true, WIRE, method("dealloc", expr(assign(W_DELEGATE, NIL)))));
            assertThat(reports).isEmpty();
        }

        @Test
        @DisplayName("MRC 下缺少 dealloc 不报告")
        void testMrcWithoutDealloc() {
            assertThat(analyze(owner(false, WIRE))).isEmpty();
        }
    }

    // ============ 编译单元 ============

    @Nested
    @DisplayName("编译单元隔离")
    class UnitIsolationTests {

        @Test
        @DisplayName("同名类的事实不跨编译单元")
        void testFactsClearedBetweenUnits() {
            DanglingDelegateChecker checker = new DanglingDelegateChecker();

            List<BugReport> first = analyze(owner("A.m", true, WIRE,
                    method("dealloc", expr(assign(W_DELEGATE, NIL)))), checker);
            assertThat(first).isEmpty();
            assertThat(checker.getFactStore().size()).isZero();

            List<BugReport> second = analyze(owner("B.m", true, WIRE), checker);
            assertThat(second).hasSize(1);
            assertThat(second.get(0).getLocation().getFile()).isEqualTo("B.m");
        }

        @Test
        @DisplayName("没有实现的类没有值得关注的字段")
        void testMissingFacts() {
            TranslationUnit unit = owner(false);
            List<BugReport> reports = analyze(unit);
            assertThat(reports).isEmpty();
        }
    }

    // ============ 调用效果 ============

    /** 记录指定方法每条路径结束时的清除状态 */
    static final class ClearanceRecorder implements EndFunctionCheck {
        private final String selector;
        final List<ClearanceMap> seen = new ArrayList<>();

        ClearanceRecorder(String selector) {
            this.selector = selector;
        }

        @Override
        public void checkEndFunction(CheckerContext context) {
            if (selector.equals(context.getStackFrame().getMethod().getSelector())) {
                seen.add(context.getState().get(DanglingDelegateChecker.FIELD_CLEARANCE));
            }
        }
    }

    @Nested
    @DisplayName("调用效果")
    class CallEffectTests {

        private ClearanceRecorder recorder;
        private TranslationUnit unit;

        private ClearanceMap detach(String... stmts) {
            unit = owner(false, WIRE, method("detach", stmts));
            recorder = new ClearanceRecorder("detach");
            List<BugReport> reports = new AnalysisDriver(options).analyze(unit, new LangOptions(false),
                    Arrays.asList(new DanglingDelegateChecker(), recorder));
            assertThat(reports).isEmpty();
            assertThat(recorder.seen).hasSize(1);
            return recorder.seen.get(0);
        }

        private FieldDecl ivar(String name) {
            InterfaceDecl owner = unit.getInterface("Owner");
            return "_w".equals(name) ? owner.findProperty("w").getIvarDecl() : owner.findIvar(name);
        }

        @Test
        @DisplayName("removeTarget:self 标记 target 已清除")
        void testRemoveTargetSelf() {
            ClearanceMap clearance = detach(expr(msg(W, "removeTarget:action:forControlEvents:", SELF, NIL, NIL)));

            ClearanceRecord record = clearance.get(ivar("_w"));
            assertThat(record.isTargetCleared()).isTrue();
            assertThat(record.isObserverCleared()).isFalse();
            assertThat(record.getClearedProperties()).isEmpty();
        }

        @Test
        @DisplayName("removeObserver:self 标记 observer 已清除")
        void testRemoveObserverSelf() {
            ClearanceMap clearance = detach(expr(msg(W, "removeObserver:forKeyPath:", SELF, NIL)));

            ClearanceRecord record = clearance.get(ivar("_w"));
            assertThat(record.isObserverCleared()).isTrue();
            assertThat(record.isTargetCleared()).isFalse();
        }

        @Test
        @DisplayName("实参不是 self 时状态不变")
        void testRemoveWithOtherArgument() {
            ClearanceMap clearance = detach(
                    expr(msg(W, "removeTarget:action:forControlEvents:", SPARE, NIL, NIL)),
                    expr(msg(W, "removeObserver:forKeyPath:", NIL, NIL)));

            assertThat(clearance.contains(ivar("_w"))).isFalse();
            assertThat(clearance.get(ivar("_w"))).isEqualTo(ClearanceRecord.EMPTY);
        }

        @Test
        @DisplayName("接收者不是值得关注的字段时状态不变")
        void testUninterestingReceiver() {
            ClearanceMap clearance = detach(
                    expr(msg(SPARE, "removeTarget:action:forControlEvents:", SELF, NIL, NIL)),
                    expr(msg(SPARE, "removeObserver:forKeyPath:", SELF, NIL)));

            assertThat(clearance.contains(ivar("_spare"))).isFalse();
            assertThat(clearance.size()).isZero();
        }
    }
}
