package com.dangle.engine;

import com.dangle.ast.decl.FieldDecl;
import com.dangle.engine.report.BugReport;
import com.dangle.engine.sval.SVal;

/**
 * 检查器回调的上下文：当前路径状态、栈帧以及报告出口。
 *
 * <p>{@link #addTransition} 用新状态替换当前状态，回调返回后引擎沿新状态继续。</p>
 */
public final class CheckerContext {
    private final ExprEngine engine;
    private final StackFrame frame;
    private final boolean wasInlined;
    private ProgramState state;

    CheckerContext(ExprEngine engine, ProgramState state, StackFrame frame, boolean wasInlined) {
        this.engine = engine;
        this.state = state;
        this.frame = frame;
        this.wasInlined = wasInlined;
    }

    public ProgramState getState() {
        return state;
    }

    public void addTransition(ProgramState newState) {
        this.state = newState;
    }

    public StackFrame getStackFrame() {
        return frame;
    }

    /** 刚结束的调用是否被内联分析过（仅 post-message 回调有意义） */
    public boolean wasInlined() {
        return wasInlined;
    }

    public LangOptions getLangOptions() {
        return engine.getAnalysisManager().getLangOptions();
    }

    public AnalysisManager getAnalysisManager() {
        return engine.getAnalysisManager();
    }

    public ConstraintManager getConstraintManager() {
        return engine.getConstraintManager();
    }

    /** 当前路径上 self 的实例变量的值 */
    public SVal getIvarValue(FieldDecl field) {
        return engine.getIvarValue(state, field);
    }

    public void emitReport(BugReport report) {
        engine.getBugReporter().emitReport(report);
    }
}
