package com.dangle.engine;

import com.dangle.ast.AstNode;
import com.dangle.ast.decl.ImplementationDecl;
import com.dangle.ast.decl.TranslationUnit;
import com.dangle.engine.checker.*;
import com.dangle.engine.report.BugReporter;
import com.dangle.engine.sval.SVal;

import java.util.ArrayList;
import java.util.List;

/**
 * 按事件类型分发检查器回调，依注册顺序串联各检查器产生的状态
 */
public class CheckerManager {
    private final List<AstDeclCheck> astDeclChecks = new ArrayList<>();
    private final List<PreStmtCheck> preStmtChecks = new ArrayList<>();
    private final List<PostObjCMessageCheck> postMessageChecks = new ArrayList<>();
    private final List<EndFunctionCheck> endFunctionChecks = new ArrayList<>();
    private final List<EvalAssumeCheck> evalAssumeChecks = new ArrayList<>();
    private final List<EndOfTranslationUnitCheck> endOfUnitChecks = new ArrayList<>();

    public void registerChecker(Checker checker) {
        if (checker instanceof AstDeclCheck) astDeclChecks.add((AstDeclCheck) checker);
        if (checker instanceof PreStmtCheck) preStmtChecks.add((PreStmtCheck) checker);
        if (checker instanceof PostObjCMessageCheck) postMessageChecks.add((PostObjCMessageCheck) checker);
        if (checker instanceof EndFunctionCheck) endFunctionChecks.add((EndFunctionCheck) checker);
        if (checker instanceof EvalAssumeCheck) evalAssumeChecks.add((EvalAssumeCheck) checker);
        if (checker instanceof EndOfTranslationUnitCheck) endOfUnitChecks.add((EndOfTranslationUnitCheck) checker);
    }

    public void runCheckersForAstDecl(ImplementationDecl impl, AnalysisManager manager, BugReporter reporter) {
        for (AstDeclCheck c : astDeclChecks) {
            c.checkAstDecl(impl, manager, reporter);
        }
    }

    public void runCheckersForEndOfTranslationUnit(TranslationUnit unit, AnalysisManager manager,
                                                   BugReporter reporter) {
        for (EndOfTranslationUnitCheck c : endOfUnitChecks) {
            c.checkEndOfTranslationUnit(unit, manager, reporter);
        }
    }

    ProgramState runCheckersForPreStmt(ExprEngine engine, AstNode node, ProgramState state, StackFrame frame) {
        for (PreStmtCheck c : preStmtChecks) {
            CheckerContext ctx = new CheckerContext(engine, state, frame, false);
            c.checkPreStmt(node, ctx);
            state = ctx.getState();
        }
        return state;
    }

    ProgramState runCheckersForPostObjCMessage(ExprEngine engine, ObjCMethodCall call, ProgramState state,
                                               StackFrame frame, boolean wasInlined) {
        for (PostObjCMessageCheck c : postMessageChecks) {
            CheckerContext ctx = new CheckerContext(engine, state, frame, wasInlined);
            c.checkPostObjCMessage(call, ctx);
            state = ctx.getState();
        }
        return state;
    }

    ProgramState runCheckersForEndFunction(ExprEngine engine, ProgramState state, StackFrame frame) {
        for (EndFunctionCheck c : endFunctionChecks) {
            CheckerContext ctx = new CheckerContext(engine, state, frame, false);
            c.checkEndFunction(ctx);
            state = ctx.getState();
        }
        return state;
    }

    /** 返回 null 表示某个检查器判定该假设不可行 */
    ProgramState runCheckersForEvalAssume(ProgramState state, SVal cond, boolean assumption) {
        for (EvalAssumeCheck c : evalAssumeChecks) {
            state = c.evalAssume(state, cond, assumption);
            if (state == null) return null;
        }
        return state;
    }
}
