package com.dangle.checkers.dangling;

import com.dangle.ast.AstNode;
import com.dangle.ast.SourceLocation;
import com.dangle.ast.decl.*;
import com.dangle.ast.expr.AssignExpr;
import com.dangle.ast.expr.Expression;
import com.dangle.ast.expr.IvarRefExpr;
import com.dangle.ast.expr.MessageExpr;
import com.dangle.ast.type.TypeRef;
import com.dangle.engine.AnalysisManager;
import com.dangle.engine.CheckerContext;
import com.dangle.engine.ObjCMethodCall;
import com.dangle.engine.ProgramState;
import com.dangle.engine.ProgramStateTrait;
import com.dangle.engine.checker.*;
import com.dangle.engine.report.BugReport;
import com.dangle.engine.report.BugReporter;
import com.dangle.engine.report.BugType;
import com.dangle.engine.sval.SVal;

import java.util.Map;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * 检测悬空的 self 回指：self 被存进某个实例变量所指对象的 assign 属性，
 * 而在释放该实例变量之前没有清除。
 *
 * <p>两遍分析：</p>
 * <ol>
 *   <li>{@link #checkAstDecl} 用 {@link FactFinder} 收集每个类的静态事实；
 *       ARC 下没有显式 dealloc 的类直接报告全部危险属性</li>
 *   <li>路径探索中维护每个实例变量的 {@link ClearanceRecord}，在释放点核对：
 *       <ul>
 *         <li>ARC 下直接覆盖实例变量之前（旧值确定为 nil 时跳过）</li>
 *         <li>向实例变量发送 release / autorelease 之后</li>
 *         <li>通过 self 的合成 setter 替换实例变量时</li>
 *         <li>ARC 下 dealloc 结束时</li>
 *       </ul>
 *   </li>
 * </ol>
 * <p>分支条件按 {@link ConditionMatcher} 的惯用写法标记清除，结论对该路径余下部分一直有效。</p>
 */
public class DanglingDelegateChecker implements AstDeclCheck, PreStmtCheck, PostObjCMessageCheck,
        EndFunctionCheck, EvalAssumeCheck, EndOfTranslationUnitCheck {

    private static final Logger LOG = Logger.getLogger(DanglingDelegateChecker.class.getName());

    public static final String NAME = "memory.DanglingDelegate";

    static final ProgramStateTrait<ClearanceMap> FIELD_CLEARANCE =
            new ProgramStateTrait<>("FieldClearance", ClearanceMap.EMPTY);
    static final ProgramStateTrait<Boolean> INIT_STATE_WAS_SET =
            new ProgramStateTrait<>("InitStateWasSet", Boolean.FALSE);
    static final ProgramStateTrait<InterfaceDecl> CURRENT_TYPE =
            new ProgramStateTrait<>("CurrentType", null);

    private static final String ARC_DEALLOC_CONTEXT = "ARC-generated dealloc";
    private static final String ARC_CODE_CONTEXT = "ARC-generated code";

    private final BugType bugType = new BugType(NAME, DiagnosticFormatter.BUG_TYPE_NAME, DiagnosticFormatter.CATEGORY);
    private final FactStore factStore;

    public DanglingDelegateChecker() {
        this(new FactStore());
    }

    public DanglingDelegateChecker(FactStore factStore) {
        this.factStore = factStore;
    }

    public FactStore getFactStore() {
        return factStore;
    }

    public BugType getBugType() {
        return bugType;
    }

    // ============ 第一遍 ============

    @Override
    public void checkAstDecl(ImplementationDecl impl, AnalysisManager manager, BugReporter reporter) {
        TypeFacts facts = factStore.getOrCreate(impl.getName());
        FactFinder.analyzeImplementation(impl, facts);
        LOG.fine(() -> "事实收集完成: " + facts);

        // ARC 自动生成的 dealloc 不会清除任何回指
        if (!facts.hasExplicitTeardown() && manager.getLangOptions().isArc()) {
            for (Map.Entry<FieldDecl, FieldFacts> e : facts.getFields().entrySet()) {
                reportUncleared(e.getKey(), e.getValue(), ClearanceRecord.EMPTY, ARC_DEALLOC_CONTEXT,
                        impl.getLocation(), impl.getName(), reporter::emitReport);
            }
        }
    }

    @Override
    public void checkEndOfTranslationUnit(TranslationUnit unit, AnalysisManager manager, BugReporter reporter) {
        factStore.clear();
    }

    // ============ 第二遍 ============

    @Override
    public void checkEndFunction(CheckerContext context) {
        // 只有 ARC 下的 dealloc 会隐式释放实例变量
        if (!context.getLangOptions().isArc()) return;
        TypeFacts facts = currentFacts(context);
        if (facts == null) return;
        MethodDecl method = context.getStackFrame().getMethod();
        if (!"dealloc".equals(method.getSelector())) return;

        ClearanceMap clearance = context.getState().get(FIELD_CLEARANCE);
        for (Map.Entry<FieldDecl, FieldFacts> e : facts.getFields().entrySet()) {
            FieldDecl field = e.getKey();
            if (ExprMatchers.isKnownToBeNil(context.getIvarValue(field), context)) continue;
            reportUncleared(field, e.getValue(), clearance.get(field), ARC_CODE_CONTEXT,
                    method.getLocation(), describe(method), context::emitReport);
        }
    }

    @Override
    public void checkPreStmt(AstNode stmt, CheckerContext context) {
        resetInitialStateIfNeeded(context);

        // MRC 下在 release 处核对，不检查赋值
        if (!context.getLangOptions().isArc()) return;
        if (!(stmt instanceof AssignExpr)) return;
        AssignExpr assign = (AssignExpr) stmt;
        if (assign.getSetterCall() != null) return;

        Expression lhs = assign.getTarget().ignoreCasts();
        if (!(lhs instanceof IvarRefExpr)) return;
        TypeRef type = lhs.getStaticType();
        if (type == null || type.getClassName() == null) return;
        FieldDecl field = ((IvarRefExpr) lhs).getDecl();
        if (field == null) return;

        // 旧值确定为 nil，没有可泄漏的引用
        if (ExprMatchers.isKnownToBeNil(context.getIvarValue(field), context)) return;
        verify(field, assign, context);
    }

    @Override
    public void checkPostObjCMessage(ObjCMethodCall call, CheckerContext context) {
        // 内联过的调用，方法体已经在路径上分析过了
        if (context.wasInlined()) return;

        MessageExpr msg = call.getOriginExpr();
        assert msg != null : "消息调用缺少源表达式";
        if (msg == null) return;

        Expression receiver = msg.getInstanceReceiver();
        if (receiver == null) return;
        if (ExprMatchers.isKnownToBeNil(call.getReceiverSVal(), context)) return;

        TypeFacts facts = currentFacts(context);
        if (facts == null) return;

        if (ExprMatchers.isSelfExpr(receiver)) {
            PropertyDecl property = ExprMatchers.matchPropertySetter(msg);
            if (property != null) {
                checkSelfSetter(call, property, facts, context);
                return;
            }
        }

        FieldDecl field = ExprMatchers.matchFieldLValue(receiver);
        if (!facts.isInteresting(field)) return;

        CallEffect effect = CallEffect.classify(msg);
        ProgramState state = context.getState();
        ClearanceMap clearance = state.get(FIELD_CLEARANCE);
        ClearanceRecord record = clearance.get(field);
        switch (effect.getKind()) {
            case RELEASE:
                assert !effect.isArgSubject() : "release 不应带参数";
                verify(field, msg, context);
                return;
            case PROPERTY_SET:
                if (!effect.isAssignPropertySet()) return;
                String name = effect.getProperty().getName();
                record = effect.isArgSubject()
                        ? record.withoutClearedProperty(name)
                        : record.withClearedProperty(name);
                break;
            case REMOVE_TARGET:
                if (!effect.isArgSubject()) return;
                record = record.withTargetCleared();
                break;
            case REMOVE_OBSERVER:
                if (!effect.isArgSubject()) return;
                record = record.withObserverCleared();
                break;
            default:
                // 不产生新状态，避免无谓的路径复制
                return;
        }
        context.addTransition(state.set(FIELD_CLEARANCE, clearance.set(field, record)));
    }

    /**
     * 通过 self 的属性 setter 替换实例变量：没有可内联的实现时核对旧值，
     * 新值确定为 nil 时视为全部清除
     */
    private void checkSelfSetter(ObjCMethodCall call, PropertyDecl property, TypeFacts facts,
                                 CheckerContext context) {
        FieldDecl field = property.getIvarDecl();
        MethodDecl definition = call.getRuntimeDefinition();
        if (definition == null || definition.isImplicit()) {
            verify(field, call.getOriginExpr(), context);
        }
        if (facts.isInteresting(field) && ExprMatchers.isKnownToBeNil(call.getArgSVal(0), context)) {
            ProgramState state = context.getState();
            ClearanceMap clearance = state.get(FIELD_CLEARANCE);
            context.addTransition(state.set(FIELD_CLEARANCE,
                    clearance.set(field, ClearanceRecord.fullyCleared(facts.getFieldFacts(field)))));
        }
    }

    @Override
    public ProgramState evalAssume(ProgramState state, SVal cond, boolean assumption) {
        InterfaceDecl current = state.get(CURRENT_TYPE);
        TypeFacts facts = factStore.lookup(current);
        if (facts == null) return state;

        ConditionPattern pattern = new ConditionMatcher(facts).match(cond, assumption);
        if (pattern == null) return state;
        LOG.finer(() -> "条件 " + cond + " = " + assumption + " 匹配 " + pattern);
        return state.set(FIELD_CLEARANCE, pattern.apply(state.get(FIELD_CLEARANCE), facts));
    }

    // ============ 辅助 ============

    /** 每条路径第一次回调时执行：记录当前类，伪构造方法中把全部字段视为已清除 */
    private void resetInitialStateIfNeeded(CheckerContext context) {
        ProgramState state = context.getState();
        if (state.get(INIT_STATE_WAS_SET)) return;

        InterfaceDecl top = ExprMatchers.getCurrentTopClassInterface(context);
        if (top != null) {
            state = state.set(CURRENT_TYPE, top);
            TypeFacts facts = factStore.getOrCreate(top.getName());
            MethodDecl method = context.getStackFrame().getMethod();
            if (facts.isPseudoConstructor(method.getSelector())) {
                ClearanceMap clearance = state.get(FIELD_CLEARANCE);
                for (Map.Entry<FieldDecl, FieldFacts> e : facts.getFields().entrySet()) {
                    clearance = clearance.set(e.getKey(), ClearanceRecord.fullyCleared(e.getValue()));
                }
                state = state.set(FIELD_CLEARANCE, clearance);
            }
        }
        context.addTransition(state.set(INIT_STATE_WAS_SET, Boolean.TRUE));
    }

    private TypeFacts currentFacts(CheckerContext context) {
        return factStore.lookup(ExprMatchers.getCurrentTopClassInterface(context));
    }

    /** 在释放点核对字段的危险属性是否都已清除 */
    private void verify(FieldDecl field, AstNode site, CheckerContext context) {
        if (field == null) return;
        TypeFacts facts = currentFacts(context);
        if (facts == null) return;
        FieldFacts fieldFacts = facts.getFieldFacts(field);
        if (fieldFacts == null) return;

        ClearanceRecord record = context.getState().get(FIELD_CLEARANCE).get(field);
        reportUncleared(field, fieldFacts, record, null, site.getLocation(),
                describe(context.getStackFrame().getMethod()), context::emitReport);
        // TODO: target/observer 登记也需要在释放点核对（isTargetCleared / isObserverCleared）
    }

    private void reportUncleared(FieldDecl field, FieldFacts facts, ClearanceRecord record, String ctx,
                                 SourceLocation location, String declaration, Consumer<BugReport> sink) {
        String className = field.getType() != null ? field.getType().getClassName() : null;
        for (String property : facts.getDangerousProperties()) {
            if (record.isPropertyCleared(property)) continue;
            String message = DiagnosticFormatter.format(field.getName(), property, className, ctx);
            sink.accept(new BugReport(bugType, message, location, declaration));
        }
    }

    static String describe(MethodDecl method) {
        String owner = method.getOwnerName() != null ? method.getOwnerName() : "?";
        return (method.isInstanceMethod() ? "-[" : "+[") + owner + " " + method.getSelector() + "]";
    }
}
