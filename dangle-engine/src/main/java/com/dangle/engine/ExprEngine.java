package com.dangle.engine;

import com.dangle.ast.AstNode;
import com.dangle.ast.decl.*;
import com.dangle.ast.expr.*;
import com.dangle.ast.stmt.*;
import com.dangle.ast.type.TypeRef;
import com.dangle.engine.report.BugReporter;
import com.dangle.engine.sval.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 路径敏感的符号执行引擎。
 *
 * <p>以一个方法为入口，逐条语句推进所有路径：</p>
 * <ul>
 *   <li>条件无法确定时分叉，{@code &&}/{@code ||} 按短路语义分叉</li>
 *   <li>{@code assert} 只保留条件为真的路径</li>
 *   <li>发给 self/super 且本单元有方法体的消息被内联</li>
 *   <li>其余消息保守求值：合成 setter 写入后备实例变量，{@code [super init...]} 返回 self，
 *       其他发给 self 的消息使实例变量失效，返回值为新符号</li>
 * </ul>
 * <p>检查器在每个表达式求值前、每次消息发送后、每次条件假设后以及方法结束时被回调。</p>
 */
public class ExprEngine {
    private static final Logger LOG = Logger.getLogger(ExprEngine.class.getName());

    private final AnalysisManager manager;
    private final CheckerManager checkers;
    private final BugReporter reporter;
    private final SValBuilder svalBuilder = new SValBuilder();
    private final ConstraintManager constraints = new ConstraintManager();

    private MethodDecl currentTopLevel;
    private boolean truncated;

    public ExprEngine(AnalysisManager manager, CheckerManager checkers, BugReporter reporter) {
        this.manager = manager;
        this.checkers = checkers;
        this.reporter = reporter;
    }

    public AnalysisManager getAnalysisManager() { return manager; }
    public ConstraintManager getConstraintManager() { return constraints; }
    public SValBuilder getSValBuilder() { return svalBuilder; }
    BugReporter getBugReporter() { return reporter; }

    /**
     * 以 method 为顶层入口探索全部路径
     *
     * @return 正常结束的路径数
     */
    public int analyzeTopLevel(MethodDecl method, InterfaceDecl classInterface) {
        currentTopLevel = method;
        truncated = false;
        StackFrame frame = new StackFrame(method, classInterface, null);
        SymbolRegionValue self = svalBuilder.regionValue(new SelfRegion(frame));
        ProgramState initial = new ProgramState().setNullness(self, false);

        List<Path> paths = exec(method.getBody(), new Path(initial), frame);
        for (Path p : paths) {
            checkers.runCheckersForEndFunction(this, p.state, frame);
        }
        LOG.fine(() -> "分析 " + method + " 完成，路径数 " + paths.size());
        return paths.size();
    }

    // ============ 值读取 ============

    public SVal getIvarValue(ProgramState state, FieldDecl field) {
        return getRegionValue(state, new IvarRegion(field));
    }

    SVal getRegionValue(ProgramState state, MemRegion region) {
        SVal bound = state.getBinding(region);
        if (bound != null) return bound;
        if (region instanceof IvarRegion && state.getInvalidation() != null) {
            return new SymbolVal(svalBuilder.derived(state.getInvalidation(), region));
        }
        if (region instanceof VarRegion && ((VarRegion) region).getDecl().getKind() == VarDecl.Kind.LOCAL) {
            return UnknownVal.INSTANCE;
        }
        return new SymbolVal(svalBuilder.regionValue(region));
    }

    // ============ 语句 ============

    private List<Path> exec(Statement stmt, Path in, StackFrame frame) {
        if (stmt == null || in.returned) return Collections.singletonList(in);

        if (stmt instanceof Block) {
            List<Path> current = Collections.singletonList(in);
            for (Statement s : ((Block) stmt).getStatements()) {
                List<Path> next = new ArrayList<>();
                for (Path p : current) next.addAll(exec(s, p, frame));
                current = limit(next);
            }
            return current;
        }
        if (stmt instanceof ExpressionStmt) {
            List<Path> out = new ArrayList<>();
            for (Node n : eval(((ExpressionStmt) stmt).getExpression(), in.state, frame)) {
                out.add(new Path(n.state));
            }
            return out;
        }
        if (stmt instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) stmt;
            List<Path> out = new ArrayList<>();
            for (Branch b : evalCondition(ifStmt.getCondition(), in.state, frame)) {
                if (b.taken) {
                    out.addAll(exec(ifStmt.getThenBranch(), new Path(b.state), frame));
                } else if (ifStmt.hasElse()) {
                    out.addAll(exec(ifStmt.getElseBranch(), new Path(b.state), frame));
                } else {
                    out.add(new Path(b.state));
                }
            }
            return limit(out);
        }
        if (stmt instanceof ReturnStmt) {
            ReturnStmt ret = (ReturnStmt) stmt;
            if (ret.getValue() == null) {
                ProgramState s = checkers.runCheckersForPreStmt(this, ret, in.state, frame);
                return Collections.singletonList(Path.returned(s, UnknownVal.INSTANCE));
            }
            List<Path> out = new ArrayList<>();
            for (Node n : eval(ret.getValue(), in.state, frame)) {
                ProgramState s = checkers.runCheckersForPreStmt(this, ret, n.state, frame);
                out.add(Path.returned(s, n.value));
            }
            return out;
        }
        if (stmt instanceof AssertStmt) {
            List<Path> out = new ArrayList<>();
            for (Branch b : evalCondition(((AssertStmt) stmt).getCondition(), in.state, frame)) {
                // 断言失败的路径直接终止
                if (b.taken) out.add(new Path(b.state));
            }
            return out;
        }
        if (stmt instanceof DeclStmt) {
            DeclStmt decl = (DeclStmt) stmt;
            VarDecl var = decl.getVariable();
            VarRegion region = new VarRegion(var, frame);
            if (var.getInitializer() == null) {
                ProgramState s = checkers.runCheckersForPreStmt(this, decl, in.state, frame);
                return Collections.singletonList(new Path(s.bind(region, UnknownVal.INSTANCE)));
            }
            List<Path> out = new ArrayList<>();
            for (Node n : eval(var.getInitializer(), in.state, frame)) {
                ProgramState s = checkers.runCheckersForPreStmt(this, decl, n.state, frame);
                out.add(new Path(s.bind(region, n.value)));
            }
            return out;
        }
        throw new IllegalStateException("不支持的语句: " + stmt.getClass().getSimpleName());
    }

    // ============ 条件 ============

    private List<Branch> evalCondition(Expression cond, ProgramState state, StackFrame frame) {
        Expression e = cond.ignoreCasts();
        if (e instanceof BinaryExpr && ((BinaryExpr) e).getOperator().isLogical()) {
            BinaryExpr bin = (BinaryExpr) e;
            boolean isAnd = bin.getOperator() == BinaryExpr.BinaryOp.AND;
            List<Branch> out = new ArrayList<>();
            for (Branch left : evalCondition(bin.getLeft(), state, frame)) {
                if (left.taken != isAnd) {
                    // 短路：a && b 中 a 为假，a || b 中 a 为真
                    out.add(left);
                } else {
                    out.addAll(evalCondition(bin.getRight(), left.state, frame));
                }
            }
            return limitBranches(out);
        }
        if (e instanceof UnaryExpr && isLogical(((UnaryExpr) e).getOperand())) {
            List<Branch> out = new ArrayList<>();
            for (Branch b : evalCondition(((UnaryExpr) e).getOperand(), state, frame)) {
                out.add(new Branch(b.state, !b.taken));
            }
            return out;
        }
        List<Branch> out = new ArrayList<>();
        for (Node n : eval(e, state, frame)) {
            ProgramState whenTrue = processAssume(n.state, n.value, true);
            if (whenTrue != null) out.add(new Branch(whenTrue, true));
            ProgramState whenFalse = processAssume(n.state, n.value, false);
            if (whenFalse != null) out.add(new Branch(whenFalse, false));
        }
        return limitBranches(out);
    }

    private static boolean isLogical(Expression e) {
        Expression x = e.ignoreCasts();
        return x instanceof BinaryExpr && ((BinaryExpr) x).getOperator().isLogical();
    }

    /** 先由约束管理器判断可行性，再交给检查器 */
    ProgramState processAssume(ProgramState state, SVal cond, boolean assumption) {
        ProgramState s = constraints.assume(state, cond, assumption);
        if (s == null) return null;
        return checkers.runCheckersForEvalAssume(s, cond, assumption);
    }

    // ============ 表达式 ============

    private List<Node> eval(Expression expr, ProgramState state, StackFrame frame) {
        if (expr instanceof CastExpr) {
            return eval(((CastExpr) expr).getOperand(), state, frame);
        }
        if (expr instanceof SelfExpr || expr instanceof SuperExpr) {
            ProgramState s = preStmt(expr, state, frame);
            return single(s, getRegionValue(s, new SelfRegion(frame)));
        }
        if (expr instanceof NilLiteral) {
            return single(preStmt(expr, state, frame), ConcreteInt.ZERO);
        }
        if (expr instanceof IvarRefExpr) {
            ProgramState s = preStmt(expr, state, frame);
            return single(s, getIvarValue(s, ((IvarRefExpr) expr).getDecl()));
        }
        if (expr instanceof LocalRefExpr) {
            ProgramState s = preStmt(expr, state, frame);
            return single(s, getRegionValue(s, new VarRegion(((LocalRefExpr) expr).getDecl(), frame)));
        }
        if (expr instanceof PropertyRefExpr) {
            MessageExpr getter = ((PropertyRefExpr) expr).getGetterCall();
            if (getter == null) return single(state, UnknownVal.INSTANCE);
            List<Node> out = new ArrayList<>();
            for (CallResult r : evalMessage(getter, state, frame)) out.add(new Node(r.state, r.value));
            return out;
        }
        if (expr instanceof MessageExpr) {
            List<Node> out = new ArrayList<>();
            for (CallResult r : evalMessage((MessageExpr) expr, state, frame)) out.add(new Node(r.state, r.value));
            return out;
        }
        if (expr instanceof AssignExpr) {
            return evalAssign((AssignExpr) expr, state, frame);
        }
        if (expr instanceof BinaryExpr) {
            BinaryExpr bin = (BinaryExpr) expr;
            List<Node> out = new ArrayList<>();
            if (bin.getOperator().isLogical()) {
                for (Branch b : evalCondition(bin, state, frame)) {
                    out.add(new Node(b.state, ConcreteInt.of(b.taken)));
                }
                return out;
            }
            for (Node l : eval(bin.getLeft(), state, frame)) {
                for (Node r : eval(bin.getRight(), l.state, frame)) {
                    ProgramState s = preStmt(bin, r.state, frame);
                    out.add(new Node(s, svalBuilder.evalComparison(bin.getOperator(), l.value, r.value)));
                }
            }
            return out;
        }
        if (expr instanceof UnaryExpr) {
            List<Node> out = new ArrayList<>();
            for (Node n : eval(((UnaryExpr) expr).getOperand(), state, frame)) {
                out.add(new Node(preStmt(expr, n.state, frame), svalBuilder.evalNot(n.value)));
            }
            return out;
        }
        throw new IllegalStateException("不支持的表达式: " + expr.getClass().getSimpleName());
    }

    private List<Node> evalAssign(AssignExpr assign, ProgramState state, StackFrame frame) {
        List<Node> out = new ArrayList<>();
        if (assign.getSetterCall() != null) {
            // 点语法赋值：结果为右值
            for (CallResult r : evalMessage(assign.getSetterCall(), state, frame)) {
                out.add(new Node(r.state, r.call.getArgSVal(0)));
            }
            return out;
        }
        MemRegion region = lvalueRegion(assign.getTarget().ignoreCasts(), frame);
        for (Node v : eval(assign.getValue(), state, frame)) {
            ProgramState s = preStmt(assign, v.state, frame);
            if (region != null) s = s.bind(region, v.value);
            out.add(new Node(s, v.value));
        }
        return out;
    }

    private static MemRegion lvalueRegion(Expression target, StackFrame frame) {
        if (target instanceof IvarRefExpr) return new IvarRegion(((IvarRefExpr) target).getDecl());
        if (target instanceof LocalRefExpr) return new VarRegion(((LocalRefExpr) target).getDecl(), frame);
        if (target instanceof SelfExpr) return new SelfRegion(frame);
        return null;
    }

    // ============ 消息 ============

    private List<CallResult> evalMessage(MessageExpr msg, ProgramState state, StackFrame frame) {
        List<Expression> operands = new ArrayList<>();
        if (msg.getReceiverKind() != MessageExpr.ReceiverKind.CLASS) operands.add(msg.getReceiver());
        operands.addAll(msg.getArgs());

        List<CallResult> out = new ArrayList<>();
        for (Operands ops : evalOperands(operands, state, frame)) {
            SVal receiver;
            List<SVal> args;
            if (msg.getReceiverKind() == MessageExpr.ReceiverKind.CLASS) {
                receiver = UnknownVal.INSTANCE;
                args = ops.values;
            } else {
                receiver = ops.values.get(0);
                args = ops.values.subList(1, ops.values.size());
            }
            ProgramState s = preStmt(msg, ops.state, frame);
            out.addAll(evalCall(msg, s, frame, receiver, args));
        }
        return out;
    }

    private List<Operands> evalOperands(List<Expression> exprs, ProgramState state, StackFrame frame) {
        List<Operands> current = Collections.singletonList(new Operands(state, Collections.<SVal>emptyList()));
        for (Expression e : exprs) {
            List<Operands> next = new ArrayList<>();
            for (Operands ops : current) {
                for (Node n : eval(e, ops.state, frame)) {
                    List<SVal> values = new ArrayList<>(ops.values);
                    values.add(n.value);
                    next.add(new Operands(n.state, values));
                }
            }
            current = next;
        }
        return current;
    }

    private List<CallResult> evalCall(MessageExpr msg, ProgramState state, StackFrame frame,
                                      SVal receiver, List<SVal> args) {
        MethodDecl definition = findRuntimeDefinition(msg);
        ObjCMethodCall call = new ObjCMethodCall(msg, receiver, args, definition);

        if (msg.getReceiverKind() != MessageExpr.ReceiverKind.CLASS && constraints.isNull(state, receiver)) {
            // 发给 nil 的消息没有效果，结果为 nil
            ProgramState s = checkers.runCheckersForPostObjCMessage(this, call, state, frame, false);
            return Collections.singletonList(new CallResult(s, ConcreteInt.ZERO, call));
        }
        if (shouldInline(msg, definition, frame)) {
            return inlineCall(call, definition, state, frame, receiver, args);
        }
        return Collections.singletonList(conservativeCall(call, definition, state, frame, receiver, args));
    }

    /** 沿接收者静态类型的继承链查找实现；有 @implementation 的类其合成存取方法也算实现 */
    private static MethodDecl findRuntimeDefinition(MessageExpr msg) {
        if (msg.getReceiverKind() == MessageExpr.ReceiverKind.CLASS) return null;
        for (InterfaceDecl c = msg.getReceiverInterface(); c != null; c = c.getSuperInterface()) {
            ImplementationDecl impl = c.getImplementation();
            if (impl == null) continue;
            MethodDecl m = impl.findMethod(msg.getSelector());
            if (m != null) return m;
            for (MethodDecl d : c.getMethods()) {
                if (d.isImplicit() && d.getSelector().equals(msg.getSelector())) return d;
            }
        }
        return null;
    }

    private static boolean isSentToSelf(MessageExpr msg) {
        if (msg.getReceiverKind() == MessageExpr.ReceiverKind.SUPER_INSTANCE) return true;
        Expression receiver = msg.getInstanceReceiver();
        return receiver != null && receiver.ignoreCasts() instanceof SelfExpr;
    }

    private boolean shouldInline(MessageExpr msg, MethodDecl definition, StackFrame frame) {
        AnalyzerOptions options = manager.getAnalyzerOptions();
        return options.isInlineMethods()
                && isSentToSelf(msg)
                && definition != null && definition.hasBody()
                && frame.getDepth() < options.getMaxInlineDepth()
                && !frame.isOnStack(definition);
    }

    private List<CallResult> inlineCall(ObjCMethodCall call, MethodDecl definition, ProgramState state,
                                        StackFrame frame, SVal receiver, List<SVal> args) {
        InterfaceDecl owner = manager.getTranslationUnit().getInterface(definition.getOwnerName());
        StackFrame callee = new StackFrame(definition, owner, frame);
        ProgramState s = state.bind(new SelfRegion(callee), receiver);
        List<VarDecl> params = definition.getParams();
        for (int i = 0; i < params.size(); i++) {
            s = s.bind(new VarRegion(params.get(i), callee), i < args.size() ? args.get(i) : UnknownVal.INSTANCE);
        }
        LOG.finer(() -> "内联 " + definition + "，深度 " + callee.getDepth());

        List<CallResult> out = new ArrayList<>();
        for (Path p : exec(definition.getBody(), new Path(s), callee)) {
            ProgramState end = checkers.runCheckersForEndFunction(this, p.state, callee);
            end = checkers.runCheckersForPostObjCMessage(this, call, end, frame, true);
            SVal ret = p.returnValue != null ? p.returnValue : UnknownVal.INSTANCE;
            out.add(new CallResult(end, ret, call));
        }
        return out;
    }

    private CallResult conservativeCall(ObjCMethodCall call, MethodDecl definition, ProgramState state,
                                        StackFrame frame, SVal receiver, List<SVal> args) {
        MessageExpr msg = call.getOriginExpr();
        MethodDecl decl = msg.getMethodDecl();
        ProgramState s = state;

        if (isSentToSelf(msg)) {
            boolean synthesized = definition == null || definition.isImplicit();
            if (decl != null && decl.isPropertyAccessor() && synthesized) {
                if (decl.getParamCount() == 1 && decl.getAccessedProperty().getIvarDecl() != null) {
                    s = s.bind(new IvarRegion(decl.getAccessedProperty().getIvarDecl()),
                            args.isEmpty() ? UnknownVal.INSTANCE : args.get(0));
                }
            } else {
                s = s.invalidateIvars(svalBuilder.conjure(msg));
            }
        }

        SVal result;
        TypeRef returnType = decl != null ? decl.getReturnType() : msg.getStaticType();
        if (returnType != null && returnType.isVoid()) {
            result = UnknownVal.INSTANCE;
        } else if (msg.getReceiverKind() == MessageExpr.ReceiverKind.SUPER_INSTANCE
                && MethodFamily.of(msg.getSelector()) == MethodFamily.INIT) {
            result = receiver;
        } else {
            result = new SymbolVal(svalBuilder.conjure(msg));
        }
        s = checkers.runCheckersForPostObjCMessage(this, call, s, frame, false);
        return new CallResult(s, result, call);
    }

    // ============ 辅助 ============

    private ProgramState preStmt(AstNode node, ProgramState state, StackFrame frame) {
        return checkers.runCheckersForPreStmt(this, node, state, frame);
    }

    private static List<Node> single(ProgramState state, SVal value) {
        return Collections.singletonList(new Node(state, value));
    }

    private <T> List<T> limit(List<T> paths) {
        int max = manager.getAnalyzerOptions().getMaxPathsPerFunction();
        if (paths.size() <= max) return paths;
        if (!truncated) {
            truncated = true;
            LOG.fine(() -> "路径数超过上限 " + max + "，截断: " + currentTopLevel);
        }
        return new ArrayList<>(paths.subList(0, max));
    }

    private List<Branch> limitBranches(List<Branch> branches) {
        return limit(branches);
    }

    private static final class Path {
        final ProgramState state;
        final boolean returned;
        final SVal returnValue;

        Path(ProgramState state) {
            this(state, false, null);
        }

        private Path(ProgramState state, boolean returned, SVal returnValue) {
            this.state = state;
            this.returned = returned;
            this.returnValue = returnValue;
        }

        static Path returned(ProgramState state, SVal value) {
            return new Path(state, true, value);
        }
    }

    private static final class Node {
        final ProgramState state;
        final SVal value;

        Node(ProgramState state, SVal value) {
            this.state = state;
            this.value = value;
        }
    }

    private static final class Branch {
        final ProgramState state;
        final boolean taken;

        Branch(ProgramState state, boolean taken) {
            this.state = state;
            this.taken = taken;
        }
    }

    private static final class Operands {
        final ProgramState state;
        final List<SVal> values;

        Operands(ProgramState state, List<SVal> values) {
            this.state = state;
            this.values = values;
        }
    }

    private static final class CallResult {
        final ProgramState state;
        final SVal value;
        final ObjCMethodCall call;

        CallResult(ProgramState state, SVal value, ObjCMethodCall call) {
            this.state = state;
            this.value = value;
            this.call = call;
        }
    }
}
