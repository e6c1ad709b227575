package com.dangle.ast.expr;

import com.dangle.ast.AstNode;
import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;
import com.dangle.ast.decl.InterfaceDecl;
import com.dangle.ast.decl.MethodDecl;

import java.util.Collections;
import java.util.List;

/**
 * 消息发送表达式：{@code [receiver selector:arg ...]} 或类消息 {@code [ClassName selector]}。
 */
public class MessageExpr extends Expression {

    public enum ReceiverKind {
        INSTANCE,
        SUPER_INSTANCE,
        CLASS
    }

    private final Expression receiver;          // 类消息时为 null
    private final String receiverClassName;     // 仅类消息
    private final String selector;
    private final List<Expression> args;
    private final AstNode syntacticForm;        // 点语法合成的消息指向原始节点

    // 解析后填充
    private MethodDecl methodDecl;
    private InterfaceDecl receiverInterface;

    public MessageExpr(SourceLocation location, Expression receiver, String selector, List<Expression> args) {
        this(location, receiver, null, selector, args, null);
    }

    public MessageExpr(SourceLocation location, Expression receiver, String receiverClassName,
                       String selector, List<Expression> args, AstNode syntacticForm) {
        super(location);
        this.receiver = receiver;
        this.receiverClassName = receiverClassName;
        this.selector = selector;
        this.args = args;
        this.syntacticForm = syntacticForm;
    }

    public static MessageExpr classMessage(SourceLocation location, String className,
                                           String selector, List<Expression> args) {
        return new MessageExpr(location, null, className, selector, args, null);
    }

    public ReceiverKind getReceiverKind() {
        if (receiver == null) return ReceiverKind.CLASS;
        return receiver.ignoreCasts() instanceof SuperExpr ? ReceiverKind.SUPER_INSTANCE : ReceiverKind.INSTANCE;
    }

    /** 任意接收者表达式（包括 super）；类消息返回 null */
    public Expression getReceiver() {
        return receiver;
    }

    /** 普通实例接收者；super 消息和类消息返回 null */
    public Expression getInstanceReceiver() {
        return getReceiverKind() == ReceiverKind.INSTANCE ? receiver : null;
    }

    public String getReceiverClassName() {
        return receiverClassName;
    }

    public String getSelector() {
        return selector;
    }

    public List<Expression> getArgs() {
        return Collections.unmodifiableList(args);
    }

    public int getNumArgs() {
        return args.size();
    }

    /** 参数不存在时返回 null */
    public Expression getArg(int index) {
        return index < args.size() ? args.get(index) : null;
    }

    public boolean isSynthesized() {
        return syntacticForm != null;
    }

    public AstNode getSyntacticForm() {
        return syntacticForm;
    }

    public MethodDecl getMethodDecl() {
        return methodDecl;
    }

    public void setMethodDecl(MethodDecl methodDecl) {
        this.methodDecl = methodDecl;
    }

    public InterfaceDecl getReceiverInterface() {
        return receiverInterface;
    }

    public void setReceiverInterface(InterfaceDecl receiverInterface) {
        this.receiverInterface = receiverInterface;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMessageExpr(this, context);
    }
}
