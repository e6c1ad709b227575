package com.dangle.engine;

import com.dangle.ast.decl.MethodDecl;
import com.dangle.ast.expr.MessageExpr;
import com.dangle.engine.sval.SVal;
import com.dangle.engine.sval.UnknownVal;

import java.util.Collections;
import java.util.List;

/**
 * 一次已求值的消息发送：源表达式、接收者与参数的值、运行时定义
 */
public final class ObjCMethodCall {
    private final MessageExpr origin;
    private final SVal receiver;
    private final List<SVal> args;
    private final MethodDecl runtimeDefinition;

    public ObjCMethodCall(MessageExpr origin, SVal receiver, List<SVal> args, MethodDecl runtimeDefinition) {
        this.origin = origin;
        this.receiver = receiver;
        this.args = args;
        this.runtimeDefinition = runtimeDefinition;
    }

    public MessageExpr getOriginExpr() {
        return origin;
    }

    public String getSelector() {
        return origin.getSelector();
    }

    /** 接收者的值；类消息为 Unknown */
    public SVal getReceiverSVal() {
        return receiver;
    }

    public SVal getArgSVal(int index) {
        return index < args.size() ? args.get(index) : UnknownVal.INSTANCE;
    }

    public List<SVal> getArgSVals() {
        return Collections.unmodifiableList(args);
    }

    /** 本单元中能找到的方法实现（可能是隐式合成的存取方法），找不到为 null */
    public MethodDecl getRuntimeDefinition() {
        return runtimeDefinition;
    }
}
