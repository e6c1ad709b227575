package com.dangle.engine.checker;

import com.dangle.engine.CheckerContext;
import com.dangle.engine.ObjCMethodCall;

/**
 * 消息发送完成后回调（内联时 {@link CheckerContext#wasInlined()} 为 true）
 */
public interface PostObjCMessageCheck extends Checker {
    void checkPostObjCMessage(ObjCMethodCall call, CheckerContext context);
}
