package com.dangle.engine.checker;

/**
 * 检查器标记接口。检查器通过实现下列回调接口订阅引擎事件：
 * {@link AstDeclCheck}、{@link PreStmtCheck}、{@link PostObjCMessageCheck}、
 * {@link EndFunctionCheck}、{@link EvalAssumeCheck}、{@link EndOfTranslationUnitCheck}。
 */
public interface Checker {
}
