package com.dangle.engine.checker;

import com.dangle.engine.CheckerContext;

/**
 * 方法（顶层或内联）的每条路径结束时回调
 */
public interface EndFunctionCheck extends Checker {
    void checkEndFunction(CheckerContext context);
}
