package com.dangle.engine.checker;

import com.dangle.engine.ProgramState;
import com.dangle.engine.sval.SVal;

/**
 * 分支条件被假设为真/假之后回调，可返回修改后的状态；返回 null 表示路径不可行
 */
public interface EvalAssumeCheck extends Checker {
    ProgramState evalAssume(ProgramState state, SVal cond, boolean assumption);
}
