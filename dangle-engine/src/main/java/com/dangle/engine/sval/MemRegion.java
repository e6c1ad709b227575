package com.dangle.engine.sval;

/**
 * 内存区域：self 参数、实例变量、局部变量/参数
 */
public abstract class MemRegion {
}
