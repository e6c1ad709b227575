package com.dangle.engine.sval;

/**
 * 符号表达式基类。原子符号见 {@link SymbolData}，复合比较见
 * {@link SymSymExpr}、{@link SymIntExpr}、{@link IntSymExpr}。
 */
public abstract class SymExpr {
}
