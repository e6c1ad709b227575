package com.dangle.engine;

/**
 * 路径探索配置
 */
public class AnalyzerOptions {
    private boolean inlineMethods = true;
    private int maxInlineDepth = 4;
    private int maxPathsPerFunction = 256;

    public AnalyzerOptions() {
    }

    /** 是否内联发给 self/super 且在本单元有方法体的消息 */
    public boolean isInlineMethods() {
        return inlineMethods;
    }

    public void setInlineMethods(boolean inlineMethods) {
        this.inlineMethods = inlineMethods;
    }

    public int getMaxInlineDepth() {
        return maxInlineDepth;
    }

    public void setMaxInlineDepth(int maxInlineDepth) {
        this.maxInlineDepth = maxInlineDepth;
    }

    /** 每个顶层方法最多同时保留的路径数，超出部分被丢弃 */
    public int getMaxPathsPerFunction() {
        return maxPathsPerFunction;
    }

    public void setMaxPathsPerFunction(int maxPathsPerFunction) {
        this.maxPathsPerFunction = maxPathsPerFunction;
    }
}
