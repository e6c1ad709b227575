package com.dangle.engine;

/**
 * 语言选项
 */
public class LangOptions {
    private boolean arc = false;

    public LangOptions() {
    }

    public LangOptions(boolean arc) {
        this.arc = arc;
    }

    /** 是否启用自动引用计数（ARC） */
    public boolean isArc() {
        return arc;
    }

    public void setArc(boolean arc) {
        this.arc = arc;
    }
}
