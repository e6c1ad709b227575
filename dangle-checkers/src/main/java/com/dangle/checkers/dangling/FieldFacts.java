package com.dangle.checkers.dangling;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 单个实例变量的静态事实。只在发现第一个危险模式时创建，之后只增不减。
 */
public final class FieldFacts {
    // 有序，报告顺序稳定
    private final Set<String> dangerousProperties = new TreeSet<>();
    private boolean mayBeEventTarget;
    private boolean mayBeEventObserver;

    /** 可能保存了 self 的 assign 属性名 */
    public Set<String> getDangerousProperties() {
        return Collections.unmodifiableSet(dangerousProperties);
    }

    void addDangerousProperty(String property) {
        dangerousProperties.add(property);
    }

    public boolean mayBeEventTarget() {
        return mayBeEventTarget;
    }

    void markEventTarget() {
        this.mayBeEventTarget = true;
    }

    public boolean mayBeEventObserver() {
        return mayBeEventObserver;
    }

    void markEventObserver() {
        this.mayBeEventObserver = true;
    }

    @Override
    public String toString() {
        return "FieldFacts{" + dangerousProperties
                + (mayBeEventTarget ? ", target" : "")
                + (mayBeEventObserver ? ", observer" : "") + "}";
    }
}
