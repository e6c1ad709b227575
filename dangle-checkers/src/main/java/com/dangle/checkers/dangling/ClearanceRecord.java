package com.dangle.checkers.dangling;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 单条路径上一个实例变量已被证明清除的回指：已置空的属性，以及 target / observer 是否已移除。
 * 不可变。
 */
public final class ClearanceRecord {
    public static final ClearanceRecord EMPTY =
            new ClearanceRecord(Collections.<String>emptySet(), false, false);

    private final Set<String> clearedProperties;
    private final boolean targetCleared;
    private final boolean observerCleared;

    private ClearanceRecord(Set<String> clearedProperties, boolean targetCleared, boolean observerCleared) {
        this.clearedProperties = clearedProperties;
        this.targetCleared = targetCleared;
        this.observerCleared = observerCleared;
    }

    /** 该字段的全部危险属性与登记都视为已清除 */
    public static ClearanceRecord fullyCleared(FieldFacts facts) {
        return new ClearanceRecord(Collections.unmodifiableSet(new TreeSet<>(facts.getDangerousProperties())),
                facts.mayBeEventTarget(), facts.mayBeEventObserver());
    }

    public Set<String> getClearedProperties() {
        return clearedProperties;
    }

    public boolean isPropertyCleared(String property) {
        return clearedProperties.contains(property);
    }

    public boolean isTargetCleared() {
        return targetCleared;
    }

    public boolean isObserverCleared() {
        return observerCleared;
    }

    public ClearanceRecord withClearedProperty(String property) {
        if (clearedProperties.contains(property)) return this;
        Set<String> copy = new TreeSet<>(clearedProperties);
        copy.add(property);
        return new ClearanceRecord(Collections.unmodifiableSet(copy), targetCleared, observerCleared);
    }

    /** 属性重新指向 self，恢复为未清除 */
    public ClearanceRecord withoutClearedProperty(String property) {
        if (!clearedProperties.contains(property)) return this;
        Set<String> copy = new TreeSet<>(clearedProperties);
        copy.remove(property);
        return new ClearanceRecord(Collections.unmodifiableSet(copy), targetCleared, observerCleared);
    }

    public ClearanceRecord withTargetCleared() {
        return new ClearanceRecord(clearedProperties, true, observerCleared);
    }

    public ClearanceRecord withObserverCleared() {
        return new ClearanceRecord(clearedProperties, targetCleared, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClearanceRecord)) return false;
        ClearanceRecord other = (ClearanceRecord) o;
        return targetCleared == other.targetCleared && observerCleared == other.observerCleared
                && clearedProperties.equals(other.clearedProperties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clearedProperties, targetCleared, observerCleared);
    }

    @Override
    public String toString() {
        return "Cleared" + clearedProperties
                + (targetCleared ? "+target" : "")
                + (observerCleared ? "+observer" : "");
    }
}
