package com.dangle.engine;

import com.dangle.engine.sval.*;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 单条路径的不可变程序状态。
 *
 * <ul>
 *   <li>store：区域到值的绑定</li>
 *   <li>nullness：原子符号的空/非空约束</li>
 *   <li>invalidation：实例变量最近一次整体失效的原因符号</li>
 *   <li>traits：检查器私有数据</li>
 * </ul>
 *
 * <p>所有修改操作都返回新实例，分叉的路径互不影响。</p>
 */
public final class ProgramState {
    private final Map<MemRegion, SVal> store;
    private final Map<SymbolData, Boolean> nullness;
    private final SymbolConjured invalidation;
    private final Map<ProgramStateTrait<?>, Object> traits;

    ProgramState() {
        this(Collections.<MemRegion, SVal>emptyMap(), Collections.<SymbolData, Boolean>emptyMap(),
                null, Collections.<ProgramStateTrait<?>, Object>emptyMap());
    }

    private ProgramState(Map<MemRegion, SVal> store, Map<SymbolData, Boolean> nullness,
                         SymbolConjured invalidation, Map<ProgramStateTrait<?>, Object> traits) {
        this.store = store;
        this.nullness = nullness;
        this.invalidation = invalidation;
        this.traits = traits;
    }

    // ============ store ============

    /** 区域的显式绑定；未绑定返回 null */
    public SVal getBinding(MemRegion region) {
        return store.get(region);
    }

    public ProgramState bind(MemRegion region, SVal value) {
        Map<MemRegion, SVal> copy = new HashMap<>(store);
        copy.put(region, value);
        return new ProgramState(copy, nullness, invalidation, traits);
    }

    /** 删除全部实例变量绑定，之后读到的是以 cause 为父符号的派生值 */
    public ProgramState invalidateIvars(SymbolConjured cause) {
        Map<MemRegion, SVal> copy = new HashMap<>();
        for (Map.Entry<MemRegion, SVal> e : store.entrySet()) {
            if (!(e.getKey() instanceof IvarRegion)) copy.put(e.getKey(), e.getValue());
        }
        return new ProgramState(copy, nullness, cause, traits);
    }

    public SymbolConjured getInvalidation() {
        return invalidation;
    }

    // ============ 约束 ============

    /** 符号的空值约束：TRUE 为 nil，FALSE 为非 nil，null 为未知 */
    public Boolean getNullness(SymbolData sym) {
        return nullness.get(sym);
    }

    public ProgramState setNullness(SymbolData sym, boolean isNull) {
        Map<SymbolData, Boolean> copy = new HashMap<>(nullness);
        copy.put(sym, isNull);
        return new ProgramState(store, copy, invalidation, traits);
    }

    // ============ traits ============

    @SuppressWarnings("unchecked")
    public <T> T get(ProgramStateTrait<T> trait) {
        Object v = traits.get(trait);
        return v != null ? (T) v : trait.getDefaultValue();
    }

    public <T> ProgramState set(ProgramStateTrait<T> trait, T value) {
        Map<ProgramStateTrait<?>, Object> copy = new HashMap<>(traits);
        copy.put(trait, value);
        return new ProgramState(store, nullness, invalidation, copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProgramState)) return false;
        ProgramState other = (ProgramState) o;
        return store.equals(other.store) && nullness.equals(other.nullness)
                && Objects.equals(invalidation, other.invalidation) && traits.equals(other.traits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(store, nullness, invalidation, traits);
    }
}
