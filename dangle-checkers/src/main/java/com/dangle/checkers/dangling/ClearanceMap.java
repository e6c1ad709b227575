package com.dangle.checkers.dangling;

import com.dangle.ast.decl.FieldDecl;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 实例变量 → {@link ClearanceRecord} 的不可变映射，作为路径状态的一部分随分叉复制。
 * 没有记录的字段等价于 {@link ClearanceRecord#EMPTY}。
 */
public final class ClearanceMap {
    public static final ClearanceMap EMPTY = new ClearanceMap(Collections.<FieldDecl, ClearanceRecord>emptyMap());

    private final Map<FieldDecl, ClearanceRecord> records;

    private ClearanceMap(Map<FieldDecl, ClearanceRecord> records) {
        this.records = records;
    }

    public ClearanceRecord get(FieldDecl field) {
        ClearanceRecord r = records.get(field);
        return r != null ? r : ClearanceRecord.EMPTY;
    }

    public boolean contains(FieldDecl field) {
        return records.containsKey(field);
    }

    public ClearanceMap set(FieldDecl field, ClearanceRecord record) {
        Map<FieldDecl, ClearanceRecord> copy = new HashMap<>(records);
        copy.put(field, record);
        return new ClearanceMap(Collections.unmodifiableMap(copy));
    }

    public int size() {
        return records.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ClearanceMap && ((ClearanceMap) o).records.equals(records);
    }

    @Override
    public int hashCode() {
        return records.hashCode();
    }

    @Override
    public String toString() {
        return records.toString();
    }
}
