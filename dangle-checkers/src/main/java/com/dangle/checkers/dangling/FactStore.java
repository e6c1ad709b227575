package com.dangle.checkers.dangling;

import com.dangle.ast.decl.InterfaceDecl;

import java.util.HashMap;
import java.util.Map;

/**
 * 按类名索引的事实表。由检查器实例持有，在编译单元分析结束时清空。
 *
 * <p>查找时不存在的条目会被创建为空事实，没有经过事实收集的类因此表现为
 * 没有值得关注的实例变量。</p>
 */
public final class FactStore {
    private final Map<String, TypeFacts> types = new HashMap<>();

    public TypeFacts getOrCreate(String typeName) {
        return types.computeIfAbsent(typeName, TypeFacts::new);
    }

    /** iface 为 null 时返回 null */
    public TypeFacts lookup(InterfaceDecl iface) {
        return iface == null ? null : getOrCreate(iface.getName());
    }

    public boolean contains(String typeName) {
        return types.containsKey(typeName);
    }

    public int size() {
        return types.size();
    }

    public void clear() {
        types.clear();
    }
}
