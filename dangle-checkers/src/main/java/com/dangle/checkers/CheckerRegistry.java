package com.dangle.checkers;

import com.dangle.checkers.dangling.DanglingDelegateChecker;
import com.dangle.engine.checker.Checker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 检查器注册表：点分名字 → 描述与工厂。
 *
 * <p>检查器带有编译单元级的状态，每个编译单元都应通过 {@link #create} 取得新实例。</p>
 */
public final class CheckerRegistry {

    private static final Map<String, Entry> checkers = new LinkedHashMap<>();

    static {
        register(DanglingDelegateChecker.NAME,
                "Find unsafe references to self that should be nil-ed before releasing an object",
                DanglingDelegateChecker::new);
    }

    private CheckerRegistry() {}

    private static void register(String name, String description, Supplier<? extends Checker> factory) {
        checkers.put(name, new Entry(name, description, factory));
    }

    public static boolean has(String name) {
        return checkers.containsKey(name);
    }

    public static Collection<Entry> entries() {
        return Collections.unmodifiableCollection(checkers.values());
    }

    public static Checker create(String name) {
        Entry entry = checkers.get(name);
        if (entry == null) {
            throw new IllegalArgumentException("未知检查器: " + name);
        }
        return entry.factory.get();
    }

    /** 按名字创建一组新实例；names 为空时创建全部已注册的检查器 */
    public static List<Checker> createAll(Collection<String> names) {
        List<Checker> result = new ArrayList<>();
        Collection<String> selected = names == null || names.isEmpty() ? checkers.keySet() : names;
        for (String name : selected) {
            result.add(create(name));
        }
        return result;
    }

    public static final class Entry {
        private final String name;
        private final String description;
        private final Supplier<? extends Checker> factory;

        private Entry(String name, String description, Supplier<? extends Checker> factory) {
            this.name = name;
            this.description = description;
            this.factory = factory;
        }

        public String getName() { return name; }
        public String getDescription() { return description; }
    }
}
