package com.dangle.checkers.dangling;

import com.dangle.ast.decl.FieldDecl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 一个类实现的静态事实：值得关注的实例变量、单例观察者登记、伪构造方法以及是否有显式 dealloc。
 */
public final class TypeFacts {
    private final String typeName;
    private final Map<FieldDecl, FieldFacts> fields = new LinkedHashMap<>();
    private final Map<String, Set<String>> sharedObserverFacts = new TreeMap<>();
    private final Set<String> pseudoConstructorMethods = new LinkedHashSet<>();
    private boolean hasExplicitTeardown;

    public TypeFacts(String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }

    public Map<FieldDecl, FieldFacts> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    /** 字段的事实；不值得关注的字段返回 null */
    public FieldFacts getFieldFacts(FieldDecl field) {
        return fields.get(field);
    }

    public boolean isInteresting(FieldDecl field) {
        return field != null && fields.containsKey(field);
    }

    FieldFacts getOrCreateFieldFacts(FieldDecl field) {
        return fields.computeIfAbsent(field, f -> new FieldFacts());
    }

    /** 单例描述 → 在其上以 self 登记观察者的方法名（只收集） */
    public Map<String, Set<String>> getSharedObserverFacts() {
        return Collections.unmodifiableMap(sharedObserverFacts);
    }

    void addSharedObserver(String singleton, String methodName) {
        sharedObserverFacts.computeIfAbsent(singleton, k -> new TreeSet<>()).add(methodName);
    }

    public Set<String> getPseudoConstructorMethods() {
        return Collections.unmodifiableSet(pseudoConstructorMethods);
    }

    public boolean isPseudoConstructor(String methodName) {
        return pseudoConstructorMethods.contains(methodName);
    }

    void addPseudoConstructor(String methodName) {
        pseudoConstructorMethods.add(methodName);
    }

    public boolean hasExplicitTeardown() {
        return hasExplicitTeardown;
    }

    void setHasExplicitTeardown(boolean hasExplicitTeardown) {
        this.hasExplicitTeardown = hasExplicitTeardown;
    }

    @Override
    public String toString() {
        return "TypeFacts{" + typeName + ", fields=" + fields + ", pseudoInit=" + pseudoConstructorMethods
                + ", dealloc=" + hasExplicitTeardown + "}";
    }
}
