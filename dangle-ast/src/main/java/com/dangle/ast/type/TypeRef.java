package com.dangle.ast.type;

import java.util.Objects;

/**
 * 类型引用：对象指针（带类名或 id）、基本类型、void。
 */
public final class TypeRef {

    public enum Kind {
        OBJECT,     // Foo * 或 id
        PRIMITIVE,  // BOOL / int / ...
        VOID
    }

    public static final TypeRef VOID = new TypeRef(Kind.VOID, "void");
    public static final TypeRef ID = new TypeRef(Kind.OBJECT, null);
    public static final TypeRef BOOL = new TypeRef(Kind.PRIMITIVE, "BOOL");

    private final Kind kind;
    private final String name;

    private TypeRef(Kind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    public static TypeRef object(String className) {
        return className == null ? ID : new TypeRef(Kind.OBJECT, className);
    }

    public static TypeRef primitive(String name) {
        return new TypeRef(Kind.PRIMITIVE, name);
    }

    /**
     * 解析类型文本："void"、"id"、"instancetype"、"Foo *"、"Foo"、"BOOL"、"int" 等。
     * 首字母大写且非 BOOL 的名字视为类名。
     */
    public static TypeRef parse(String text) {
        if (text == null) return ID;
        String t = text.trim();
        if (t.endsWith("*")) {
            return object(t.substring(0, t.length() - 1).trim());
        }
        switch (t) {
            case "void":
                return VOID;
            case "id":
            case "instancetype":
                return ID;
            case "BOOL":
                return BOOL;
            default:
                if (!t.isEmpty() && Character.isUpperCase(t.charAt(0))) {
                    return object(t);
                }
                return primitive(t);
        }
    }

    public Kind getKind() { return kind; }

    /** 对象指针的类名；id 或非对象类型返回 null */
    public String getClassName() {
        return kind == Kind.OBJECT ? name : null;
    }

    public boolean isObjectPointer() { return kind == Kind.OBJECT; }
    public boolean isVoid() { return kind == Kind.VOID; }

    public String toDisplayString() {
        switch (kind) {
            case OBJECT:
                return name == null ? "id" : name + " *";
            default:
                return name;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeRef)) return false;
        TypeRef other = (TypeRef) o;
        return kind == other.kind && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name);
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
