package com.dangle.ast.decl;

/**
 * 方法族：由选择子的第一个驼峰单词决定（忽略前导下划线）。
 * 例如 {@code initWithFrame:} 属于 INIT，{@code initialize} 不属于任何族。
 */
public enum MethodFamily {
    NONE,
    ALLOC,
    COPY,
    INIT,
    MUTABLE_COPY,
    NEW,
    AUTORELEASE,
    DEALLOC,
    RELEASE,
    RETAIN;

    public static MethodFamily of(String selector) {
        if (selector == null) return NONE;
        int start = 0;
        while (start < selector.length() && selector.charAt(start) == '_') start++;
        int end = start;
        while (end < selector.length() && Character.isLowerCase(selector.charAt(end))) end++;
        // 第一个单词之后必须是大写字母、冒号或结束
        if (end < selector.length()) {
            char next = selector.charAt(end);
            if (next != ':' && !Character.isUpperCase(next)) return NONE;
        }
        String word = selector.substring(start, end);
        switch (word) {
            case "alloc": return ALLOC;
            case "copy": return COPY;
            case "init": return INIT;
            case "new": return NEW;
            case "autorelease": return AUTORELEASE;
            case "dealloc": return DEALLOC;
            case "release": return RELEASE;
            case "retain": return RETAIN;
            case "mutable":
                return selector.startsWith("Copy", end) ? MUTABLE_COPY : NONE;
            default: return NONE;
        }
    }
}
