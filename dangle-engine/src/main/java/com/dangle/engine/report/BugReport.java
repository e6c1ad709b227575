package com.dangle.engine.report;

import com.dangle.ast.SourceLocation;

import java.util.Objects;

/**
 * 一条缺陷报告
 */
public final class BugReport {
    private final BugType bugType;
    private final String description;
    private final SourceLocation location;
    private final String declaration;

    /**
     * @param declaration 报告所在的声明（如 {@code -[Test dealloc]} 或类名），可为 null
     */
    public BugReport(BugType bugType, String description, SourceLocation location, String declaration) {
        this.bugType = bugType;
        this.description = description;
        this.location = location;
        this.declaration = declaration;
    }

    public BugType getBugType() { return bugType; }
    public String getDescription() { return description; }
    public SourceLocation getLocation() { return location; }
    public String getDeclaration() { return declaration; }

    /** 去重键：缺陷类型 + 位置 + 消息 */
    boolean isDuplicateOf(BugReport other) {
        return bugType == other.bugType && Objects.equals(location, other.location)
                && description.equals(other.description);
    }

    @Override
    public String toString() {
        return location + ": " + description;
    }
}
