package com.dangle.engine.report;

/**
 * 缺陷类型：标题、分类及所属检查器
 */
public final class BugType {
    private final String checkerName;
    private final String name;
    private final String category;

    public BugType(String checkerName, String name, String category) {
        this.checkerName = checkerName;
        this.name = name;
        this.category = category;
    }

    public String getCheckerName() { return checkerName; }
    public String getName() { return name; }
    public String getCategory() { return category; }

    @Override
    public String toString() {
        return name + " (" + category + ")";
    }
}
