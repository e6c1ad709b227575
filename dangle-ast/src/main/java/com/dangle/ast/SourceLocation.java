package com.dangle.ast;

import java.util.Objects;

/**
 * 源码位置信息（行列均从 1 开始，0 表示未知）
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;
    private final int length;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0);

    public SourceLocation(String file, int line, int column, int length) {
        this.file = file != null ? file.intern() : null;
        this.line = line;
        this.column = column;
        this.length = length;
    }

    public static SourceLocation of(String file, int line, int column) {
        return new SourceLocation(file, line, column, 1);
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getLength() {
        return length;
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column && length == that.length
                && Objects.equals(file, that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column, length);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
