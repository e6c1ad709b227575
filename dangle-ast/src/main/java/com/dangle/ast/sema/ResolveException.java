package com.dangle.ast.sema;

import com.dangle.ast.SourceLocation;

/**
 * 名字解析失败（未知的实例变量、局部变量等）
 */
public class ResolveException extends RuntimeException {
    private final SourceLocation location;

    public ResolveException(String message, SourceLocation location) {
        super(message);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        if (location == null || !location.isKnown()) return super.getMessage();
        return location + ": " + super.getMessage();
    }
}
