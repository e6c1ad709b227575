package com.dangle.ast.json;

/**
 * JSON 编译单元格式错误，携带出错节点的 JSON 路径（如 {@code $.decls[1].methods[0].body[2]}）
 */
public class AstFormatException extends RuntimeException {
    private final String path;

    public AstFormatException(String path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public AstFormatException(String path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
