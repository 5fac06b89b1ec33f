package com.gullang.compiler.transpiler;

import java.nio.file.Path;

/**
 * 转译输入不可读或输出不可写
 */
public class TranspileException extends RuntimeException {
    private final Path path;

    public TranspileException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String getMessage() {
        if (path == null) {
            return super.getMessage();
        }
        return super.getMessage() + ": " + path;
    }
}
