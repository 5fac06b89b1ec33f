package com.gullang.compiler.source;

/**
 * 逻辑行：缩进深度 + 去掉缩进后的内容
 *
 * <p>括号未闭合的多个物理行会拼接为一条逻辑行，行号取首行。</p>
 */
public final class LogicalLine {
    private final int number;
    private final int indent;
    private final String content;   // 去掉缩进的完整文本（含注释）
    private final String code;      // 去掉行尾注释后的代码
    private final String comment;   // '#' 之后的注释文本，无注释为 null

    public LogicalLine(int number, int indent, String content, String code, String comment) {
        this.number = number;
        this.indent = indent;
        this.content = content;
        this.code = code;
        this.comment = comment;
    }

    /** 从单个物理行构建 */
    public static LogicalLine of(int number, String physical) {
        String content = physical.trim();
        int hash = SourceLines.commentStart(content);
        String code = hash >= 0 ? content.substring(0, hash).trim() : content;
        String comment = hash >= 0 ? content.substring(hash + 1).trim() : null;
        return new LogicalLine(number, SourceLines.indentOf(physical), content, code, comment);
    }

    public int getNumber() {
        return number;
    }

    public int getIndent() {
        return indent;
    }

    public String getContent() {
        return content;
    }

    public String getCode() {
        return code;
    }

    public String getComment() {
        return comment;
    }

    public boolean hasComment() {
        return comment != null;
    }

    /** 空行或纯注释行 */
    public boolean isBlank() {
        return code.isEmpty();
    }

    @Override
    public String toString() {
        return number + ":" + indent + ": " + content;
    }
}
