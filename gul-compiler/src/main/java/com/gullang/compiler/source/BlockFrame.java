package com.gullang.compiler.source;

/**
 * 块栈帧：记录块的起始缩进、类型以及关闭时需要输出的内容
 */
public final class BlockFrame {
    private final int indent;
    private final BlockKind kind;
    private final String name;
    private final String closer;
    private String pendingSuffix;
    private boolean explicitBrace;

    public BlockFrame(int indent, BlockKind kind, String name, String closer) {
        this.indent = indent;
        this.kind = kind;
        this.name = name;
        this.closer = closer;
    }

    public int getIndent() {
        return indent;
    }

    public BlockKind getKind() {
        return kind;
    }

    /** struct / enum / impl 的类型名，其余为 null */
    public String getName() {
        return name;
    }

    public String getCloser() {
        return closer;
    }

    /** 关闭时附加在 closer 之后的合成后缀，例如包装 return 的 ')' */
    public void setPendingSuffix(String pendingSuffix) {
        this.pendingSuffix = pendingSuffix;
    }

    /** 源码中已经写了 '{'，关闭由显式 '}' 行消费 */
    public boolean isExplicitBrace() {
        return explicitBrace;
    }

    public void setExplicitBrace(boolean explicitBrace) {
        this.explicitBrace = explicitBrace;
    }

    /** 关闭该帧输出的完整文本 */
    public String closingText() {
        return pendingSuffix != null ? closer + pendingSuffix : closer;
    }

    @Override
    public String toString() {
        return kind + "@" + indent + (name != null ? "(" + name + ")" : "");
    }
}
