package com.gullang.compiler.transpiler;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 批量转译结果：已写出的文件与失败的源文件
 */
public final class TranspileReport {
    private final List<Path> written = new ArrayList<Path>();
    private final List<Path> failed = new ArrayList<Path>();
    private int unbalanced;

    void addWritten(Path output) {
        written.add(output);
    }

    void addFailed(Path source) {
        failed.add(source);
    }

    void addUnbalanced() {
        unbalanced++;
    }

    public List<Path> getWritten() {
        return Collections.unmodifiableList(written);
    }

    public List<Path> getFailed() {
        return Collections.unmodifiableList(failed);
    }

    /** 块栈开闭计数不一致的文件数（输出仍已写出） */
    public int getUnbalancedCount() {
        return unbalanced;
    }

    public boolean isSuccess() {
        return failed.isEmpty();
    }

    /** 一行摘要，如 "Transpiled 12 files (0 failed)" */
    public String summary() {
        return "Transpiled " + written.size() + " files (" + failed.size() + " failed)";
    }

    @Override
    public String toString() {
        return summary();
    }
}
