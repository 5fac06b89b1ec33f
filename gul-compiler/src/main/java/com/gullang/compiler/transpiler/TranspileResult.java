package com.gullang.compiler.transpiler;

/**
 * 单个文件的转译结果
 */
public final class TranspileResult {
    private final String code;
    private final int framesOpened;
    private final int framesClosed;

    public TranspileResult(String code, int framesOpened, int framesClosed) {
        this.code = code;
        this.framesOpened = framesOpened;
        this.framesClosed = framesClosed;
    }

    public String getCode() {
        return code;
    }

    public int getFramesOpened() {
        return framesOpened;
    }

    public int getFramesClosed() {
        return framesClosed;
    }

    /** 每个打开的块都恰好关闭一次 */
    public boolean isBalanced() {
        return framesOpened == framesClosed;
    }

    @Override
    public String toString() {
        return "TranspileResult{opened=" + framesOpened + ", closed=" + framesClosed + "}";
    }
}
