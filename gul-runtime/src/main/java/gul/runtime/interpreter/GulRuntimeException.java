package gul.runtime.interpreter;

import gul.runtime.GulException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * GUL 运行时异常
 *
 * <p>记录出错语句的文件与行号，以及异常向外传播时经过的函数调用（GUL 层面的调用栈）。</p>
 */
public class GulRuntimeException extends GulException {

    /** getMessage 中最多展示的调用帧数 */
    static final int TRACE_DISPLAY_LIMIT = 20;

    private String fileName;
    private int line;
    private String sourceLine;
    private final List<String> gulTrace = new ArrayList<String>();
    private boolean fatal;

    public GulRuntimeException(String message) {
        super(message);
    }

    public GulRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }

    /** 不能被 GUL 的 try/catch 捕获的失败（如超出指令预算） */
    public static GulRuntimeException fatal(String message) {
        GulRuntimeException e = new GulRuntimeException(message);
        e.fatal = true;
        return e;
    }

    /**
     * 第一次设置生效，保留最内层语句的位置
     */
    public GulRuntimeException withLocation(String fileName, int line, String sourceLine) {
        if (this.fileName == null) {
            this.fileName = fileName;
            this.line = line;
            this.sourceLine = sourceLine;
        }
        return this;
    }

    public boolean hasLocation() {
        return fileName != null;
    }

    void addTraceFrame(String frame) {
        gulTrace.add(frame);
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    public String getSourceLine() {
        return sourceLine;
    }

    public List<String> getGulTrace() {
        return Collections.unmodifiableList(gulTrace);
    }

    public boolean isFatal() {
        return fatal;
    }

    /** 返回不含位置与调用栈的错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (fileName != null) {
            sb.append("\n  at ").append(fileName).append(':').append(line);
            if (sourceLine != null) {
                sb.append(": ").append(sourceLine);
            }
        }
        int size = gulTrace.size();
        if (size <= TRACE_DISPLAY_LIMIT) {
            for (String frame : gulTrace) {
                sb.append("\n  in ").append(frame);
            }
        } else {
            // 深递归折叠：保留最内层与最外层各一半
            int half = TRACE_DISPLAY_LIMIT / 2;
            for (int i = 0; i < half; i++) {
                sb.append("\n  in ").append(gulTrace.get(i));
            }
            sb.append("\n  ... ").append(size - TRACE_DISPLAY_LIMIT).append(" frames omitted ...");
            for (int i = size - half; i < size; i++) {
                sb.append("\n  in ").append(gulTrace.get(i));
            }
        }
        return sb.toString();
    }
}
