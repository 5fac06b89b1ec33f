package gul.runtime;

/**
 * GUL 基础运行时异常（无源位置信息）。
 *
 * <p>{@code gul-runtime} 中的 {@code GulRuntimeException} 继承此类，
 * 并添加文件名、行号与语句追踪。</p>
 */
public class GulException extends RuntimeException {

    public GulException(String message) {
        super(message);
    }

    public GulException(String message, Throwable cause) {
        super(message, cause);
    }
}
