package gul.runtime.interpreter;

import gul.runtime.GulNone;
import gul.runtime.GulValue;

/**
 * 块执行结果
 *
 * <p>return、break、continue 不走异常，每次执行块都返回一个 Signal，
 * 由拥有该控制流的结构（函数调用、循环）检查并消费。</p>
 */
public final class Signal {

    /**
     * 信号类型
     */
    public enum Kind {
        NORMAL,
        RETURN,
        BREAK,
        CONTINUE
    }

    public static final Signal NORMAL = new Signal(Kind.NORMAL, null);
    public static final Signal BREAK = new Signal(Kind.BREAK, null);
    public static final Signal CONTINUE = new Signal(Kind.CONTINUE, null);

    private final Kind kind;
    private final GulValue value;

    private Signal(Kind kind, GulValue value) {
        this.kind = kind;
        this.value = value;
    }

    public static Signal returnValue(GulValue value) {
        return new Signal(Kind.RETURN, value != null ? value : GulNone.NONE);
    }

    public Kind getKind() {
        return kind;
    }

    /** RETURN 携带的值，其他类型为 None */
    public GulValue getValue() {
        return value != null ? value : GulNone.NONE;
    }

    public boolean isNormal() {
        return kind == Kind.NORMAL;
    }

    public boolean isReturn() {
        return kind == Kind.RETURN;
    }

    @Override
    public String toString() {
        return kind == Kind.RETURN ? "RETURN(" + getValue().repr() + ")" : kind.name();
    }
}
