package gul.runtime;

/**
 * GUL 整数（64 位）
 */
public final class GulInt extends GulNumber {

    private static final int CACHE_LOW = -128;
    private static final int CACHE_HIGH = 1024;
    private static final GulInt[] CACHE = new GulInt[CACHE_HIGH - CACHE_LOW + 1];
    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new GulInt(CACHE_LOW + i);
        }
    }

    /** 获取实例，小整数走缓存 */
    public static GulInt of(long value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new GulInt(value);
    }

    private final long value;

    private GulInt(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "int";
    }

    @Override
    public boolean isInteger() {
        return true;
    }

    @Override
    public boolean isTruthy() {
        return value != 0;
    }

    @Override
    public long asLong() {
        return value;
    }

    @Override
    public double asDouble() {
        return value;
    }

    @Override
    public String render() {
        return Long.toString(value);
    }
}
