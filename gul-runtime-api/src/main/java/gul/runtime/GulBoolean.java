package gul.runtime;

/**
 * GUL 布尔值
 */
public final class GulBoolean extends GulValue {

    public static final GulBoolean TRUE = new GulBoolean(true);

    public static final GulBoolean FALSE = new GulBoolean(false);

    private final boolean value;

    private GulBoolean(boolean value) {
        this.value = value;
    }

    public static GulBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "bool";
    }

    @Override
    public boolean isTruthy() {
        return value;
    }

    // 与 Python 相同，布尔值可参与整数运算
    @Override
    public long asLong() {
        return value ? 1 : 0;
    }

    @Override
    public double asDouble() {
        return value ? 1.0 : 0.0;
    }

    @Override
    public String render() {
        return value ? "True" : "False";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof GulBoolean && ((GulBoolean) obj).value == value;
    }

    @Override
    public int hashCode() {
        return value ? 1 : 0;
    }
}
