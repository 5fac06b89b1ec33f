package gul.runtime;

/**
 * GUL None 值
 */
public final class GulNone extends GulValue {

    /** 唯一实例 */
    public static final GulNone NONE = new GulNone();

    private GulNone() {
    }

    @Override
    public String getTypeName() {
        return "NoneType";
    }

    @Override
    public boolean isTruthy() {
        return false;
    }

    @Override
    public boolean isNone() {
        return true;
    }

    @Override
    public String render() {
        return "None";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof GulNone;
    }

    @Override
    public int hashCode() {
        return 0;
    }
}
