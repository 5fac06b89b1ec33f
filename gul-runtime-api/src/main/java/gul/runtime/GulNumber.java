package gul.runtime;

/**
 * 数值值的公共基类，整数与浮点数按数值相等
 */
public abstract class GulNumber extends GulValue {

    @Override
    public boolean isNumber() {
        return true;
    }

    public abstract boolean isInteger();

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof GulNumber)) {
            return false;
        }
        GulNumber other = (GulNumber) obj;
        if (isInteger() && other.isInteger()) {
            return asLong() == other.asLong();
        }
        return asDouble() == other.asDouble();
    }

    @Override
    public int hashCode() {
        double d = asDouble();
        if (!isInteger() && d != Math.rint(d)) {
            return Double.hashCode(d);
        }
        return Long.hashCode(isInteger() ? asLong() : (long) d);
    }
}
