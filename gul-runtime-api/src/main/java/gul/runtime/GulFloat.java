package gul.runtime;

/**
 * GUL 浮点数（双精度）
 */
public final class GulFloat extends GulNumber {

    public static final GulFloat INFINITY = new GulFloat(Double.POSITIVE_INFINITY);

    private final double value;

    private GulFloat(double value) {
        this.value = value;
    }

    public static GulFloat of(double value) {
        return new GulFloat(value);
    }

    public double getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "float";
    }

    @Override
    public boolean isInteger() {
        return false;
    }

    @Override
    public boolean isTruthy() {
        return value != 0.0;
    }

    @Override
    public long asLong() {
        return (long) value;
    }

    @Override
    public double asDouble() {
        return value;
    }

    @Override
    public String render() {
        return format(value);
    }

    /**
     * Python 风格浮点文本：整数值保留 ".0"，极大极小值用 1e+20 形式
     */
    public static String format(double d) {
        if (Double.isNaN(d)) {
            return "nan";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "inf" : "-inf";
        }
        double abs = Math.abs(d);
        if (d == Math.rint(d) && abs < 1e16) {
            return Long.toString((long) d) + ".0";
        }
        String s = Double.toString(d);
        int e = s.indexOf('E');
        if (e < 0) {
            return s;
        }
        String mantissa = s.substring(0, e);
        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        }
        int exp = Integer.parseInt(s.substring(e + 1));
        if (exp >= -4 && exp < 16) {
            return new java.math.BigDecimal(s).stripTrailingZeros().toPlainString();
        }
        String sign = exp < 0 ? "-" : "+";
        int absExp = Math.abs(exp);
        return mantissa + "e" + sign + (absExp < 10 ? "0" : "") + absExp;
    }
}
