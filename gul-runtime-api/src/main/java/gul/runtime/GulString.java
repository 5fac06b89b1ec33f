package gul.runtime;

/**
 * GUL 字符串（不可变）
 */
public final class GulString extends GulValue implements Comparable<GulString> {

    public static final GulString EMPTY = new GulString("");

    private final String value;

    private GulString(String value) {
        this.value = value;
    }

    public static GulString of(String value) {
        return value.isEmpty() ? EMPTY : new GulString(value);
    }

    public String getValue() {
        return value;
    }

    public int length() {
        return value.codePointCount(0, value.length());
    }

    @Override
    public String getTypeName() {
        return "str";
    }

    @Override
    public boolean isString() {
        return true;
    }

    @Override
    public boolean isTruthy() {
        return !value.isEmpty();
    }

    @Override
    public String render() {
        return value;
    }

    /** 'text'，含单引号且不含双引号时用双引号 */
    @Override
    public String repr() {
        char quote = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder sb = new StringBuilder(value.length() + 2).append(quote);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                case '\r': sb.append("\\r"); break;
                default:
                    if (c == quote) {
                        sb.append('\\');
                    }
                    sb.append(c);
            }
        }
        return sb.append(quote).toString();
    }

    @Override
    public int compareTo(GulString other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof GulString && ((GulString) obj).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
