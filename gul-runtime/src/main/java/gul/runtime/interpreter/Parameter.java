package gul.runtime.interpreter;

/**
 * 函数参数：名称、所有权修饰（已解析但不检查）、类型标注与默认值的源码文本
 */
public final class Parameter {
    private final String name;
    private final String ownership;
    private final String typeName;
    private final String defaultSource;

    public Parameter(String name, String ownership, String typeName, String defaultSource) {
        this.name = name;
        this.ownership = ownership;
        this.typeName = typeName;
        this.defaultSource = defaultSource;
    }

    public String getName() {
        return name;
    }

    /** ref / mut / borrow / move / kept，未写时为 null */
    public String getOwnership() {
        return ownership;
    }

    public String getTypeName() {
        return typeName;
    }

    public String getDefaultSource() {
        return defaultSource;
    }

    public boolean hasDefault() {
        return defaultSource != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (ownership != null) {
            sb.append(ownership).append(' ');
        }
        sb.append(name);
        if (typeName != null) {
            sb.append(": ").append(typeName);
        }
        if (defaultSource != null) {
            sb.append(" = ").append(defaultSource);
        }
        return sb.toString();
    }
}
