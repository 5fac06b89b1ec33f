package gul.runtime.types;

/**
 * 结构体字段声明：名称、类型标注文本与默认值表达式文本（都可为 null）
 */
public final class FieldSpec {
    private final String name;
    private final String typeName;
    private final String defaultSource;

    public FieldSpec(String name, String typeName, String defaultSource) {
        this.name = name;
        this.typeName = typeName;
        this.defaultSource = defaultSource;
    }

    public String getName() {
        return name;
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
        return typeName == null ? name : name + ": " + typeName;
    }
}
