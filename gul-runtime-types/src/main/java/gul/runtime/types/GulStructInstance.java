package gul.runtime.types;

import gul.runtime.GulValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 结构体实例，字段可变，按引用相等
 */
public final class GulStructInstance extends GulValue {

    private final String structName;
    private final GulStructDefinition definition;
    private final Map<String, GulValue> fields;

    public GulStructInstance(String structName, GulStructDefinition definition, Map<String, GulValue> fields) {
        this.structName = structName;
        this.definition = definition;
        this.fields = new LinkedHashMap<String, GulValue>(fields);
    }

    public String getStructName() {
        return structName;
    }

    /** 构造时未找到定义则为 null */
    public GulStructDefinition getDefinition() {
        return definition;
    }

    public Map<String, GulValue> getFields() {
        return fields;
    }

    /** 不存在返回 null */
    public GulValue getField(String name) {
        return fields.get(name);
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    public void setField(String name, GulValue value) {
        fields.put(name, value);
    }

    @Override
    public String getTypeName() {
        return structName;
    }

    /** Name{x: 1, y: 'a'} */
    @Override
    public String render() {
        StringBuilder sb = new StringBuilder(structName).append('{');
        boolean first = true;
        for (Map.Entry<String, GulValue> e : fields.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(e.getKey()).append(": ").append(e.getValue().repr());
        }
        return sb.append('}').toString();
    }
}
