package gul.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 具名属性集合，如内置的 {@code sys} 对象（{@code sys.argv}）
 */
public final class GulNamespace extends GulValue {

    private final String name;
    private final Map<String, GulValue> attributes = new LinkedHashMap<String, GulValue>();

    public GulNamespace(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /** 不存在返回 null */
    public GulValue getAttribute(String attr) {
        return attributes.get(attr);
    }

    public boolean hasAttribute(String attr) {
        return attributes.containsKey(attr);
    }

    public GulNamespace setAttribute(String attr, GulValue value) {
        attributes.put(attr, value);
        return this;
    }

    public Map<String, GulValue> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public String getTypeName() {
        return "module";
    }

    @Override
    public String render() {
        return "<module '" + name + "'>";
    }
}
