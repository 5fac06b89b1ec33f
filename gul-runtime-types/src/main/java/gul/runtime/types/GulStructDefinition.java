package gul.runtime.types;

import gul.runtime.GulCallable;
import gul.runtime.GulValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 结构体定义
 *
 * <p>方法分两张表：第一个参数为 {@code self} 的实例方法（调用时接收者作为第一个实参），
 * 以及其余的静态方法。方法从不出现在模块级名字空间中。</p>
 */
public final class GulStructDefinition extends GulValue {

    private final String name;
    private final List<FieldSpec> fields;
    private final Map<String, GulCallable> instanceMethods = new LinkedHashMap<String, GulCallable>();
    private final Map<String, GulCallable> staticMethods = new LinkedHashMap<String, GulCallable>();

    public GulStructDefinition(String name, List<FieldSpec> fields) {
        this.name = name;
        this.fields = new ArrayList<FieldSpec>(fields);
    }

    public String getName() {
        return name;
    }

    public List<FieldSpec> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public List<String> getFieldNames() {
        List<String> names = new ArrayList<String>(fields.size());
        for (FieldSpec f : fields) {
            names.add(f.getName());
        }
        return names;
    }

    public void addInstanceMethod(String methodName, GulCallable method) {
        instanceMethods.put(methodName, method);
    }

    public void addStaticMethod(String methodName, GulCallable method) {
        staticMethods.put(methodName, method);
    }

    /** 不存在返回 null */
    public GulCallable findInstanceMethod(String methodName) {
        return instanceMethods.get(methodName);
    }

    /** 不存在返回 null */
    public GulCallable findStaticMethod(String methodName) {
        return staticMethods.get(methodName);
    }

    public Map<String, GulCallable> getInstanceMethods() {
        return Collections.unmodifiableMap(instanceMethods);
    }

    public Map<String, GulCallable> getStaticMethods() {
        return Collections.unmodifiableMap(staticMethods);
    }

    @Override
    public String getTypeName() {
        return "type";
    }

    @Override
    public String render() {
        return "<struct " + name + ">";
    }
}
