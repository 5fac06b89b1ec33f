package gul.runtime.types;

import gul.runtime.GulException;
import gul.runtime.GulValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 运行时环境
 *
 * <p>一次运行只有一个扁平的名字 → 值映射。函数定义时复制一份快照作为闭包；
 * 调用时先保存调用方的映射，叠加闭包快照并绑定参数，返回后整体恢复。
 * 因此闭包看不到定义之后对外层的修改，函数体内的重新赋值也不会泄漏给调用方。</p>
 */
public final class Environment {

    private Map<String, GulValue> values = new LinkedHashMap<String, GulValue>();

    /** sealBuiltins 时登记的内置绑定 */
    private Map<String, GulValue> builtins = Collections.emptyMap();

    /**
     * 定义或覆盖变量。GUL 的 let / var / 赋值在此层不区分。
     */
    public void define(String name, GulValue value) {
        values.put(name, value);
    }

    /**
     * 查找变量
     *
     * @return 未定义时返回 null
     */
    public GulValue lookup(String name) {
        return values.get(name);
    }

    /**
     * 查找变量，未定义时抛出异常
     */
    public GulValue get(String name) {
        GulValue value = values.get(name);
        if (value == null) {
            throw new GulException("Undefined variable: " + name);
        }
        return value;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public void remove(String name) {
        values.remove(name);
    }

    /** 已绑定的全部名字（按定义顺序的副本） */
    public Set<String> names() {
        return new LinkedHashSet<String>(values.keySet());
    }

    public int size() {
        return values.size();
    }

    /**
     * 把当前已注册的绑定登记为内置，{@link #userBindings()} 据此过滤
     */
    public void sealBuiltins() {
        this.builtins = new LinkedHashMap<String, GulValue>(values);
    }

    public int getBuiltinCount() {
        return builtins.size();
    }

    /**
     * 用户代码产生的绑定：排除仍指向原内置值的名字，被重新赋值的内置名保留
     */
    public Map<String, GulValue> userBindings() {
        Map<String, GulValue> user = new LinkedHashMap<String, GulValue>();
        for (Map.Entry<String, GulValue> e : values.entrySet()) {
            if (builtins.get(e.getKey()) != e.getValue()) {
                user.put(e.getKey(), e.getValue());
            }
        }
        return user;
    }

    /**
     * 复制当前映射
     */
    public Map<String, GulValue> snapshot() {
        return new LinkedHashMap<String, GulValue>(values);
    }

    /**
     * 用快照整体替换当前映射，之后对快照的修改不影响环境
     */
    public void restore(Map<String, GulValue> snapshot) {
        this.values = new LinkedHashMap<String, GulValue>(snapshot);
    }

    /**
     * 把给定绑定叠加到当前映射上（同名覆盖）
     */
    public void overlay(Map<String, GulValue> bindings) {
        values.putAll(bindings);
    }

    /**
     * 与快照相比新增的绑定
     */
    public Map<String, GulValue> newSince(Map<String, GulValue> snapshot) {
        Map<String, GulValue> added = new LinkedHashMap<String, GulValue>();
        for (Map.Entry<String, GulValue> e : values.entrySet()) {
            if (!snapshot.containsKey(e.getKey())) {
                added.put(e.getKey(), e.getValue());
            }
        }
        return added;
    }

    public Map<String, GulValue> asMap() {
        return Collections.unmodifiableMap(values);
    }
}
