package gul.runtime;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GUL 字典（保持插入顺序）
 */
public final class GulDict extends GulValue implements Iterable<GulValue> {

    private final Map<GulValue, GulValue> entries;

    public GulDict() {
        this.entries = new LinkedHashMap<GulValue, GulValue>();
    }

    public GulDict(Map<GulValue, GulValue> entries) {
        this.entries = new LinkedHashMap<GulValue, GulValue>(entries);
    }

    public Map<GulValue, GulValue> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    /** 键不存在返回 null */
    public GulValue get(GulValue key) {
        return entries.get(key);
    }

    public void put(GulValue key, GulValue value) {
        entries.put(key, value);
    }

    public boolean containsKey(GulValue key) {
        return entries.containsKey(key);
    }

    public GulList keys() {
        return new GulList(entries.keySet());
    }

    public GulList values() {
        return new GulList(entries.values());
    }

    /** [(k, v), ...] */
    public GulList items() {
        GulList list = new GulList();
        for (Map.Entry<GulValue, GulValue> e : entries.entrySet()) {
            ArrayList<GulValue> pair = new ArrayList<GulValue>(2);
            pair.add(e.getKey());
            pair.add(e.getValue());
            list.add(new GulTuple(pair));
        }
        return list;
    }

    @Override
    public String getTypeName() {
        return "dict";
    }

    @Override
    public boolean isTruthy() {
        return !entries.isEmpty();
    }

    @Override
    public String render() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<GulValue, GulValue> e : entries.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(e.getKey().repr()).append(": ").append(e.getValue().repr());
        }
        return sb.append('}').toString();
    }

    /** 迭代键 */
    @Override
    public Iterator<GulValue> iterator() {
        return entries.keySet().iterator();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof GulDict && ((GulDict) obj).entries.equals(entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }
}
