package gul.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
 * GUL 列表（可变）
 */
public final class GulList extends GulValue implements Iterable<GulValue> {

    private final List<GulValue> elements;

    public GulList() {
        this.elements = new ArrayList<GulValue>();
    }

    public GulList(Collection<? extends GulValue> values) {
        this.elements = new ArrayList<GulValue>(values);
    }

    public List<GulValue> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public GulValue get(int index) {
        return elements.get(index);
    }

    public void set(int index, GulValue value) {
        elements.set(index, value);
    }

    public void add(GulValue value) {
        elements.add(value);
    }

    @Override
    public String getTypeName() {
        return "list";
    }

    @Override
    public boolean isTruthy() {
        return !elements.isEmpty();
    }

    @Override
    public String render() {
        return "[" + joinRepr(elements) + "]";
    }

    @Override
    public Iterator<GulValue> iterator() {
        return elements.iterator();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof GulList && ((GulList) obj).elements.equals(elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    static String joinRepr(Iterable<GulValue> values) {
        StringBuilder sb = new StringBuilder();
        for (GulValue v : values) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(v.repr());
        }
        return sb.toString();
    }
}
