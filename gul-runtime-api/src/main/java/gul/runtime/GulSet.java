package gul.runtime;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * GUL 集合（保持插入顺序）
 */
public final class GulSet extends GulValue implements Iterable<GulValue> {

    private final Set<GulValue> elements;

    public GulSet() {
        this.elements = new LinkedHashSet<GulValue>();
    }

    public GulSet(Collection<? extends GulValue> values) {
        this.elements = new LinkedHashSet<GulValue>(values);
    }

    public Set<GulValue> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public boolean contains(GulValue value) {
        return elements.contains(value);
    }

    @Override
    public String getTypeName() {
        return "set";
    }

    @Override
    public boolean isTruthy() {
        return !elements.isEmpty();
    }

    @Override
    public String render() {
        if (elements.isEmpty()) {
            return "set()";
        }
        return "{" + GulList.joinRepr(elements) + "}";
    }

    @Override
    public Iterator<GulValue> iterator() {
        return elements.iterator();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof GulSet && ((GulSet) obj).elements.equals(elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }
}
