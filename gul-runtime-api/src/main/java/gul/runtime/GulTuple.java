package gul.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * GUL 元组（不可变）
 */
public final class GulTuple extends GulValue implements Iterable<GulValue> {

    private final List<GulValue> elements;

    public GulTuple(Collection<? extends GulValue> values) {
        this.elements = Collections.unmodifiableList(new ArrayList<GulValue>(values));
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

    @Override
    public String getTypeName() {
        return "tuple";
    }

    @Override
    public boolean isTruthy() {
        return !elements.isEmpty();
    }

    @Override
    public String render() {
        if (elements.size() == 1) {
            return "(" + elements.get(0).repr() + ",)";
        }
        return "(" + GulList.joinRepr(elements) + ")";
    }

    @Override
    public Iterator<GulValue> iterator() {
        return elements.iterator();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof GulTuple && ((GulTuple) obj).elements.equals(elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode() * 31 + 7;
    }
}
