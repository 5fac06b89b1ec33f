package gul.runtime.interpreter;

import gul.runtime.GulDict;
import gul.runtime.GulList;
import gul.runtime.GulSet;
import gul.runtime.GulString;
import gul.runtime.GulTuple;
import gul.runtime.GulValue;

import java.util.ArrayList;
import java.util.List;

/**
 * 可迭代值的元素展开
 */
final class GulIterables {

    private GulIterables() {}

    static boolean isIterable(GulValue value) {
        return value instanceof GulList || value instanceof GulTuple || value instanceof GulSet
                || value instanceof GulDict || value instanceof GulString;
    }

    /**
     * 按迭代顺序复制出元素：字典取键，字符串取单字符
     */
    static List<GulValue> elements(GulValue value) {
        if (value instanceof GulList) {
            return new ArrayList<GulValue>(((GulList) value).getElements());
        }
        if (value instanceof GulTuple) {
            return new ArrayList<GulValue>(((GulTuple) value).getElements());
        }
        if (value instanceof GulSet) {
            return new ArrayList<GulValue>(((GulSet) value).getElements());
        }
        if (value instanceof GulDict) {
            return new ArrayList<GulValue>(((GulDict) value).getEntries().keySet());
        }
        if (value instanceof GulString) {
            String s = ((GulString) value).getValue();
            List<GulValue> chars = new ArrayList<GulValue>(s.length());
            for (int i = 0; i < s.length(); ) {
                int cp = s.codePointAt(i);
                chars.add(GulString.of(new String(Character.toChars(cp))));
                i += Character.charCount(cp);
            }
            return chars;
        }
        throw new GulRuntimeException("'" + value.getTypeName() + "' object is not iterable");
    }
}
