package gul.runtime.interpreter;

import gul.runtime.GulBoolean;
import gul.runtime.GulDict;
import gul.runtime.GulInt;
import gul.runtime.GulList;
import gul.runtime.GulNone;
import gul.runtime.GulSet;
import gul.runtime.GulString;
import gul.runtime.GulTuple;
import gul.runtime.GulValue;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 内置类型的原生方法（list / str / dict / set / tuple）
 *
 * <p>方法调用的第一站：找不到时返回 null，由调用方继续查结构体方法表。</p>
 */
final class NativeMethods {

    private static final Pattern FORMAT_FIELD = Pattern.compile("\\{(\\d*)\\}");

    private NativeMethods() {}

    /**
     * @return 方法结果；receiver 的类型没有该方法时返回 null
     */
    static GulValue invoke(GulValue receiver, String name, List<GulValue> args) {
        if (receiver instanceof GulList) {
            return listMethod((GulList) receiver, name, args);
        }
        if (receiver instanceof GulString) {
            return stringMethod((GulString) receiver, name, args);
        }
        if (receiver instanceof GulDict) {
            return dictMethod((GulDict) receiver, name, args);
        }
        if (receiver instanceof GulSet) {
            return setMethod((GulSet) receiver, name, args);
        }
        if (receiver instanceof GulTuple) {
            return tupleMethod((GulTuple) receiver, name, args);
        }
        return null;
    }

    // ============ list ============

    private static GulValue listMethod(GulList list, String name, List<GulValue> args) {
        List<GulValue> elements = list.getElements();
        switch (name) {
            case "append":
            case "add":
                elements.add(arg(args, 0, name));
                return GulNone.NONE;
            case "pop": {
                if (elements.isEmpty()) {
                    throw new GulRuntimeException("pop from empty list");
                }
                int index = args.isEmpty() ? elements.size() - 1 : normalizeIndex(args.get(0), elements.size());
                return elements.remove(index);
            }
            case "insert": {
                int size = elements.size();
                long raw = arg(args, 0, name).asLong();
                long index = raw < 0 ? Math.max(0, raw + size) : Math.min(raw, size);
                elements.add((int) index, arg(args, 1, name));
                return GulNone.NONE;
            }
            case "remove":
                if (!elements.remove(arg(args, 0, name))) {
                    throw new GulRuntimeException("list.remove(x): x not in list");
                }
                return GulNone.NONE;
            case "extend":
                elements.addAll(GulIterables.elements(arg(args, 0, name)));
                return GulNone.NONE;
            case "index": {
                int i = elements.indexOf(arg(args, 0, name));
                if (i < 0) {
                    throw new GulRuntimeException(args.get(0).repr() + " is not in list");
                }
                return GulInt.of(i);
            }
            case "count":
                return GulInt.of(Collections.frequency(elements, arg(args, 0, name)));
            case "clear":
                elements.clear();
                return GulNone.NONE;
            case "contains":
                return GulBoolean.of(elements.contains(arg(args, 0, name)));
            case "copy":
                return new GulList(elements);
            case "reverse":
                Collections.reverse(elements);
                return GulNone.NONE;
            case "sort":
                elements.sort((a, b) -> BinaryOps.compare(a, b, "<"));
                return GulNone.NONE;
            default:
                return null;
        }
    }

    // ============ str ============

    private static GulValue stringMethod(GulString str, String name, List<GulValue> args) {
        String s = str.getValue();
        switch (name) {
            case "upper":
                return GulString.of(s.toUpperCase());
            case "lower":
                return GulString.of(s.toLowerCase());
            case "strip":
                return GulString.of(s.trim());
            case "lstrip":
                return GulString.of(s.replaceAll("^\\s+", ""));
            case "rstrip":
                return GulString.of(s.replaceAll("\\s+$", ""));
            case "split":
                return split(s, args.isEmpty() || args.get(0).isNone() ? null : stringArg(args, 0, name));
            case "join": {
                StringBuilder sb = new StringBuilder();
                List<GulValue> parts = GulIterables.elements(arg(args, 0, name));
                for (int i = 0; i < parts.size(); i++) {
                    if (i > 0) {
                        sb.append(s);
                    }
                    sb.append(parts.get(i).render());
                }
                return GulString.of(sb.toString());
            }
            case "replace":
                return GulString.of(s.replace(stringArg(args, 0, name), stringArg(args, 1, name)));
            case "startswith":
                return GulBoolean.of(s.startsWith(stringArg(args, 0, name)));
            case "endswith":
                return GulBoolean.of(s.endsWith(stringArg(args, 0, name)));
            case "find":
                return GulInt.of(s.indexOf(stringArg(args, 0, name)));
            case "contains":
                return GulBoolean.of(s.contains(stringArg(args, 0, name)));
            case "isdigit":
                return GulBoolean.of(!s.isEmpty() && s.chars().allMatch(Character::isDigit));
            case "isalpha":
                return GulBoolean.of(!s.isEmpty() && s.chars().allMatch(Character::isLetter));
            case "format":
                return GulString.of(format(s, args));
            default:
                return null;
        }
    }

    private static GulList split(String s, String separator) {
        GulList result = new GulList();
        if (separator == null) {
            String trimmed = s.trim();
            if (trimmed.isEmpty()) {
                return result;
            }
            for (String part : trimmed.split("\\s+")) {
                result.add(GulString.of(part));
            }
            return result;
        }
        if (separator.isEmpty()) {
            throw new GulRuntimeException("empty separator");
        }
        for (String part : s.split(Pattern.quote(separator), -1)) {
            result.add(GulString.of(part));
        }
        return result;
    }

    // {} 依次取参数，{n} 取第 n 个
    private static String format(String template, List<GulValue> args) {
        String escaped = template.replace("{{", "\u0000").replace("}}", "\u0001");
        Matcher m = FORMAT_FIELD.matcher(escaped);
        StringBuffer sb = new StringBuffer();
        int next = 0;
        while (m.find()) {
            int index = m.group(1).isEmpty() ? next++ : Integer.parseInt(m.group(1));
            if (index >= args.size()) {
                throw new GulRuntimeException("Replacement index " + index + " out of range for positional args tuple");
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(args.get(index).render()));
        }
        m.appendTail(sb);
        return sb.toString().replace('\u0000', '{').replace('\u0001', '}');
    }

    // ============ dict ============

    private static GulValue dictMethod(GulDict dict, String name, List<GulValue> args) {
        Map<GulValue, GulValue> entries = dict.getEntries();
        switch (name) {
            case "get": {
                GulValue value = entries.get(arg(args, 0, name));
                if (value != null) {
                    return value;
                }
                return args.size() > 1 ? args.get(1) : GulNone.NONE;
            }
            case "keys":
                return dict.keys();
            case "values":
                return dict.values();
            case "items":
                return dict.items();
            case "pop": {
                GulValue key = arg(args, 0, name);
                if (entries.containsKey(key)) {
                    return entries.remove(key);
                }
                if (args.size() > 1) {
                    return args.get(1);
                }
                throw new GulRuntimeException("KeyError: " + key.repr());
            }
            case "update": {
                GulValue other = arg(args, 0, name);
                if (!(other instanceof GulDict)) {
                    throw new GulRuntimeException("dict.update() argument must be a dict, not " + other.getTypeName());
                }
                entries.putAll(((GulDict) other).getEntries());
                return GulNone.NONE;
            }
            case "contains":
                return GulBoolean.of(entries.containsKey(arg(args, 0, name)));
            case "clear":
                entries.clear();
                return GulNone.NONE;
            default:
                return null;
        }
    }

    // ============ set / tuple ============

    private static GulValue setMethod(GulSet set, String name, List<GulValue> args) {
        switch (name) {
            case "add":
                set.getElements().add(arg(args, 0, name));
                return GulNone.NONE;
            case "remove": {
                GulValue item = arg(args, 0, name);
                if (!set.getElements().remove(item)) {
                    throw new GulRuntimeException("KeyError: " + item.repr());
                }
                return GulNone.NONE;
            }
            case "contains":
                return GulBoolean.of(set.contains(arg(args, 0, name)));
            default:
                return null;
        }
    }

    private static GulValue tupleMethod(GulTuple tuple, String name, List<GulValue> args) {
        List<GulValue> elements = tuple.getElements();
        switch (name) {
            case "index": {
                int i = elements.indexOf(arg(args, 0, name));
                if (i < 0) {
                    throw new GulRuntimeException("tuple.index(x): x not in tuple");
                }
                return GulInt.of(i);
            }
            case "count":
                return GulInt.of(Collections.frequency(elements, arg(args, 0, name)));
            default:
                return null;
        }
    }

    // ============ 参数辅助 ============

    private static GulValue arg(List<GulValue> args, int index, String method) {
        if (index >= args.size()) {
            throw new GulRuntimeException(method + "() missing required argument " + (index + 1));
        }
        return args.get(index);
    }

    private static String stringArg(List<GulValue> args, int index, String method) {
        GulValue value = arg(args, index, method);
        if (!(value instanceof GulString)) {
            throw new GulRuntimeException(method + "() argument must be str, not " + value.getTypeName());
        }
        return ((GulString) value).getValue();
    }

    /** 支持负下标，越界抛出 IndexError */
    static int normalizeIndex(GulValue index, int size) {
        long i = index.asLong();
        if (i < 0) {
            i += size;
        }
        if (i < 0 || i >= size) {
            throw new GulRuntimeException("IndexError: index " + index.render() + " out of range");
        }
        return (int) i;
    }
}
