package com.gullang.compiler.transpiler;

import com.gullang.compiler.source.TextScanner;

import java.util.ArrayList;
import java.util.List;

/**
 * GUL 类型与集合写法到 Rust 的映射
 *
 * <p>同一个 {@code @list[...]} 在类型标注位置和值位置含义不同：
 * 标注里是元素类型（{@code Vec<T>}），值里是元素列表（{@code vec![...]}）。</p>
 */
public class TypeAndCollectionMapper {

    /** 未写元素类型的集合默认元素类型 */
    static final String DEFAULT_ELEMENT = "String";

    /**
     * 映射类型标注，如 {@code @list[@int]} → {@code Vec<i64>}
     */
    public String mapAnnotation(String type) {
        String t = type.trim();
        if (t.isEmpty()) {
            return t;
        }
        if (t.endsWith("?")) {
            return "Option<" + mapAnnotation(t.substring(0, t.length() - 1)) + ">";
        }
        if (t.startsWith("(") && t.endsWith(")")) {
            return "(" + joinMapped(TextScanner.splitTopLevel(t.substring(1, t.length() - 1), ',')) + ")";
        }
        boolean prefixed = t.startsWith("@");
        int nameStart = prefixed ? 1 : 0;
        int nameEnd = TextScanner.identEnd(t, nameStart);
        String name = t.substring(nameStart, nameEnd);
        List<String> args = new ArrayList<String>();
        String rest = t.substring(nameEnd).trim();
        if (rest.startsWith("[") || rest.startsWith("<")) {
            int open = t.indexOf(rest.charAt(0), nameEnd);
            int close = rest.startsWith("[") ? TextScanner.matchingClose(t, open) : t.lastIndexOf('>');
            if (close > open) {
                for (String arg : TextScanner.splitTopLevel(t.substring(open + 1, close), ',')) {
                    args.add(mapAnnotation(arg));
                }
            }
        } else if (!rest.isEmpty() || name.isEmpty()) {
            // 不是可识别的类型写法，原样保留
            return t;
        }
        return mapTypeName(name, args, prefixed);
    }

    private String mapTypeName(String name, List<String> args, boolean prefixed) {
        switch (name) {
            case "int":
            case "i64":
                return "i64";
            case "float":
            case "f64":
                return "f64";
            case "str":
            case "string":
                return "String";
            case "bool":
                return "bool";
            case "char":
                return "char";
            case "any":
                return DEFAULT_ELEMENT;
            case "list":
            case "vec":
                return "Vec<" + argOrDefault(args, 0) + ">";
            case "set":
                return "HashSet<" + argOrDefault(args, 0) + ">";
            case "dict":
            case "map":
                if (args.size() == 1) {
                    return "HashMap<" + DEFAULT_ELEMENT + ", " + args.get(0) + ">";
                }
                return "HashMap<" + argOrDefault(args, 0) + ", " + argOrDefault(args, 1) + ">";
            case "tuple":
                return "(" + String.join(", ", args) + ")";
            case "option":
            case "optional":
                return "Option<" + argOrDefault(args, 0) + ">";
            default:
                break;
        }
        // 用户类型：@Token / Token / Result[T, E]
        if (args.isEmpty()) {
            return name;
        }
        return name + "<" + String.join(", ", args) + ">";
    }

    private static String argOrDefault(List<String> args, int index) {
        return index < args.size() ? args.get(index) : DEFAULT_ELEMENT;
    }

    private String joinMapped(List<String> types) {
        List<String> mapped = new ArrayList<String>(types.size());
        for (String t : types) {
            mapped.add(mapAnnotation(t));
        }
        return String.join(", ", mapped);
    }

    /**
     * 映射值位置的集合与类型构造写法：
     * {@code @list[]} → {@code Vec::new()}，{@code [a, b]} → {@code vec![a, b]}，
     * {@code {k: v}} → {@code dict!{k => v}}，{@code @int(x)} → {@code (x) as i64}
     */
    public String mapValue(String expr) {
        StringBuilder out = new StringBuilder(expr.length() + 16);
        int i = 0;
        while (i < expr.length()) {
            char c = expr.charAt(i);
            if (c == '"' || c == '\'') {
                int end = TextScanner.stringEnd(expr, i);
                out.append(expr, i, end);
                i = end;
            } else if (c == '@' && i + 1 < expr.length() && Character.isLetter(expr.charAt(i + 1))) {
                i = mapTypeToken(expr, i, out);
            } else if (c == '[' && !isIndexOrGenericContext(expr, i)) {
                int close = TextScanner.matchingClose(expr, i);
                if (close < 0) {
                    out.append(c);
                    i++;
                } else {
                    out.append(listLiteral(expr.substring(i + 1, close)));
                    i = close + 1;
                }
            } else if (c == '{' && isBareBraceLiteral(expr, i)) {
                int close = TextScanner.matchingClose(expr, i);
                if (close < 0) {
                    out.append(c);
                    i++;
                } else {
                    out.append(braceLiteral(expr.substring(i + 1, close)));
                    i = close + 1;
                }
            } else if (c == '{' && TextScanner.isIdentChar(TextScanner.previousNonSpace(expr, i))) {
                int close = TextScanner.matchingClose(expr, i);
                if (close < 0) {
                    out.append(c);
                    i++;
                } else {
                    out.append(structLiteralBody(expr.substring(i + 1, close)));
                    i = close + 1;
                }
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /** 处理 '@' 开头的类型记号，返回继续扫描的位置 */
    private int mapTypeToken(String expr, int at, StringBuilder out) {
        int nameEnd = TextScanner.identEnd(expr, at + 1);
        String name = expr.substring(at + 1, nameEnd);
        char next = nameEnd < expr.length() ? expr.charAt(nameEnd) : 0;

        if ((next == '[' || next == '{') && isCollectionName(name)) {
            int close = TextScanner.matchingClose(expr, nameEnd);
            if (close < 0) {
                out.append(collectionPrefix(name, next));
                return nameEnd + 1;
            }
            String inner = expr.substring(nameEnd + 1, close);
            if (next == '[' && looksLikeTypeArguments(inner)) {
                out.append(turbofishNew(mapAnnotation(expr.substring(at, close + 1))));
                int after = close + 1;
                return expr.startsWith("()", after) ? after + 2 : after;
            }
            if ("list".equals(name)) {
                out.append(listLiteral(inner));
            } else if ("set".equals(name)) {
                out.append(setLiteral(TextScanner.splitTopLevel(inner, ',')));
            } else if ("dict".equals(name)) {
                out.append(dictLiteral(TextScanner.splitTopLevel(inner, ',')));
            } else {
                out.append('(').append(mapEach(TextScanner.splitTopLevel(inner, ','))).append(')');
            }
            return close + 1;
        }

        if (next == '(') {
            int close = TextScanner.matchingClose(expr, nameEnd);
            if (close > 0) {
                String arg = mapValue(expr.substring(nameEnd + 1, close).trim());
                out.append(typeConstructor(name, arg));
                return close + 1;
            }
        }

        out.append(mapAnnotation(expr.substring(at, nameEnd)));
        return nameEnd;
    }

    private static boolean isCollectionName(String name) {
        return "list".equals(name) || "set".equals(name) || "dict".equals(name) || "tuple".equals(name);
    }

    /** 多行字面量开头（@dict{ 行尾未闭合） */
    private static String collectionPrefix(String name, char open) {
        if ("dict".equals(name)) {
            return "dict!{";
        }
        if ("set".equals(name)) {
            return "HashSet::from([";
        }
        return open == '[' ? "vec![" : "(";
    }

    /** [ ... ] 里全是类型记号：@list[@int] */
    private static boolean looksLikeTypeArguments(String inner) {
        List<String> parts = TextScanner.splitTopLevel(inner, ',');
        if (parts.isEmpty()) {
            return false;
        }
        for (String part : parts) {
            if (!part.startsWith("@") || part.contains("(") || part.contains("{")) {
                return false;
            }
        }
        return true;
    }

    private static String turbofishNew(String rustType) {
        int lt = rustType.indexOf('<');
        if (lt < 0) {
            return rustType + "::new()";
        }
        return rustType.substring(0, lt) + "::" + rustType.substring(lt) + "::new()";
    }

    private String typeConstructor(String name, String arg) {
        switch (name) {
            case "int":
                return "(" + arg + ") as i64";
            case "float":
                return "(" + arg + ") as f64";
            case "str":
                return "(" + arg + ").to_string()";
            case "bool":
                return "(" + arg + ")";
            case "list":
                return arg.isEmpty() ? "Vec::new()" : "Vec::from(" + arg + ")";
            case "set":
                return arg.isEmpty() ? "HashSet::new()" : "HashSet::from(" + arg + ")";
            case "dict":
                return arg.isEmpty() ? "HashMap::new()" : "HashMap::from(" + arg + ")";
            default:
                return name + "(" + arg + ")";
        }
    }

    private String listLiteral(String inner) {
        List<String> items = TextScanner.splitTopLevel(inner, ',');
        if (items.isEmpty()) {
            return "Vec::new()";
        }
        return "vec![" + mapEach(items) + "]";
    }

    private String setLiteral(List<String> items) {
        if (items.isEmpty()) {
            return "HashSet::new()";
        }
        return "vec![" + mapEach(items) + "].into_iter().collect::<HashSet<_>>()";
    }

    private String dictLiteral(List<String> entries) {
        if (entries.isEmpty()) {
            return "HashMap::new()";
        }
        List<String> mapped = new ArrayList<String>(entries.size());
        for (String entry : entries) {
            mapped.add(dictEntry(entry));
        }
        return "dict!{" + String.join(", ", mapped) + "}";
    }

    /** k: v → k => v */
    public String dictEntry(String entry) {
        int colon = TextScanner.topLevelColon(entry);
        if (colon < 0) {
            return mapValue(entry);
        }
        return mapValue(entry.substring(0, colon).trim()) + " => "
                + mapValue(entry.substring(colon + 1).trim());
    }

    /** 裸 { ... }：有 ':' 的是字典，否则是集合 */
    private String braceLiteral(String inner) {
        List<String> items = TextScanner.splitTopLevel(inner, ',');
        if (items.isEmpty() || TextScanner.topLevelColon(items.get(0)) >= 0) {
            return dictLiteral(items);
        }
        return setLiteral(items);
    }

    /** Name{f: v} 保持 Rust 结构体构造写法，字段值递归映射 */
    private String structLiteralBody(String inner) {
        List<String> fields = TextScanner.splitTopLevel(inner, ',');
        List<String> mapped = new ArrayList<String>(fields.size());
        for (String field : fields) {
            mapped.add(structField(field));
        }
        return "{" + String.join(", ", mapped) + "}";
    }

    /** f: "s" → f: "s".to_string() */
    public String structField(String field) {
        int colon = TextScanner.topLevelColon(field);
        if (colon < 0) {
            return mapValue(field);
        }
        return field.substring(0, colon).trim() + ": "
                + ownedString(mapValue(field.substring(colon + 1).trim()));
    }

    /** 单独的字符串字面量作为值时转为 String */
    public static String ownedString(String value) {
        if (TextScanner.isStringLiteral(value)) {
            return value + ".to_string()";
        }
        return value;
    }

    private String mapEach(List<String> items) {
        List<String> mapped = new ArrayList<String>(items.size());
        for (String item : items) {
            mapped.add(ownedString(mapValue(item)));
        }
        return String.join(", ", mapped);
    }

    /** '[' 前是标识符、')' 或 ']' 时是索引访问 */
    private static boolean isIndexOrGenericContext(String expr, int at) {
        char prev = TextScanner.previousNonSpace(expr, at);
        if (prev == ')' || prev == ']') {
            return true;
        }
        if (!TextScanner.isIdentChar(prev)) {
            return prev == '!';
        }
        // 'in [1, 2]' / 'return [x]' 之类关键字后是列表字面量
        int end = at;
        while (end > 0 && Character.isWhitespace(expr.charAt(end - 1))) {
            end--;
        }
        int start = end;
        while (start > 0 && TextScanner.isIdentChar(expr.charAt(start - 1))) {
            start--;
        }
        String word = expr.substring(start, end);
        return !("in".equals(word) || "return".equals(word) || "and".equals(word)
                || "or".equals(word) || "not".equals(word));
    }

    /** '{' 前不是标识符（结构体构造）也不是 '!'（宏调用） */
    private static boolean isBareBraceLiteral(String expr, int at) {
        char prev = TextScanner.previousNonSpace(expr, at);
        return prev == 0 || "=(,[:{".indexOf(prev) >= 0 || (prev == 'n' && endsWithWord(expr, at, "return"));
    }

    private static boolean endsWithWord(String expr, int at, String word) {
        String before = expr.substring(0, at).trim();
        return before.endsWith(word)
                && (before.length() == word.length()
                || !TextScanner.isIdentChar(before.charAt(before.length() - word.length() - 1)));
    }
}
