package com.gullang.compiler.transpiler;

import com.gullang.compiler.source.TextScanner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 表达式文本改写：关键字运算符、f-string、内置调用、方法名、集合写法、字符串拼接
 */
public class ExpressionRewriter {

    private static final Pattern NOT = Pattern.compile("\\bnot\\s+");
    private static final Pattern AND = Pattern.compile("\\band\\b");
    private static final Pattern OR = Pattern.compile("\\bor\\b");
    private static final Pattern TRUE = Pattern.compile("\\bTrue\\b");
    private static final Pattern FALSE = Pattern.compile("\\bFalse\\b");
    private static final Pattern TYPE_PATH = Pattern.compile("\\b([A-Z]\\w*)\\.([A-Za-z_]\\w*)(\\s*\\()?");

    private static final Map<String, String> METHOD_RENAMES;

    static {
        Map<String, String> map = new LinkedHashMap<String, String>();
        map.put("append", "push");
        map.put("add", "push");
        map.put("upper", "to_uppercase");
        map.put("lower", "to_lowercase");
        map.put("strip", "trim");
        map.put("startswith", "starts_with");
        map.put("endswith", "ends_with");
        map.put("items", "iter");
        METHOD_RENAMES = Collections.unmodifiableMap(map);
    }

    private final TypeAndCollectionMapper mapper;
    private final Set<String> knownEnums;
    private final Set<String> knownStructs;

    public ExpressionRewriter(TypeAndCollectionMapper mapper, Set<String> knownEnums, Set<String> knownStructs) {
        this.mapper = mapper;
        this.knownEnums = knownEnums;
        this.knownStructs = knownStructs;
    }

    public TypeAndCollectionMapper getMapper() {
        return mapper;
    }

    public Set<String> getKnownEnums() {
        return knownEnums;
    }

    /**
     * 改写一个完整表达式
     */
    public String rewrite(String expr) {
        String e = expr.trim();
        if (e.isEmpty()) {
            return e;
        }
        String print = rewritePrint(e);
        if (print != null) {
            return print;
        }
        e = rewriteFStrings(e);
        e = rewriteLen(e);
        e = rewriteMembership(e);
        e = TextScanner.mapCode(e, this::rewriteWords);
        e = mapper.mapValue(e);
        return rewriteConcat(e);
    }

    /** 值位置：单独的字符串字面量转为 String */
    public String rewriteValue(String expr) {
        return TypeAndCollectionMapper.ownedString(rewrite(expr));
    }

    /**
     * 条件表达式，与 rewrite 相同但去掉多余的外层括号
     */
    public String rewriteCondition(String cond) {
        String c = rewrite(cond);
        if (c.startsWith("(") && TextScanner.matchingClose(c, 0) == c.length() - 1) {
            return c.substring(1, c.length() - 1).trim();
        }
        return c;
    }

    // print(a, b) → println!("{} {}", a, b)
    private String rewritePrint(String e) {
        if (!e.startsWith("print(") || TextScanner.matchingClose(e, 5) != e.length() - 1) {
            return null;
        }
        List<String> args = TextScanner.splitTopLevel(e.substring(6, e.length() - 1), ',');
        if (args.isEmpty()) {
            return "println!()";
        }
        StringBuilder placeholders = new StringBuilder();
        List<String> rewritten = new ArrayList<String>(args.size());
        for (String arg : args) {
            if (placeholders.length() > 0) {
                placeholders.append(' ');
            }
            placeholders.append("{}");
            rewritten.add(rewrite(arg));
        }
        return "println!(\"" + placeholders + "\", " + String.join(", ", rewritten) + ")";
    }

    // f"a{x}b" → format!("a{}b", x)
    private String rewriteFStrings(String e) {
        StringBuilder out = new StringBuilder(e.length() + 16);
        int i = 0;
        while (i < e.length()) {
            char c = e.charAt(i);
            if (c == 'f' && i + 1 < e.length() && (e.charAt(i + 1) == '"' || e.charAt(i + 1) == '\'')
                    && (i == 0 || !TextScanner.isIdentChar(e.charAt(i - 1)))) {
                int end = TextScanner.stringEnd(e, i + 1);
                out.append(formatCall(e.substring(i + 2, end - 1)));
                i = end;
            } else if (c == '"' || c == '\'') {
                int end = TextScanner.stringEnd(e, i);
                out.append(e, i, end);
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private String formatCall(String body) {
        StringBuilder template = new StringBuilder();
        List<String> args = new ArrayList<String>();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if ((c == '{' || c == '}') && i + 1 < body.length() && body.charAt(i + 1) == c) {
                template.append(c).append(c);
                i += 2;
            } else if (c == '{') {
                int close = TextScanner.matchingClose(body, i);
                if (close < 0) {
                    template.append(body.substring(i));
                    break;
                }
                String inner = body.substring(i + 1, close);
                int colon = TextScanner.topLevelColon(inner);
                if (colon >= 0) {
                    template.append("{:").append(inner.substring(colon + 1)).append('}');
                    inner = inner.substring(0, colon);
                } else {
                    template.append("{}");
                }
                args.add(rewrite(inner));
                i = close + 1;
            } else if (c == '"') {
                template.append("\\\"");
                i++;
            } else {
                template.append(c);
                i++;
            }
        }
        if (args.isEmpty()) {
            return "format!(\"" + template + "\")";
        }
        return "format!(\"" + template + "\", " + String.join(", ", args) + ")";
    }

    // len(x) → (x).len()
    private String rewriteLen(String e) {
        StringBuilder out = new StringBuilder(e.length());
        int i = 0;
        while (i < e.length()) {
            char c = e.charAt(i);
            if (c == '"' || c == '\'') {
                int end = TextScanner.stringEnd(e, i);
                out.append(e, i, end);
                i = end;
                continue;
            }
            if (e.startsWith("len(", i) && (i == 0 || (!TextScanner.isIdentChar(e.charAt(i - 1))
                    && e.charAt(i - 1) != '.'))) {
                int close = TextScanner.matchingClose(e, i + 3);
                if (close > 0) {
                    out.append('(').append(rewrite(e.substring(i + 4, close))).append(").len()");
                    i = close + 1;
                    continue;
                }
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    // a in b → b.contains(&a)，a not in b → !b.contains(&a)
    private String rewriteMembership(String e) {
        if (TextScanner.topLevelWord(e, "in") < 0 || e.startsWith("for ")) {
            return e;
        }
        List<String> pieces = new ArrayList<String>();
        List<String> separators = new ArrayList<String>();
        splitLogical(e, pieces, separators);
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < pieces.size(); i++) {
            if (i > 0) {
                out.append(' ').append(separators.get(i - 1)).append(' ');
            }
            out.append(membershipPiece(pieces.get(i)));
        }
        return out.toString();
    }

    private static void splitLogical(String e, List<String> pieces, List<String> separators) {
        int start = 0;
        while (true) {
            int and = TextScanner.topLevelWord(e, "and", start);
            int or = TextScanner.topLevelWord(e, "or", start);
            int next;
            String sep;
            if (and >= 0 && (or < 0 || and < or)) {
                next = and;
                sep = "and";
            } else if (or >= 0) {
                next = or;
                sep = "or";
            } else {
                break;
            }
            pieces.add(e.substring(start, next).trim());
            separators.add(sep);
            start = next + sep.length();
        }
        pieces.add(e.substring(start).trim());
    }

    private static String membershipPiece(String piece) {
        int in = TextScanner.topLevelWord(piece, "in");
        if (in < 0) {
            return piece;
        }
        String left = piece.substring(0, in).trim();
        String right = piece.substring(in + 2).trim();
        boolean negated = false;
        if (left.endsWith(" not")) {
            negated = true;
            left = left.substring(0, left.length() - 4).trim();
        }
        String call = right + ".contains(&" + left + ")";
        return negated ? "!" + call : call;
    }

    /** 字符串之外的代码段 */
    private String rewriteWords(String code) {
        if (code.isEmpty()) {
            return code;
        }
        String c = NOT.matcher(code).replaceAll("!");
        c = AND.matcher(c).replaceAll("&&");
        c = OR.matcher(c).replaceAll("||");
        c = TRUE.matcher(c).replaceAll("true");
        c = FALSE.matcher(c).replaceAll("false");
        c = rewriteTypePaths(c);
        for (Map.Entry<String, String> rename : METHOD_RENAMES.entrySet()) {
            c = c.replace("." + rename.getKey() + "(", "." + rename.getValue() + "(");
        }
        return c;
    }

    // Enum.Variant → Enum::Variant，Struct.method( → Struct::method(
    private String rewriteTypePaths(String code) {
        Matcher m = TYPE_PATH.matcher(code);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            String type = m.group(1);
            String member = m.group(2);
            boolean call = m.group(3) != null;
            boolean path = knownEnums.contains(type)
                    || (call && knownStructs.contains(type))
                    || (!call && Character.isUpperCase(member.charAt(0)));
            String replacement = path
                    ? type + "::" + member + (call ? m.group(3) : "")
                    : m.group();
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    // "s" + x → "s".add_gul(x)
    private static String rewriteConcat(String e) {
        List<Integer> pluses = TextScanner.topLevelPluses(e);
        if (pluses.isEmpty()) {
            return e;
        }
        List<String> operands = new ArrayList<String>(pluses.size() + 1);
        int start = 0;
        for (int p : pluses) {
            operands.add(e.substring(start, p).trim());
            start = p + 1;
        }
        operands.add(e.substring(start).trim());

        boolean stringy = false;
        for (String op : operands) {
            if (isStringProducing(op)) {
                stringy = true;
                break;
            }
        }
        if (!stringy) {
            return e;
        }
        String first = operands.get(0);
        StringBuilder out = new StringBuilder(isStringProducing(first)
                ? first : "format!(\"{}\", " + first + ")");
        for (int i = 1; i < operands.size(); i++) {
            out.append(".add_gul(").append(operands.get(i)).append(')');
        }
        return out.toString();
    }

    private static boolean isStringProducing(String operand) {
        return TextScanner.isStringLiteral(operand) || operand.startsWith("format!(");
    }
}
