package com.gullang.compiler.source;

import java.util.ArrayList;
import java.util.List;

/**
 * 源码切分为行
 */
public final class SourceLines {

    public static final int TAB_WIDTH = 4;

    private SourceLines() {
    }

    /**
     * 按物理行切分（转译器逐行处理，续行由括号计数识别）
     */
    public static List<LogicalLine> physical(String source) {
        String[] raw = normalize(source).split("\n", -1);
        List<LogicalLine> lines = new ArrayList<LogicalLine>(raw.length);
        for (int i = 0; i < raw.length; i++) {
            lines.add(LogicalLine.of(i + 1, raw[i]));
        }
        return lines;
    }

    /**
     * 按逻辑行切分：括号未闭合或三引号字符串未结束时与后续物理行拼接
     */
    public static List<LogicalLine> logical(String source) {
        List<LogicalLine> physical = physical(source);
        List<LogicalLine> lines = new ArrayList<LogicalLine>(physical.size());
        int i = 0;
        while (i < physical.size()) {
            LogicalLine first = physical.get(i);
            int depth = bracketDelta(first.getCode());
            boolean inTriple = countTripleQuotes(first.getContent()) % 2 == 1;
            if (depth <= 0 && !inTriple) {
                lines.add(first);
                i++;
                continue;
            }
            StringBuilder content = new StringBuilder(first.getContent());
            StringBuilder code = new StringBuilder(inTriple ? first.getContent() : first.getCode());
            int j = i + 1;
            while (j < physical.size() && (depth > 0 || inTriple)) {
                LogicalLine next = physical.get(j);
                content.append('\n').append(next.getContent());
                if (inTriple) {
                    code.append('\n').append(next.getContent());
                    if (countTripleQuotes(next.getContent()) % 2 == 1) {
                        inTriple = false;
                    }
                } else {
                    code.append(' ').append(next.getCode());
                    depth += bracketDelta(next.getCode());
                }
                j++;
            }
            lines.add(new LogicalLine(first.getNumber(), first.getIndent(),
                    content.toString(), code.toString().trim(), first.getComment()));
            i = j;
        }
        return lines;
    }

    private static String normalize(String source) {
        return source.replace("\r\n", "\n").replace('\r', '\n');
    }

    /** 计算缩进深度，制表符按 {@link #TAB_WIDTH} 计 */
    public static int indentOf(String physical) {
        int indent = 0;
        for (int i = 0; i < physical.length(); i++) {
            char c = physical.charAt(i);
            if (c == ' ') {
                indent++;
            } else if (c == '\t') {
                indent += TAB_WIDTH;
            } else {
                break;
            }
        }
        return indent;
    }

    /**
     * 字符串外第一个 '#' 的位置，没有则返回 -1
     */
    public static int commentStart(String text) {
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '#') {
                return i;
            }
        }
        return -1;
    }

    /**
     * 字符串外开括号数减闭括号数
     */
    public static int bracketDelta(String code) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"':
                case '\'':
                    quote = c;
                    break;
                case '(':
                case '[':
                case '{':
                    depth++;
                    break;
                case ')':
                case ']':
                case '}':
                    depth--;
                    break;
                default:
                    break;
            }
        }
        return depth;
    }

    private static int countTripleQuotes(String text) {
        int count = 0;
        int idx = text.indexOf("\"\"\"");
        while (idx >= 0) {
            count++;
            idx = text.indexOf("\"\"\"", idx + 3);
        }
        return count;
    }
}
