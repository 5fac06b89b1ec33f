package com.gullang.compiler.source;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * 文本扫描工具：括号匹配、顶层切分、字符串感知的改写
 *
 * <p>所有方法都跳过字符串字面量内部的字符。</p>
 */
public final class TextScanner {

    private TextScanner() {
    }

    /**
     * 返回与 openIdx 处括号配对的闭括号下标，未闭合返回 -1
     */
    public static int matchingClose(String s, int openIdx) {
        int depth = 0;
        char quote = 0;
        for (int i = openIdx; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * 按顶层分隔符切分（括号与字符串内部的分隔符忽略），各段去除首尾空白，空段丢弃
     */
    public static List<String> splitTopLevel(String s, char sep) {
        List<String> parts = new ArrayList<String>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == sep && depth == 0) {
                addPart(parts, s.substring(start, i));
                start = i + 1;
            }
        }
        addPart(parts, s.substring(start));
        return parts;
    }

    private static void addPart(List<String> parts, String part) {
        String trimmed = part.trim();
        if (!trimmed.isEmpty()) {
            parts.add(trimmed);
        }
    }

    /**
     * 顶层二元 '+' 的位置（排除 '+=' 与一元正号），没有返回空列表
     */
    public static List<Integer> topLevelPluses(String s) {
        List<Integer> positions = new ArrayList<Integer>();
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == '+' && depth == 0) {
                boolean compound = i + 1 < s.length() && s.charAt(i + 1) == '=';
                String before = s.substring(0, i).trim();
                if (!compound && !before.isEmpty() && !endsWithOperator(before)) {
                    positions.add(i);
                }
            }
        }
        return positions;
    }

    private static boolean endsWithOperator(String s) {
        char last = s.charAt(s.length() - 1);
        return "+-*/%=<>!(,[{:".indexOf(last) >= 0;
    }

    /**
     * 顶层第一个赋值 '='（排除 == != <= >= =>，复合赋值返回其中 '=' 的位置）
     */
    public static int topLevelAssign(String s) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == '=' && depth == 0) {
                char prev = i > 0 ? s.charAt(i - 1) : ' ';
                char next = i + 1 < s.length() ? s.charAt(i + 1) : ' ';
                if (next == '=' || next == '>' || "=!<>".indexOf(prev) >= 0) {
                    if (next == '=' || next == '>') {
                        i++;
                    }
                    continue;
                }
                return i;
            }
        }
        return -1;
    }

    /** 顶层第一个 '=>' 的位置 */
    public static int topLevelArrow(String code) {
        char quote = 0;
        int depth = 0;
        for (int i = 0; i + 1 < code.length(); i++) {
            char c = code.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == '=' && code.charAt(i + 1) == '>' && depth == 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 顶层第一个 ':' 的位置
     */
    public static int topLevelColon(String s) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ':' && depth == 0) {
                if (i + 1 < s.length() && s.charAt(i + 1) == ':') {
                    i++;
                    continue;
                }
                return i;
            }
        }
        return -1;
    }

    /**
     * 顶层单词出现的位置（单词边界、不在字符串或括号内），没有返回 -1
     */
    public static int topLevelWord(String s, String word) {
        return topLevelWord(s, word, 0);
    }

    public static int topLevelWord(String s, String word, int from) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (depth == 0 && i >= from && s.startsWith(word, i)
                    && (i == 0 || !isIdentChar(s.charAt(i - 1)))
                    && (i + word.length() >= s.length() || !isIdentChar(s.charAt(i + word.length())))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 只对字符串字面量之外的代码段应用改写，单引号字符串转成双引号
     */
    public static String mapCode(String s, UnaryOperator<String> rewrite) {
        StringBuilder out = new StringBuilder(s.length() + 16);
        StringBuilder code = new StringBuilder();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '"' || c == '\'') {
                int end = stringEnd(s, i);
                out.append(rewrite.apply(code.toString()));
                code.setLength(0);
                out.append(c == '\'' ? toDoubleQuoted(s.substring(i, end)) : s.substring(i, end));
                i = end;
            } else {
                code.append(c);
                i++;
            }
        }
        out.append(rewrite.apply(code.toString()));
        return out.toString();
    }

    /** 字符串字面量结束位置（不含），未闭合返回 s.length() */
    public static int stringEnd(String s, int start) {
        char quote = s.charAt(start);
        for (int i = start + 1; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == quote) {
                return i + 1;
            }
        }
        return s.length();
    }

    private static String toDoubleQuoted(String literal) {
        if (literal.length() < 2 || !literal.endsWith("'")) {
            return literal;
        }
        String body = literal.substring(1, literal.length() - 1)
                .replace("\\'", "'")
                .replace("\"", "\\\"");
        return "\"" + body + "\"";
    }

    /** 整段文本是一个字符串字面量 */
    public static boolean isStringLiteral(String s) {
        if (s.length() < 2) {
            return false;
        }
        char c = s.charAt(0);
        return (c == '"' || c == '\'') && stringEnd(s, 0) == s.length();
    }

    public static boolean isIdentChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /** 从 start 开始的标识符结束位置 */
    public static int identEnd(String s, int start) {
        int i = start;
        while (i < s.length() && isIdentChar(s.charAt(i))) {
            i++;
        }
        return i;
    }

    /** start 之前最近的非空白字符，没有返回 0 */
    public static char previousNonSpace(String s, int start) {
        for (int i = start - 1; i >= 0; i--) {
            if (!Character.isWhitespace(s.charAt(i))) {
                return s.charAt(i);
            }
        }
        return 0;
    }

    /**
     * 行内未闭合的开括号对应的闭括号序列（由内向外），用于合成后缀
     */
    public static String unclosedClosers(String s) {
        StringBuilder stack = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                stack.append(')');
            } else if (c == '[') {
                stack.append(']');
            } else if (c == '{') {
                stack.append('}');
            } else if ((c == ')' || c == ']' || c == '}') && stack.length() > 0) {
                stack.setLength(stack.length() - 1);
            }
        }
        return stack.reverse().toString();
    }
}
