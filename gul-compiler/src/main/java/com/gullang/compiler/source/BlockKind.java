package com.gullang.compiler.source;

/**
 * 块类型
 */
public enum BlockKind {
    STRUCT,
    ENUM,
    IMPL,
    FN,
    MAIN,       // mn:
    IF,
    ELSE,       // elif / else
    WHILE,
    FOR,
    TRY,
    CATCH,
    MATCH,
    MATCH_ARM,  // pattern =>（块形式分支）
    LITERAL,    // 以 '{' 结尾的表达式行（多行字面量/结构体构造）
    OTHER;

    /**
     * 根据块头文本（已去掉注释）判断类型
     */
    public static BlockKind classify(String code) {
        String word = firstWord(code);
        switch (word) {
            case "struct": return STRUCT;
            case "enum": return ENUM;
            case "impl": return IMPL;
            case "fn":
            case "async":
                return FN;
            case "mn": return MAIN;
            case "if": return IF;
            case "elif":
            case "else":
                return ELSE;
            case "while": return WHILE;
            case "for": return FOR;
            case "try": return TRY;
            case "catch":
            case "except":
                return CATCH;
            case "match": return MATCH;
            default:
                break;
        }
        if (code.contains("=>")) {
            return MATCH_ARM;
        }
        if (code.endsWith("{")) {
            return LITERAL;
        }
        return OTHER;
    }

    /** 首个单词（遇到非标识符字符截止） */
    public static String firstWord(String code) {
        int end = 0;
        while (end < code.length()
                && (Character.isLetterOrDigit(code.charAt(end)) || code.charAt(end) == '_')) {
            end++;
        }
        return code.substring(0, end);
    }

    /** 块体内的行需要以 ',' 结尾 */
    public boolean commaSeparated() {
        return this == STRUCT || this == ENUM || this == MATCH || this == LITERAL;
    }
}
