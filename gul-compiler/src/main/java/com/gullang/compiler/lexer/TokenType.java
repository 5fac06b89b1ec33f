package com.gullang.compiler.lexer;

/**
 * GUL 表达式词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    FSTRING,                // f"...{expr}..."

    // === 标识符 ===
    IDENTIFIER,
    TYPE_NAME,              // @int / @list / @dict ...

    // === 关键词 ===
    KW_TRUE, KW_FALSE, KW_NONE,
    KW_AND, KW_OR, KW_NOT, KW_IN,

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    MOD,            // %

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    LE,             // <=
    GT,             // >
    GE,             // >=

    // === 操作符 - 逻辑 ===
    AND,            // &&
    OR,             // ||
    NOT,            // !

    // === 操作符 - 赋值 ===
    ASSIGN,         // =
    PLUS_ASSIGN,    // +=
    MINUS_ASSIGN,   // -=
    MUL_ASSIGN,     // *=
    DIV_ASSIGN,     // /=

    // === 分隔符 ===
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    LBRACKET, RBRACKET,
    COMMA,
    COLON,
    DOT,
    ARROW,          // ->
    DOUBLE_ARROW,   // =>

    // === 特殊 ===
    ERROR,
    EOF
}
