package com.gullang.compiler.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * GUL 表达式词法分析器
 *
 * <p>输入是一条逻辑行中的表达式文本（可能由多个物理行拼接而成），
 * 块结构由缩进处理，不在此处产生换行或缩进 Token。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line;
    private int column = 1;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        map.put("true", TokenType.KW_TRUE);
        map.put("True", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("False", TokenType.KW_FALSE);
        map.put("None", TokenType.KW_NONE);

        // 单词形式的逻辑运算符
        map.put("and", TokenType.KW_AND);
        map.put("or", TokenType.KW_OR);
        map.put("not", TokenType.KW_NOT);
        map.put("in", TokenType.KW_IN);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName, int line) {
        this.source = source;
        this.fileName = fileName;
        this.line = line;
    }

    public Lexer(String source) {
        this(source, "<input>", 1);
    }

    public String getSource() {
        return source;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            if (!scanToken()) {
                break;
            }
        }

        tokens.add(new Token(TokenType.EOF, "", null, line, column, current));
        return tokens;
    }

    /**
     * @return false 表示遇到行尾注释，停止扫描
     */
    private boolean scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '.': addToken(TokenType.DOT); break;
            case '%': addToken(TokenType.MOD); break;

            case '#':
                // 注释直到逻辑行结束
                current = source.length();
                return false;

            case '+':
                addToken(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS);
                break;

            case '-':
                if (match('=')) addToken(TokenType.MINUS_ASSIGN);
                else if (match('>')) addToken(TokenType.ARROW);
                else addToken(TokenType.MINUS);
                break;

            case '*':
                addToken(match('=') ? TokenType.MUL_ASSIGN : TokenType.MUL);
                break;

            case '/':
                addToken(match('=') ? TokenType.DIV_ASSIGN : TokenType.DIV);
                break;

            case '=':
                if (match('=')) addToken(TokenType.EQ);
                else if (match('>')) addToken(TokenType.DOUBLE_ARROW);
                else addToken(TokenType.ASSIGN);
                break;

            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.NOT);
                break;

            case '<':
                addToken(match('=') ? TokenType.LE : TokenType.LT);
                break;

            case '>':
                addToken(match('=') ? TokenType.GE : TokenType.GT);
                break;

            case '&':
                if (match('&')) {
                    addToken(TokenType.AND);
                } else {
                    error("Unexpected character '&'. Did you mean '&&'?");
                }
                break;

            case '|':
                if (match('|')) {
                    addToken(TokenType.OR);
                } else {
                    error("Unexpected character '|'. Did you mean '||'?");
                }
                break;

            case '@':
                typeName();
                break;

            // 空白字符（拼接后的逻辑行可能含换行）
            case ' ':
            case '\r':
            case '\t':
                break;

            case '\n':
                line++;
                column = 1;
                break;

            case '"':
            case '\'':
                if (c == '"' && peek() == '"' && peekNext() == '"') {
                    advance();
                    advance();
                    tripleString();
                } else {
                    string(c, TokenType.STRING_LITERAL);
                }
                break;

            // f-string: f"..."
            case 'f':
                if (peek() == '"' || peek() == '\'') {
                    string(advance(), TokenType.FSTRING);
                } else {
                    identifier();
                }
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
        return true;
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        int tokenColumn = column - (current - start);
        tokens.add(new Token(type, lexeme, literal, line, tokenColumn, start));
    }

    // === 复杂 Token 扫描 ===

    /**
     * 单行字符串。f-string 保留原始内容（转义留给插值解析），
     * 花括号内允许出现另一种引号的字符串。
     */
    private void string(char quote, TokenType type) {
        StringBuilder value = new StringBuilder();
        int braceDepth = 0;
        char innerQuote = 0;

        while (!isAtEnd()) {
            char c = peek();
            if (innerQuote != 0) {
                if (c == innerQuote) innerQuote = 0;
                value.append(advance());
                continue;
            }
            if (c == quote && braceDepth == 0) {
                break;
            }
            if (c == '\\') {
                advance();
                if (isAtEnd()) break;
                if (type == TokenType.FSTRING) {
                    value.append('\\').append(advance());
                } else {
                    LiteralEscapes.appendEscape(value, advance());
                }
                continue;
            }
            if (type == TokenType.FSTRING) {
                if (c == '{' && peekNext() != '{') {
                    braceDepth++;
                } else if (c == '}' && braceDepth > 0) {
                    braceDepth--;
                } else if (braceDepth > 0 && (c == '"' || c == '\'')) {
                    innerQuote = c;
                } else if ((c == '{' || c == '}') && braceDepth == 0 && peekNext() == c) {
                    value.append(advance());
                }
            }
            value.append(advance());
        }

        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }

        advance(); // 闭合引号
        addToken(type, value.toString());
    }

    private void tripleString() {
        boolean terminated = false;
        while (!isAtEnd()) {
            if (peek() == '"' && current + 2 < source.length()
                    && source.charAt(current + 1) == '"'
                    && source.charAt(current + 2) == '"') {
                advance();
                advance();
                advance();
                terminated = true;
                break;
            }
            if (peek() == '\n') {
                line++;
                column = 0;
            }
            advance();
        }

        if (!terminated) {
            error("Unterminated multiline string");
            return;
        }

        addToken(TokenType.STRING_LITERAL, source.substring(start + 3, current - 3));
    }

    private void number() {
        while (isDigit(peek()) || peek() == '_') advance();

        boolean isFloat = false;
        // 小数部分（1.method 这类写法不当作小数）
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance();
            while (isDigit(peek()) || peek() == '_') advance();
        }
        // 指数部分
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || peekNext() == '+' || peekNext() == '-')) {
            isFloat = true;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            while (isDigit(peek())) advance();
        }

        String text = source.substring(start, current).replace("_", "");
        try {
            if (isFloat) {
                addToken(TokenType.FLOAT_LITERAL, Double.parseDouble(text));
            } else if (isIntegerOutOfRange(text)) {
                error("Integer literal out of range: " + source.substring(start, current));
            } else {
                addToken(TokenType.INT_LITERAL, Long.parseLong(text));
            }
        } catch (NumberFormatException e) {
            error("Invalid number literal: " + source.substring(start, current));
        }
    }

    /** 整数是有符号 64 位，超出范围的字面量不接受 */
    private static boolean isIntegerOutOfRange(String digits) {
        String trimmed = digits.replaceFirst("^0+(?=.)", "");
        return trimmed.length() > 19 || (trimmed.length() == 19 && trimmed.compareTo("9223372036854775807") > 0);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    /** @int / @list / @dict 等类型名 */
    private void typeName() {
        if (!isAlpha(peek())) {
            error("Expected type name after '@'");
            return;
        }
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.TYPE_NAME, source.substring(start + 1, current));
    }

    private void error(String message) {
        String errorMsg = String.format("[%s:%d:%d] Lexer error: %s",
                fileName, line, column, message);
        addToken(TokenType.ERROR, errorMsg);
    }
}
