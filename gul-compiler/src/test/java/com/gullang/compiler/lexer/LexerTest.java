package com.gullang.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回非 EOF 的 token 列表 */
    private List<Token> tokens(String source) {
        return new Lexer(source).scanTokens().stream()
                .filter(t -> t.getType() != TokenType.EOF)
                .collect(Collectors.toList());
    }

    private List<TokenType> types(String source) {
        return tokens(source).stream().map(Token::getType).collect(Collectors.toList());
    }

    private void assertSingleToken(String source, TokenType expectedType, Object expectedLiteral) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expectedType, toks.get(0).getType());
        assertEquals(expectedLiteral, toks.get(0).getLiteral());
    }

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        @Test
        @DisplayName("整数与浮点数")
        void testNumbers() {
            assertSingleToken("42", TokenType.INT_LITERAL, 42L);
            assertSingleToken("1_000", TokenType.INT_LITERAL, 1000L);
            assertSingleToken("3.14", TokenType.FLOAT_LITERAL, 3.14);
            assertSingleToken("1e3", TokenType.FLOAT_LITERAL, 1000.0);
        }

        @Test
        @DisplayName("整数字面量限于 64 位")
        void testIntegerRange() {
            assertSingleToken("9223372036854775807", TokenType.INT_LITERAL, Long.MAX_VALUE);
            assertSingleToken("0009", TokenType.INT_LITERAL, 9L);
            List<Token> toks = tokens("99999999999999999999");
            assertEquals(TokenType.ERROR, toks.get(0).getType());
            assertTrue(String.valueOf(toks.get(0).getLiteral())
                    .contains("Integer literal out of range: 99999999999999999999"));
            assertEquals(TokenType.ERROR, tokens("9223372036854775808").get(0).getType());
        }

        @Test
        @DisplayName("单双引号字符串及转义")
        void testStrings() {
            assertSingleToken("\"hello\"", TokenType.STRING_LITERAL, "hello");
            assertSingleToken("'hi'", TokenType.STRING_LITERAL, "hi");
            assertSingleToken("\"a\\nb\"", TokenType.STRING_LITERAL, "a\nb");
        }

        @Test
        @DisplayName("f-string 保留花括号内的表达式")
        void testFString() {
            assertSingleToken("f\"x={x + 1}\"", TokenType.FSTRING, "x={x + 1}");
        }

        @Test
        @DisplayName("未闭合的字符串产生 ERROR token")
        void testUnterminatedString() {
            List<Token> toks = tokens("\"abc");
            assertEquals(TokenType.ERROR, toks.get(toks.size() - 1).getType());
            assertTrue(String.valueOf(toks.get(toks.size() - 1).getLiteral()).contains("Unterminated string"));
        }
    }

    @Nested
    @DisplayName("运算符与关键词")
    class OperatorTests {

        @Test
        @DisplayName("比较与赋值运算符")
        void testOperators() {
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.GE, TokenType.INT_LITERAL),
                    types("a >= 1"));
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.PLUS_ASSIGN, TokenType.INT_LITERAL),
                    types("a += 1"));
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.DOUBLE_ARROW, TokenType.IDENTIFIER),
                    types("a => b"));
        }

        @Test
        @DisplayName("单词形式与符号形式的逻辑运算")
        void testLogical() {
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.KW_AND, TokenType.KW_NOT, TokenType.IDENTIFIER),
                    types("a and not b"));
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.AND, TokenType.NOT, TokenType.IDENTIFIER),
                    types("a && !b"));
        }

        @Test
        @DisplayName("True / False / None 两种大小写")
        void testKeywords() {
            assertEquals(List.of(TokenType.KW_TRUE, TokenType.KW_TRUE, TokenType.KW_FALSE, TokenType.KW_NONE),
                    types("true True False None"));
        }

        @Test
        @DisplayName("@ 类型名")
        void testTypeName() {
            List<Token> toks = tokens("@list[@int]");
            assertEquals(TokenType.TYPE_NAME, toks.get(0).getType());
            assertEquals("list", toks.get(0).getLiteral());
            assertEquals("int", toks.get(2).getLiteral());
        }

        @Test
        @DisplayName("单个 & 报错")
        void testSingleAmpersand() {
            assertEquals(TokenType.ERROR, types("a & b").get(1));
        }
    }

    @Test
    @DisplayName("# 之后的内容被忽略")
    void testComment() {
        assertEquals(List.of(TokenType.IDENTIFIER), types("x # comment (unbalanced"));
    }

    @Test
    @DisplayName("以 f 开头的标识符不是 f-string")
    void testIdentifierStartingWithF() {
        List<Token> toks = tokens("foo");
        assertEquals(1, toks.size());
        assertEquals(TokenType.IDENTIFIER, toks.get(0).getType());
        assertEquals("foo", toks.get(0).getLexeme());
    }
}
