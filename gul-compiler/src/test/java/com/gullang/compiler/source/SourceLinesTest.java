package com.gullang.compiler.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 行切分与逻辑行拼接
 */
class SourceLinesTest {

    @Test
    @DisplayName("缩进按空格计数，制表符计 4")
    void testIndent() {
        assertEquals(0, SourceLines.indentOf("x = 1"));
        assertEquals(4, SourceLines.indentOf("    x = 1"));
        assertEquals(6, SourceLines.indentOf("\t  x"));
    }

    @Test
    @DisplayName("行尾注释与字符串内的 #")
    void testComments() {
        LogicalLine line = LogicalLine.of(1, "  x = \"#1\"  # set x");
        assertEquals("x = \"#1\"", line.getCode());
        assertEquals("set x", line.getComment());
        assertEquals(2, line.getIndent());

        LogicalLine commentOnly = LogicalLine.of(2, "# only comment");
        assertTrue(commentOnly.isBlank());
        assertTrue(commentOnly.hasComment());
    }

    @Test
    @DisplayName("括号未闭合的物理行拼接为一条逻辑行")
    void testJoinBrackets() {
        List<LogicalLine> lines = SourceLines.logical("let xs = [\n    1,\n    2\n]\nprint(xs)");
        assertEquals(2, lines.size());
        assertEquals("let xs = [ 1, 2 ]", lines.get(0).getCode());
        assertEquals(1, lines.get(0).getNumber());
        assertEquals(5, lines.get(1).getNumber());
    }

    @Test
    @DisplayName("物理切分保留每一行，兼容 CRLF")
    void testPhysical() {
        List<LogicalLine> lines = SourceLines.physical("a\r\nb\r\n");
        assertEquals(3, lines.size());
        assertEquals("b", lines.get(1).getCode());
        assertTrue(lines.get(2).isBlank());
    }

    @Test
    @DisplayName("多行三引号字符串视为一条逻辑行")
    void testTripleQuoted() {
        List<LogicalLine> lines = SourceLines.logical("\"\"\"doc\nmore\n\"\"\"\nx = 1");
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).getCode().startsWith("\"\"\""));
        assertEquals("x = 1", lines.get(1).getCode());
    }

    @Test
    @DisplayName("字符串内的括号不计入深度")
    void testBracketDelta() {
        assertEquals(1, SourceLines.bracketDelta("f(\")\""));
        assertEquals(0, SourceLines.bracketDelta("a[0] + b(1)"));
    }
}
