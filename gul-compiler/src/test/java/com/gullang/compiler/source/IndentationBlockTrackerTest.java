package com.gullang.compiler.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 缩进块追踪器测试
 */
class IndentationBlockTrackerTest {

    private static List<LogicalLine> lines(String source) {
        return SourceLines.physical(source);
    }

    @Nested
    @DisplayName("blockEnd")
    class BlockEndTests {

        @Test
        @DisplayName("块在第一个缩进不大于块头的非空行结束")
        void testBlockEnd() {
            List<LogicalLine> ls = lines("if x:\n    a\n\n    b\nc");
            assertEquals(4, IndentationBlockTracker.blockEnd(ls, 0));
        }

        @Test
        @DisplayName("空行与注释行不结束块")
        void testBlankLines() {
            List<LogicalLine> ls = lines("fn f():\n    a\n# note\n    b");
            assertEquals(4, IndentationBlockTracker.blockEnd(ls, 0));
        }

        @Test
        @DisplayName("嵌套块")
        void testNested() {
            List<LogicalLine> ls = lines("while a:\n    if b:\n        c\n    d\ne");
            assertEquals(3, IndentationBlockTracker.blockEnd(ls, 1));
            assertEquals(4, IndentationBlockTracker.blockEnd(ls, 0));
        }
    }

    @Nested
    @DisplayName("帧栈")
    class FrameTests {

        private BlockFrame frame(LogicalLine line, String name) {
            return new BlockFrame(line.getIndent(), BlockKind.classify(line.getCode()), name, "}");
        }

        @Test
        @DisplayName("同级语句关闭前一个块，drain 关闭剩余帧")
        void testAdvanceAndDrain() {
            IndentationBlockTracker tracker = new IndentationBlockTracker();
            List<LogicalLine> ls = lines("struct P:\n    x: @int\nfn f():\n    if a:\n        b");
            assertTrue(tracker.advance(ls.get(0)).isEmpty());
            tracker.push(frame(ls.get(0), "P"));
            assertTrue(tracker.advance(ls.get(1)).isEmpty());

            List<BlockFrame> closed = tracker.advance(ls.get(2));
            assertEquals(1, closed.size());
            assertEquals(BlockKind.STRUCT, closed.get(0).getKind());
            assertEquals("P", closed.get(0).getName());
            assertNull(tracker.peek());

            tracker.push(frame(ls.get(2), null));
            assertTrue(tracker.advance(ls.get(3)).isEmpty());
            tracker.push(frame(ls.get(3), null));
            assertTrue(tracker.advance(ls.get(4)).isEmpty());
            assertEquals(BlockKind.IF, tracker.peek().getKind());

            List<BlockFrame> drained = tracker.drain();
            assertEquals(2, drained.size());
            assertEquals(BlockKind.IF, drained.get(0).getKind());
            assertEquals(BlockKind.FN, drained.get(1).getKind());
            assertEquals(3, tracker.getOpenedCount());
            assertEquals(tracker.getOpenedCount(), tracker.getClosedCount());
        }

        @Test
        @DisplayName("反缩进一次弹出多层")
        void testMultiLevelDedent() {
            IndentationBlockTracker tracker = new IndentationBlockTracker();
            List<LogicalLine> ls = lines("while a:\n    if b:\n        c\nd");
            tracker.advance(ls.get(0));
            tracker.push(frame(ls.get(0), null));
            tracker.advance(ls.get(1));
            tracker.push(frame(ls.get(1), null));
            tracker.advance(ls.get(2));

            List<BlockFrame> closed = tracker.advance(ls.get(3));
            assertEquals(2, closed.size());
            assertEquals(BlockKind.IF, closed.get(0).getKind());
            assertEquals(BlockKind.WHILE, closed.get(1).getKind());
            assertTrue(tracker.drain().isEmpty());
        }

        @Test
        @DisplayName("括号续行不关闭块")
        void testContinuation() {
            IndentationBlockTracker tracker = new IndentationBlockTracker();
            List<LogicalLine> ls = lines("fn f():\n    call(a,\nb)\n    c");
            tracker.advance(ls.get(0));
            tracker.push(frame(ls.get(0), null));
            tracker.advance(ls.get(1));
            assertTrue(tracker.isContinuation());
            assertTrue(tracker.advance(ls.get(2)).isEmpty());
            assertFalse(tracker.isContinuation());
            assertTrue(tracker.advance(ls.get(3)).isEmpty());
            assertEquals(BlockKind.FN, tracker.peek().getKind());
        }

        @Test
        @DisplayName("显式 '}' 行用 pop 消费帧，关闭文本带合成后缀")
        void testPopAndClosingText() {
            IndentationBlockTracker tracker = new IndentationBlockTracker();
            BlockFrame literal = new BlockFrame(4, BlockKind.LITERAL, "Point", "}");
            literal.setExplicitBrace(true);
            literal.setPendingSuffix(");");
            tracker.push(literal);

            BlockFrame popped = tracker.pop();
            assertSame(literal, popped);
            assertTrue(popped.isExplicitBrace());
            assertEquals("});", popped.closingText());
            assertEquals(1, tracker.getClosedCount());
            assertNull(tracker.peek());
        }
    }
}
