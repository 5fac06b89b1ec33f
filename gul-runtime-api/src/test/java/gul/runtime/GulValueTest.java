package gul.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 值模型：渲染、真值与相等性
 */
class GulValueTest {

    private static GulInt i(long v) {
        return GulInt.of(v);
    }

    private static GulString s(String v) {
        return GulString.of(v);
    }

    @Nested
    @DisplayName("数字")
    class NumberTests {

        @Test
        @DisplayName("整数渲染与真值")
        void testInt() {
            assertEquals("42", i(42).render());
            assertEquals("-7", i(-7).render());
            assertFalse(i(0).isTruthy());
            assertTrue(i(1).isNumber());
        }

        @Test
        @DisplayName("浮点渲染与 Python 一致")
        void testFloatFormat() {
            assertEquals("3.0", GulFloat.of(3.0).render());
            assertEquals("0.5", GulFloat.of(0.5).render());
            assertEquals("0.30000000000000004", GulFloat.of(0.1 + 0.2).render());
            assertEquals("12345678.9", GulFloat.of(12345678.9).render());
            assertEquals("1e+20", GulFloat.of(1e20).render());
            assertEquals("1e-05", GulFloat.of(1e-5).render());
            assertEquals("inf", GulFloat.INFINITY.render());
            assertEquals("-inf", GulFloat.of(Double.NEGATIVE_INFINITY).render());
            assertEquals("nan", GulFloat.of(Double.NaN).render());
        }

        @Test
        @DisplayName("整数与浮点跨类型相等，哈希一致")
        void testCrossTypeEquality() {
            assertEquals(i(2), GulFloat.of(2.0));
            assertEquals(i(2).hashCode(), GulFloat.of(2.0).hashCode());
            assertNotEquals(i(2), GulFloat.of(2.5));
        }
    }

    @Nested
    @DisplayName("字符串")
    class StringTests {

        @Test
        @DisplayName("render 不带引号，repr 带单引号")
        void testRenderAndRepr() {
            assertEquals("hi", s("hi").render());
            assertEquals("'hi'", s("hi").repr());
            assertEquals("\"it's\"", s("it's").repr());
            assertEquals("'a\\nb'", s("a\nb").repr());
        }

        @Test
        @DisplayName("长度按码点计算")
        void testLength() {
            assertEquals(3, s("abc").length());
            assertEquals(1, s("🚀").length());
            assertSame(GulString.EMPTY, s(""));
            assertFalse(s("").isTruthy());
        }
    }

    @Nested
    @DisplayName("容器")
    class ContainerTests {

        @Test
        @DisplayName("列表中字符串带引号")
        void testList() {
            GulList list = new GulList(Arrays.<GulValue>asList(i(1), s("a"), GulBoolean.TRUE, GulNone.NONE));
            assertEquals("[1, 'a', True, None]", list.render());
            assertFalse(new GulList().isTruthy());
        }

        @Test
        @DisplayName("单元素元组带逗号")
        void testTuple() {
            assertEquals("(1,)", new GulTuple(Arrays.<GulValue>asList(i(1))).render());
            assertEquals("(1, 'b')", new GulTuple(Arrays.<GulValue>asList(i(1), s("b"))).render());
        }

        @Test
        @DisplayName("字典保持插入顺序")
        void testDict() {
            GulDict dict = new GulDict();
            dict.put(s("b"), i(2));
            dict.put(s("a"), i(1));
            assertEquals("{'b': 2, 'a': 1}", dict.render());
            assertEquals("[('b', 2), ('a', 1)]", dict.items().render());
            assertEquals(i(1), dict.get(s("a")));
            assertNull(dict.get(s("z")));
        }

        @Test
        @DisplayName("空集合渲染为 set()")
        void testSet() {
            assertEquals("set()", new GulSet().render());
            GulSet set = new GulSet(Arrays.<GulValue>asList(i(1), i(1), i(2)));
            assertEquals(2, set.size());
            assertTrue(set.contains(GulFloat.of(1.0)));
        }
    }

    @Nested
    @DisplayName("其他")
    class MiscTests {

        @Test
        @DisplayName("布尔与 None")
        void testBooleanAndNone() {
            assertEquals("True", GulBoolean.TRUE.render());
            assertEquals("None", GulNone.NONE.render());
            assertFalse(GulNone.NONE.isTruthy());
            assertEquals("NoneType", GulValue.typeNameOf(null));
        }

        @Test
        @DisplayName("非数字转换抛出 GulException")
        void testConversionError() {
            GulException e = assertThrows(GulException.class, () -> s("x").asLong());
            assertEquals("Cannot convert str to int", e.getMessage());
        }

        @Test
        @DisplayName("命名空间")
        void testNamespace() {
            GulNamespace ns = new GulNamespace("lexer").setAttribute("x", i(1));
            assertTrue(ns.hasAttribute("x"));
            assertEquals(i(1), ns.getAttribute("x"));
            assertEquals("<module 'lexer'>", ns.render());
        }
    }
}
