package gul.runtime.types;

import gul.runtime.GulException;
import gul.runtime.GulInt;
import gul.runtime.GulValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Environment 与结构体 / 枚举类型单元测试
 */
class EnvironmentTest {

    private Environment env;

    @BeforeEach
    void setUp() {
        env = new Environment();
    }

    @Nested
    @DisplayName("变量定义和获取")
    class DefineAndGetTests {

        @Test
        @DisplayName("定义、覆盖与查找")
        void testDefine() {
            env.define("x", GulInt.of(1));
            env.define("x", GulInt.of(2));
            assertEquals(GulInt.of(2), env.get("x"));
            assertNull(env.lookup("y"));
            assertEquals(1, env.size());
        }

        @Test
        @DisplayName("获取未定义变量抛出异常")
        void testGetUndefined() {
            GulException e = assertThrows(GulException.class, () -> env.get("missing"));
            assertEquals("Undefined variable: missing", e.getMessage());
        }

        @Test
        @DisplayName("内置名字计数")
        void testSealBuiltins() {
            env.define("print", GulInt.of(0));
            env.define("len", GulInt.of(0));
            env.sealBuiltins();
            env.define("x", GulInt.of(1));
            assertEquals(2, env.getBuiltinCount());
            assertEquals(3, env.names().size());
        }

        @Test
        @DisplayName("userBindings 过滤未改动的内置名字")
        void testUserBindings() {
            GulValue print = GulInt.of(0);
            env.define("print", print);
            env.define("len", GulInt.of(0));
            env.sealBuiltins();
            env.define("x", GulInt.of(1));
            env.define("len", GulInt.of(5));

            Map<String, GulValue> user = env.userBindings();
            assertEquals(Arrays.asList("len", "x"), new ArrayList<String>(user.keySet()));
            assertEquals(GulInt.of(5), user.get("len"));
            assertFalse(user.containsKey("print"));

            env.define("print", print);
            assertFalse(env.userBindings().containsKey("print"));
        }
    }

    @Nested
    @DisplayName("快照与恢复")
    class SnapshotTests {

        @Test
        @DisplayName("快照之后的修改不影响快照")
        void testSnapshotIsCopy() {
            env.define("x", GulInt.of(1));
            Map<String, GulValue> snap = env.snapshot();
            env.define("x", GulInt.of(2));
            assertEquals(GulInt.of(1), snap.get("x"));
        }

        @Test
        @DisplayName("恢复后丢弃调用期间的绑定")
        void testRestore() {
            env.define("x", GulInt.of(1));
            Map<String, GulValue> saved = env.snapshot();
            env.overlay(Collections.<String, GulValue>singletonMap("y", GulInt.of(5)));
            env.define("x", GulInt.of(9));
            env.restore(saved);
            assertEquals(GulInt.of(1), env.get("x"));
            assertFalse(env.contains("y"));
        }

        @Test
        @DisplayName("newSince 只返回新增的名字")
        void testNewSince() {
            env.define("a", GulInt.of(1));
            Map<String, GulValue> before = env.snapshot();
            env.define("a", GulInt.of(2));
            env.define("b", GulInt.of(3));
            Map<String, GulValue> added = env.newSince(before);
            assertEquals(Collections.singleton("b"), added.keySet());
        }

        @Test
        @DisplayName("asMap 只读")
        void testAsMapReadOnly() {
            env.define("a", GulInt.of(1));
            assertThrows(UnsupportedOperationException.class, () -> env.asMap().put("b", GulInt.of(2)));
        }
    }

    @Nested
    @DisplayName("结构体与枚举")
    class TypeTests {

        @Test
        @DisplayName("结构体实例渲染字段")
        void testStructInstance() {
            GulStructDefinition def = new GulStructDefinition("Point",
                    Arrays.asList(new FieldSpec("x", "@int", null), new FieldSpec("y", "@int", "0")));
            assertEquals(Arrays.asList("x", "y"), def.getFieldNames());
            assertTrue(def.getFields().get(1).hasDefault());
            assertEquals("x: @int", def.getFields().get(0).toString());

            Map<String, GulValue> fields = new LinkedHashMap<String, GulValue>();
            fields.put("x", GulInt.of(1));
            fields.put("y", GulInt.of(2));
            GulStructInstance p = new GulStructInstance("Point", def, fields);
            p.setField("x", GulInt.of(7));
            assertEquals("Point{x: 7, y: 2}", p.render());
            assertEquals("Point", p.getTypeName());
            assertNull(def.findInstanceMethod("norm"));
        }

        @Test
        @DisplayName("枚举变体从声明文本中取名")
        void testEnum() {
            GulEnumDefinition color = new GulEnumDefinition("Color",
                    Arrays.asList("Red", "Green = 2", "Ident(int)", ""));
            assertEquals(Arrays.asList("Red", "Green", "Ident"), color.getVariantNames());
            GulEnumVariant red = color.getVariant("Red");
            assertEquals("Color.Red", red.render());
            assertEquals(new GulEnumVariant("Color", "Red"), red);
            assertNotEquals(new GulEnumVariant("Shade", "Red"), red);
            assertNull(color.getVariant("Blue"));
        }
    }
}
