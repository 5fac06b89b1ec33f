package com.gullang.compiler.transpiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 类型标注与集合值映射
 */
class TypeAndCollectionMapperTest {

    private final TypeAndCollectionMapper mapper = new TypeAndCollectionMapper();

    @Nested
    @DisplayName("类型标注")
    class AnnotationTests {

        @Test
        @DisplayName("基本类型")
        void testPrimitives() {
            assertEquals("i64", mapper.mapAnnotation("@int"));
            assertEquals("f64", mapper.mapAnnotation("@float"));
            assertEquals("String", mapper.mapAnnotation("@str"));
            assertEquals("bool", mapper.mapAnnotation(" @bool "));
        }

        @Test
        @DisplayName("集合类型带元素类型")
        void testCollections() {
            assertEquals("Vec<i64>", mapper.mapAnnotation("@list[@int]"));
            assertEquals("HashMap<String, i64>", mapper.mapAnnotation("@dict[@str, @int]"));
            assertEquals("HashSet<String>", mapper.mapAnnotation("@set[@str]"));
            assertEquals("Vec<Vec<f64>>", mapper.mapAnnotation("@list[@list[@float]]"));
        }

        @Test
        @DisplayName("未写元素类型时默认为 String")
        void testDefaultElement() {
            assertEquals("Vec<String>", mapper.mapAnnotation("@list"));
        }

        @Test
        @DisplayName("可选类型与用户类型")
        void testOptionalAndUserTypes() {
            assertEquals("Option<i64>", mapper.mapAnnotation("@int?"));
            assertEquals("Token", mapper.mapAnnotation("Token"));
            assertEquals("Token", mapper.mapAnnotation("@Token"));
        }
    }

    @Nested
    @DisplayName("值")
    class ValueTests {

        @Test
        @DisplayName("空集合")
        void testEmptyCollections() {
            assertEquals("Vec::new()", mapper.mapValue("@list[]"));
            assertEquals("HashMap::new()", mapper.mapValue("@dict{}"));
            assertEquals("HashSet::new()", mapper.mapValue("@set{}"));
        }

        @Test
        @DisplayName("列表与集合字面量")
        void testLiterals() {
            assertEquals("vec![1, 2]", mapper.mapValue("[1, 2]"));
            assertEquals("vec![1, 2]", mapper.mapValue("@list[1, 2]"));
            assertEquals("vec![1, 2].into_iter().collect::<HashSet<_>>()", mapper.mapValue("@set{1, 2}"));
        }

        @Test
        @DisplayName("字典字面量改为 dict! 宏")
        void testDict() {
            assertEquals("dict!{\"a\" => 1}", mapper.mapValue("{\"a\": 1}"));
        }

        @Test
        @DisplayName("带元素类型的空集合构造")
        void testTypedConstructor() {
            assertEquals("Vec::<i64>::new()", mapper.mapValue("@list[@int]"));
        }

        @Test
        @DisplayName("类型转换")
        void testConversions() {
            assertEquals("(x) as i64", mapper.mapValue("@int(x)"));
            assertEquals("(y) as f64", mapper.mapValue("@float(y)"));
            assertEquals("(n).to_string()", mapper.mapValue("@str(n)"));
        }

        @Test
        @DisplayName("下标不是列表字面量")
        void testIndexUntouched() {
            assertEquals("xs[0]", mapper.mapValue("xs[0]"));
        }

        @Test
        @DisplayName("列表中的字符串元素转为 String")
        void testOwnedStrings() {
            assertEquals("vec![\"a\".to_string()]", mapper.mapValue("[\"a\"]"));
            assertEquals("\"s\".to_string()", TypeAndCollectionMapper.ownedString("\"s\""));
            assertEquals("x", TypeAndCollectionMapper.ownedString("x"));
        }
    }
}
