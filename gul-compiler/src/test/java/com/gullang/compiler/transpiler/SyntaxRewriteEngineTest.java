package com.gullang.compiler.transpiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 逐行改写状态机测试
 */
class SyntaxRewriteEngineTest {

    private final SyntaxRewriteEngine engine = new SyntaxRewriteEngine();

    /** 转译并返回去掉缩进的非空行 */
    private List<String> lines(String source) {
        TranspileResult result = engine.transpile(source);
        assertThat(result.isBalanced()).as("block frames balanced").isTrue();
        return Arrays.stream(result.getCode().split("\n"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("声明")
    class DeclarationTests {

        @Test
        @DisplayName("struct 字段")
        void testStruct() {
            assertThat(lines("struct Point:\n    x: @int\n    y: @float\n")).containsExactly(
                    "#[derive(Debug, Clone, PartialEq)]",
                    "pub struct Point {",
                    "pub x: i64,",
                    "pub y: f64,",
                    "}");
        }

        @Test
        @DisplayName("struct 体内的方法关闭 struct 并打开 impl")
        void testStructWithMethod() {
            assertThat(lines("struct Point:\n    x: @int\n    fn norm(self) -> @int:\n        return self.x\n"))
                    .containsExactly(
                            "#[derive(Debug, Clone, PartialEq)]",
                            "pub struct Point {",
                            "pub x: i64,",
                            "}",
                            "impl Point {",
                            "pub fn norm(&self) -> i64 {",
                            "return self.x;",
                            "}",
                            "}");
        }

        @Test
        @DisplayName("enum 变体与 Enum.Variant 路径")
        void testEnum() {
            List<String> out = lines("enum Color:\n    Red\n    Green\nlet c = Color.Red\n");
            assertThat(out).containsSubsequence("pub enum Color {", "Red,", "Green,", "}", "let c = Color::Red;");
        }

        @Test
        @DisplayName("函数签名：类型映射与所有权修饰")
        void testFunction() {
            assertThat(lines("fn add(a: @int, b: @int) -> @int:\n    return a + b\n")).containsExactly(
                    "pub fn add(a: i64, b: i64) -> i64 {",
                    "return a + b;",
                    "}");
            assertThat(lines("fn push(ref self, item: @str):\n    pass\n").get(0))
                    .isEqualTo("pub fn push(&mut self, item: String) {");
        }

        @Test
        @DisplayName("mn: 与变量声明")
        void testMainAndDeclarations() {
            assertThat(lines("mn:\n    let x: @list[@int] = @list[]\n    var n = 0\n")).containsExactly(
                    "fn main() {",
                    "let x: Vec<i64> = Vec::new();",
                    "let mut n = 0;",
                    "}");
        }
    }

    @Nested
    @DisplayName("控制流")
    class ControlFlowTests {

        @Test
        @DisplayName("if / elif / else 与逻辑运算符")
        void testIfChain() {
            String src = "if a and not b:\n    x = 1\nelif c:\n    x = 2\nelse:\n    x = 3\n";
            assertThat(lines(src)).containsExactly(
                    "if a && !b {", "x = 1;", "}",
                    "else if c {", "x = 2;", "}",
                    "else {", "x = 3;", "}");
        }

        @Test
        @DisplayName("for ... in range(a, b) 改为区间")
        void testForRange() {
            assertThat(lines("for i in range(0, 10):\n    print(i)\n")).containsExactly(
                    "for i in 0..10 {",
                    "println!(\"{}\", i);",
                    "}");
        }

        @Test
        @DisplayName("match 分支以 ',' 结尾，_ 与 pass")
        void testMatch() {
            assertThat(lines("match x:\n    1 => print(\"one\")\n    _ => pass\n")).containsExactly(
                    "match x {",
                    "1 => println!(\"{}\", \"one\"),",
                    "_ => (),",
                    "}");
        }

        @Test
        @DisplayName("try / catch 保持原有形状")
        void testTryCatch() {
            assertThat(lines("try:\n    risky()\ncatch e:\n    pass\n")).containsExactly(
                    "if true {", "risky();", "}",
                    "else if false {", "();", "}");
        }
    }

    @Nested
    @DisplayName("行级改写")
    class LineTests {

        @Test
        @DisplayName("@imp 去掉源码根目录，std 路径直接 use")
        void testImports() {
            assertThat(lines("@imp compiler.lexer.token\n@imp std.collections\n")).containsExactly(
                    "use crate::lexer::token::*;",
                    "use std::collections;");
        }

        @Test
        @DisplayName("行尾注释移到标点之后")
        void testTrailingComment() {
            assertThat(lines("x = 1  # note\n")).containsExactly("x = 1;  // note");
        }

        @Test
        @DisplayName("文档字符串改为注释")
        void testDocstring() {
            assertThat(lines("\"\"\"Module doc\"\"\"\n")).containsExactly("// Module doc");
        }

        @Test
        @DisplayName("f-string 与字符串拼接")
        void testStrings() {
            assertThat(lines("let s = f\"n={n}\"\n")).containsExactly("let s = format!(\"n={}\", n);");
            assertThat(lines("msg = \"a\" + b\n")).containsExactly("msg = \"a\".add_gul(b);");
        }

        @Test
        @DisplayName("len 与成员判断")
        void testBuiltins() {
            assertThat(lines("n = len(xs)\n")).containsExactly("n = (xs).len();");
            assertThat(lines("ok = x in xs\n")).containsExactly("ok = xs.contains(&x);");
        }
    }

    @Test
    @DisplayName("收集声明的类型名")
    void testDeclaredTypes() {
        String src = "struct A:\n    x: @int\nenum B:\n    C\n";
        assertThat(SyntaxRewriteEngine.declaredStructs(src)).containsExactly("A");
        assertThat(SyntaxRewriteEngine.declaredEnums(src)).containsExactly("B");
    }

    @Test
    @DisplayName("任意输入都产出文本且块栈平衡")
    void testMalformedInputStillBalanced() {
        TranspileResult result = engine.transpile("if :\n    ???\n  }}\nfn\n");
        assertThat(result.getCode()).isNotEmpty();
        assertThat(result.getFramesOpened()).isEqualTo(result.getFramesClosed());
    }
}
