package com.gullang.compiler.transpiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 目录级转译：镜像目录、入口前导、mod.rs、排除目录
 */
class ProjectTranspilerTest {

    @TempDir
    Path temp;

    private Path write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("镜像目录结构，入口文件带前导与 mod 声明")
    void testTranspileProject() throws IOException {
        Path src = temp.resolve("compiler");
        Path dest = temp.resolve("compiler_rust");
        write(src.resolve("main.mn"), "@imp compiler.lexer.token\nmn:\n    print(\"hi\")\n");
        write(src.resolve("lexer/token.mn"), "struct Token:\n    kind: @str\n");
        write(src.resolve("tests/test_lexer.mn"), "mn:\n    pass\n");

        TranspileReport report = new ProjectTranspiler().transpileProject(src, dest);

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getFailed()).isEmpty();
        assertThat(report.getWritten()).hasSize(3);
        assertThat(report.summary()).isEqualTo("Transpiled 3 files (0 failed)");

        String main = read(dest.resolve("main.rs"));
        assertThat(main).contains("macro_rules! dict");
        assertThat(main).contains("mod lexer;");
        assertThat(main).contains("use crate::lexer::token::*;");
        assertThat(main).contains("fn main() {");

        String token = read(dest.resolve("lexer/token.rs"));
        assertThat(token).startsWith("// Auto-generated from GUL source");
        assertThat(token).contains("use crate::*;");
        assertThat(token).contains("pub struct Token {");

        assertThat(read(dest.resolve("lexer/mod.rs"))).contains("pub mod token;");
        assertThat(dest.resolve("tests")).doesNotExist();
    }

    @Test
    @DisplayName("没有入口文件时不输出前导")
    void testNoEntryFile() throws IOException {
        Path src = temp.resolve("src");
        Path dest = temp.resolve("out");
        write(src.resolve("util.mn"), "fn id(x: @int) -> @int:\n    return x\n");

        TranspileReport report = new ProjectTranspiler().transpileProject(src, dest);

        assertThat(report.getWritten()).containsExactly(dest.resolve("util.rs"));
        assertThat(read(dest.resolve("util.rs"))).doesNotContain("macro_rules!");
    }

    @Test
    @DisplayName("源目录不存在")
    void testMissingSourceDirectory() {
        assertThatThrownBy(() -> new ProjectTranspiler().transpileProject(temp.resolve("nope"), temp.resolve("out")))
                .isInstanceOf(TranspileException.class)
                .hasMessageContaining("Source directory not found");
    }

    @Test
    @DisplayName("单文件模式：默认输出替换扩展名并带前导")
    void testTranspileFile() throws IOException {
        Path input = write(temp.resolve("hello.mn"), "mn:\n    print(\"hello\")\n");
        ProjectTranspiler transpiler = new ProjectTranspiler();
        Path output = transpiler.defaultOutput(input);
        assertThat(output.getFileName().toString()).isEqualTo("hello.rs");

        TranspileResult result = transpiler.transpileFile(input, output);

        assertThat(result.isBalanced()).isTrue();
        String code = read(output);
        assertThat(code).contains("pub mod sys");
        assertThat(code).contains("println!(\"{}\", \"hello\");");
    }

    @Test
    @DisplayName("单文件模式：输入不可读")
    void testTranspileMissingFile() {
        assertThatThrownBy(() -> new ProjectTranspiler().transpileFile(temp.resolve("missing.mn"), temp.resolve("x.rs")))
                .isInstanceOf(TranspileException.class);
    }
}
