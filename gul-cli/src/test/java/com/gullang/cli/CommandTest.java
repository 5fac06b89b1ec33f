package com.gullang.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 命令行子命令测试
 */
class CommandTest {

    @TempDir
    Path temp;

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;

    @BeforeEach
    void setUp() {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
    }

    private PrintStream stream(ByteArrayOutputStream bytes) {
        return new PrintStream(bytes, true, StandardCharsets.UTF_8);
    }

    private String out() {
        return new String(outBytes.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String err() {
        return new String(errBytes.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private Path write(String relative, String content) throws IOException {
        Path file = temp.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Nested
    @DisplayName("gul")
    class MainTests {

        @Test
        @DisplayName("注册 run 与 transpile 子命令")
        void testSubcommands() {
            assertThat(Main.commandLine().getSubcommands()).containsKeys("run", "transpile");
        }

        @Test
        @DisplayName("--version")
        void testVersion() {
            CommandLine cmd = Main.commandLine();
            StringWriter sw = new StringWriter();
            cmd.setOut(new PrintWriter(sw));
            assertThat(cmd.execute("--version")).isEqualTo(0);
            assertThat(sw.toString()).contains("GUL bootstrap v0.1.0");
        }
    }

    @Nested
    @DisplayName("gul run")
    class RunTests {

        private int run(String... args) {
            RunCommand command = new RunCommand();
            command.out = stream(outBytes);
            command.err = stream(errBytes);
            return new CommandLine(command).execute(args);
        }

        @Test
        @DisplayName("执行脚本并传入 sys.argv")
        void testRun() throws IOException {
            Path script = write("args.mn", "print(sys.argv)\n");

            assertThat(run(script.toString(), "a", "b")).isEqualTo(0);
            assertThat(out()).startsWith("🚀 Running: " + script + "\n");
            assertThat(out()).contains("['" + script + "', 'a', 'b']");
            assertThat(out()).contains("✅ Complete!");
        }

        @Test
        @DisplayName("文件不存在")
        void testMissingFile() {
            Path missing = temp.resolve("missing.mn");
            assertThat(run(missing.toString())).isEqualTo(1);
            assertThat(err()).contains("❌ Error: No such file or directory: '" + missing + "'");
        }

        @Test
        @DisplayName("运行时错误返回 1 并输出位置")
        void testRuntimeError() throws IOException {
            Path script = write("bad.mn", "let a = 1\nprint(x)\n");
            assertThat(run(script.toString())).isEqualTo(1);
            assertThat(err()).contains("❌ Error: name 'x' is not defined");
            assertThat(err()).contains(":2: print(x)");
            assertThat(out()).doesNotContain("✅ Complete!");
        }

        @Test
        @DisplayName("--max-steps 限制死循环")
        void testMaxSteps() throws IOException {
            Path script = write("spin.mn", "while True:\n    pass\n");
            assertThat(run("--max-steps", "50", script.toString())).isEqualTo(1);
            assertThat(err()).contains("Instruction budget exceeded");
        }

        @Test
        @DisplayName("接近默认深度上限的递归可以完成")
        void testDeepRecursion() throws IOException {
            Path script = write("deep.mn",
                    "fn down(n):\n" +
                    "    if n == 0:\n" +
                    "        return \"bottom\"\n" +
                    "    return down(n - 1)\n" +
                    "print(down(990))\n");
            assertThat(run(script.toString())).isEqualTo(0);
            assertThat(out()).contains("bottom");
        }

        @Test
        @DisplayName("超出深度上限的递归报错")
        void testRecursionLimit() throws IOException {
            Path script = write("runaway.mn", "fn f(n):\n    return f(n + 1)\nf(0)\n");
            assertThat(run(script.toString())).isEqualTo(1);
            assertThat(err()).contains("❌ Error: maximum recursion depth exceeded");
            assertThat(err()).contains("frames omitted");
        }
    }

    @Nested
    @DisplayName("gul transpile")
    class TranspileTests {

        private int transpile(String... args) {
            TranspileCommand command = new TranspileCommand();
            command.out = stream(outBytes);
            command.err = stream(errBytes);
            return new CommandLine(command).execute(args);
        }

        @Test
        @DisplayName("目录模式")
        void testProject() throws IOException {
            write("compiler/main.mn", "mn:\n    print(\"hi\")\n");
            Path src = temp.resolve("compiler");
            Path dest = temp.resolve("compiler_rust");

            assertThat(transpile(src.toString(), dest.toString())).isEqualTo(0);
            assertThat(out()).contains("✅ Transpiled 1 files (0 failed) to " + dest);
            assertThat(dest.resolve("main.rs")).exists();
        }

        @Test
        @DisplayName("配置文件提供目录")
        void testConfig() throws IOException {
            write("gul/util.mn", "fn id(x):\n    return x\n");
            Path dest = temp.resolve("out");
            Path config = write("transpiler.json", "{\"src_dir\": \""
                    + temp.resolve("gul").toString().replace('\\', '/') + "\", \"dest_dir\": \""
                    + dest.toString().replace('\\', '/') + "\"}");

            assertThat(transpile("--config", config.toString())).isEqualTo(0);
            assertThat(dest.resolve("util.rs")).exists();
        }

        @Test
        @DisplayName("单文件模式")
        void testSingleFile() throws IOException {
            Path input = write("one.mn", "mn:\n    print(1)\n");
            Path target = temp.resolve("one_out.rs");

            assertThat(transpile("--file", input.toString(), "-o", target.toString())).isEqualTo(0);
            assertThat(out()).contains("Transpiling " + input + " -> " + target);
            assertThat(out()).contains("✅ Generated " + target);
            assertThat(target).exists();
        }

        @Test
        @DisplayName("源目录不存在")
        void testMissingSource() {
            Path src = temp.resolve("nope");
            assertThat(transpile(src.toString(), temp.resolve("out").toString())).isEqualTo(1);
            assertThat(err()).contains("❌ Error: Source directory not found: " + src);
        }

        @Test
        @DisplayName("配置文件格式错误")
        void testInvalidConfig() throws IOException {
            Path config = write("bad.json", "{\"src_dir\": [");
            assertThat(transpile("--config", config.toString())).isEqualTo(1);
            assertThat(err()).contains("Invalid transpiler config");
        }
    }
}
