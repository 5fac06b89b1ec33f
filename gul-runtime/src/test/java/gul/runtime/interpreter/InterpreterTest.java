package gul.runtime.interpreter;

import gul.runtime.GulInt;
import gul.runtime.GulValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 解释器集成测试
 */
class InterpreterTest {

    private Interpreter interpreter;
    private ByteArrayOutputStream outContent;

    @BeforeEach
    void setUp() {
        interpreter = new Interpreter();
        outContent = new ByteArrayOutputStream();
        interpreter.setStdout(new PrintStream(outContent, true, StandardCharsets.UTF_8));
    }

    private String getOutput() {
        return new String(outContent.toByteArray(), StandardCharsets.UTF_8).trim().replace("\r\n", "\n");
    }

    private String run(String source) {
        interpreter.execute(source, "<test>");
        return getOutput();
    }

    private GulRuntimeException runFailing(String source) {
        return assertThrows(GulRuntimeException.class, () -> interpreter.execute(source, "<test>"));
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("运算")
    class OperatorTests {

        @Test
        @DisplayName("算术：真除法、除零得 inf、取模向负无穷")
        void testArithmetic() {
            assertEquals("7\n3.5\n2.0\ninf\n2\n-3",
                    run("print(1 + 2 * 3)\n" +
                        "print(7 / 2)\n" +
                        "print(4 / 2)\n" +
                        "print(1 / 0)\n" +
                        "print(-7 % 3)\n" +
                        "print(2 - 5)"));
        }

        @Test
        @DisplayName("整数溢出是可捕获的错误，超范围字面量报清楚的原因")
        void testIntegerOverflow() {
            assertEquals("integer overflow\ninteger overflow",
                    run("try:\n" +
                        "    print(9223372036854775807 + 1)\n" +
                        "catch e:\n" +
                        "    print(e)\n" +
                        "let big = 4611686018427387904\n" +
                        "try:\n" +
                        "    big *= 4\n" +
                        "catch e:\n" +
                        "    print(e)"));

            GulRuntimeException e = runFailing("print(99999999999999999999)");
            assertTrue(e.getRawMessage().startsWith("Failed to evaluate expression: "));
            assertTrue(e.getRawMessage().endsWith("(Integer literal out of range: 99999999999999999999)"));
        }

        @Test
        @DisplayName("and / or 返回决定结果的操作数")
        void testLogical() {
            assertEquals("x\n2\nNone\nTrue\n0",
                    run("print(0 or \"x\")\n" +
                        "print(1 and 2)\n" +
                        "print(None and 1)\n" +
                        "print(not 0)\n" +
                        "print(None or 0)"));
        }

        @Test
        @DisplayName("任一操作数为字符串时 + 做拼接")
        void testStringConcat() {
            assertEquals("n=5\nabab\nTrue\n1.5x",
                    run("print(\"n=\" + 5)\n" +
                        "print(\"ab\" * 2)\n" +
                        "print(\"b\" in \"abc\")\n" +
                        "print(1.5 + \"x\")"));
        }

        @Test
        @DisplayName("比较与成员检测")
        void testComparison() {
            assertEquals("True\nTrue\nFalse\nTrue",
                    run("print(1 == 1.0)\n" +
                        "print(\"a\" < \"b\")\n" +
                        "print(3 not in [1, 2, 3])\n" +
                        "print(\"k\" in {\"k\": 1})"));
        }

        @Test
        @DisplayName("f-string 插值")
        void testFString() {
            assertEquals("x=42, name=Ada",
                    run("let x = 41\n" +
                        "let name = \"Ada\"\n" +
                        "print(f\"x={x + 1}, name={name}\")"));
        }

        @Test
        @DisplayName("容器按 Python 风格渲染")
        void testRendering() {
            assertEquals("[1, 'a', None]\n{'k': 1.5}\nTrue 3.0\n(1, 2)",
                    run("print([1, \"a\", None])\n" +
                        "print({\"k\": 1.5})\n" +
                        "print(True, 3.0)\n" +
                        "print(tuple([1, 2]))"));
        }

        @Test
        @DisplayName("下标：负下标、字符串、字典")
        void testIndexing() {
            assertEquals("3\nb\n1",
                    run("let xs = [1, 2, 3]\n" +
                        "print(xs[-1])\n" +
                        "print(\"abc\"[1])\n" +
                        "let d = {\"k\": 1}\n" +
                        "print(d[\"k\"])"));
            GulRuntimeException e = runFailing("let d = {}\nprint(d[\"missing\"])");
            assertEquals("KeyError: 'missing'", e.getRawMessage());
        }

        @Test
        @DisplayName("复合赋值与下标赋值")
        void testAssignment() {
            assertEquals("15\n[1, 9]\n{'a': 2}",
                    run("let n = 10\n" +
                        "n += 5\n" +
                        "print(n)\n" +
                        "let xs = [1, 2]\n" +
                        "xs[1] = 9\n" +
                        "print(xs)\n" +
                        "let d = {}\n" +
                        "d[\"a\"] = 2\n" +
                        "print(d)"));
        }
    }

    // ============ 函数 ============

    @Nested
    @DisplayName("函数")
    class FunctionTests {

        @Test
        @DisplayName("默认参数与命名参数")
        void testDefaults() {
            assertEquals("Hello, Bob\nHi, Amy\nHello, Zed",
                    run("fn greet(name: @str, greeting: @str = \"Hello\") -> @str:\n" +
                        "    return greeting + \", \" + name\n" +
                        "print(greet(\"Bob\"))\n" +
                        "print(greet(\"Amy\", \"Hi\"))\n" +
                        "print(greet(name=\"Zed\"))"));
        }

        @Test
        @DisplayName("缺少的参数绑定为 None")
        void testMissingArgument() {
            assertEquals("None", run("fn show(a, b):\n    return b\nprint(show(1))"));
        }

        @Test
        @DisplayName("递归")
        void testRecursion() {
            assertEquals("55",
                    run("fn fib(n):\n" +
                        "    if n < 2:\n" +
                        "        return n\n" +
                        "    return fib(n - 1) + fib(n - 2)\n" +
                        "print(fib(10))"));
        }

        @Test
        @DisplayName("闭包是定义时的快照")
        void testClosureSnapshot() {
            assertEquals("11",
                    run("let base = 10\n" +
                        "fn add_base(n):\n" +
                        "    return n + base\n" +
                        "base = 20\n" +
                        "print(add_base(1))"));
        }

        @Test
        @DisplayName("函数体内的赋值不泄漏给调用方")
        void testNoLeak() {
            assertEquals("1\n0",
                    run("let count = 0\n" +
                        "fn bump():\n" +
                        "    count = count + 1\n" +
                        "    return count\n" +
                        "print(bump())\n" +
                        "print(count)"));
        }

        @Test
        @DisplayName("单行函数体与所有权修饰")
        void testInlineBody() {
            assertEquals("6", run("fn double(ref x: @int) -> @int: return x * 2\nprint(double(3))"));
        }

        @Test
        @DisplayName("多值返回与解构")
        void testTupleReturn() {
            assertEquals("1\ntwo\n(1, 'two')\ntwo 1",
                    run("fn pair():\n" +
                        "    return 1, \"two\"\n" +
                        "let a, b = pair()\n" +
                        "print(a)\n" +
                        "print(b)\n" +
                        "print(pair())\n" +
                        "a, b = b, a\n" +
                        "print(a, b)"));
        }

        @Test
        @DisplayName("解构数量不符")
        void testUnpackMismatch() {
            GulRuntimeException e = runFailing("let a, b = [1, 2, 3]");
            assertEquals("too many values to unpack (expected 2)", e.getRawMessage());
        }

        @Test
        @DisplayName("无限递归报错")
        void testRecursionLimit() {
            GulRuntimeException e = runFailing("fn f(n):\n    return f(n + 1)\nf(0)");
            assertEquals("maximum recursion depth exceeded", e.getRawMessage());
        }

        @Test
        @DisplayName("无限递归可以被 try/catch 捕获")
        void testRecursionLimitCatchable() {
            assertEquals("maximum recursion depth exceeded\nafter",
                    run("fn f(n):\n" +
                        "    return f(n + 1)\n" +
                        "try:\n" +
                        "    f(0)\n" +
                        "catch e:\n" +
                        "    print(e)\n" +
                        "print(\"after\")"));
        }

        @Test
        @DisplayName("Java 栈先耗尽时同样转成可捕获的错误")
        void testStackOverflowCatchable() throws InterruptedException {
            String[] result = new String[1];
            Thread small = new Thread(null, () -> result[0] = run(
                    "fn f(n):\n" +
                    "    return f(n + 1)\n" +
                    "try:\n" +
                    "    f(0)\n" +
                    "catch e:\n" +
                    "    print(e)"), "small-stack", 256 * 1024);
            small.start();
            small.join();
            assertEquals("maximum recursion depth exceeded", result[0]);
        }

        @Test
        @DisplayName("可配置调用深度上限，深调用栈折叠显示")
        void testConfiguredCallDepth() {
            interpreter.setMaxCallDepth(50);
            assertEquals(50, interpreter.getMaxCallDepth());
            assertEquals("0",
                    run("fn down(n):\n" +
                        "    if n == 0:\n" +
                        "        return 0\n" +
                        "    return down(n - 1)\n" +
                        "print(down(40))"));

            GulRuntimeException e = runFailing("down(60)");
            assertEquals("maximum recursion depth exceeded", e.getRawMessage());
            assertEquals(50, e.getGulTrace().size());
            assertTrue(e.getMessage().contains("\n  ... 30 frames omitted ..."));
            assertThrows(IllegalArgumentException.class, () -> interpreter.setMaxCallDepth(0));
        }
    }

    // ============ 结构体与枚举 ============

    @Nested
    @DisplayName("结构体与枚举")
    class TypeTests {

        @Test
        @DisplayName("字段默认值、实例方法与静态方法")
        void testStruct() {
            assertEquals("7\nPoint{x: 0, y: 0}\n10\nPoint{x: 10, y: 4}",
                    run("struct Point:\n" +
                        "    x: @int\n" +
                        "    y: @int = 0\n" +
                        "\n" +
                        "    fn sum(self) -> @int:\n" +
                        "        return self.x + self.y\n" +
                        "\n" +
                        "    fn origin():\n" +
                        "        return Point{x: 0}\n" +
                        "\n" +
                        "let p = Point{x: 3, y: 4}\n" +
                        "print(p.sum())\n" +
                        "print(Point.origin())\n" +
                        "p.x = 10\n" +
                        "print(p.x)\n" +
                        "print(p)"));
        }

        @Test
        @DisplayName("impl 块的方法修改实例")
        void testImpl() {
            assertEquals("2\n2",
                    run("struct Counter:\n" +
                        "    n: @int\n" +
                        "\n" +
                        "impl Counter:\n" +
                        "    fn inc(self):\n" +
                        "        self.n += 1\n" +
                        "        return self.n\n" +
                        "\n" +
                        "let c = Counter{n: 1}\n" +
                        "print(c.inc())\n" +
                        "print(c.n)"));
            // impl 中的方法不进入模块级名字空间
            assertNull(interpreter.getEnvironment().lookup("inc"));
        }

        @Test
        @DisplayName("未知属性报错")
        void testUnknownAttribute() {
            GulRuntimeException e = runFailing("struct P:\n    x: @int\nlet p = P{x: 1}\np.nope()");
            assertEquals("'P' object has no attribute 'nope'", e.getRawMessage());
        }

        @Test
        @DisplayName("枚举变体与 match")
        void testEnumMatch() {
            assertEquals("red\nother\nColor.Red",
                    run("enum Color:\n" +
                        "    Red\n" +
                        "    Green\n" +
                        "\n" +
                        "fn name(c):\n" +
                        "    match c:\n" +
                        "        Color.Red => return \"red\"\n" +
                        "        _ => return \"other\"\n" +
                        "\n" +
                        "print(name(Color.Red))\n" +
                        "print(name(Color.Green))\n" +
                        "print(Color.Red)"));
        }

        @Test
        @DisplayName("match 块分支，第一个匹配生效")
        void testMatchBlocks() {
            assertEquals("two\nfallback",
                    run("let x = 2\n" +
                        "match x:\n" +
                        "    1:\n" +
                        "        print(\"one\")\n" +
                        "    case 2:\n" +
                        "        print(\"two\")\n" +
                        "    2:\n" +
                        "        print(\"again\")\n" +
                        "match \"z\":\n" +
                        "    \"a\" => print(\"a\")\n" +
                        "    else =>\n" +
                        "        print(\"fallback\")"));
        }
    }

    // ============ 控制流 ============

    @Nested
    @DisplayName("控制流")
    class ControlFlowTests {

        @Test
        @DisplayName("if / elif / else if / else")
        void testIfChain() {
            assertEquals("A\nB\nC\nF",
                    run("fn grade(n):\n" +
                        "    if n >= 90:\n" +
                        "        return \"A\"\n" +
                        "    elif n >= 80:\n" +
                        "        return \"B\"\n" +
                        "    else if n >= 70:\n" +
                        "        return \"C\"\n" +
                        "    else:\n" +
                        "        return \"F\"\n" +
                        "print(grade(95))\n" +
                        "print(grade(85))\n" +
                        "print(grade(75))\n" +
                        "print(grade(10))"));
        }

        @Test
        @DisplayName("单行 if")
        void testInlineIf() {
            assertEquals("pos", run("let x = 3\nif x > 0: print(\"pos\")\nif x < 0: print(\"neg\")"));
        }

        @Test
        @DisplayName("for 中的 break 与 continue")
        void testForBreakContinue() {
            assertEquals("16",
                    run("let total = 0\n" +
                        "for i in range(10):\n" +
                        "    if i % 2 == 0:\n" +
                        "        continue\n" +
                        "    if i > 7:\n" +
                        "        break\n" +
                        "    total += i\n" +
                        "print(total)"));
        }

        @Test
        @DisplayName("while 与 loop")
        void testWhileAndLoop() {
            assertEquals("5\n3",
                    run("let n = 0\n" +
                        "while n < 5:\n" +
                        "    n += 1\n" +
                        "print(n)\n" +
                        "let k = 0\n" +
                        "loop:\n" +
                        "    k += 1\n" +
                        "    if k == 3:\n" +
                        "        break\n" +
                        "print(k)"));
        }

        @Test
        @DisplayName("for 解构键值对")
        void testForUnpack() {
            assertEquals("a=1\nb=2",
                    run("let d = {\"a\": 1, \"b\": 2}\n" +
                        "for k, v in d.items():\n" +
                        "    print(k + \"=\" + str(v))"));
        }

        @Test
        @DisplayName("遍历列表时追加的元素也会被访问")
        void testLiveListIteration() {
            assertEquals("[1, 2, 3]",
                    run("let xs = [1]\n" +
                        "for x in xs:\n" +
                        "    if x < 3:\n" +
                        "        xs.append(x + 1)\n" +
                        "print(xs)"));
        }

        @Test
        @DisplayName("mn 块与文档字符串")
        void testMainBlock() {
            assertEquals("main",
                    run("\"\"\"\n" +
                        "模块说明\n" +
                        "\"\"\"\n" +
                        "mn:\n" +
                        "    \"\"\"入口\"\"\"\n" +
                        "    pass\n" +
                        "    print(\"main\")  # 注释"));
        }

        @Test
        @DisplayName("孤立的 else 报错")
        void testDanglingElse() {
            GulRuntimeException e = runFailing("else:\n    pass");
            assertEquals("'else' without a matching 'if'", e.getRawMessage());
        }
    }

    // ============ 错误处理 ============

    @Nested
    @DisplayName("错误处理")
    class ErrorTests {

        @Test
        @DisplayName("catch 绑定错误消息")
        void testCatch() {
            assertEquals("caught: integer modulo by zero\nafter",
                    run("try:\n" +
                        "    let z = 1 % 0\n" +
                        "catch e:\n" +
                        "    print(\"caught: \" + e)\n" +
                        "print(\"after\")"));
        }

        @Test
        @DisplayName("except ... as 形式")
        void testExceptAs() {
            assertEquals("name 'nope' is not defined",
                    run("try:\n" +
                        "    print(nope)\n" +
                        "except Exception as err:\n" +
                        "    print(err)"));
        }

        @Test
        @DisplayName("没有 catch 时错误被吞掉")
        void testTryWithoutCatch() {
            assertEquals("after", run("try:\n    print(undefined_name)\nprint(\"after\")"));
        }

        @Test
        @DisplayName("未定义名字：消息、行号与源码行")
        void testUndefinedName() {
            GulRuntimeException e = runFailing("let a = 1\nprint(b)");
            assertEquals("name 'b' is not defined", e.getRawMessage());
            assertEquals(2, e.getLine());
            assertEquals("<test>", e.getFileName());
            assertTrue(e.getMessage().contains("at <test>:2: print(b)"));
        }

        @Test
        @DisplayName("函数中的错误带调用栈")
        void testTrace() {
            GulRuntimeException e = runFailing("fn boom():\n    return 1 % 0\nboom()");
            assertEquals(2, e.getLine());
            assertEquals(1, e.getGulTrace().size());
            assertTrue(e.getGulTrace().get(0).startsWith("fn boom ("));
            assertTrue(e.getMessage().contains("\n  in fn boom"));
        }

        @Test
        @DisplayName("超出指令预算是致命错误，try 也捕获不了")
        void testMaxSteps() {
            interpreter.setMaxSteps(100);
            GulRuntimeException e = runFailing("try:\n    while True:\n        pass\ncatch e:\n    print(e)");
            assertTrue(e.isFatal());
            assertEquals("Instruction budget exceeded", e.getRawMessage());
            assertEquals("", getOutput());
        }

        @Test
        @DisplayName("缺少冒号")
        void testMissingColon() {
            GulRuntimeException e = runFailing("while True\n    pass");
            assertEquals("Expected ':' after 'while'", e.getRawMessage());
        }

        @Test
        @DisplayName("未绑定根名字的属性链求值为源码文本")
        void testAttributeFallback() {
            assertEquals("foo.bar.baz", run("print(foo.bar.baz)"));
        }
    }

    // ============ 内置函数与原生方法 ============

    @Nested
    @DisplayName("内置函数")
    class BuiltinTests {

        @Test
        @DisplayName("类型转换")
        void testConversions() {
            assertEquals("5\n43\n2.5\n3.0\n7\n[]\nFalse",
                    run("print(len(\"héllo\"))\n" +
                        "print(int(\"42\") + 1)\n" +
                        "print(float(\"2.5\"))\n" +
                        "print(str(3.0))\n" +
                        "print(@int(\"7\"))\n" +
                        "print(@list())\n" +
                        "print(bool(\"\"))"));
        }

        @Test
        @DisplayName("非法整数文本")
        void testInvalidInt() {
            GulRuntimeException e = runFailing("int(\"abc\")");
            assertEquals("invalid literal for int() with base 10: 'abc'", e.getRawMessage());
        }

        @Test
        @DisplayName("range 直接返回列表")
        void testRange() {
            assertEquals("[0, 1, 2]\n[1, 4, 7]\n[3, 2, 1]",
                    run("print(range(3))\nprint(range(1, 10, 3))\nprint(range(3, 0, -1))"));
        }

        @Test
        @DisplayName("字符串方法")
        void testStringMethods() {
            assertEquals("['a', 'b', 'c']\nx-y\n1 + 2\nHI\nTrue",
                    run("print(\"a,b,c\".split(\",\"))\n" +
                        "print(\"-\".join([\"x\", \"y\"]))\n" +
                        "print(\"{} + {}\".format(1, 2))\n" +
                        "print(\" hi \".strip().upper())\n" +
                        "print(\"main.mn\".endswith(\".mn\"))"));
        }

        @Test
        @DisplayName("列表与字典方法")
        void testCollectionMethods() {
            assertEquals("3\n[1, 2]\n0\n['a']\n[1, 2, 3]",
                    run("let xs = [2, 1, 3]\n" +
                        "print(xs.pop())\n" +
                        "xs.sort()\n" +
                        "print(xs)\n" +
                        "let d = {\"a\": 1}\n" +
                        "print(d.get(\"missing\", 0))\n" +
                        "print(d.keys())\n" +
                        "xs.extend([3])\n" +
                        "print(xs)"));
        }

        @Test
        @DisplayName("sys.argv")
        void testArgv() {
            interpreter.setArgv(Arrays.asList("main.mn", "x"));
            assertEquals("['main.mn', 'x']", run("print(sys.argv)"));
        }

        @Test
        @DisplayName("文件读写相对工作目录")
        void testFileBuiltins(@TempDir Path temp) {
            interpreter.setWorkingDirectory(temp);
            assertEquals("True\nTrue\nhello",
                    run("print(write_file(\"out.txt\", \"hello\"))\n" +
                        "print(file_exists(\"out.txt\"))\n" +
                        "print(read_file(\"out.txt\"))"));
            GulRuntimeException e = runFailing("read_file(\"missing.txt\")");
            assertEquals("No such file or directory: 'missing.txt'", e.getRawMessage());
        }
    }

    // ============ 入口 ============

    @Nested
    @DisplayName("入口与状态")
    class EntryTests {

        @Test
        @DisplayName("evaluate 求值单个表达式")
        void testEvaluate() {
            GulValue value = interpreter.evaluate("1 + 2");
            assertEquals(GulInt.of(3), value);
        }

        @Test
        @DisplayName("runFile 输出开始与完成横幅")
        void testRunFile(@TempDir Path temp) throws IOException {
            Files.write(temp.resolve("hello.mn"), "mn:\n    print(\"hi\")\n".getBytes(StandardCharsets.UTF_8));
            interpreter.setWorkingDirectory(temp);
            interpreter.runFile(Paths.get("hello.mn"));
            assertEquals("🚀 Running: hello.mn\n\nhi\n\n✅ Complete!", getOutput());
        }

        @Test
        @DisplayName("调试模式先输出提示")
        void testRunFileDebug(@TempDir Path temp) throws IOException {
            Path file = temp.resolve("a.mn");
            Files.write(file, "pass\n".getBytes(StandardCharsets.UTF_8));
            interpreter.setDebug(true);
            interpreter.runFile(file);
            assertTrue(getOutput().startsWith("🐞 Debug mode enabled\n🚀 Running: "));
        }

        @Test
        @DisplayName("getGlobals 只列出用户定义的名字")
        void testGlobals() {
            run("let a = 1\n" +
                "fn twice(n):\n" +
                "    return n * 2\n" +
                "let len = 3");
            assertTrue(interpreter.getGlobals().keySet().containsAll(Arrays.asList("a", "twice", "len")));
            assertFalse(interpreter.getGlobals().containsKey("print"));
            assertFalse(interpreter.getGlobals().containsKey("sys"));
            assertEquals(GulInt.of(3), interpreter.getGlobals().get("len"));
        }

        @Test
        @DisplayName("循环体的表达式命中解析缓存")
        void testParseCache() {
            run("let n = 0\nwhile n < 20:\n    n += 1");
            assertTrue(interpreter.getParseCacheStats().getHitCount() > 0);
            // 未设置预算时不计步
            assertEquals(0, interpreter.getSteps());
        }

        @Test
        @DisplayName("设置预算后统计执行步数")
        void testStepsCounted() {
            interpreter.setMaxSteps(10000);
            run("let n = 0\nwhile n < 3:\n    n += 1");
            assertTrue(interpreter.getSteps() > 3);
        }
    }
}
