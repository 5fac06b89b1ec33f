package gul.runtime.interpreter;

import com.gullang.compiler.ast.expr.Expression;
import com.gullang.compiler.lexer.Lexer;
import com.gullang.compiler.lexer.Token;
import com.gullang.compiler.lexer.TokenType;
import com.gullang.compiler.parser.ParseException;
import com.gullang.compiler.parser.Parser;
import com.gullang.compiler.source.LogicalLine;
import com.gullang.compiler.source.SourceLines;
import gul.runtime.GulList;
import gul.runtime.GulNamespace;
import gul.runtime.GulNone;
import gul.runtime.GulString;
import gul.runtime.GulValue;
import gul.runtime.interpreter.cache.BoundedCache;
import gul.runtime.interpreter.cache.CacheStats;
import gul.runtime.interpreter.cache.CaffeineCache;
import gul.runtime.types.Environment;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * GUL 解释器。
 *
 * <p>逐条逻辑行执行源码：语句结构由 {@link StatementDispatcher} 按缩进识别，
 * 表达式经解析缓存得到 AST 后由 {@link ExpressionEvaluator} 求值。
 * 整个运行共用一个扁平的 {@link Environment}。</p>
 */
public class Interpreter {

    private static final Logger LOG = Logger.getLogger(Interpreter.class.getName());

    public static final int DEFAULT_PARSE_CACHE_SIZE = 4096;

    /** GUL 函数调用的默认最大嵌套深度 */
    public static final int MAX_CALL_DEPTH = 1000;

    /** 唯一的运行时环境 */
    private final Environment environment = new Environment();

    /** 已解析表达式缓存，键为 文件:行号:文本 */
    private final BoundedCache<String, Expression> parseCache;

    private final ExpressionEvaluator evaluator;
    private final StatementDispatcher dispatcher;
    private final ModuleLoader moduleLoader;

    /** 以 sys 名字暴露给 GUL 代码，argv 为其属性 */
    private final GulNamespace sysModule = new GulNamespace("sys");

    /** 标准输出流 */
    private PrintStream stdout = System.out;

    private boolean debug;

    /** 相对路径（模块查找、文件内置函数）的基准目录 */
    private Path workingDirectory = Paths.get("").toAbsolutePath();

    /** 语句预算，<= 0 表示不限制 */
    private long maxSteps;
    private long steps;

    /** 当前调用深度（递归检查用） */
    private int callDepth;
    private int maxCallDepth = MAX_CALL_DEPTH;

    /** 当前执行的文件名（错误位置与模块相对查找） */
    private String currentFile = "<script>";

    public Interpreter() {
        this(DEFAULT_PARSE_CACHE_SIZE);
    }

    public Interpreter(long parseCacheSize) {
        this.parseCache = new CaffeineCache<String, Expression>(parseCacheSize);
        this.evaluator = new ExpressionEvaluator(this);
        this.dispatcher = new StatementDispatcher(this);
        this.moduleLoader = new ModuleLoader(this);
        setArgv(Collections.<String>emptyList());
        Builtins.register(this, environment);
        environment.sealBuiltins();
    }

    // ============ 入口 ============

    /**
     * 执行源文件，前后输出开始与完成横幅
     */
    public void runFile(Path file) throws IOException {
        Path resolved = file.isAbsolute() ? file : workingDirectory.resolve(file);
        String source = new String(Files.readAllBytes(resolved), StandardCharsets.UTF_8);
        if (debug) {
            stdout.println("🐞 Debug mode enabled");
        }
        stdout.println("🚀 Running: " + file + "\n");
        execute(source, resolved.toString());
        if (debug && LOG.isLoggable(Level.FINE)) {
            LOG.fine("Globals after run: " + getGlobals().keySet());
        }
        stdout.println("\n✅ Complete!");
    }

    /**
     * 执行一段源码。顶层的 return / break / continue 被忽略。
     */
    public void execute(String source, String fileName) {
        try {
            executeModule(source, fileName);
        } catch (StackOverflowError e) {
            throw new GulRuntimeException("maximum recursion depth exceeded");
        }
    }

    /**
     * 求值单个表达式
     */
    public GulValue evaluate(String expression) {
        String saved = currentFile;
        currentFile = "<eval>";
        try {
            return evaluator.evaluate(expression.trim(), 1);
        } finally {
            currentFile = saved;
        }
    }

    void executeModule(String source, String fileName) {
        List<LogicalLine> lines = SourceLines.logical(source);
        String saved = currentFile;
        currentFile = fileName;
        try {
            dispatcher.executeBlock(lines, 0, lines.size());
        } finally {
            currentFile = saved;
        }
    }

    // ============ 函数调用 ============

    /**
     * 调用源码定义的函数：保存调用方环境，叠加闭包快照并绑定参数，执行函数体后整体恢复。
     * 缺少的参数取默认值（调用时求值），没有默认值绑定 None；多余的参数被忽略。
     */
    GulValue callFunction(GulFunction function, List<GulValue> args, Map<String, GulValue> namedArgs) {
        if (callDepth >= maxCallDepth) {
            throw new GulRuntimeException("maximum recursion depth exceeded");
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Calling " + function.getName() + " with " + args.size() + " args");
        }
        Map<String, GulValue> saved = environment.snapshot();
        String savedFile = currentFile;
        callDepth++;
        try {
            environment.overlay(function.getClosure());
            currentFile = function.getFileName();
            List<Parameter> params = function.getParams();
            for (int i = 0; i < params.size(); i++) {
                Parameter param = params.get(i);
                GulValue value = i < args.size() ? args.get(i) : namedArgs.get(param.getName());
                if (value == null && param.hasDefault()) {
                    value = evaluator.evaluate(param.getDefaultSource(), function.getLine());
                }
                environment.define(param.getName(), value != null ? value : GulNone.NONE);
            }
            List<LogicalLine> body = function.getBody();
            Signal signal = dispatcher.executeBlock(body, 0, body.size());
            return signal.isReturn() ? signal.getValue() : GulNone.NONE;
        } catch (GulRuntimeException e) {
            e.addTraceFrame("fn " + function.getName() + " (" + function.getFileName() + ":" + function.getLine() + ")");
            throw e;
        } catch (StackOverflowError e) {
            // Java 栈先于深度上限耗尽：转成可被 try/catch 捕获的运行时错误
            GulRuntimeException error = new GulRuntimeException("maximum recursion depth exceeded");
            error.addTraceFrame("fn " + function.getName() + " (" + function.getFileName() + ":" + function.getLine() + ")");
            throw error;
        } finally {
            callDepth--;
            currentFile = savedFile;
            environment.restore(saved);
        }
    }

    // ============ 解析缓存 ============

    Expression parseExpression(String text, int line) {
        String file = currentFile;
        try {
            return parseCache.computeIfAbsent(file + ':' + line + ':' + text,
                    k -> Parser.parseExpression(text, file, line));
        } catch (ParseException e) {
            throw evaluationFailure(text, e);
        }
    }

    Expression parseStatement(String text, int line) {
        String file = currentFile;
        try {
            return parseCache.computeIfAbsent("stmt:" + file + ':' + line + ':' + text,
                    k -> new Parser(new Lexer(text, file, line)).parseStatementExpression());
        } catch (ParseException e) {
            throw evaluationFailure(text, e);
        }
    }

    /**
     * 词法错误（如整数字面量越界）把原因附在消息后面
     */
    private static GulRuntimeException evaluationFailure(String text, ParseException e) {
        String message = "Failed to evaluate expression: '" + text + "'";
        Token token = e.getToken();
        if (token != null && token.is(TokenType.ERROR)) {
            String detail = String.valueOf(token.getLiteral());
            int marker = detail.indexOf("Lexer error: ");
            message += " (" + (marker >= 0 ? detail.substring(marker + "Lexer error: ".length()) : detail) + ")";
        }
        return new GulRuntimeException(message, e);
    }

    public CacheStats getParseCacheStats() {
        return parseCache.getStats();
    }

    // ============ 预算 ============

    void countStep() {
        if (maxSteps > 0 && ++steps > maxSteps) {
            throw GulRuntimeException.fatal("Instruction budget exceeded");
        }
    }

    public long getSteps() {
        return steps;
    }

    // ============ 路径 ============

    /**
     * 相对路径按工作目录解析
     */
    public Path resolvePath(String path) {
        Path p = Paths.get(path);
        return p.isAbsolute() ? p : workingDirectory.resolve(p);
    }

    /** 当前执行文件所在目录；没有真实文件时为工作目录 */
    Path currentDirectory() {
        if (currentFile == null || currentFile.startsWith("<")) {
            return workingDirectory;
        }
        Path parent = resolvePath(currentFile).getParent();
        return parent != null ? parent : workingDirectory;
    }

    // ============ 访问器 ============

    /** 用户代码定义的全局绑定（不含未改动的内置） */
    public Map<String, GulValue> getGlobals() {
        return environment.userBindings();
    }

    public Environment getEnvironment() {
        return environment;
    }

    public ExpressionEvaluator getEvaluator() {
        return evaluator;
    }

    public StatementDispatcher getDispatcher() {
        return dispatcher;
    }

    public ModuleLoader getModuleLoader() {
        return moduleLoader;
    }

    public GulNamespace getSysModule() {
        return sysModule;
    }

    public String getCurrentFile() {
        return currentFile;
    }

    public PrintStream getStdout() { return stdout; }

    public void setStdout(PrintStream stdout) { this.stdout = stdout; }

    public boolean isDebug() { return debug; }

    public void setDebug(boolean debug) { this.debug = debug; }

    public Path getWorkingDirectory() { return workingDirectory; }

    public void setWorkingDirectory(Path workingDirectory) {
        this.workingDirectory = workingDirectory.toAbsolutePath();
    }

    public long getMaxSteps() { return maxSteps; }

    public void setMaxSteps(long maxSteps) { this.maxSteps = maxSteps; }

    public int getMaxCallDepth() { return maxCallDepth; }

    /**
     * 设置函数调用深度上限。实际可达深度还受执行线程的 Java 栈大小限制。
     */
    public void setMaxCallDepth(int maxCallDepth) {
        if (maxCallDepth <= 0) {
            throw new IllegalArgumentException("maxCallDepth must be positive: " + maxCallDepth);
        }
        this.maxCallDepth = maxCallDepth;
    }

    /**
     * 设置 sys.argv（惯例上第一个元素是脚本路径）
     */
    public void setArgv(List<String> argv) {
        List<GulValue> values = new ArrayList<GulValue>(argv.size());
        for (String arg : argv) {
            values.add(GulString.of(arg));
        }
        sysModule.setAttribute("argv", new GulList(values));
    }
}
