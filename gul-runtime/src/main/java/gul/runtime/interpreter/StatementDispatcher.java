package gul.runtime.interpreter;

import com.gullang.compiler.source.BlockKind;
import com.gullang.compiler.source.IndentationBlockTracker;
import com.gullang.compiler.source.LogicalLine;
import com.gullang.compiler.source.TextScanner;
import gul.runtime.GulException;
import gul.runtime.GulList;
import gul.runtime.GulNamespace;
import gul.runtime.GulNone;
import gul.runtime.GulString;
import gul.runtime.GulTuple;
import gul.runtime.GulValue;
import gul.runtime.types.Environment;
import gul.runtime.types.FieldSpec;
import gul.runtime.types.GulEnumDefinition;
import gul.runtime.types.GulStructDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 语句分派器
 *
 * <p>按首个单词识别语句。块结构（if / match / while / for / try / fn / struct / enum / impl / mn）
 * 各自从块头向后扫描，找到第一个缩进不大于块头的非空行作为块的结束。</p>
 *
 * <p>return / break / continue 通过返回的 {@link Signal} 传播，由拥有它的结构消费。</p>
 */
public final class StatementDispatcher {

    private static final Logger LOG = Logger.getLogger(StatementDispatcher.class.getName());

    private static final Pattern IMPORT_ALIAS = Pattern.compile("^([\\w.]+)\\s+as\\s+([A-Za-z_]\\w*)$");
    private static final Pattern IDENT = Pattern.compile("[A-Za-z_]\\w*");
    private static final String DOCSTRING = "\"\"\"";

    private final Interpreter interpreter;

    StatementDispatcher(Interpreter interpreter) {
        this.interpreter = interpreter;
    }

    /**
     * 语句执行结果：控制信号 + 下一条语句的下标
     */
    private static final class Outcome {
        final Signal signal;
        final int next;

        Outcome(Signal signal, int next) {
            this.signal = signal;
            this.next = next;
        }

        static Outcome next(int next) {
            return new Outcome(Signal.NORMAL, next);
        }
    }

    /**
     * 块头：关键字之后、顶层冒号之前的文本，以及冒号之后的内联语句
     */
    private static final class Header {
        final String text;
        final String inline;

        Header(String text, String inline) {
            this.text = text;
            this.inline = inline;
        }
    }

    /**
     * 执行 [start, end) 范围内的逻辑行
     *
     * @return 遇到 return / break / continue 时返回对应信号，否则 NORMAL
     */
    public Signal executeBlock(List<LogicalLine> lines, int start, int end) {
        int i = start;
        while (i < end) {
            LogicalLine line = lines.get(i);
            if (line.isBlank()) {
                i++;
                continue;
            }
            if (line.getCode().startsWith(DOCSTRING)) {
                i = skipDocstring(lines, i, end);
                continue;
            }
            interpreter.countStep();
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Processing line " + line.getNumber() + ": " + line.getCode());
            }
            Outcome outcome;
            try {
                outcome = execute(lines, i, end);
            } catch (GulRuntimeException e) {
                throw e.withLocation(interpreter.getCurrentFile(), line.getNumber(), line.getCode());
            } catch (GulException e) {
                throw new GulRuntimeException(e.getMessage(), e)
                        .withLocation(interpreter.getCurrentFile(), line.getNumber(), line.getCode());
            }
            if (!outcome.signal.isNormal()) {
                return outcome.signal;
            }
            i = outcome.next;
        }
        return Signal.NORMAL;
    }

    private Outcome execute(List<LogicalLine> lines, int i, int end) {
        LogicalLine line = lines.get(i);
        String code = line.getCode();
        if (code.startsWith("@imp")) {
            importModules(code.substring(4).trim());
            return Outcome.next(i + 1);
        }
        String word = BlockKind.firstWord(code);
        switch (word) {
            case "fn":
            case "async":
                return defineFunction(lines, i, end);
            case "struct":
                return defineStruct(lines, i, end);
            case "enum":
                return defineEnum(lines, i, end);
            case "impl":
                return defineImpl(lines, i, end);
            case "mn":
                if (code.startsWith("mn:")) {
                    int bodyEnd = blockEnd(lines, i, end);
                    LOG.fine("Entering main block");
                    return new Outcome(runBody(lines, i, bodyEnd, header(code, "mn").inline), bodyEnd);
                }
                break;
            case "if":
                return executeIf(lines, i, end);
            case "elif":
            case "else":
                throw new GulRuntimeException("'" + word + "' without a matching 'if'");
            case "match":
                return executeMatch(lines, i, end);
            case "while":
                return executeWhile(lines, i, end);
            case "loop":
                if (code.startsWith("loop:")) {
                    return executeLoop(lines, i, end);
                }
                break;
            case "for":
                return executeFor(lines, i, end);
            case "try":
                if (code.startsWith("try:")) {
                    return executeTry(lines, i, end);
                }
                break;
            case "catch":
            case "except":
                throw new GulRuntimeException("'" + word + "' without a matching 'try'");
            case "return": {
                String rest = code.substring("return".length()).trim();
                GulValue value = rest.isEmpty() ? GulNone.NONE : evaluateValue(rest, line);
                return new Outcome(Signal.returnValue(value), i + 1);
            }
            case "break":
                if (code.equals("break")) {
                    return new Outcome(Signal.BREAK, i + 1);
                }
                break;
            case "continue":
                if (code.equals("continue")) {
                    return new Outcome(Signal.CONTINUE, i + 1);
                }
                break;
            case "pass":
                if (code.equals("pass")) {
                    return Outcome.next(i + 1);
                }
                break;
            case "let":
            case "var":
            case "const":
                if (code.length() > word.length() && Character.isWhitespace(code.charAt(word.length()))) {
                    declare(code.substring(word.length()).trim(), line);
                    return Outcome.next(i + 1);
                }
                break;
            default:
                break;
        }
        executeSimple(code, line);
        return Outcome.next(i + 1);
    }

    // ============ 导入 ============

    // @imp a.b.c / @imp a.b, c.d / @imp a.b as m
    private void importModules(String specs) {
        Environment env = interpreter.getEnvironment();
        for (String part : TextScanner.splitTopLevel(specs, ',')) {
            String spec = part.trim();
            if (spec.isEmpty()) {
                continue;
            }
            Matcher alias = IMPORT_ALIAS.matcher(spec);
            if (alias.matches()) {
                Map<String, GulValue> before = env.snapshot();
                Map<String, GulValue> exports = interpreter.getModuleLoader().load(alias.group(1));
                env.restore(before);
                GulNamespace namespace = new GulNamespace(alias.group(1));
                for (Map.Entry<String, GulValue> e : exports.entrySet()) {
                    namespace.setAttribute(e.getKey(), e.getValue());
                }
                env.define(alias.group(2), namespace);
            } else {
                env.overlay(interpreter.getModuleLoader().load(spec));
            }
        }
    }

    // ============ 声明 ============

    private Outcome defineFunction(List<LogicalLine> lines, int i, int end) {
        int bodyEnd = blockEnd(lines, i, end);
        GulFunction function = parseFunction(lines, i, bodyEnd, true);
        if (function != null) {
            interpreter.getEnvironment().define(function.getName(), function);
        }
        return Outcome.next(bodyEnd);
    }

    /**
     * 解析 fn 声明；签名无法识别时记录警告并返回 null。
     * selfReference 为 true 时闭包中包含函数自身，用于递归。
     */
    private GulFunction parseFunction(List<LogicalLine> lines, int i, int bodyEnd, boolean selfReference) {
        LogicalLine line = lines.get(i);
        DeclarationParser.FnHeader header = DeclarationParser.parseFnHeader(line.getCode());
        if (header == null) {
            LOG.warning("Could not parse function signature at " + location(line) + ": " + line.getCode());
            return null;
        }
        List<LogicalLine> body = header.inlineBody != null
                ? Collections.singletonList(inlineLine(header.inlineBody, line))
                : lines.subList(i + 1, bodyEnd);
        Map<String, GulValue> closure = interpreter.getEnvironment().snapshot();
        GulFunction function = new GulFunction(header.name, header.params, header.returnType, body, closure,
                interpreter.getCurrentFile(), line.getNumber(), interpreter);
        if (selfReference) {
            closure.put(header.name, function);
        }
        return function;
    }

    private Outcome defineStruct(List<LogicalLine> lines, int i, int end) {
        LogicalLine line = lines.get(i);
        int bodyEnd = blockEnd(lines, i, end);
        String name = DeclarationParser.typeName(line.getCode());
        if (name == null) {
            LOG.warning("Could not parse struct declaration at " + location(line) + ": " + line.getCode());
            return Outcome.next(bodyEnd);
        }
        List<FieldSpec> fields = new ArrayList<FieldSpec>();
        List<GulFunction> methods = new ArrayList<GulFunction>();
        int k = i + 1;
        while (k < bodyEnd) {
            LogicalLine member = lines.get(k);
            if (member.isBlank()) {
                k++;
                continue;
            }
            if (member.getCode().startsWith(DOCSTRING)) {
                k = skipDocstring(lines, k, bodyEnd);
                continue;
            }
            int memberEnd = blockEnd(lines, k, bodyEnd);
            if (isFunctionHeader(member.getCode())) {
                GulFunction method = parseFunction(lines, k, memberEnd, false);
                if (method != null) {
                    methods.add(method);
                }
            } else {
                FieldSpec field = DeclarationParser.parseField(member.getCode());
                if (field != null) {
                    fields.add(field);
                }
            }
            k = memberEnd;
        }
        GulStructDefinition definition = new GulStructDefinition(name, fields);
        for (GulFunction method : methods) {
            addMethod(definition, method);
        }
        interpreter.getEnvironment().define(name, definition);
        return Outcome.next(bodyEnd);
    }

    private Outcome defineEnum(List<LogicalLine> lines, int i, int end) {
        LogicalLine line = lines.get(i);
        int bodyEnd = blockEnd(lines, i, end);
        String name = DeclarationParser.typeName(line.getCode());
        if (name == null) {
            LOG.warning("Could not parse enum declaration at " + location(line) + ": " + line.getCode());
            return Outcome.next(bodyEnd);
        }
        List<String> variants = new ArrayList<String>();
        for (int k = i + 1; k < bodyEnd; k++) {
            String code = lines.get(k).getCode();
            if (code.isEmpty() || code.startsWith(DOCSTRING) || "pass".equals(code)) {
                continue;
            }
            variants.add(code.endsWith(",") ? code.substring(0, code.length() - 1).trim() : code);
        }
        interpreter.getEnvironment().define(name, new GulEnumDefinition(name, variants));
        return Outcome.next(bodyEnd);
    }

    /**
     * impl 中的函数只进入结构体的方法表，不成为模块级名字
     */
    private Outcome defineImpl(List<LogicalLine> lines, int i, int end) {
        LogicalLine line = lines.get(i);
        int bodyEnd = blockEnd(lines, i, end);
        String target = DeclarationParser.implTarget(line.getCode());
        GulValue bound = target != null ? interpreter.getEnvironment().lookup(target) : null;
        if (!(bound instanceof GulStructDefinition)) {
            LOG.warning("impl for unknown struct " + target + " at " + location(line));
            return Outcome.next(bodyEnd);
        }
        GulStructDefinition definition = (GulStructDefinition) bound;
        int k = i + 1;
        while (k < bodyEnd) {
            LogicalLine member = lines.get(k);
            if (member.isBlank()) {
                k++;
                continue;
            }
            int memberEnd = blockEnd(lines, k, bodyEnd);
            if (isFunctionHeader(member.getCode())) {
                GulFunction method = parseFunction(lines, k, memberEnd, false);
                if (method != null) {
                    addMethod(definition, method);
                }
            }
            k = memberEnd;
        }
        return Outcome.next(bodyEnd);
    }

    // 第一个参数为 self 的进入实例表，其余进入静态表
    private static void addMethod(GulStructDefinition definition, GulFunction method) {
        if (method.isInstanceMethod()) {
            definition.addInstanceMethod(method.getName(), method);
        } else {
            definition.addStaticMethod(method.getName(), method);
        }
        method.getClosure().put(definition.getName(), definition);
    }

    private static boolean isFunctionHeader(String code) {
        String word = BlockKind.firstWord(code);
        return "fn".equals(word) || "async".equals(word);
    }

    // ============ 条件与匹配 ============

    private Outcome executeIf(List<LogicalLine> lines, int i, int end) {
        int indent = lines.get(i).getIndent();
        List<Integer> branches = new ArrayList<Integer>();
        branches.add(i);
        int next = blockEnd(lines, i, end);
        while (next < end && lines.get(next).getIndent() == indent && isElseBranch(lines.get(next).getCode())) {
            branches.add(next);
            next = blockEnd(lines, next, end);
        }
        for (int branch : branches) {
            LogicalLine line = lines.get(branch);
            String code = line.getCode();
            String word = BlockKind.firstWord(code);
            Header header;
            boolean taken;
            if ("else".equals(word) && !isElseIf(code)) {
                header = header(code, "else");
                taken = true;
            } else {
                String keyword = isElseIf(code) ? code.substring(0, code.indexOf("if") + 2) : word;
                header = header(code, keyword);
                taken = evaluate(header.text, line).isTruthy();
            }
            if (taken) {
                return new Outcome(runBody(lines, branch, blockEnd(lines, branch, end), header.inline), next);
            }
        }
        return Outcome.next(next);
    }

    private static boolean isElseBranch(String code) {
        String word = BlockKind.firstWord(code);
        return "elif".equals(word) || "else".equals(word);
    }

    private static boolean isElseIf(String code) {
        return code.startsWith("else ") && code.substring(4).trim().startsWith("if ");
    }

    /**
     * match 主体只求值一次；分支为 {@code pattern => expr}、{@code pattern =>} 加缩进块，
     * 或 {@code pattern:} 加缩进块。_ 与 else 总是匹配，其余模式求值后按 == 比较，
     * 第一个匹配的分支执行后结束。
     */
    private Outcome executeMatch(List<LogicalLine> lines, int i, int end) {
        LogicalLine line = lines.get(i);
        Header header = header(line.getCode(), "match");
        int matchEnd = blockEnd(lines, i, end);
        GulValue subject = evaluate(header.text, line);
        int armIndent = -1;
        int k = i + 1;
        while (k < matchEnd) {
            LogicalLine arm = lines.get(k);
            if (arm.isBlank()) {
                k++;
                continue;
            }
            int armEnd = blockEnd(lines, k, matchEnd);
            if (armIndent < 0) {
                armIndent = arm.getIndent();
            }
            String[] parts = arm.getIndent() == armIndent ? splitArm(arm.getCode()) : null;
            if (parts != null && armMatches(parts[0], subject, arm)) {
                Signal signal = Signal.NORMAL;
                if (parts[1] != null) {
                    signal = executeInline(parts[1], arm);
                }
                if (signal.isNormal() && armEnd > k + 1) {
                    signal = executeBlock(lines, k + 1, armEnd);
                }
                return new Outcome(signal, matchEnd);
            }
            k = armEnd;
        }
        return Outcome.next(matchEnd);
    }

    /**
     * @return {pattern, inlineBody}，inlineBody 可为 null；不是分支行时返回 null
     */
    private static String[] splitArm(String code) {
        int arrow = TextScanner.topLevelArrow(code);
        if (arrow >= 0) {
            String body = code.substring(arrow + 2).trim();
            if (body.isEmpty() || ":".equals(body) || "{".equals(body)) {
                body = null;
            }
            return new String[] {code.substring(0, arrow).trim(), body};
        }
        if (code.endsWith(":")) {
            String pattern = code.substring(0, code.length() - 1).trim();
            if (pattern.startsWith("case ")) {
                pattern = pattern.substring(5).trim();
            }
            return new String[] {pattern, null};
        }
        return null;
    }

    private boolean armMatches(String pattern, GulValue subject, LogicalLine arm) {
        if ("_".equals(pattern) || "else".equals(pattern)) {
            return true;
        }
        return evaluate(pattern, arm).equals(subject);
    }

    // ============ 循环 ============

    private Outcome executeWhile(List<LogicalLine> lines, int i, int end) {
        LogicalLine line = lines.get(i);
        Header header = header(line.getCode(), "while");
        int bodyEnd = blockEnd(lines, i, end);
        while (evaluate(header.text, line).isTruthy()) {
            Signal signal = runBody(lines, i, bodyEnd, header.inline);
            if (signal.getKind() == Signal.Kind.BREAK) {
                break;
            }
            if (signal.isReturn()) {
                return new Outcome(signal, bodyEnd);
            }
            interpreter.countStep();
        }
        return Outcome.next(bodyEnd);
    }

    private Outcome executeLoop(List<LogicalLine> lines, int i, int end) {
        Header header = header(lines.get(i).getCode(), "loop");
        int bodyEnd = blockEnd(lines, i, end);
        while (true) {
            Signal signal = runBody(lines, i, bodyEnd, header.inline);
            if (signal.getKind() == Signal.Kind.BREAK) {
                return Outcome.next(bodyEnd);
            }
            if (signal.isReturn()) {
                return new Outcome(signal, bodyEnd);
            }
            interpreter.countStep();
        }
    }

    /**
     * for x in expr / for a, b in expr。列表按下标实时遍历，循环中追加的元素也会被访问。
     */
    private Outcome executeFor(List<LogicalLine> lines, int i, int end) {
        LogicalLine line = lines.get(i);
        Header header = header(line.getCode(), "for");
        int in = TextScanner.topLevelWord(header.text, "in");
        if (in < 0) {
            throw new GulRuntimeException("Invalid for statement: " + line.getCode());
        }
        List<String> names = targetNames(header.text.substring(0, in));
        GulValue iterable = evaluate(header.text.substring(in + 2).trim(), line);
        int bodyEnd = blockEnd(lines, i, end);

        List<GulValue> snapshot = iterable instanceof GulList ? null : GulIterables.elements(iterable);
        for (int k = 0; ; k++) {
            GulValue item;
            if (snapshot == null) {
                GulList list = (GulList) iterable;
                if (k >= list.size()) {
                    break;
                }
                item = list.get(k);
            } else {
                if (k >= snapshot.size()) {
                    break;
                }
                item = snapshot.get(k);
            }
            bind(names, item);
            Signal signal = runBody(lines, i, bodyEnd, header.inline);
            if (signal.getKind() == Signal.Kind.BREAK) {
                break;
            }
            if (signal.isReturn()) {
                return new Outcome(signal, bodyEnd);
            }
            interpreter.countStep();
        }
        return Outcome.next(bodyEnd);
    }

    // ============ try / catch ============

    /**
     * 任何非致命的运行时错误都进入 catch 块（不区分错误类型）；没有 catch 时错误被吞掉。
     * {@code catch e:} 与 {@code catch Error as e:} 把错误消息绑定到 e。
     */
    private Outcome executeTry(List<LogicalLine> lines, int i, int end) {
        LogicalLine line = lines.get(i);
        Header header = header(line.getCode(), "try");
        int tryEnd = blockEnd(lines, i, end);
        int next = tryEnd;
        int catchIndex = -1;
        if (tryEnd < end && lines.get(tryEnd).getIndent() == line.getIndent()) {
            String word = BlockKind.firstWord(lines.get(tryEnd).getCode());
            if ("catch".equals(word) || "except".equals(word)) {
                catchIndex = tryEnd;
                next = blockEnd(lines, catchIndex, end);
            }
        }
        try {
            return new Outcome(runBody(lines, i, tryEnd, header.inline), next);
        } catch (GulRuntimeException e) {
            if (e.isFatal()) {
                throw e;
            }
            LOG.fine("Caught error: " + e.getRawMessage());
            if (catchIndex < 0) {
                return Outcome.next(next);
            }
            LogicalLine catchLine = lines.get(catchIndex);
            Header catchHeader = header(catchLine.getCode(), BlockKind.firstWord(catchLine.getCode()));
            String variable = catchVariable(catchHeader.text);
            if (variable != null) {
                interpreter.getEnvironment().define(variable, GulString.of(e.getRawMessage()));
            }
            return new Outcome(runBody(lines, catchIndex, next, catchHeader.inline), next);
        }
    }

    private static String catchVariable(String text) {
        if (text.isEmpty()) {
            return null;
        }
        int as = TextScanner.topLevelWord(text, "as");
        String name = as >= 0 ? text.substring(as + 2).trim() : text;
        return IDENT.matcher(name).matches() ? name : null;
    }

    // ============ 简单语句 ============

    /**
     * let / var / const 之后的部分：name[: type] [= expr]，或 (a, b) / a, b 解构
     */
    private void declare(String rest, LogicalLine line) {
        if (rest.startsWith("mut ")) {
            rest = rest.substring(4).trim();
        }
        int eq = TextScanner.topLevelAssign(rest);
        String target = eq < 0 ? rest : rest.substring(0, eq).trim();
        GulValue value = eq < 0 ? GulNone.NONE : evaluateValue(rest.substring(eq + 1).trim(), line);
        int colon = TextScanner.topLevelColon(target);
        if (colon >= 0) {
            target = target.substring(0, colon).trim();
        }
        bind(targetNames(target), value);
    }

    private void executeSimple(String code, LogicalLine line) {
        int eq = TextScanner.topLevelAssign(code);
        if (eq > 0 && "+-*/".indexOf(code.charAt(eq - 1)) < 0) {
            String target = code.substring(0, eq).trim();
            if (TextScanner.splitTopLevel(target, ',').size() > 1) {
                bind(targetNames(target), evaluateValue(code.substring(eq + 1).trim(), line));
                return;
            }
        }
        interpreter.getEvaluator().executeStatement(code, line.getNumber());
    }

    // ============ 辅助 ============

    /**
     * 逗号分隔的多个表达式求值为元组
     */
    private GulValue evaluateValue(String text, LogicalLine line) {
        List<String> parts = TextScanner.splitTopLevel(text, ',');
        if (parts.size() <= 1) {
            return evaluate(text, line);
        }
        List<GulValue> values = new ArrayList<GulValue>(parts.size());
        for (String part : parts) {
            if (!part.trim().isEmpty()) {
                values.add(evaluate(part.trim(), line));
            }
        }
        return new GulTuple(values);
    }

    private GulValue evaluate(String text, LogicalLine line) {
        return interpreter.getEvaluator().evaluate(text, line.getNumber());
    }

    // "a"、"a, b"、"(a, b)" → 名字列表
    private static List<String> targetNames(String text) {
        String t = text.trim();
        if (t.startsWith("(") && t.endsWith(")") && TextScanner.matchingClose(t, 0) == t.length() - 1) {
            t = t.substring(1, t.length() - 1);
        }
        List<String> names = new ArrayList<String>();
        for (String part : TextScanner.splitTopLevel(t, ',')) {
            String name = part.trim();
            if (name.isEmpty()) {
                continue;
            }
            if (!IDENT.matcher(name).matches()) {
                throw new GulRuntimeException("cannot assign to '" + name + "'");
            }
            names.add(name);
        }
        if (names.isEmpty()) {
            throw new GulRuntimeException("missing assignment target");
        }
        return names;
    }

    private void bind(List<String> names, GulValue value) {
        Environment env = interpreter.getEnvironment();
        if (names.size() == 1) {
            env.define(names.get(0), value);
            return;
        }
        List<GulValue> items = GulIterables.elements(value);
        if (items.size() != names.size()) {
            throw new GulRuntimeException(items.size() < names.size()
                    ? "not enough values to unpack (expected " + names.size() + ", got " + items.size() + ")"
                    : "too many values to unpack (expected " + names.size() + ")");
        }
        for (int k = 0; k < names.size(); k++) {
            env.define(names.get(k), items.get(k));
        }
    }

    private Signal runBody(List<LogicalLine> lines, int headerIndex, int bodyEnd, String inline) {
        if (inline != null) {
            return executeInline(inline, lines.get(headerIndex));
        }
        return executeBlock(lines, headerIndex + 1, bodyEnd);
    }

    private Signal executeInline(String code, LogicalLine origin) {
        return executeBlock(Collections.singletonList(inlineLine(code, origin)), 0, 1);
    }

    private static LogicalLine inlineLine(String code, LogicalLine origin) {
        return new LogicalLine(origin.getNumber(), origin.getIndent() + 1, code, code, null);
    }

    private static Header header(String code, String keyword) {
        String rest = code.substring(keyword.length()).trim();
        int colon = TextScanner.topLevelColon(rest);
        if (colon < 0) {
            throw new GulRuntimeException("Expected ':' after '" + keyword + "'");
        }
        String inline = rest.substring(colon + 1).trim();
        return new Header(rest.substring(0, colon).trim(), inline.isEmpty() ? null : inline);
    }

    private static int blockEnd(List<LogicalLine> lines, int headerIndex, int end) {
        return Math.min(IndentationBlockTracker.blockEnd(lines, headerIndex), end);
    }

    // 单行 """...""" 或跨行直到出现结束的 """
    private static int skipDocstring(List<LogicalLine> lines, int i, int end) {
        String content = lines.get(i).getContent();
        if (content.indexOf(DOCSTRING, DOCSTRING.length()) >= 0) {
            return i + 1;
        }
        for (int k = i + 1; k < end; k++) {
            if (lines.get(k).getContent().contains(DOCSTRING)) {
                return k + 1;
            }
        }
        return end;
    }

    private String location(LogicalLine line) {
        return interpreter.getCurrentFile() + ":" + line.getNumber();
    }
}
