package com.gullang.compiler.transpiler;

import com.gullang.compiler.source.BlockFrame;
import com.gullang.compiler.source.BlockKind;
import com.gullang.compiler.source.IndentationBlockTracker;
import com.gullang.compiler.source.LogicalLine;
import com.gullang.compiler.source.SourceLines;
import com.gullang.compiler.source.TextScanner;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GUL → Rust 逐行改写状态机
 *
 * <p>每行先交给 {@link IndentationBlockTracker} 计算需要关闭的块，为每个弹出的帧输出一个关闭记号；
 * 然后按所在块的类型（struct 字段、enum 变体、match 分支、多行字面量或普通语句）改写该行，
 * 块头行压入新帧并记录关闭时需要的标点。</p>
 *
 * <p>对任意输入都会产出文本，格式不正确的输入只会得到尽力而为的输出。</p>
 */
public class SyntaxRewriteEngine {

    private static final Logger LOG = Logger.getLogger(SyntaxRewriteEngine.class.getName());

    private static final Set<String> OWNERSHIP_MODES = Collections.unmodifiableSet(
            new HashSet<String>(Arrays.asList("ref", "mut", "borrow", "move", "kept")));

    private static final Set<String> PREFIX_KEYWORDS = Collections.unmodifiableSet(
            new HashSet<String>(Arrays.asList("return", "in", "and", "or", "not", "else")));

    private static final Pattern ENUM_DECL = Pattern.compile("(?m)^\\s*enum\\s+([A-Za-z_]\\w*)");
    private static final Pattern STRUCT_DECL = Pattern.compile("(?m)^\\s*struct\\s+([A-Za-z_]\\w*)");

    private static final String DERIVE = "#[derive(Debug, Clone, PartialEq)]";
    private static final String DOCSTRING = "\"\"\"";

    private final TranspilerConfig config;
    private final TypeAndCollectionMapper mapper = new TypeAndCollectionMapper();
    private final Set<String> knownEnums = new LinkedHashSet<String>();
    private final Set<String> knownStructs = new LinkedHashSet<String>();

    public SyntaxRewriteEngine(TranspilerConfig config) {
        this.config = config;
    }

    public SyntaxRewriteEngine() {
        this(TranspilerConfig.defaults());
    }

    /**
     * 登记其他文件中声明的类型，用于 Type.Member → Type::Member
     */
    public void registerTypes(Set<String> enums, Set<String> structs) {
        knownEnums.addAll(enums);
        knownStructs.addAll(structs);
    }

    /** 收集源码中声明的 enum 名 */
    public static Set<String> declaredEnums(String source) {
        return collect(ENUM_DECL, source);
    }

    /** 收集源码中声明的 struct 名 */
    public static Set<String> declaredStructs(String source) {
        return collect(STRUCT_DECL, source);
    }

    private static Set<String> collect(Pattern pattern, String source) {
        Set<String> names = new LinkedHashSet<String>();
        Matcher m = pattern.matcher(source);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }

    /**
     * 转译一个源文件的内容
     */
    public TranspileResult transpile(String source) {
        Set<String> enums = new LinkedHashSet<String>(knownEnums);
        enums.addAll(declaredEnums(source));
        Set<String> structs = new LinkedHashSet<String>(knownStructs);
        structs.addAll(declaredStructs(source));
        Pass pass = new Pass(new ExpressionRewriter(mapper, enums, structs));
        return pass.run(SourceLines.physical(source));
    }

    /**
     * 一次转译的状态：块栈、输出、文档字符串与续行缓冲
     */
    private final class Pass {
        private final ExpressionRewriter rewriter;
        private final IndentationBlockTracker tracker = new IndentationBlockTracker();
        private final List<String> out = new ArrayList<String>();
        private boolean inDocstring;

        // 括号跨行的语句先缓冲，括号闭合后拼成一行处理
        private StringBuilder buffer;
        private LogicalLine bufferStart;
        private String bufferComment;

        Pass(ExpressionRewriter rewriter) {
            this.rewriter = rewriter;
        }

        TranspileResult run(List<LogicalLine> lines) {
            for (LogicalLine line : lines) {
                try {
                    line(line);
                } catch (RuntimeException e) {
                    // 单行改写失败时原样输出为注释，继续后续行
                    LOG.log(Level.FINE, "Line " + line.getNumber() + " left untranslated", e);
                    out.add(indent(line.getIndent()) + "// " + line.getContent());
                }
            }
            if (buffer != null) {
                flushBuffer();
            }
            for (BlockFrame frame : tracker.drain()) {
                emitCloser(frame);
            }
            return new TranspileResult(String.join("\n", out) + "\n",
                    tracker.getOpenedCount(), tracker.getClosedCount());
        }

        private void line(LogicalLine line) {
            if (inDocstring) {
                docstringLine(line);
                return;
            }
            if (line.isBlank()) {
                out.add(line.hasComment() ? indent(line.getIndent()) + "// " + line.getComment() : "");
                return;
            }
            if (buffer != null) {
                tracker.advance(line);
                buffer.append(' ').append(line.getCode());
                if (line.hasComment()) {
                    bufferComment = bufferComment == null ? line.getComment() : bufferComment + " " + line.getComment();
                }
                if (!tracker.isContinuation()) {
                    flushBuffer();
                }
                return;
            }

            List<BlockFrame> popped = tracker.advance(line);
            if (closeFrames(popped, line)) {
                return;
            }
            if (tracker.isContinuation()) {
                buffer = new StringBuilder(line.getCode());
                bufferStart = line;
                bufferComment = line.getComment();
                return;
            }
            statement(line);
        }

        private void flushBuffer() {
            String code = buffer.toString();
            LogicalLine joined = new LogicalLine(bufferStart.getNumber(), bufferStart.getIndent(),
                    code, code, bufferComment);
            buffer = null;
            bufferStart = null;
            bufferComment = null;
            statement(joined);
        }

        // ============ 块关闭 ============

        /**
         * 为弹出的帧输出关闭记号。当前行以 '}' 开头且恰好对应一个源码中显式写出的 '{' 时，
         * 该行本身就是关闭记号，不再重复输出。
         *
         * @return 当前行已被消费
         */
        private boolean closeFrames(List<BlockFrame> popped, LogicalLine line) {
            boolean explicitLine = line.getCode().startsWith("}");
            for (int i = 0; i < popped.size(); i++) {
                BlockFrame frame = popped.get(i);
                boolean last = i == popped.size() - 1;
                if (explicitLine && last && frame.isExplicitBrace() && frame.getIndent() == line.getIndent()) {
                    explicitClose(frame, line);
                    return true;
                }
                emitCloser(frame);
            }
            if (explicitLine) {
                out.add(finish(indent(line.getIndent()) + line.getCode(), line.getComment()));
                return true;
            }
            return false;
        }

        private void emitCloser(BlockFrame frame) {
            out.add(indent(frame.getIndent()) + frame.closingText());
        }

        private void explicitClose(BlockFrame frame, LogicalLine line) {
            String rest = line.getCode().substring(1).trim();
            String text;
            if (rest.isEmpty()) {
                text = frame.closingText();
            } else {
                text = frame.getCloser() + rest;
                if (!endsWithPunctuation(text)) {
                    text += punctuationFor(tracker.peek());
                }
            }
            out.add(finish(indent(line.getIndent()) + text, line.getComment()));
        }

        // ============ 语句分派 ============

        private void statement(LogicalLine line) {
            String code = line.getCode();
            int indent = line.getIndent();
            BlockFrame parent = tracker.peek();

            if (code.startsWith(DOCSTRING)) {
                docstringStart(line);
                return;
            }
            if (code.startsWith("@imp ") || code.startsWith("@import ")) {
                for (String use : importLines(code)) {
                    out.add(finish(indent(indent) + use, line.getComment()));
                }
                return;
            }

            BlockKind kind = BlockKind.classify(code);
            if (parent != null) {
                switch (parent.getKind()) {
                    case STRUCT:
                        if (kind != BlockKind.FN) {
                            structField(line);
                            return;
                        }
                        break;
                    case ENUM:
                        enumVariant(line);
                        return;
                    case MATCH:
                        if (matchArm(line)) {
                            return;
                        }
                        break;
                    case LITERAL:
                        if (!code.endsWith("{")) {
                            literalField(line, parent);
                            return;
                        }
                        break;
                    default:
                        break;
                }
            }

            if (code.endsWith(":") && isHeaderKind(kind, code)) {
                blockHeader(line, kind, code.substring(0, code.length() - 1).trim());
                return;
            }
            if (isHeaderKind(kind, code) && inlineBlock(line, kind)) {
                return;
            }
            if (code.endsWith("{")) {
                literalOpener(line);
                return;
            }
            out.add(finish(indent(indent) + punctuate(simpleStatement(code, parent), parent), line.getComment()));
        }

        private boolean isHeaderKind(BlockKind kind, String code) {
            switch (kind) {
                case STRUCT:
                case ENUM:
                case IMPL:
                case FN:
                case MAIN:
                case IF:
                case ELSE:
                case WHILE:
                case FOR:
                case TRY:
                case CATCH:
                case MATCH:
                    return true;
                default:
                    return "loop".equals(BlockKind.firstWord(code));
            }
        }

        // ============ 块头 ============

        private void blockHeader(LogicalLine line, BlockKind kind, String header) {
            int indent = line.getIndent();
            String name = null;
            String text;
            switch (kind) {
                case STRUCT:
                    name = typeNameAfter(header, "struct");
                    out.add(indent(indent) + DERIVE);
                    text = "pub struct " + name + " {";
                    break;
                case ENUM:
                    name = typeNameAfter(header, "enum");
                    out.add(indent(indent) + DERIVE);
                    text = "pub enum " + name + " {";
                    break;
                case IMPL:
                    name = implTarget(header);
                    text = header + " {";
                    break;
                case FN:
                    switchStructToImpl();
                    text = fnSignature(header, tracker.peek()) + " {";
                    break;
                default:
                    text = controlHeader(kind, header) + " {";
                    break;
            }
            out.add(finish(indent(indent) + text, line.getComment()));
            tracker.push(new BlockFrame(indent, kind, name, "}"));
        }

        /** if cond: body → if cond { body; } */
        private boolean inlineBlock(LogicalLine line, BlockKind kind) {
            String code = line.getCode();
            int colon = TextScanner.topLevelColon(code);
            if (colon < 0 || colon == code.length() - 1) {
                return false;
            }
            String header = code.substring(0, colon).trim();
            String body = code.substring(colon + 1).trim();
            String text;
            if (kind == BlockKind.FN) {
                switchStructToImpl();
                text = fnSignature(header, tracker.peek());
            } else if (kind == BlockKind.STRUCT || kind == BlockKind.ENUM || kind == BlockKind.IMPL
                    || kind == BlockKind.MATCH) {
                return false;
            } else {
                text = controlHeader(kind, header);
            }
            String stmt = punctuate(simpleStatement(body, null), null);
            out.add(finish(indent(line.getIndent()) + text + " { " + stmt + " }", line.getComment()));
            return true;
        }

        /** struct 体内出现方法时，关闭 struct 并以同一缩进打开 impl */
        private void switchStructToImpl() {
            BlockFrame parent = tracker.peek();
            if (parent == null || parent.getKind() != BlockKind.STRUCT) {
                return;
            }
            tracker.pop();
            emitCloser(parent);
            out.add(indent(parent.getIndent()) + "impl " + parent.getName() + " {");
            tracker.push(new BlockFrame(parent.getIndent(), BlockKind.IMPL, parent.getName(), "}"));
        }

        private String controlHeader(BlockKind kind, String header) {
            String word = BlockKind.firstWord(header);
            String rest = header.substring(word.length()).trim();
            switch (kind) {
                case MAIN:
                    return "fn main()";
                case IF:
                    return "if " + rewriter.rewriteCondition(rest);
                case ELSE:
                    return "elif".equals(word) ? "else if " + rewriter.rewriteCondition(rest) : "else";
                case WHILE:
                    return "while " + rewriter.rewriteCondition(rest);
                case FOR:
                    return forHeader(rest);
                case TRY:
                    return "if true";
                case CATCH:
                    return "else if false";
                case MATCH:
                    return "match " + rewriter.rewriteCondition(rest);
                default:
                    return "loop";
            }
        }

        // for x in range(a, b) → for x in a..b
        private String forHeader(String rest) {
            int in = TextScanner.topLevelWord(rest, "in");
            if (in < 0) {
                return "for " + rewriter.rewrite(rest);
            }
            String var = rest.substring(0, in).trim();
            String iter = rest.substring(in + 2).trim();
            if (var.contains(",") && !var.startsWith("(")) {
                var = "(" + var + ")";
            }
            String target;
            if (iter.startsWith("range(") && TextScanner.matchingClose(iter, 5) == iter.length() - 1) {
                List<String> args = TextScanner.splitTopLevel(iter.substring(6, iter.length() - 1), ',');
                List<String> mapped = new ArrayList<String>(args.size());
                for (String arg : args) {
                    mapped.add(rewriter.rewrite(arg));
                }
                if (mapped.size() == 1) {
                    target = "0.." + mapped.get(0);
                } else if (mapped.size() == 2) {
                    target = mapped.get(0) + ".." + mapped.get(1);
                } else if (mapped.size() >= 3) {
                    target = "(" + mapped.get(0) + ".." + mapped.get(1) + ").step_by((" + mapped.get(2) + ") as usize)";
                } else {
                    target = "0..0";
                }
            } else {
                target = rewriter.rewrite(iter);
            }
            return "for " + var + " in " + target;
        }

        private String fnSignature(String header, BlockFrame parent) {
            String h = header;
            String prefix = "";
            if (h.startsWith("async ")) {
                prefix = "async ";
                h = h.substring(6).trim();
            }
            h = h.substring(2).trim(); // "fn"
            int open = h.indexOf('(');
            if (open < 0) {
                LOG.warning("Malformed fn header: " + header);
                return visibility(parent) + prefix + "fn " + h + "()";
            }
            String name = h.substring(0, open).trim();
            int close = TextScanner.matchingClose(h, open);
            String params = close > open ? h.substring(open + 1, close) : h.substring(open + 1);
            String rest = close > open ? h.substring(close + 1).trim() : "";

            List<String> mapped = new ArrayList<String>();
            for (String param : TextScanner.splitTopLevel(params, ',')) {
                mapped.add(parameter(param));
            }
            String ret = "";
            if (rest.startsWith("->")) {
                ret = " -> " + mapper.mapAnnotation(rest.substring(2).trim());
            }
            return visibility(parent) + prefix + "fn " + name + "(" + String.join(", ", mapped) + ")" + ret;
        }

        private String visibility(BlockFrame parent) {
            if (parent == null || parent.getKind() == BlockKind.IMPL) {
                return "pub ";
            }
            return "";
        }

        /** 去掉所有权修饰与默认值，映射参数类型 */
        private String parameter(String param) {
            String p = param.trim();
            int eq = TextScanner.topLevelAssign(p);
            if (eq >= 0) {
                p = p.substring(0, eq).trim();
            }
            String mode = null;
            while (true) {
                String word = BlockKind.firstWord(p);
                if (OWNERSHIP_MODES.contains(word) && p.length() > word.length()
                        && Character.isWhitespace(p.charAt(word.length()))) {
                    mode = mode == null ? word : mode;
                    p = p.substring(word.length()).trim();
                } else {
                    break;
                }
            }
            if ("self".equals(p)) {
                if ("ref".equals(mode) || "mut".equals(mode)) {
                    return "&mut self";
                }
                if ("move".equals(mode) || "kept".equals(mode)) {
                    return "self";
                }
                return "&self";
            }
            int colon = TextScanner.topLevelColon(p);
            if (colon < 0) {
                return p + ": " + TypeAndCollectionMapper.DEFAULT_ELEMENT;
            }
            return p.substring(0, colon).trim() + ": " + mapper.mapAnnotation(p.substring(colon + 1));
        }

        // ============ 块体内的行 ============

        private void structField(LogicalLine line) {
            String code = stripTrailingComma(line.getCode());
            String text;
            if ("pass".equals(code)) {
                text = "// pass";
            } else {
                int eq = TextScanner.topLevelAssign(code);
                String decl = eq >= 0 ? code.substring(0, eq).trim() : code;
                int colon = TextScanner.topLevelColon(decl);
                if (colon < 0) {
                    text = "pub " + decl + ": " + TypeAndCollectionMapper.DEFAULT_ELEMENT + ",";
                } else {
                    text = "pub " + decl.substring(0, colon).trim() + ": "
                            + mapper.mapAnnotation(decl.substring(colon + 1)) + ",";
                }
            }
            out.add(finish(indent(line.getIndent()) + text, line.getComment()));
        }

        private void enumVariant(LogicalLine line) {
            String code = stripTrailingComma(line.getCode());
            String text;
            if ("pass".equals(code)) {
                text = "// pass";
            } else {
                int open = code.indexOf('(');
                int close = open >= 0 ? TextScanner.matchingClose(code, open) : -1;
                if (open > 0 && close > open) {
                    List<String> types = new ArrayList<String>();
                    for (String t : TextScanner.splitTopLevel(code.substring(open + 1, close), ',')) {
                        types.add(mapper.mapAnnotation(t));
                    }
                    text = code.substring(0, open).trim() + "(" + String.join(", ", types) + "),";
                } else {
                    text = code + ",";
                }
            }
            out.add(finish(indent(line.getIndent()) + text, line.getComment()));
        }

        /**
         * pattern => expr 为内联分支；pattern => 或 pattern: 为块分支
         *
         * @return false 表示不是分支行
         */
        private boolean matchArm(LogicalLine line) {
            String code = line.getCode();
            int arrow = TextScanner.topLevelArrow(code);
            String pattern;
            String body;
            if (arrow >= 0) {
                pattern = code.substring(0, arrow).trim();
                body = code.substring(arrow + 2).trim();
                if (body.equals(":")) {
                    body = "";
                }
            } else if (code.endsWith(":")) {
                pattern = code.substring(0, code.length() - 1).trim();
                body = "";
            } else {
                return false;
            }
            String pat = "_".equals(pattern) || "else".equals(pattern) ? "_" : rewriter.rewrite(pattern);
            if (body.isEmpty()) {
                out.add(finish(indent(line.getIndent()) + pat + " => {", line.getComment()));
                tracker.push(new BlockFrame(line.getIndent(), BlockKind.MATCH_ARM, null, "},"));
                return true;
            }
            String arm = armBody(body);
            out.add(finish(indent(line.getIndent()) + pat + " => " + arm + ",", line.getComment()));
            return true;
        }

        private String armBody(String body) {
            String word = BlockKind.firstWord(body);
            if ("return".equals(word) || "let".equals(word) || "var".equals(word)
                    || TextScanner.topLevelAssign(body) >= 0) {
                return "{ " + punctuate(simpleStatement(body, null), null) + " }";
            }
            if ("pass".equals(body)) {
                return "()";
            }
            return simpleStatement(body, null);
        }

        private void literalField(LogicalLine line, BlockFrame literal) {
            String code = stripTrailingComma(line.getCode());
            String text;
            if ("dict".equals(literal.getName())) {
                int colon = TextScanner.topLevelColon(code);
                text = colon < 0
                        ? rewriter.rewrite(code)
                        : rewriter.rewrite(code.substring(0, colon)) + " => " + rewriter.rewriteValue(code.substring(colon + 1));
            } else if ("set".equals(literal.getName())) {
                text = rewriter.rewriteValue(code);
            } else {
                int colon = TextScanner.topLevelColon(code);
                text = colon < 0
                        ? rewriter.rewrite(code)
                        : code.substring(0, colon).trim() + ": " + rewriter.rewriteValue(code.substring(colon + 1));
            }
            out.add(finish(indent(line.getIndent()) + text + ",", line.getComment()));
        }

        /**
         * 以 '{' 结尾的表达式行：多行结构体构造或字典/集合字面量。
         * 行内未闭合的括号记为帧的合成后缀，关闭时补齐。
         */
        private void literalOpener(LogicalLine line) {
            BlockFrame parent = tracker.peek();
            String code = line.getCode();
            String prefix = code.substring(0, code.length() - 1).trim();
            String name;
            String before;
            String open;
            String closer = "}";
            if (prefix.endsWith("@dict")) {
                name = "dict";
                before = prefix.substring(0, prefix.length() - 5);
                open = "dict!{";
            } else if (prefix.endsWith("@set")) {
                name = "set";
                before = prefix.substring(0, prefix.length() - 4);
                open = "vec![";
                closer = "].into_iter().collect::<HashSet<_>>()";
            } else if (isStructPrefix(prefix)) {
                int start = prefix.length();
                while (start > 0 && TextScanner.isIdentChar(prefix.charAt(start - 1))) {
                    start--;
                }
                name = prefix.substring(start);
                before = prefix.substring(0, start);
                open = name + " {";
            } else {
                name = "dict";
                before = prefix;
                open = "dict!{";
            }
            String head = prefixStatement(before.trim(), parent);
            if (!head.isEmpty() && !head.endsWith("(") && !head.endsWith("[")) {
                head += " ";
            }
            out.add(finish(indent(line.getIndent()) + head + open, line.getComment()));

            BlockFrame frame = new BlockFrame(line.getIndent(), BlockKind.LITERAL, name, closer);
            frame.setExplicitBrace(true);
            frame.setPendingSuffix(TextScanner.unclosedClosers(head) + punctuationFor(parent));
            tracker.push(frame);
        }

        private boolean isStructPrefix(String prefix) {
            if (prefix.isEmpty() || !TextScanner.isIdentChar(prefix.charAt(prefix.length() - 1))) {
                return false;
            }
            int start = prefix.length();
            while (start > 0 && TextScanner.isIdentChar(prefix.charAt(start - 1))) {
                start--;
            }
            String word = prefix.substring(start);
            return !PREFIX_KEYWORDS.contains(word) && !Character.isDigit(word.charAt(0));
        }

        /** 字面量开头之前的部分：let 声明头、return、赋值左侧或未闭合的调用 */
        private String prefixStatement(String before, BlockFrame parent) {
            if (before.isEmpty()) {
                return "";
            }
            String word = BlockKind.firstWord(before);
            if (("let".equals(word) || "var".equals(word)) && before.endsWith("=")) {
                return declarationHead(before.substring(0, before.length() - 1).trim()) + " =";
            }
            if (parent != null && parent.getKind() == BlockKind.LITERAL && before.endsWith(":")) {
                String key = before.substring(0, before.length() - 1).trim();
                return "dict".equals(parent.getName()) ? rewriter.rewrite(key) + " =>" : key + ":";
            }
            return rewriter.rewrite(before);
        }

        // ============ 简单语句 ============

        private String simpleStatement(String code, BlockFrame parent) {
            String word = BlockKind.firstWord(code);
            if ("pass".equals(code)) {
                return parent != null && (parent.getKind() == BlockKind.IMPL) ? "// pass" : "()";
            }
            if ("break".equals(code) || "continue".equals(code)) {
                return code;
            }
            if ("return".equals(code)) {
                return "return";
            }
            if ("return".equals(word)) {
                return "return " + rewriter.rewriteValue(code.substring(6));
            }
            if ("let".equals(word) || "var".equals(word) || "const".equals(word)) {
                return declaration(code);
            }
            int eq = TextScanner.topLevelAssign(code);
            if (eq > 0) {
                char op = code.charAt(eq - 1);
                if ("+-*/%".indexOf(op) >= 0) {
                    return rewriter.rewrite(code.substring(0, eq - 1)) + " " + op + "= "
                            + rewriter.rewrite(code.substring(eq + 1));
                }
                return rewriter.rewrite(code.substring(0, eq)) + " = "
                        + rewriter.rewriteValue(code.substring(eq + 1));
            }
            return rewriter.rewrite(code);
        }

        // let [mut] x[: T] [= v] / var x ... → let mut x ...
        private String declaration(String code) {
            int eq = TextScanner.topLevelAssign(code);
            String head = eq >= 0 ? code.substring(0, eq).trim() : code;
            String text = declarationHead(head);
            if (eq >= 0) {
                text += " = " + rewriter.rewriteValue(code.substring(eq + 1));
            }
            return text;
        }

        private String declarationHead(String head) {
            String word = BlockKind.firstWord(head);
            String rest = head.substring(word.length()).trim();
            boolean mutable = "var".equals(word);
            if (rest.startsWith("mut ")) {
                mutable = true;
                rest = rest.substring(4).trim();
            }
            String keyword = "const".equals(word) ? "const " : (mutable ? "let mut " : "let ");
            int colon = TextScanner.topLevelColon(rest);
            if (colon < 0) {
                return keyword + rest;
            }
            return keyword + rest.substring(0, colon).trim() + ": " + mapper.mapAnnotation(rest.substring(colon + 1));
        }

        // ============ 文档字符串与 import ============

        private void docstringStart(LogicalLine line) {
            String body = line.getContent().substring(3);
            int end = body.indexOf(DOCSTRING);
            if (end >= 0) {
                out.add(indent(line.getIndent()) + "// " + body.substring(0, end).trim());
                return;
            }
            inDocstring = true;
            if (!body.trim().isEmpty()) {
                out.add(indent(line.getIndent()) + "// " + body.trim());
            }
        }

        private void docstringLine(LogicalLine line) {
            String content = line.getContent();
            int end = content.indexOf(DOCSTRING);
            if (end >= 0) {
                inDocstring = false;
                content = content.substring(0, end);
            }
            if (!content.trim().isEmpty()) {
                out.add(indent(line.getIndent()) + "// " + content.trim());
            }
        }

        /** @imp a.b.c → use crate::a::b::c::*; 标准库路径直接 use */
        private List<String> importLines(String code) {
            String spec = code.substring(code.indexOf(' ') + 1).trim();
            List<String> uses = new ArrayList<String>();
            for (String path : TextScanner.splitTopLevel(spec, ',')) {
                String alias = null;
                int as = TextScanner.topLevelWord(path, "as");
                if (as > 0) {
                    alias = path.substring(as + 2).trim();
                    path = path.substring(0, as).trim();
                }
                List<String> segments = new ArrayList<String>(Arrays.asList(path.split("\\.")));
                if ("std".equals(segments.get(0))) {
                    uses.add("use " + String.join("::", segments) + (alias != null ? " as " + alias : "") + ";");
                    continue;
                }
                if (segments.size() > 1 && segments.get(0).equals(config.getImportRoot())) {
                    segments.remove(0);
                }
                String target = "crate::" + String.join("::", segments);
                uses.add(alias != null ? "use " + target + " as " + alias + ";" : "use " + target + "::*;");
            }
            return uses;
        }

        // ============ 标点与格式 ============

        private String punctuate(String text, BlockFrame parent) {
            if (text.isEmpty() || text.startsWith("//") || endsWithPunctuation(text) || text.endsWith("{")) {
                return text;
            }
            return text + punctuationFor(parent);
        }
    }

    /** 块体内行尾标点：struct / enum / match / 字面量中为 ','，其余为 ';' */
    static String punctuationFor(BlockFrame parent) {
        if (parent != null && parent.getKind().commaSeparated()) {
            return ",";
        }
        return ";";
    }

    private static boolean endsWithPunctuation(String text) {
        return text.endsWith(";") || text.endsWith(",");
    }

    private static String stripTrailingComma(String code) {
        String c = code.trim();
        return c.endsWith(",") ? c.substring(0, c.length() - 1).trim() : c;
    }

    private static String typeNameAfter(String header, String keyword) {
        String rest = header.substring(keyword.length()).trim();
        int end = TextScanner.identEnd(rest, 0);
        return rest.substring(0, end);
    }

    // impl Trait for Type → Type
    private static String implTarget(String header) {
        String rest = header.substring(4).trim();
        int forIdx = TextScanner.topLevelWord(rest, "for");
        if (forIdx >= 0) {
            rest = rest.substring(forIdx + 3).trim();
        }
        return rest.substring(0, TextScanner.identEnd(rest, 0));
    }

    private static String finish(String text, String comment) {
        if (comment == null || comment.isEmpty()) {
            return text;
        }
        return text + "  // " + comment;
    }

    private static String indent(int n) {
        StringBuilder sb = new StringBuilder(n);
        for (int i = 0; i < n; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
