package gul.runtime.interpreter;

import com.gullang.compiler.source.TextScanner;
import gul.runtime.types.FieldSpec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 声明行解析：fn 签名、参数列表、struct 字段、impl 目标
 *
 * <p>参数按顶层逗号切分（尊重括号嵌套与字符串），去掉所有权修饰后再绑定。</p>
 */
final class DeclarationParser {

    static final Set<String> OWNERSHIP_MODES = Collections.unmodifiableSet(
            new HashSet<String>(Arrays.asList("ref", "mut", "borrow", "move", "kept")));

    private static final Pattern FN_HEAD = Pattern.compile("^(?:async\\s+)?fn\\s+(?:@\\w+\\s+)?([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern IMPL_HEAD = Pattern.compile("^impl\\s+(?:([A-Za-z_]\\w*)\\s+for\\s+)?([A-Za-z_]\\w*)");
    private static final Pattern TYPE_HEAD = Pattern.compile("^(?:struct|enum)\\s+([A-Za-z_]\\w*)");
    private static final Pattern IDENT = Pattern.compile("[A-Za-z_]\\w*");

    private DeclarationParser() {
    }

    /**
     * fn 签名解析结果
     */
    static final class FnHeader {
        final String name;
        final List<Parameter> params;
        final String returnType;
        final String inlineBody;

        FnHeader(String name, List<Parameter> params, String returnType, String inlineBody) {
            this.name = name;
            this.params = params;
            this.returnType = returnType;
            this.inlineBody = inlineBody;
        }
    }

    /**
     * 解析 {@code fn name(params) -> R: [body]}
     *
     * @return 无法识别时返回 null
     */
    static FnHeader parseFnHeader(String code) {
        Matcher m = FN_HEAD.matcher(code);
        if (!m.find()) {
            return null;
        }
        int open = m.end() - 1;
        int close = TextScanner.matchingClose(code, open);
        if (close < 0) {
            return null;
        }
        String rest = code.substring(close + 1).trim();
        int colon = TextScanner.topLevelColon(rest);
        if (colon < 0) {
            return null;
        }
        String returnType = null;
        String beforeColon = rest.substring(0, colon).trim();
        if (beforeColon.startsWith("->")) {
            returnType = beforeColon.substring(2).trim();
        } else if (!beforeColon.isEmpty()) {
            return null;
        }
        String inline = rest.substring(colon + 1).trim();
        return new FnHeader(m.group(1), parseParams(code.substring(open + 1, close)), returnType,
                inline.isEmpty() ? null : inline);
    }

    static List<Parameter> parseParams(String text) {
        List<Parameter> params = new ArrayList<Parameter>();
        for (String part : TextScanner.splitTopLevel(text, ',')) {
            params.add(parseParam(part));
        }
        return params;
    }

    // [ownership] name[: type][ = default]
    static Parameter parseParam(String text) {
        String p = text.trim();
        String defaultSource = null;
        int eq = TextScanner.topLevelAssign(p);
        if (eq >= 0) {
            defaultSource = p.substring(eq + 1).trim();
            p = p.substring(0, eq).trim();
        }
        String typeName = null;
        int colon = TextScanner.topLevelColon(p);
        if (colon >= 0) {
            typeName = p.substring(colon + 1).trim();
            p = p.substring(0, colon).trim();
        }
        String ownership = null;
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (String mode : OWNERSHIP_MODES) {
                if (p.startsWith(mode + " ")) {
                    if (ownership == null) {
                        ownership = mode;
                    }
                    p = p.substring(mode.length() + 1).trim();
                    stripped = true;
                }
            }
        }
        return new Parameter(p, ownership, typeName, defaultSource);
    }

    /**
     * 解析 struct 体中的字段行 {@code name: type [= default]}、{@code name = default} 或 {@code name}
     *
     * @return pass 或不是字段的行返回 null
     */
    static FieldSpec parseField(String code) {
        String c = code.endsWith(",") ? code.substring(0, code.length() - 1).trim() : code;
        if (c.isEmpty() || "pass".equals(c) || c.startsWith("\"\"\"")) {
            return null;
        }
        String defaultSource = null;
        int eq = TextScanner.topLevelAssign(c);
        if (eq >= 0) {
            defaultSource = c.substring(eq + 1).trim();
            c = c.substring(0, eq).trim();
        }
        String typeName = null;
        int colon = TextScanner.topLevelColon(c);
        if (colon >= 0) {
            typeName = c.substring(colon + 1).trim();
            c = c.substring(0, colon).trim();
        }
        if (!IDENT.matcher(c).matches()) {
            return null;
        }
        return new FieldSpec(c, typeName, defaultSource);
    }

    /** struct / enum 头中的类型名，无法识别返回 null */
    static String typeName(String code) {
        Matcher m = TYPE_HEAD.matcher(code);
        return m.find() ? m.group(1) : null;
    }

    /** impl X: 或 impl Trait for X: 中的 X，无法识别返回 null */
    static String implTarget(String code) {
        Matcher m = IMPL_HEAD.matcher(code);
        return m.find() ? m.group(2) : null;
    }
}
