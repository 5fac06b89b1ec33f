package com.gullang.compiler.lexer;

/**
 * 字符串转义解码
 */
public final class LiteralEscapes {

    private LiteralEscapes() {
    }

    /**
     * 将转义字符 c（反斜杠之后的字符）解码追加到 sb。
     * 未知转义保留反斜杠原样输出。
     */
    public static void appendEscape(StringBuilder sb, char c) {
        switch (c) {
            case 'n': sb.append('\n'); break;
            case 't': sb.append('\t'); break;
            case 'r': sb.append('\r'); break;
            case '0': sb.append('\0'); break;
            case '\\': sb.append('\\'); break;
            case '"': sb.append('"'); break;
            case '\'': sb.append('\''); break;
            default: sb.append('\\').append(c); break;
        }
    }

    /** 解码整段文本中的转义序列 */
    public static String unescape(String raw) {
        if (raw.indexOf('\\') < 0) {
            return raw;
        }
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '\\' && i + 1 < raw.length()) {
                appendEscape(sb, raw.charAt(++i));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
