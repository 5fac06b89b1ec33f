package com.gullang.compiler.parser;

import com.gullang.compiler.ast.SourceLocation;
import com.gullang.compiler.ast.expr.Expression;
import com.gullang.compiler.ast.expr.Literal;
import com.gullang.compiler.ast.expr.StringInterpolation;
import com.gullang.compiler.lexer.Lexer;
import com.gullang.compiler.lexer.LiteralEscapes;
import com.gullang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * 字面量解析辅助类
 */
class LiteralHelper {

    final Parser parser;

    LiteralHelper(Parser parser) {
        this.parser = parser;
    }

    Literal literal(Token token, SourceLocation loc) {
        switch (token.getType()) {
            case INT_LITERAL:
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.INT);
            case FLOAT_LITERAL:
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.FLOAT);
            case STRING_LITERAL:
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.STRING);
            case KW_TRUE:
                return new Literal(loc, Boolean.TRUE, Literal.LiteralKind.BOOLEAN);
            case KW_FALSE:
                return new Literal(loc, Boolean.FALSE, Literal.LiteralKind.BOOLEAN);
            case KW_NONE:
                return new Literal(loc, null, Literal.LiteralKind.NONE);
            default:
                throw new ParseException("Expected literal", token);
        }
    }

    /**
     * f-string：{expr} 为插值，{{ 与 }} 为字面花括号
     */
    StringInterpolation interpolation(Token token, SourceLocation loc) {
        String raw = (String) token.getLiteral();
        List<Object> parts = new ArrayList<Object>();
        StringBuilder text = new StringBuilder();
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == '{' && i + 1 < raw.length() && raw.charAt(i + 1) == '{') {
                text.append('{');
                i += 2;
                continue;
            }
            if (c == '}' && i + 1 < raw.length() && raw.charAt(i + 1) == '}') {
                text.append('}');
                i += 2;
                continue;
            }
            if (c == '{') {
                int end = findInterpolationEnd(raw, i + 1);
                if (end < 0) {
                    throw new ParseException("Unclosed '{' in f-string", token);
                }
                if (text.length() > 0) {
                    parts.add(LiteralEscapes.unescape(text.toString()));
                    text.setLength(0);
                }
                String exprText = raw.substring(i + 1, end).trim();
                if (exprText.isEmpty()) {
                    throw new ParseException("Empty expression in f-string", token);
                }
                parts.add(parseEmbedded(exprText, token));
                i = end + 1;
                continue;
            }
            text.append(c);
            i++;
        }
        if (text.length() > 0) {
            parts.add(LiteralEscapes.unescape(text.toString()));
        }
        return new StringInterpolation(loc, parts);
    }

    private Expression parseEmbedded(String exprText, Token token) {
        return new Parser(new Lexer(exprText, parser.fileName, token.getLine())).parseExpression();
    }

    /** 找到与 start 之前的 '{' 配对的 '}'，跳过内部字符串 */
    private static int findInterpolationEnd(String raw, int start) {
        int depth = 0;
        char quote = 0;
        for (int i = start; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '{' || c == '[' || c == '(') {
                depth++;
            } else if (c == '}' || c == ']' || c == ')') {
                if (depth == 0) {
                    return c == '}' ? i : -1;
                }
                depth--;
            }
        }
        return -1;
    }
}
