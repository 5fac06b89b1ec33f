package com.gullang.compiler.parser;

import com.gullang.compiler.ast.SourceLocation;
import com.gullang.compiler.ast.expr.*;
import com.gullang.compiler.lexer.Token;
import com.gullang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.gullang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseDisjunctionExpr();
    }

    // 逻辑或 || / or
    private Expression parseDisjunctionExpr() {
        Expression left = parseConjunctionExpr();

        while (parser.matchAny(OR, KW_OR)) {
            SourceLocation loc = parser.previousLocation();
            Expression right = parseConjunctionExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.OR, right);
        }

        return left;
    }

    // 逻辑与 && / and
    private Expression parseConjunctionExpr() {
        Expression left = parseComparisonExpr();

        while (parser.matchAny(AND, KW_AND)) {
            SourceLocation loc = parser.previousLocation();
            Expression right = parseComparisonExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.AND, right);
        }

        return left;
    }

    // 比较 == != < > <= >= in / not in（同一层级，左结合，不做链式比较）
    private Expression parseComparisonExpr() {
        Expression left = parseAdditiveExpr();

        while (true) {
            BinaryExpr.BinaryOp op;
            if (parser.check(KW_NOT) && parser.peekAt(1).is(KW_IN)) {
                parser.advance();
                op = BinaryExpr.BinaryOp.NOT_IN;
            } else if (parser.checkAny(EQ, NE, LT, GT, LE, GE, KW_IN)) {
                op = comparisonOp(parser.peek());
            } else {
                break;
            }
            Token opToken = parser.advance();
            Expression right = parseAdditiveExpr();
            left = new BinaryExpr(parser.locationOf(opToken), left, op, right);
        }

        return left;
    }

    private static BinaryExpr.BinaryOp comparisonOp(Token token) {
        switch (token.getType()) {
            case EQ: return BinaryExpr.BinaryOp.EQ;
            case NE: return BinaryExpr.BinaryOp.NE;
            case LT: return BinaryExpr.BinaryOp.LT;
            case GT: return BinaryExpr.BinaryOp.GT;
            case LE: return BinaryExpr.BinaryOp.LE;
            case GE: return BinaryExpr.BinaryOp.GE;
            case KW_IN: return BinaryExpr.BinaryOp.IN;
            default: throw new ParseException("Unexpected comparison operator", token);
        }
    }

    // 加减
    private Expression parseAdditiveExpr() {
        Expression left = parseMultiplicativeExpr();

        while (parser.checkAny(PLUS, MINUS)) {
            Token op = parser.advance();
            Expression right = parseMultiplicativeExpr();
            left = new BinaryExpr(parser.locationOf(op), left,
                    op.is(PLUS) ? BinaryExpr.BinaryOp.ADD : BinaryExpr.BinaryOp.SUB, right);
        }

        return left;
    }

    // 乘除模
    private Expression parseMultiplicativeExpr() {
        Expression left = parseUnaryExpr();

        while (parser.checkAny(MUL, DIV, MOD)) {
            Token op = parser.advance();
            BinaryExpr.BinaryOp binaryOp;
            switch (op.getType()) {
                case MUL: binaryOp = BinaryExpr.BinaryOp.MUL; break;
                case DIV: binaryOp = BinaryExpr.BinaryOp.DIV; break;
                default: binaryOp = BinaryExpr.BinaryOp.MOD; break;
            }
            Expression right = parseUnaryExpr();
            left = new BinaryExpr(parser.locationOf(op), left, binaryOp, right);
        }

        return left;
    }

    // 一元 not / ! / -，比所有二元运算符绑定更紧
    private Expression parseUnaryExpr() {
        if (parser.checkAny(KW_NOT, NOT)) {
            Token op = parser.advance();
            return new UnaryExpr(parser.locationOf(op), UnaryExpr.UnaryOp.NOT, parseUnaryExpr());
        }
        if (parser.check(MINUS)) {
            Token op = parser.advance();
            return new UnaryExpr(parser.locationOf(op), UnaryExpr.UnaryOp.NEG, parseUnaryExpr());
        }
        return parsePostfixExpr();
    }

    // 后缀：调用、索引、成员访问
    private Expression parsePostfixExpr() {
        int startOffset = parser.peek().getOffset();
        Expression expr = parsePrimaryExpr();

        while (true) {
            if (parser.match(LPAREN)) {
                SourceLocation loc = parser.previousLocation();
                List<Expression> args = new ArrayList<Expression>();
                Map<String, Expression> namedArgs = new LinkedHashMap<String, Expression>();
                parseArguments(args, namedArgs);
                expr = new CallExpr(loc, expr, args, namedArgs);
            } else if (parser.match(LBRACKET)) {
                SourceLocation loc = parser.previousLocation();
                Expression index = parseExpression();
                parser.expect(RBRACKET, "Expected ']' after index");
                expr = new IndexExpr(loc, expr, index);
            } else if (parser.match(DOT)) {
                SourceLocation loc = parser.previousLocation();
                Token name = parser.expect(IDENTIFIER, "Expected member name after '.'");
                expr = new MemberExpr(loc, expr, name.getLexeme(), parser.textFrom(startOffset));
            } else {
                break;
            }
        }

        return expr;
    }

    private void parseArguments(List<Expression> args, Map<String, Expression> namedArgs) {
        while (!parser.check(RPAREN)) {
            if (parser.check(IDENTIFIER) && parser.peekAt(1).is(ASSIGN)) {
                String name = parser.advance().getLexeme();
                parser.advance();
                namedArgs.put(name, parseExpression());
            } else {
                if (!namedArgs.isEmpty()) {
                    throw new ParseException("Positional argument after named argument", parser.peek());
                }
                args.add(parseExpression());
            }
            if (!parser.match(COMMA)) {
                break;
            }
        }
        parser.expect(RPAREN, "Expected ')' after arguments");
    }

    private Expression parsePrimaryExpr() {
        Token token = parser.peek();
        SourceLocation loc = parser.locationOf(token);

        switch (token.getType()) {
            case INT_LITERAL:
            case FLOAT_LITERAL:
            case STRING_LITERAL:
            case KW_TRUE:
            case KW_FALSE:
            case KW_NONE:
                parser.advance();
                return parser.literalHelper.literal(token, loc);

            case FSTRING:
                parser.advance();
                return parser.literalHelper.interpolation(token, loc);

            case IDENTIFIER:
                parser.advance();
                if (parser.check(LBRACE) && looksLikeStructBody()) {
                    return parseStructLiteral(token.getLexeme(), loc);
                }
                return new Identifier(loc, token.getLexeme());

            case LPAREN:
                parser.advance();
                return parseParenthesized(loc);

            case LBRACKET:
                parser.advance();
                return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.LIST,
                        parseElements(RBRACKET), null);

            case LBRACE:
                parser.advance();
                return parseBraceLiteral(loc, false);

            case TYPE_NAME:
                parser.advance();
                return parseTypeExpr((String) token.getLiteral(), loc);

            default:
                throw new ParseException("Expected expression", token);
        }
    }

    // (expr) 或 (a, b) 元组，元组按列表处理
    private Expression parseParenthesized(SourceLocation loc) {
        if (parser.match(RPAREN)) {
            return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.LIST, null, null);
        }
        Expression first = parseExpression();
        if (parser.match(RPAREN)) {
            return first;
        }
        parser.expect(COMMA, "Expected ')' after expression");
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        elements.addAll(parseElements(RPAREN));
        return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.LIST, elements, null);
    }

    /** 解析逗号分隔的元素直到 closer（允许尾随逗号），消费 closer */
    private List<Expression> parseElements(TokenType closer) {
        List<Expression> elements = new ArrayList<Expression>();
        while (!parser.check(closer)) {
            elements.add(parseExpression());
            if (!parser.match(COMMA)) {
                break;
            }
        }
        parser.expect(closer, "Expected '" + closerText(closer) + "'");
        return elements;
    }

    private static String closerText(TokenType closer) {
        switch (closer) {
            case RBRACKET: return "]";
            case RBRACE: return "}";
            default: return ")";
        }
    }

    /**
     * '{' 之后的字面量：{} 与 {k: v} 为字典，{a, b} 为集合。
     * forceMap 用于 @dict{...}。
     */
    private Expression parseBraceLiteral(SourceLocation loc, boolean forceMap) {
        if (parser.match(RBRACE)) {
            return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.MAP, null, null);
        }
        Expression first = parseExpression();
        if (!forceMap && !parser.check(COLON)) {
            List<Expression> elements = new ArrayList<Expression>();
            elements.add(first);
            if (parser.match(COMMA)) {
                elements.addAll(parseElements(RBRACE));
            } else {
                parser.expect(RBRACE, "Expected '}'");
            }
            return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.SET, elements, null);
        }

        List<CollectionLiteral.MapEntry> entries = new ArrayList<CollectionLiteral.MapEntry>();
        parser.expect(COLON, "Expected ':' in dict literal");
        entries.add(new CollectionLiteral.MapEntry(first, parseExpression()));
        while (parser.match(COMMA)) {
            if (parser.check(RBRACE)) {
                break;
            }
            Expression key = parseExpression();
            parser.expect(COLON, "Expected ':' in dict literal");
            entries.add(new CollectionLiteral.MapEntry(key, parseExpression()));
        }
        parser.expect(RBRACE, "Expected '}' after dict literal");
        return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.MAP, null, entries);
    }

    // @list[...] / @dict{...} / @set{...} / @type(expr)
    private Expression parseTypeExpr(String typeName, SourceLocation loc) {
        if ("list".equals(typeName) && parser.match(LBRACKET)) {
            return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.LIST,
                    parseElements(RBRACKET), null);
        }
        if ("dict".equals(typeName) && parser.match(LBRACE)) {
            return parseBraceLiteral(loc, true);
        }
        if ("set".equals(typeName) && parser.match(LBRACE)) {
            return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.SET,
                    parseElements(RBRACE), null);
        }
        if ("set".equals(typeName) && parser.match(LBRACKET)) {
            return new CollectionLiteral(loc, CollectionLiteral.CollectionKind.SET,
                    parseElements(RBRACKET), null);
        }
        if (parser.match(LPAREN)) {
            Expression argument = null;
            if (!parser.check(RPAREN)) {
                argument = parseExpression();
            }
            parser.expect(RPAREN, "Expected ')' after type constructor argument");
            return new TypeConstructorExpr(loc, typeName, argument);
        }
        throw new ParseException("Expected '(' after @" + typeName, parser.peek());
    }

    // Name{} 或 Name{ident: ...}
    private boolean looksLikeStructBody() {
        Token next = parser.peekAt(1);
        if (next.is(RBRACE)) {
            return true;
        }
        return next.is(IDENTIFIER) && parser.peekAt(2).is(COLON);
    }

    private Expression parseStructLiteral(String typeName, SourceLocation loc) {
        parser.expect(LBRACE, "Expected '{'");
        Map<String, Expression> fields = new LinkedHashMap<String, Expression>();
        while (!parser.check(RBRACE)) {
            Token name = parser.expect(IDENTIFIER, "Expected field name");
            parser.expect(COLON, "Expected ':' after field name");
            fields.put(name.getLexeme(), parseExpression());
            if (!parser.match(COMMA)) {
                break;
            }
        }
        parser.expect(RBRACE, "Expected '}' after struct fields");
        return new StructLiteral(loc, typeName, fields);
    }
}
