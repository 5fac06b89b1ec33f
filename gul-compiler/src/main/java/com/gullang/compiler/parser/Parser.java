package com.gullang.compiler.parser;

import com.gullang.compiler.ast.SourceLocation;
import com.gullang.compiler.ast.expr.AssignExpr;
import com.gullang.compiler.ast.expr.Expression;
import com.gullang.compiler.ast.expr.Identifier;
import com.gullang.compiler.ast.expr.IndexExpr;
import com.gullang.compiler.ast.expr.MemberExpr;
import com.gullang.compiler.lexer.Lexer;
import com.gullang.compiler.lexer.Token;
import com.gullang.compiler.lexer.TokenType;

import java.util.List;

import static com.gullang.compiler.lexer.TokenType.*;

/**
 * GUL 表达式解析器
 *
 * <p>一次解析一条逻辑行里的表达式文本，语句与块结构由解释器按缩进处理。
 * 优先级由低到高：or / and / 比较与 in / 加减 / 乘除模 / 一元 / 后缀，
 * 所有二元层级左结合。</p>
 */
public class Parser {

    final String fileName;
    final String source;
    private final List<Token> tokens;
    private int pos;
    private int markedPos = -1;

    // === Helper 实例 ===
    final LiteralHelper literalHelper = new LiteralHelper(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer) {
        this.fileName = lexer.getFileName();
        this.source = lexer.getSource();
        this.tokens = lexer.scanTokens();
        this.pos = 0;
    }

    /** 便捷入口：解析完整表达式 */
    public static Expression parseExpression(String text, String fileName, int line) {
        return new Parser(new Lexer(text, fileName, line)).parseExpression();
    }

    /**
     * 解析一个完整表达式，要求消费全部输入
     */
    public Expression parseExpression() {
        Expression expr = exprParser.parseExpression();
        expectEnd();
        return expr;
    }

    /**
     * 解析表达式语句：普通表达式或赋值（=、+=、-=、*=、/=）
     */
    public Expression parseStatementExpression() {
        Expression target = exprParser.parseExpression();
        if (checkAny(ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, MUL_ASSIGN, DIV_ASSIGN)) {
            Token op = advance();
            if (!(target instanceof Identifier || target instanceof MemberExpr
                    || target instanceof IndexExpr)) {
                throw new ParseException("Invalid assignment target", op);
            }
            Expression value = exprParser.parseExpression();
            expectEnd();
            return new AssignExpr(locationOf(op), target, toAssignOp(op), value);
        }
        expectEnd();
        return target;
    }

    private static AssignExpr.AssignOp toAssignOp(Token op) {
        switch (op.getType()) {
            case PLUS_ASSIGN: return AssignExpr.AssignOp.ADD_ASSIGN;
            case MINUS_ASSIGN: return AssignExpr.AssignOp.SUB_ASSIGN;
            case MUL_ASSIGN: return AssignExpr.AssignOp.MUL_ASSIGN;
            case DIV_ASSIGN: return AssignExpr.AssignOp.DIV_ASSIGN;
            default: return AssignExpr.AssignOp.ASSIGN;
        }
    }

    private void expectEnd() {
        if (!check(EOF)) {
            throw new ParseException("Unexpected token", peek());
        }
    }

    // ============ 基础方法 ============

    Token peek() {
        Token t = tokens.get(pos);
        if (t.is(ERROR)) {
            throw new ParseException(String.valueOf(t.getLiteral()), t);
        }
        return t;
    }

    /** 向前查看第 n 个 token（0 = 当前） */
    Token peekAt(int n) {
        int i = Math.min(pos + n, tokens.size() - 1);
        return tokens.get(i);
    }

    Token previous() {
        return tokens.get(pos - 1);
    }

    Token advance() {
        Token t = peek();
        if (!t.is(EOF)) {
            pos++;
        }
        return t;
    }

    boolean check(TokenType type) {
        return peek().is(type);
    }

    boolean checkAny(TokenType... types) {
        return peek().isOneOf(types);
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    boolean matchAny(TokenType... types) {
        if (checkAny(types)) {
            advance();
            return true;
        }
        return false;
    }

    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, peek(), type.name());
    }

    void mark() {
        markedPos = pos;
    }

    void reset() {
        if (markedPos >= 0) {
            pos = markedPos;
            markedPos = -1;
        }
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn());
    }

    SourceLocation previousLocation() {
        return locationOf(previous());
    }

    /** 截取 [startOffset, 上一个 token 结束) 的原始文本 */
    String textFrom(int startOffset) {
        return source.substring(startOffset, previous().getEndOffset());
    }
}
