package com.gullang.compiler.ast.expr;

import com.gullang.compiler.ast.AstVisitor;
import com.gullang.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),

        // 比较
        EQ("=="),
        NE("!="),
        LT("<"),
        GT(">"),
        LE("<="),
        GE(">="),

        // 包含
        IN("in"),
        NOT_IN("not in"),

        // 逻辑
        AND("and"),
        OR("or");

        private final String source;

        BinaryOp(String source) {
            this.source = source;
        }

        /** 返回 GUL 源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public boolean isComparison() {
            return ordinal() >= EQ.ordinal() && ordinal() <= NOT_IN.ordinal();
        }
    }
}
