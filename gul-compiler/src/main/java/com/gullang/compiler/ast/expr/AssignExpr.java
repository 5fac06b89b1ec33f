package com.gullang.compiler.ast.expr;

import com.gullang.compiler.ast.AstVisitor;
import com.gullang.compiler.ast.SourceLocation;

/**
 * 赋值 target = value / target += value
 */
public class AssignExpr extends Expression {
    private final Expression target;
    private final AssignOp operator;
    private final Expression value;

    public AssignExpr(SourceLocation location, Expression target, AssignOp operator, Expression value) {
        super(location);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public AssignOp getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignExpr(this, context);
    }

    public enum AssignOp {
        ASSIGN(null),
        ADD_ASSIGN(BinaryExpr.BinaryOp.ADD),
        SUB_ASSIGN(BinaryExpr.BinaryOp.SUB),
        MUL_ASSIGN(BinaryExpr.BinaryOp.MUL),
        DIV_ASSIGN(BinaryExpr.BinaryOp.DIV);

        private final BinaryExpr.BinaryOp binaryOp;

        AssignOp(BinaryExpr.BinaryOp binaryOp) {
            this.binaryOp = binaryOp;
        }

        /** 复合赋值对应的二元运算符，普通赋值返回 null */
        public BinaryExpr.BinaryOp getBinaryOp() {
            return binaryOp;
        }
    }
}
