package com.gullang.compiler.ast.expr;

import com.gullang.compiler.ast.AstVisitor;
import com.gullang.compiler.ast.SourceLocation;

/**
 * 成员访问 a.b
 */
public class MemberExpr extends Expression {
    private final Expression target;
    private final String member;
    private final String sourceText;  // 整条访问链的原始文本

    public MemberExpr(SourceLocation location, Expression target, String member, String sourceText) {
        super(location);
        this.target = target;
        this.member = member;
        this.sourceText = sourceText;
    }

    public Expression getTarget() {
        return target;
    }

    public String getMember() {
        return member;
    }

    public String getSourceText() {
        return sourceText;
    }

    /** 链的最左端是否为标识符（a.b.c 形式，中间无调用或索引） */
    public Identifier getRootIdentifier() {
        Expression e = target;
        while (e instanceof MemberExpr) {
            e = ((MemberExpr) e).getTarget();
        }
        return e instanceof Identifier ? (Identifier) e : null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMemberExpr(this, context);
    }
}
