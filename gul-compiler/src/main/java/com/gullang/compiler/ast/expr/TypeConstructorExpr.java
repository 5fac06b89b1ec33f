package com.gullang.compiler.ast.expr;

import com.gullang.compiler.ast.AstVisitor;
import com.gullang.compiler.ast.SourceLocation;

/**
 * 类型构造调用 @int(x)、@str(x)、@list(x)
 */
public class TypeConstructorExpr extends Expression {
    private final String typeName;
    private final Expression argument;  // 可为 null：@int()

    public TypeConstructorExpr(SourceLocation location, String typeName, Expression argument) {
        super(location);
        this.typeName = typeName;
        this.argument = argument;
    }

    public String getTypeName() {
        return typeName;
    }

    public Expression getArgument() {
        return argument;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeConstructorExpr(this, context);
    }
}
