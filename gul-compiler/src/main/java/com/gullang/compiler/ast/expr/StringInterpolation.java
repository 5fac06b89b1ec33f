package com.gullang.compiler.ast.expr;

import com.gullang.compiler.ast.AstVisitor;
import com.gullang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 字符串插值 f"Hello, {name}!"
 */
public class StringInterpolation extends Expression {
    private final List<Object> parts;  // String 或 Expression

    public StringInterpolation(SourceLocation location, List<Object> parts) {
        super(location);
        this.parts = parts;
    }

    public List<Object> getParts() {
        return parts;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStringInterpolation(this, context);
    }
}
