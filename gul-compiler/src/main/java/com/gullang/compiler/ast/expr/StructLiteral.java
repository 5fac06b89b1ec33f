package com.gullang.compiler.ast.expr;

import com.gullang.compiler.ast.AstVisitor;
import com.gullang.compiler.ast.SourceLocation;

import java.util.Map;

/**
 * 结构体构造 Point{x: 1, y: 2}
 */
public class StructLiteral extends Expression {
    private final String typeName;
    private final Map<String, Expression> fields;  // 保持书写顺序

    public StructLiteral(SourceLocation location, String typeName, Map<String, Expression> fields) {
        super(location);
        this.typeName = typeName;
        this.fields = fields;
    }

    public String getTypeName() {
        return typeName;
    }

    public Map<String, Expression> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructLiteral(this, context);
    }
}
