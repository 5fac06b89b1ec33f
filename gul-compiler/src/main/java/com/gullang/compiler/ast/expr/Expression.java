package com.gullang.compiler.ast.expr;

import com.gullang.compiler.ast.AstNode;
import com.gullang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
