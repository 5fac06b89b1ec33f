package com.gullang.compiler.ast.expr;

import com.gullang.compiler.ast.AstVisitor;
import com.gullang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 调用表达式。callee 为 MemberExpr 时是方法调用。
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Expression> args;
    private final Map<String, Expression> namedArgs;

    public CallExpr(SourceLocation location, Expression callee, List<Expression> args,
                    Map<String, Expression> namedArgs) {
        super(location);
        this.callee = callee;
        this.args = args;
        this.namedArgs = namedArgs != null ? namedArgs : Collections.<String, Expression>emptyMap();
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public Map<String, Expression> getNamedArgs() {
        return namedArgs;
    }

    public boolean isMethodCall() {
        return callee instanceof MemberExpr;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
