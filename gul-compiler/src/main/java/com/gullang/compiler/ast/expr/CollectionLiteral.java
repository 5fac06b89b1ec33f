package com.gullang.compiler.ast.expr;

import com.gullang.compiler.ast.AstVisitor;
import com.gullang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 集合字面量：[a, b]、@list[...]、{k: v}、@dict{...}、@set{...}
 */
public class CollectionLiteral extends Expression {
    private final CollectionKind kind;
    private final List<Expression> elements;
    private final List<MapEntry> mapEntries;

    public CollectionLiteral(SourceLocation location, CollectionKind kind,
                             List<Expression> elements, List<MapEntry> mapEntries) {
        super(location);
        this.kind = kind;
        this.elements = elements != null ? elements : Collections.<Expression>emptyList();
        this.mapEntries = mapEntries != null ? mapEntries : Collections.<MapEntry>emptyList();
    }

    public CollectionKind getKind() {
        return kind;
    }

    public List<Expression> getElements() {
        return elements;
    }

    public List<MapEntry> getMapEntries() {
        return mapEntries;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCollectionLiteral(this, context);
    }

    public enum CollectionKind {
        LIST,
        SET,
        MAP
    }

    /**
     * Map 条目
     */
    public static class MapEntry {
        private final Expression key;
        private final Expression value;

        public MapEntry(Expression key, Expression value) {
            this.key = key;
            this.value = value;
        }

        public Expression getKey() {
            return key;
        }

        public Expression getValue() {
            return value;
        }
    }
}
