package com.stratdsl.ast;

import java.util.Objects;

/**
 * Immutable node of a parsed strategy expression.
 *
 * <p>Three concrete shapes exist: {@link AtomNode} for literals, {@link SymbolNode} for bare
 * identifiers and {@link ListNode} for bracketed forms. Every node remembers where it started in
 * the source so evaluation errors and trace entries can point back at it.
 */
public abstract class AstNode {

    private final SourcePosition position;

    protected AstNode(SourcePosition position) {
        this.position = Objects.requireNonNull(position, "position");
    }

    public SourcePosition getPosition() {
        return position;
    }

    public abstract NodeKind getKind();

    /** Renders the node back into s-expression text. */
    public abstract String render();

    @Override
    public String toString() {
        return render();
    }
}
