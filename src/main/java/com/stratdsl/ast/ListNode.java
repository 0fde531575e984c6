package com.stratdsl.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered children enclosed in parentheses, brackets or braces.
 */
public final class ListNode extends AstNode {

    private final List<AstNode> children;
    private final ListKind listKind;

    public ListNode(List<AstNode> children, ListKind listKind, SourcePosition position) {
        super(position);
        this.children = List.copyOf(children);
        this.listKind = Objects.requireNonNull(listKind, "listKind");
    }

    public List<AstNode> getChildren() {
        return children;
    }

    public ListKind getListKind() {
        return listKind;
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    public int size() {
        return children.size();
    }

    /**
     * Returns the head symbol when this is a plain list whose first child is a symbol,
     * i.e. when the list reads as an operator call.
     */
    public Optional<SymbolNode> callHead() {
        if (listKind != ListKind.PLAIN || children.isEmpty()) {
            return Optional.empty();
        }
        AstNode head = children.get(0);
        return head instanceof SymbolNode symbol ? Optional.of(symbol) : Optional.empty();
    }

    /** Arguments of a call, i.e. every child after the head. */
    public List<AstNode> arguments() {
        return children.isEmpty() ? List.of() : children.subList(1, children.size());
    }

    /**
     * Copy of this list with {@code node} inserted right after the head. Used when a metric
     * expression is applied to each candidate symbol of a selection.
     */
    public ListNode withArgumentPrepended(AstNode node) {
        List<AstNode> copy = new ArrayList<>(children.size() + 1);
        copy.add(children.get(0));
        copy.add(node);
        copy.addAll(arguments());
        return new ListNode(copy, listKind, getPosition());
    }

    @Override
    public NodeKind getKind() {
        return listKind.getNodeKind();
    }

    @Override
    public String render() {
        return children.stream()
                .map(AstNode::render)
                .collect(Collectors.joining(" ", listKind.getOpen(), listKind.getClose()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ListNode other)) {
            return false;
        }
        return listKind == other.listKind
                && children.equals(other.children)
                && getPosition().equals(other.getPosition());
    }

    @Override
    public int hashCode() {
        return Objects.hash(children, listKind, getPosition());
    }
}
