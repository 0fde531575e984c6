package com.stratdsl.ast;

/**
 * Bracket flavour of a {@link ListNode}.
 *
 * <ul>
 *   <li>{@code PLAIN} - {@code ( ... )}, a call when the head is a symbol</li>
 *   <li>{@code VECTOR} - {@code [ ... ]}, always data</li>
 *   <li>{@code MAP_LITERAL} - <code>{ ... }</code>, alternating keys and values</li>
 * </ul>
 */
public enum ListKind {
    PLAIN("(", ")", NodeKind.LIST),
    VECTOR("[", "]", NodeKind.VECTOR),
    MAP_LITERAL("{", "}", NodeKind.MAP_LITERAL);

    private final String open;
    private final String close;
    private final NodeKind nodeKind;

    ListKind(String open, String close, NodeKind nodeKind) {
        this.open = open;
        this.close = close;
        this.nodeKind = nodeKind;
    }

    public String getOpen() {
        return open;
    }

    public String getClose() {
        return close;
    }

    public NodeKind getNodeKind() {
        return nodeKind;
    }
}
