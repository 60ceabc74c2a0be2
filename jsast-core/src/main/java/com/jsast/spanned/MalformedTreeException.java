package com.jsast.spanned;

/**
 * Thrown when a spanned tree handed to conversion is not a finished tree, for example when
 * a parser placeholder was left in it. This is a bug in whatever produced the tree.
 */
public class MalformedTreeException extends RuntimeException {

    private final transient Node node;

    public MalformedTreeException(String message, Node node) {
        super(message + " at " + node.loc());
        this.node = node;
    }

    /**
     * The offending node.
     */
    public Node getNode() {
        return node;
    }
}
