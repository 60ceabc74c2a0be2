package com.jsast.ast;

/**
 * A node of the plain tree: the position-free counterpart of a spanned node, shaped after ESTree.
 */
public interface Node {

    /**
     * The ESTree {@code type} discriminator.
     */
    String type();
}
