package com.jsast.json;

import com.jsast.ast.Node;

/**
 * Writes plain AST nodes as ESTree JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a plain AST node to a JSON string.
     *
     * @param node the node to serialize; usually a {@link com.jsast.ast.Program}
     * @return the ESTree JSON for the node
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Serializes a plain AST node to an indented JSON string.
     *
     * @param node the node to serialize
     * @return the pretty-printed ESTree JSON for the node
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;
}
