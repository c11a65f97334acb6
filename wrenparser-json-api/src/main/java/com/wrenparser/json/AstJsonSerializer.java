package com.wrenparser.json;

import com.wrenparser.ast.Node;

/**
 * Writes syntax tree nodes as JSON.
 *
 * <p>Every node object carries a {@code "type"} member naming its kind, and
 * each token is written as an object with its kind, text, line and column.</p>
 */
public interface AstJsonSerializer {

    /**
     * Serializes a node and everything below it to a compact JSON string.
     *
     * @param node the node to serialize
     * @return the JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Serializes a node and everything below it to an indented JSON string.
     *
     * @param node the node to serialize
     * @return the pretty-printed JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;
}
