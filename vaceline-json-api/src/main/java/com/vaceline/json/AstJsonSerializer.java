package com.vaceline.json;

import com.vaceline.ast.Node;

/**
 * Writes AST nodes as JSON. Every node object carries its type name in a {@code "type"} property;
 * nodes without a source location have no {@code "loc"} property.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize(Node)} with indentation and line breaks.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;
}
