package com.vaceline.json;

import com.vaceline.ast.Node;
import com.vaceline.ast.Program;

/**
 * Reads AST nodes back from the JSON written by an {@link AstJsonSerializer}.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a JSON string to a Program (root AST node).
     *
     * @param json the JSON string to deserialize
     * @return the deserialized Program
     * @throws AstJsonException if deserialization fails
     */
    Program deserializeProgram(String json) throws AstJsonException;

    /**
     * Deserializes a JSON string to a specific node type, or to any node with {@code Node.class}.
     *
     * @param json the JSON string to deserialize
     * @param type the expected node type
     * @param <T> the node type
     * @return the deserialized node
     * @throws AstJsonException if deserialization fails or the JSON holds another node type
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
