package com.vaceline.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for AST serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = VacelineJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(program);
 * Program program = mapper.readValue(json, Program.class);
 * </pre>
 */
public final class VacelineJackson {

    private VacelineJackson() {
        // Utility class
    }

    /**
     * The returned mapper writes every node with its {@code "type"}, omits absent values
     * ({@code loc} of synthesized nodes, an unused {@code else}) and ignores unknown properties when reading.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());
        return mapper;
    }
}
