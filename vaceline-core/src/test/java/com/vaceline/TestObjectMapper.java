package com.vaceline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vaceline.ast.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Test utility that turns ASTs into JSON trees for structural comparison.
 * This duplicates the type handling of vaceline-jackson to avoid cyclic dependencies in tests.
 */
public class TestObjectMapper {

    private static ObjectMapper instance;

    public static synchronized ObjectMapper get() {
        if (instance == null) {
            instance = createObjectMapper();
        }
        return instance;
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.addMixIn(Node.class, NodeMixin.class);
        mapper.addMixIn(Statement.class, NodeMixin.class);
        mapper.addMixIn(Expression.class, NodeMixin.class);
        mapper.addMixIn(Literal.class, NodeMixin.class);
        mapper.addMixIn(Comments.class, CommentsMixin.class);
        return mapper;
    }

    /**
     * JSON tree of {@code node} with every {@code loc} property removed.
     */
    public static JsonNode withoutLocations(Node node) {
        JsonNode tree = get().valueToTree(node);
        stripLocations(tree);
        return tree;
    }

    /**
     * Asserts both trees have the same shape and values, ignoring source locations.
     */
    public static void assertSameStructure(Node expected, Node actual) {
        assertEquals(withoutLocations(expected).toPrettyString(), withoutLocations(actual).toPrettyString());
    }

    private static void stripLocations(JsonNode node) {
        if (node instanceof ObjectNode object) {
            object.remove("loc");
            object.forEach(TestObjectMapper::stripLocations);
        } else if (node instanceof ArrayNode array) {
            array.forEach(TestObjectMapper::stripLocations);
        }
    }

    // ==================== Mixins ====================

    // Default type ids are the simple class names, which are the node type names
    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    private abstract static class NodeMixin {
    }

    private abstract static class CommentsMixin {
        @JsonProperty("leading")
        abstract List<Comment> leading();

        @JsonProperty("trailing")
        abstract List<Comment> trailing();

        @JsonProperty("inner")
        abstract List<Comment> inner();

        @JsonIgnore
        abstract boolean isEmpty();
    }
}
