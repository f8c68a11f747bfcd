package com.encsyntax.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for syntax tree serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = EncSyntaxJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(tree.root());
 * GreenNode green = mapper.readValue(json, GreenNode.class);
 * </pre>
 */
public final class EncSyntaxJackson {

    private EncSyntaxJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for syntax tree serialization/deserialization.
     *
     * The returned mapper:
     * - Writes red nodes and tokens with their absolute start (and length for nodes)
     * - Writes green elements without positions
     * - Reads nodes and tokens into green elements, ignoring positions
     * - Ignores unknown properties
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new SyntaxModule());

        return mapper;
    }
}
