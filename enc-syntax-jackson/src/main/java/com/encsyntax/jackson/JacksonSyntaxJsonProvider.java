package com.encsyntax.jackson;

import com.encsyntax.json.SyntaxJsonDeserializer;
import com.encsyntax.json.SyntaxJsonException;
import com.encsyntax.json.SyntaxJsonProvider;
import com.encsyntax.json.SyntaxJsonSerializer;
import com.encsyntax.syntax.GreenElement;
import com.encsyntax.syntax.GreenNode;
import com.encsyntax.syntax.SyntaxElement;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Jackson-based implementation of SyntaxJsonProvider.
 */
public class JacksonSyntaxJsonProvider implements SyntaxJsonProvider {

    private final ObjectMapper mapper;
    private final SyntaxJsonSerializer serializer;
    private final SyntaxJsonDeserializer deserializer;

    public JacksonSyntaxJsonProvider() {
        this.mapper = EncSyntaxJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public SyntaxJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public SyntaxJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements SyntaxJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(SyntaxElement element) throws SyntaxJsonException {
            try {
                return mapper.writeValueAsString(element);
            } catch (Exception e) {
                throw new SyntaxJsonException("Failed to serialize " + element, e);
            }
        }

        @Override
        public String serializePretty(SyntaxElement element) throws SyntaxJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(element);
            } catch (Exception e) {
                throw new SyntaxJsonException("Failed to serialize " + element, e);
            }
        }

        @Override
        public String serialize(GreenElement element) throws SyntaxJsonException {
            try {
                return mapper.writeValueAsString(element);
            } catch (Exception e) {
                throw new SyntaxJsonException("Failed to serialize green " + element.kind(), e);
            }
        }
    }

    private static class JacksonDeserializer implements SyntaxJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public GreenNode deserializeGreen(String json) throws SyntaxJsonException {
            try {
                return mapper.readValue(json, GreenNode.class);
            } catch (Exception e) {
                throw new SyntaxJsonException("Failed to deserialize syntax tree", e);
            }
        }
    }
}
