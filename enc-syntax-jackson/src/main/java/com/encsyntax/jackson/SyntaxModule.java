package com.encsyntax.jackson;

import com.encsyntax.syntax.GreenElement;
import com.encsyntax.syntax.GreenNode;
import com.encsyntax.syntax.GreenToken;
import com.encsyntax.syntax.SyntaxElement;
import com.encsyntax.syntax.SyntaxFactory;
import com.encsyntax.syntax.SyntaxKind;
import com.encsyntax.syntax.SyntaxNode;
import com.encsyntax.syntax.SyntaxToken;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Jackson module that configures serialization/deserialization for the syntax tree classes.
 *
 * This module handles:
 * - Red elements, written with their absolute positions
 * - Green elements, written without positions
 * - Reading nodes and tokens back into green elements by kind
 */
public class SyntaxModule extends SimpleModule {

    static final String KIND = "kind";
    static final String START = "start";
    static final String LENGTH = "length";
    static final String CHILDREN = "children";
    static final String TEXT = "text";
    static final String TRIVIA = "trivia";

    public SyntaxModule() {
        super("SyntaxModule", new Version(0, 1, 0, "SNAPSHOT", "com.encsyntax", "enc-syntax-jackson"));

        SyntaxElementSerializer red = new SyntaxElementSerializer();
        addSerializer(SyntaxElement.class, red);
        addSerializer(SyntaxNode.class, red);
        addSerializer(SyntaxToken.class, red);

        GreenElementSerializer green = new GreenElementSerializer();
        addSerializer(GreenElement.class, green);
        addSerializer(GreenNode.class, green);
        addSerializer(GreenToken.class, green);

        addDeserializer(GreenElement.class, new GreenElementDeserializer<>(GreenElement.class));
        addDeserializer(GreenNode.class, new GreenElementDeserializer<>(GreenNode.class));
        addDeserializer(GreenToken.class, new GreenElementDeserializer<>(GreenToken.class));
    }

    // ==================== Serializers ====================

    private static class SyntaxElementSerializer extends JsonSerializer<SyntaxElement> {
        @Override
        public void serialize(SyntaxElement element, JsonGenerator gen, SerializerProvider serializers)
                throws IOException {
            gen.writeStartObject();
            gen.writeStringField(KIND, element.kind().name());
            gen.writeNumberField(START, element.fullSpan().start());
            if (element instanceof SyntaxNode node) {
                gen.writeNumberField(LENGTH, node.fullSpan().length());
                gen.writeArrayFieldStart(CHILDREN);
                for (SyntaxElement child : node.childNodesAndTokens()) {
                    serialize(child, gen, serializers);
                }
                gen.writeEndArray();
            } else if (element instanceof SyntaxToken token) {
                writeTokenText(token.green(), gen);
            }
            gen.writeEndObject();
        }
    }

    private static class GreenElementSerializer extends JsonSerializer<GreenElement> {
        @Override
        public void serialize(GreenElement element, JsonGenerator gen, SerializerProvider serializers)
                throws IOException {
            gen.writeStartObject();
            gen.writeStringField(KIND, element.kind().name());
            if (element instanceof GreenNode node) {
                gen.writeArrayFieldStart(CHILDREN);
                for (GreenElement child : node.children()) {
                    serialize(child, gen, serializers);
                }
                gen.writeEndArray();
            } else if (element instanceof GreenToken token) {
                writeTokenText(token, gen);
            }
            gen.writeEndObject();
        }
    }

    private static void writeTokenText(GreenToken token, JsonGenerator gen) throws IOException {
        gen.writeStringField(TEXT, token.text());
        if (!token.trailingTrivia().isEmpty()) {
            gen.writeStringField(TRIVIA, token.trailingTrivia());
        }
    }

    // ==================== Deserializer ====================

    /**
     * Reads a node or token object into a green element. The kind decides which one
     * it is; positions in the input are ignored.
     */
    private static class GreenElementDeserializer<T extends GreenElement> extends JsonDeserializer<T> {
        private final Class<T> type;

        GreenElementDeserializer(Class<T> type) {
            this.type = type;
        }

        @Override
        public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode json = p.readValueAsTree();
            GreenElement element = readElement(json, p);
            if (!type.isInstance(element)) {
                throw JsonMappingException.from(p,
                    "Expected " + type.getSimpleName() + " but found " + element.kind());
            }
            return type.cast(element);
        }

        private GreenElement readElement(JsonNode json, JsonParser p) throws JsonMappingException {
            if (json == null || !json.isObject()) {
                throw JsonMappingException.from(p, "Expected a syntax element object but found " + json);
            }
            SyntaxKind kind = readKind(json, p);
            try {
                if (kind.isToken()) {
                    return readToken(kind, json, p);
                }
                JsonNode children = json.get(CHILDREN);
                if (children != null && !children.isArray()) {
                    throw JsonMappingException.from(p, "'" + CHILDREN + "' of " + kind + " is not an array");
                }
                List<GreenElement> elements = new ArrayList<>();
                if (children != null) {
                    for (JsonNode child : children) {
                        elements.add(readElement(child, p));
                    }
                }
                return SyntaxFactory.node(kind, elements);
            } catch (IllegalArgumentException e) {
                throw JsonMappingException.from(p, "Invalid " + kind + ": " + e.getMessage(), e);
            }
        }

        private static SyntaxKind readKind(JsonNode json, JsonParser p) throws JsonMappingException {
            JsonNode kind = json.get(KIND);
            if (kind == null || !kind.isTextual()) {
                throw JsonMappingException.from(p, "Syntax element without '" + KIND + "': " + json);
            }
            try {
                return SyntaxKind.valueOf(kind.asText());
            } catch (IllegalArgumentException e) {
                throw JsonMappingException.from(p, "Unknown syntax kind: " + kind.asText(), e);
            }
        }

        private static GreenToken readToken(SyntaxKind kind, JsonNode json, JsonParser p) throws JsonMappingException {
            String text = json.hasNonNull(TEXT) ? json.get(TEXT).asText() : kind.text();
            if (text == null) {
                throw JsonMappingException.from(p, "Token " + kind + " needs '" + TEXT + "'");
            }
            String trivia = json.hasNonNull(TRIVIA) ? json.get(TRIVIA).asText() : "";
            return SyntaxFactory.token(kind, text, trivia);
        }
    }
}
