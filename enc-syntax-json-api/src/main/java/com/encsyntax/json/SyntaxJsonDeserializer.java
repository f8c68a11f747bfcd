package com.encsyntax.json;

import com.encsyntax.syntax.GreenNode;
import com.encsyntax.syntax.SyntaxTree;

/**
 * Interface for reading syntax trees from JSON.
 */
public interface SyntaxJsonDeserializer {

    /**
     * Deserializes a JSON node object to a green node. Any {@code start} and
     * {@code length} fields are ignored: positions follow from the token texts.
     *
     * @param json the JSON string to deserialize
     * @return the green node
     * @throws SyntaxJsonException if the JSON is malformed or names an unknown kind
     */
    GreenNode deserializeGreen(String json) throws SyntaxJsonException;

    /**
     * Deserializes a JSON node object and builds a positioned tree rooted at it.
     *
     * @param json the JSON string to deserialize
     * @return the syntax tree
     * @throws SyntaxJsonException if the JSON is malformed or names an unknown kind
     */
    default SyntaxTree deserializeTree(String json) throws SyntaxJsonException {
        return SyntaxTree.create(deserializeGreen(json));
    }
}
