package com.encsyntax.json;

import com.encsyntax.syntax.GreenElement;
import com.encsyntax.syntax.SyntaxElement;

/**
 * Interface for serializing syntax trees to JSON.
 *
 * <p>Positioned elements carry their absolute {@code start} (and {@code length} for
 * nodes); green elements are written without positions.</p>
 */
public interface SyntaxJsonSerializer {

    /**
     * Serializes a node or token, with absolute positions, to a JSON string.
     *
     * @param element the element to serialize
     * @return the JSON representation of the element
     * @throws SyntaxJsonException if serialization fails
     */
    String serialize(SyntaxElement element) throws SyntaxJsonException;

    /**
     * Serializes a node or token to a pretty-printed JSON string.
     *
     * @param element the element to serialize
     * @return the pretty-printed JSON representation of the element
     * @throws SyntaxJsonException if serialization fails
     */
    String serializePretty(SyntaxElement element) throws SyntaxJsonException;

    /**
     * Serializes a green element, without positions, to a JSON string.
     *
     * @param element the green element to serialize
     * @return the JSON representation of the element
     * @throws SyntaxJsonException if serialization fails
     */
    String serialize(GreenElement element) throws SyntaxJsonException;
}
