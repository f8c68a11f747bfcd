package com.encsyntax.syntax;

/**
 * A positioned syntax node or token belonging to a {@link SyntaxTree}.
 */
public sealed interface SyntaxElement permits SyntaxNode, SyntaxToken {

    SyntaxKind kind();

    GreenElement green();

    SyntaxTree syntaxTree();

    /**
     * Returns the enclosing node, or {@code null} for the root.
     */
    SyntaxNode parent();

    /**
     * Span of the element's text including trailing trivia.
     */
    TextSpan fullSpan();

    /**
     * Span of the element's text without trailing trivia.
     */
    TextSpan span();

    default int spanStart() {
        return span().start();
    }

    boolean isToken();

    default boolean isNode() {
        return !isToken();
    }

    default SyntaxNode asNode() {
        if (this instanceof SyntaxNode node) {
            return node;
        }
        throw new IllegalStateException(kind() + " at " + fullSpan() + " is a token");
    }

    default SyntaxToken asToken() {
        if (this instanceof SyntaxToken token) {
            return token;
        }
        throw new IllegalStateException(kind() + " at " + fullSpan() + " is a node");
    }

    String toFullString();
}
