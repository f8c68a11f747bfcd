package com.encsyntax.syntax;

/**
 * Position-free description of a syntax node or token.
 *
 * <p>Green elements carry shape and text only. A {@link SyntaxTree} lays a green root
 * out into positioned {@link SyntaxElement}s.</p>
 */
public sealed interface GreenElement permits GreenNode, GreenToken {

    SyntaxKind kind();

    /**
     * Width of the element's text including trailing trivia.
     */
    int fullWidth();
}
