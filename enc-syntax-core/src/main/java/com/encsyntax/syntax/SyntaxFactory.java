package com.encsyntax.syntax;

import java.util.Arrays;
import java.util.List;

/**
 * Static builders for green elements.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * GreenNode ret = node(SyntaxKind.RETURN_STATEMENT,
 *     keyword(SyntaxKind.RETURN_KEYWORD),
 *     node(SyntaxKind.IDENTIFIER_NAME, identifier("x")),
 *     token(SyntaxKind.SEMICOLON_TOKEN));
 * }</pre>
 */
public final class SyntaxFactory {

    private SyntaxFactory() {
        // Utility class
    }

    public static GreenNode node(SyntaxKind kind, GreenElement... children) {
        return new GreenNode(kind, Arrays.asList(children));
    }

    public static GreenNode node(SyntaxKind kind, List<? extends GreenElement> children) {
        return new GreenNode(kind, List.copyOf(children));
    }

    /**
     * A node with no children and therefore no width.
     */
    public static GreenNode missingNode(SyntaxKind kind) {
        return new GreenNode(kind, List.of());
    }

    /**
     * A punctuation or keyword token with its fixed text and no trivia.
     */
    public static GreenToken token(SyntaxKind kind) {
        return new GreenToken(kind, fixedText(kind));
    }

    public static GreenToken token(SyntaxKind kind, String text, String trailingTrivia) {
        return new GreenToken(kind, text, trailingTrivia);
    }

    /**
     * A keyword token followed by a single space.
     */
    public static GreenToken keyword(SyntaxKind kind) {
        return new GreenToken(kind, fixedText(kind), " ");
    }

    public static GreenToken missingToken(SyntaxKind kind) {
        return new GreenToken(kind, "");
    }

    public static GreenToken identifier(String name) {
        return new GreenToken(SyntaxKind.IDENTIFIER_TOKEN, name);
    }

    public static GreenToken identifier(String name, String trailingTrivia) {
        return new GreenToken(SyntaxKind.IDENTIFIER_TOKEN, name, trailingTrivia);
    }

    public static GreenToken numericLiteral(String text) {
        return new GreenToken(SyntaxKind.NUMERIC_LITERAL_TOKEN, text);
    }

    public static GreenToken stringLiteral(String quotedText) {
        return new GreenToken(SyntaxKind.STRING_LITERAL_TOKEN, quotedText);
    }

    private static String fixedText(SyntaxKind kind) {
        String text = kind.text();
        if (text == null) {
            throw new IllegalArgumentException(kind + " has no fixed text");
        }
        return text;
    }
}
