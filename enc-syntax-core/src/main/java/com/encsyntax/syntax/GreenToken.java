package com.encsyntax.syntax;

import java.util.Objects;

public record GreenToken(
    SyntaxKind kind,
    String text,
    String trailingTrivia
) implements GreenElement {

    public GreenToken {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        if (!kind.isToken()) {
            throw new IllegalArgumentException(kind + " is not a token kind");
        }
        trailingTrivia = trailingTrivia == null ? "" : trailingTrivia;
    }

    public GreenToken(SyntaxKind kind, String text) {
        this(kind, text, "");
    }

    public int width() {
        return text.length();
    }

    @Override
    public int fullWidth() {
        return text.length() + trailingTrivia.length();
    }
}
