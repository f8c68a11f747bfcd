package com.encsyntax.syntax;

import java.util.List;
import java.util.Objects;

public record GreenNode(
    SyntaxKind kind,
    List<GreenElement> children,
    int fullWidth
) implements GreenElement {

    public GreenNode {
        Objects.requireNonNull(kind, "kind");
        if (kind.isToken()) {
            throw new IllegalArgumentException(kind + " is a token kind");
        }
        children = List.copyOf(children);
        int sum = 0;
        for (GreenElement child : children) {
            sum += child.fullWidth();
        }
        if (sum != fullWidth) {
            throw new IllegalArgumentException(
                "Width " + fullWidth + " of " + kind + " does not match its children (" + sum + ")");
        }
    }

    public GreenNode(SyntaxKind kind, List<GreenElement> children) {
        this(kind, children, widthOf(children));
    }

    private static int widthOf(List<GreenElement> children) {
        int sum = 0;
        for (GreenElement child : children) {
            sum += child.fullWidth();
        }
        return sum;
    }
}
