package com.encsyntax.syntax;

/**
 * A leaf of the syntax tree.
 */
public final class SyntaxToken implements SyntaxElement {

    private final GreenToken green;
    private final SyntaxTree tree;
    private final SyntaxNode parent;
    private final int position;

    SyntaxToken(GreenToken green, SyntaxTree tree, SyntaxNode parent, int position) {
        this.green = green;
        this.tree = tree;
        this.parent = parent;
        this.position = position;
    }

    @Override
    public SyntaxKind kind() {
        return green.kind();
    }

    @Override
    public GreenToken green() {
        return green;
    }

    @Override
    public SyntaxTree syntaxTree() {
        return tree;
    }

    @Override
    public SyntaxNode parent() {
        return parent;
    }

    public String text() {
        return green.text();
    }

    public String trailingTrivia() {
        return green.trailingTrivia();
    }

    @Override
    public TextSpan fullSpan() {
        return new TextSpan(position, green.fullWidth());
    }

    @Override
    public TextSpan span() {
        return new TextSpan(position, green.width());
    }

    @Override
    public boolean isToken() {
        return true;
    }

    @Override
    public String toFullString() {
        return green.text() + green.trailingTrivia();
    }

    @Override
    public String toString() {
        return kind() + span().toString() + " '" + green.text() + "'";
    }
}
