package com.encsyntax.syntax;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * An immutable snapshot of a source text's syntax.
 *
 * <p>The whole positioned tree is built eagerly when the snapshot is created, so a
 * tree can be shared between threads without synchronization. An edit never
 * changes a tree; it produces a new one.</p>
 */
public final class SyntaxTree {

    private static final Logger logger = LoggerFactory.getLogger(SyntaxTree.class);

    private final SyntaxNode root;

    private SyntaxTree(GreenNode green) {
        this.root = new SyntaxNode(green, this, null, 0);
    }

    /**
     * Lays out a green root at offset zero.
     *
     * @param green the root's shape and text
     * @return the new tree
     */
    public static SyntaxTree create(GreenNode green) {
        Objects.requireNonNull(green, "green");
        SyntaxTree tree = new SyntaxTree(green);
        logger.debug("Created syntax tree with root {} of length {}", green.kind(), green.fullWidth());
        return tree;
    }

    public SyntaxNode root() {
        return root;
    }

    public int length() {
        return root.fullSpan().length();
    }

    public String toFullString() {
        return root.toFullString();
    }
}
