package com.encsyntax;

import com.encsyntax.syntax.SyntaxElement;
import com.encsyntax.syntax.SyntaxNode;
import com.encsyntax.syntax.SyntaxToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Maps nodes and positions of an old tree to their counterparts in a new tree.
 *
 * <p>Outside the edited text the two trees have the same shape, so the counterpart of a
 * node there is reached by walking both trees in lockstep: at each level take the old
 * child that contains the target position and the new child at the same index. The walk
 * costs O(depth) and needs no precomputed alignment.</p>
 *
 * <p>Every step checks that both sides have the same kind. A mismatch means the trees
 * are not congruent along the path, which is a caller error reported as a
 * {@link SyntaxConsistencyException}.</p>
 */
public final class TreePartnerMatcher {

    private static final Logger logger = LoggerFactory.getLogger(TreePartnerMatcher.class);

    private TreePartnerMatcher() {
        // Utility class
    }

    /**
     * A leaf token of the old tree and its counterpart in the new tree.
     */
    public record LeafPartner(SyntaxToken oldLeaf, SyntaxToken newLeaf) {
    }

    /**
     * Returns the node of the new tree that corresponds to {@code oldNode}.
     *
     * @param oldRoot root of the old tree, or of an old subtree
     * @param newRoot the node of the new tree corresponding to {@code oldRoot}
     * @param oldNode {@code oldRoot} or one of its descendants; must not be zero-width
     * @return the partner node
     * @throws SyntaxConsistencyException if {@code oldNode} is zero-width or outside
     *         {@code oldRoot}, or the trees differ in shape along the path
     */
    public static SyntaxNode findPartner(SyntaxNode oldRoot, SyntaxNode newRoot, SyntaxNode oldNode) {
        Objects.requireNonNull(oldRoot, "oldRoot");
        Objects.requireNonNull(newRoot, "newRoot");
        Objects.requireNonNull(oldNode, "oldNode");

        if (oldNode.fullSpan().isEmpty()) {
            throw fault("Finding the partner of zero-width node " + oldNode + " is not supported");
        }
        if (!oldRoot.isAncestorOrSelfOf(oldNode)) {
            throw fault(oldNode + " is not within " + oldRoot);
        }

        int position = oldNode.spanStart();
        SyntaxNode oldCurrent = oldRoot;
        SyntaxNode newCurrent = newRoot;
        while (oldCurrent != oldNode) {
            checkSameKind(oldCurrent, newCurrent, position);

            int index = oldCurrent.childIndexContainingPosition(position);
            SyntaxElement oldChild = oldCurrent.childNodesAndTokens().get(index);
            if (oldChild.isToken()) {
                throw fault("Reached token " + oldChild + " before " + oldNode);
            }
            SyntaxElement newChild = childAt(newCurrent, index, oldChild);
            if (newChild.isToken()) {
                throw fault("Expected a node partnering " + oldChild + " but found token " + newChild);
            }

            logger.trace("Descending from {} into child {}: {}", oldCurrent, index, oldChild);
            oldCurrent = oldChild.asNode();
            newCurrent = newChild.asNode();
        }

        checkSameKind(oldCurrent, newCurrent, position);
        return newCurrent;
    }

    /**
     * Descends both trees towards {@code position} until the old side reaches a token.
     *
     * @param oldRoot root of the old tree, or of an old subtree
     * @param position absolute offset in the old text
     * @param newRoot the node of the new tree corresponding to {@code oldRoot}
     * @return the old token containing the position and its partner
     * @throws IllegalArgumentException if the position is outside {@code oldRoot}
     * @throws SyntaxConsistencyException if the trees differ in shape along the path
     */
    public static LeafPartner findLeafNodeAndPartner(SyntaxNode oldRoot, int position, SyntaxNode newRoot) {
        Objects.requireNonNull(oldRoot, "oldRoot");
        Objects.requireNonNull(newRoot, "newRoot");
        if (!oldRoot.fullSpan().contains(position)) {
            throw new IllegalArgumentException(
                "Position " + position + " is outside of " + oldRoot.kind() + " " + oldRoot.fullSpan());
        }

        SyntaxNode oldCurrent = oldRoot;
        SyntaxNode newCurrent = newRoot;
        while (true) {
            checkSameKind(oldCurrent, newCurrent, position);

            int index = oldCurrent.childIndexContainingPosition(position);
            SyntaxElement oldChild = oldCurrent.childNodesAndTokens().get(index);
            SyntaxElement newChild = childAt(newCurrent, index, oldChild);

            if (oldChild.isToken()) {
                if (!newChild.isToken() || newChild.kind() != oldChild.kind()) {
                    throw fault("Kind mismatch at offset " + position + ": old " + oldChild + ", new " + newChild);
                }
                return new LeafPartner(oldChild.asToken(), newChild.asToken());
            }
            if (newChild.isToken()) {
                throw fault("Expected a node partnering " + oldChild + " but found token " + newChild);
            }

            logger.trace("Descending from {} into child {}: {}", oldCurrent, index, oldChild);
            oldCurrent = oldChild.asNode();
            newCurrent = newChild.asNode();
        }
    }

    private static SyntaxElement childAt(SyntaxNode newParent, int index, SyntaxElement oldChild) {
        List<SyntaxElement> children = newParent.childNodesAndTokens();
        if (index >= children.size()) {
            throw fault("No child " + index + " in " + newParent + " to partner " + oldChild);
        }
        return children.get(index);
    }

    private static void checkSameKind(SyntaxNode oldNode, SyntaxNode newNode, int position) {
        if (oldNode.kind() != newNode.kind()) {
            throw fault("Kind mismatch at offset " + position + ": old " + oldNode + ", new " + newNode);
        }
    }

    private static SyntaxConsistencyException fault(String message) {
        logger.debug("Tree partner matching failed: {}", message);
        return new SyntaxConsistencyException(message);
    }
}
