package com.encsyntax.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * An interior node of the syntax tree.
 *
 * <p>Children are created together with the node and are fixed afterwards. Their full
 * spans partition the node's full span in order.</p>
 */
public final class SyntaxNode implements SyntaxElement {

    private final GreenNode green;
    private final SyntaxTree tree;
    private final SyntaxNode parent;
    private final int position;
    private final int trailingTriviaWidth;
    private final List<SyntaxElement> children;

    SyntaxNode(GreenNode green, SyntaxTree tree, SyntaxNode parent, int position) {
        this.green = green;
        this.tree = tree;
        this.parent = parent;
        this.position = position;
        this.trailingTriviaWidth = trailingTriviaWidth(green);

        List<SyntaxElement> built = new ArrayList<>(green.children().size());
        int offset = position;
        for (GreenElement child : green.children()) {
            if (child instanceof GreenNode node) {
                built.add(new SyntaxNode(node, tree, this, offset));
            } else {
                built.add(new SyntaxToken((GreenToken) child, tree, this, offset));
            }
            offset += child.fullWidth();
        }
        this.children = Collections.unmodifiableList(built);
    }

    // Trivia of the last token that has any width.
    private static int trailingTriviaWidth(GreenElement element) {
        if (element instanceof GreenToken token) {
            return token.trailingTrivia().length();
        }
        List<GreenElement> children = ((GreenNode) element).children();
        for (int i = children.size() - 1; i >= 0; i--) {
            if (children.get(i).fullWidth() > 0) {
                return trailingTriviaWidth(children.get(i));
            }
        }
        return 0;
    }

    @Override
    public SyntaxKind kind() {
        return green.kind();
    }

    @Override
    public GreenNode green() {
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

    @Override
    public TextSpan fullSpan() {
        return new TextSpan(position, green.fullWidth());
    }

    @Override
    public TextSpan span() {
        return new TextSpan(position, green.fullWidth() - trailingTriviaWidth);
    }

    @Override
    public boolean isToken() {
        return false;
    }

    public boolean isKind(SyntaxKind kind) {
        return green.kind() == kind;
    }

    // ========================================================================
    // Children
    // ========================================================================

    public List<SyntaxElement> childNodesAndTokens() {
        return children;
    }

    public int childCount() {
        return children.size();
    }

    public List<SyntaxNode> childNodes() {
        List<SyntaxNode> nodes = new ArrayList<>();
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode node) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    public List<SyntaxToken> childTokens() {
        List<SyntaxToken> tokens = new ArrayList<>();
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxToken token) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Returns the first child node of the given kind, or {@code null}.
     */
    public SyntaxNode firstChildNode(SyntaxKind kind) {
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode node && node.kind() == kind) {
                return node;
            }
        }
        return null;
    }

    public List<SyntaxNode> childNodes(SyntaxKind kind) {
        List<SyntaxNode> nodes = new ArrayList<>();
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode node && node.kind() == kind) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    /**
     * Returns the first child token of the given kind, or {@code null}.
     */
    public SyntaxToken firstChildToken(SyntaxKind kind) {
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxToken token && token.kind() == kind) {
                return token;
            }
        }
        return null;
    }

    public boolean hasChildToken(SyntaxKind kind) {
        return firstChildToken(kind) != null;
    }

    /**
     * Returns the first child node that follows the first child token of the given
     * kind, or {@code null} when there is no such token or no node after it.
     */
    public SyntaxNode childNodeAfter(SyntaxKind tokenKind) {
        boolean seen = false;
        for (SyntaxElement child : children) {
            if (!seen) {
                seen = child.isToken() && child.kind() == tokenKind;
            } else if (child instanceof SyntaxNode node) {
                return node;
            }
        }
        return null;
    }

    /**
     * Returns the index of the child whose full span contains {@code position}.
     *
     * @throws IllegalArgumentException if the position is outside this node's full span
     */
    public int childIndexContainingPosition(int position) {
        if (!fullSpan().contains(position)) {
            throw new IllegalArgumentException(
                "Position " + position + " is outside of " + kind() + " " + fullSpan());
        }
        // Largest index whose start is at or before the position; zero-width children
        // share their start with the following child and are skipped by this search.
        int lo = 0;
        int hi = children.size() - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (children.get(mid).fullSpan().start() <= position) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }

    public SyntaxElement childThatContainsPosition(int position) {
        return children.get(childIndexContainingPosition(position));
    }

    // ========================================================================
    // Navigation
    // ========================================================================

    public List<SyntaxNode> ancestorsAndSelf() {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode node = this; node != null; node = node.parent) {
            result.add(node);
        }
        return result;
    }

    public boolean isAncestorOrSelfOf(SyntaxElement element) {
        for (SyntaxNode node = element.isNode() ? element.asNode() : element.parent();
             node != null;
             node = node.parent) {
            if (node == this) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the descendant nodes in document order.
     *
     * @param descendIntoChildren decides whether the children of a visited node are
     *                            visited too; it is applied to this node as well
     */
    public List<SyntaxNode> descendantNodes(Predicate<SyntaxNode> descendIntoChildren) {
        return collect(false, descendIntoChildren);
    }

    public List<SyntaxNode> descendantNodesAndSelf(Predicate<SyntaxNode> descendIntoChildren) {
        return collect(true, descendIntoChildren);
    }

    public List<SyntaxNode> descendantNodes() {
        return collect(false, node -> true);
    }

    private List<SyntaxNode> collect(boolean includeSelf, Predicate<SyntaxNode> descendIntoChildren) {
        List<SyntaxNode> result = new ArrayList<>();
        if (includeSelf) {
            result.add(this);
        }
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        if (descendIntoChildren.test(this)) {
            pushChildren(stack, this);
        }
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            result.add(node);
            if (descendIntoChildren.test(node)) {
                pushChildren(stack, node);
            }
        }
        return result;
    }

    private static void pushChildren(Deque<SyntaxNode> stack, SyntaxNode node) {
        List<SyntaxElement> nodeChildren = node.children;
        for (int i = nodeChildren.size() - 1; i >= 0; i--) {
            if (nodeChildren.get(i) instanceof SyntaxNode child) {
                stack.push(child);
            }
        }
    }

    @Override
    public String toFullString() {
        StringBuilder sb = new StringBuilder(green.fullWidth());
        appendText(green, sb);
        return sb.toString();
    }

    private static void appendText(GreenElement element, StringBuilder sb) {
        if (element instanceof GreenToken token) {
            sb.append(token.text()).append(token.trailingTrivia());
        } else {
            for (GreenElement child : ((GreenNode) element).children()) {
                appendText(child, sb);
            }
        }
    }

    @Override
    public String toString() {
        return kind() + span().toString();
    }
}
