package com.encsyntax;

import com.encsyntax.syntax.SyntaxKind;
import com.encsyntax.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Correlates the bodies of lambdas and query clauses across two versions of a tree.
 */
public final class LambdaBodyCorrelator {

    private LambdaBodyCorrelator() {
        // Utility class
    }

    public static boolean isLambdaShape(SyntaxKind kind) {
        return LambdaShape.isLambdaShape(kind);
    }

    public static boolean isNotLambdaShape(SyntaxNode node) {
        return !LambdaShape.isLambdaShape(node.kind());
    }

    /**
     * Returns the body in {@code newLambda} that corresponds to {@code oldBody}.
     *
     * <p>{@code newLambda} must already be matched with {@code oldBody}'s parent. For a
     * join or group clause the body on the same side as {@code oldBody} is returned.</p>
     *
     * @param oldBody a lambda or query clause body in the old tree
     * @param newLambda the lambda or query clause in the new tree matched with the old body's parent
     * @return the corresponding body, or {@code null} if the new node has none
     * @throws SyntaxConsistencyException if the old body's parent is not a lambda shape or
     *         the two shapes belong to different families
     */
    public static SyntaxNode getPartnerBody(SyntaxNode oldBody, SyntaxNode newLambda) {
        Objects.requireNonNull(oldBody, "oldBody");
        Objects.requireNonNull(newLambda, "newLambda");

        SyntaxNode oldLambda = oldBody.parent();
        LambdaShape oldShape = oldLambda == null ? null : LambdaShape.of(oldLambda.kind());
        if (oldShape == null) {
            throw new SyntaxConsistencyException(
                "Parent of " + oldBody + " is not a lambda or query clause: " + oldLambda);
        }
        LambdaShape newShape = LambdaShape.of(newLambda.kind());
        if (newShape == null || newShape.family() != oldShape.family()) {
            throw new SyntaxConsistencyException(
                "Cannot correlate body of " + oldLambda + " with " + newLambda + ": different lambda shapes");
        }

        return switch (oldShape.family()) {
            case LAMBDA, FROM, LET, WHERE, ORDERING, SELECT -> singleBody(newShape, newLambda);
            case JOIN -> sameSide(oldBody, oldLambda,
                SyntaxKind.ON_KEYWORD, SyntaxKind.EQUALS_KEYWORD, newLambda);
            case GROUP -> sameSide(oldBody, oldLambda,
                SyntaxKind.GROUP_KEYWORD, SyntaxKind.BY_KEYWORD, newLambda);
        };
    }

    /**
     * Returns the bodies owned by a lambda or query clause in document order: one for
     * lambdas and most clauses, two for join (left, right) and group (group, by).
     * Absent bodies are left out.
     *
     * @throws IllegalArgumentException if the node is not a lambda shape
     */
    public static List<SyntaxNode> getLambdaBodies(SyntaxNode lambda) {
        LambdaShape shape = LambdaShape.of(lambda.kind());
        if (shape == null) {
            throw new IllegalArgumentException(lambda + " is not a lambda or query clause");
        }
        List<SyntaxNode> bodies = new ArrayList<>(2);
        switch (shape.family()) {
            case LAMBDA, FROM, LET, WHERE, ORDERING, SELECT -> addIfPresent(bodies, singleBody(shape, lambda));
            case JOIN -> {
                addIfPresent(bodies, lambda.childNodeAfter(SyntaxKind.ON_KEYWORD));
                addIfPresent(bodies, lambda.childNodeAfter(SyntaxKind.EQUALS_KEYWORD));
            }
            case GROUP -> {
                addIfPresent(bodies, lambda.childNodeAfter(SyntaxKind.GROUP_KEYWORD));
                addIfPresent(bodies, lambda.childNodeAfter(SyntaxKind.BY_KEYWORD));
            }
        }
        return bodies;
    }

    /**
     * Returns true if {@code node} is a body of its parent lambda or query clause.
     */
    public static boolean isLambdaBody(SyntaxNode node) {
        SyntaxNode parent = node.parent();
        return parent != null
            && LambdaShape.isLambdaShape(parent.kind())
            && getLambdaBodies(parent).contains(node);
    }

    private static SyntaxNode singleBody(LambdaShape shape, SyntaxNode lambda) {
        return switch (shape) {
            case PARENTHESIZED_LAMBDA, SIMPLE_LAMBDA -> lambda.childNodeAfter(SyntaxKind.EQUALS_GREATER_THAN_TOKEN);
            case ANONYMOUS_METHOD -> lambda.firstChildNode(SyntaxKind.BLOCK);
            case FROM -> lambda.childNodeAfter(SyntaxKind.IN_KEYWORD);
            case LET -> lambda.childNodeAfter(SyntaxKind.EQUALS_TOKEN);
            case WHERE -> lambda.childNodeAfter(SyntaxKind.WHERE_KEYWORD);
            case ASCENDING_ORDERING, DESCENDING_ORDERING -> firstOrNull(lambda.childNodes());
            case SELECT -> lambda.childNodeAfter(SyntaxKind.SELECT_KEYWORD);
            case JOIN, GROUP -> throw new SyntaxConsistencyException(lambda + " owns two bodies");
        };
    }

    private static SyntaxNode sameSide(SyntaxNode oldBody, SyntaxNode oldClause,
                                       SyntaxKind firstKeyword, SyntaxKind secondKeyword,
                                       SyntaxNode newClause) {
        if (oldClause.childNodeAfter(firstKeyword) == oldBody) {
            return newClause.childNodeAfter(firstKeyword);
        }
        if (oldClause.childNodeAfter(secondKeyword) == oldBody) {
            return newClause.childNodeAfter(secondKeyword);
        }
        throw new SyntaxConsistencyException(
            oldBody + " is neither body of " + oldClause);
    }

    private static SyntaxNode firstOrNull(List<SyntaxNode> nodes) {
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    private static void addIfPresent(List<SyntaxNode> bodies, SyntaxNode body) {
        if (body != null) {
            bodies.add(body);
        }
    }
}
