package com.encsyntax;

import com.encsyntax.syntax.SyntaxKind;
import com.encsyntax.syntax.SyntaxNode;

import java.util.List;
import java.util.Objects;

/**
 * Extracts the await expressions and yield statements of a body.
 */
public final class ControlFlowFeatures {

    private ControlFlowFeatures() {
        // Utility class
    }

    /**
     * Returns the await expressions of a body in document order. Lambdas and query
     * clauses nested in the body are skipped: their awaits belong to them.
     */
    public static List<SyntaxNode> collectAwaitExpressions(SyntaxNode body) {
        Objects.requireNonNull(body, "body");
        return body.descendantNodesAndSelf(LambdaBodyCorrelator::isNotLambdaShape).stream()
            .filter(node -> node.isKind(SyntaxKind.AWAIT_EXPRESSION))
            .toList();
    }

    /**
     * Returns the yield statements of a method body in document order.
     *
     * <p>Lambdas and expression-bodied members cannot be iterators, so the result is
     * empty unless the body belongs to a method declaration. Expressions are not
     * entered.</p>
     */
    public static List<SyntaxNode> collectYieldStatements(SyntaxNode body) {
        Objects.requireNonNull(body, "body");
        SyntaxNode owner = body.parent();
        if (owner == null || !owner.isKind(SyntaxKind.METHOD_DECLARATION)) {
            return List.of();
        }
        return body.descendantNodes(node -> !node.kind().isExpression()).stream()
            .filter(ControlFlowFeatures::isYieldStatement)
            .toList();
    }

    static boolean isYieldStatement(SyntaxNode node) {
        return node.isKind(SyntaxKind.YIELD_RETURN_STATEMENT) || node.isKind(SyntaxKind.YIELD_BREAK_STATEMENT);
    }
}
