package com.encsyntax;

import com.encsyntax.syntax.SyntaxKind;
import com.encsyntax.syntax.SyntaxNode;

import java.util.Objects;

/**
 * Finds the executable body of a declaration.
 *
 * <p>A body is the one node whose contents are matched across versions: a block, the
 * expression of an expression-bodied member, a field or property initializer value, or
 * a lambda/query clause body.</p>
 */
public final class BodyLocator {

    private BodyLocator() {
        // Utility class
    }

    /**
     * Returns the body of a member declaration.
     *
     * <table>
     *   <caption>Body by declaration kind</caption>
     *   <tr><td>method, conversion operator, operator</td><td>block, else expression body</td></tr>
     *   <tr><td>accessor, constructor, destructor</td><td>block</td></tr>
     *   <tr><td>property</td><td>initializer value, else effective getter body</td></tr>
     *   <tr><td>indexer</td><td>expression body</td></tr>
     * </table>
     *
     * @param declaration any node
     * @return the body, or {@code null} if the declaration has none or is not a member with a body
     */
    public static SyntaxNode getBody(SyntaxNode declaration) {
        Objects.requireNonNull(declaration, "declaration");
        MemberKind member = MemberKind.of(declaration.kind());
        if (member == null) {
            return null;
        }

        SyntaxNode result = switch (member) {
            case METHOD, CONVERSION_OPERATOR, OPERATOR -> {
                SyntaxNode block = SyntaxLayout.block(declaration);
                yield block != null ? block : SyntaxLayout.arrowExpression(SyntaxLayout.expressionBody(declaration));
            }
            case GET_ACCESSOR, SET_ACCESSOR, ADD_ACCESSOR, REMOVE_ACCESSOR,
                 CONSTRUCTOR, DESTRUCTOR -> SyntaxLayout.block(declaration);
            case PROPERTY -> {
                SyntaxNode initializer = SyntaxLayout.initializerValue(SyntaxLayout.initializer(declaration));
                yield initializer != null
                    ? initializer
                    : getEffectiveGetterBody(SyntaxLayout.expressionBody(declaration), SyntaxLayout.accessorList(declaration));
            }
            case INDEXER -> SyntaxLayout.arrowExpression(SyntaxLayout.expressionBody(declaration));
        };

        assert result == null || isBody(result, false) : "Not a body: " + result + " of " + declaration;
        return result;
    }

    /**
     * Returns the body that computes the value of a property or indexer, or {@code null}
     * for any other node.
     */
    public static SyntaxNode getEffectiveGetterBody(SyntaxNode declaration) {
        if (declaration.isKind(SyntaxKind.PROPERTY_DECLARATION) || declaration.isKind(SyntaxKind.INDEXER_DECLARATION)) {
            return getEffectiveGetterBody(SyntaxLayout.expressionBody(declaration), SyntaxLayout.accessorList(declaration));
        }
        return null;
    }

    /**
     * Returns the expression of the expression body if there is one; otherwise the block
     * of the first get accessor that has a block.
     *
     * @param expressionBody an arrow expression clause, or {@code null}
     * @param accessorList an accessor list, or {@code null}
     * @return the body, or {@code null}
     */
    public static SyntaxNode getEffectiveGetterBody(SyntaxNode expressionBody, SyntaxNode accessorList) {
        if (expressionBody != null) {
            return SyntaxLayout.arrowExpression(expressionBody);
        }
        for (SyntaxNode accessor : SyntaxLayout.accessors(accessorList)) {
            if (accessor.isKind(SyntaxKind.GET_ACCESSOR_DECLARATION)) {
                SyntaxNode block = SyntaxLayout.block(accessor);
                if (block != null) {
                    return block;
                }
            }
        }
        return null;
    }

    /**
     * Checks that a node has one of the shapes a body may have.
     *
     * @param node the candidate body
     * @param allowLambda whether lambda and query clause bodies are acceptable
     */
    public static boolean isBody(SyntaxNode node, boolean allowLambda) {
        if (LambdaBodyCorrelator.isLambdaBody(node)) {
            return allowLambda && (node.kind().isExpression() || node.isKind(SyntaxKind.BLOCK));
        }

        if (node.isKind(SyntaxKind.BLOCK)) {
            return true;
        }

        if (!node.kind().isExpression() || node.parent() == null) {
            return false;
        }

        SyntaxNode parent = node.parent();
        if (parent.isKind(SyntaxKind.ARROW_EXPRESSION_CLAUSE)) {
            return true;
        }

        // field or property initializer
        SyntaxNode grandparent = parent.parent();
        return parent.isKind(SyntaxKind.EQUALS_VALUE_CLAUSE)
            && grandparent != null
            && (grandparent.isKind(SyntaxKind.VARIABLE_DECLARATOR) || grandparent.isKind(SyntaxKind.PROPERTY_DECLARATION));
    }
}
