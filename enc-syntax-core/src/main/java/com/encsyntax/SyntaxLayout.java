package com.encsyntax;

import com.encsyntax.syntax.SyntaxElement;
import com.encsyntax.syntax.SyntaxKind;
import com.encsyntax.syntax.SyntaxNode;
import com.encsyntax.syntax.SyntaxToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Locates the parts of declarations, lambdas and query clauses among their children.
 *
 * <p>Layout expected from the tree producer:</p>
 * <ul>
 *   <li>modifiers are direct keyword token children;</li>
 *   <li>a block body is a {@code BLOCK} child, an expression body an
 *       {@code ARROW_EXPRESSION_CLAUSE} child holding {@code =>} and the expression;</li>
 *   <li>an initializer is an {@code EQUALS_VALUE_CLAUSE} child holding {@code =} and the value;</li>
 *   <li>accessors live in an {@code ACCESSOR_LIST} child;</li>
 *   <li>query clause expressions follow the keyword that introduces them.</li>
 * </ul>
 * All accessors return {@code null} for absent parts.
 */
public final class SyntaxLayout {

    private SyntaxLayout() {
        // Utility class
    }

    public static List<SyntaxToken> modifiers(SyntaxNode declaration) {
        List<SyntaxToken> modifiers = new ArrayList<>();
        for (SyntaxElement child : declaration.childNodesAndTokens()) {
            if (child instanceof SyntaxToken token && token.kind().isModifier()) {
                modifiers.add(token);
            }
        }
        return modifiers;
    }

    public static boolean hasModifier(SyntaxNode declaration, SyntaxKind modifier) {
        for (SyntaxToken token : modifiers(declaration)) {
            if (token.kind() == modifier) {
                return true;
            }
        }
        return false;
    }

    public static SyntaxNode block(SyntaxNode declaration) {
        return declaration.firstChildNode(SyntaxKind.BLOCK);
    }

    public static SyntaxNode expressionBody(SyntaxNode declaration) {
        return declaration.firstChildNode(SyntaxKind.ARROW_EXPRESSION_CLAUSE);
    }

    public static SyntaxNode arrowExpression(SyntaxNode arrowClause) {
        return arrowClause == null ? null : arrowClause.childNodeAfter(SyntaxKind.EQUALS_GREATER_THAN_TOKEN);
    }

    public static SyntaxNode initializer(SyntaxNode declaration) {
        return declaration.firstChildNode(SyntaxKind.EQUALS_VALUE_CLAUSE);
    }

    public static SyntaxNode initializerValue(SyntaxNode equalsValueClause) {
        return equalsValueClause == null ? null : equalsValueClause.childNodeAfter(SyntaxKind.EQUALS_TOKEN);
    }

    public static SyntaxNode accessorList(SyntaxNode declaration) {
        return declaration.firstChildNode(SyntaxKind.ACCESSOR_LIST);
    }

    /**
     * Accessor declarations of an accessor list, in declaration order.
     */
    public static List<SyntaxNode> accessors(SyntaxNode accessorList) {
        if (accessorList == null) {
            return List.of();
        }
        List<SyntaxNode> accessors = new ArrayList<>();
        for (SyntaxNode child : accessorList.childNodes()) {
            MemberKind member = MemberKind.of(child.kind());
            if (member != null && member.isAccessor()) {
                accessors.add(child);
            }
        }
        return accessors;
    }

    /**
     * Parameters of a declaration's parenthesized or bracketed parameter list.
     */
    public static List<SyntaxNode> parameters(SyntaxNode declaration) {
        SyntaxNode list = declaration.firstChildNode(SyntaxKind.PARAMETER_LIST);
        if (list == null) {
            list = declaration.firstChildNode(SyntaxKind.BRACKETED_PARAMETER_LIST);
        }
        return list == null ? List.of() : list.childNodes(SyntaxKind.PARAMETER);
    }

    public static List<SyntaxNode> typeParameters(SyntaxNode declaration) {
        SyntaxNode list = declaration.firstChildNode(SyntaxKind.TYPE_PARAMETER_LIST);
        return list == null ? List.of() : list.childNodes(SyntaxKind.TYPE_PARAMETER);
    }
}
