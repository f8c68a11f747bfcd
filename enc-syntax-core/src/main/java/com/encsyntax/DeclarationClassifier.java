package com.encsyntax;

import com.encsyntax.syntax.SyntaxKind;
import com.encsyntax.syntax.SyntaxNode;
import com.encsyntax.syntax.SyntaxToken;

import java.util.List;
import java.util.Objects;

/**
 * Predicates over declarations that decide whether an edit keeps a member's shape.
 */
public final class DeclarationClassifier {

    private DeclarationClassifier() {
        // Utility class
    }

    /**
     * Returns true for methods, operators, accessors, constructors and destructors.
     */
    public static boolean isMethodLike(SyntaxNode node) {
        MemberKind member = MemberKind.of(node.kind());
        return member != null && member.isMethodLike();
    }

    public static boolean isParameterlessConstructor(SyntaxNode node) {
        return node.isKind(SyntaxKind.CONSTRUCTOR_DECLARATION) && SyntaxLayout.parameters(node).isEmpty();
    }

    /**
     * Returns true if the compiler generates a backing field for the property, which is
     * the case for an auto-implemented property: no expression body and at least one
     * accessor without a body. Abstract and extern properties never have one.
     *
     * @throws IllegalArgumentException if the node is not a property declaration
     */
    public static boolean hasBackingField(SyntaxNode property) {
        if (!property.isKind(SyntaxKind.PROPERTY_DECLARATION)) {
            throw new IllegalArgumentException(property + " is not a property declaration");
        }
        if (SyntaxLayout.hasModifier(property, SyntaxKind.ABSTRACT_KEYWORD)
            || SyntaxLayout.hasModifier(property, SyntaxKind.EXTERN_KEYWORD)) {
            return false;
        }
        if (SyntaxLayout.expressionBody(property) != null) {
            return false;
        }
        for (SyntaxNode accessor : SyntaxLayout.accessors(SyntaxLayout.accessorList(property))) {
            if (SyntaxLayout.block(accessor) == null) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reads accessibility off a modifier list. The first accessibility keyword decides.
     *
     * @param modifiers modifier tokens in declaration order
     * @return {@link Accessibility#UNSPECIFIED} when no accessibility keyword is present
     */
    public static Accessibility accessibilityFromModifiers(List<SyntaxToken> modifiers) {
        for (SyntaxToken modifier : modifiers) {
            switch (modifier.kind()) {
                case PUBLIC_KEYWORD, PROTECTED_KEYWORD, INTERNAL_KEYWORD:
                    return Accessibility.NON_PRIVATE;
                case PRIVATE_KEYWORD:
                    return Accessibility.PRIVATE;
                default:
                    break;
            }
        }
        return Accessibility.UNSPECIFIED;
    }

    public static Accessibility accessibility(SyntaxNode declaration) {
        return accessibilityFromModifiers(SyntaxLayout.modifiers(declaration));
    }

    /**
     * Returns true for an async lambda or anonymous method, or for an async method given
     * either its declaration or its expression body clause.
     */
    public static boolean isAsyncMethodOrLambda(SyntaxNode node) {
        if ((node.isKind(SyntaxKind.PARENTHESIZED_LAMBDA_EXPRESSION)
            || node.isKind(SyntaxKind.SIMPLE_LAMBDA_EXPRESSION)
            || node.isKind(SyntaxKind.ANONYMOUS_METHOD_EXPRESSION))
            && node.hasChildToken(SyntaxKind.ASYNC_KEYWORD)) {
            return true;
        }

        SyntaxNode declaration = node;
        if (declaration.isKind(SyntaxKind.ARROW_EXPRESSION_CLAUSE)) {
            declaration = declaration.parent();
        }

        return declaration != null
            && declaration.isKind(SyntaxKind.METHOD_DECLARATION)
            && SyntaxLayout.hasModifier(declaration, SyntaxKind.ASYNC_KEYWORD);
    }

    /**
     * Returns true if a method declaration with a block body contains a yield statement
     * outside of any expression. Lambdas and expression-bodied members cannot be
     * iterators.
     */
    public static boolean isIteratorMethod(SyntaxNode declaration) {
        if (!declaration.isKind(SyntaxKind.METHOD_DECLARATION)) {
            return false;
        }
        SyntaxNode block = SyntaxLayout.block(declaration);
        return block != null && !ControlFlowFeatures.collectYieldStatements(block).isEmpty();
    }

    /**
     * Returns the modifiers of a field or property declaration, or {@code null} for any
     * other node.
     */
    public static List<SyntaxToken> fieldOrPropertyModifiers(SyntaxNode node) {
        if (node.isKind(SyntaxKind.FIELD_DECLARATION) || node.isKind(SyntaxKind.PROPERTY_DECLARATION)) {
            return SyntaxLayout.modifiers(node);
        }
        return null;
    }

    public static boolean hasTypeParameters(SyntaxNode declaration) {
        return !SyntaxLayout.typeParameters(Objects.requireNonNull(declaration, "declaration")).isEmpty();
    }
}
