package com.encsyntax;

import com.encsyntax.syntax.GreenNode;
import com.encsyntax.syntax.SyntaxKind;
import com.encsyntax.syntax.SyntaxNode;
import com.encsyntax.syntax.SyntaxToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.encsyntax.CSharpSyntax.*;
import static com.encsyntax.syntax.SyntaxFactory.*;
import static org.junit.jupiter.api.Assertions.*;

public class TreePartnerMatcherTest {

    // class C {int M(){return <literal>;}int N(){return x+2;}}
    private static GreenNode twoMethods(String literal) {
        return classDeclaration("C",
            method(modifiers(), "M", block(returnStatement(num(literal)))),
            method(modifiers(), "N", block(returnStatement(add(id("x"), num("2"))))));
    }

    @Test
    @DisplayName("Identical trees partner every node with its twin")
    void testIdentity() {
        SyntaxNode oldRoot = parse(twoMethods("1"));
        SyntaxNode newRoot = parse(twoMethods("1"));

        for (SyntaxNode oldNode : oldRoot.descendantNodesAndSelf(n -> true)) {
            SyntaxNode partner = TreePartnerMatcher.findPartner(oldRoot, newRoot, oldNode);

            assertEquals(oldNode.kind(), partner.kind());
            assertEquals(oldNode.fullSpan(), partner.fullSpan(), oldNode.toString());
            assertSame(newRoot.syntaxTree(), partner.syntaxTree());
            assertSame(oldNode, TreePartnerMatcher.findPartner(oldRoot, oldRoot, oldNode));
        }
    }

    @Test
    @DisplayName("Nodes after an edit map to their shifted counterparts")
    void testPartnerAfterEdit() {
        SyntaxNode oldRoot = parse(twoMethods("1"));
        SyntaxNode newRoot = parse(twoMethods("12345"));
        SyntaxNode oldAdd = first(oldRoot, SyntaxKind.ADD_EXPRESSION);

        SyntaxNode partner = TreePartnerMatcher.findPartner(oldRoot, newRoot, oldAdd);

        assertEquals(SyntaxKind.ADD_EXPRESSION, partner.kind());
        assertEquals("x+2", partner.toFullString());
        assertEquals(oldAdd.spanStart() + 4, partner.spanStart());
        assertSame(first(newRoot, SyntaxKind.ADD_EXPRESSION), partner);
    }

    @Test
    void testPartnerWithinSubtree() {
        SyntaxNode oldRoot = parse(twoMethods("1"));
        SyntaxNode newRoot = parse(twoMethods("12345"));
        SyntaxNode oldMethod = all(oldRoot, SyntaxKind.METHOD_DECLARATION).get(1);
        SyntaxNode newMethod = all(newRoot, SyntaxKind.METHOD_DECLARATION).get(1);
        SyntaxNode oldLiteral = all(oldMethod, SyntaxKind.NUMERIC_LITERAL_EXPRESSION).get(0);

        SyntaxNode partner = TreePartnerMatcher.findPartner(oldMethod, newMethod, oldLiteral);

        assertSame(all(newMethod, SyntaxKind.NUMERIC_LITERAL_EXPRESSION).get(0), partner);
        assertSame(newMethod, TreePartnerMatcher.findPartner(oldMethod, newMethod, oldMethod));
    }

    @Test
    @DisplayName("The edited literal itself still has a partner of the same kind")
    void testPartnerOfEditedNode() {
        SyntaxNode oldRoot = parse(twoMethods("1"));
        SyntaxNode newRoot = parse(twoMethods("12345"));

        SyntaxNode partner = TreePartnerMatcher.findPartner(oldRoot, newRoot,
            first(oldRoot, SyntaxKind.NUMERIC_LITERAL_EXPRESSION));

        assertEquals("12345", partner.toFullString());
    }

    // ==================== Faults ====================

    @Test
    void testKindMismatch() {
        SyntaxNode oldRoot = parse(method(modifiers(), "M", block(returnStatement(num("1")))));
        SyntaxNode newRoot = parse(method(modifiers(), "M", block(returnStatement(id("x")))));

        SyntaxConsistencyException e = assertThrows(SyntaxConsistencyException.class,
            () -> TreePartnerMatcher.findPartner(oldRoot, newRoot, first(oldRoot, SyntaxKind.NUMERIC_LITERAL_EXPRESSION)));
        assertTrue(e.getMessage().contains("Kind mismatch"));
    }

    @Test
    void testRootKindMismatch() {
        SyntaxNode oldRoot = parse(block(returnStatement(num("1"))));
        SyntaxNode newRoot = parse(method(modifiers(), "M", block(returnStatement(num("1")))));

        assertThrows(SyntaxConsistencyException.class,
            () -> TreePartnerMatcher.findPartner(oldRoot, newRoot, oldRoot));
    }

    @Test
    @DisplayName("Zero-width nodes have no partner")
    void testZeroWidthNode() {
        SyntaxNode oldRoot = parse(node(SyntaxKind.COMPILATION_UNIT,
            missingNode(SyntaxKind.ATTRIBUTE_LIST),
            node(SyntaxKind.EMPTY_STATEMENT, token(SyntaxKind.SEMICOLON_TOKEN))));
        SyntaxNode missing = oldRoot.childNodes().get(0);

        SyntaxConsistencyException e = assertThrows(SyntaxConsistencyException.class,
            () -> TreePartnerMatcher.findPartner(oldRoot, oldRoot, missing));
        assertTrue(e.getMessage().contains("zero-width"));
        assertSame(oldRoot.childNodes().get(1),
            TreePartnerMatcher.findPartner(oldRoot, oldRoot, oldRoot.childNodes().get(1)));
    }

    @Test
    void testNodeOutsideRoot() {
        SyntaxNode oldRoot = parse(twoMethods("1"));
        SyntaxNode firstMethod = all(oldRoot, SyntaxKind.METHOD_DECLARATION).get(0);
        SyntaxNode secondMethod = all(oldRoot, SyntaxKind.METHOD_DECLARATION).get(1);

        assertThrows(SyntaxConsistencyException.class,
            () -> TreePartnerMatcher.findPartner(firstMethod, firstMethod, secondMethod));
        assertThrows(SyntaxConsistencyException.class,
            () -> TreePartnerMatcher.findPartner(oldRoot, oldRoot, parse(twoMethods("1"))));
    }

    @Test
    @DisplayName("A new tree missing children is a fault, not an index error")
    void testMissingNewChild() {
        SyntaxNode oldRoot = parse(block(statement(id("a")), statement(id("b"))));
        SyntaxNode newRoot = parse(block(statement(id("a"))));

        assertThrows(SyntaxConsistencyException.class,
            () -> TreePartnerMatcher.findPartner(oldRoot, newRoot, all(oldRoot, SyntaxKind.EXPRESSION_STATEMENT).get(1)));
    }

    // ==================== Leaves ====================

    @Test
    @DisplayName("Every offset finds the token containing it and its twin")
    void testLeafAtEveryOffset() {
        SyntaxNode oldRoot = parse(twoMethods("1"));
        SyntaxNode newRoot = parse(twoMethods("1"));

        for (int position = 0; position < oldRoot.fullSpan().length(); position++) {
            TreePartnerMatcher.LeafPartner leaf = TreePartnerMatcher.findLeafNodeAndPartner(oldRoot, position, newRoot);

            assertTrue(leaf.oldLeaf().fullSpan().contains(position), "offset " + position);
            assertSame(oldRoot.syntaxTree(), leaf.oldLeaf().syntaxTree());
            assertSame(newRoot.syntaxTree(), leaf.newLeaf().syntaxTree());
            assertEquals(leaf.oldLeaf().kind(), leaf.newLeaf().kind());
            assertEquals(leaf.oldLeaf().fullSpan(), leaf.newLeaf().fullSpan());
        }
    }

    @Test
    void testLeafAfterEdit() {
        SyntaxNode oldRoot = parse(twoMethods("1"));
        SyntaxNode newRoot = parse(twoMethods("12345"));
        SyntaxToken oldX = first(oldRoot, SyntaxKind.ADD_EXPRESSION).childNodes().get(0).childTokens().get(0);

        TreePartnerMatcher.LeafPartner leaf = TreePartnerMatcher.findLeafNodeAndPartner(oldRoot, oldX.spanStart(), newRoot);

        assertSame(oldX, leaf.oldLeaf());
        assertEquals("x", leaf.newLeaf().text());
        assertEquals(oldX.spanStart() + 4, leaf.newLeaf().spanStart());
    }

    @Test
    void testLeafKindMismatch() {
        SyntaxNode oldRoot = parse(statement(id("x")));
        SyntaxNode newRoot = parse(node(SyntaxKind.EXPRESSION_STATEMENT,
            node(SyntaxKind.IDENTIFIER_NAME, numericLiteral("1")), token(SyntaxKind.SEMICOLON_TOKEN)));

        assertThrows(SyntaxConsistencyException.class,
            () -> TreePartnerMatcher.findLeafNodeAndPartner(oldRoot, 0, newRoot));
    }

    @Test
    void testLeafPositionOutOfRange() {
        SyntaxNode oldRoot = parse(twoMethods("1"));
        int length = oldRoot.fullSpan().length();

        assertThrows(IllegalArgumentException.class,
            () -> TreePartnerMatcher.findLeafNodeAndPartner(oldRoot, length, oldRoot));
        assertThrows(IllegalArgumentException.class,
            () -> TreePartnerMatcher.findLeafNodeAndPartner(oldRoot, -1, oldRoot));
    }
}
