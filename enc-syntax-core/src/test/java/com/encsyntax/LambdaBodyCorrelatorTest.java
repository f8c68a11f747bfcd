package com.encsyntax;

import com.encsyntax.syntax.SyntaxKind;
import com.encsyntax.syntax.SyntaxNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.encsyntax.CSharpSyntax.*;
import static org.junit.jupiter.api.Assertions.*;

public class LambdaBodyCorrelatorTest {

    // from a in xs join b in ys on a equals b let c = a where c group a by c
    private static SyntaxNode queryWith(String left, String right, String groupBy) {
        return parse(query(
            from("a", id("xs")),
            join("b", id("ys"), id(left), id(right)),
            let("c", id("a")),
            where(id("c")),
            orderBy(ascending(id("a")), descending(id("b"))),
            group(id("a"), id(groupBy))));
    }

    @Test
    @DisplayName("Join left body maps to the new join's left expression")
    void testJoinLeft() {
        SyntaxNode oldQuery = queryWith("a", "b", "c");
        SyntaxNode newQuery = queryWith("k1", "k2", "c");
        SyntaxNode oldJoin = first(oldQuery, SyntaxKind.JOIN_CLAUSE);
        SyntaxNode newJoin = first(newQuery, SyntaxKind.JOIN_CLAUSE);
        SyntaxNode oldLeft = oldJoin.childNodeAfter(SyntaxKind.ON_KEYWORD);

        SyntaxNode partner = LambdaBodyCorrelator.getPartnerBody(oldLeft, newJoin);

        assertEquals("k1", partner.toFullString().trim());
        assertNotSame(newJoin.childNodeAfter(SyntaxKind.EQUALS_KEYWORD), partner);
    }

    @Test
    void testJoinRight() {
        SyntaxNode oldJoin = first(queryWith("a", "b", "c"), SyntaxKind.JOIN_CLAUSE);
        SyntaxNode newJoin = first(queryWith("k1", "k2", "c"), SyntaxKind.JOIN_CLAUSE);
        SyntaxNode oldRight = oldJoin.childNodeAfter(SyntaxKind.EQUALS_KEYWORD);

        assertEquals("k2", LambdaBodyCorrelator.getPartnerBody(oldRight, newJoin).toFullString().trim());
    }

    @Test
    @DisplayName("Identical join expressions are told apart by side, not by text")
    void testJoinWithEqualSides() {
        SyntaxNode oldJoin = first(queryWith("a", "a", "c"), SyntaxKind.JOIN_CLAUSE);
        SyntaxNode newJoin = first(queryWith("a", "a", "c"), SyntaxKind.JOIN_CLAUSE);

        assertSame(newJoin.childNodeAfter(SyntaxKind.ON_KEYWORD),
            LambdaBodyCorrelator.getPartnerBody(oldJoin.childNodeAfter(SyntaxKind.ON_KEYWORD), newJoin));
        assertSame(newJoin.childNodeAfter(SyntaxKind.EQUALS_KEYWORD),
            LambdaBodyCorrelator.getPartnerBody(oldJoin.childNodeAfter(SyntaxKind.EQUALS_KEYWORD), newJoin));
    }

    @Test
    void testGroupSides() {
        SyntaxNode oldGroup = first(queryWith("a", "b", "c"), SyntaxKind.GROUP_CLAUSE);
        SyntaxNode newGroup = first(queryWith("a", "b", "d"), SyntaxKind.GROUP_CLAUSE);

        SyntaxNode groupPartner = LambdaBodyCorrelator.getPartnerBody(
            oldGroup.childNodeAfter(SyntaxKind.GROUP_KEYWORD), newGroup);
        SyntaxNode byPartner = LambdaBodyCorrelator.getPartnerBody(
            oldGroup.childNodeAfter(SyntaxKind.BY_KEYWORD), newGroup);

        assertSame(newGroup.childNodeAfter(SyntaxKind.GROUP_KEYWORD), groupPartner);
        assertEquals("d", byPartner.toFullString().trim());
    }

    @Test
    void testSingleExpressionClauses() {
        SyntaxNode oldQuery = queryWith("a", "b", "c");
        SyntaxNode newQuery = queryWith("a", "b", "c");

        for (SyntaxKind kind : List.of(SyntaxKind.FROM_CLAUSE, SyntaxKind.LET_CLAUSE, SyntaxKind.WHERE_CLAUSE,
                                       SyntaxKind.ASCENDING_ORDERING, SyntaxKind.DESCENDING_ORDERING)) {
            SyntaxNode oldClause = first(oldQuery, kind);
            SyntaxNode newClause = first(newQuery, kind);
            SyntaxNode oldBody = LambdaBodyCorrelator.getLambdaBodies(oldClause).get(0);

            SyntaxNode partner = LambdaBodyCorrelator.getPartnerBody(oldBody, newClause);

            assertSame(LambdaBodyCorrelator.getLambdaBodies(newClause).get(0), partner, kind.toString());
            assertEquals(oldBody.toFullString(), partner.toFullString());
        }
    }

    @Test
    @DisplayName("Ascending and descending orderings correlate with each other")
    void testOrderingDirectionChange() {
        SyntaxNode oldOrdering = first(parse(query(from("a", id("xs")), orderBy(ascending(id("a"))), select(id("a")))),
            SyntaxKind.ASCENDING_ORDERING);
        SyntaxNode newOrdering = first(parse(query(from("a", id("xs")), orderBy(descending(id("a"))), select(id("a")))),
            SyntaxKind.DESCENDING_ORDERING);

        SyntaxNode partner = LambdaBodyCorrelator.getPartnerBody(oldOrdering.childNodes().get(0), newOrdering);

        assertSame(newOrdering.childNodes().get(0), partner);
    }

    @Test
    void testSelectClause() {
        SyntaxNode oldSelect = parse(select(id("a")));
        SyntaxNode newSelect = parse(select(add(id("a"), CSharpSyntax.num("1"))));

        SyntaxNode partner = LambdaBodyCorrelator.getPartnerBody(oldSelect.childNodeAfter(SyntaxKind.SELECT_KEYWORD), newSelect);

        assertEquals(SyntaxKind.ADD_EXPRESSION, partner.kind());
    }

    @Test
    void testLambdaForms() {
        SyntaxNode oldLambda = parse(parenthesizedLambda(false, id("x")));
        SyntaxNode newParenthesized = parse(parenthesizedLambda(true, block()));
        SyntaxNode newSimple = parse(simpleLambda(false, "p", id("p")));
        SyntaxNode newAnonymous = parse(anonymousMethod(false, block()));
        SyntaxNode oldBody = LambdaBodyCorrelator.getLambdaBodies(oldLambda).get(0);

        assertEquals(SyntaxKind.BLOCK, LambdaBodyCorrelator.getPartnerBody(oldBody, newParenthesized).kind());
        assertEquals(SyntaxKind.IDENTIFIER_NAME, LambdaBodyCorrelator.getPartnerBody(oldBody, newSimple).kind());
        assertSame(newAnonymous.firstChildNode(SyntaxKind.BLOCK), LambdaBodyCorrelator.getPartnerBody(oldBody, newAnonymous));
    }

    // ==================== Consistency faults ====================

    @Test
    @DisplayName("Correlating a join body with a where clause is a consistency fault")
    void testMismatchedFamilies() {
        SyntaxNode oldQuery = queryWith("a", "b", "c");
        SyntaxNode oldLeft = first(oldQuery, SyntaxKind.JOIN_CLAUSE).childNodeAfter(SyntaxKind.ON_KEYWORD);
        SyntaxNode newWhere = first(queryWith("a", "b", "c"), SyntaxKind.WHERE_CLAUSE);

        SyntaxConsistencyException e = assertThrows(SyntaxConsistencyException.class,
            () -> LambdaBodyCorrelator.getPartnerBody(oldLeft, newWhere));
        assertTrue(e.getMessage().contains("different lambda shapes"));
    }

    @Test
    void testLambdaBodyAgainstQueryClause() {
        SyntaxNode oldLambda = parse(simpleLambda(false, "x", id("x")));
        SyntaxNode newSelect = parse(select(id("x")));

        assertThrows(SyntaxConsistencyException.class,
            () -> LambdaBodyCorrelator.getPartnerBody(LambdaBodyCorrelator.getLambdaBodies(oldLambda).get(0), newSelect));
        assertThrows(SyntaxConsistencyException.class,
            () -> LambdaBodyCorrelator.getPartnerBody(LambdaBodyCorrelator.getLambdaBodies(oldLambda).get(0), parse(block())));
    }

    @Test
    void testOldBodyOutsideLambda() {
        SyntaxNode method = parse(method(modifiers(), "M", block()));

        assertThrows(SyntaxConsistencyException.class,
            () -> LambdaBodyCorrelator.getPartnerBody(method.firstChildNode(SyntaxKind.BLOCK), method));
        assertThrows(SyntaxConsistencyException.class,
            () -> LambdaBodyCorrelator.getPartnerBody(method, method));
    }

    @Test
    @DisplayName("The source of a join is not one of its bodies")
    void testJoinSourceIsNotABody() {
        SyntaxNode oldJoin = first(queryWith("a", "b", "c"), SyntaxKind.JOIN_CLAUSE);
        SyntaxNode newJoin = first(queryWith("a", "b", "c"), SyntaxKind.JOIN_CLAUSE);

        assertThrows(SyntaxConsistencyException.class,
            () -> LambdaBodyCorrelator.getPartnerBody(oldJoin.childNodeAfter(SyntaxKind.IN_KEYWORD), newJoin));
    }

    // ==================== Shapes ====================

    @Test
    void testLambdaShapes() {
        SyntaxNode query = queryWith("a", "b", "c");

        assertTrue(LambdaBodyCorrelator.isLambdaShape(SyntaxKind.FROM_CLAUSE));
        assertTrue(LambdaBodyCorrelator.isLambdaShape(SyntaxKind.ANONYMOUS_METHOD_EXPRESSION));
        assertFalse(LambdaBodyCorrelator.isLambdaShape(SyntaxKind.ORDER_BY_CLAUSE));
        assertFalse(LambdaBodyCorrelator.isLambdaShape(SyntaxKind.QUERY_EXPRESSION));
        assertTrue(LambdaBodyCorrelator.isNotLambdaShape(query));

        assertEquals(2, LambdaBodyCorrelator.getLambdaBodies(first(query, SyntaxKind.JOIN_CLAUSE)).size());
        assertEquals(2, LambdaBodyCorrelator.getLambdaBodies(first(query, SyntaxKind.GROUP_CLAUSE)).size());
        assertEquals(1, LambdaBodyCorrelator.getLambdaBodies(first(query, SyntaxKind.LET_CLAUSE)).size());
        assertThrows(IllegalArgumentException.class, () -> LambdaBodyCorrelator.getLambdaBodies(query));
    }
}
