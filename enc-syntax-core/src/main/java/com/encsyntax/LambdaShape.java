package com.encsyntax;

import com.encsyntax.syntax.SyntaxKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Syntax that implicitly introduces a nested executable scope: the lambda forms and the
 * query clauses.
 *
 * <p>A from clause only becomes a lambda inside a query body, but for matching purposes
 * every from clause is treated the same.</p>
 */
public enum LambdaShape {
    PARENTHESIZED_LAMBDA(SyntaxKind.PARENTHESIZED_LAMBDA_EXPRESSION, Family.LAMBDA),
    SIMPLE_LAMBDA(SyntaxKind.SIMPLE_LAMBDA_EXPRESSION, Family.LAMBDA),
    ANONYMOUS_METHOD(SyntaxKind.ANONYMOUS_METHOD_EXPRESSION, Family.LAMBDA),
    FROM(SyntaxKind.FROM_CLAUSE, Family.FROM),
    LET(SyntaxKind.LET_CLAUSE, Family.LET),
    WHERE(SyntaxKind.WHERE_CLAUSE, Family.WHERE),
    ASCENDING_ORDERING(SyntaxKind.ASCENDING_ORDERING, Family.ORDERING),
    DESCENDING_ORDERING(SyntaxKind.DESCENDING_ORDERING, Family.ORDERING),
    SELECT(SyntaxKind.SELECT_CLAUSE, Family.SELECT),
    JOIN(SyntaxKind.JOIN_CLAUSE, Family.JOIN),
    GROUP(SyntaxKind.GROUP_CLAUSE, Family.GROUP);

    /**
     * Shapes whose bodies correspond to each other across versions.
     */
    public enum Family {
        LAMBDA,
        FROM,
        LET,
        WHERE,
        ORDERING,
        SELECT,
        JOIN,
        GROUP
    }

    private static final Map<SyntaxKind, LambdaShape> BY_SYNTAX_KIND = new EnumMap<>(SyntaxKind.class);

    static {
        for (LambdaShape shape : values()) {
            BY_SYNTAX_KIND.put(shape.syntaxKind, shape);
        }
    }

    private final SyntaxKind syntaxKind;
    private final Family family;

    LambdaShape(SyntaxKind syntaxKind, Family family) {
        this.syntaxKind = syntaxKind;
        this.family = family;
    }

    public SyntaxKind syntaxKind() {
        return syntaxKind;
    }

    public Family family() {
        return family;
    }

    /**
     * Returns the shape of a syntax kind, or {@code null} if the kind does not
     * introduce a nested scope.
     */
    public static LambdaShape of(SyntaxKind kind) {
        return BY_SYNTAX_KIND.get(kind);
    }

    public static boolean isLambdaShape(SyntaxKind kind) {
        return BY_SYNTAX_KIND.containsKey(kind);
    }
}
