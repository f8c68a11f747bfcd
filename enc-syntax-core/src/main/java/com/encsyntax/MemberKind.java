package com.encsyntax;

import com.encsyntax.syntax.SyntaxKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Declaration kinds that own an executable body.
 */
public enum MemberKind {
    METHOD(SyntaxKind.METHOD_DECLARATION),
    CONVERSION_OPERATOR(SyntaxKind.CONVERSION_OPERATOR_DECLARATION),
    OPERATOR(SyntaxKind.OPERATOR_DECLARATION),
    GET_ACCESSOR(SyntaxKind.GET_ACCESSOR_DECLARATION),
    SET_ACCESSOR(SyntaxKind.SET_ACCESSOR_DECLARATION),
    ADD_ACCESSOR(SyntaxKind.ADD_ACCESSOR_DECLARATION),
    REMOVE_ACCESSOR(SyntaxKind.REMOVE_ACCESSOR_DECLARATION),
    CONSTRUCTOR(SyntaxKind.CONSTRUCTOR_DECLARATION),
    DESTRUCTOR(SyntaxKind.DESTRUCTOR_DECLARATION),
    PROPERTY(SyntaxKind.PROPERTY_DECLARATION),
    INDEXER(SyntaxKind.INDEXER_DECLARATION);

    private static final Map<SyntaxKind, MemberKind> BY_SYNTAX_KIND = new EnumMap<>(SyntaxKind.class);

    static {
        for (MemberKind member : values()) {
            BY_SYNTAX_KIND.put(member.syntaxKind, member);
        }
    }

    private final SyntaxKind syntaxKind;

    MemberKind(SyntaxKind syntaxKind) {
        this.syntaxKind = syntaxKind;
    }

    public SyntaxKind syntaxKind() {
        return syntaxKind;
    }

    /**
     * Returns the member kind for a syntax kind, or {@code null} if the kind does not
     * declare a member with a body.
     */
    public static MemberKind of(SyntaxKind kind) {
        return BY_SYNTAX_KIND.get(kind);
    }

    public boolean isMethodLike() {
        return switch (this) {
            case METHOD, CONVERSION_OPERATOR, OPERATOR,
                 GET_ACCESSOR, SET_ACCESSOR, ADD_ACCESSOR, REMOVE_ACCESSOR,
                 CONSTRUCTOR, DESTRUCTOR -> true;
            case PROPERTY, INDEXER -> false;
        };
    }

    public boolean isAccessor() {
        return switch (this) {
            case GET_ACCESSOR, SET_ACCESSOR, ADD_ACCESSOR, REMOVE_ACCESSOR -> true;
            case METHOD, CONVERSION_OPERATOR, OPERATOR, CONSTRUCTOR, DESTRUCTOR,
                 PROPERTY, INDEXER -> false;
        };
    }
}
