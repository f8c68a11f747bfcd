package com.encsyntax.syntax;

/**
 * Closed set of kinds for syntax nodes and tokens.
 *
 * <p>Every kind belongs to a {@link Category}. Punctuation and keyword tokens carry
 * their fixed source text; tokens whose text varies (identifiers, literals) have
 * {@code null} text. Modifier keywords are flagged so declarations can pick their
 * modifier tokens out of their children.</p>
 */
public enum SyntaxKind {
    // ========================================================================
    // Punctuation
    // ========================================================================
    OPEN_BRACE_TOKEN("{"),
    CLOSE_BRACE_TOKEN("}"),
    OPEN_PAREN_TOKEN("("),
    CLOSE_PAREN_TOKEN(")"),
    OPEN_BRACKET_TOKEN("["),
    CLOSE_BRACKET_TOKEN("]"),
    SEMICOLON_TOKEN(";"),
    COMMA_TOKEN(","),
    DOT_TOKEN("."),
    COLON_TOKEN(":"),
    TILDE_TOKEN("~"),
    EQUALS_TOKEN("="),
    EQUALS_EQUALS_TOKEN("=="),
    EQUALS_GREATER_THAN_TOKEN("=>"),
    PLUS_TOKEN("+"),
    MINUS_TOKEN("-"),
    ASTERISK_TOKEN("*"),
    LESS_THAN_TOKEN("<"),
    GREATER_THAN_TOKEN(">"),

    // ========================================================================
    // Tokens with variable text
    // ========================================================================
    IDENTIFIER_TOKEN(Category.TOKEN, null, false),
    NUMERIC_LITERAL_TOKEN(Category.TOKEN, null, false),
    STRING_LITERAL_TOKEN(Category.TOKEN, null, false),

    // ========================================================================
    // Modifier keywords
    // ========================================================================
    PUBLIC_KEYWORD(Category.TOKEN, "public", true),
    PROTECTED_KEYWORD(Category.TOKEN, "protected", true),
    INTERNAL_KEYWORD(Category.TOKEN, "internal", true),
    PRIVATE_KEYWORD(Category.TOKEN, "private", true),
    STATIC_KEYWORD(Category.TOKEN, "static", true),
    ABSTRACT_KEYWORD(Category.TOKEN, "abstract", true),
    EXTERN_KEYWORD(Category.TOKEN, "extern", true),
    VIRTUAL_KEYWORD(Category.TOKEN, "virtual", true),
    OVERRIDE_KEYWORD(Category.TOKEN, "override", true),
    SEALED_KEYWORD(Category.TOKEN, "sealed", true),
    READONLY_KEYWORD(Category.TOKEN, "readonly", true),
    UNSAFE_KEYWORD(Category.TOKEN, "unsafe", true),
    PARTIAL_KEYWORD(Category.TOKEN, "partial", true),
    ASYNC_KEYWORD(Category.TOKEN, "async", true),

    // ========================================================================
    // Other keywords
    // ========================================================================
    CLASS_KEYWORD("class"),
    EVENT_KEYWORD("event"),
    VOID_KEYWORD("void"),
    INT_KEYWORD("int"),
    STRING_KEYWORD("string"),
    BOOL_KEYWORD("bool"),
    OBJECT_KEYWORD("object"),
    OPERATOR_KEYWORD("operator"),
    IMPLICIT_KEYWORD("implicit"),
    EXPLICIT_KEYWORD("explicit"),
    THIS_KEYWORD("this"),
    NEW_KEYWORD("new"),
    TRUE_KEYWORD("true"),
    FALSE_KEYWORD("false"),
    NULL_KEYWORD("null"),
    GET_KEYWORD("get"),
    SET_KEYWORD("set"),
    ADD_KEYWORD("add"),
    REMOVE_KEYWORD("remove"),
    RETURN_KEYWORD("return"),
    YIELD_KEYWORD("yield"),
    BREAK_KEYWORD("break"),
    IF_KEYWORD("if"),
    ELSE_KEYWORD("else"),
    WHILE_KEYWORD("while"),
    FOREACH_KEYWORD("foreach"),
    IN_KEYWORD("in"),
    TRY_KEYWORD("try"),
    CATCH_KEYWORD("catch"),
    FINALLY_KEYWORD("finally"),
    THROW_KEYWORD("throw"),
    SWITCH_KEYWORD("switch"),
    CASE_KEYWORD("case"),
    DEFAULT_KEYWORD("default"),
    AWAIT_KEYWORD("await"),
    DELEGATE_KEYWORD("delegate"),
    FROM_KEYWORD("from"),
    LET_KEYWORD("let"),
    WHERE_KEYWORD("where"),
    ORDERBY_KEYWORD("orderby"),
    ASCENDING_KEYWORD("ascending"),
    DESCENDING_KEYWORD("descending"),
    SELECT_KEYWORD("select"),
    JOIN_KEYWORD("join"),
    ON_KEYWORD("on"),
    EQUALS_KEYWORD("equals"),
    INTO_KEYWORD("into"),
    GROUP_KEYWORD("group"),
    BY_KEYWORD("by"),

    // ========================================================================
    // Structure
    // ========================================================================
    COMPILATION_UNIT(Category.OTHER),
    CLASS_DECLARATION(Category.OTHER),
    ATTRIBUTE_LIST(Category.OTHER),
    PARAMETER_LIST(Category.OTHER),
    BRACKETED_PARAMETER_LIST(Category.OTHER),
    PARAMETER(Category.OTHER),
    TYPE_PARAMETER_LIST(Category.OTHER),
    TYPE_PARAMETER(Category.OTHER),
    ARGUMENT_LIST(Category.OTHER),
    ARGUMENT(Category.OTHER),
    ACCESSOR_LIST(Category.OTHER),
    ARROW_EXPRESSION_CLAUSE(Category.OTHER),
    EQUALS_VALUE_CLAUSE(Category.OTHER),
    VARIABLE_DECLARATION(Category.OTHER),
    VARIABLE_DECLARATOR(Category.OTHER),
    ELSE_CLAUSE(Category.OTHER),
    CATCH_CLAUSE(Category.OTHER),
    FINALLY_CLAUSE(Category.OTHER),
    SWITCH_SECTION(Category.OTHER),
    CASE_SWITCH_LABEL(Category.OTHER),
    DEFAULT_SWITCH_LABEL(Category.OTHER),
    QUERY_BODY(Category.OTHER),

    // ========================================================================
    // Member declarations
    // ========================================================================
    METHOD_DECLARATION(Category.MEMBER),
    CONVERSION_OPERATOR_DECLARATION(Category.MEMBER),
    OPERATOR_DECLARATION(Category.MEMBER),
    CONSTRUCTOR_DECLARATION(Category.MEMBER),
    DESTRUCTOR_DECLARATION(Category.MEMBER),
    PROPERTY_DECLARATION(Category.MEMBER),
    INDEXER_DECLARATION(Category.MEMBER),
    EVENT_DECLARATION(Category.MEMBER),
    FIELD_DECLARATION(Category.MEMBER),
    GET_ACCESSOR_DECLARATION(Category.MEMBER),
    SET_ACCESSOR_DECLARATION(Category.MEMBER),
    ADD_ACCESSOR_DECLARATION(Category.MEMBER),
    REMOVE_ACCESSOR_DECLARATION(Category.MEMBER),

    // ========================================================================
    // Types
    // ========================================================================
    PREDEFINED_TYPE(Category.TYPE),
    GENERIC_NAME(Category.TYPE),

    // ========================================================================
    // Statements
    // ========================================================================
    BLOCK(Category.STATEMENT),
    LOCAL_DECLARATION_STATEMENT(Category.STATEMENT),
    EXPRESSION_STATEMENT(Category.STATEMENT),
    RETURN_STATEMENT(Category.STATEMENT),
    YIELD_RETURN_STATEMENT(Category.STATEMENT),
    YIELD_BREAK_STATEMENT(Category.STATEMENT),
    BREAK_STATEMENT(Category.STATEMENT),
    IF_STATEMENT(Category.STATEMENT),
    WHILE_STATEMENT(Category.STATEMENT),
    FOREACH_STATEMENT(Category.STATEMENT),
    TRY_STATEMENT(Category.STATEMENT),
    THROW_STATEMENT(Category.STATEMENT),
    SWITCH_STATEMENT(Category.STATEMENT),
    EMPTY_STATEMENT(Category.STATEMENT),

    // ========================================================================
    // Expressions
    // ========================================================================
    IDENTIFIER_NAME(Category.EXPRESSION),
    NUMERIC_LITERAL_EXPRESSION(Category.EXPRESSION),
    STRING_LITERAL_EXPRESSION(Category.EXPRESSION),
    TRUE_LITERAL_EXPRESSION(Category.EXPRESSION),
    FALSE_LITERAL_EXPRESSION(Category.EXPRESSION),
    NULL_LITERAL_EXPRESSION(Category.EXPRESSION),
    THIS_EXPRESSION(Category.EXPRESSION),
    PARENTHESIZED_EXPRESSION(Category.EXPRESSION),
    INVOCATION_EXPRESSION(Category.EXPRESSION),
    SIMPLE_MEMBER_ACCESS_EXPRESSION(Category.EXPRESSION),
    OBJECT_CREATION_EXPRESSION(Category.EXPRESSION),
    ADD_EXPRESSION(Category.EXPRESSION),
    SUBTRACT_EXPRESSION(Category.EXPRESSION),
    MULTIPLY_EXPRESSION(Category.EXPRESSION),
    LESS_THAN_EXPRESSION(Category.EXPRESSION),
    GREATER_THAN_EXPRESSION(Category.EXPRESSION),
    EQUALS_EXPRESSION(Category.EXPRESSION),
    SIMPLE_ASSIGNMENT_EXPRESSION(Category.EXPRESSION),
    AWAIT_EXPRESSION(Category.EXPRESSION),
    PARENTHESIZED_LAMBDA_EXPRESSION(Category.EXPRESSION),
    SIMPLE_LAMBDA_EXPRESSION(Category.EXPRESSION),
    ANONYMOUS_METHOD_EXPRESSION(Category.EXPRESSION),
    QUERY_EXPRESSION(Category.EXPRESSION),

    // ========================================================================
    // Query clauses
    // ========================================================================
    FROM_CLAUSE(Category.CLAUSE),
    LET_CLAUSE(Category.CLAUSE),
    WHERE_CLAUSE(Category.CLAUSE),
    ORDER_BY_CLAUSE(Category.CLAUSE),
    ASCENDING_ORDERING(Category.CLAUSE),
    DESCENDING_ORDERING(Category.CLAUSE),
    SELECT_CLAUSE(Category.CLAUSE),
    JOIN_CLAUSE(Category.CLAUSE),
    GROUP_CLAUSE(Category.CLAUSE);

    /**
     * Broad grouping of kinds.
     */
    public enum Category {
        TOKEN,
        EXPRESSION,
        TYPE,
        STATEMENT,
        MEMBER,
        CLAUSE,
        OTHER
    }

    private final Category category;
    private final String text;
    private final boolean modifier;

    SyntaxKind(String text) {
        this(Category.TOKEN, text, false);
    }

    SyntaxKind(Category category) {
        this(category, null, false);
    }

    SyntaxKind(Category category, String text, boolean modifier) {
        this.category = category;
        this.text = text;
        this.modifier = modifier;
    }

    public Category category() {
        return category;
    }

    /**
     * Returns the fixed source text of a punctuation or keyword token, or {@code null}
     * for nodes and for tokens whose text varies.
     */
    public String text() {
        return text;
    }

    public boolean isToken() {
        return category == Category.TOKEN;
    }

    public boolean isModifier() {
        return modifier;
    }

    /**
     * Type syntax counts as expression syntax, so a walk that stops at expressions
     * also stops at types.
     */
    public boolean isExpression() {
        return category == Category.EXPRESSION || category == Category.TYPE;
    }

    public boolean isStatement() {
        return category == Category.STATEMENT;
    }
}
