package com.encsyntax;

/**
 * Accessibility stated by a declaration's modifiers.
 *
 * <p>{@link #UNSPECIFIED} means no accessibility keyword was written. The default that
 * applies then depends on the enclosing declaration and is left to the caller.</p>
 */
public enum Accessibility {
    NON_PRIVATE,
    PRIVATE,
    UNSPECIFIED
}
