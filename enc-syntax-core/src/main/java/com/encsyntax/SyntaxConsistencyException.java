package com.encsyntax;

/**
 * Thrown when old and new trees handed to a matching or correlation operation are not
 * structurally congruent where they must be, or when a caller passes a node the
 * operation cannot handle by contract.
 *
 * <p>This is never an expected outcome: it means the caller mixed unrelated snapshots
 * or mismatched nodes, and the current operation cannot continue.</p>
 */
public class SyntaxConsistencyException extends IllegalStateException {

    public SyntaxConsistencyException(String message) {
        super(message);
    }
}
