// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.util;

/**
 * Thrown when control flow reaches a branch that the surrounding invariants rule out, for instance when the tree
 * builder is handed a production shape the reader never emits.
 * <p>
 * This is a programming error rather than a data error, hence an {@link AssertionError}.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError() {
        super("Execution reached a point expected to be unreachable");
    }

    public UnreachableCodeReachedError(final String message) {
        super(message);
    }
}
