// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.util.condition;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when every handler declined the condition.
 * <p>
 * Leaving a fatal condition unhandled is a programming error, so this extends {@link AssertionError}. The condition
 * stays available to whoever catches it anyway.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition);
        this.condition = condition;
    }

    /**
     * Returns the condition nobody handled.
     */
    public Condition condition() {
        return condition;
    }

    private final transient Condition condition;
}
