// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.util.condition;

/**
 * The base type of everything that can be signaled through {@link ConditionContext}.
 * <p>
 * Handlers see a condition <em>before</em> the stack unwinds, which is what separates conditions from exceptions.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given short user-readable message.
     */
    protected Condition(final String message) {
        this.message = message;
    }

    /**
     * Returns the short user-readable message of this condition.
     */
    public final String message() {
        return message;
    }

    /**
     * Returns the full user-readable description of this condition. Subclasses add whatever context they carry.
     */
    public String detailedMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + message;
    }

    private final String message;
}
