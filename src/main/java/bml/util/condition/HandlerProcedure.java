// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.util.condition;

/**
 * The body of a {@link Handler}.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Looks at a signaled condition.
     * <p>
     * Returning normally declines the condition and lets older handlers see it. Handling it means leaving
     * non-locally, usually through {@link Restart#unwindTo()}.
     */
    void handle(SignaledCondition condition) throws Unwind;
}
