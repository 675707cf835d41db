// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.util.condition;

import bml.util.SneakyThrow;
import bml.util.annotation.Nullable;

/**
 * A named point that handlers can transfer control to.
 * <p>
 * Restarts are created by {@link ConditionContext#withRestart(String, RestartCallback)} and stay active until its
 * callback finishes.
 */
public final class Restart {
    Restart(final String name) {
        final var context = ConditionContext.localContext();
        next = context.firstRestart;
        this.name = name;
        ownerContext = context;
        context.firstRestart = this;
    }

    /**
     * Returns the user-readable name of this restart.
     */
    public String name() {
        return name;
    }

    /**
     * Abandons everything between the caller and this restart; {@code withRestart} then returns {@code null}.
     * <p>
     * Never returns.
     */
    public void unwindTo() {
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    void unlink() {
        assert ownerContext == ConditionContext.localContext() : "Restart unlinked by a different thread";
        assert ownerContext.firstRestart == this : "Restart chain corrupt";
        ownerContext.firstRestart = next;
    }

    final @Nullable Restart next;
    private final String name;
    private final ConditionContext ownerContext;
}
