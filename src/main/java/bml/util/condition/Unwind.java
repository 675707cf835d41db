// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.util.condition;

/**
 * The throwable that carries control from {@link Restart#unwindTo()} to the frame that established the restart.
 * <p>
 * It is neither an {@link Exception} nor an {@link Error}: it is control flow, so generic {@code catch} clauses
 * must not swallow it. Public only so that methods can declare it.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    Restart target() {
        return target;
    }

    private final transient Restart target;
}
