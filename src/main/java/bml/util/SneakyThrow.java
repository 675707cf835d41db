// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.util;

/**
 * Bypasses the checked exception mechanism.
 * <p>
 * The condition system uses it to transfer control to a restart point with {@link bml.util.condition.Unwind},
 * which would otherwise have to be declared by every method between a handler and its restart.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable as if it were unchecked, regardless of its actual type.
     * <p>
     * Never returns normally; the declared return type exists so call sites can write {@code throw doThrow(t)} and
     * keep the compiler's flow analysis happy.
     */
    public static UnreachableCodeReachedError doThrow(final Throwable throwable) {
        throw SneakyThrow.<RuntimeException>doThrowImpl(throwable);
    }

    // E erases to Throwable, so the cast vanishes from the bytecode.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> UnreachableCodeReachedError doThrowImpl(final Throwable throwable) throws E {
        throw (E) throwable;
    }
}
