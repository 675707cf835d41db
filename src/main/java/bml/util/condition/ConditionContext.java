// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.util.condition;

import java.util.ArrayList;
import java.util.List;
import bml.util.SneakyThrow;
import bml.util.annotation.Nullable;

/**
 * The per-thread registry of active {@link Handler}s and {@link Restart}s.
 * <p>
 * Instances are never exposed; the static methods act on the calling thread's context.
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition as non-fatal.
     * <p>
     * Handlers run newest first. If all of them decline, this method returns normally. A handler may unwind to a
     * restart instead, in which case {@link Unwind} is (sneakily) thrown through this method.
     */
    public static void signal(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, false));
    }

    /**
     * Signals the given condition as fatal.
     * <p>
     * Behaves like {@link #signal(Condition)}, except that it never returns: if every handler declines, an
     * {@link UnhandledErrorError} is thrown. The declared return type lets call sites write
     * {@code throw ConditionContext.error(...)}.
     */
    public static UnhandledErrorError error(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Runs the callback with a restart point named {@code restartName} around it.
     *
     * @return What the callback returned, or {@code null} if a handler unwound to this restart.
     */
    public static <T> @Nullable T withRestart(final String restartName, final RestartCallback<? extends T> callback) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the calling thread's active restarts, newest first.
     */
    public static List<Restart> restarts() {
        final var restarts = new ArrayList<Restart>();
        for (var restart = localContext().firstRestart; restart != null; restart = restart.next) {
            restarts.add(restart);
        }
        return List.copyOf(restarts);
    }

    static ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final SignaledCondition condition) {
        // A condition signaled from inside a handler is only offered to the handlers older than that one.
        final var start = (currentHandler == null) ? firstHandler : currentHandler.next;
        for (var handler = start; handler != null; handler = handler.next) {
            final var saved = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } catch (final Unwind unwind) {
                throw SneakyThrow.doThrow(unwind);
            } finally {
                currentHandler = saved;
            }
        }
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    private static final ThreadLocal<ConditionContext> localContext = ThreadLocal.withInitial(ConditionContext::new);
}
