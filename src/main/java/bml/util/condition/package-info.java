// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system.
 * <p>
 * Code that detects a problem {@linkplain ConditionContext#error(Condition) signals} a {@link Condition} instead of
 * throwing. Registered {@link Handler}s look at it while the signaling frame is still on the stack and decide what
 * happens next, typically by unwinding to a {@link Restart} established further up.
 */
@NonNullByDefault
package bml.util.condition;

import bml.util.annotation.NonNullByDefault;
