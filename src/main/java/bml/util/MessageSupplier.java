// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.util;

/**
 * A lazily computed {@link Trace} message.
 */
@FunctionalInterface
public interface MessageSupplier {
    String get();
}
