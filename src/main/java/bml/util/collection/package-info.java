// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Immutable collections.
 */
@NonNullByDefault
package bml.util.collection;

import bml.util.annotation.NonNullByDefault;
