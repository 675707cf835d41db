// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The BML document tree: node model, construction from reader output, and canonical serialization.
 */
@NonNullByDefault
package bml.dom;

import bml.util.annotation.NonNullByDefault;
