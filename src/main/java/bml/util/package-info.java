// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small utilities used throughout the module: operation traces and control flow helpers.
 */
@NonNullByDefault
package bml.util;

import bml.util.annotation.NonNullByDefault;
