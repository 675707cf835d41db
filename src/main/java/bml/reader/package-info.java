// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The BML reader: turns text into a tree of labelled {@link bml.reader.Production productions}.
 */
@NonNullByDefault
package bml.reader;

import bml.util.annotation.NonNullByDefault;
