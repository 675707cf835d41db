// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Nullness annotations shared by the whole module, built on JSR-305 meta-annotations.
 */
package bml.util.annotation;
