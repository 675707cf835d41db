// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.reader;

import java.util.List;

/**
 * A node of the reader's output: a labelled piece of input text with its nested productions.
 *
 * @param rule     What this production represents.
 * @param text     For {@link Rule#NAME}, {@link Rule#QUOTED_DATA}, {@link Rule#SPACE_DATA} and data lines of elements,
 *                 exactly the name or value. Otherwise the source text the production was read from: the whole input
 *                 for {@link Rule#ROOT}, the header line for {@link Rule#NODE}, the attribute or value as written for
 *                 {@link Rule#ATTR} and attribute {@link Rule#DATA}, and the empty string for {@link Rule#EOI}.
 * @param location Where the production starts.
 * @param inner    The nested productions, in source order.
 */
public record Production(Rule rule, String text, SourceLocation location, List<Production> inner) {
    public Production {
        inner = List.copyOf(inner);
    }

    /**
     * Returns a new production without nested productions.
     */
    public static Production leaf(final Rule rule, final String text, final SourceLocation location) {
        return new Production(rule, text, location, List.of());
    }
}
