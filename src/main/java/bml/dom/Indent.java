// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.dom;

/**
 * How nesting is rendered by the {@link Serializer}: {@code unit} repeated {@code repeat} times.
 * <p>
 * The root's indent gives the level of top-level elements; every nesting level below adds one more {@code unit}.
 *
 * @param unit   The indentation of one level. Must be non-empty and consist of spaces and tabs only, otherwise the
 *               output couldn't be read back.
 * @param repeat How many units precede the current level. Must not be negative.
 */
public record Indent(String unit, int repeat) {
    /**
     * Two spaces per level, top-level elements not indented.
     */
    public static final Indent DEFAULT = new Indent("  ", 0);

    public Indent {
        if (unit.isEmpty() || !unit.chars().allMatch(ch -> ch == ' ' || ch == '\t')) {
            throw new IllegalArgumentException("Indent unit must be a non-empty run of spaces and tabs");
        }
        if (repeat < 0) {
            throw new IllegalArgumentException("Negative indent repeat count: " + repeat);
        }
    }

    /**
     * Returns the indent of the next nesting level.
     */
    public Indent next() {
        return new Indent(unit, repeat + 1);
    }

    /**
     * Returns the whitespace this indent stands for.
     */
    @Override
    public String toString() {
        return unit.repeat(repeat);
    }
}
