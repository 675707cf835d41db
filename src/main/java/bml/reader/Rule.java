// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.reader;

/**
 * The label of a {@link Production}.
 */
public enum Rule {
    /**
     * The whole document. Its inner productions are the top-level {@link #NODE}s followed by one {@link #EOI}.
     */
    ROOT("document"),
    /**
     * An element: a {@link #NAME}, then its {@link #DATA} lines, {@link #ATTR}ibutes and nested {@code NODE}s.
     */
    NODE("element"),
    /**
     * The name of an element or attribute. Its text is the name itself.
     */
    NAME("name"),
    /**
     * A data line of an element, whose text is the line content, or the value of an attribute, which wraps exactly
     * one {@link #QUOTED_DATA} or {@link #SPACE_DATA} production.
     */
    DATA("data"),
    /**
     * An attribute: a {@link #NAME} and an optional {@link #DATA}.
     */
    ATTR("attribute"),
    /**
     * An attribute value written as {@code name="value"}. Its text excludes the quotes.
     */
    QUOTED_DATA("quoted value"),
    /**
     * An attribute value written as {@code name=value}, delimited by whitespace.
     */
    SPACE_DATA("unquoted value"),
    /**
     * The end of input.
     */
    EOI("end of input");

    Rule(final String description) {
        this.description = description;
    }

    /**
     * Returns a user-readable description of this rule, as used in error messages.
     */
    public String description() {
        return description;
    }

    private final String description;
}
