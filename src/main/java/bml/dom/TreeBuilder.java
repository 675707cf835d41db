// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.dom;

import java.util.ArrayList;
import bml.reader.Production;
import bml.reader.Rule;
import bml.util.UnreachableCodeReachedError;
import bml.util.annotation.Nullable;
import bml.util.collection.OrderedMultimap;

/**
 * Turns the output of the {@link bml.reader.Reader} into a document tree.
 * <p>
 * The builder trusts its input to be well-formed: validation is the reader's job. A production it has no place for
 * means the reader and the builder disagree about the grammar, which is reported as an
 * {@link UnreachableCodeReachedError}.
 */
public final class TreeBuilder {
    private TreeBuilder() {
    }

    /**
     * Builds the tree for the given {@link Rule#ROOT} production.
     */
    public static BmlNode.Root build(final Production root) {
        if (root.rule() != Rule.ROOT) {
            throw unexpected(root);
        }
        final var children = new OrderedMultimap.Builder<String, BmlNode>();
        for (final var production : root.inner()) {
            switch (production.rule()) {
                case NODE -> appendElement(children, production);
                case EOI -> {
                }
                default -> throw unexpected(production);
            }
        }
        return new BmlNode.Root(children.freeze());
    }

    private static void appendElement(
        final OrderedMultimap.Builder<String, BmlNode> parent,
        final Production node
    ) {
        @Nullable String name = null;
        final var lines = new ArrayList<String>();
        final var children = new OrderedMultimap.Builder<String, BmlNode>();
        for (final var production : node.inner()) {
            switch (production.rule()) {
                case NAME -> name = production.text();
                case DATA -> lines.add(production.text());
                case ATTR -> appendAttribute(children, production);
                case NODE -> appendElement(children, production);
                default -> throw unexpected(production);
            }
        }
        if (name == null) {
            throw unexpected(node);
        }
        parent.append(name, new BmlNode.Element(lines, children.freeze()));
    }

    private static void appendAttribute(
        final OrderedMultimap.Builder<String, BmlNode> parent,
        final Production attribute
    ) {
        @Nullable String name = null;
        final var lines = new ArrayList<String>(1);
        var quote = true;
        for (final var production : attribute.inner()) {
            switch (production.rule()) {
                case NAME -> name = production.text();
                case DATA -> {
                    for (final var value : production.inner()) {
                        switch (value.rule()) {
                            case QUOTED_DATA -> {
                            }
                            // Quoting is a property of the whole attribute, not of a single value.
                            case SPACE_DATA -> quote = false;
                            default -> throw unexpected(value);
                        }
                        lines.add(value.text());
                    }
                }
                default -> throw unexpected(production);
            }
        }
        if (name == null) {
            throw unexpected(attribute);
        }
        if (lines.size() > 1) {
            throw new UnreachableCodeReachedError("Attribute '" + name + "' has more than one value");
        }
        parent.append(name, new BmlNode.Attribute(lines, quote));
    }

    private static UnreachableCodeReachedError unexpected(final Production production) {
        return new UnreachableCodeReachedError(
            "Unexpected " + production.rule() + " production at " + production.location().lineNumber() + ':'
                + production.location().column()
        );
    }
}
