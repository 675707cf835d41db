// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.dom;

import java.util.List;
import java.util.Objects;
import bml.util.annotation.Nullable;
import bml.util.collection.OrderedMultimap;

/**
 * A node of a BML document tree: an ordered list of data {@link #lines()} plus an ordered list of named
 * {@link #children()}.
 * <p>
 * Every node is one of three variants:
 * <ul>
 * <li>{@link Root}, the unnamed container of a document's top-level elements and the only variant with a rendering
 * {@link Indent};
 * <li>{@link Element}, a named node with data lines, attributes and nested elements;
 * <li>{@link Attribute}, a named leaf with at most one data line, remembering whether it was written quoted.
 * </ul>
 * Attributes are children like any other, which is why the children of an element start with its attributes,
 * followed by its nested elements. The name of a node is the key its parent stores it under.
 * <p>
 * Trees are immutable once built, with the sole exception of the root's indent.
 */
public abstract sealed class BmlNode {
    private BmlNode(final List<String> lines, final OrderedMultimap<String, BmlNode> children) {
        this.lines = List.copyOf(lines);
        this.children = children;
    }

    /**
     * Returns the value of this node: its data lines joined with {@code '\n'}.
     *
     * @throws IllegalStateException if this node has no data lines; check {@link #hasData()} first.
     */
    public final String value() {
        if (lines.isEmpty()) {
            throw new IllegalStateException("BML node has no value: it holds no data lines");
        }
        return String.join("\n", lines);
    }

    /**
     * Returns the data lines of this node, none of which contains a line break.
     */
    public final List<String> lines() {
        return lines;
    }

    /**
     * Returns {@code true} iff this node has at least one data line.
     */
    public final boolean hasData() {
        return !lines.isEmpty();
    }

    /**
     * Returns all children of this node as (name, node) entries, in document order, attributes first.
     */
    public final List<OrderedMultimap.Entry<String, BmlNode>> children() {
        return children.entries();
    }

    /**
     * Returns the children named {@code name}, in document order.
     * <p>
     * Complexity: <i>O(1)</i> expected, the children are indexed by name.
     */
    public final List<BmlNode> named(final String name) {
        return children.getAll(name);
    }

    /**
     * Returns the first child named {@code name}, or {@code null} if there is none.
     */
    public final @Nullable BmlNode firstNamed(final String name) {
        return children.getFirst(name);
    }

    /**
     * Two nodes are equal iff their data lines and their children are equal. The variant, quoting and indent don't
     * take part, so an attribute and an element holding the same value compare equal.
     */
    @Override
    public final boolean equals(final @Nullable Object object) {
        return object instanceof BmlNode node && lines.equals(node.lines) && children.equals(node.children);
    }

    @Override
    public final int hashCode() {
        return Objects.hash(lines, children);
    }

    final OrderedMultimap<String, BmlNode> childMap() {
        return children;
    }

    private final List<String> lines;
    private final OrderedMultimap<String, BmlNode> children;

    /**
     * The root of a document tree.
     * <p>
     * It has no data and no name of its own, and holds the {@link Indent} the document is rendered with. Its
     * string representation is the canonical serialization of the whole document.
     */
    public static final class Root extends BmlNode {
        Root(final OrderedMultimap<String, BmlNode> children) {
            super(List.of(), children);
        }

        /**
         * Returns the indent this document is rendered with.
         */
        public Indent indent() {
            return indent;
        }

        /**
         * Changes how this document is rendered: each nesting level is indented by {@code unit}, top-level elements
         * by {@code repeat} units.
         * <p>
         * The default is two spaces and no root indent. A tab with no root indent is the usual alternative.
         * <p>
         * The tree itself is left untouched. This is the only mutation a tree supports; finish it before sharing the
         * tree with other threads.
         *
         * @throws IllegalArgumentException if the unit is empty or contains anything but spaces and tabs, or if
         *                                  {@code repeat} is negative.
         */
        public void setIndent(final String unit, final int repeat) {
            setIndent(new Indent(unit, repeat));
        }

        /**
         * Changes how this document is rendered. See {@link #setIndent(String, int)}.
         */
        public void setIndent(final Indent indent) {
            this.indent = indent;
        }

        @Override
        public String toString() {
            return Serializer.serializeToString(this);
        }

        private Indent indent = Indent.DEFAULT;
    }

    /**
     * A named element.
     */
    public static final class Element extends BmlNode {
        Element(final List<String> lines, final OrderedMultimap<String, BmlNode> children) {
            super(lines, children);
        }

        @Override
        public String toString() {
            return "Element[lines=" + lines() + ", children=" + childMap().keySet() + ']';
        }
    }

    /**
     * A named attribute of an element.
     */
    public static final class Attribute extends BmlNode {
        Attribute(final List<String> lines, final boolean quote) {
            super(lines, OrderedMultimap.empty());
            assert lines.size() <= 1 : "An attribute holds at most one data line";
            this.quote = quote;
        }

        /**
         * Returns {@code true} iff the value is rendered in quotes, which is the case unless it was read from the
         * unquoted {@code name=value} form.
         */
        public boolean quote() {
            return quote;
        }

        @Override
        public String toString() {
            return "Attribute[lines=" + lines() + ", quote=" + quote + ']';
        }

        private final boolean quote;
    }
}
