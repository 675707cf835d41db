// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.dom;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import bml.util.UnreachableCodeReachedError;

/**
 * The tree-to-BML serializer.
 * <p>
 * The output is canonical rather than a copy of the original text: comments are gone, indentation follows the
 * root's {@link Indent}, and reading the output back yields a tree equal to the serialized one.
 * <ul>
 * <li>Top-level elements are separated by one blank line.
 * <li>An element without attributes and with exactly one data line is written as {@code name: value}.
 * Otherwise its header line holds the name and the attributes, and each data line follows on its own line as
 * {@code :line}, one level deeper.
 * <li>Attributes are written as {@code name}, {@code name=value} or {@code name="value"}, depending on whether they
 * have a value and on how the value was originally written.
 * </ul>
 */
public final class Serializer {
    private Serializer(final Writer writer) {
        this.writer = writer;
    }

    /**
     * Serializes the given document, writing the output to the given {@link Writer}.
     * <p>
     * Any {@link IOException}s thrown by the writer are allowed to propagate.
     */
    public static void serialize(final Writer writer, final BmlNode.Root root) throws IOException {
        new Serializer(writer).serializeNode("", root, root.indent());
    }

    /**
     * Serializes the given document into a string.
     */
    public static String serializeToString(final BmlNode.Root root) {
        final var writer = new StringWriter();
        try {
            serialize(writer, root);
        } catch (final IOException e) {
            // StringWriter doesn't do I/O.
            throw new UnreachableCodeReachedError();
        }
        return writer.toString();
    }

    private void serializeNode(final String name, final BmlNode node, final Indent indent) throws IOException {
        if (node instanceof BmlNode.Root) {
            serializeRoot(node, indent);
        } else if (node instanceof BmlNode.Element) {
            serializeElement(name, node, indent);
        } else if (node instanceof BmlNode.Attribute attribute) {
            serializeAttribute(name, attribute);
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private void serializeRoot(final BmlNode root, final Indent indent) throws IOException {
        final var children = root.children();
        for (int i = 0; i < children.size(); i += 1) {
            if (i > 0) {
                writer.write('\n');
            }
            final var child = children.get(i);
            serializeNode(child.key(), child.value(), indent);
        }
    }

    private void serializeElement(final String name, final BmlNode element, final Indent indent) throws IOException {
        writer.write(indent.toString());
        writer.write(name);
        final var childIndent = indent.next();
        final var children = element.children();
        var attributeCount = 0;
        while (attributeCount < children.size()
            && children.get(attributeCount).value() instanceof BmlNode.Attribute attribute) {
            serializeAttribute(children.get(attributeCount).key(), attribute);
            attributeCount += 1;
        }
        final var lines = element.lines();
        if (attributeCount == 0 && lines.size() == 1) {
            writer.write(": ");
            writer.write(lines.get(0));
            writer.write('\n');
        } else {
            writer.write('\n');
            final var prefix = childIndent.toString();
            for (final var line : lines) {
                writer.write(prefix);
                writer.write(':');
                writer.write(line);
                writer.write('\n');
            }
        }
        for (final var child : children.subList(attributeCount, children.size())) {
            serializeNode(child.key(), child.value(), childIndent);
        }
    }

    private void serializeAttribute(final String name, final BmlNode.Attribute attribute) throws IOException {
        writer.write(' ');
        writer.write(name);
        if (attribute.hasData()) {
            final var value = attribute.lines().get(0);
            if (attribute.quote()) {
                writer.write("=\"");
                writer.write(value);
                writer.write('"');
            } else {
                writer.write('=');
                writer.write(value);
            }
        }
    }

    private final Writer writer;
}
