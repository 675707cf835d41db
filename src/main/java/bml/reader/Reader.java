// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.reader;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import bml.util.Trace;
import bml.util.annotation.Nullable;
import bml.util.condition.ConditionContext;
import bml.util.condition.UnhandledErrorError;

/**
 * The BML reader: the primary means of turning BML text into a tree of {@link Production}s.
 * <p>
 * Nesting is decided by comparing whole indentation strings rather than counting characters: the first line nested
 * under an element fixes the indentation of all its children, and every sibling has to repeat it exactly. Tabs and
 * spaces can thus both be used for alignment, as long as a document is consistent about it. Tabs are likewise
 * accepted between attributes and between a colon and its data.
 */
public final class Reader {
    /**
     * Initializes a new reader over the given input.
     */
    public Reader(final String source) {
        this.source = source;
        lines = splitLines(source);
    }

    /**
     * Reads the given input in one go. Equivalent to {@code new Reader(source).readDocument()}.
     */
    public static Production read(final String source) {
        return new Reader(source).readDocument();
    }

    /**
     * Reads the whole input.
     * <p>
     * Returns a {@link Rule#ROOT} production whose inner productions are the top-level {@link Rule#NODE}s followed
     * by a single {@link Rule#EOI}. If the input doesn't match the grammar, a fatal {@link SyntaxErrorCondition} is
     * signaled and nothing is returned.
     */
    public Production readDocument() {
        final var inner = new ArrayList<Production>();
        @Nullable String rootIndent = null;
        while (skipInsignificantLines()) {
            enterLine();
            final var indent = leadingBlanks(line);
            if (rootIndent == null) {
                rootIndent = indent;
            } else if (!indent.equals(rootIndent)) {
                throw signalError("Top-level element indented differently from the first one", 0, Set.of());
            }
            if (isDataLine(line, indent)) {
                throw signalError("Data line outside of any element", indent.length(), EnumSet.of(Rule.NODE));
            }
            final var headerLine = line;
            final var headerLineNumber = lineNumber;
            try (final var trace = new Trace(() -> "Reading top-level element '" + nameAt(headerLine, indent.length())
                + "' at line " + headerLineNumber)) {
                trace.use();
                inner.add(readNode(indent, 1));
            }
        }
        final var lastLine = lines[lines.length - 1];
        inner.add(Production.leaf(Rule.EOI, "", new SourceLocation(lines.length, lastLine.length() + 1, lastLine)));
        return new Production(Rule.ROOT, source, new SourceLocation(1, 1, lines[0]), inner);
    }

    private Production readNode(final String indent, final int depth) {
        enterLine();
        if (depth > maxDepth) {
            throw signalError("Nesting limit reached, try to limit nesting", indent.length(), Set.of());
        }
        final var nodeLocation = location(indent.length());
        final var headerLine = line;
        final var inner = new ArrayList<Production>();
        position = indent.length();
        inner.add(readName("Expected an element name"));
        final var hasInlineData = position < line.length() && line.charAt(position) == ':';
        if (hasInlineData) {
            position += 1;
            skipBlanks();
            inner.add(Production.leaf(Rule.DATA, line.substring(position), location(position)));
        } else {
            readAttributes(inner);
        }
        lineIndex += 1;
        readBlock(indent, depth, hasInlineData, inner);
        return new Production(Rule.NODE, headerLine, nodeLocation, inner);
    }

    private void readAttributes(final List<Production> inner) {
        while (true) {
            final var skipped = skipBlanks();
            if (position >= line.length()) {
                return;
            }
            if (skipped == 0) {
                throw signalError(
                    "Unexpected character '" + line.charAt(position) + "'",
                    position,
                    EnumSet.of(Rule.ATTR, Rule.DATA)
                );
            }
            inner.add(readAttribute());
        }
    }

    private Production readAttribute() {
        final var start = position;
        final var inner = new ArrayList<Production>(2);
        inner.add(readName("Expected an attribute name"));
        if (position < line.length() && line.charAt(position) == '=') {
            position += 1;
            final var valueStart = position;
            final Production value;
            if (position < line.length() && line.charAt(position) == '"') {
                final var closingQuote = line.indexOf('"', position + 1);
                if (closingQuote < 0) {
                    throw signalError("Unterminated quoted value", position, EnumSet.of(Rule.QUOTED_DATA));
                }
                value = Production.leaf(
                    Rule.QUOTED_DATA,
                    line.substring(position + 1, closingQuote),
                    location(position + 1)
                );
                position = closingQuote + 1;
            } else {
                final var end = findBlank(position);
                value = Production.leaf(Rule.SPACE_DATA, line.substring(position, end), location(position));
                position = end;
            }
            inner.add(new Production(
                Rule.DATA,
                line.substring(valueStart, position),
                location(valueStart),
                List.of(value)
            ));
        }
        return new Production(Rule.ATTR, line.substring(start, position), location(start), inner);
    }

    private void readBlock(
        final String indent,
        final int depth,
        final boolean hasInlineData,
        final List<Production> inner
    ) {
        @Nullable String childIndent = null;
        var sawElement = false;
        while (skipInsignificantLines()) {
            final var candidate = lines[lineIndex];
            final var lineIndent = leadingBlanks(candidate);
            if (lineIndent.length() <= indent.length() || !lineIndent.startsWith(indent)) {
                // Belongs to an ancestor; the ancestors decide whether the indentation makes sense.
                return;
            }
            if (childIndent == null) {
                childIndent = lineIndent;
            } else if (!lineIndent.equals(childIndent)) {
                enterLine();
                throw signalError(
                    "Inconsistent indentation, siblings must be indented exactly alike",
                    0,
                    EnumSet.of(Rule.NODE, Rule.DATA)
                );
            }
            if (isDataLine(candidate, lineIndent)) {
                inner.add(readDataLine(lineIndent, hasInlineData, sawElement));
            } else {
                sawElement = true;
                inner.add(readNode(lineIndent, depth + 1));
            }
        }
    }

    private Production readDataLine(final String indent, final boolean hasInlineData, final boolean sawElement) {
        enterLine();
        if (hasInlineData) {
            throw signalError("An element with inline data can't have data lines", indent.length(), Set.of());
        }
        if (sawElement) {
            throw signalError("Data lines must precede nested elements", indent.length(), EnumSet.of(Rule.NODE));
        }
        position = indent.length() + 1;
        skipBlanks();
        final var data = Production.leaf(Rule.DATA, line.substring(position), location(indent.length()));
        lineIndex += 1;
        return data;
    }

    private Production readName(final String errorMessage) {
        final var start = position;
        while (position < line.length() && isNameCharacter(line.charAt(position))) {
            position += 1;
        }
        if (position == start) {
            throw signalError(errorMessage, start, EnumSet.of(Rule.NAME));
        }
        return Production.leaf(Rule.NAME, line.substring(start, position), location(start));
    }

    private boolean skipInsignificantLines() {
        for (; lineIndex < lines.length; lineIndex += 1) {
            final var candidate = lines[lineIndex];
            final var contentStart = leadingBlanks(candidate).length();
            if (contentStart < candidate.length() && !candidate.startsWith(commentPrefix, contentStart)) {
                return true;
            }
        }
        return false;
    }

    private int skipBlanks() {
        final var start = position;
        while (position < line.length() && isBlank(line.charAt(position))) {
            position += 1;
        }
        return position - start;
    }

    private int findBlank(final int start) {
        var end = start;
        while (end < line.length() && !isBlank(line.charAt(end))) {
            end += 1;
        }
        return end;
    }

    private void enterLine() {
        line = lines[lineIndex];
        lineNumber = lineIndex + 1;
        position = 0;
    }

    private SourceLocation location(final int index) {
        return new SourceLocation(lineNumber, index + 1, line);
    }

    private UnhandledErrorError signalError(final String message, final int index, final Set<Rule> expected) {
        throw ConditionContext.error(new SyntaxErrorCondition(message, location(index), expected));
    }

    private static boolean isDataLine(final String line, final String indent) {
        return line.startsWith(":", indent.length());
    }

    private static String nameAt(final String line, final int start) {
        var end = start;
        while (end < line.length() && isNameCharacter(line.charAt(end))) {
            end += 1;
        }
        return line.substring(start, end);
    }

    private static String leadingBlanks(final String line) {
        var end = 0;
        while (end < line.length() && isBlank(line.charAt(end))) {
            end += 1;
        }
        return line.substring(0, end);
    }

    private static boolean isBlank(final char ch) {
        return ch == ' ' || ch == '\t';
    }

    private static boolean isNameCharacter(final char ch) {
        return (ch >= 'A' && ch <= 'Z')
            || (ch >= 'a' && ch <= 'z')
            || (ch >= '0' && ch <= '9')
            || ch == '-'
            || ch == '.';
    }

    private static String[] splitLines(final String source) {
        final var lines = source.split("\n", -1);
        for (int i = 0; i < lines.length; i += 1) {
            final var line = lines[i];
            if (line.endsWith("\r")) {
                lines[i] = line.substring(0, line.length() - 1);
            }
        }
        return lines;
    }

    private static final String commentPrefix = "//";
    private static final int maxDepth = 150;

    private final String source;
    private final String[] lines;
    private int lineIndex = 0;
    private String line = "";
    private int lineNumber = 1;
    private int position = 0;
}
