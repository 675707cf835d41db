// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.reader;

import bml.util.annotation.Nullable;

/**
 * A position in BML input.
 *
 * @param lineNumber The 1-based line number.
 * @param column     The 1-based column, counted in characters, or in bytes for undecodable input.
 * @param lineText   The text of that line without its terminator, or {@code null} if it is not available.
 */
public record SourceLocation(int lineNumber, int column, @Nullable String lineText) {
    @Override
    public String toString() {
        final var header = "In line " + lineNumber + ", column " + column;
        if (lineText == null) {
            return header;
        }
        final var gutter = " ".repeat(String.valueOf(lineNumber).length());
        return header + '\n'
            + gutter + " |\n"
            + lineNumber + " | " + lineText + '\n'
            + gutter + " | " + caretPadding(lineText, column) + '^';
    }

    // Tabs are kept as tabs so the caret lines up regardless of the terminal's tab width.
    private static String caretPadding(final String lineText, final int column) {
        final var builder = new StringBuilder();
        for (int i = 0; i < column - 1; i += 1) {
            builder.append((i < lineText.length() && lineText.charAt(i) == '\t') ? '\t' : ' ');
        }
        return builder.toString();
    }
}
