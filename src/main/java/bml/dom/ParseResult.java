// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.dom;

import java.util.List;
import bml.reader.SyntaxErrorCondition;

/**
 * The outcome of {@link Bml#tryParse(String)}.
 */
public sealed interface ParseResult {
    /**
     * The input was valid BML.
     */
    record Success(BmlNode.Root root) implements ParseResult {
    }

    /**
     * The input was not valid BML.
     *
     * @param error The syntax error that stopped reading.
     * @param trace The operation traces that were active when the error was signaled, innermost first.
     */
    record Failure(SyntaxErrorCondition error, List<String> trace) implements ParseResult {
        public Failure {
            trace = List.copyOf(trace);
        }
    }
}
