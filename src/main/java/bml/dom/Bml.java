// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.dom;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.util.Objects;
import bml.reader.Reader;
import bml.reader.SyntaxErrorCondition;
import bml.reader.Utf8Input;
import bml.util.Trace;
import bml.util.annotation.Nullable;
import bml.util.condition.ConditionContext;
import bml.util.condition.Handler;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * Entry points for reading and writing BML documents.
 */
public final class Bml {
    private Bml() {
    }

    /**
     * Parses the given BML text into a document tree.
     * <p>
     * If the text isn't valid BML, a fatal {@link SyntaxErrorCondition} is signaled. Without a handler that unwinds,
     * that ends in a {@link bml.util.condition.UnhandledErrorError}; see {@link #tryParse(String)} for a variant
     * returning the error instead.
     */
    public static BmlNode.Root parse(final String text) {
        return TreeBuilder.build(Reader.read(text));
    }

    /**
     * Reads the given stream to its end and parses it as UTF-8 encoded BML. The stream is not closed.
     * <p>
     * Signals {@link SyntaxErrorCondition} for invalid UTF-8 and invalid BML alike, and
     * {@link bml.util.condition.exception.IOExceptionCondition} if reading fails.
     */
    public static BmlNode.Root parse(final InputStream stream) {
        final String text;
        try (final var trace = new Trace("Reading BML input stream")) {
            trace.use();
            text = Utf8Input.readAll(stream);
        }
        return parse(text);
    }

    /**
     * Parses the given BML text, returning either the tree or the syntax error.
     * <p>
     * Other fatal conditions are not intercepted.
     */
    @CheckReturnValue
    public static ParseResult tryParse(final String text) {
        final var failure = new FailureHolder();
        final var root = ConditionContext.withRestart("Abandon parsing the BML document", restart -> {
            try (final var handler = new Handler(signaled -> {
                if (signaled.condition() instanceof final SyntaxErrorCondition error) {
                    failure.value = new ParseResult.Failure(error, Trace.activeTraces());
                    restart.unwindTo();
                }
            })) {
                handler.use();
                return parse(text);
            }
        });
        return (root != null) ? new ParseResult.Success(root) : Objects.requireNonNull(failure.value);
    }

    /**
     * Writes the canonical serialization of the given document to the given {@link Writer}.
     * <p>
     * Any {@link IOException}s thrown by the writer are allowed to propagate.
     */
    public static void write(final Writer writer, final BmlNode.Root root) throws IOException {
        Serializer.serialize(writer, root);
    }

    private static final class FailureHolder {
        private @Nullable ParseResult.Failure value = null;
    }
}
