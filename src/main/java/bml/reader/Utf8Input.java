// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.reader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import bml.util.condition.ConditionContext;
import bml.util.condition.exception.IOExceptionCondition;

/**
 * Turns a byte stream into text for the {@link Reader}.
 */
public final class Utf8Input {
    private Utf8Input() {
    }

    /**
     * Reads the given stream to its end and decodes it as UTF-8. The stream is not closed.
     * <p>
     * Decoding is strict: malformed or unmappable input signals a fatal {@link SyntaxErrorCondition} located at
     * the first offending byte. An {@link IOException} is caught and signaled as a fatal
     * {@link IOExceptionCondition}.
     */
    public static String readAll(final InputStream stream) {
        final byte[] bytes;
        try {
            bytes = stream.readAllBytes();
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
        return decode(bytes);
    }

    private static String decode(final byte[] bytes) {
        final var buffer = ByteBuffer.wrap(bytes);
        try {
            return newUtf8Decoder().decode(buffer).toString();
        } catch (final CharacterCodingException e) {
            // The decoder stops right at the offending byte.
            throw ConditionContext.error(new SyntaxErrorCondition(
                "Invalid UTF-8 byte sequence detected",
                locate(bytes, buffer.position()),
                Set.of()
            ));
        }
    }

    private static SourceLocation locate(final byte[] bytes, final int offset) {
        var lineNumber = 1;
        var lineStart = 0;
        for (int i = 0; i < offset; i += 1) {
            if (bytes[i] == '\n') {
                lineNumber += 1;
                lineStart = i + 1;
            }
        }
        return new SourceLocation(lineNumber, offset - lineStart + 1, null);
    }

    private static CharsetDecoder newUtf8Decoder() {
        final var decoder = StandardCharsets.UTF_8.newDecoder();
        decoder.onMalformedInput(CodingErrorAction.REPORT);
        decoder.onUnmappableCharacter(CodingErrorAction.REPORT);
        return decoder;
    }
}
