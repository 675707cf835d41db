// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.reader;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;
import bml.util.condition.Condition;

/**
 * Signaled as a fatal condition when BML input doesn't match the grammar.
 */
public final class SyntaxErrorCondition extends Condition {
    SyntaxErrorCondition(final String rawMessage, final SourceLocation location, final Set<Rule> expected) {
        super(rawMessage);
        this.location = location;
        this.expected = expected.isEmpty() ? EnumSet.noneOf(Rule.class) : EnumSet.copyOf(expected);
    }

    /**
     * Returns where the input stopped making sense.
     */
    public SourceLocation location() {
        return location;
    }

    /**
     * Returns the productions that would have been accepted at {@link #location()}. May be empty.
     */
    public Set<Rule> expected() {
        return EnumSet.copyOf(expected);
    }

    @Override
    public String detailedMessage() {
        final var builder = new StringBuilder("Invalid BML: ").append(message());
        if (!expected.isEmpty()) {
            builder.append("\nExpected ")
                .append(expected.stream().map(Rule::description).collect(Collectors.joining(" or ")));
        }
        return builder.append('\n').append(location).toString();
    }

    private final SourceLocation location;
    private final EnumSet<Rule> expected;
}
