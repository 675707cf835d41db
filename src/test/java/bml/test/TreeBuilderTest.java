// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.test;

import java.util.List;
import bml.dom.BmlNode;
import bml.dom.TreeBuilder;
import bml.reader.Production;
import bml.reader.Rule;
import bml.reader.SourceLocation;
import bml.util.UnreachableCodeReachedError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;

final class TreeBuilderTest {
    @Test
    void buildsElementsAttributesAndData() {
        final var root = TreeBuilder.build(root(
            node(
                name("board"),
                attribute("type", Production.leaf(Rule.SPACE_DATA, "SHVC", location)),
                attribute("region", Production.leaf(Rule.QUOTED_DATA, "NTSC", location)),
                attribute("volatile"),
                Production.leaf(Rule.DATA, "first", location),
                Production.leaf(Rule.DATA, "second", location),
                node(name("memory"), Production.leaf(Rule.DATA, "ROM", location))
            ),
            Production.leaf(Rule.EOI, "", location)
        ));

        assertThat(root.children()).extracting(entry -> entry.key()).containsExactly("board");
        final var board = root.firstNamed("board");
        assertThat(board).isInstanceOf(BmlNode.Element.class);
        assertThat(board.lines()).containsExactly("first", "second");
        assertThat(board.children()).extracting(entry -> entry.key())
            .containsExactly("type", "region", "volatile", "memory");

        final var type = (BmlNode.Attribute) board.firstNamed("type");
        assertThat(type.value()).isEqualTo("SHVC");
        assertThat(type.quote()).isFalse();
        final var region = (BmlNode.Attribute) board.firstNamed("region");
        assertThat(region.value()).isEqualTo("NTSC");
        assertThat(region.quote()).isTrue();
        final var flag = (BmlNode.Attribute) board.firstNamed("volatile");
        assertThat(flag.hasData()).isFalse();
        assertThat(flag.quote()).isTrue();
        assertThat(board.firstNamed("memory").value()).isEqualTo("ROM");
    }

    @Test
    void emptyRootWorks() {
        final var root = TreeBuilder.build(root(Production.leaf(Rule.EOI, "", location)));
        assertThat(root.children()).isEmpty();
        assertThat(root.hasData()).isFalse();
    }

    @Test
    void rejectsNonRootInput() {
        assertThatExceptionOfType(UnreachableCodeReachedError.class)
            .isThrownBy(() -> TreeBuilder.build(node(name("a"))))
            .withMessage("Unexpected NODE production at 3:7");
    }

    @Test
    void rejectsMisplacedProductions() {
        assertThatExceptionOfType(UnreachableCodeReachedError.class)
            .isThrownBy(() -> TreeBuilder.build(root(name("a"))));
        assertThatExceptionOfType(UnreachableCodeReachedError.class)
            .isThrownBy(() -> TreeBuilder.build(root(node(name("a"), Production.leaf(Rule.EOI, "", location)))));
        assertThatExceptionOfType(UnreachableCodeReachedError.class).isThrownBy(() -> TreeBuilder.build(root(
            node(name("a"), attribute("x", Production.leaf(Rule.NAME, "y", location)))
        )));
    }

    @Test
    void rejectsNamelessProductions() {
        assertThatExceptionOfType(UnreachableCodeReachedError.class)
            .isThrownBy(() -> TreeBuilder.build(root(node(Production.leaf(Rule.DATA, "orphan", location)))))
            .withMessage("Unexpected NODE production at 3:7");
        final var nameless = new Production(Rule.ATTR, "", location, List.of());
        assertThatExceptionOfType(UnreachableCodeReachedError.class)
            .isThrownBy(() -> TreeBuilder.build(root(node(name("a"), nameless))))
            .withMessage("Unexpected ATTR production at 3:7");
    }

    @Test
    void rejectsAttributesWithSeveralValues() {
        final var data = new Production(Rule.DATA, "", location, List.of(
            Production.leaf(Rule.QUOTED_DATA, "1", location),
            Production.leaf(Rule.QUOTED_DATA, "2", location)
        ));
        final var attribute = new Production(Rule.ATTR, "", location, List.of(name("x"), data));
        assertThatExceptionOfType(UnreachableCodeReachedError.class)
            .isThrownBy(() -> TreeBuilder.build(root(node(name("a"), attribute))))
            .withMessageContaining("'x'");
    }

    private static Production root(final Production... inner) {
        return new Production(Rule.ROOT, "", location, List.of(inner));
    }

    private static Production node(final Production... inner) {
        return new Production(Rule.NODE, "", location, List.of(inner));
    }

    private static Production name(final String name) {
        return Production.leaf(Rule.NAME, name, location);
    }

    private static Production attribute(final String name) {
        return new Production(Rule.ATTR, name, location, List.of(name(name)));
    }

    private static Production attribute(final String name, final Production value) {
        final var data = new Production(Rule.DATA, value.text(), location, List.of(value));
        return new Production(Rule.ATTR, name, location, List.of(name(name), data));
    }

    private static final SourceLocation location = new SourceLocation(3, 7, null);
}
