// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A parser and canonical serializer for BML, an indentation-sensitive markup language.
 */
module bml {
    requires static org.checkerframework.checker.qual;
    requires static com.github.spotbugs.annotations;
    requires static jsr305;

    exports bml.dom;
    exports bml.reader;
    exports bml.util;
    exports bml.util.annotation;
    exports bml.util.collection;
    exports bml.util.condition;
    exports bml.util.condition.exception;
}
