// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.uri;

final class UriNames {
    private UriNames() {
    }

    /**
     * Checks that {@code path} is a non-empty sequence of valid segments separated by slashes.
     */
    static boolean isValidPath(final String path) {
        if (path.isEmpty() || path.startsWith("/") || path.endsWith("/")) {
            return false;
        }
        for (final var segment : path.split("/", -1)) {
            if (!isValidSegment(segment)) {
                return false;
            }
        }
        return true;
    }

    static boolean isValidSegment(final String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        final var length = segment.length();
        for (int i = 0; i < length; i += 1) {
            final var c = segment.charAt(i);
            if (Character.isWhitespace(c) || reservedCharacters.indexOf(c) >= 0) {
                return false;
            }
        }
        return true;
    }

    static String lastSegment(final String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private static final String reservedCharacters = "?#/,\"<>";
}
