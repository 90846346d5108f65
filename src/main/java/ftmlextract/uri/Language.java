// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.uri;

import ftmlextract.util.annotation.Nullable;

/**
 * A natural language, as a lower-case ISO 639 code.
 */
public record Language(String code) {
    public Language {
        if (!isValidCode(code)) {
            throw new IllegalArgumentException("Not a valid language code: '" + code + '\'');
        }
    }

    /**
     * Parses a language tag, returning {@code null} if it isn't a two or three letter lower-case code.
     */
    public static @Nullable Language parse(final String string) {
        return isValidCode(string) ? new Language(string) : null;
    }

    private static boolean isValidCode(final String code) {
        final var length = code.length();
        if (length < 2 || length > 3) {
            return false;
        }
        for (int i = 0; i < length; i += 1) {
            final var c = code.charAt(i);
            if (c < 'a' || c > 'z') {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return code;
    }
}
