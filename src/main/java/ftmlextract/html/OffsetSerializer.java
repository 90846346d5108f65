// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.html;

import java.util.Set;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.DocumentType;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

/**
 * The incremental DOM-to-HTML serializer.
 * <p>
 * Output is appended piece by piece while the tree is walked, and the serializer keeps count of the UTF-8 length of
 * everything written, so that element ranges can be recorded as byte offsets. Output can be rewound to an earlier
 * {@link Position}, which is how elements are removed after the fact.
 */
final class OffsetSerializer {
    /**
     * A point in the output.
     *
     * @param characters The length of the output in UTF-16 code units.
     * @param bytes      The length of the output in UTF-8 bytes.
     */
    record Position(int characters, int bytes) {
    }

    @NotNull Position position() {
        return new Position(builder.length(), byteLength);
    }

    int byteOffset() {
        return byteLength;
    }

    /**
     * Discards everything written after {@code position}.
     */
    void rewind(final @NotNull Position position) {
        assert position.characters() <= builder.length() : "Rewinding past the end";
        builder.setLength(position.characters());
        byteLength = position.bytes();
    }

    void startTag(final @NotNull Element element) {
        write("<");
        write(element.tagName());
        for (final Attribute attribute : element.attributes()) {
            write(" ");
            write(attribute.getKey());
            write("=\"");
            writeEscaped(attribute.getValue(), AttributeEscaper.instance);
            write("\"");
        }
        write(">");
    }

    void endTag(final @NotNull Element element) {
        if (!isVoid(element)) {
            write("</");
            write(element.tagName());
            write(">");
        }
    }

    void text(final @NotNull TextNode text) {
        final var parent = text.parent();
        if (parent instanceof final Element element && rawTextElements.contains(element.normalName())) {
            write(text.getWholeText());
        } else {
            writeEscaped(text.getWholeText(), TextEscaper.instance);
        }
    }

    void data(final @NotNull DataNode data) {
        write(data.getWholeData());
    }

    void doctype(final @NotNull DocumentType doctype) {
        write("<!DOCTYPE ");
        write(doctype.name());
        write(">");
    }

    @NotNull String result() {
        return builder.toString();
    }

    /**
     * Returns whether the element never has content or an end tag.
     */
    static boolean isVoid(final @NotNull Element element) {
        return voidElements.contains(element.normalName());
    }

    private void write(final @NotNull String string) {
        builder.append(string);
        byteLength += utf8Length(string, 0, string.length());
    }

    private void writeEscaped(final @NotNull String string, final @NotNull Escaper escaper) {
        int index = 0;
        int indexToEscape;
        while ((indexToEscape = findCharacterToEscape(string, index, escaper)) >= 0) {
            writeRange(string, index, indexToEscape);
            final var escaped = escaper.escape(string.charAt(indexToEscape));
            assert escaped != null;
            write(escaped);
            index = indexToEscape + 1;
        }
        if (index < string.length()) {
            writeRange(string, index, string.length());
        }
    }

    private void writeRange(final @NotNull String string, final int start, final int end) {
        builder.append(string, start, end);
        byteLength += utf8Length(string, start, end);
    }

    private static int findCharacterToEscape(
        final @NotNull String string,
        final int startIndex,
        final @NotNull Escaper escaper
    ) {
        final var length = string.length();
        for (int i = startIndex; i < length; i += 1) {
            if (escaper.escape(string.charAt(i)) != null) {
                return i;
            }
        }
        return -1;
    }

    private static int utf8Length(final @NotNull CharSequence string, final int start, final int end) {
        int length = 0;
        for (int i = start; i < end; i += 1) {
            final var character = string.charAt(i);
            if (character < 0x80) {
                length += 1;
            } else if (character < 0x800) {
                length += 2;
            } else if (Character.isHighSurrogate(character)) {
                // The low surrogate that follows is part of the same 4-byte sequence.
                length += 4;
            } else if (!Character.isLowSurrogate(character)) {
                length += 3;
            }
        }
        return length;
    }

    private final StringBuilder builder = new StringBuilder();
    private int byteLength = 0;

    private static final Set<String> voidElements = Set.of(
        "area",
        "base",
        "basefont",
        "bgsound",
        "br",
        "col",
        "embed",
        "frame",
        "hr",
        "img",
        "input",
        "keygen",
        "link",
        "meta",
        "param",
        "source",
        "track",
        "wbr"
    );

    private static final Set<String> rawTextElements =
        Set.of("style", "script", "xmp", "iframe", "noembed", "noframes", "plaintext");

    private sealed interface Escaper {
        @Nullable String escape(char character);
    }

    private static final class TextEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return switch (character) {
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '&' -> "&amp;";
                case '\u00A0' -> "&nbsp;";
                default -> null;
            };
        }

        private static final TextEscaper instance = new TextEscaper();
    }

    private static final class AttributeEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return switch (character) {
                case '"' -> "&quot;";
                case '&' -> "&amp;";
                case '\u00A0' -> "&nbsp;";
                default -> null;
            };
        }

        private static final AttributeEscaper instance = new AttributeEscaper();
    }
}
