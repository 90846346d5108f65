// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.html;

/**
 * A stylesheet the document uses, taken out of its head.
 */
public sealed interface Css {
    /**
     * An external stylesheet.
     *
     * @param href The resolved location, or the original {@code href} if the resolver didn't know it.
     */
    record Link(String href) implements Css {
    }

    /**
     * The content of a {@code <style>} element.
     */
    record Inline(String content) implements Css {
    }
}
