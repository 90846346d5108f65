// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.html;

import java.util.ArrayList;
import java.util.List;
import ftmlextract.extraction.CloseElement;
import ftmlextract.extraction.FtmlNode;
import ftmlextract.narrative.DocumentRange;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.jsoup.nodes.Element;

/**
 * An element being walked, with its place in the output and the close markers its rules returned.
 * <p>
 * An element known to be removed from the output when it ends, and everything inside it, reports the empty range at
 * the point of removal.
 */
final class TrackedNode implements FtmlNode {
    TrackedNode(final Element element, final OffsetSerializer.Position start, final @Nullable TrackedNode parent) {
        this.element = element;
        this.start = start;
        removedAt = (parent != null) ? parent.removedAt : null;
    }

    Element element() {
        return element;
    }

    OffsetSerializer.Position start() {
        return start;
    }

    List<CloseElement> markers() {
        return markers;
    }

    void setEnd(final int end) {
        this.end = end;
    }

    /**
     * Marks the element for removal once it ends. Must be called before any child is opened.
     */
    void markForRemoval() {
        isMarkedForRemoval = true;
        if (removedAt == null) {
            removedAt = start;
        }
    }

    boolean isRemoved() {
        return isDeleted || isMarkedForRemoval;
    }

    @Override
    public DocumentRange range() {
        assert end >= 0 : "Range of an element that hasn't ended";
        final var removalPoint = removedAt;
        if (removalPoint != null) {
            return new DocumentRange(removalPoint.bytes(), removalPoint.bytes());
        }
        return new DocumentRange(start.bytes(), end);
    }

    @Override
    public String text() {
        return element.text();
    }

    @Override
    public void delete() {
        isDeleted = true;
    }

    private final Element element;
    private final OffsetSerializer.Position start;
    private final List<CloseElement> markers = new ArrayList<>();
    private OffsetSerializer.@Nullable Position removedAt;
    private int end = -1;
    private boolean isDeleted = false;
    private boolean isMarkedForRemoval = false;
}
