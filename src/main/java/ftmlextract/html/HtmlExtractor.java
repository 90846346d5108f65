// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.html;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import ftmlextract.extraction.AttributeRecognizer;
import ftmlextract.extraction.CloseElement;
import ftmlextract.extraction.ExtractionErrorCondition;
import ftmlextract.extraction.ExtractorState;
import ftmlextract.extraction.FtmlAttributes;
import ftmlextract.extraction.RuleTable;
import ftmlextract.narrative.DocumentRange;
import ftmlextract.util.Trace;
import ftmlextract.util.condition.ConditionContext;
import ftmlextract.util.condition.Handler;
import ftmlextract.util.condition.SignaledCondition;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.DocumentType;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.nodes.XmlDeclaration;
import org.jsoup.parser.Parser;

/**
 * Extracts the semantic content of an FTML-annotated HTML document.
 * <p>
 * The document is parsed with jsoup, then walked once: every element is serialized as it's entered, its FTML
 * attributes are run through the {@link RuleTable}, and the close markers they return are run when the element ends.
 * An annotation that can't be processed is recorded as a {@link SemanticDiagnostic} and skipped; extraction itself
 * never fails.
 * <p>
 * Extraction is confined to the calling thread.
 */
public final class HtmlExtractor {
    private HtmlExtractor(final ExtractionOptions options) {
        this.options = options;
        state = new ExtractorState(options.documentUri());
    }

    /**
     * Extracts everything from the given HTML text.
     */
    public static HtmlExtractionResult extract(final String html, final ExtractionOptions options) {
        final var extractor = new HtmlExtractor(options);
        try (final var trace = new Trace(() -> "Extracting " + options.documentUri())) {
            trace.use();
            try (final var handler = new Handler(extractor::handleCondition)) {
                handler.use();
                return extractor.run(html);
            }
        }
    }

    private HtmlExtractionResult run(final String html) {
        final var parser = Parser.htmlParser().setTrackErrors(options.maxParseErrors());
        final var document = parser.parseInput(html, "");
        final var warnings = new ArrayList<ParseWarning>();
        for (final var error : parser.getErrors()) {
            warnings.add(new ParseWarning(error.getPosition(), error.getErrorMessage()));
        }

        walk(document);

        return new HtmlExtractionResult(
            serializer.result(),
            List.copyOf(stylesheets),
            bodyRange,
            bodyHeaderLength,
            state.finish(),
            diagnostics,
            warnings
        );
    }

    private void walk(final Document document) {
        final var cursors = new ArrayDeque<Cursor>();
        cursors.push(new Cursor(document, null));
        while (!cursors.isEmpty()) {
            final var cursor = cursors.peek();
            final var parent = cursor.node;
            if (cursor.nextChild < parent.childNodeSize()) {
                final var child = parent.childNode(cursor.nextChild);
                cursor.nextChild += 1;
                if (child instanceof final Element element) {
                    final var tracked = open(element, cursor.tracked);
                    if (!OffsetSerializer.isVoid(element)) {
                        cursors.push(new Cursor(element, tracked));
                    } else if (close(tracked)) {
                        cursor.nextChild -= 1;
                    }
                } else {
                    writeLeaf(child);
                }
            } else {
                cursors.pop();
                if (cursor.tracked != null && close(cursor.tracked)) {
                    final var parentCursor = cursors.peek();
                    assert parentCursor != null : "Removed an element without a parent";
                    parentCursor.nextChild -= 1;
                }
            }
        }
    }

    private void writeLeaf(final Node node) {
        if (node instanceof final DataNode data) {
            serializer.data(data);
        } else if (node instanceof final TextNode text) {
            serializer.text(text);
        } else if (node instanceof final DocumentType doctype) {
            serializer.doctype(doctype);
        } else if (!(node instanceof Comment || node instanceof XmlDeclaration)) {
            throw new IllegalStateException("Unexpected node type " + node.getClass().getName());
        }
    }

    private TrackedNode open(final Element element, final @Nullable TrackedNode parent) {
        final var tracked = new TrackedNode(element, serializer.position(), parent);
        currentElementStart = tracked.start().bytes();

        final var keys = AttributeRecognizer.recognize(element.attributes());
        if (!keys.isEmpty()) {
            final var attributes = new FtmlAttributes(element.attributes(), keys);
            for (var key = attributes.nextKey(); key != null; key = attributes.nextKey()) {
                final var currentKey = key;
                final var marker = ConditionContext.withRestart(skipMarkerRestart, restart -> {
                    try (final var trace = new Trace(() ->
                        "Applying " + currentKey.attributeName() + " on <" + element.tagName() + ">"
                    )) {
                        trace.use();
                        return RuleTable.apply(currentKey, state, attributes);
                    }
                });
                if (marker != null) {
                    tracked.markers().add(marker);
                }
            }
        }

        if (tracked.markers().contains(CloseElement.INVISIBLE) || isHeadStylesheet(element)) {
            tracked.markForRemoval();
        }

        if (element.normalName().equals("img") && element.hasAttr("src")) {
            options.imageResolver().apply(element.attr("src")).ifPresent(src -> element.attr("src", src));
        }

        serializer.startTag(element);
        if (element.normalName().equals("body")) {
            bodyHeaderLength = serializer.byteOffset() - tracked.start().bytes();
        }
        return tracked;
    }

    /**
     * Ends the element and runs its close markers.
     *
     * @return Whether the element was removed from the document tree.
     */
    private boolean close(final TrackedNode tracked) {
        final var element = tracked.element();
        serializer.endTag(element);
        tracked.setEnd(serializer.byteOffset());
        currentElementStart = tracked.start().bytes();

        if (element.normalName().equals("body")) {
            bodyRange = tracked.range();
        } else if (isHeadStylesheet(element)) {
            takeStylesheet(element);
        }

        final var markers = tracked.markers();
        for (int i = markers.size() - 1; i >= 0; i -= 1) {
            final var marker = markers.get(i);
            ConditionContext.withRestart(skipMarkerRestart, restart -> {
                try (final var trace = new Trace(() ->
                    "Closing " + describe(marker) + " on <" + element.tagName() + ">"
                )) {
                    trace.use();
                    state.close(marker, tracked);
                    return null;
                }
            });
        }

        if (!tracked.isRemoved()) {
            return false;
        }
        serializer.rewind(tracked.start());
        // Detached, so that the text of enclosing elements matches the output.
        element.remove();
        return true;
    }

    private void takeStylesheet(final Element element) {
        if (element.normalName().equals("link")) {
            final var href = element.attr("href");
            stylesheets.add(new Css.Link(options.stylesheetResolver().apply(href).orElse(href)));
        } else {
            stylesheets.add(new Css.Inline(element.data()));
        }
    }

    private void handleCondition(final SignaledCondition signaled) {
        if (!(signaled.condition() instanceof final ExtractionErrorCondition condition)) {
            return;
        }
        for (final var restart : ConditionContext.restarts()) {
            if (restart.name().equals(skipMarkerRestart)) {
                diagnostics.add(new SemanticDiagnostic(condition.error(), currentElementStart, Trace.activeTraces()));
                restart.unwindTo();
                return;
            }
        }
    }

    private static boolean isHeadStylesheet(final Element element) {
        final var parent = element.parent();
        if (parent == null || !parent.normalName().equals("head")) {
            return false;
        }
        return switch (element.normalName()) {
            case "link" -> isStylesheetLink(element) && element.hasAttr("href");
            case "style" -> true;
            default -> false;
        };
    }

    private static boolean isStylesheetLink(final Element element) {
        for (final var rel : element.attr("rel").split("\\s+")) {
            if (rel.equalsIgnoreCase("stylesheet")) {
                return true;
            }
        }
        return false;
    }

    private static String describe(final CloseElement marker) {
        return marker.name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }

    private static final String skipMarkerRestart = "skip-ftml-marker";

    private final ExtractionOptions options;
    private final ExtractorState state;
    private final OffsetSerializer serializer = new OffsetSerializer();
    private final Set<Css> stylesheets = new LinkedHashSet<>();
    private final List<SemanticDiagnostic> diagnostics = new ArrayList<>();
    private @Nullable DocumentRange bodyRange = null;
    private int bodyHeaderLength = 0;
    private int currentElementStart = 0;

    private static final class Cursor {
        private Cursor(final Node node, final @Nullable TrackedNode tracked) {
            this.node = node;
            this.tracked = tracked;
        }

        private final Node node;
        private final @Nullable TrackedNode tracked;
        private int nextChild = 0;
    }
}
