// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.extraction;

import java.util.ArrayList;
import java.util.List;
import ftmlextract.narrative.DocumentElement;
import ftmlextract.narrative.ParagraphKind;
import ftmlextract.narrative.ParagraphSubject;
import ftmlextract.narrative.Title;
import ftmlextract.narrative.VariableData;
import ftmlextract.term.Term;
import ftmlextract.uri.DocumentElementUri;
import ftmlextract.uri.ModuleUri;
import ftmlextract.uri.SymbolUri;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A frame on the narrative stack: a document element whose content is still being read.
 */
public sealed interface OpenNarrativeElement {
    /**
     * Returns the list closed child elements are appended to, or {@code null} if this frame doesn't take children.
     */
    default @Nullable List<DocumentElement> children() {
        return null;
    }

    /**
     * Frames that can be given a title.
     */
    sealed interface Titled extends OpenNarrativeElement {
        @Nullable Title title();

        void setTitle(Title title);

        DocumentElementUri uri();

        @Override
        List<DocumentElement> children();
    }

    record Module(ModuleUri uri, List<DocumentElement> children) implements OpenNarrativeElement {
        Module(final ModuleUri uri) {
            this(uri, new ArrayList<>());
        }
    }

    record Structure(SymbolUri uri, List<DocumentElement> children) implements OpenNarrativeElement {
        Structure(final SymbolUri uri) {
            this(uri, new ArrayList<>());
        }
    }

    record Morphism(SymbolUri uri, List<DocumentElement> children) implements OpenNarrativeElement {
        Morphism(final SymbolUri uri) {
            this(uri, new ArrayList<>());
        }
    }

    final class Section implements Titled {
        Section(final DocumentElementUri uri) {
            this.uri = uri;
        }

        @Override
        public DocumentElementUri uri() {
            return uri;
        }

        @Override
        public @Nullable Title title() {
            return title;
        }

        @Override
        public void setTitle(final Title title) {
            this.title = title;
        }

        @Override
        public List<DocumentElement> children() {
            return children;
        }

        private final DocumentElementUri uri;
        private @Nullable Title title = null;
        private final List<DocumentElement> children = new ArrayList<>();
    }

    final class Paragraph implements Titled {
        Paragraph(
            final DocumentElementUri uri,
            final ParagraphKind kind,
            final boolean isInline,
            final List<String> styles,
            final List<SymbolUri> fors
        ) {
            this.uri = uri;
            this.kind = kind;
            this.isInline = isInline;
            this.styles = List.copyOf(styles);
            for (final var symbol : fors) {
                this.fors.add(new ParagraphSubject(symbol, null));
            }
        }

        @Override
        public DocumentElementUri uri() {
            return uri;
        }

        public ParagraphKind kind() {
            return kind;
        }

        public boolean isInline() {
            return isInline;
        }

        public List<String> styles() {
            return styles;
        }

        /**
         * Returns the symbols this paragraph is about, in declaration order.
         */
        public List<ParagraphSubject> fors() {
            return fors;
        }

        /**
         * Records the definiens of {@code symbol}, adding it to the subjects if it's not there yet.
         */
        void define(final SymbolUri symbol, final Term definiens) {
            for (int i = 0; i < fors.size(); i += 1) {
                if (fors.get(i).symbol().equals(symbol)) {
                    fors.set(i, new ParagraphSubject(symbol, definiens));
                    return;
                }
            }
            fors.add(new ParagraphSubject(symbol, definiens));
        }

        @Override
        public @Nullable Title title() {
            return title;
        }

        @Override
        public void setTitle(final Title title) {
            this.title = title;
        }

        @Override
        public List<DocumentElement> children() {
            return children;
        }

        private final DocumentElementUri uri;
        private final ParagraphKind kind;
        private final boolean isInline;
        private final List<String> styles;
        private final List<ParagraphSubject> fors = new ArrayList<>();
        private @Nullable Title title = null;
        private final List<DocumentElement> children = new ArrayList<>();
    }

    final class Slide implements Titled {
        Slide(final DocumentElementUri uri) {
            this.uri = uri;
        }

        @Override
        public DocumentElementUri uri() {
            return uri;
        }

        @Override
        public @Nullable Title title() {
            return title;
        }

        @Override
        public void setTitle(final Title title) {
            this.title = title;
        }

        @Override
        public List<DocumentElement> children() {
            return children;
        }

        private final DocumentElementUri uri;
        private @Nullable Title title = null;
        private final List<DocumentElement> children = new ArrayList<>();
    }

    record SkipSection(List<DocumentElement> children) implements OpenNarrativeElement {
        SkipSection() {
            this(new ArrayList<>());
        }
    }

    record Invisible() implements OpenNarrativeElement {
    }

    final class VariableDeclaration implements OpenNarrativeElement {
        VariableDeclaration(final DocumentElementUri uri, final VariableData data) {
            this.uri = uri;
            this.data = data;
        }

        public DocumentElementUri uri() {
            return uri;
        }

        public VariableData data() {
            return data;
        }

        void setData(final VariableData data) {
            this.data = data;
        }

        private final DocumentElementUri uri;
        private VariableData data;
    }

    record Notation(
        DocumentElementUri uri,
        Term head,
        @Nullable String id,
        int precedence,
        List<Integer> argumentPrecedences
    ) implements OpenNarrativeElement {
    }

    record Definiendum(SymbolUri symbol) implements OpenNarrativeElement {
    }
}
