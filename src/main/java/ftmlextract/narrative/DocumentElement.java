// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.narrative;

import java.util.List;
import ftmlextract.term.Term;
import ftmlextract.uri.DocumentElementUri;
import ftmlextract.uri.DocumentUri;
import ftmlextract.uri.ModuleUri;
import ftmlextract.uri.SymbolUri;
import ftmlextract.util.annotation.Nullable;

/**
 * A finished narrative element.
 * <p>
 * Elements that correspond to a piece of markup carry its {@link DocumentRange}, so that the fragment can be cut out
 * of the serialized HTML later.
 */
public sealed interface DocumentElement {
    /**
     * Returns the child elements, or an empty list for elements that can't have any.
     */
    default List<DocumentElement> children() {
        return List.of();
    }

    record Section(
        DocumentElementUri uri,
        DocumentRange range,
        @Nullable Title title,
        List<DocumentElement> children
    ) implements DocumentElement {
        public Section {
            children = List.copyOf(children);
        }
    }

    /**
     * A logical paragraph: a definition, assertion, example, proof or plain paragraph.
     *
     * @param styles The paragraph styles, referring to {@link DocumentStyle} names.
     * @param fors   The symbols the paragraph is about, with the definiens it gives them if any.
     */
    record Paragraph(
        DocumentElementUri uri,
        ParagraphKind kind,
        boolean isInline,
        DocumentRange range,
        @Nullable Title title,
        List<String> styles,
        List<ParagraphSubject> fors,
        List<DocumentElement> children
    ) implements DocumentElement {
        public Paragraph {
            styles = List.copyOf(styles);
            fors = List.copyOf(fors);
            children = List.copyOf(children);
        }
    }

    record Slide(
        DocumentElementUri uri,
        DocumentRange range,
        @Nullable Title title,
        List<DocumentElement> children
    ) implements DocumentElement {
        public Slide {
            children = List.copyOf(children);
        }
    }

    /**
     * Content that belongs to a section level that's skipped, such as the preamble between a chapter heading and
     * its first section.
     */
    record SkipSection(List<DocumentElement> children) implements DocumentElement {
        public SkipSection {
            children = List.copyOf(children);
        }
    }

    /**
     * The narrative side of a module: the markup that declares it.
     */
    record ModuleBlock(
        ModuleUri module,
        DocumentRange range,
        List<DocumentElement> children
    ) implements DocumentElement {
        public ModuleBlock {
            children = List.copyOf(children);
        }
    }

    /**
     * The narrative side of a mathematical structure.
     */
    record Structure(
        SymbolUri structure,
        DocumentRange range,
        List<DocumentElement> children
    ) implements DocumentElement {
        public Structure {
            children = List.copyOf(children);
        }
    }

    record Morphism(
        SymbolUri morphism,
        DocumentRange range,
        List<DocumentElement> children
    ) implements DocumentElement {
        public Morphism {
            children = List.copyOf(children);
        }
    }

    record VariableDeclaration(DocumentElementUri uri, VariableData data) implements DocumentElement {
    }

    /**
     * A presentation template for a symbol or variable.
     *
     * @param head                 The presented symbol or variable, as a {@link Term.Symbol} or {@link Term.Var}.
     * @param id                   The notation's name, if it has one.
     * @param argumentPrecedences  One precedence per argument; empty if not declared.
     */
    record Notation(
        DocumentElementUri uri,
        Term head,
        @Nullable String id,
        int precedence,
        List<Integer> argumentPrecedences,
        DocumentRange range
    ) implements DocumentElement {
        public Notation {
            argumentPrecedences = List.copyOf(argumentPrecedences);
        }
    }

    record SymbolReference(DocumentRange range, SymbolUri uri, @Nullable String notation) implements DocumentElement {
    }

    record VariableReference(
        DocumentRange range,
        DocumentElementUri uri,
        @Nullable String notation
    ) implements DocumentElement {
    }

    /**
     * A complex term occurring in running text.
     */
    record TermElement(DocumentElementUri uri, Term term) implements DocumentElement {
    }

    /**
     * The occurrence of a symbol being defined.
     */
    record Definiendum(DocumentRange range, SymbolUri uri) implements DocumentElement {
    }

    /**
     * An inclusion of another document at this point.
     */
    record DocumentReference(DocumentElementUri uri, DocumentUri target) implements DocumentElement {
    }

    record UseModule(ModuleUri module) implements DocumentElement {
    }

    record ImportModule(ModuleUri module) implements DocumentElement {
    }
}
