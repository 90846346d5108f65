// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.extraction;

import java.util.List;
import ftmlextract.domain.SymbolData;
import ftmlextract.narrative.DocumentCounter;
import ftmlextract.narrative.DocumentStyle;
import ftmlextract.narrative.ParagraphKind;
import ftmlextract.narrative.SectionLevel;
import ftmlextract.narrative.VariableData;
import ftmlextract.term.ArgumentPosition;
import ftmlextract.term.Term;
import ftmlextract.term.Variable;
import ftmlextract.uri.DocumentElementUri;
import ftmlextract.uri.DocumentUri;
import ftmlextract.uri.Language;
import ftmlextract.uri.ModuleUri;
import ftmlextract.uri.SymbolUri;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Something a rule found on an element: a construct that starts there, or a fact about the document.
 * <p>
 * {@link #split()} decides what each one contributes to the domain and narrative stacks.
 */
public sealed interface OpenElement {
    Split split();

    record Module(
        ModuleUri uri,
        @Nullable ModuleUri metatheory,
        @Nullable Language language,
        @Nullable Language signature
    ) implements OpenElement {
        @Override
        public Split split() {
            return new Split.Open(
                new OpenDomainElement.Module(uri, metatheory, language, signature),
                new OpenNarrativeElement.Module(uri)
            );
        }
    }

    record Structure(SymbolUri uri, @Nullable String macroname) implements OpenElement {
        @Override
        public Split split() {
            return new Split.Open(
                new OpenDomainElement.Structure(uri, macroname),
                new OpenNarrativeElement.Structure(uri)
            );
        }
    }

    record Morphism(SymbolUri uri, ModuleUri domain, boolean isTotal) implements OpenElement {
        @Override
        public Split split() {
            return new Split.Open(
                new OpenDomainElement.Morphism(uri, domain, isTotal),
                new OpenNarrativeElement.Morphism(uri)
            );
        }
    }

    /**
     * An assignment to a symbol of the enclosing morphism's domain. Its definiens and type are read from the content.
     */
    record Assign(SymbolUri source) implements OpenElement {
        @Override
        public Split split() {
            return Split.Open.domain(new OpenDomainElement.Assign(source));
        }
    }

    record Rename(SymbolUri source, @Nullable String newName, @Nullable String macroname) implements OpenElement {
        @Override
        public Split split() {
            return new Split.Meta(new MetaDatum.Rename(source, newName, macroname));
        }
    }

    record SymbolDeclaration(SymbolUri uri, SymbolData data) implements OpenElement {
        @Override
        public Split split() {
            return Split.Open.domain(new OpenDomainElement.SymbolDeclaration(uri, data));
        }
    }

    record VariableDeclaration(DocumentElementUri uri, VariableData data) implements OpenElement {
        @Override
        public Split split() {
            return Split.Open.narrative(new OpenNarrativeElement.VariableDeclaration(uri, data));
        }
    }

    record Section(DocumentElementUri uri) implements OpenElement {
        @Override
        public Split split() {
            return Split.Open.narrative(new OpenNarrativeElement.Section(uri));
        }
    }

    record SkipSection() implements OpenElement {
        @Override
        public Split split() {
            return Split.Open.narrative(new OpenNarrativeElement.SkipSection());
        }
    }

    record Paragraph(
        DocumentElementUri uri,
        ParagraphKind kind,
        boolean isInline,
        List<String> styles,
        List<SymbolUri> fors
    ) implements OpenElement {
        public Paragraph {
            styles = List.copyOf(styles);
            fors = List.copyOf(fors);
        }

        @Override
        public Split split() {
            return Split.Open.narrative(new OpenNarrativeElement.Paragraph(uri, kind, isInline, styles, fors));
        }
    }

    record Slide(DocumentElementUri uri) implements OpenElement {
        @Override
        public Split split() {
            return Split.Open.narrative(new OpenNarrativeElement.Slide(uri));
        }
    }

    record Invisible() implements OpenElement {
        @Override
        public Split split() {
            return Split.Open.narrative(new OpenNarrativeElement.Invisible());
        }
    }

    record SectionTitle() implements OpenElement {
        @Override
        public Split split() {
            return new Split.None();
        }
    }

    record ParagraphTitle() implements OpenElement {
        @Override
        public Split split() {
            return new Split.None();
        }
    }

    record SlideTitle() implements OpenElement {
        @Override
        public Split split() {
            return new Split.None();
        }
    }

    record DocTitle() implements OpenElement {
        @Override
        public Split split() {
            return new Split.None();
        }
    }

    record SymbolReference(SymbolUri uri, @Nullable String notation) implements OpenElement {
        @Override
        public Split split() {
            return Split.Open.domain(new OpenDomainElement.SymbolReference(uri, notation));
        }
    }

    record VariableReference(Variable variable, @Nullable String notation) implements OpenElement {
        @Override
        public Split split() {
            return Split.Open.domain(new OpenDomainElement.VariableReference(variable, notation));
        }
    }

    /**
     * @param uri The URI of the term as a document element, or {@code null} if it's nested in another term.
     */
    record Application(Term head, @Nullable String notation, @Nullable DocumentElementUri uri) implements OpenElement {
        @Override
        public Split split() {
            return Split.Open.domain(new OpenDomainElement.Application(head, notation, uri));
        }
    }

    record Binding(Term head, @Nullable String notation, @Nullable DocumentElementUri uri) implements OpenElement {
        @Override
        public Split split() {
            return Split.Open.domain(new OpenDomainElement.Binding(head, notation, uri));
        }
    }

    record Argument(ArgumentPosition position) implements OpenElement {
        @Override
        public Split split() {
            return Split.Open.domain(new OpenDomainElement.Argument(position));
        }
    }

    record HeadTerm() implements OpenElement {
        @Override
        public Split split() {
            return Split.Open.domain(new OpenDomainElement.HeadTerm());
        }
    }

    record Type() implements OpenElement {
        @Override
        public Split split() {
            return Split.Open.domain(new OpenDomainElement.Type());
        }
    }

    record Definiens(@Nullable SymbolUri of) implements OpenElement {
        @Override
        public Split split() {
            return Split.Open.domain(new OpenDomainElement.Definiens(of));
        }
    }

    record Notation(
        DocumentElementUri uri,
        Term head,
        @Nullable String id,
        int precedence,
        List<Integer> argumentPrecedences
    ) implements OpenElement {
        public Notation {
            argumentPrecedences = List.copyOf(argumentPrecedences);
        }

        @Override
        public Split split() {
            return Split.Open.narrative(
                new OpenNarrativeElement.Notation(uri, head, id, precedence, argumentPrecedences)
            );
        }
    }

    record Definiendum(SymbolUri symbol) implements OpenElement {
        @Override
        public Split split() {
            return Split.Open.narrative(new OpenNarrativeElement.Definiendum(symbol));
        }
    }

    record Comp() implements OpenElement {
        @Override
        public Split split() {
            return Split.Open.domain(new OpenDomainElement.Comp());
        }
    }

    record DefComp() implements OpenElement {
        @Override
        public Split split() {
            return Split.Open.domain(new OpenDomainElement.DefComp());
        }
    }

    record Style(String name, @Nullable String counter) implements OpenElement {
        @Override
        public Split split() {
            return new Split.Meta(new MetaDatum.Style(new DocumentStyle(name, counter)));
        }
    }

    record Counter(DocumentCounter counter) implements OpenElement {
        @Override
        public Split split() {
            return new Split.Meta(new MetaDatum.Counter(counter));
        }
    }

    record InputRef(DocumentElementUri uri, DocumentUri target) implements OpenElement {
        @Override
        public Split split() {
            return new Split.Meta(new MetaDatum.InputRef(uri, target));
        }
    }

    record IfInputref(boolean value) implements OpenElement {
        @Override
        public Split split() {
            return new Split.Meta(new MetaDatum.IfInputref(value));
        }
    }

    record SetSectionLevel(SectionLevel level) implements OpenElement {
        @Override
        public Split split() {
            return new Split.Meta(new MetaDatum.SetSectionLevel(level));
        }
    }

    record ImportModule(ModuleUri module) implements OpenElement {
        @Override
        public Split split() {
            return new Split.Meta(new MetaDatum.ImportModule(module));
        }
    }

    record UseModule(ModuleUri module) implements OpenElement {
        @Override
        public Split split() {
            return new Split.Meta(new MetaDatum.UseModule(module));
        }
    }
}
