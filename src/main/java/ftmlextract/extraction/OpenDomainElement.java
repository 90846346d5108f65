// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.extraction;

import java.util.ArrayList;
import java.util.List;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import ftmlextract.domain.Assignment;
import ftmlextract.domain.Declaration;
import ftmlextract.domain.SymbolData;
import ftmlextract.term.ArgumentPosition;
import ftmlextract.term.Term;
import ftmlextract.term.Variable;
import ftmlextract.uri.DocumentElementUri;
import ftmlextract.uri.Language;
import ftmlextract.uri.ModuleUri;
import ftmlextract.uri.SymbolUri;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A frame on the domain stack: a declaration or term whose content is still being read.
 */
public sealed interface OpenDomainElement {
    /**
     * Frames that collect the terms closed directly inside them.
     */
    sealed interface TermCollector extends OpenDomainElement {
        List<Term> terms();
    }

    /**
     * Frames that are terms themselves.
     */
    sealed interface OpenTerm extends OpenDomainElement {
    }

    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The declaration list is filled in by the state")
    record Module(
        ModuleUri uri,
        @Nullable ModuleUri metatheory,
        @Nullable Language language,
        @Nullable Language signature,
        List<Declaration> declarations
    ) implements OpenDomainElement {
        Module(
            final ModuleUri uri,
            final @Nullable ModuleUri metatheory,
            final @Nullable Language language,
            final @Nullable Language signature
        ) {
            this(uri, metatheory, language, signature, new ArrayList<>());
        }
    }

    /**
     * A structure whose declarations are being read. They live in the module named after the structure, nested in the
     * structure's own module.
     */
    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The declaration list is filled in by the state")
    record Structure(
        SymbolUri uri,
        @Nullable String macroname,
        ModuleUri contentModule,
        List<Declaration> declarations
    ) implements OpenDomainElement {
        Structure(final SymbolUri uri, final @Nullable String macroname) {
            this(uri, macroname, uri.asNestedModule(), new ArrayList<>());
        }
    }

    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The assignment list is filled in by the state")
    record Morphism(
        SymbolUri uri,
        ModuleUri domain,
        boolean isTotal,
        List<Assignment> assignments
    ) implements OpenDomainElement {
        Morphism(final SymbolUri uri, final ModuleUri domain, final boolean isTotal) {
            this(uri, domain, isTotal, new ArrayList<>());
        }
    }

    /**
     * An assignment whose definiens and refined type are being read.
     */
    final class Assign implements OpenDomainElement {
        Assign(final SymbolUri source) {
            this.source = source;
        }

        public SymbolUri source() {
            return source;
        }

        public @Nullable Term definiens() {
            return definiens;
        }

        void setDefiniens(final Term definiens) {
            this.definiens = definiens;
        }

        public @Nullable Term refinedType() {
            return refinedType;
        }

        void setRefinedType(final Term refinedType) {
            this.refinedType = refinedType;
        }

        private final SymbolUri source;
        private @Nullable Term definiens = null;
        private @Nullable Term refinedType = null;
    }

    final class SymbolDeclaration implements OpenDomainElement {
        SymbolDeclaration(final SymbolUri uri, final SymbolData data) {
            this.uri = uri;
            this.data = data;
        }

        public SymbolUri uri() {
            return uri;
        }

        public SymbolData data() {
            return data;
        }

        void setData(final SymbolData data) {
            this.data = data;
        }

        private final SymbolUri uri;
        private SymbolData data;
    }

    record SymbolReference(SymbolUri uri, @Nullable String notation) implements OpenTerm {
    }

    record VariableReference(Variable variable, @Nullable String notation) implements OpenTerm {
    }

    /**
     * An application under construction. The head may be replaced by an explicit head term.
     */
    final class Application implements OpenTerm {
        Application(final Term head, final @Nullable String notation, final @Nullable DocumentElementUri uri) {
            this.head = head;
            this.notation = notation;
            this.uri = uri;
        }

        public Term head() {
            return head;
        }

        void setHead(final Term head) {
            this.head = head;
        }

        public @Nullable String notation() {
            return notation;
        }

        /**
         * Returns the URI of the term as a document element, or {@code null} if it's nested in another term.
         */
        public @Nullable DocumentElementUri uri() {
            return uri;
        }

        List<OpenArgument> arguments() {
            return arguments;
        }

        private Term head;
        private final @Nullable String notation;
        private final @Nullable DocumentElementUri uri;
        private final List<OpenArgument> arguments = new ArrayList<>();
    }

    /**
     * A binding under construction. Its last argument slot holds the body.
     */
    final class Binding implements OpenTerm {
        Binding(final Term head, final @Nullable String notation, final @Nullable DocumentElementUri uri) {
            this.head = head;
            this.notation = notation;
            this.uri = uri;
        }

        public Term head() {
            return head;
        }

        void setHead(final Term head) {
            this.head = head;
        }

        public @Nullable String notation() {
            return notation;
        }

        public @Nullable DocumentElementUri uri() {
            return uri;
        }

        List<OpenBoundArgument> arguments() {
            return arguments;
        }

        private Term head;
        private final @Nullable String notation;
        private final @Nullable DocumentElementUri uri;
        private final List<OpenBoundArgument> arguments = new ArrayList<>();
    }

    record Argument(ArgumentPosition position, List<Term> terms) implements TermCollector {
        Argument(final ArgumentPosition position) {
            this(position, new ArrayList<>());
        }
    }

    record HeadTerm(List<Term> terms) implements TermCollector {
        HeadTerm() {
            this(new ArrayList<>());
        }
    }

    record Type(List<Term> terms) implements TermCollector {
        Type() {
            this(new ArrayList<>());
        }
    }

    /**
     * @param of The symbol being defined, if named explicitly.
     */
    record Definiens(@Nullable SymbolUri of, List<Term> terms) implements TermCollector {
        Definiens(final @Nullable SymbolUri of) {
            this(of, new ArrayList<>());
        }
    }

    record Comp() implements OpenDomainElement {
    }

    record DefComp() implements OpenDomainElement {
    }
}
