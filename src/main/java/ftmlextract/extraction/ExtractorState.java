// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.extraction;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;
import ftmlextract.domain.Assignment;
import ftmlextract.domain.Declaration;
import ftmlextract.narrative.Document;
import ftmlextract.narrative.DocumentCounter;
import ftmlextract.narrative.DocumentElement;
import ftmlextract.narrative.DocumentStyle;
import ftmlextract.narrative.SectionLevel;
import ftmlextract.narrative.Title;
import ftmlextract.term.Argument;
import ftmlextract.term.BoundArgument;
import ftmlextract.term.Term;
import ftmlextract.term.Variable;
import ftmlextract.uri.DocumentElementUri;
import ftmlextract.uri.DocumentUri;
import ftmlextract.uri.ModuleUri;
import ftmlextract.uri.SymbolUri;
import ftmlextract.util.UnreachableCodeReachedError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The extraction state of one document: two stacks of open frames, one for the formal content and one for the
 * document structure, plus everything already finished.
 * <p>
 * Rules query the state and {@link #add(OpenElement) add} what they found; the markers they return are
 * {@link #close(CloseElement, FtmlNode) closed} when their element ends, innermost first. Closing pops the matching
 * frame and attaches what it built to its parent. Failures are signaled as {@link ExtractionErrorCondition}s.
 */
public final class ExtractorState {
    public ExtractorState(final DocumentUri documentUri) {
        this.documentUri = documentUri;
    }

    public DocumentUri documentUri() {
        return documentUri;
    }

    /**
     * Returns the URI of the module whose content is being read, or {@code null} if the innermost domain frame is
     * neither a module nor a structure. The content of a structure lives in its {@link SymbolUri#asNestedModule()}.
     */
    public @Nullable ModuleUri currentModule() {
        final var top = domainStack.peek();
        if (top instanceof final OpenDomainElement.Module module) {
            return module.uri();
        } else if (top instanceof final OpenDomainElement.Structure structure) {
            return structure.contentModule();
        }
        return null;
    }

    /**
     * Returns whether the innermost domain frame is a structure.
     */
    public boolean inStructure() {
        return domainStack.peek() instanceof OpenDomainElement.Structure;
    }

    /**
     * Returns the domain of the morphism whose assignments are being read, or {@code null} if the innermost domain
     * frame isn't a morphism.
     */
    public @Nullable ModuleUri morphismDomain() {
        return (domainStack.peek() instanceof final OpenDomainElement.Morphism morphism) ? morphism.domain() : null;
    }

    /**
     * Returns the URI of a new element named {@code name} in the innermost enclosing section, paragraph or slide, or
     * the document itself. Returns {@code null} if {@code name} isn't a valid element name.
     */
    public @Nullable DocumentElementUri elementUri(final String name) {
        for (final var frame : narrativeStack) {
            if (frame instanceof final OpenNarrativeElement.Titled titled) {
                return titled.uri().child(name);
            }
        }
        return documentUri.element(name);
    }

    /**
     * Returns a fresh element name for the given prefix.
     */
    public String newId(final String prefix) {
        return ids.next(prefix);
    }

    /**
     * Returns whether a term is being read.
     */
    public boolean inTerm() {
        for (final var frame : domainStack) {
            if (frame instanceof OpenDomainElement.OpenTerm) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns whether a notation is being read. Terms and arguments inside notations are presentation only.
     */
    public boolean inNotation() {
        for (final var frame : narrativeStack) {
            if (frame instanceof OpenNarrativeElement.Notation) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns whether the innermost domain frame is an application or binding, which can take arguments.
     */
    public boolean hasOpenApplication() {
        final var top = domainStack.peek();
        return top instanceof OpenDomainElement.Application || top instanceof OpenDomainElement.Binding;
    }

    /**
     * Returns whether the innermost domain frame is a term, which can have presentation components.
     */
    public boolean inReferenceOrApplication() {
        return domainStack.peek() instanceof OpenDomainElement.OpenTerm;
    }

    /**
     * Returns the title marker for a title starting now, or {@code null} if there's nothing to give a title to.
     */
    public @Nullable CloseElement titleMarker() {
        final var target = titleTarget();
        if (target instanceof OpenNarrativeElement.Section) {
            return CloseElement.SECTION_TITLE;
        } else if (target instanceof OpenNarrativeElement.Paragraph) {
            return CloseElement.PARAGRAPH_TITLE;
        } else if (target instanceof OpenNarrativeElement.Slide) {
            return CloseElement.SLIDE_TITLE;
        } else if (target == null) {
            return null;
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    /**
     * Finds a declared variable by name, innermost declaration first. Returns {@code null} if there is none in scope.
     */
    public @Nullable Variable resolveVariableName(final String name) {
        for (final var frame : narrativeStack) {
            final var children = frame.children();
            if (children != null) {
                final var variable = findVariable(children, name);
                if (variable != null) {
                    return variable;
                }
            }
        }
        return findVariable(topLevel, name);
    }

    /**
     * Returns the open domain frames, innermost first.
     */
    public List<OpenDomainElement> domainFrames() {
        return List.copyOf(domainStack);
    }

    /**
     * Returns the open narrative frames, innermost first.
     */
    public List<OpenNarrativeElement> narrativeFrames() {
        return List.copyOf(narrativeStack);
    }

    /**
     * Pushes the frames of an element that starts now, or applies the fact it states.
     */
    public void add(final OpenElement element) {
        final var split = element.split();
        if (split instanceof final Split.Open open) {
            final var domain = open.domain();
            if (domain != null) {
                domainStack.push(domain);
            }
            final var narrative = open.narrative();
            if (narrative != null) {
                narrativeStack.push(narrative);
            }
        } else if (split instanceof final Split.Meta meta) {
            apply(meta.datum());
        } else if (!(split instanceof Split.None)) {
            throw new UnreachableCodeReachedError();
        }
    }

    /**
     * Finishes what the given marker opened. {@code node} is the element that carried the marker, already ended.
     * <p>
     * If the innermost frame doesn't belong to the marker, the stacks are left as they are.
     */
    public void close(final CloseElement marker, final FtmlNode node) {
        switch (marker) {
            case MODULE -> closeModule(marker, node);
            case STRUCTURE -> closeStructure(marker, node);
            case MORPHISM -> closeMorphism(marker, node);
            case ASSIGNMENT -> {
                final var frame = popDomain(OpenDomainElement.Assign.class, marker);
                if (!(domainStack.peek() instanceof final OpenDomainElement.Morphism morphism)) {
                    throw notIn(marker, "assignment outside of a morphism");
                }
                updateAssignment(morphism, frame.source(), assignment ->
                    assignment.withTerms(frame.definiens(), frame.refinedType())
                );
            }
            case SYMBOL_DECLARATION -> closeSymbolDeclaration(marker);
            case VARIABLE_DECLARATION -> {
                final var frame = popNarrative(OpenNarrativeElement.VariableDeclaration.class, marker);
                pushElement(new DocumentElement.VariableDeclaration(frame.uri(), frame.data()));
            }
            case SECTION -> {
                final var frame = popNarrative(OpenNarrativeElement.Section.class, marker);
                pushElement(new DocumentElement.Section(frame.uri(), node.range(), frame.title(), frame.children()));
            }
            case SKIP_SECTION -> {
                final var frame = popNarrative(OpenNarrativeElement.SkipSection.class, marker);
                pushElement(new DocumentElement.SkipSection(frame.children()));
            }
            case PARAGRAPH -> {
                final var frame = popNarrative(OpenNarrativeElement.Paragraph.class, marker);
                pushElement(new DocumentElement.Paragraph(
                    frame.uri(),
                    frame.kind(),
                    frame.isInline(),
                    node.range(),
                    frame.title(),
                    frame.styles(),
                    frame.fors(),
                    frame.children()
                ));
            }
            case SLIDE -> {
                final var frame = popNarrative(OpenNarrativeElement.Slide.class, marker);
                pushElement(new DocumentElement.Slide(frame.uri(), node.range(), frame.title(), frame.children()));
            }
            case INVISIBLE -> {
                popNarrative(OpenNarrativeElement.Invisible.class, marker);
                node.delete();
            }
            case SECTION_TITLE -> closeTitle(marker, OpenNarrativeElement.Section.class, node);
            case PARAGRAPH_TITLE -> closeTitle(marker, OpenNarrativeElement.Paragraph.class, node);
            case SLIDE_TITLE -> closeTitle(marker, OpenNarrativeElement.Slide.class, node);
            case DOC_TITLE -> {
                if (title != null) {
                    throw ExtractionErrorCondition.signal(
                        marker.key(),
                        ExtractionError.Reason.DUPLICATE_VALUE,
                        "document title already set"
                    );
                }
                title = node.text();
            }
            case SYMBOL_REFERENCE -> {
                final var frame = popDomain(OpenDomainElement.SymbolReference.class, marker);
                closeTerm(marker, new Term.Symbol(frame.uri()), node, frame.notation(), null);
            }
            case VARIABLE_REFERENCE -> {
                final var frame = popDomain(OpenDomainElement.VariableReference.class, marker);
                closeTerm(marker, new Term.Var(frame.variable()), node, frame.notation(), null);
            }
            case APPLICATION -> closeApplication(marker, node);
            case BINDING -> closeBinding(marker, node);
            case ARGUMENT -> closeArgument(marker, node);
            case HEAD_TERM -> {
                final var frame = popDomain(OpenDomainElement.HeadTerm.class, marker);
                final var term = asTerm(frame.terms(), node);
                final var parent = domainStack.peek();
                if (parent instanceof final OpenDomainElement.Application application) {
                    application.setHead(term);
                } else if (parent instanceof final OpenDomainElement.Binding binding) {
                    binding.setHead(term);
                } else {
                    throw notIn(marker, "head term outside of an application or binding");
                }
            }
            case TYPE -> closeType(marker, node);
            case DEFINIENS -> closeDefiniens(marker, node);
            case NOTATION -> {
                final var frame = popNarrative(OpenNarrativeElement.Notation.class, marker);
                final var notation = new DocumentElement.Notation(
                    frame.uri(),
                    frame.head(),
                    frame.id(),
                    frame.precedence(),
                    frame.argumentPrecedences(),
                    node.range()
                );
                notations.add(notation);
                pushElement(notation);
            }
            case DEFINIENDUM -> {
                final var frame = popNarrative(OpenNarrativeElement.Definiendum.class, marker);
                pushElement(new DocumentElement.Definiendum(node.range(), frame.symbol()));
            }
            case COMP -> popDomain(OpenDomainElement.Comp.class, marker);
            case DEF_COMP -> popDomain(OpenDomainElement.DefComp.class, marker);
        }
    }

    /**
     * Returns everything extracted so far. Frames still open are ignored.
     */
    public ExtractionResult finish() {
        final var document = new Document(documentUri, title, topLevel, topSectionLevel, styles, counters);
        return new ExtractionResult(document, declarations, notations);
    }

    private void apply(final MetaDatum datum) {
        if (datum instanceof final MetaDatum.Style style) {
            styles.add(style.style());
        } else if (datum instanceof final MetaDatum.Counter counter) {
            counters.add(counter.counter());
        } else if (datum instanceof final MetaDatum.InputRef inputRef) {
            pushElement(new DocumentElement.DocumentReference(inputRef.uri(), inputRef.target()));
        } else if (datum instanceof MetaDatum.IfInputref) {
            // Only meaningful when rendering.
        } else if (datum instanceof final MetaDatum.SetSectionLevel level) {
            topSectionLevel = level.level();
        } else if (datum instanceof final MetaDatum.ImportModule importModule) {
            final var top = domainStack.peek();
            final var declaration = new Declaration.Import(importModule.module());
            if (top instanceof final OpenDomainElement.Module module) {
                module.declarations().add(declaration);
            } else if (top instanceof final OpenDomainElement.Structure structure) {
                structure.declarations().add(declaration);
            } else {
                throw ExtractionErrorCondition.signal(
                    FtmlKey.IMPORT,
                    ExtractionError.Reason.NOT_IN,
                    "import outside of a module"
                );
            }
            pushElement(new DocumentElement.ImportModule(importModule.module()));
        } else if (datum instanceof final MetaDatum.UseModule useModule) {
            pushElement(new DocumentElement.UseModule(useModule.module()));
        } else if (datum instanceof final MetaDatum.Rename rename) {
            if (!(domainStack.peek() instanceof final OpenDomainElement.Morphism morphism)) {
                throw ExtractionErrorCondition.signal(
                    FtmlKey.RENAME,
                    ExtractionError.Reason.NOT_IN,
                    "rename outside of a morphism"
                );
            }
            updateAssignment(morphism, rename.source(), assignment ->
                assignment.withName(rename.newName(), rename.macroname())
            );
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private void closeModule(final CloseElement marker, final FtmlNode node) {
        final var domainTop = domainStack.peek();
        if (!(domainTop instanceof final OpenDomainElement.Module domain)) {
            throw unexpectedEnd(marker, "module", domainTop);
        }
        final var narrativeTop = narrativeStack.peek();
        if (!(narrativeTop instanceof final OpenNarrativeElement.Module narrative)) {
            throw unexpectedEnd(marker, "module", narrativeTop);
        }
        domainStack.pop();
        narrativeStack.pop();
        if (domainStack.peek() instanceof OpenDomainElement.Structure) {
            throw ExtractionErrorCondition.signal(
                marker.key(),
                ExtractionError.Reason.INVALID_IN,
                "module inside a structure"
            );
        }

        final var module = new Declaration.Module(
            domain.uri(),
            domain.metatheory(),
            domain.language(),
            domain.signature(),
            domain.declarations()
        );
        if (domainStack.peek() instanceof final OpenDomainElement.Module parent) {
            parent.declarations().add(module);
        } else {
            declarations.add(module);
        }
        pushElement(new DocumentElement.ModuleBlock(narrative.uri(), node.range(), narrative.children()));
    }

    private void closeStructure(final CloseElement marker, final FtmlNode node) {
        final var domainTop = domainStack.peek();
        if (!(domainTop instanceof final OpenDomainElement.Structure domain)) {
            throw unexpectedEnd(marker, "structure", domainTop);
        }
        final var narrativeTop = narrativeStack.peek();
        if (!(narrativeTop instanceof final OpenNarrativeElement.Structure narrative)) {
            throw unexpectedEnd(marker, "structure", narrativeTop);
        }
        domainStack.pop();
        narrativeStack.pop();

        if (!(domainStack.peek() instanceof final OpenDomainElement.Module module)) {
            throw notIn(marker, "structure outside of a module");
        }
        module.declarations().add(new Declaration.Structure(domain.uri(), domain.macroname(), domain.declarations()));
        pushElement(new DocumentElement.Structure(narrative.uri(), node.range(), narrative.children()));
    }

    private void closeMorphism(final CloseElement marker, final FtmlNode node) {
        final var domainTop = domainStack.peek();
        if (!(domainTop instanceof final OpenDomainElement.Morphism domain)) {
            throw unexpectedEnd(marker, "morphism", domainTop);
        }
        final var narrativeTop = narrativeStack.peek();
        if (!(narrativeTop instanceof final OpenNarrativeElement.Morphism narrative)) {
            throw unexpectedEnd(marker, "morphism", narrativeTop);
        }
        domainStack.pop();
        narrativeStack.pop();

        final var morphism =
            new Declaration.Morphism(domain.uri(), domain.domain(), domain.isTotal(), domain.assignments());
        final var parent = domainStack.peek();
        if (parent instanceof final OpenDomainElement.Module module) {
            module.declarations().add(morphism);
        } else if (parent instanceof final OpenDomainElement.Structure structure) {
            structure.declarations().add(morphism);
        } else {
            throw notIn(marker, "morphism outside of a module or structure");
        }
        pushElement(new DocumentElement.Morphism(narrative.uri(), node.range(), narrative.children()));
    }

    private void closeSymbolDeclaration(final CloseElement marker) {
        final var frame = popDomain(OpenDomainElement.SymbolDeclaration.class, marker);
        final var symbol = new Declaration.Symbol(frame.uri(), frame.data());
        final var parent = domainStack.peek();
        if (parent instanceof final OpenDomainElement.Module module) {
            module.declarations().add(symbol);
        } else if (parent instanceof final OpenDomainElement.Structure structure) {
            structure.declarations().add(symbol);
        } else if (parent == null) {
            declarations.add(symbol);
        } else {
            throw notIn(marker, "symbol declaration outside of a module or structure");
        }
    }

    private void closeTitle(
        final CloseElement marker,
        final Class<? extends OpenNarrativeElement.Titled> type,
        final FtmlNode node
    ) {
        final var target = titleTarget();
        if (target == null || !type.isInstance(target)) {
            throw unexpectedEnd(marker, type.getSimpleName().toLowerCase(Locale.ROOT), target);
        }
        if (target.title() != null) {
            throw ExtractionErrorCondition.signal(
                marker.key(),
                ExtractionError.Reason.DUPLICATE_VALUE,
                "title already set for " + target.uri()
            );
        }
        target.setTitle(new Title(node.text(), node.range()));
    }

    private void closeApplication(final CloseElement marker, final FtmlNode node) {
        final var frame = popDomain(OpenDomainElement.Application.class, marker);
        final var slots = frame.arguments();
        final var arguments = new ArrayList<Argument>(slots.size());
        for (int i = 0; i < slots.size(); i += 1) {
            final var argument = slots.get(i).close();
            if (argument == null) {
                throw missingArgument(marker, i);
            }
            arguments.add(argument);
        }
        closeTerm(marker, new Term.Application(frame.head(), arguments), node, frame.notation(), frame.uri());
    }

    private void closeBinding(final CloseElement marker, final FtmlNode node) {
        final var frame = popDomain(OpenDomainElement.Binding.class, marker);
        final var slots = frame.arguments();
        if (slots.isEmpty()) {
            throw ExtractionErrorCondition.signal(
                marker.key(),
                ExtractionError.Reason.MISSING_ARGUMENT,
                "binding has no body"
            );
        }
        final var arguments = new ArrayList<BoundArgument>(slots.size());
        for (int i = 0; i < slots.size(); i += 1) {
            final var argument = slots.get(i).close();
            if (argument == null) {
                throw missingArgument(marker, i);
            }
            arguments.add(argument);
        }
        final var last = arguments.remove(arguments.size() - 1);
        if (!(last instanceof final BoundArgument.Simple body)) {
            throw ExtractionErrorCondition.signal(
                marker.key(),
                ExtractionError.Reason.MISSING_ARGUMENT,
                "the body of a binding, argument " + slots.size() + ", must be a single term"
            );
        }
        final var term = new Term.Binding(frame.head(), arguments, body.term());
        closeTerm(marker, term, node, frame.notation(), frame.uri());
    }

    private void closeArgument(final CloseElement marker, final FtmlNode node) {
        final var frame = popDomain(OpenDomainElement.Argument.class, marker);
        final var term = asTerm(frame.terms(), node);
        final var parent = domainStack.peek();
        if (parent instanceof final OpenDomainElement.Application application) {
            OpenArgument.set(application.arguments(), frame.position(), term);
        } else if (parent instanceof final OpenDomainElement.Binding binding) {
            OpenBoundArgument.set(binding.arguments(), frame.position(), term);
        } else {
            throw notIn(marker, "argument outside of an application or binding");
        }
    }

    private void closeType(final CloseElement marker, final FtmlNode node) {
        final var frame = popDomain(OpenDomainElement.Type.class, marker);
        final var term = asTerm(frame.terms(), node);
        final var top = domainStack.peek();
        if (top instanceof final OpenDomainElement.SymbolDeclaration symbol) {
            symbol.setData(symbol.data().withType(term));
            return;
        }
        if (top instanceof final OpenDomainElement.Assign assign) {
            assign.setRefinedType(term);
            return;
        }
        final var variable = openVariableDeclaration();
        if (variable != null) {
            variable.setData(variable.data().withType(term));
            return;
        }
        throw notIn(marker, "type outside of a symbol or variable declaration");
    }

    private void closeDefiniens(final CloseElement marker, final FtmlNode node) {
        final var frame = popDomain(OpenDomainElement.Definiens.class, marker);
        final var term = asTerm(frame.terms(), node);
        final var top = domainStack.peek();
        if (top instanceof final OpenDomainElement.SymbolDeclaration symbol) {
            symbol.setData(symbol.data().withDefiniens(term));
            return;
        }
        if (top instanceof final OpenDomainElement.Assign assign) {
            assign.setDefiniens(term);
            return;
        }
        final var variable = openVariableDeclaration();
        if (variable != null) {
            variable.setData(variable.data().withDefiniens(term));
            return;
        }
        final var paragraph = openDefinitionParagraph();
        if (paragraph == null) {
            throw notIn(marker, "definiens outside of a declaration or definition");
        }
        var symbol = frame.of();
        if (symbol == null) {
            final var fors = paragraph.fors();
            if (fors.size() != 1) {
                throw ExtractionErrorCondition.signal(
                    marker.key(),
                    ExtractionError.Reason.MISSING_KEY,
                    "cannot tell which of " + fors.size() + " symbols is defined"
                );
            }
            symbol = fors.get(0).symbol();
        }
        paragraph.define(symbol, term);
        for (final var domainFrame : domainStack) {
            if (domainFrame instanceof final OpenDomainElement.Module module
                && defineSymbol(module.declarations(), symbol, term)) {
                return;
            }
            if (domainFrame instanceof final OpenDomainElement.Structure structure
                && defineSymbol(structure.declarations(), symbol, term)) {
                return;
            }
        }
        defineSymbol(declarations, symbol, term);
    }

    private void closeTerm(
        final CloseElement marker,
        final Term term,
        final FtmlNode node,
        final @Nullable String notation,
        final @Nullable DocumentElementUri uri
    ) {
        final var top = domainStack.peek();
        if (top instanceof final OpenDomainElement.TermCollector collector) {
            collector.terms().add(term);
            return;
        }
        if (top instanceof OpenDomainElement.Comp || top instanceof OpenDomainElement.DefComp) {
            throw ExtractionErrorCondition.signal(
                marker.key(),
                ExtractionError.Reason.INVALID_IN,
                "term inside a presentation component"
            );
        }

        if (term instanceof final Term.Symbol symbol) {
            pushElement(new DocumentElement.SymbolReference(node.range(), symbol.uri(), notation));
        } else if (term instanceof final Term.Var var) {
            // Variables never declared in this document have no element to refer to.
            if (var.variable() instanceof final Variable.Ref ref) {
                pushElement(new DocumentElement.VariableReference(node.range(), ref.declaration(), notation));
            }
        } else if (uri != null) {
            pushElement(new DocumentElement.TermElement(uri, term));
        } else {
            throw ExtractionErrorCondition.signal(
                marker.key(),
                ExtractionError.Reason.INVALID_IN,
                "nested term is not an argument"
            );
        }
    }

    private void pushElement(final DocumentElement element) {
        for (final var frame : narrativeStack) {
            final var children = frame.children();
            if (children != null) {
                children.add(element);
                return;
            }
        }
        topLevel.add(element);
    }

    private <T extends OpenDomainElement> T popDomain(final Class<T> type, final CloseElement marker) {
        final var top = domainStack.peek();
        if (!type.isInstance(top)) {
            throw unexpectedEnd(marker, type.getSimpleName(), top);
        }
        domainStack.pop();
        return type.cast(top);
    }

    private <T extends OpenNarrativeElement> T popNarrative(final Class<T> type, final CloseElement marker) {
        final var top = narrativeStack.peek();
        if (!type.isInstance(top)) {
            throw unexpectedEnd(marker, type.getSimpleName(), top);
        }
        narrativeStack.pop();
        return type.cast(top);
    }

    private OpenNarrativeElement.@Nullable Titled titleTarget() {
        for (final var frame : narrativeStack) {
            if (frame instanceof final OpenNarrativeElement.Titled titled) {
                return titled;
            }
            if (!(frame instanceof OpenNarrativeElement.Module
                || frame instanceof OpenNarrativeElement.Structure
                || frame instanceof OpenNarrativeElement.Invisible)) {
                return null;
            }
        }
        return null;
    }

    private OpenNarrativeElement.@Nullable VariableDeclaration openVariableDeclaration() {
        for (final var frame : narrativeStack) {
            if (frame instanceof final OpenNarrativeElement.VariableDeclaration variable) {
                return variable;
            }
        }
        return null;
    }

    private OpenNarrativeElement.@Nullable Paragraph openDefinitionParagraph() {
        for (final var frame : narrativeStack) {
            if (frame instanceof final OpenNarrativeElement.Paragraph paragraph
                && paragraph.kind().isDefinitionLike()) {
                return paragraph;
            }
        }
        return null;
    }

    private static void updateAssignment(
        final OpenDomainElement.Morphism morphism,
        final SymbolUri source,
        final UnaryOperator<Assignment> update
    ) {
        final var assignments = morphism.assignments();
        for (int i = 0; i < assignments.size(); i += 1) {
            if (assignments.get(i).original().equals(source)) {
                assignments.set(i, update.apply(assignments.get(i)));
                return;
            }
        }
        assignments.add(update.apply(Assignment.of(source, morphism.uri())));
    }

    private static Term asTerm(final List<Term> terms, final FtmlNode node) {
        return (terms.size() == 1) ? terms.get(0) : new Term.Informal(node.text(), terms);
    }

    private static boolean defineSymbol(final List<Declaration> declarations, final SymbolUri uri, final Term term) {
        for (int i = 0; i < declarations.size(); i += 1) {
            if (declarations.get(i) instanceof final Declaration.Symbol symbol && symbol.uri().equals(uri)) {
                if (symbol.data().definiens() == null) {
                    declarations.set(i, symbol.withDefiniens(term));
                }
                return true;
            }
        }
        return false;
    }

    private static @Nullable Variable findVariable(final List<DocumentElement> elements, final String name) {
        for (int i = elements.size() - 1; i >= 0; i -= 1) {
            if (elements.get(i) instanceof final DocumentElement.VariableDeclaration declaration
                && declaration.data().name().equals(name)) {
                return new Variable.Ref(declaration.uri(), declaration.data().isSequence());
            }
        }
        return null;
    }

    private static RuntimeException unexpectedEnd(
        final CloseElement marker,
        final String expected,
        final @Nullable Object top
    ) {
        final var found = (top != null) ? top.getClass().getSimpleName() : "nothing";
        throw ExtractionErrorCondition.signal(
            marker.key(),
            ExtractionError.Reason.UNEXPECTED_END,
            "expected an open " + expected + ", found " + found
        );
    }

    private static RuntimeException notIn(final CloseElement marker, final String message) {
        throw ExtractionErrorCondition.signal(marker.key(), ExtractionError.Reason.NOT_IN, message);
    }

    private static RuntimeException missingArgument(final CloseElement marker, final int index) {
        throw ExtractionErrorCondition.signal(
            marker.key(),
            ExtractionError.Reason.MISSING_ARGUMENT,
            "argument " + (index + 1) + " is missing or incomplete"
        );
    }

    private final DocumentUri documentUri;
    private final Deque<OpenDomainElement> domainStack = new ArrayDeque<>();
    private final Deque<OpenNarrativeElement> narrativeStack = new ArrayDeque<>();
    private final List<DocumentElement> topLevel = new ArrayList<>();
    private final List<Declaration> declarations = new ArrayList<>();
    private final List<DocumentElement.Notation> notations = new ArrayList<>();
    private final List<DocumentStyle> styles = new ArrayList<>();
    private final List<DocumentCounter> counters = new ArrayList<>();
    private final IdCounter ids = new IdCounter();
    private @Nullable String title = null;
    private SectionLevel topSectionLevel = SectionLevel.SECTION;
}
