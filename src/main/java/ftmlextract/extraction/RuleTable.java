// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.extraction;

import java.util.ArrayList;
import java.util.List;
import ftmlextract.domain.SymbolData;
import ftmlextract.narrative.DocumentCounter;
import ftmlextract.narrative.ParagraphKind;
import ftmlextract.narrative.SectionLevel;
import ftmlextract.narrative.VariableData;
import ftmlextract.term.ArgumentMode;
import ftmlextract.term.ArgumentPosition;
import ftmlextract.term.AssociativityType;
import ftmlextract.term.Term;
import ftmlextract.term.Variable;
import ftmlextract.uri.DocumentElementUri;
import ftmlextract.uri.DocumentUri;
import ftmlextract.uri.Language;
import ftmlextract.uri.ModuleUri;
import ftmlextract.uri.SymbolUri;
import ftmlextract.util.UnreachableCodeReachedError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The rules run for each recognized FTML key of an element.
 * <p>
 * A rule reads the values it needs from the element, checks them against the extractor state, and only then adds
 * what it found, so a rule that fails leaves the state untouched. Rules that open something return the marker to run
 * when the element ends.
 */
public final class RuleTable {
    private RuleTable() {
    }

    /**
     * Runs the rule for {@code key}.
     *
     * @return The close marker to record on the element, or {@code null} if the rule opened nothing.
     */
    public static @Nullable CloseElement apply(
        final FtmlKey key,
        final ExtractorState state,
        final FtmlAttributes attributes
    ) {
        return switch (key) {
            case MODULE -> module(state, attributes);
            case STRUCTURE -> structure(state, attributes);
            case MORPHISM -> morphism(state, attributes);
            case ASSIGN -> {
                final var source = domainSymbol(key, attributes.get(key), state);
                state.add(new OpenElement.Assign(source));
                yield CloseElement.ASSIGNMENT;
            }
            case RENAME -> {
                final var source = domainSymbol(key, attributes.get(key), state);
                final var newName = attributes.takeOptional(FtmlKey.RENAME_TO);
                if (newName != null && source.module().symbol(newName) == null) {
                    throw invalidValue(FtmlKey.RENAME_TO, "not a valid symbol name: '" + newName + '\'');
                }
                final var macroname = attributes.takeOptional(FtmlKey.MACRONAME);
                state.add(new OpenElement.Rename(source, newName, macroname));
                yield null;
            }
            case SYMDECL -> symbolDeclaration(state, attributes);
            case VARDEF, VARSEQ -> variableDeclaration(key, state, attributes);
            case SECTION -> {
                state.add(new OpenElement.Section(elementUri(state, attributes, "section")));
                yield CloseElement.SECTION;
            }
            case SKIPSECTION -> {
                state.add(new OpenElement.SkipSection());
                yield CloseElement.SKIP_SECTION;
            }
            case SECTIONLEVEL -> {
                final var level =
                    attributes.get(key, RuleTable::parseSectionLevel, ExtractionError.Reason.INVALID_VALUE);
                state.add(new OpenElement.SetSectionLevel(level));
                yield null;
            }
            case DEFINITION -> paragraph(key, ParagraphKind.DEFINITION, state, attributes);
            case PARAGRAPH -> paragraph(key, ParagraphKind.PARAGRAPH, state, attributes);
            case ASSERTION -> paragraph(key, ParagraphKind.ASSERTION, state, attributes);
            case EXAMPLE -> paragraph(key, ParagraphKind.EXAMPLE, state, attributes);
            case PROOF -> paragraph(key, ParagraphKind.PROOF, state, attributes);
            case SUBPROOF -> paragraph(key, ParagraphKind.SUBPROOF, state, attributes);
            case SLIDE -> {
                state.add(new OpenElement.Slide(elementUri(state, attributes, "slide")));
                yield CloseElement.SLIDE;
            }
            case TITLE -> title(state);
            case DOCTITLE -> {
                state.add(new OpenElement.DocTitle());
                yield CloseElement.DOC_TITLE;
            }
            case INVISIBLE -> {
                if (!attributes.takeBoolean(key)) {
                    yield null;
                }
                state.add(new OpenElement.Invisible());
                yield CloseElement.INVISIBLE;
            }
            case TERM -> term(state, attributes);
            case ARG -> argument(state, attributes);
            case HEADTERM -> {
                if (!state.hasOpenApplication()) {
                    throw notIn(key, "head term outside of an application or binding");
                }
                state.add(new OpenElement.HeadTerm());
                yield CloseElement.HEAD_TERM;
            }
            case TYPE -> {
                if (state.inTerm()) {
                    throw ExtractionErrorCondition.signal(key, ExtractionError.Reason.INVALID_IN, "type inside a term");
                }
                state.add(new OpenElement.Type());
                yield CloseElement.TYPE;
            }
            case DEFINIENS -> {
                final var of = attributes.getOptional(key, SymbolUri::parse, ExtractionError.Reason.INVALID_URI);
                if (state.inTerm()) {
                    throw ExtractionErrorCondition.signal(
                        key,
                        ExtractionError.Reason.INVALID_IN,
                        "definiens inside a term"
                    );
                }
                state.add(new OpenElement.Definiens(of));
                yield CloseElement.DEFINIENS;
            }
            case NOTATION -> notation(state, attributes);
            case DEFINIENDUM -> {
                final var symbol = symbolUri(key, attributes.get(key), state);
                state.add(new OpenElement.Definiendum(symbol));
                yield CloseElement.DEFINIENDUM;
            }
            case COMP, VARCOMP, MAINCOMP, DEFCOMP -> comp(key, state);
            case IMPORT -> {
                final var module = attributes.get(key, ModuleUri::parse, ExtractionError.Reason.INVALID_URI);
                if (state.currentModule() == null) {
                    throw notIn(key, "import outside of a module");
                }
                state.add(new OpenElement.ImportModule(module));
                yield null;
            }
            case USEMODULE -> {
                final var module = attributes.get(key, ModuleUri::parse, ExtractionError.Reason.INVALID_URI);
                state.add(new OpenElement.UseModule(module));
                yield null;
            }
            case INPUTREF -> {
                final var target = attributes.get(key, DocumentUri::parse, ExtractionError.Reason.INVALID_URI);
                final var uri = elementUri(state, attributes, target.name());
                state.add(new OpenElement.InputRef(uri, target));
                yield null;
            }
            case IFINPUTREF -> {
                state.add(new OpenElement.IfInputref(attributes.getBoolean(key)));
                yield null;
            }
            case STYLE -> {
                final var name = attributes.get(key);
                final var counter = attributes.getOptional(FtmlKey.COUNTER);
                state.add(new OpenElement.Style(name, counter));
                yield null;
            }
            case COUNTER -> {
                // On a style element the counter belongs to the style.
                if (attributes.has(FtmlKey.STYLE)) {
                    yield null;
                }
                final var name = attributes.get(key);
                final var parent = attributes.getOptional(
                    FtmlKey.COUNTER_PARENT,
                    RuleTable::parseSectionLevel,
                    ExtractionError.Reason.INVALID_VALUE
                );
                state.add(new OpenElement.Counter(new DocumentCounter(name, parent)));
                yield null;
            }
            case HEAD, ARGMODE, COUNTER_PARENT, ID, ROLE, ARGS, ASSOCTYPE, REORDERARGS, MACRONAME, BIND, NOTATIONID,
                NOTATIONFRAGMENT, PRECEDENCE, ARGPRECS, LANGUAGE, METATHEORY, SIGNATURE, DOMAIN, TOTAL, RENAME_TO, FORS,
                STYLES, INLINE -> null;
        };
    }

    private static CloseElement module(final ExtractorState state, final FtmlAttributes attributes) {
        final var name = attributes.get(FtmlKey.MODULE);
        final var parent = state.currentModule();
        final var uri = (parent != null) ? parent.nested(name) : ModuleUri.parse(name);
        if (uri == null) {
            throw invalidUri(FtmlKey.MODULE, name);
        }
        final var language =
            attributes.getOptional(FtmlKey.LANGUAGE, Language::parse, ExtractionError.Reason.INVALID_LANGUAGE);
        final var metatheory =
            attributes.getOptional(FtmlKey.METATHEORY, ModuleUri::parse, ExtractionError.Reason.INVALID_URI);
        final var signature =
            attributes.getOptional(FtmlKey.SIGNATURE, Language::parse, ExtractionError.Reason.INVALID_LANGUAGE);
        state.add(new OpenElement.Module(uri, metatheory, language, signature));
        return CloseElement.MODULE;
    }

    private static CloseElement structure(final ExtractorState state, final FtmlAttributes attributes) {
        final var name = attributes.get(FtmlKey.STRUCTURE);
        final var macroname = attributes.takeOptional(FtmlKey.MACRONAME);
        if (state.inStructure()) {
            throw ExtractionErrorCondition.signal(
                FtmlKey.STRUCTURE,
                ExtractionError.Reason.INVALID_IN,
                "structure inside another structure"
            );
        }
        final var module = state.currentModule();
        if (module == null) {
            throw notIn(FtmlKey.STRUCTURE, "structure outside of a module");
        }
        final var uri = module.symbol(name);
        if (uri == null) {
            throw invalidUri(FtmlKey.STRUCTURE, name);
        }
        state.add(new OpenElement.Structure(uri, macroname));
        return CloseElement.STRUCTURE;
    }

    private static CloseElement morphism(final ExtractorState state, final FtmlAttributes attributes) {
        final var name = attributes.get(FtmlKey.MORPHISM);
        final var domain = attributes.get(FtmlKey.DOMAIN, ModuleUri::parse, ExtractionError.Reason.INVALID_URI);
        final var isTotal = attributes.takeBoolean(FtmlKey.TOTAL);
        final var module = state.currentModule();
        if (module == null) {
            throw notIn(FtmlKey.MORPHISM, "morphism outside of a module or structure");
        }
        final var uri = module.symbol(name);
        if (uri == null) {
            throw invalidUri(FtmlKey.MORPHISM, name);
        }
        state.add(new OpenElement.Morphism(uri, domain, isTotal));
        return CloseElement.MORPHISM;
    }

    private static CloseElement symbolDeclaration(final ExtractorState state, final FtmlAttributes attributes) {
        final var uri = symbolUri(FtmlKey.SYMDECL, attributes.get(FtmlKey.SYMDECL), state);
        final var data = new SymbolData(
            arity(attributes),
            attributes.takeList(FtmlKey.ROLE),
            associativity(attributes),
            attributes.takeOptional(FtmlKey.REORDERARGS),
            attributes.takeOptional(FtmlKey.MACRONAME),
            null,
            null
        );
        state.add(new OpenElement.SymbolDeclaration(uri, data));
        return CloseElement.SYMBOL_DECLARATION;
    }

    private static CloseElement variableDeclaration(
        final FtmlKey key,
        final ExtractorState state,
        final FtmlAttributes attributes
    ) {
        final var name = attributes.get(key);
        final var uri = state.elementUri(name);
        if (uri == null) {
            throw ExtractionErrorCondition.signal(
                key,
                ExtractionError.Reason.INVALID_VALUE,
                "not a valid variable name: '" + name + '\''
            );
        }
        final var data = new VariableData(
            name,
            key == FtmlKey.VARSEQ,
            attributes.takeBoolean(FtmlKey.BIND),
            arity(attributes),
            attributes.takeList(FtmlKey.ROLE),
            associativity(attributes),
            attributes.takeOptional(FtmlKey.REORDERARGS),
            attributes.takeOptional(FtmlKey.MACRONAME),
            null,
            null
        );
        state.add(new OpenElement.VariableDeclaration(uri, data));
        return CloseElement.VARIABLE_DECLARATION;
    }

    private static CloseElement paragraph(
        final FtmlKey key,
        final ParagraphKind kind,
        final ExtractorState state,
        final FtmlAttributes attributes
    ) {
        final var uri = elementUri(state, attributes, key.keyName());
        final var isInline = attributes.takeBoolean(FtmlKey.INLINE);
        final var styles = attributes.takeList(FtmlKey.STYLES);
        final var fors = new ArrayList<SymbolUri>();
        for (final var value : attributes.takeList(FtmlKey.FORS)) {
            final var symbol = SymbolUri.parse(value);
            if (symbol == null) {
                throw invalidUri(FtmlKey.FORS, value);
            }
            fors.add(symbol);
        }
        state.add(new OpenElement.Paragraph(uri, kind, isInline, styles, fors));
        return CloseElement.PARAGRAPH;
    }

    private static CloseElement title(final ExtractorState state) {
        final var marker = state.titleMarker();
        if (marker == null) {
            throw notIn(FtmlKey.TITLE, "title outside of a section, paragraph or slide");
        }
        switch (marker) {
            case SECTION_TITLE -> state.add(new OpenElement.SectionTitle());
            case PARAGRAPH_TITLE -> state.add(new OpenElement.ParagraphTitle());
            case SLIDE_TITLE -> state.add(new OpenElement.SlideTitle());
            default -> throw new UnreachableCodeReachedError();
        }
        return marker;
    }

    private static @Nullable CloseElement term(final ExtractorState state, final FtmlAttributes attributes) {
        if (state.inNotation()) {
            return null;
        }
        final var kind = attributes.get(FtmlKey.TERM);
        final var notation = attributes.getOptional(FtmlKey.NOTATIONID);
        switch (kind) {
            case "OMID", "OMS", "OMMOD" -> {
                final var head = head(FtmlKey.HEAD, attributes.get(FtmlKey.HEAD), state);
                if (!(head instanceof final Term.Symbol symbol)) {
                    throw invalidValue(FtmlKey.HEAD, "symbol reference with a variable head");
                }
                state.add(new OpenElement.SymbolReference(symbol.uri(), notation));
                return CloseElement.SYMBOL_REFERENCE;
            }
            case "OMV" -> {
                final var head = head(FtmlKey.HEAD, attributes.get(FtmlKey.HEAD), state);
                if (!(head instanceof final Term.Var var)) {
                    throw invalidValue(FtmlKey.HEAD, "variable reference with a symbol head");
                }
                state.add(new OpenElement.VariableReference(var.variable(), notation));
                return CloseElement.VARIABLE_REFERENCE;
            }
            case "OMA", "OMBIND" -> {
                final var head = head(FtmlKey.HEAD, attributes.get(FtmlKey.HEAD), state);
                final var uri = state.inTerm() ? null : elementUri(state, attributes, "term");
                if (kind.equals("OMA")) {
                    state.add(new OpenElement.Application(head, notation, uri));
                    return CloseElement.APPLICATION;
                }
                state.add(new OpenElement.Binding(head, notation, uri));
                return CloseElement.BINDING;
            }
            default -> throw invalidValue(FtmlKey.TERM, "unknown term kind '" + kind + '\'');
        }
    }

    private static @Nullable CloseElement argument(final ExtractorState state, final FtmlAttributes attributes) {
        if (state.inNotation()) {
            return null;
        }
        final var mode =
            attributes.getOptional(FtmlKey.ARGMODE, RuleTable::parseMode, ExtractionError.Reason.INVALID_VALUE);
        final var position = attributes.get(
            FtmlKey.ARG,
            value -> ArgumentPosition.parse(value, mode),
            ExtractionError.Reason.INVALID_VALUE
        );
        if (!state.hasOpenApplication()) {
            throw notIn(FtmlKey.ARG, "argument outside of an application or binding");
        }
        state.add(new OpenElement.Argument(position));
        return CloseElement.ARGUMENT;
    }

    private static CloseElement notation(final ExtractorState state, final FtmlAttributes attributes) {
        final var head = head(FtmlKey.NOTATION, attributes.get(FtmlKey.NOTATION), state);
        final var id = attributes.getOptional(FtmlKey.NOTATIONFRAGMENT);
        final var precedence =
            attributes.getOptional(FtmlKey.PRECEDENCE, RuleTable::parseInteger, ExtractionError.Reason.INVALID_VALUE);
        final var argumentPrecedences = new ArrayList<Integer>();
        for (final var value : attributes.getList(FtmlKey.ARGPRECS)) {
            final var argumentPrecedence = parseInteger(value);
            if (argumentPrecedence == null) {
                throw invalidValue(FtmlKey.ARGPRECS, "not an integer: '" + value + '\'');
            }
            argumentPrecedences.add(argumentPrecedence);
        }
        final var uri = elementUri(state, attributes, "notation");
        state.add(new OpenElement.Notation(
            uri,
            head,
            id,
            (precedence != null) ? precedence : 0,
            argumentPrecedences
        ));
        return CloseElement.NOTATION;
    }

    private static @Nullable CloseElement comp(final FtmlKey key, final ExtractorState state) {
        if (state.inNotation()) {
            return null;
        }
        if (!state.inReferenceOrApplication()) {
            throw notIn(key, "presentation component outside of a term");
        }
        if (key == FtmlKey.DEFCOMP) {
            state.add(new OpenElement.DefComp());
            return CloseElement.DEF_COMP;
        }
        state.add(new OpenElement.Comp());
        return CloseElement.COMP;
    }

    /**
     * Parses a term head: a symbol URI, a variable declaration URI, or the name of a variable, resolved against the
     * declarations in scope if possible.
     */
    private static Term head(final FtmlKey key, final String value, final ExtractorState state) {
        if (value.indexOf('?') >= 0) {
            final var symbol = SymbolUri.parse(value);
            if (symbol == null) {
                throw invalidUri(key, value);
            }
            return new Term.Symbol(symbol);
        }
        if (value.indexOf('#') >= 0) {
            final var declaration = DocumentElementUri.parse(value);
            if (declaration == null) {
                throw invalidUri(key, value);
            }
            return new Term.Var(new Variable.Ref(declaration, false));
        }
        final var resolved = state.resolveVariableName(value);
        return new Term.Var((resolved != null) ? resolved : new Variable.Name(value));
    }

    /**
     * Parses a symbol given either as a full URI or as a name in the module being read.
     */
    private static SymbolUri symbolUri(final FtmlKey key, final String value, final ExtractorState state) {
        if (value.indexOf('?') >= 0) {
            final var symbol = SymbolUri.parse(value);
            if (symbol == null) {
                throw invalidUri(key, value);
            }
            return symbol;
        }
        final var module = state.currentModule();
        if (module == null) {
            throw notIn(key, "symbol name '" + value + "' outside of a module");
        }
        final var symbol = module.symbol(value);
        if (symbol == null) {
            throw invalidUri(key, value);
        }
        return symbol;
    }

    /**
     * Parses a symbol of the enclosing morphism's domain, given either as a full URI or as a name in the domain.
     */
    private static SymbolUri domainSymbol(final FtmlKey key, final String value, final ExtractorState state) {
        final var domain = state.morphismDomain();
        if (domain == null) {
            throw notIn(key, "outside of a morphism");
        }
        final var symbol = (value.indexOf('?') >= 0) ? SymbolUri.parse(value) : domain.symbol(value);
        if (symbol == null) {
            throw invalidUri(key, value);
        }
        return symbol;
    }

    /**
     * Returns the URI for an element named by its {@code data-ftml-id}, or by a fresh name with the given prefix.
     */
    private static DocumentElementUri elementUri(
        final ExtractorState state,
        final FtmlAttributes attributes,
        final String prefix
    ) {
        final var id = attributes.getOptional(FtmlKey.ID);
        final var name = (id != null) ? id : state.newId(prefix);
        final var uri = state.elementUri(name);
        if (uri == null) {
            throw invalidValue(FtmlKey.ID, "not a valid element name: '" + name + '\'');
        }
        return uri;
    }

    private static List<ArgumentMode> arity(final FtmlAttributes attributes) {
        final var arity =
            attributes.takeOptional(FtmlKey.ARGS, ArgumentMode::parseArity, ExtractionError.Reason.INVALID_VALUE);
        return (arity != null) ? arity : List.of();
    }

    private static @Nullable AssociativityType associativity(final FtmlAttributes attributes) {
        return attributes.takeOptional(
            FtmlKey.ASSOCTYPE,
            AssociativityType::fromAttributeValue,
            ExtractionError.Reason.INVALID_VALUE
        );
    }

    private static @Nullable ArgumentMode parseMode(final String value) {
        return (value.length() == 1) ? ArgumentMode.fromCharacter(value.charAt(0)) : null;
    }

    private static @Nullable SectionLevel parseSectionLevel(final String value) {
        final var number = parseInteger(value);
        return (number != null) ? SectionLevel.fromNumber(number) : null;
    }

    private static @Nullable Integer parseInteger(final String value) {
        try {
            return Integer.valueOf(value);
        } catch (final NumberFormatException e) {
            return null;
        }
    }

    private static RuntimeException notIn(final FtmlKey key, final String message) {
        throw ExtractionErrorCondition.signal(key, ExtractionError.Reason.NOT_IN, message);
    }

    private static RuntimeException invalidValue(final FtmlKey key, final String message) {
        throw ExtractionErrorCondition.signal(key, ExtractionError.Reason.INVALID_VALUE, message);
    }

    private static RuntimeException invalidUri(final FtmlKey key, final String value) {
        throw ExtractionErrorCondition.signal(key, ExtractionError.Reason.INVALID_URI, "invalid URI '" + value + '\'');
    }
}
