// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Optional;
import ftmlextract.domain.Assignment;
import ftmlextract.domain.Declaration;
import ftmlextract.domain.SymbolData;
import ftmlextract.extraction.ExtractionError;
import ftmlextract.extraction.FtmlKey;
import ftmlextract.html.Css;
import ftmlextract.html.ExtractionOptions;
import ftmlextract.html.HtmlExtractionResult;
import ftmlextract.html.HtmlExtractor;
import ftmlextract.narrative.DocumentElement;
import ftmlextract.narrative.DocumentStyle;
import ftmlextract.narrative.ParagraphKind;
import ftmlextract.narrative.ParagraphSubject;
import ftmlextract.narrative.SectionLevel;
import ftmlextract.term.Argument;
import ftmlextract.term.ArgumentMode;
import ftmlextract.term.AssociativityType;
import ftmlextract.term.BoundArgument;
import ftmlextract.term.Term;
import ftmlextract.term.Variable;
import ftmlextract.uri.DocumentElementUri;
import ftmlextract.uri.DocumentUri;
import ftmlextract.uri.Language;
import ftmlextract.uri.ModuleUri;
import ftmlextract.uri.SymbolUri;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class HtmlExtractorTest {
    @Test
    void plainDocumentIsSerializedUnchanged() {
        final var html = "<!DOCTYPE html><html><head></head><body><p class=\"x\">Hello</p></body></html>";
        final var result = extract(html);
        assertThat(result.html()).isEqualTo(html);
        assertThat(result.errors()).isEmpty();
        assertThat(result.result().document().elements()).isEmpty();
    }

    @Test
    void textAndAttributesAreEscaped() {
        final var result = extract(
            "<html><head></head><body><p title=\"a&quot;b&amp;c\">1 &lt; 2 &amp;&nbsp;3</p></body></html>"
        );
        assertThat(result.html())
            .isEqualTo("<html><head></head><body><p title=\"a&quot;b&amp;c\">1 &lt; 2 &amp;&nbsp;3</p></body></html>");
    }

    @Test
    void scriptsAreRawAndCommentsDropped() {
        final var result =
            extract("<html><head></head><body><script>if (a < b) {}</script><!-- gone -->x</body></html>");
        assertThat(result.html()).isEqualTo("<html><head></head><body><script>if (a < b) {}</script>x</body></html>");
    }

    @Test
    void headStylesheetsAreCollectedOnce() {
        final var options = ExtractionOptions.builder(document)
            .setStylesheetResolver(href -> href.equals("b.css") ? Optional.of("/static/b.css") : Optional.empty())
            .build();
        final var result = HtmlExtractor.extract(
            "<html><head><link rel=\"stylesheet\" href=\"a.css\"><link rel=\"stylesheet\" href=\"a.css\">"
                + "<style>p{}</style><link rel=\"Stylesheet alternate\" href=\"b.css\">"
                + "<link rel=\"icon\" href=\"i.png\">"
                + "</head><body>x</body></html>",
            options
        );
        assertThat(result.stylesheets()).containsExactly(
            new Css.Link("a.css"),
            new Css.Inline("p{}"),
            new Css.Link("/static/b.css")
        );
        assertThat(result.html())
            .isEqualTo("<html><head><link rel=\"icon\" href=\"i.png\"></head><body>x</body></html>");
    }

    @Test
    void bodyRangeCountsBytes() {
        final var result = extract("<html><head></head><body class=\"é\">ä€😀</body></html>");
        final var range = result.bodyRange();
        assertThat(range).isNotNull();
        assertThat(result.fragment(range)).isEqualTo("<body class=\"é\">ä€😀</body>");
        assertThat(range.start()).isEqualTo("<html><head></head>".length());
        assertThat(result.bodyHeaderLength()).isEqualTo("<body class=\"é\">".getBytes(StandardCharsets.UTF_8).length);
    }

    @Test
    void imageSourcesAreResolved() {
        final var options = ExtractionOptions.builder(document)
            .setImageResolver(src -> Optional.of("/img/" + src))
            .build();
        final var result = HtmlExtractor.extract("<html><head></head><body><img src=\"a.png\"></body></html>", options);
        assertThat(result.html()).isEqualTo("<html><head></head><body><img src=\"/img/a.png\"></body></html>");
    }

    @Test
    void invisibleContentIsRemoved() {
        final var result = extract(
            "<html><head></head><body>a<span data-ftml-invisible=\"true\">b<i>c</i></span>d"
                + "<span data-ftml-invisible=\"false\">e</span></body></html>"
        );
        assertThat(result.html()).isEqualTo("<html><head></head><body>ad<span>e</span></body></html>");
    }

    @Test
    void rangesInsideRemovedContentAreEmpty() {
        final var result = extract(
            "<html><head></head><body><span data-ftml-invisible=\"true\">"
                + "<span data-ftml-notation=\"m?s\">a long notation body here</span></span>x</body></html>"
        );
        assertThat(result.errors()).isEmpty();
        assertThat(result.html()).isEqualTo("<html><head></head><body>x</body></html>");
        final var range = result.result().notations().get(0).range();
        assertThat(range.start()).isEqualTo("<html><head></head><body>".length());
        assertThat(range.length()).isZero();
        assertThat(result.fragment(range)).isEmpty();
    }

    @Test
    void removedContentIsNotPartOfText() {
        final var result = extract(
            "<html><head></head><body><section data-ftml-section=\"\" data-ftml-id=\"intro\">"
                + "<h1 data-ftml-title=\"\">Intro<span data-ftml-invisible=\"true\">HIDDEN</span></h1>"
                + "<span data-ftml-term=\"OMA\" data-ftml-head=\"m?f\"><span data-ftml-arg=\"1\">some"
                + "<span data-ftml-invisible=\"true\"> hidden</span> text</span></span>"
                + "<i data-ftml-invisible=\"true\"></i><b>after</b></section></body></html>"
        );
        assertThat(result.errors()).isEmpty();
        final var section = (DocumentElement.Section) result.result().document().elements().get(0);
        assertThat(section.title()).isNotNull();
        assertThat(section.title().text()).isEqualTo("Intro");
        assertThat(result.fragment(section.title().range())).isEqualTo("<h1 data-ftml-title=\"\">Intro</h1>");
        assertThat(section.children()).containsExactly(new DocumentElement.TermElement(
            new DocumentElementUri(document, "intro/term"),
            new Term.Application(symbol("f"), List.of(new Argument.Simple(new Term.Informal("some text", List.of()))))
        ));
        assertThat(result.fragment(section.range())).endsWith("<b>after</b></section>");
    }

    @Test
    void noscriptContentIsEscaped() {
        final var html = "<html><head></head><body><noscript>a &lt; b</noscript><xmp>a &lt; b</xmp></body></html>";
        assertThat(extract(html).html()).isEqualTo(html);
    }

    @Test
    void stylesheetLinkWithoutHrefIsKept() {
        final var result = extract("<html><head><link rel=\"stylesheet\"></head><body>x</body></html>");
        assertThat(result.stylesheets()).isEmpty();
        assertThat(result.html()).isEqualTo("<html><head><link rel=\"stylesheet\"></head><body>x</body></html>");
    }

    @Test
    void parseErrorsBecomeWarnings() {
        final var html = "<html><head></head><body></div>x</body></html>";
        assertThat(extract(html).warnings()).isNotEmpty();
        final var options = ExtractionOptions.builder(document).setMaxParseErrors(0).build();
        assertThat(HtmlExtractor.extract(html, options).warnings()).isEmpty();
    }

    @Test
    void sectionWithTitle() {
        final var result = extract(
            "<html><head></head><body><section data-ftml-section=\"\" data-ftml-id=\"intro\">"
                + "<h1 data-ftml-title=\"\">Intro</h1><p>text</p></section></body></html>"
        );
        assertThat(result.errors()).isEmpty();
        final var elements = result.result().document().elements();
        assertThat(elements).hasSize(1);
        final var section = (DocumentElement.Section) elements.get(0);
        assertThat(section.uri()).isEqualTo(new DocumentElementUri(document, "intro"));
        assertThat(section.title()).isNotNull();
        assertThat(section.title().text()).isEqualTo("Intro");
        assertThat(result.fragment(section.title().range())).isEqualTo("<h1 data-ftml-title=\"\">Intro</h1>");
        assertThat(result.fragment(section.range())).startsWith("<section").endsWith("<p>text</p></section>");
    }

    @Test
    void duplicateTitleIsReportedAndFirstKept() {
        final var result = extract(
            "<html><head></head><body><section data-ftml-section=\"\">"
                + "<h1 data-ftml-title=\"\">One</h1><h1 data-ftml-title=\"\">Two</h1></section></body></html>"
        );
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).error().reason()).isEqualTo(ExtractionError.Reason.DUPLICATE_VALUE);
        final var section = (DocumentElement.Section) result.result().document().elements().get(0);
        assertThat(section.title()).isNotNull();
        assertThat(section.title().text()).isEqualTo("One");
    }

    @Test
    void failedAnnotationIsSkippedAndReported() {
        final var html = "<html><head></head><body><span data-ftml-arg=\"1\">x</span>"
            + "<div data-ftml-section=\"\"></div></body></html>";
        final var result = extract(html);
        assertThat(result.errors()).hasSize(1);
        final var diagnostic = result.errors().get(0);
        assertThat(diagnostic.error().key()).isEqualTo(FtmlKey.ARG);
        assertThat(diagnostic.error().reason()).isEqualTo(ExtractionError.Reason.NOT_IN);
        assertThat(diagnostic.position()).isEqualTo(html.indexOf("<span"));
        assertThat(diagnostic.trace()).contains("Applying data-ftml-arg on <span>");
        assertThat(result.html()).contains(">x</span>");
        assertThat(result.result().document().elements())
            .singleElement()
            .isInstanceOf(DocumentElement.Section.class);
    }

    @Test
    void failedCloseIsReported() {
        final var result = extract(
            "<html><head></head><body><span data-ftml-term=\"OMA\" data-ftml-head=\"m?f\">"
                + "<span data-ftml-arg=\"2\">x</span></span></body></html>"
        );
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).error().reason()).isEqualTo(ExtractionError.Reason.MISSING_ARGUMENT);
        assertThat(result.errors().get(0).trace()).contains("Closing application on <span>");
        assertThat(result.result().document().elements()).isEmpty();
    }

    @Test
    void argumentAfterTermOnTheSameElementIsReported() {
        final var result = extract(
            "<html><head></head><body><span data-ftml-term=\"OMA\" data-ftml-head=\"m?f\">"
                + "<span data-ftml-term=\"OMS\" data-ftml-head=\"m?a\" data-ftml-arg=\"1\">a</span>"
                + "</span></body></html>"
        );
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).error().key()).isEqualTo(FtmlKey.ARG);
        assertThat(result.errors().get(0).error().reason()).isEqualTo(ExtractionError.Reason.NOT_IN);
        assertThat(result.result().document().elements()).contains(new DocumentElement.TermElement(
            new DocumentElementUri(document, "term"),
            new Term.Application(symbol("f"), List.of())
        ));
    }

    @Test
    void argumentBeforeTermOnTheSameElementIsFilled() {
        final var result = extract(
            "<html><head></head><body><span data-ftml-term=\"OMA\" data-ftml-head=\"m?f\">"
                + "<span data-ftml-arg=\"1\" data-ftml-term=\"OMS\" data-ftml-head=\"m?a\">a</span>"
                + "</span></body></html>"
        );
        assertThat(result.errors()).isEmpty();
        assertThat(result.result().document().elements()).containsExactly(new DocumentElement.TermElement(
            new DocumentElementUri(document, "term"),
            new Term.Application(symbol("f"), List.of(new Argument.Simple(symbol("a"))))
        ));
    }

    @Test
    void unknownTermKindIsReported() {
        final var result = extract(
            "<html><head></head><body><span data-ftml-term=\"OMX\" data-ftml-head=\"m?f\">f</span></body></html>"
        );
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).error().key()).isEqualTo(FtmlKey.TERM);
        assertThat(result.errors().get(0).error().reason()).isEqualTo(ExtractionError.Reason.INVALID_VALUE);
    }

    @Test
    void modulesAndDeclarations() {
        final var result = extract(
            "<html><head></head><body><div data-ftml-module=\"math/sets\">"
                + "<span data-ftml-symdecl=\"emptyset\"></span>"
                + "<div data-ftml-module=\"inner\"><span data-ftml-symdecl=\"x\"></span></div>"
                + "</div></body></html>"
        );
        assertThat(result.errors()).isEmpty();
        final var outer = new ModuleUri("math/sets");
        final var inner = new ModuleUri("math/sets/inner");
        final var innerModule = new Declaration.Module(inner, null, null, null, List.of(
            new Declaration.Symbol(new SymbolUri(inner, "x"), emptyData)
        ));
        final var outerModule = new Declaration.Module(outer, null, null, null, List.of(
            new Declaration.Symbol(new SymbolUri(outer, "emptyset"), emptyData),
            innerModule
        ));
        assertThat(result.result().declarations()).containsExactly(outerModule);
        final var block = (DocumentElement.ModuleBlock) result.result().document().elements().get(0);
        assertThat(block.module()).isEqualTo(outer);
        assertThat(block.children()).singleElement().isInstanceOf(DocumentElement.ModuleBlock.class);
    }

    @Test
    void structuresAndMorphisms() {
        final var result = extract(
            "<html><head></head><body><div data-ftml-module=\"math/algebra\">"
                + "<div data-ftml-feature-structure=\"monoid\" data-ftml-macroname=\"Monoid\">"
                + "<span data-ftml-import=\"math/sets\"></span><span data-ftml-symdecl=\"op\"></span></div>"
                + "<div data-ftml-feature-morphism=\"natadd\" data-ftml-domain=\"math/algebra/monoid\""
                + " data-ftml-total=\"true\"><span data-ftml-assign=\"op\"><span data-ftml-definiens=\"\">"
                + "<span data-ftml-term=\"OMS\" data-ftml-head=\"math/nat?plus\">+</span></span></span>"
                + "<span data-ftml-rename=\"op\" data-ftml-to=\"add\" data-ftml-macroname=\"natadd\"></span>"
                + "</div></div></body></html>"
        );
        assertThat(result.errors()).isEmpty();
        final var algebra = new ModuleUri("math/algebra");
        final var monoid = new SymbolUri(algebra, "monoid");
        final var operation = new SymbolUri(monoid.asNestedModule(), "op");
        final var morphism = new SymbolUri(algebra, "natadd");
        assertThat(operation).hasToString("math/algebra/monoid?op");
        final var structureDeclaration = new Declaration.Structure(monoid, "Monoid", List.of(
            new Declaration.Import(new ModuleUri("math/sets")),
            new Declaration.Symbol(operation, emptyData)
        ));
        final var morphismDeclaration = new Declaration.Morphism(morphism, monoid.asNestedModule(), true, List.of(
            new Assignment(
                operation, morphism, new Term.Symbol(SymbolUri.parse("math/nat?plus")), null, "add", "natadd"
            )
        ));
        assertThat(result.result().declarations()).containsExactly(
            new Declaration.Module(algebra, null, null, null, List.of(structureDeclaration, morphismDeclaration))
        );

        final var block = (DocumentElement.ModuleBlock) result.result().document().elements().get(0);
        assertThat(block.children()).hasSize(2);
        final var structure = (DocumentElement.Structure) block.children().get(0);
        assertThat(structure.structure()).isEqualTo(monoid);
        assertThat(structure.children())
            .containsExactly(new DocumentElement.ImportModule(new ModuleUri("math/sets")));
        assertThat(result.fragment(structure.range())).startsWith("<div").endsWith("</span></div>");
        final var morphismElement = (DocumentElement.Morphism) block.children().get(1);
        assertThat(morphismElement.morphism()).isEqualTo(morphism);
        assertThat(result.fragment(morphismElement.range())).contains(">+</span>");
    }

    @Test
    void symbolDeclaredOutsideModule() {
        final var result = extract(
            "<html><head></head><body><span data-ftml-symdecl=\"math/sets?emptyset\"></span></body></html>"
        );
        assertThat(result.result().declarations())
            .containsExactly(new Declaration.Symbol(SymbolUri.parse("math/sets?emptyset"), emptyData));
        assertThat(result.result().document().elements()).isEmpty();
    }

    @Test
    void applicationWithArgumentsOutOfOrder() {
        final var result = extract(
            "<html><head></head><body><span data-ftml-term=\"OMA\" data-ftml-head=\"m?plus\">"
                + "<span data-ftml-arg=\"2\"><span data-ftml-term=\"OMS\" data-ftml-head=\"m?b\">b</span></span>"
                + " + <span data-ftml-arg=\"1\">some <i>text</i></span>"
                + "</span></body></html>"
        );
        assertThat(result.errors()).isEmpty();
        assertThat(result.result().document().elements()).containsExactly(new DocumentElement.TermElement(
            new DocumentElementUri(document, "term"),
            new Term.Application(symbol("plus"), List.of(
                new Argument.Simple(new Term.Informal("some text", List.of())),
                new Argument.Simple(symbol("b"))
            ))
        ));
    }

    @Test
    void sequenceArgumentGivenElementByElement() {
        final var result = extract(
            "<html><head></head><body><span data-ftml-term=\"OMA\" data-ftml-head=\"m?set\">"
                + "<span data-ftml-arg=\"12\" data-ftml-argmode=\"a\">"
                + "<span data-ftml-term=\"OMS\" data-ftml-head=\"m?b\">b</span></span>"
                + "<span data-ftml-arg=\"11\" data-ftml-argmode=\"a\">"
                + "<span data-ftml-term=\"OMS\" data-ftml-head=\"m?a\">a</span></span>"
                + "</span></body></html>"
        );
        assertThat(result.errors()).isEmpty();
        final var term = ((DocumentElement.TermElement) result.result().document().elements().get(0)).term();
        assertThat(term).isEqualTo(new Term.Application(symbol("set"), List.of(
            new Argument.Sequence(List.of(symbol("a"), symbol("b")))
        )));
    }

    @Test
    void bindingOverDeclaredVariable() {
        final var result = extract(
            "<html><head></head><body><span data-ftml-vardef=\"x\"></span>"
                + "<span data-ftml-term=\"OMBIND\" data-ftml-head=\"m?forall\">"
                + "<span data-ftml-arg=\"1\" data-ftml-argmode=\"b\">"
                + "<span data-ftml-term=\"OMV\" data-ftml-head=\"x\">x</span></span>. "
                + "<span data-ftml-arg=\"2\"><span data-ftml-term=\"OMS\" data-ftml-head=\"m?true\">T</span></span>"
                + "</span></body></html>"
        );
        assertThat(result.errors()).isEmpty();
        final var elements = result.result().document().elements();
        assertThat(elements).hasSize(2);
        assertThat(elements.get(0)).isInstanceOf(DocumentElement.VariableDeclaration.class);
        final var x = new Variable.Ref(new DocumentElementUri(document, "x"), false);
        assertThat(elements.get(1)).isEqualTo(new DocumentElement.TermElement(
            new DocumentElementUri(document, "term"),
            new Term.Binding(symbol("forall"), List.of(new BoundArgument.Bound(x)), symbol("true"))
        ));
    }

    @Test
    void definitionGivesDefiniens() {
        final var result = extract(
            "<html><head></head><body><div data-ftml-module=\"m\"><span data-ftml-symdecl=\"emptyset\"></span>"
                + "<div data-ftml-definition=\"\" data-ftml-fors=\"m?emptyset\">"
                + "<b data-ftml-definiendum=\"emptyset\">empty set</b> is "
                + "<span data-ftml-definiens=\"\"><span data-ftml-term=\"OMS\" data-ftml-head=\"m?nothing\">x</span>"
                + "</span></div></div></body></html>"
        );
        assertThat(result.errors()).isEmpty();
        final var emptyset = SymbolUri.parse("m?emptyset");
        assertThat(result.result().declarations()).containsExactly(new Declaration.Module(
            new ModuleUri("m"),
            null,
            null,
            null,
            List.of(new Declaration.Symbol(emptyset, emptyData.withDefiniens(symbol("nothing"))))
        ));
        final var block = (DocumentElement.ModuleBlock) result.result().document().elements().get(0);
        final var paragraph = (DocumentElement.Paragraph) block.children().get(0);
        assertThat(paragraph.kind()).isEqualTo(ParagraphKind.DEFINITION);
        assertThat(paragraph.fors()).containsExactly(new ParagraphSubject(emptyset, symbol("nothing")));
        assertThat(paragraph.children()).singleElement().isInstanceOf(DocumentElement.Definiendum.class);
        final var definiendum = (DocumentElement.Definiendum) paragraph.children().get(0);
        assertThat(result.fragment(definiendum.range())).endsWith(">empty set</b>");
    }

    @Test
    void notationIsRecordedAndItsContentIgnored() {
        final var result = extract(
            "<html><head></head><body><span data-ftml-notation=\"m?plus\" data-ftml-notationfragment=\"infix\""
                + " data-ftml-precedence=\"100\" data-ftml-argprecs=\"100, 101\">"
                + "<span data-ftml-term=\"OMS\" data-ftml-head=\"m?plus\" data-ftml-comp=\"\">+</span>"
                + "</span></body></html>"
        );
        assertThat(result.errors()).isEmpty();
        final var notations = result.result().notations();
        assertThat(notations).hasSize(1);
        final var notation = notations.get(0);
        assertThat(notation.head()).isEqualTo(symbol("plus"));
        assertThat(notation.id()).isEqualTo("infix");
        assertThat(notation.precedence()).isEqualTo(100);
        assertThat(notation.argumentPrecedences()).containsExactly(100, 101);
        assertThat(result.result().document().elements()).containsExactly(notation);
    }

    @Test
    void documentLevelFacts() {
        final var result = extract(
            "<html><head></head><body><h1 data-ftml-doctitle=\"\">My <b>Title</b></h1>"
                + "<div data-ftml-sectionlevel=\"1\" data-ftml-style=\"lemma\" data-ftml-counter=\"theorem\"></div>"
                + "<div data-ftml-inputref=\"docs/b\"></div><div data-ftml-usemodule=\"m\"></div></body></html>"
        );
        assertThat(result.errors()).isEmpty();
        final var extracted = result.result().document();
        assertThat(extracted.title()).isEqualTo("My Title");
        assertThat(extracted.topSectionLevel()).isEqualTo(SectionLevel.CHAPTER);
        assertThat(extracted.styles()).containsExactly(new DocumentStyle("lemma", "theorem"));
        assertThat(extracted.counters()).isEmpty();
        assertThat(extracted.elements()).containsExactly(
            new DocumentElement.DocumentReference(new DocumentElementUri(document, "b"), new DocumentUri("docs/b")),
            new DocumentElement.UseModule(new ModuleUri("m"))
        );
    }

    @Test
    void deepNestingDoesNotOverflowTheStack() {
        final var depth = 10_000;
        final var html = new StringBuilder("<html><head></head><body>");
        html.append("<div data-ftml-skipsection=\"\">".repeat(depth));
        html.append("x");
        html.append("</div>".repeat(depth));
        html.append("</body></html>");

        final var result = extract(html.toString());
        assertThat(result.errors()).isEmpty();
        var count = 0;
        final var pending = new ArrayDeque<DocumentElement>(result.result().document().elements());
        while (!pending.isEmpty()) {
            final var element = pending.pop();
            assertThat(element).isInstanceOf(DocumentElement.SkipSection.class);
            count += 1;
            pending.addAll(element.children());
        }
        assertThat(count).isEqualTo(depth);
    }

    @Test
    void fixtureDocument() throws IOException {
        final var html = Files.readString(testResourcesPath.resolve("documents/sets.html"), StandardCharsets.UTF_8);
        final var result = HtmlExtractor.extract(html, ExtractionOptions.builder(new DocumentUri("docs/sets")).build());

        assertThat(result.errors()).isEmpty();
        assertThat(result.stylesheets())
            .containsExactly(new Css.Link("ftml.css"), new Css.Inline(".ftml-comp { color: blue; }"));
        assertThat(result.html())
            .contains("<meta charset=\"utf-8\">")
            .doesNotContain("<link")
            .doesNotContain("<style")
            .doesNotContain("internal note");

        final var extracted = result.result();
        assertThat(extracted.document().title()).isEqualTo("Elementary set theory");

        final var sets = new ModuleUri("math/sets");
        final var emptysetData = new SymbolData(List.of(), List.of(), null, null, "emptyset", null, null)
            .withDefiniens(new Term.Informal("with no elements", List.of()));
        final var unionData = new SymbolData(
            List.of(ArgumentMode.SIMPLE, ArgumentMode.SIMPLE),
            List.of(),
            AssociativityType.BINARY_LEFT,
            null,
            null,
            null,
            null
        );
        assertThat(extracted.declarations()).containsExactly(new Declaration.Module(
            sets,
            null,
            new Language("en"),
            null,
            List.of(
                new Declaration.Symbol(new SymbolUri(sets, "emptyset"), emptysetData),
                new Declaration.Symbol(new SymbolUri(sets, "union"), unionData)
            )
        ));

        final var block = (DocumentElement.ModuleBlock) extracted.document().elements().get(0);
        final var section = (DocumentElement.Section) block.children().get(0);
        assertThat(section.uri()).hasToString("docs/sets#basics");
        assertThat(section.title()).isNotNull();
        assertThat(section.title().text()).isEqualTo("Basics");

        final var children = section.children();
        assertThat(children).hasSize(4);
        assertThat(children.get(0)).isInstanceOf(DocumentElement.Paragraph.class);
        assertThat(children.get(1)).isInstanceOf(DocumentElement.VariableDeclaration.class);
        assertThat(children.get(2)).isInstanceOf(DocumentElement.VariableDeclaration.class);
        final var a = new Term.Var(new Variable.Ref(DocumentElementUri.parse("docs/sets#basics/A"), false));
        final var b = new Term.Var(new Variable.Ref(DocumentElementUri.parse("docs/sets#basics/B"), false));
        assertThat(children.get(3)).isEqualTo(new DocumentElement.TermElement(
            DocumentElementUri.parse("docs/sets#basics/term"),
            new Term.Application(new Term.Symbol(new SymbolUri(sets, "union")), List.of(
                new Argument.Simple(a),
                new Argument.Simple(b)
            ))
        ));
    }

    private static HtmlExtractionResult extract(final String html) {
        return HtmlExtractor.extract(html, ExtractionOptions.builder(document).build());
    }

    private static Term symbol(final String name) {
        return new Term.Symbol(new SymbolUri(new ModuleUri("m"), name));
    }

    private static final DocumentUri document = new DocumentUri("docs/a");
    private static final SymbolData emptyData = new SymbolData(List.of(), List.of(), null, null, null, null, null);
    private static final Path testResourcesPath = Path.of("src/test/resources");
}
