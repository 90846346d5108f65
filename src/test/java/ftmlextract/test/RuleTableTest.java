// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.test;

import java.util.ArrayList;
import java.util.List;
import ftmlextract.domain.Declaration;
import ftmlextract.domain.SymbolData;
import ftmlextract.extraction.AttributeRecognizer;
import ftmlextract.extraction.CloseElement;
import ftmlextract.extraction.ExtractionError;
import ftmlextract.extraction.ExtractorState;
import ftmlextract.extraction.FtmlAttributes;
import ftmlextract.extraction.FtmlKey;
import ftmlextract.extraction.FtmlNode;
import ftmlextract.extraction.OpenDomainElement;
import ftmlextract.extraction.OpenNarrativeElement;
import ftmlextract.extraction.RuleTable;
import ftmlextract.narrative.DocumentCounter;
import ftmlextract.narrative.DocumentRange;
import ftmlextract.narrative.DocumentStyle;
import ftmlextract.narrative.SectionLevel;
import ftmlextract.term.ArgumentMode;
import ftmlextract.term.AssociativityType;
import ftmlextract.term.Variable;
import ftmlextract.uri.DocumentElementUri;
import ftmlextract.uri.DocumentUri;
import ftmlextract.uri.ModuleUri;
import ftmlextract.uri.SymbolUri;
import static org.assertj.core.api.Assertions.assertThat;
import org.jsoup.nodes.Attributes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class RuleTableTest {
    @Test
    void recognizerKeepsDeclarationOrderAndSkipsUnknownAttributes() {
        final var attributes = new Attributes()
            .put("class", "x")
            .put("data-ftml-term", "OMS")
            .put("data-ftml-bogus", "1")
            .put("data-ftml-head", "m?a")
            .put("data-other", "y");
        assertThat(AttributeRecognizer.recognize(attributes)).containsExactly(FtmlKey.TERM, FtmlKey.HEAD);
    }

    @Test
    void sectionUsesExplicitId() {
        final var state = new ExtractorState(document);
        final var attributes = new Attributes().put("data-ftml-section", "").put("data-ftml-id", "intro");
        assertThat(run(state, attributes)).containsExactly(CloseElement.SECTION);
        final var frame = (OpenNarrativeElement.Section) state.narrativeFrames().get(0);
        assertThat(frame.uri()).isEqualTo(new DocumentElementUri(document, "intro"));
    }

    @Test
    void sectionsWithoutIdGetFreshNames() {
        final var state = new ExtractorState(document);
        run(state, new Attributes().put("data-ftml-section", ""));
        run(state, new Attributes().put("data-ftml-section", ""));
        final var frames = state.narrativeFrames();
        assertThat(((OpenNarrativeElement.Section) frames.get(1)).uri()).hasToString("docs/a#section");
        assertThat(((OpenNarrativeElement.Section) frames.get(0)).uri()).hasToString("docs/a#section/section_1");
    }

    @Test
    void invalidIdIsRejected() {
        final var state = new ExtractorState(document);
        final var error = ExtractionErrors.capture(
            () -> run(state, new Attributes().put("data-ftml-slide", "").put("data-ftml-id", "a b"))
        );
        assertThat(error.key()).isEqualTo(FtmlKey.ID);
        assertThat(error.reason()).isEqualTo(ExtractionError.Reason.INVALID_VALUE);
        assertThat(state.narrativeFrames()).isEmpty();
    }

    @Test
    void symbolDeclarationTakesItsAttributes() {
        final var state = new ExtractorState(document);
        run(state, new Attributes().put("data-ftml-module", "math/sets"));
        final var attributes = new Attributes()
            .put("data-ftml-symdecl", "union")
            .put("data-ftml-args", "ia")
            .put("data-ftml-role", "binop, set")
            .put("data-ftml-assoctype", "bin")
            .put("data-ftml-macroname", "union");
        assertThat(run(state, attributes)).containsExactly(CloseElement.SYMBOL_DECLARATION);
        assertThat(attributes.hasKey("data-ftml-args")).isFalse();
        assertThat(attributes.hasKey("data-ftml-role")).isFalse();
        assertThat(attributes.hasKey("data-ftml-macroname")).isFalse();
        assertThat(attributes.hasKey("data-ftml-symdecl")).isTrue();

        final var frame = (OpenDomainElement.SymbolDeclaration) state.domainFrames().get(0);
        assertThat(frame.uri()).isEqualTo(new SymbolUri(new ModuleUri("math/sets"), "union"));
        assertThat(frame.data()).isEqualTo(new SymbolData(
            List.of(ArgumentMode.SIMPLE, ArgumentMode.SEQUENCE),
            List.of("binop", "set"),
            AssociativityType.BINARY_LEFT,
            null,
            "union",
            null,
            null
        ));
    }

    @Test
    void symbolNameOutsideModuleIsRejected() {
        final var state = new ExtractorState(document);
        final var error = ExtractionErrors.capture(() -> run(state, new Attributes().put("data-ftml-symdecl", "x")));
        assertThat(error.key()).isEqualTo(FtmlKey.SYMDECL);
        assertThat(error.reason()).isEqualTo(ExtractionError.Reason.NOT_IN);
    }

    @Test
    void fullSymbolUriIsAllowedOutsideModules() {
        final var state = new ExtractorState(document);
        final var markers = run(state, new Attributes().put("data-ftml-symdecl", "math/sets?emptyset"));
        state.close(markers.get(0), new FakeNode());
        final var declarations = state.finish().declarations();
        assertThat(declarations).hasSize(1);
        assertThat(((Declaration.Symbol) declarations.get(0)).uri()).hasToString("math/sets?emptyset");
    }

    @Test
    void nestedModulesExtendTheirParent() {
        final var state = new ExtractorState(document);
        run(state, new Attributes().put("data-ftml-module", "math/sets").put("data-ftml-language", "en"));
        run(state, new Attributes().put("data-ftml-module", "inner"));
        assertThat(state.currentModule()).isEqualTo(new ModuleUri("math/sets/inner"));
    }

    @Test
    void structureContentLivesInItsOwnModule() {
        final var state = new ExtractorState(document);
        run(state, new Attributes().put("data-ftml-module", "math/algebra"));
        assertThat(run(state, new Attributes().put("data-ftml-feature-structure", "monoid")))
            .containsExactly(CloseElement.STRUCTURE);
        assertThat(state.inStructure()).isTrue();
        assertThat(state.currentModule()).isEqualTo(new ModuleUri("math/algebra/monoid"));
        run(state, new Attributes().put("data-ftml-symdecl", "op"));
        final var frame = (OpenDomainElement.SymbolDeclaration) state.domainFrames().get(0);
        assertThat(frame.uri()).hasToString("math/algebra/monoid?op");
    }

    @Test
    void structureNeedsModule() {
        final var state = new ExtractorState(document);
        final var error =
            ExtractionErrors.capture(() -> run(state, new Attributes().put("data-ftml-feature-structure", "s")));
        assertThat(error.key()).isEqualTo(FtmlKey.STRUCTURE);
        assertThat(error.reason()).isEqualTo(ExtractionError.Reason.NOT_IN);
    }

    @Test
    void structuresDoNotNest() {
        final var state = new ExtractorState(document);
        run(state, new Attributes().put("data-ftml-module", "m"));
        run(state, new Attributes().put("data-ftml-feature-structure", "outer"));
        final var error =
            ExtractionErrors.capture(() -> run(state, new Attributes().put("data-ftml-feature-structure", "inner")));
        assertThat(error.reason()).isEqualTo(ExtractionError.Reason.INVALID_IN);
        assertThat(state.domainFrames()).hasSize(2);
    }

    @Test
    void morphismNeedsDomain() {
        final var state = new ExtractorState(document);
        run(state, new Attributes().put("data-ftml-module", "m"));
        final var error =
            ExtractionErrors.capture(() -> run(state, new Attributes().put("data-ftml-feature-morphism", "f")));
        assertThat(error.key()).isEqualTo(FtmlKey.DOMAIN);
        assertThat(error.reason()).isEqualTo(ExtractionError.Reason.MISSING_KEY);
    }

    @Test
    void assignmentsResolveAgainstTheMorphismDomain() {
        final var state = new ExtractorState(document);
        run(state, new Attributes().put("data-ftml-module", "m"));
        run(state, new Attributes().put("data-ftml-feature-morphism", "f").put("data-ftml-domain", "d"));
        assertThat(state.morphismDomain()).isEqualTo(new ModuleUri("d"));
        assertThat(run(state, new Attributes().put("data-ftml-assign", "x")))
            .containsExactly(CloseElement.ASSIGNMENT);
        final var frame = (OpenDomainElement.Assign) state.domainFrames().get(0);
        assertThat(frame.source()).isEqualTo(new SymbolUri(new ModuleUri("d"), "x"));
    }

    @Test
    void assignmentAndRenameNeedMorphism() {
        final var state = new ExtractorState(document);
        run(state, new Attributes().put("data-ftml-module", "m"));
        final var assign = ExtractionErrors.capture(() -> run(state, new Attributes().put("data-ftml-assign", "x")));
        assertThat(assign.key()).isEqualTo(FtmlKey.ASSIGN);
        assertThat(assign.reason()).isEqualTo(ExtractionError.Reason.NOT_IN);
        final var rename = ExtractionErrors.capture(() -> run(state, new Attributes().put("data-ftml-rename", "x")));
        assertThat(rename.key()).isEqualTo(FtmlKey.RENAME);
        assertThat(rename.reason()).isEqualTo(ExtractionError.Reason.NOT_IN);
    }

    @Test
    void invalidNewNameIsRejected() {
        final var state = new ExtractorState(document);
        run(state, new Attributes().put("data-ftml-module", "m"));
        run(state, new Attributes().put("data-ftml-feature-morphism", "f").put("data-ftml-domain", "d"));
        final var error = ExtractionErrors.capture(
            () -> run(state, new Attributes().put("data-ftml-rename", "x").put("data-ftml-to", "a?b"))
        );
        assertThat(error.key()).isEqualTo(FtmlKey.RENAME_TO);
        assertThat(error.reason()).isEqualTo(ExtractionError.Reason.INVALID_VALUE);
    }

    @Test
    void invalidLanguageIsRejected() {
        final var state = new ExtractorState(document);
        final var error = ExtractionErrors.capture(
            () -> run(state, new Attributes().put("data-ftml-module", "m").put("data-ftml-language", "English"))
        );
        assertThat(error.key()).isEqualTo(FtmlKey.LANGUAGE);
        assertThat(error.reason()).isEqualTo(ExtractionError.Reason.INVALID_LANGUAGE);
        assertThat(state.domainFrames()).isEmpty();
    }

    @Test
    void argumentOutsideApplicationIsRejected() {
        final var state = new ExtractorState(document);
        final var error = ExtractionErrors.capture(() -> run(state, new Attributes().put("data-ftml-arg", "1")));
        assertThat(error.key()).isEqualTo(FtmlKey.ARG);
        assertThat(error.reason()).isEqualTo(ExtractionError.Reason.NOT_IN);
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "01", "x", "1256"})
    void invalidArgumentPositionIsRejected(final String position) {
        final var state = new ExtractorState(document);
        run(state, new Attributes().put("data-ftml-term", "OMA").put("data-ftml-head", "m?f"));
        final var error = ExtractionErrors.capture(() -> run(state, new Attributes().put("data-ftml-arg", position)));
        assertThat(error.key()).isEqualTo(FtmlKey.ARG);
        assertThat(error.reason()).isEqualTo(ExtractionError.Reason.INVALID_VALUE);
    }

    @Test
    void invalidArgumentModeIsRejected() {
        final var state = new ExtractorState(document);
        run(state, new Attributes().put("data-ftml-term", "OMA").put("data-ftml-head", "m?f"));
        final var error = ExtractionErrors.capture(
            () -> run(state, new Attributes().put("data-ftml-arg", "1").put("data-ftml-argmode", "ab"))
        );
        assertThat(error.key()).isEqualTo(FtmlKey.ARGMODE);
        assertThat(error.reason()).isEqualTo(ExtractionError.Reason.INVALID_VALUE);
    }

    @Test
    void unknownTermKindIsRejected() {
        final var state = new ExtractorState(document);
        final var error = ExtractionErrors.capture(
            () -> run(state, new Attributes().put("data-ftml-term", "OMX").put("data-ftml-head", "m?f"))
        );
        assertThat(error.key()).isEqualTo(FtmlKey.TERM);
        assertThat(error.reason()).isEqualTo(ExtractionError.Reason.INVALID_VALUE);
        assertThat(state.domainFrames()).isEmpty();
    }

    @Test
    void termHeadKindMustMatch() {
        final var state = new ExtractorState(document);
        final var error = ExtractionErrors.capture(
            () -> run(state, new Attributes().put("data-ftml-term", "OMS").put("data-ftml-head", "x"))
        );
        assertThat(error.key()).isEqualTo(FtmlKey.HEAD);
    }

    @Test
    void nestedApplicationsGetNoUri() {
        final var state = new ExtractorState(document);
        run(state, new Attributes().put("data-ftml-term", "OMA").put("data-ftml-head", "m?f"));
        run(state, new Attributes().put("data-ftml-arg", "1"));
        run(state, new Attributes().put("data-ftml-term", "OMA").put("data-ftml-head", "m?g"));
        final var frames = state.domainFrames();
        assertThat(((OpenDomainElement.Application) frames.get(0)).uri()).isNull();
        assertThat(((OpenDomainElement.Application) frames.get(2)).uri()).hasToString("docs/a#term");
    }

    @Test
    void variableHeadsResolveToDeclarations() {
        final var state = new ExtractorState(document);
        final var markers = run(state, new Attributes().put("data-ftml-vardef", "x"));
        state.close(markers.get(0), new FakeNode());
        run(state, new Attributes().put("data-ftml-term", "OMV").put("data-ftml-head", "x"));
        run(state, new Attributes().put("data-ftml-term", "OMV").put("data-ftml-head", "y"));
        final var frames = state.domainFrames();
        assertThat(((OpenDomainElement.VariableReference) frames.get(1)).variable())
            .isEqualTo(new Variable.Ref(new DocumentElementUri(document, "x"), false));
        assertThat(((OpenDomainElement.VariableReference) frames.get(0)).variable())
            .isEqualTo(new Variable.Name("y"));
    }

    @Test
    void termsInsideNotationsAreIgnored() {
        final var state = new ExtractorState(document);
        assertThat(run(state, new Attributes().put("data-ftml-notation", "m?f").put("data-ftml-precedence", "10")))
            .containsExactly(CloseElement.NOTATION);
        assertThat(run(state, new Attributes().put("data-ftml-term", "OMS").put("data-ftml-head", "m?f"))).isEmpty();
        assertThat(run(state, new Attributes().put("data-ftml-comp", ""))).isEmpty();
        assertThat(state.domainFrames()).isEmpty();
    }

    @Test
    void componentOutsideTermIsRejected() {
        final var state = new ExtractorState(document);
        final var error = ExtractionErrors.capture(() -> run(state, new Attributes().put("data-ftml-comp", "")));
        assertThat(error.reason()).isEqualTo(ExtractionError.Reason.NOT_IN);
    }

    @Test
    void falseInvisibleIsDroppedFromTheElement() {
        final var state = new ExtractorState(document);
        final var attributes = new Attributes().put("data-ftml-invisible", "false");
        assertThat(run(state, attributes)).isEmpty();
        assertThat(attributes.hasKey("data-ftml-invisible")).isFalse();
        assertThat(run(state, new Attributes().put("data-ftml-invisible", "true")))
            .containsExactly(CloseElement.INVISIBLE);
    }

    @Test
    void counterOnStyleElementBelongsToTheStyle() {
        final var state = new ExtractorState(document);
        run(state, new Attributes().put("data-ftml-counter", "theorem").put("data-ftml-style", "lemma"));
        run(state, new Attributes().put("data-ftml-counter", "theorem").put("data-ftml-counter-parent", "2"));
        final var result = state.finish().document();
        assertThat(result.styles()).containsExactly(new DocumentStyle("lemma", "theorem"));
        assertThat(result.counters()).containsExactly(new DocumentCounter("theorem", SectionLevel.SECTION));
    }

    @Test
    void sectionLevelIsRecorded() {
        final var state = new ExtractorState(document);
        run(state, new Attributes().put("data-ftml-sectionlevel", "1"));
        assertThat(state.finish().document().topSectionLevel()).isEqualTo(SectionLevel.CHAPTER);
        final var error =
            ExtractionErrors.capture(() -> run(state, new Attributes().put("data-ftml-sectionlevel", "9")));
        assertThat(error.reason()).isEqualTo(ExtractionError.Reason.INVALID_VALUE);
    }

    @Test
    void importNeedsModule() {
        final var state = new ExtractorState(document);
        final var error = ExtractionErrors.capture(() -> run(state, new Attributes().put("data-ftml-import", "m")));
        assertThat(error.key()).isEqualTo(FtmlKey.IMPORT);
        assertThat(error.reason()).isEqualTo(ExtractionError.Reason.NOT_IN);
    }

    @Test
    void invalidParagraphSubjectIsRejected() {
        final var state = new ExtractorState(document);
        final var error = ExtractionErrors.capture(
            () -> run(state, new Attributes().put("data-ftml-definition", "").put("data-ftml-fors", "m?a, nope"))
        );
        assertThat(error.key()).isEqualTo(FtmlKey.FORS);
        assertThat(error.reason()).isEqualTo(ExtractionError.Reason.INVALID_URI);
        assertThat(state.narrativeFrames()).isEmpty();
    }

    @Test
    void titleOutsideSectionIsRejected() {
        final var state = new ExtractorState(document);
        final var error = ExtractionErrors.capture(() -> run(state, new Attributes().put("data-ftml-title", "")));
        assertThat(error.key()).isEqualTo(FtmlKey.TITLE);
        assertThat(error.reason()).isEqualTo(ExtractionError.Reason.NOT_IN);
    }

    @Test
    void missingRequiredValueIsRejected() {
        final var state = new ExtractorState(document);
        final var error = ExtractionErrors.capture(() -> run(state, new Attributes().put("data-ftml-usemodule", " ")));
        assertThat(error.key()).isEqualTo(FtmlKey.USEMODULE);
        assertThat(error.reason()).isEqualTo(ExtractionError.Reason.MISSING_KEY);
    }

    private static List<CloseElement> run(final ExtractorState state, final Attributes attributes) {
        final var ftmlAttributes = new FtmlAttributes(attributes, AttributeRecognizer.recognize(attributes));
        final var markers = new ArrayList<CloseElement>();
        for (var key = ftmlAttributes.nextKey(); key != null; key = ftmlAttributes.nextKey()) {
            final var marker = RuleTable.apply(key, state, ftmlAttributes);
            if (marker != null) {
                markers.add(marker);
            }
        }
        return markers;
    }

    private static final DocumentUri document = new DocumentUri("docs/a");

    private static final class FakeNode implements FtmlNode {
        @Override
        public DocumentRange range() {
            return new DocumentRange(0, 0);
        }

        @Override
        public String text() {
            return "";
        }

        @Override
        public void delete() {
        }
    }
}
