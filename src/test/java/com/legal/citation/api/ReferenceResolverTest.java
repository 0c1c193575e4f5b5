package com.legal.citation.api;

import com.legal.citation.core.model.EdgeKind;
import com.legal.citation.core.model.ReferenceEdge;
import com.legal.citation.core.model.ResolutionContext;
import com.legal.citation.metrics.MetricsService;
import com.legal.citation.registry.InMemoryLawStore;
import com.legal.citation.registry.LawRegistry;
import com.legal.citation.rules.AmendmentBareCitationRule;
import com.legal.citation.rules.AmendmentSelfNumberingGuardRule;
import com.legal.citation.rules.DefaultSelfRule;
import com.legal.citation.rules.ExplicitActNumberRule;
import com.legal.citation.rules.ImmediateExternalLawRule;
import com.legal.citation.rules.ResolutionType;
import com.legal.citation.rules.SentenceExternalCooccurrenceRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ReferenceResolverTest {

    private static final String MINPO_ID = "129AC0000000089";
    private static final String KEIHO_ID = "140AC0000000045";
    private static final String KEISOHO_ID = "323AC0000000131";
    private static final String KENPO_ID = "321CONSTITUTION";
    private static final String KAISHAHO_ID = "417AC0000000086";

    private ReferenceResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = resolverFor(baseStore());
    }

    private static InMemoryLawStore baseStore() {
        return new InMemoryLawStore()
                .addLaw("民法", MINPO_ID)
                .addLaw("刑法", KEIHO_ID)
                .addLaw("刑事訴訟法", KEISOHO_ID)
                .addLaw("日本国憲法", KENPO_ID);
    }

    private static ReferenceResolver resolverFor(InMemoryLawStore store) {
        return ReferenceResolver.builder()
                .registry(LawRegistry.builder().store(store).build())
                .build();
    }

    private static ResolutionContext ctx(String law, String lawId, String article) {
        return ctx(law, lawId, article, false);
    }

    private static ResolutionContext ctx(String law, String lawId, String article, boolean amendment) {
        return ResolutionContext.builder()
                .currentLawName(law)
                .sourceLawId(lawId)
                .sourceNodeId("JPLAW:" + lawId + "#main#" + article)
                .amendmentFragment(amendment)
                .build();
    }

    private static List<String> targets(ResolutionResult result) {
        return result.getEdges().stream().map(ReferenceEdge::to).toList();
    }

    @Nested
    @DisplayName("Self citations")
    class SelfCitations {

        @Test
        @DisplayName("Text without citations should be returned unchanged")
        void testNoCitations() {
            String text = "この法律は、公布の日から施行する。";
            ResolutionResult result = resolver.resolve(text, ctx("民法", MINPO_ID, "1"));

            assertEquals(text, result.getText());
            assertTrue(result.getEdges().isEmpty());
            assertTrue(result.getDecisions().isEmpty());
        }

        @Test
        @DisplayName("Bare citation should link to the current law with one internal edge")
        void testBareCitation() {
            ResolutionResult result = resolver.resolve("第二条の規定により", ctx("民法", MINPO_ID, "1"));

            assertEquals("[[laws/民法/本文/第2条.md|第二条]]の規定により", result.getText());
            assertEquals(1, result.getEdges().size());
            ReferenceEdge edge = result.getEdges().get(0);
            assertEquals("JPLAW:" + MINPO_ID + "#main#1", edge.from());
            assertEquals("JPLAW:" + MINPO_ID + "#main#2", edge.to());
            assertEquals(EdgeKind.INTERNAL, edge.kind());
            assertEquals("第二条", edge.evidence());
            assertEquals(0.9, edge.confidence());
            assertEquals("regex_v2", edge.extractorVersion());
        }

        @Test
        @DisplayName("Citation of the source article should be linked without an edge")
        void testSelfLoopDropped() {
            ResolutionResult result = resolver.resolve("第二条", ctx("民法", MINPO_ID, "2"));

            assertEquals("[[laws/民法/本文/第2条.md|第二条]]", result.getText());
            assertTrue(result.getEdges().isEmpty());
        }

        @Test
        @DisplayName("Enumerated self-law citations should all be self-scoped")
        void testSelfEnumeration() {
            ResolutionResult result = resolver.resolve("本法第一条、第二条、第三条", ctx("民法", MINPO_ID, "10"));

            assertEquals("本法[[laws/民法/本文/第1条.md|第一条]]、[[laws/民法/本文/第2条.md|第二条]]、"
                    + "[[laws/民法/本文/第3条.md|第三条]]", result.getText());
            assertEquals(List.of(
                    "JPLAW:" + MINPO_ID + "#main#1",
                    "JPLAW:" + MINPO_ID + "#main#2",
                    "JPLAW:" + MINPO_ID + "#main#3"), targets(result));
        }

        @Test
        @DisplayName("Branch numbers should appear in file name and node id")
        void testBranchNumber() {
            ResolutionResult result = resolver.resolve("第三十条の二十八", ctx("民法", MINPO_ID, "1"));

            assertEquals("[[laws/民法/本文/第30条の28.md|第三十条の二十八]]", result.getText());
            assertEquals(List.of("JPLAW:" + MINPO_ID + "#main#30_28"), targets(result));
        }

        @Test
        @DisplayName("Current law named explicitly should resolve to self")
        void testNamedCurrentLaw() {
            ResolutionResult result = resolver.resolve("民法第一条", ctx("民法", MINPO_ID, "5"));

            assertEquals("民法[[laws/民法/本文/第1条.md|第一条]]", result.getText());
            assertEquals(List.of("JPLAW:" + MINPO_ID + "#main#1"), targets(result));
        }
    }

    @Nested
    @DisplayName("Cross-links")
    class CrossLinks {

        @Test
        @DisplayName("Longer law name should win over a shorter one")
        void testBoundarySafety() {
            ResolutionResult result = resolver.resolve("刑事訴訟法第二百九十条", ctx("民法", MINPO_ID, "1"));

            assertEquals("刑事訴訟法[[laws/刑事訴訟法/本文/第290条.md|第二百九十条]]", result.getText());
            assertEquals(List.of("JPLAW:" + KEISOHO_ID + "#main#290"), targets(result));
        }

        @Test
        @DisplayName("Named scope should continue through an enumeration")
        void testScopeContinuation() {
            ResolutionResult result = resolver.resolve("刑法第百七十六条、第百七十七条", ctx("民法", MINPO_ID, "1"));

            assertEquals("刑法[[laws/刑法/本文/第176条.md|第百七十六条]]、[[laws/刑法/本文/第177条.md|第百七十七条]]",
                    result.getText());
            assertEquals(List.of(
                    "JPLAW:" + KEIHO_ID + "#main#176",
                    "JPLAW:" + KEIHO_ID + "#main#177"), targets(result));
        }

        @Test
        @DisplayName("の規定は should send the next citation back to the current law")
        void testScopeReset() {
            ResolutionResult result = resolver.resolve("民法第九十三条の規定は、第七百七十四条の四において",
                    ctx("刑法", KEIHO_ID, "1"));

            assertEquals("民法[[laws/民法/本文/第93条.md|第九十三条]]の規定は、"
                    + "[[laws/刑法/本文/第774条の4.md|第七百七十四条の四]]において", result.getText());
            assertEquals(List.of(
                    "JPLAW:" + MINPO_ID + "#main#93",
                    "JPLAW:" + KEIHO_ID + "#main#774_4"), targets(result));
        }

        @Test
        @DisplayName("Named scope should survive a later external law in the enumeration")
        void testNamedScopeOverExternal() {
            ResolutionResult result = resolver.resolve("刑法第百条及び破産法第二条、第三条", ctx("民法", MINPO_ID, "1"));

            assertEquals("刑法[[laws/刑法/本文/第100条.md|第百条]]及び破産法第二条、[[laws/刑法/本文/第3条.md|第三条]]",
                    result.getText());
            assertEquals(List.of(
                    "JPLAW:" + KEIHO_ID + "#main#100",
                    "JPLAW:" + KEIHO_ID + "#main#3"), targets(result));
        }

        @Test
        @DisplayName("Aliases should link to the canonical law folder")
        void testAliases() {
            ResolutionResult kenpo = resolver.resolve("憲法第十四条", ctx("民法", MINPO_ID, "1"));
            assertEquals("憲法[[laws/日本国憲法/本文/第14条.md|第十四条]]", kenpo.getText());
            assertEquals(List.of("JPLAW:" + KENPO_ID + "#main#14"), targets(kenpo));

            ResolutionResult oldKeiho = resolver.resolve("旧刑法第二条", ctx("民法", MINPO_ID, "1"));
            assertEquals("旧刑法[[laws/刑法/本文/第2条.md|第二条]]", oldKeiho.getText());

            ResolutionResult newMinpo = resolver.resolve("新民法第三条", ctx("刑法", KEIHO_ID, "1"));
            assertEquals("新民法[[laws/民法/本文/第3条.md|第三条]]", newMinpo.getText());
        }

        @Test
        @DisplayName("Parenthetical annotation between law name and citation should be allowed")
        void testAnnotatedLawName() {
            ResolutionResult result = resolver.resolve("民法（改正前）第二十七条", ctx("刑法", KEIHO_ID, "1"));

            assertEquals("民法（改正前）[[laws/民法/本文/第27条.md|第二十七条]]", result.getText());
            assertEquals(List.of("JPLAW:" + MINPO_ID + "#main#27"), targets(result));
        }

        @Test
        @DisplayName("Act number of a stored law should cross-link")
        void testActNumberStoredLaw() {
            ResolutionResult result = resolver.resolve("民法（明治二十九年法律第八十九号）第七百九条",
                    ctx("刑法", KEIHO_ID, "1"));

            assertTrue(result.getText().endsWith("[[laws/民法/本文/第709条.md|第七百九条]]"));
            assertEquals(List.of("JPLAW:" + MINPO_ID + "#main#709"), targets(result));
        }

        @Test
        @DisplayName("Law without a readable id should be linked without an edge")
        void testCrossLinkWithoutLawId() {
            ReferenceResolver noIds = resolverFor(new InMemoryLawStore().addLaw("民法", MINPO_ID).addLaw("刑法"));

            ResolutionResult result = noIds.resolve("刑法第百九十九条", ctx("民法", MINPO_ID, "1"));

            assertEquals("刑法[[laws/刑法/本文/第199条.md|第百九十九条]]", result.getText());
            assertTrue(result.getEdges().isEmpty());
            assertEquals(1, result.getLinkCount());
        }

        @Test
        @DisplayName("External-list law present in the store should be promoted to linkable")
        void testPromotion() {
            ReferenceResolver promoted = resolverFor(baseStore().addLaw("会社法", KAISHAHO_ID));

            ResolutionResult result = promoted.resolve("会社法第二条", ctx("民法", MINPO_ID, "1"));

            assertEquals("会社法[[laws/会社法/本文/第2条.md|第二条]]", result.getText());
            assertEquals(List.of("JPLAW:" + KAISHAHO_ID + "#main#2"), targets(result));
        }
    }

    @Nested
    @DisplayName("External and suppressed citations")
    class ExternalCitations {

        @Test
        @DisplayName("Act number of a law outside the store should give one external edge and no link")
        void testExternalActNumber() {
            String text = "弁護士法（昭和二十四年法律第二百五号）第三十条の二十八";
            ResolutionResult result = resolver.resolve(text, ctx("会社法", KAISHAHO_ID, "1"));

            assertEquals(text, result.getText());
            assertEquals(1, result.getEdges().size());
            ReferenceEdge edge = result.getEdges().get(0);
            assertEquals("external:弁護士法#main#30_28", edge.to());
            assertEquals(EdgeKind.EXTERNAL, edge.kind());
            assertEquals(0.8, edge.confidence());
            assertEquals(ExplicitActNumberRule.NAME, result.getDecisions().get(0).resolution().rule());
        }

        @Test
        @DisplayName("Each act-numbered law of an enumeration should get its own external edge")
        void testExternalEnumeration() {
            String text = "弁護士法（昭和二十四年法律第二百五号）第三十条の二十八第六項、"
                    + "司法書士法（昭和二十五年法律第百九十七号）第四十五条の二第六項、"
                    + "土地家屋調査士法（昭和二十五年法律第二百二十八号）第四十条の二第六項において";
            ResolutionResult result = resolver.resolve(text, ctx("会社法", KAISHAHO_ID, "1"));

            assertEquals(text, result.getText());
            assertEquals(List.of(
                    "external:弁護士法#main#30_28",
                    "external:司法書士法#main#45_2",
                    "external:土地家屋調査士法#main#40_2"), targets(result));
        }

        @Test
        @DisplayName("External law named directly before the citation should suppress it")
        void testImmediateExternal() {
            ResolutionResult result = resolver.resolve("会社法第二条", ctx("民法", MINPO_ID, "1"));

            assertEquals("会社法第二条", result.getText());
            assertTrue(result.getEdges().isEmpty());
            assertEquals(ImmediateExternalLawRule.NAME, result.getDecisions().get(0).resolution().rule());
        }

        @Test
        @DisplayName("同法 should not be linked")
        void testDouhou() {
            ResolutionResult result = resolver.resolve("会社法第三条及び同法第五条", ctx("民法", MINPO_ID, "1"));

            assertEquals("会社法第三条及び同法第五条", result.getText());
            assertTrue(result.getEdges().isEmpty());
        }

        @Test
        @DisplayName("External scope should carry over an enumeration")
        void testExternalScope() {
            ResolutionResult result = resolver.resolve("土地収用法第二条及び第三条", ctx("民法", MINPO_ID, "1"));

            assertEquals("土地収用法第二条及び第三条", result.getText());
            assertTrue(result.getEdges().isEmpty());
        }

        @Test
        @DisplayName("External law elsewhere in the sentence should suppress a bare citation")
        void testSentenceCooccurrence() {
            String text = "破産法の規定による届出があった場合には、第五条";
            ResolutionResult result = resolver.resolve(text, ctx("民法", MINPO_ID, "1"));

            assertEquals(text, result.getText());
            assertEquals(SentenceExternalCooccurrenceRule.NAME, result.getDecisions().get(0).resolution().rule());
        }

        @Test
        @DisplayName("Quoted external law should not suppress a bare citation")
        void testQuotedExternalIgnored() {
            ResolutionResult result = resolver.resolve("「破産法」に定める場合を除き、第五条", ctx("民法", MINPO_ID, "1"));

            assertEquals(List.of("JPLAW:" + MINPO_ID + "#main#5"), targets(result));
        }
    }

    @Nested
    @DisplayName("Amendment fragments")
    class AmendmentFragments {

        @Test
        @DisplayName("Bare citation should be left alone")
        void testBareSuppressed() {
            String text = "第十条を次のように改める。";
            ResolutionResult result = resolver.resolve(text, ctx("民法", MINPO_ID, "1", true));

            assertEquals(text, result.getText());
            assertTrue(result.getEdges().isEmpty());
            assertEquals(AmendmentBareCitationRule.NAME, result.getDecisions().get(0).resolution().rule());
        }

        @Test
        @DisplayName("の規定による without a law prefix should be guarded")
        void testGuard() {
            String text = "第十条の規定による";
            ResolutionResult result = resolver.resolve(text, ctx("民法", MINPO_ID, "1", true));

            assertEquals(text, result.getText());
            assertEquals(AmendmentSelfNumberingGuardRule.NAME, result.getDecisions().get(0).resolution().rule());
        }

        @Test
        @DisplayName("Explicit self token should override the guard")
        void testSelfTokenOverridesGuard() {
            ResolutionResult result = resolver.resolve("本法第十条の規定による", ctx("民法", MINPO_ID, "1", true));

            assertEquals("本法[[laws/民法/本文/第10条.md|第十条]]の規定による", result.getText());
            assertEquals(List.of("JPLAW:" + MINPO_ID + "#main#10"), targets(result));
        }

        @Test
        @DisplayName("Named law directly before the citation should still link")
        void testNamedLawInAmendment() {
            ResolutionResult result = resolver.resolve("刑法第十条の規定による", ctx("民法", MINPO_ID, "1", true));

            assertEquals(List.of("JPLAW:" + KEIHO_ID + "#main#10"), targets(result));
        }

        @Test
        @DisplayName("Law name far before the citation should not scope it")
        void testDistantLawName() {
            String text = "民法" + "あ".repeat(60) + "第二十七条";
            ResolutionResult result = resolver.resolve(text, ctx("刑法", KEIHO_ID, "1", true));

            assertEquals(text, result.getText());
            assertTrue(result.getEdges().isEmpty());
        }
    }

    @Nested
    @DisplayName("Single decision path")
    class SingleDecisionPath {

        @Test
        @DisplayName("Links and edges should agree for every citation")
        void testLinksAndEdgesAgree() {
            String text = "民法第一条及び第二条並びに会社法第三条の規定は、第四条、本法第五条、"
                    + "弁護士法（昭和二十四年法律第二百五号）第三十条";
            ResolutionResult result = resolver.resolve(text, ctx("刑法", KEIHO_ID, "99"));

            for (CitationDecision decision : result.getDecisions()) {
                ResolutionType type = decision.resolution().type();
                switch (type) {
                    case SELF, CROSS_LINK -> {
                        assertTrue(decision.isLinked());
                        assertTrue(decision.getEdge().map(e -> !e.isExternal()).orElse(true));
                    }
                    case EXTERNAL_EDGE -> {
                        assertFalse(decision.isLinked());
                        assertTrue(decision.getEdge().orElseThrow().isExternal());
                    }
                    case SUPPRESS -> {
                        assertFalse(decision.isLinked());
                        assertTrue(decision.getEdge().isEmpty());
                    }
                }
            }
            int linkMarkers = result.getText().split("\\[\\[", -1).length - 1;
            assertEquals(result.getLinkCount(), linkMarkers);
            assertEquals(result.getDecisions().stream().filter(d -> d.getEdge().isPresent()).count(),
                    result.getEdges().size());
        }

        @Test
        @DisplayName("link should return the text of resolve")
        void testLinkMatchesResolve() {
            ResolutionContext context = ctx("民法", MINPO_ID, "1");
            String text = "刑法第百七十六条、第百七十七条及び第三条";

            assertEquals(resolver.resolve(text, context).getText(), resolver.link(text, context));
        }

        @Test
        @DisplayName("Resolving twice should give equal results")
        void testDeterministic() {
            ResolutionContext context = ctx("民法", MINPO_ID, "1");
            String text = "刑法第百七十六条、第百七十七条及び本法第三条";

            ResolutionResult first = resolver.resolve(text, context);
            ResolutionResult second = resolver.resolve(text, context);

            assertEquals(first.getText(), second.getText());
            assertEquals(first.getEdges(), second.getEdges());
        }
    }

    @Test
    @DisplayName("Options should set confidences and extractor tag")
    void testOptions() {
        ReferenceResolver custom = ReferenceResolver.builder()
                .registry(LawRegistry.builder().store(baseStore()).build())
                .options(ResolverOptions.builder()
                        .internalConfidence(0.95)
                        .externalConfidence(0.5)
                        .extractorVersion("regex_v3")
                        .build())
                .build();

        ResolutionResult result = custom.resolve("第二条", ctx("民法", MINPO_ID, "1"));

        ReferenceEdge edge = result.getEdges().get(0);
        assertEquals(0.95, edge.confidence());
        assertEquals("regex_v3", edge.extractorVersion());
    }

    @Test
    @DisplayName("Metrics should record each decision and emitted edge")
    void testMetrics() {
        MetricsService metrics = mock(MetricsService.class);
        ReferenceResolver measured = ReferenceResolver.builder()
                .registry(LawRegistry.builder().store(baseStore()).build())
                .metricsService(metrics)
                .build();

        measured.resolve("第一条及び第二条", ctx("民法", MINPO_ID, "1"));

        verify(metrics, times(2)).incrementCitationResolved(ResolutionType.SELF, DefaultSelfRule.NAME);
        verify(metrics).incrementSelfLoopDropped();
        verify(metrics).incrementEdgeEmitted(EdgeKind.INTERNAL);
        verify(metrics).recordDocumentDuration(any(Duration.class));
    }

    @Test
    @DisplayName("Should reject null text and missing registry")
    void testValidation() {
        assertThrows(NullPointerException.class, () -> resolver.resolve(null, ctx("民法", MINPO_ID, "1")));
        assertThrows(NullPointerException.class, () -> ReferenceResolver.builder().build());
        assertThrows(IllegalArgumentException.class, () -> ResolverOptions.builder().internalConfidence(1.5));
        assertThrows(IllegalArgumentException.class, () -> ResolverOptions.builder().extractorVersion(" "));
    }
}
