package com.legal.citation.rules;

import com.legal.citation.core.model.CitationOccurrence;
import com.legal.citation.core.model.ResolutionContext;
import com.legal.citation.registry.InMemoryLawStore;
import com.legal.citation.registry.LawRegistry;
import com.legal.citation.scope.ScopeResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CitationRuleEngineTest {

    @Mock
    private CitationRule first;

    @Mock
    private CitationRule second;

    @Mock
    private CitationRule third;

    private LawRegistry registry;
    private CitationSite site;

    @BeforeEach
    void setUp() {
        registry = LawRegistry.builder().store(new InMemoryLawStore()).build();
        ResolutionContext ctx = ResolutionContext.builder()
                .fullText("第一条")
                .currentLawName("民法")
                .sourceLawId("129AC0000000089")
                .sourceNodeId("JPLAW:129AC0000000089#main#2")
                .build();
        site = new CitationSite(new CitationOccurrence(0, 3, "一", null, "第一条"), ctx, new ScopeResolver(registry));
    }

    @Test
    @DisplayName("Should stop at the first rule returning a verdict, in priority order")
    void testFirstVerdictWins() {
        when(first.getPriority()).thenReturn(10);
        when(second.getPriority()).thenReturn(20);
        when(third.getPriority()).thenReturn(30);
        when(second.evaluate(site)).thenReturn(Optional.of(Resolution.suppress("second")));
        when(second.getName()).thenReturn("second");

        CitationRuleEngine engine = new CitationRuleEngine(List.of(third, second, first));
        Resolution resolution = engine.evaluate(site);

        assertEquals(ResolutionType.SUPPRESS, resolution.type());
        assertEquals("second", resolution.rule());
        verify(first).evaluate(site);
        verify(third, never()).evaluate(any());
    }

    @Test
    @DisplayName("Should fall back to self when no rule matches")
    void testFallback() {
        CitationRuleEngine engine = new CitationRuleEngine();

        Resolution resolution = engine.evaluate(site);

        assertEquals(ResolutionType.SELF, resolution.type());
        assertEquals(CitationRuleEngine.FALLBACK_RULE, resolution.rule());
    }

    @Test
    @DisplayName("Default chain should hold the nine rules in cascade order")
    void testDefaultChainOrder() {
        CitationRuleEngine engine = DefaultCitationRules.createDefaultChain(registry);

        List<String> names = engine.getRules().stream().map(CitationRule::getName).toList();
        assertEquals(List.of(
                ExplicitActNumberRule.NAME,
                AmendmentSelfNumberingGuardRule.NAME,
                SelfLawTokenRule.NAME,
                ImmediateNamedLawRule.NAME,
                ImmediateExternalLawRule.NAME,
                SentenceScopeRule.NAME,
                SentenceExternalCooccurrenceRule.NAME,
                AmendmentBareCitationRule.NAME,
                DefaultSelfRule.NAME), names);
    }

    @Test
    @DisplayName("Should add and remove rules by name")
    void testAddRemove() {
        CitationRuleEngine engine = DefaultCitationRules.createDefaultChain(registry);

        assertTrue(engine.removeRule(DefaultSelfRule.NAME));
        assertFalse(engine.removeRule(DefaultSelfRule.NAME));
        assertEquals(8, engine.getRules().size());

        engine.addRule(new AmendmentBareCitationRule() {
            @Override
            public String getName() {
                return "always-suppress";
            }

            @Override
            public Optional<Resolution> evaluate(CitationSite s) {
                return Optional.of(Resolution.suppress(getName()));
            }
        });
        assertEquals("always-suppress", engine.evaluate(site).rule());
    }

    @Test
    @DisplayName("Resolution should require a law name for cross-links and external edges")
    void testResolutionValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new Resolution(ResolutionType.CROSS_LINK, null, "r"));
        assertThrows(IllegalArgumentException.class,
                () -> new Resolution(ResolutionType.EXTERNAL_EDGE, null, "r"));
        assertTrue(Resolution.self("r").isLinked());
        assertFalse(Resolution.suppress("r").isLinked());
    }
}
