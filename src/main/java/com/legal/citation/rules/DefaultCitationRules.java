package com.legal.citation.rules;

import com.legal.citation.registry.LawRegistry;

import java.util.List;

/**
 * The built-in citation cascade.
 *
 * <ol>
 *   <li>{@link ExplicitActNumberRule} - {@code 法令名（…号）第N条}</li>
 *   <li>{@link AmendmentSelfNumberingGuardRule} - {@code 第N条の規定による} in amendments</li>
 *   <li>{@link SelfLawTokenRule} - {@code 本法第N条}</li>
 *   <li>{@link ImmediateNamedLawRule} - {@code 民法第N条}</li>
 *   <li>{@link ImmediateExternalLawRule} - {@code 会社法第N条} (not in store)</li>
 *   <li>{@link SentenceScopeRule} - scope carried from earlier in the sentence</li>
 *   <li>{@link SentenceExternalCooccurrenceRule} - external law elsewhere in the sentence</li>
 *   <li>{@link AmendmentBareCitationRule} - unscoped citation in an amendment</li>
 *   <li>{@link DefaultSelfRule} - the current law</li>
 * </ol>
 */
public final class DefaultCitationRules {

    public static final int DEFAULT_ACT_NUMBER_LOOKBEHIND = 100;
    public static final int DEFAULT_GUARD_LOOKAHEAD = 10;

    private DefaultCitationRules() {
        // Utility class
    }

    /**
     * Creates an engine with the default rules and window sizes.
     */
    public static CitationRuleEngine createDefaultChain(LawRegistry registry) {
        return createDefaultChain(registry, DEFAULT_ACT_NUMBER_LOOKBEHIND, DEFAULT_GUARD_LOOKAHEAD);
    }

    /**
     * Creates an engine with the default rules.
     *
     * @param registry           law registry shared by the rules
     * @param actNumberLookbehind characters searched before a citation for {@code （…号）}
     * @param guardLookahead     characters inspected after a citation by the amendment guard
     */
    public static CitationRuleEngine createDefaultChain(LawRegistry registry,
                                                        int actNumberLookbehind,
                                                        int guardLookahead) {
        CitationRuleEngine engine = new CitationRuleEngine();
        engine.addRules(getRules(registry, actNumberLookbehind, guardLookahead));
        return engine;
    }

    public static List<CitationRule> getRules(LawRegistry registry, int actNumberLookbehind, int guardLookahead) {
        return List.of(
                new ExplicitActNumberRule(registry, actNumberLookbehind),
                new AmendmentSelfNumberingGuardRule(registry, actNumberLookbehind, guardLookahead),
                new SelfLawTokenRule(),
                new ImmediateNamedLawRule(registry),
                new ImmediateExternalLawRule(),
                new SentenceScopeRule(registry),
                new SentenceExternalCooccurrenceRule(),
                new AmendmentBareCitationRule(),
                new DefaultSelfRule()
        );
    }
}
