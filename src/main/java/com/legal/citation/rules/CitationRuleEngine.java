package com.legal.citation.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates citation rules in priority order (lower priority number = higher precedence).
 * The first rule returning a verdict decides; when no rule matches the citation is
 * attributed to the current law.
 */
public class CitationRuleEngine {
    private static final Logger log = LoggerFactory.getLogger(CitationRuleEngine.class);

    static final String FALLBACK_RULE = "no-rule-matched";

    private final List<CitationRule> rules;

    public CitationRuleEngine() {
        this.rules = new ArrayList<>();
    }

    public CitationRuleEngine(List<CitationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    /**
     * Adds a rule to the engine.
     */
    public void addRule(CitationRule rule) {
        rules.add(rule);
        sortRules();
    }

    /**
     * Adds multiple rules to the engine.
     */
    public void addRules(List<CitationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    /**
     * Removes a rule by name.
     */
    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    /**
     * Gets all rules currently in the engine, in evaluation order.
     */
    public List<CitationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Decides the given citation.
     */
    public Resolution evaluate(CitationSite site) {
        for (CitationRule rule : rules) {
            Optional<Resolution> verdict = rule.evaluate(site);
            if (verdict.isPresent()) {
                log.debug("Rule '{}' decided '{}' at offset {} -> {}",
                        rule.getName(), site.occurrence().literalText(),
                        site.occurrence().startOffset(), verdict.get().type());
                return verdict.get();
            }
        }
        return Resolution.self(FALLBACK_RULE);
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(CitationRule::getPriority));
    }
}
