package com.legal.citation.api;

import com.legal.citation.core.model.CitationOccurrence;
import com.legal.citation.core.model.NodeIds;
import com.legal.citation.core.model.ReferenceEdge;
import com.legal.citation.core.model.ResolutionContext;
import com.legal.citation.logging.LogContext;
import com.legal.citation.markup.WikiLinks;
import com.legal.citation.metrics.MetricsService;
import com.legal.citation.metrics.NoOpMetricsService;
import com.legal.citation.registry.LawRegistry;
import com.legal.citation.rules.CitationRuleEngine;
import com.legal.citation.rules.CitationSite;
import com.legal.citation.rules.DefaultCitationRules;
import com.legal.citation.rules.Resolution;
import com.legal.citation.scope.ScopeResolver;
import com.legal.citation.tokenizer.CitationTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Main entry point: turns the citations of a text into wiki links and reference edges.
 *
 * <p>Every citation goes through one decision of the rule cascade and the link and the
 * edge are both derived from that decision:</p>
 * <ul>
 *   <li>self or cross-link: the citation is linked, and an internal edge is emitted
 *       when the target law id is known and differs from the source node;</li>
 *   <li>external: no link, one edge to an {@code external:} id;</li>
 *   <li>suppressed: text left as is, nothing emitted.</li>
 * </ul>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * ReferenceResolver resolver = ReferenceResolver.builder()
 *     .registry(LawRegistry.builder().store(new VaultLawStore(vault)).build())
 *     .build();
 *
 * ResolutionResult result = resolver.resolve(paragraph, ResolutionContext.builder()
 *     .currentLawName("民法")
 *     .sourceLawId("129AC0000000089")
 *     .sourceNodeId("JPLAW:129AC0000000089#main#1")
 *     .build());
 * </pre>
 *
 * <p>Instances are thread-safe; resolution is synchronous and only touches the
 * registry caches.</p>
 */
public class ReferenceResolver {
    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private final LawRegistry registry;
    private final CitationTokenizer tokenizer;
    private final ScopeResolver scopeResolver;
    private final CitationRuleEngine ruleEngine;
    private final ResolverOptions options;
    private final MetricsService metricsService;

    private ReferenceResolver(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "registry is required");
        this.options = builder.options != null ? builder.options : ResolverOptions.defaults();
        this.tokenizer = new CitationTokenizer();
        this.scopeResolver = new ScopeResolver(registry);
        this.ruleEngine = builder.ruleEngine != null
                ? builder.ruleEngine
                : DefaultCitationRules.createDefaultChain(registry,
                options.getActNumberLookbehind(), options.getGuardLookahead());
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
    }

    /**
     * Resolves the citations of {@code text} in the given context.
     * The context's own text is ignored in favour of {@code text}.
     */
    public ResolutionResult resolve(String text, ResolutionContext context) {
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(context, "context is required");
        return resolve(context.withText(text));
    }

    /**
     * Resolves the citations of the context's text.
     */
    public ResolutionResult resolve(ResolutionContext context) {
        Objects.requireNonNull(context, "context is required");
        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forDocument(context.getSourceNodeId(), context.getCurrentLawName())) {
            String text = context.getFullText();
            StringBuilder out = new StringBuilder(text.length() + 64);
            List<ReferenceEdge> edges = new ArrayList<>();
            List<CitationDecision> decisions = new ArrayList<>();
            int copied = 0;

            for (CitationOccurrence occurrence : tokenizer.scan(text)) {
                Resolution resolution = ruleEngine.evaluate(new CitationSite(occurrence, context, scopeResolver));
                metricsService.incrementCitationResolved(resolution.type(), resolution.rule());
                CitationDecision decision = apply(occurrence, resolution, context);
                decisions.add(decision);

                out.append(text, copied, occurrence.startOffset());
                if (decision.isLinked()) {
                    out.append(WikiLinks.format(decision.linkTarget(), occurrence.literalText()));
                } else {
                    out.append(occurrence.literalText());
                }
                copied = occurrence.endOffset();
                decision.getEdge().ifPresent(edge -> {
                    edges.add(edge);
                    metricsService.incrementEdgeEmitted(edge.kind());
                });
            }
            out.append(text, copied, text.length());

            if (!decisions.isEmpty()) {
                log.debug("citations.resolved citations={} edges={}", decisions.size(), edges.size());
            }
            return new ResolutionResult(out.toString(), edges, decisions);
        } finally {
            metricsService.recordDocumentDuration(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Returns only the transformed text; the decision path is the same as {@link #resolve}.
     */
    public String link(String text, ResolutionContext context) {
        return resolve(text, context).getText();
    }

    public LawRegistry getRegistry() {
        return registry;
    }

    public ResolverOptions getOptions() {
        return options;
    }

    private CitationDecision apply(CitationOccurrence occurrence, Resolution resolution, ResolutionContext context) {
        return switch (resolution.type()) {
            case SELF -> selfDecision(occurrence, resolution, context);
            case CROSS_LINK -> crossLinkDecision(occurrence, resolution, context);
            case EXTERNAL_EDGE -> {
                ReferenceEdge edge = ReferenceEdge.external(context.getSourceNodeId(),
                        NodeIds.external(resolution.lawName(), occurrence.articleKey()), occurrence.literalText(),
                        options.getExternalConfidence(), options.getExtractorVersion());
                yield new CitationDecision(occurrence, resolution, null, edge);
            }
            case SUPPRESS -> new CitationDecision(occurrence, resolution, null, null);
        };
    }

    private CitationDecision crossLinkDecision(CitationOccurrence occurrence, Resolution resolution,
                                               ResolutionContext context) {
        String lawName = resolution.lawName();
        if (registry.isSelf(lawName, context.getCurrentLawName())) {
            return selfDecision(occurrence, resolution, context);
        }
        String target = WikiLinks.articlePath(lawName, occurrence.articleFileName());
        Optional<String> lawId = registry.resolveLawId(lawName);
        if (lawId.isEmpty()) {
            log.debug("citation.crosslink.noLawId law={} citation={}", lawName, occurrence.literalText());
            return new CitationDecision(occurrence, resolution, target, null);
        }
        ReferenceEdge edge = internalEdge(context,
                NodeIds.article(lawId.get(), occurrence.articleKey()), occurrence.literalText());
        return new CitationDecision(occurrence, resolution, target, edge);
    }

    private CitationDecision selfDecision(CitationOccurrence occurrence, Resolution resolution,
                                          ResolutionContext context) {
        String target = WikiLinks.articlePath(context.getCurrentLawName(), occurrence.articleFileName());
        ReferenceEdge edge = internalEdge(context,
                NodeIds.article(context.getSourceLawId(), occurrence.articleKey()), occurrence.literalText());
        return new CitationDecision(occurrence, resolution, target, edge);
    }

    // Null when the edge would point back at the citing node.
    private ReferenceEdge internalEdge(ResolutionContext context, String to, String evidence) {
        ReferenceEdge edge = ReferenceEdge.internal(context.getSourceNodeId(), to, evidence,
                options.getInternalConfidence(), options.getExtractorVersion());
        if (edge.isSelfLoop()) {
            metricsService.incrementSelfLoopDropped();
            return null;
        }
        return edge;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LawRegistry registry;
        private ResolverOptions options;
        private CitationRuleEngine ruleEngine;
        private MetricsService metricsService;

        public Builder registry(LawRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder options(ResolverOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Replaces the default rule cascade.
         */
        public Builder ruleEngine(CitationRuleEngine ruleEngine) {
            this.ruleEngine = ruleEngine;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public ReferenceResolver build() {
            return new ReferenceResolver(this);
        }
    }
}
