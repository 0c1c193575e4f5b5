package com.legal.citation.metrics;

import com.legal.citation.core.model.EdgeKind;
import com.legal.citation.rules.ResolutionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code citation.document.duration}: Timer</li>
 *   <li>{@code citation.resolved}: Counter (tags: outcome, rule)</li>
 *   <li>{@code citation.edge.emitted}: Counter (tag: kind)</li>
 *   <li>{@code citation.edge.selfloop.dropped}: Counter</li>
 *   <li>{@code citation.batch.size}: DistributionSummary</li>
 *   <li>{@code citation.document.failed}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer documentTimer;
    private final DistributionSummary batchSizeSummary;
    private final Counter selfLoopCounter;
    private final Counter failedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.documentTimer = Timer.builder("citation.document.duration")
                .description("Duration of resolving the citations of one text")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("citation.batch.size")
                .description("Number of documents per batch")
                .register(registry);
        this.selfLoopCounter = Counter.builder("citation.edge.selfloop.dropped")
                .description("Edges dropped because source and target coincide")
                .register(registry);
        this.failedCounter = Counter.builder("citation.document.failed")
                .description("Documents whose resolution failed in a batch")
                .register(registry);
    }

    @Override
    public void recordDocumentDuration(Duration duration) {
        documentTimer.record(duration);
    }

    @Override
    public void incrementCitationResolved(ResolutionType type, String rule) {
        String key = "resolved:" + type.name() + ":" + rule;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("citation.resolved")
                        .description("Citations decided by the rule cascade")
                        .tag("outcome", type.name())
                        .tag("rule", rule)
                        .register(registry)).increment();
    }

    @Override
    public void incrementEdgeEmitted(EdgeKind kind) {
        String key = "edge:" + kind.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("citation.edge.emitted")
                        .description("Reference edges emitted")
                        .tag("kind", kind.name())
                        .register(registry)).increment();
    }

    @Override
    public void incrementSelfLoopDropped() {
        selfLoopCounter.increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void incrementDocumentFailed() {
        failedCounter.increment();
    }
}
