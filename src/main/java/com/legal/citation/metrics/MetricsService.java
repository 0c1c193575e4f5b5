package com.legal.citation.metrics;

import com.legal.citation.core.model.EdgeKind;
import com.legal.citation.rules.ResolutionType;

import java.time.Duration;

/**
 * Interface for recording citation resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a meter registry.
 */
public interface MetricsService {

    void recordDocumentDuration(Duration duration);

    void incrementCitationResolved(ResolutionType type, String rule);

    void incrementEdgeEmitted(EdgeKind kind);

    void incrementSelfLoopDropped();

    void recordBatchSize(int size);

    void incrementDocumentFailed();
}
