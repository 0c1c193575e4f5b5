package com.legal.citation.metrics;

import com.legal.citation.core.model.EdgeKind;
import com.legal.citation.rules.ResolutionType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordDocumentDuration(Duration duration) {
    }

    @Override
    public void incrementCitationResolved(ResolutionType type, String rule) {
    }

    @Override
    public void incrementEdgeEmitted(EdgeKind kind) {
    }

    @Override
    public void incrementSelfLoopDropped() {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void incrementDocumentFailed() {
    }
}
