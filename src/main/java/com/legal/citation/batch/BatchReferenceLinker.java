package com.legal.citation.batch;

import com.legal.citation.api.ReferenceResolver;
import com.legal.citation.api.ResolutionResult;
import com.legal.citation.logging.LogContext;
import com.legal.citation.metrics.MetricsService;
import com.legal.citation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Resolves many documents concurrently on a fixed thread pool.
 *
 * <p>Documents are independent, so they run in any order; results are reported in request
 * order. A failing document is recorded in the {@link BatchResult} unless the linker was
 * built with {@code failFast}, in which case the first failure (in request order) is rethrown.</p>
 */
public class BatchReferenceLinker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchReferenceLinker.class);

    private static final int DEFAULT_THREADS = Math.max(1, Runtime.getRuntime().availableProcessors());

    private final ReferenceResolver resolver;
    private final ExecutorService executor;
    private final MetricsService metricsService;
    private final boolean failFast;

    private BatchReferenceLinker(Builder builder) {
        this.resolver = Objects.requireNonNull(builder.resolver, "resolver is required");
        this.executor = Executors.newFixedThreadPool(builder.threads);
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.failFast = builder.failFast;
    }

    /**
     * Resolves one document asynchronously.
     */
    public CompletableFuture<ResolutionResult> linkAsync(LinkRequest request) {
        Objects.requireNonNull(request, "request is required");
        return CompletableFuture.supplyAsync(() -> resolver.resolve(request.context()), executor);
    }

    /**
     * Resolves all documents using every pool thread.
     */
    public BatchResult linkAll(List<LinkRequest> requests) {
        return linkAll(requests, Integer.MAX_VALUE);
    }

    /**
     * Resolves all documents with at most {@code maxConcurrency} running at once.
     */
    public BatchResult linkAll(List<LinkRequest> requests, int maxConcurrency) {
        Objects.requireNonNull(requests, "requests is required");
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be > 0");
        }
        String batchId = LogContext.generateCorrelationId();
        try (LogContext ignored = LogContext.forBatch(batchId)) {
            metricsService.recordBatchSize(requests.size());
            Semaphore semaphore = new Semaphore(Math.min(maxConcurrency, Math.max(1, requests.size())));

            List<CompletableFuture<ResolutionResult>> futures = requests.stream()
                    .map(request -> CompletableFuture.supplyAsync(() -> {
                        try {
                            semaphore.acquire();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw new CompletionException(e);
                        }
                        try {
                            return resolver.resolve(request.context());
                        } finally {
                            semaphore.release();
                        }
                    }, executor))
                    .toList();

            List<DocumentResult> documents = new ArrayList<>(requests.size());
            for (int i = 0; i < requests.size(); i++) {
                String documentId = requests.get(i).documentId();
                try {
                    documents.add(DocumentResult.success(documentId, futures.get(i).join()));
                } catch (CompletionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    metricsService.incrementDocumentFailed();
                    if (failFast) {
                        futures.forEach(f -> f.cancel(false));
                        log.error("batch.failed document={} error={}", documentId, cause.getMessage());
                        if (cause instanceof RuntimeException runtime) {
                            throw runtime;
                        }
                        throw e;
                    }
                    log.warn("batch.document.failed document={} error={}", documentId, cause.getMessage());
                    documents.add(DocumentResult.failure(documentId, String.valueOf(cause.getMessage())));
                }
            }

            BatchResult result = new BatchResult(documents);
            log.info("batch.completed result={}", result);
            return result;
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ReferenceResolver resolver;
        private int threads = DEFAULT_THREADS;
        private MetricsService metricsService;
        private boolean failFast;

        public Builder resolver(ReferenceResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder threads(int threads) {
            if (threads <= 0) {
                throw new IllegalArgumentException("threads must be positive");
            }
            this.threads = threads;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Rethrow the first failure instead of recording it.
         */
        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public BatchReferenceLinker build() {
            return new BatchReferenceLinker(this);
        }
    }
}
