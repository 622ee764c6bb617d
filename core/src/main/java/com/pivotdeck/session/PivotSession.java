package com.pivotdeck.session;

import com.pivotdeck.catalog.DimensionCatalog;
import com.pivotdeck.data.Dataset;
import com.pivotdeck.filter.Filter;
import com.pivotdeck.metric.MetricRegistry;
import com.pivotdeck.pivot.PivotAggregator;
import com.pivotdeck.pivot.PivotResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-user pivot context: the dataset, the metric registry, the current configuration
 * and the latest published result.
 *
 * <p>Recomputation follows latest-wins semantics:
 * <ul>
 *   <li>Every submission takes the next generation number</li>
 *   <li>A finished computation is published only if no newer submission exists</li>
 *   <li>A stale computation is never merged or published; its future completes empty</li>
 * </ul>
 *
 * <p>Configurations are validated on the submitting thread, so errors surface from
 * {@link #submit} directly and never from the future. A rejected configuration takes
 * no generation and leaves the computations in flight untouched.
 */
public class PivotSession {

    private static final Logger logger = LoggerFactory.getLogger(PivotSession.class);

    private final String sessionId;
    private final long createdAt;
    private final MetricRegistry metricRegistry;
    private final PivotAggregator aggregator;
    private final AtomicReference<Dataset> dataset;
    private final AtomicLong generations = new AtomicLong();
    private final AtomicReference<Published> published = new AtomicReference<>(Published.NONE);

    /**
     * A result together with the configuration and generation that produced it.
     */
    public record Published(long generation, PivotConfiguration configuration, PivotResult result) {
        static final Published NONE = new Published(0L, null, null);
    }

    public PivotSession(String sessionId, Dataset dataset, MetricRegistry metricRegistry) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.dataset = new AtomicReference<>(Objects.requireNonNull(dataset, "dataset must not be null"));
        this.metricRegistry = Objects.requireNonNull(metricRegistry, "metricRegistry must not be null");
        this.aggregator = new PivotAggregator(metricRegistry);
        this.createdAt = System.currentTimeMillis();
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public Dataset getDataset() {
        return dataset.get();
    }

    public MetricRegistry getMetricRegistry() {
        return metricRegistry;
    }

    /**
     * Replaces the session's dataset, e.g. after regenerating data.
     *
     * <p>Computations already running keep the dataset they started with.
     *
     * @param replacement the new dataset
     */
    public void replaceDataset(Dataset replacement) {
        Dataset previous = dataset.getAndSet(Objects.requireNonNull(replacement, "replacement must not be null"));
        logger.info("Session {} switched dataset {} -> {}", sessionId, previous.id(), replacement.id());
    }

    /**
     * Computes a configuration on the calling thread and publishes its result if it is the latest.
     *
     * @param configuration the configuration
     * @return the result (returned even if a newer submission prevents publishing it)
     */
    public PivotResult compute(PivotConfiguration configuration) {
        Dataset current = dataset.get();
        Filter filter = validate(configuration, current);
        long generation = generations.incrementAndGet();
        PivotResult result = aggregator.computePivot(current, configuration.bucketRules(), filter, configuration.spec());
        publish(generation, configuration, result);
        return result;
    }

    /**
     * Schedules a recomputation.
     *
     * @param configuration the configuration
     * @param executor where to run the computation
     * @return a future holding the result, or empty if a newer submission superseded this one
     * @throws com.pivotdeck.exception.PivotException if the configuration is invalid
     */
    public CompletableFuture<Optional<PivotResult>> submit(PivotConfiguration configuration, Executor executor) {
        Objects.requireNonNull(executor, "executor must not be null");
        Dataset current = dataset.get();
        Filter filter = validate(configuration, current);
        long generation = generations.incrementAndGet();
        logger.debug("Session {} submitted generation {}", sessionId, generation);

        return CompletableFuture
            .supplyAsync(() -> aggregator.computePivot(current, configuration.bucketRules(), filter,
                configuration.spec()), executor)
            .thenApply(result -> publish(generation, configuration, result)
                ? Optional.of(result)
                : Optional.empty());
    }

    /**
     * Returns the most recently published result.
     *
     * @return the latest result, or empty if nothing was published yet
     */
    public Optional<PivotResult> latestResult() {
        return Optional.ofNullable(published.get().result());
    }

    /**
     * Returns the configuration of the latest published result.
     *
     * @return the configuration, or empty if nothing was published yet
     */
    public Optional<PivotConfiguration> activeConfiguration() {
        return Optional.ofNullable(published.get().configuration());
    }

    public long latestGeneration() {
        return generations.get();
    }

    public long publishedGeneration() {
        return published.get().generation();
    }

    private Filter validate(PivotConfiguration configuration, Dataset current) {
        Objects.requireNonNull(configuration, "configuration must not be null");
        Filter filter = Filter.parse(configuration.filterText(), DimensionCatalog.fromSchema(current.schema()));
        aggregator.validate(current, configuration.bucketRules(), configuration.spec());
        return filter;
    }

    private boolean publish(long generation, PivotConfiguration configuration, PivotResult result) {
        if (generation != generations.get()) {
            logger.warn("Session {} discarded stale generation {} (latest is {})",
                sessionId, generation, generations.get());
            return false;
        }
        Published candidate = new Published(generation, configuration, result);
        while (true) {
            Published current = published.get();
            if (current.generation() >= generation) {
                logger.warn("Session {} discarded generation {} after generation {} was published",
                    sessionId, generation, current.generation());
                return false;
            }
            if (published.compareAndSet(current, candidate)) {
                logger.debug("Session {} published generation {}: {}", sessionId, generation, result);
                return true;
            }
        }
    }

    @Override
    public String toString() {
        return String.format("PivotSession[id=%s, dataset=%s, generation=%d]",
            sessionId, dataset.get().id(), generations.get());
    }
}
