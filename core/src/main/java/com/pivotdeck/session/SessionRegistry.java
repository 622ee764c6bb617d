package com.pivotdeck.session;

import com.pivotdeck.config.PivotDeckConfig;
import com.pivotdeck.data.Dataset;
import com.pivotdeck.metric.MetricPresets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates and tracks pivot sessions by id.
 *
 * <p>Each session owns its own dataset reference and metric registry; the registry
 * only maps ids to sessions and shares nothing between them. Asynchronous
 * recomputations of all sessions run on one pool of daemon worker threads, sized by
 * {@link PivotDeckConfig#sessionThreads()}.
 */
public class SessionRegistry implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentHashMap<String, PivotSession> sessions = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    /**
     * Creates a registry configured from system properties.
     */
    public SessionRegistry() {
        this(PivotDeckConfig.fromSystemProperties());
    }

    public SessionRegistry(PivotDeckConfig config) {
        AtomicInteger threadIndex = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(config.sessionThreads(), r -> {
            Thread t = new Thread(r, "pivot-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        logger.info("SessionRegistry initialized: sessionThreads={}", config.sessionThreads());
    }

    /**
     * Creates a session with a random id and the preset metrics.
     *
     * @param dataset the session's dataset
     * @return the new session
     */
    public PivotSession create(Dataset dataset) {
        return getOrCreate(UUID.randomUUID().toString(), dataset);
    }

    /**
     * Returns the session with the given id, creating it on first use.
     *
     * @param sessionId the session id
     * @param dataset the dataset for a newly created session (ignored if the session exists)
     * @return the session
     */
    public PivotSession getOrCreate(String sessionId, Dataset dataset) {
        return sessions.computeIfAbsent(sessionId, id -> {
            PivotSession session = new PivotSession(id, dataset, MetricPresets.newRegistry());
            logger.info("Created session {} on dataset {} ({} records)", id, dataset.id(), dataset.size());
            return session;
        });
    }

    public Optional<PivotSession> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Closes a session.
     *
     * @param sessionId the session id
     * @return true if the session existed
     */
    public boolean remove(String sessionId) {
        boolean removed = sessions.remove(sessionId) != null;
        if (removed) {
            logger.info("Closed session {}", sessionId);
        }
        return removed;
    }

    public List<String> sessionIds() {
        return List.copyOf(sessions.keySet());
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Returns the shared worker pool for {@link PivotSession#submit}.
     *
     * @return the executor
     */
    public ExecutorService executor() {
        return executor;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        sessions.clear();
        logger.info("SessionRegistry closed");
    }
}
