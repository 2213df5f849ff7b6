package com.civica.service;

import com.civica.config.CivicaProperties;
import com.civica.events.AnalysisEventSink;
import com.civica.model.ActorSnapshot;
import com.civica.model.AnalysisCompletedEvent;
import com.civica.model.AnalysisResult;
import com.civica.model.RequestType;
import com.civica.model.ResultSource;
import com.civica.model.dto.GatewayStatistics;
import com.civica.model.dto.ServiceStatus;
import com.civica.provider.BackendOutcome;
import com.civica.provider.FailureKind;
import com.civica.provider.PromptBuilder;
import com.civica.service.batching.ClusteringBatcher;
import com.civica.service.batching.PendingRequest;
import com.civica.service.batching.RepresentativeBuilder;
import com.civica.service.batching.RequestCluster;
import com.civica.service.batching.ResponseCustomizer;
import com.civica.service.canonicalization.RequestKeyGenerator;
import com.civica.service.offline.OfflineAnalysisService;
import com.civica.service.offline.OfflineResponseGenerator;
import com.civica.service.resilience.CircuitBreaker;
import com.civica.service.resilience.CircuitBreakerState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Entry point the simulation talks to.
 *
 * Flow:
 * 1. {@link #enqueue} answers from the exact tier, then the bucket tier, else parks the request
 * 2. {@link #tick} clusters parked requests once enough have gathered or the oldest timed out
 * 3. Each cluster's representative goes through the dispatcher on the dispatch executor
 * 4. The shared result is customized per member, cached, and delivered
 * 5. A failed or refused dispatch answers every member from the offline generator
 *
 * Enqueue never blocks. At most one tick runs at a time.
 */
@Slf4j
public class SimulationAiGateway {

    static final Duration SWEEP_INTERVAL = Duration.ofMinutes(1);
    static final Duration STOP_GRACE = Duration.ofSeconds(10);

    private final RequestKeyGenerator keyGenerator;
    private final ResponseCacheService cacheService;
    private final ClusteringBatcher batcher;
    private final BatchDispatcher dispatcher;
    private final OfflineAnalysisService offlineAnalysis;
    private final ResponseCustomizer customizer;
    private final PromptBuilder promptBuilder;
    private final AnalysisEventSink eventSink;
    private final Executor dispatchExecutor;
    private final CivicaProperties.BatchingConfig batchingConfig;
    private final Clock clock;

    private final ConcurrentLinkedQueue<PendingRequest> pending = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pendingCount = new AtomicInteger();
    private final AtomicLong sequence = new AtomicLong();
    private final ReentrantLock tickLock = new ReentrantLock();

    // Guarded by tickLock
    private final List<PendingRequest> deferred = new ArrayList<>();
    private Instant lastSweep;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong exactCacheHits = new AtomicLong();
    private final AtomicLong bucketCacheHits = new AtomicLong();
    private final AtomicLong batchedRequests = new AtomicLong();
    private final AtomicLong dispatchedRequests = new AtomicLong();
    private final AtomicLong clustersDispatched = new AtomicLong();
    private final AtomicLong fallbackResults = new AtomicLong();

    private final Object idleMonitor = new Object();
    private final AtomicInteger activeBatches = new AtomicInteger();

    private volatile boolean circuitClosed;
    private ScheduledExecutorService scheduler;

    public SimulationAiGateway(RequestKeyGenerator keyGenerator,
                               ResponseCacheService cacheService,
                               ClusteringBatcher batcher,
                               BatchDispatcher dispatcher,
                               OfflineAnalysisService offlineAnalysis,
                               ResponseCustomizer customizer,
                               PromptBuilder promptBuilder,
                               AnalysisEventSink eventSink,
                               Executor dispatchExecutor,
                               CivicaProperties.BatchingConfig batchingConfig,
                               Clock clock) {
        this.keyGenerator = keyGenerator;
        this.cacheService = cacheService;
        this.batcher = batcher;
        this.dispatcher = dispatcher;
        this.offlineAnalysis = offlineAnalysis;
        this.customizer = customizer;
        this.promptBuilder = promptBuilder;
        this.eventSink = eventSink;
        this.dispatchExecutor = dispatchExecutor;
        this.batchingConfig = batchingConfig;
        this.clock = clock;

        CircuitBreaker breaker = dispatcher.getCircuitBreaker();
        this.circuitClosed = breaker.getState() == CircuitBreakerState.CLOSED;
        breaker.addListener((from, to) -> {
            boolean wasAvailable = isAvailable();
            circuitClosed = to == CircuitBreakerState.CLOSED;
            if (wasAvailable != isAvailable()) {
                log.info("Analysis backend is now {}", isAvailable() ? "available" : "unavailable");
            }
        });
    }

    public void enqueue(ActorSnapshot snapshot, RequestType type, Consumer<AnalysisResult> callback) {
        enqueue(snapshot, type, null, callback);
    }

    /**
     * Submit a request. Returns immediately; {@code callback} fires exactly once,
     * on this thread for a cache hit, otherwise on a dispatch thread.
     *
     * @param subject political content the actor reacts to, may be null
     */
    public void enqueue(ActorSnapshot snapshot, RequestType type, String subject, Consumer<AnalysisResult> callback) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(type, "type");
        totalRequests.incrementAndGet();

        String exactKey = keyGenerator.exactKey(snapshot, type, subject);
        String bucketKey = keyGenerator.bucketKey(snapshot, type, subject);
        PendingRequest request = new PendingRequest(sequence.incrementAndGet(), snapshot, type, subject,
                callback, clock.instant(), exactKey, bucketKey);

        Optional<ResponseCacheService.CacheResult> cached = cacheService.get(exactKey, bucketKey);
        if (cached.isPresent()) {
            boolean exact = cached.get().getMatchType() == ResponseCacheService.MatchType.EXACT;
            (exact ? exactCacheHits : bucketCacheHits).incrementAndGet();
            AnalysisResult result = cached.get().getResult().copy();
            result.setSource(exact ? ResultSource.EXACT_CACHE : ResultSource.BUCKET_CACHE);
            request.complete(result);
            return;
        }

        pending.add(request);
        pendingCount.incrementAndGet();
    }

    /**
     * Periodic work: expiry sweep at most once per {@link #SWEEP_INTERVAL}, then a
     * flush when enough requests are waiting or the oldest has hit the batch timeout.
     * Returns at once if another tick is running.
     */
    public void tick() {
        if (!tickLock.tryLock()) {
            return;
        }
        try {
            Instant now = clock.instant();
            sweepIfDue(now);
            if (flushDue(now)) {
                drainAndDispatch(false);
            }
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * Dispatch everything waiting, regardless of group size or age.
     */
    public void flush() {
        tickLock.lock();
        try {
            drainAndDispatch(true);
        } finally {
            tickLock.unlock();
        }
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        if (!batchingConfig.isBackgroundFlush()) {
            log.info("Gateway started without background flush; the host drives tick()");
            return;
        }
        long interval = batchingConfig.getTickInterval().toMillis();
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "civica-batch-tick");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::tickSafely, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Gateway started: tick every {}ms", interval);
    }

    /**
     * Stop the background timer, dispatch every waiting request and wait a
     * bounded time for in-flight clusters.
     */
    public void stop() {
        synchronized (this) {
            if (scheduler != null) {
                scheduler.shutdownNow();
                scheduler = null;
            }
        }
        flush();
        if (!awaitIdle(STOP_GRACE)) {
            log.warn("Gateway stopped with {} batches still in flight", activeBatches.get());
        } else {
            log.info("Gateway stopped");
        }
    }

    /**
     * Wait until no cluster is in flight.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (activeBatches.get() > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                try {
                    TimeUnit.NANOSECONDS.timedWait(idleMonitor, remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return true;
    }

    public void clearCaches() {
        cacheService.clear();
        offlineAnalysis.getGenerator().clear();
    }

    public GatewayStatistics getStatistics() {
        long total = totalRequests.get();
        long hits = exactCacheHits.get() + bucketCacheHits.get();
        long clusters = clustersDispatched.get();
        OfflineResponseGenerator.OfflineStatistics offline = offlineAnalysis.getGenerator().getStatistics();
        return GatewayStatistics.builder()
                .cacheHitRatio(ratio(hits, total))
                .batchingEfficiency(ratio(batchedRequests.get(), total))
                .activeCacheEntries(cacheService.size())
                .activeBatches(activeBatches.get())
                .averageBatchSize(ratio(dispatchedRequests.get(), clusters))
                .totalRequests(total)
                .exactCacheHits(exactCacheHits.get())
                .bucketCacheHits(bucketCacheHits.get())
                .batchedRequests(batchedRequests.get())
                .clustersDispatched(clusters)
                .fallbackResults(fallbackResults.get())
                .pendingRequests(getPendingCount())
                .circuitState(dispatcher.getCircuitBreaker().getState())
                .offlineCacheHitRate(offline.getCacheHitRate())
                .offlineCachedResponses(offline.getCachedResponseCount())
                .offlineGeneratedResponses(offline.getGeneratedResponseCount())
                .build();
    }

    public ServiceStatus getServiceStatus() {
        ServiceStatusTracker tracker = dispatcher.getStatusTracker();
        return ServiceStatus.builder()
                .available(isAvailable())
                .requestsToday(tracker.getRequestsToday())
                .failedRequestsToday(tracker.getFailedRequestsToday())
                .lastSuccessfulRequest(tracker.getLastSuccessfulRequest())
                .circuitBreakerState(dispatcher.getCircuitBreaker().getState())
                .cacheHitRate(ratio(exactCacheHits.get() + bucketCacheHits.get(), totalRequests.get()))
                .build();
    }

    /**
     * Circuit closed and a credential configured.
     */
    public boolean isAvailable() {
        return circuitClosed && dispatcher.hasCredential();
    }

    /**
     * Requests parked in the pool or held back by the last tick.
     */
    public int getPendingCount() {
        tickLock.lock();
        try {
            return pendingCount.get() + deferred.size();
        } finally {
            tickLock.unlock();
        }
    }

    private void tickSafely() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Batch tick failed", e);
        }
    }

    // Caller holds tickLock
    private void sweepIfDue(Instant now) {
        if (lastSweep != null && Duration.between(lastSweep, now).compareTo(SWEEP_INTERVAL) < 0) {
            return;
        }
        lastSweep = now;
        int removed = cacheService.removeExpired();
        if (removed > 0) {
            log.debug("Swept {} expired cache entries", removed);
        }
    }

    // Caller holds tickLock
    private boolean flushDue(Instant now) {
        int waiting = pendingCount.get() + deferred.size();
        if (waiting == 0) {
            return false;
        }
        if (waiting >= batcher.getMinBatchSize()) {
            return true;
        }
        // Deferred requests were drained before anything still in the pool
        PendingRequest oldest = deferred.isEmpty() ? pending.peek() : deferred.get(0);
        return oldest != null
                && Duration.between(oldest.getEnqueuedAt(), now).compareTo(batcher.getBatchTimeout()) >= 0;
    }

    // Caller holds tickLock
    private void drainAndDispatch(boolean force) {
        List<PendingRequest> working = new ArrayList<>(deferred);
        deferred.clear();
        PendingRequest next;
        while ((next = pending.poll()) != null) {
            pendingCount.decrementAndGet();
            working.add(next);
        }
        if (working.isEmpty()) {
            return;
        }

        ClusteringBatcher.Plan plan = batcher.plan(working, force);
        deferred.addAll(plan.getDeferred());

        Instant now = clock.instant();
        for (List<PendingRequest> members : plan.getDispatch()) {
            submit(new RequestCluster(members, RepresentativeBuilder.build(members), now));
        }
    }

    private void submit(RequestCluster cluster) {
        cluster.markProcessing();
        activeBatches.incrementAndGet();
        clustersDispatched.incrementAndGet();
        dispatchedRequests.addAndGet(cluster.size());
        try {
            dispatchExecutor.execute(() -> process(cluster));
        } catch (RejectedExecutionException e) {
            log.warn("Dispatch executor rejected cluster {}, processing on the tick thread", cluster.getId());
            process(cluster);
        }
    }

    private void process(RequestCluster cluster) {
        Instant started = clock.instant();
        String summary = promptBuilder.summarize(cluster.getRepresentative(), cluster.getRequestType(), cluster.getSubject());
        try {
            BackendOutcome outcome;
            try {
                outcome = dispatcher.dispatch(cluster.getRepresentative(), cluster.getRequestType(), cluster.getSubject());
            } catch (RuntimeException e) {
                log.error("Unexpected error dispatching cluster {}", cluster.getId(), e);
                outcome = BackendOutcome.failure(FailureKind.UNKNOWN, e.getMessage());
            }

            Instant finished = clock.instant();
            Duration elapsed = Duration.between(started, finished);

            if (outcome.isSuccess()) {
                AnalysisResult shared = outcome.getResult();
                shared.setBatchSize(cluster.size());
                shared.setProcessingTimeMs(elapsed.toMillis());
                cluster.markCompleted(shared, finished);
                if (cluster.size() > 1) {
                    batchedRequests.addAndGet(cluster.size());
                }
                deliver(cluster, shared, ResultSource.BACKEND, true);
                log.info("Cluster {} completed: {} requests in {}ms", cluster.getId(), cluster.size(), elapsed.toMillis());
                publish(new AnalysisCompletedEvent(summary, shared, elapsed, finished));
            } else {
                log.warn("Cluster {} of {} requests answered offline ({}: {})",
                        cluster.getId(), cluster.size(), outcome.getFailureKind(), outcome.getMessage());
                AnalysisResult fallback = offlineAnalysis.analyze(cluster.getRepresentative(), cluster.getRequestType(), summary);
                fallback.setBatchSize(cluster.size());
                fallback.setProcessingTimeMs(elapsed.toMillis());
                cluster.markFailed(fallback, finished);
                fallbackResults.addAndGet(cluster.size());
                deliver(cluster, fallback, ResultSource.OFFLINE_FALLBACK, false);
            }
        } finally {
            if (activeBatches.decrementAndGet() == 0) {
                synchronized (idleMonitor) {
                    idleMonitor.notifyAll();
                }
            }
        }
    }

    private void deliver(RequestCluster cluster, AnalysisResult shared, ResultSource source, boolean cache) {
        for (PendingRequest member : cluster.getMembers()) {
            AnalysisResult result = customizer.customize(shared, member.getSnapshot(), cluster.size(), source);
            if (cache) {
                cacheService.put(member.getExactKey(), member.getBucketKey(), result.copy());
            }
            member.complete(result);
        }
    }

    private void publish(AnalysisCompletedEvent event) {
        try {
            eventSink.publish(event);
        } catch (RuntimeException e) {
            log.warn("Event sink failed: {}", e.getMessage(), e);
        }
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}
