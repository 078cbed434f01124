package com.rulewise.core.fetch;

import com.rulewise.core.cache.CacheEntry;
import com.rulewise.core.cache.RulesCache;
import com.rulewise.core.logging.MdcContext;
import com.rulewise.core.metrics.RulewiseMetrics;
import com.rulewise.core.model.RuleDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resolves the content of many rules at once, cache first.
 *
 * <p>Every remote read runs on a fixed pool of {@code concurrencyLimit} threads,
 * so no more than that many reads are ever in flight. Each item moves through
 * {@link FetchState}: a transient failure is retried after an exponential backoff
 * (initial, 2x, 4x ...) up to {@code maxRetries} times; a missing document is
 * never retried. An item that still fails is served from the stale area of the
 * cache when possible and otherwise reported as {@link FetchStatus#FAILED}.
 * Failures stay with their item and never affect siblings.
 *
 * <p>With a deadline, items still running when it passes come back as
 * {@link FetchStatus#TIMED_OUT}; their reads keep going and fill the cache for
 * the next request.
 */
public class ConcurrentFetcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentFetcher.class);

    private final ContentSource source;
    private final RulesCache cache;
    private final boolean cacheEnabled;
    private final String ref;
    private final int concurrencyLimit;
    private final int maxRetries;
    private final Duration initialBackoff;
    private final Sleeper sleeper;
    private final RulewiseMetrics metrics;
    private final ExecutorService executor;
    private final Map<String, CompletableFuture<byte[]>> uncachedReads = new ConcurrentHashMap<>();

    public ConcurrentFetcher(ContentSource source, RulesCache cache, Settings settings,
                             Sleeper sleeper, RulewiseMetrics metrics) {
        if (settings.concurrencyLimit() <= 0) {
            throw new IllegalArgumentException("concurrencyLimit must be positive: " + settings.concurrencyLimit());
        }
        if (settings.maxRetries() < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + settings.maxRetries());
        }
        this.source = source;
        this.cache = cache;
        this.cacheEnabled = settings.cacheEnabled() && cache != null;
        this.ref = settings.ref();
        this.concurrencyLimit = settings.concurrencyLimit();
        this.maxRetries = settings.maxRetries();
        this.initialBackoff = settings.initialBackoff();
        this.sleeper = sleeper;
        this.metrics = metrics;
        this.executor = Executors.newFixedThreadPool(concurrencyLimit, new FetchThreadFactory());
    }

    ConcurrentFetcher(ContentSource source, RulesCache cache, Settings settings, Sleeper sleeper) {
        this(source, cache, settings, sleeper, null);
    }

    /**
     * Fetches every descriptor and waits for all of them.
     *
     * @return one result per descriptor, in input order
     */
    public List<FetchResult> fetchMany(List<RuleDescriptor> descriptors) {
        return fetchMany(descriptors, null);
    }

    /**
     * Fetches every descriptor, waiting at most {@code timeout}.
     *
     * @param timeout how long to wait, or {@code null} to wait for every item
     * @return one result per descriptor, in input order
     */
    public List<FetchResult> fetchMany(List<RuleDescriptor> descriptors, Duration timeout) {
        if (descriptors.isEmpty()) {
            return List.of();
        }
        String requestId = MdcContext.currentRequest();
        var futures = new ArrayList<CompletableFuture<FetchResult>>(descriptors.size());
        for (var descriptor : descriptors) {
            futures.add(fetchOne(descriptor, requestId));
        }

        var all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            if (timeout == null) {
                all.get();
            } else {
                all.get(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
            }
        } catch (TimeoutException e) {
            log.debug("Fetch deadline of {} ms passed with items outstanding", timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for rule fetches");
        } catch (ExecutionException e) {
            // per-item futures complete normally; reaching here is a bug in result handling
            log.error("Unexpected fetch failure", e.getCause());
        }

        var results = new ArrayList<FetchResult>(descriptors.size());
        for (int i = 0; i < futures.size(); i++) {
            var future = futures.get(i);
            FetchResult result;
            if (future.isDone() && !future.isCompletedExceptionally()) {
                result = future.join();
            } else if (future.isDone()) {
                result = FetchResult.empty(descriptors.get(i), FetchStatus.FAILED);
            } else {
                result = FetchResult.empty(descriptors.get(i), FetchStatus.TIMED_OUT);
            }
            record(result.status());
            results.add(result);
        }
        return results;
    }

    private CompletableFuture<FetchResult> fetchOne(RuleDescriptor descriptor, String requestId) {
        String path = descriptor.path();
        // PENDING: consult the cache before any remote work
        if (cacheEnabled) {
            Optional<CacheEntry> hit = cache.get(path);
            if (hit.isPresent()) {
                log.debug("Cache hit for {}", path);
                return CompletableFuture.completedFuture(
                        FetchResult.of(descriptor, FetchStatus.CACHED, hit.get().content()));
            }
            return cache.fill(path, p -> CompletableFuture.supplyAsync(() -> readWithRetry(p, requestId), executor))
                    .handle((entry, error) -> error == null
                            ? FetchResult.of(descriptor, FetchStatus.FETCHED, entry.content())
                            : fallback(descriptor, unwrap(error)));
        }
        return uncachedRead(path, requestId)
                .handle((bytes, error) -> error == null
                        ? FetchResult.of(descriptor, FetchStatus.FETCHED, bytes)
                        : fallback(descriptor, unwrap(error)));
    }

    /**
     * Remote read with the cache disabled. Concurrent requests for the same path
     * share one read; nothing is stored once it completes.
     */
    private CompletableFuture<byte[]> uncachedRead(String path, String requestId) {
        var read = new CompletableFuture<byte[]>();
        CompletableFuture<byte[]> existing = uncachedReads.putIfAbsent(path, read);
        if (existing != null) {
            log.debug("Joining in-flight read for {}", path);
            return existing;
        }
        CompletableFuture.supplyAsync(() -> readWithRetry(path, requestId), executor)
                .whenComplete((bytes, error) -> {
                    uncachedReads.remove(path, read);
                    if (error != null) {
                        read.completeExceptionally(unwrap(error));
                    } else {
                        read.complete(bytes);
                    }
                });
        return read;
    }

    /**
     * Runs on a pool thread. Returns the document bytes or throws the final failure.
     */
    byte[] readWithRetry(String path, String requestId) {
        MdcContext.setRule(requestId, path);
        try {
            FetchState state = FetchState.FETCHING;
            int retries = 0;
            byte[] content = null;
            while (state != FetchState.DONE) {
                switch (state) {
                    case FETCHING -> {
                        try {
                            content = source.read(path, ref);
                            state = FetchState.DONE;
                        } catch (TransientContentException e) {
                            if (retries >= maxRetries) {
                                throw e;
                            }
                            log.debug("Transient failure reading {}: {}", path, e.getMessage());
                            state = FetchState.RETRY;
                        }
                    }
                    case RETRY -> {
                        Duration delay = backoff(retries);
                        retries++;
                        if (metrics != null) {
                            metrics.recordFetchRetry();
                        }
                        log.debug("Retry {}/{} for {} in {} ms", retries, maxRetries, path, delay.toMillis());
                        try {
                            sleeper.sleep(delay);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw new ContentSourceException("Interrupted while backing off for " + path, path, e);
                        }
                        state = FetchState.FETCHING;
                    }
                    default -> throw new IllegalStateException("Unexpected fetch state " + state);
                }
            }
            log.debug("Fetched {} ({} bytes, {} retries)", path, content.length, retries);
            return content;
        } finally {
            MdcContext.clearRule();
        }
    }

    /** {@code initialBackoff * 2^retry}. */
    Duration backoff(int retry) {
        return initialBackoff.multipliedBy(1L << Math.min(retry, 20));
    }

    private FetchResult fallback(RuleDescriptor descriptor, Throwable error) {
        String path = descriptor.path();
        if (error instanceof ContentNotFoundException) {
            log.debug("Rule {} not found in {}", path, source.describe());
            return FetchResult.empty(descriptor, FetchStatus.NOT_FOUND);
        }
        if (cacheEnabled) {
            var stale = cache.getStale(path);
            if (stale.isPresent()) {
                log.warn("Serving stale copy of {} after fetch failure: {}", path, error.getMessage());
                return FetchResult.of(descriptor, FetchStatus.STALE, stale.get().content());
            }
        }
        log.warn("Failed to fetch {}: {}", path, error.getMessage());
        return FetchResult.empty(descriptor, FetchStatus.FAILED);
    }

    private void record(FetchStatus status) {
        if (metrics != null) {
            metrics.recordFetchResult(status);
        }
    }

    public int concurrencyLimit() {
        return concurrencyLimit;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    /**
     * Fetcher tuning.
     *
     * @param ref              branch or version to read
     * @param concurrencyLimit maximum simultaneous remote reads
     * @param maxRetries       retries after the first attempt for transient failures
     * @param initialBackoff   delay before the first retry, doubled for each further one
     * @param cacheEnabled     when false the cache is neither read nor written
     */
    public record Settings(String ref, int concurrencyLimit, int maxRetries, Duration initialBackoff,
                           boolean cacheEnabled) {

        public static Settings defaults() {
            return new Settings("main", 5, 3, Duration.ofSeconds(1), true);
        }
    }

    private static final class FetchThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "rulewise-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
