package dao.tron.txverify.service;

import dao.tron.txverify.exception.VerificationCancelledException;
import dao.tron.txverify.model.BatchDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * TTL cache of batch descriptors in front of the ledger.
 *
 * <ul>
 *   <li>Expired entries are never served; they are dropped on access and by {@link #sweep()}.</li>
 *   <li>Concurrent misses for one id share a single load.</li>
 *   <li>Failed loads and not-found results are not cached.</li>
 * </ul>
 */
@Slf4j
public class BatchMetadataCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Optional<BatchDescriptor>>> inFlight = new ConcurrentHashMap<>();

    private final Function<String, Optional<BatchDescriptor>> loader;
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;

    public BatchMetadataCache(Function<String, Optional<BatchDescriptor>> loader,
                              Duration ttl,
                              int maxEntries,
                              Clock clock) {
        this.loader = loader;
        this.ttl = ttl;
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
    }

    /**
     * Cached descriptor, or the result of loading it.
     *
     * @throws VerificationCancelledException if interrupted while waiting for another caller's load
     */
    public Optional<BatchDescriptor> get(String batchId) {
        while (true) {
            Entry cached = entries.get(batchId);
            if (cached != null) {
                if (cached.isLive(clock.instant())) {
                    return Optional.of(cached.batch);
                }
                entries.remove(batchId, cached);
            }

            CompletableFuture<Optional<BatchDescriptor>> mine = new CompletableFuture<>();
            CompletableFuture<Optional<BatchDescriptor>> leader = inFlight.putIfAbsent(batchId, mine);
            if (leader == null) {
                return load(batchId, mine);
            }

            try {
                return leader.get();
            } catch (CancellationException e) {
                // the leading caller was cancelled; load on our own account
                log.debug("Shared load of {} was cancelled, retrying", batchId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new VerificationCancelledException("interrupted waiting for batch " + batchId, e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) throw (RuntimeException) cause;
                if (cause instanceof Error) throw (Error) cause;
                throw new IllegalStateException("Batch load failed: " + batchId, cause);
            }
        }
    }

    private Optional<BatchDescriptor> load(String batchId, CompletableFuture<Optional<BatchDescriptor>> mine) {
        Optional<BatchDescriptor> loaded;
        try {
            loaded = loader.apply(batchId);
        } catch (VerificationCancelledException e) {
            inFlight.remove(batchId, mine);
            mine.cancel(false);
            throw e;
        } catch (RuntimeException | Error e) {
            inFlight.remove(batchId, mine);
            mine.completeExceptionally(e);
            throw e;
        }
        loaded.ifPresent(this::store);
        inFlight.remove(batchId, mine);
        mine.complete(loaded);
        return loaded;
    }

    /**
     * Caches a descriptor obtained elsewhere (an index query) unless a live entry already exists.
     */
    public void remember(BatchDescriptor batch) {
        Entry cached = entries.get(batch.batchId());
        if (cached != null && cached.isLive(clock.instant())) return;
        store(batch);
    }

    public void invalidate(String batchId) {
        if (entries.remove(batchId) != null) {
            log.debug("Invalidated cached batch {}", batchId);
        }
    }

    /**
     * Drops expired entries.
     *
     * @return number of entries removed
     */
    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, Entry> e : entries.entrySet()) {
            if (!e.getValue().isLive(now) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Swept {} expired batch descriptors", removed);
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    // capacity check and insert under one lock so concurrent stores cannot overshoot maxEntries
    private synchronized void store(BatchDescriptor batch) {
        if (!entries.containsKey(batch.batchId()) && entries.size() >= maxEntries) {
            evict();
        }
        entries.put(batch.batchId(), new Entry(batch, clock.instant().plus(ttl)));
    }

    private void evict() {
        if (entries.size() < maxEntries) return;
        if (sweep() > 0 && entries.size() < maxEntries) return;
        entries.entrySet().stream()
                .min(Comparator.comparing(e -> e.getValue().expiresAt))
                .ifPresent(e -> entries.remove(e.getKey(), e.getValue()));
    }

    private static final class Entry {
        private final BatchDescriptor batch;
        private final Instant expiresAt;

        private Entry(BatchDescriptor batch, Instant expiresAt) {
            this.batch = batch;
            this.expiresAt = expiresAt;
        }

        private boolean isLive(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
