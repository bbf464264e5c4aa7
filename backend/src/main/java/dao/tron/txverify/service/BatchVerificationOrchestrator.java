package dao.tron.txverify.service;

import dao.tron.txverify.config.VerifierProperties;
import dao.tron.txverify.exception.InvalidHintException;
import dao.tron.txverify.model.ErrorKind;
import dao.tron.txverify.model.VerificationItem;
import dao.tron.txverify.model.VerificationVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs many verifications on a bounded worker pool.
 *
 * Results come back in input order regardless of completion order. One item failing never
 * affects the others; at the deadline (or on fail-fast) unfinished items are interrupted and
 * reported as cancelled.
 */
@Slf4j
@Service
public class BatchVerificationOrchestrator {

    private final TransactionVerifier verifier;
    private final ExecutorService executor;
    private final int workers;

    public BatchVerificationOrchestrator(TransactionVerifier verifier, VerifierProperties properties) {
        this.verifier = verifier;
        // Upper bound to avoid accidental massive fan-out against the ledger node.
        this.workers = Math.max(1, Math.min(32, properties.getOrchestrator().getWorkers()));
        this.executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        log.info("Verification pool started with {} workers", workers);
    }

    /**
     * @param timeout  overall deadline for the whole call
     * @param failFast cancel the remaining items at the first verdict that is not VERIFIED
     * @return one verdict per item, in input order
     */
    public List<VerificationVerdict> verifyMany(List<VerificationItem> items, Duration timeout, boolean failFast) {
        return verifyMany(items, timeout, failFast, true);
    }

    /**
     * @param parallel when false the items run one at a time, in input order
     */
    public List<VerificationVerdict> verifyMany(List<VerificationItem> items, Duration timeout,
                                                boolean failFast, boolean parallel) {
        int n = items.size();
        if (n == 0) return List.of();
        // written only by the calling thread, from completed futures
        VerificationVerdict[] results = new VerificationVerdict[n];

        long deadline = System.nanoTime() + timeout.toNanos();
        CompletionService<Outcome> completion = new ExecutorCompletionService<>(executor);
        List<Future<Outcome>> futures = new ArrayList<>(n);
        int inFlightLimit = parallel ? n : 1;
        while (futures.size() < inFlightLimit) {
            submit(completion, futures, items);
        }

        String cancelReason = null;
        int completed = 0;
        while (completed < n) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                cancelReason = "deadline of " + timeout.toMillis() + "ms exceeded";
                break;
            }
            Future<Outcome> done;
            try {
                done = completion.poll(remaining, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelReason = "caller interrupted";
                break;
            }
            if (done == null) {
                cancelReason = "deadline of " + timeout.toMillis() + "ms exceeded";
                break;
            }
            completed++;
            Outcome outcome = outcomeOf(done);
            if (outcome != null) {
                results[outcome.index()] = outcome.verdict();
                if (failFast && !outcome.verdict().isVerified()) {
                    cancelReason = "fail-fast after item " + outcome.index() + " returned " + outcome.verdict().outcome();
                    break;
                }
            }
            if (futures.size() < n) {
                submit(completion, futures, items);
            }
        }

        if (cancelReason != null) {
            int cancelled = n - futures.size();
            for (Future<Outcome> f : futures) {
                if (!f.isDone() && f.cancel(true)) {
                    cancelled++;
                }
            }
            int late = collectFinished(futures, results);
            log.info("Cancelled {} of {} verifications ({} finished before cancellation): {}",
                    cancelled, n, late, cancelReason);
        }

        List<VerificationVerdict> ordered = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            VerificationVerdict verdict = results[i];
            ordered.add(verdict != null ? verdict : VerificationVerdict.cancelled(
                    cancelReason != null ? cancelReason : "no result produced"));
        }
        return ordered;
    }

    private void submit(CompletionService<Outcome> completion, List<Future<Outcome>> futures,
                        List<VerificationItem> items) {
        final int index = futures.size();
        futures.add(completion.submit(() -> new Outcome(index, verifyOne(items.get(index)))));
    }

    /**
     * Copies verdicts of tasks that completed but were never taken from the completion queue.
     *
     * @return number of slots filled
     */
    static int collectFinished(List<Future<Outcome>> futures, VerificationVerdict[] results) {
        int filled = 0;
        for (Future<Outcome> f : futures) {
            if (!f.isDone() || f.isCancelled()) continue;
            Outcome outcome = outcomeOf(f);
            if (outcome != null && results[outcome.index()] == null) {
                results[outcome.index()] = outcome.verdict();
                filled++;
            }
        }
        return filled;
    }

    private VerificationVerdict verifyOne(VerificationItem item) {
        try {
            return verifier.verify(item.record(), item.hint());
        } catch (InvalidHintException e) {
            return VerificationVerdict.error(ErrorKind.INVALID_HINT, e.getMessage(), false);
        } catch (RuntimeException e) {
            log.error("Verification task failed unexpectedly", e);
            return VerificationVerdict.error(ErrorKind.INTERNAL, "internal error: " + e.getMessage(), false);
        }
    }

    private static Outcome outcomeOf(Future<Outcome> done) {
        try {
            return done.get();
        } catch (ExecutionException e) {
            log.error("Verification task failed: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (CancellationException e) {
            return null;
        }
    }

    public int getWorkers() {
        return workers;
    }

    @jakarta.annotation.PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    record Outcome(int index, VerificationVerdict verdict) {}

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "verify-worker-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
