package dao.tron.txverify.service;

import dao.tron.txverify.exception.CollaboratorException;
import dao.tron.txverify.exception.TransientCollaboratorException;
import dao.tron.txverify.exception.VerificationCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry for ledger and storage calls. Only {@link TransientCollaboratorException} is
 * retried; the delay doubles per attempt up to a cap, plus random jitter.
 */
@Slf4j
public class RetryPolicy {

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final long jitterMs;

    public RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, long jitterMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
        this.jitterMs = Math.max(0, jitterMs);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, 0, 0, 0);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Runs {@code call}, retrying transient failures.
     *
     * @throws CollaboratorException the last failure once attempts are exhausted, or at once when permanent
     * @throws VerificationCancelledException if interrupted while waiting or calling
     */
    public <T> T call(String operation, Callable<T> call) {
        long sleepMs = baseDelayMs;
        for (int attempt = 1; ; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new VerificationCancelledException(operation + " interrupted");
            }
            try {
                return call.call();
            } catch (TransientCollaboratorException e) {
                if (attempt >= maxAttempts) {
                    log.warn("{} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    throw e;
                }
                long jitter = jitterMs == 0 ? 0 : ThreadLocalRandom.current().nextLong(0, jitterMs + 1);
                log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                        operation, attempt, maxAttempts, sleepMs + jitter, e.getMessage());
                sleep(operation, sleepMs + jitter);
                sleepMs = Math.min(maxDelayMs, sleepMs * 2);
            } catch (CollaboratorException | VerificationCancelledException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new VerificationCancelledException(operation + " interrupted", e);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CollaboratorException(operation + " failed: " + e.getMessage(), e);
            }
        }
    }

    private static void sleep(String operation, long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new VerificationCancelledException(operation + " interrupted during backoff", ie);
        }
    }
}
