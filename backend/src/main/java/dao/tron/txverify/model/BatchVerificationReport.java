package dao.tron.txverify.model;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated result of a batch verification; {@code results} is in request order.
 */
public record BatchVerificationReport(
        int totalTransactions,
        int verifiedCount,
        int failedCount,
        Map<VerdictOutcome, Integer> outcomeCounts,
        double successRate,
        long processingTimeMs,
        Instant verificationTimestamp,
        boolean failFast,
        boolean parallelProcessing,
        List<VerificationVerdict> results
) {

    public static BatchVerificationReport of(List<VerificationVerdict> results, Instant startedAt,
                                             long processingTimeMs, boolean failFast,
                                             boolean parallelProcessing) {
        Map<VerdictOutcome, Integer> counts = new EnumMap<>(VerdictOutcome.class);
        for (VerdictOutcome outcome : VerdictOutcome.values()) {
            counts.put(outcome, 0);
        }
        for (VerificationVerdict v : results) {
            counts.merge(v.outcome(), 1, Integer::sum);
        }
        int total = results.size();
        int verified = counts.get(VerdictOutcome.VERIFIED);
        double rate = total == 0 ? 0.0 : (double) verified / total;
        return new BatchVerificationReport(total, verified, total - verified, counts, rate,
                processingTimeMs, startedAt, failFast, parallelProcessing, List.copyOf(results));
    }
}
