package dao.tron.txverify.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Terminal outcome of one verification attempt. Every verification call yields one of these;
 * nothing past hint validation surfaces as an exception.
 *
 * @param candidates       batch ids considered, in rank order (diagnostics)
 * @param errorKind        set only for {@link VerdictOutcome#ERROR}
 * @param retryable        the failure was transient and a later retry may succeed
 * @param possiblyIncomplete the candidate search hit its cost bound
 * @param batchTimestamp   ledger timestamp of the matched batch
 */
@Builder(toBuilder = true)
public record VerificationVerdict(
        VerdictOutcome outcome,
        String batchId,
        Hash32 leafHash,
        Hash32 expectedRoot,
        MerkleProof proof,
        List<String> candidates,
        String reason,
        ErrorKind errorKind,
        boolean retryable,
        boolean possiblyIncomplete,
        Instant batchTimestamp,
        OperationKind operation,
        long processingTimeMs
) {

    public VerificationVerdict {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public boolean isVerified() {
        return outcome == VerdictOutcome.VERIFIED;
    }

    public static VerificationVerdict error(ErrorKind kind, String reason, boolean retryable) {
        return VerificationVerdict.builder()
                .outcome(VerdictOutcome.ERROR)
                .errorKind(kind)
                .reason(reason)
                .retryable(retryable)
                .build();
    }

    public static VerificationVerdict cancelled(String detail) {
        return error(ErrorKind.CANCELLED, "cancelled: " + detail, true);
    }
}
