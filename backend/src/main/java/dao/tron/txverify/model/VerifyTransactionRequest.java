package dao.tron.txverify.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class VerifyTransactionRequest {

    @NotNull
    @Valid
    private TransactionRecordRequest record;

    private VerificationHint hint;

    /** Overrides verifier.orchestrator.transaction-timeout-seconds for this call. */
    @Positive
    private Long timeoutSeconds;
}
