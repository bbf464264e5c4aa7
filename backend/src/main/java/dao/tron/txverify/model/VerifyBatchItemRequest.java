package dao.tron.txverify.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class VerifyBatchItemRequest {

    @NotNull
    @Valid
    private TransactionRecordRequest record;

    /** Per-item hint; the request-level hint applies when absent. */
    private VerificationHint hint;
}
