package dao.tron.txverify.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.List;

@Data
public class VerifyBatchRequest {

    @NotEmpty
    @Valid
    private List<VerifyBatchItemRequest> items;

    /** Shared hint for items that carry none of their own. */
    private VerificationHint hint;

    /** Stop at the first verdict that is not VERIFIED; the rest come back cancelled. */
    private boolean failFast;

    /** When false the items are verified one after another. */
    private boolean parallel = true;

    @Positive
    private Long timeoutSeconds;
}
