package dao.tron.txverify.model;

/**
 * One entry of a batch verification request.
 */
public record VerificationItem(TransactionRecord record, VerificationHint hint) {

    public VerificationItem {
        if (record == null) throw new IllegalArgumentException("Verification item needs a record");
        if (hint == null) hint = VerificationHint.empty();
    }
}
