package dao.tron.txverify.model;

public enum VerdictOutcome {
    VERIFIED,
    TAMPERED,
    NOT_FOUND,
    AMBIGUOUS,
    ERROR
}
