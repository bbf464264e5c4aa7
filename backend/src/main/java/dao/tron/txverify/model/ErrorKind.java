package dao.tron.txverify.model;

/**
 * Why a verdict ended in {@link VerdictOutcome#ERROR}.
 */
public enum ErrorKind {
    INVALID_HINT,
    ENCODING,
    COLLABORATOR,
    CANCELLED,
    INTERNAL
}
