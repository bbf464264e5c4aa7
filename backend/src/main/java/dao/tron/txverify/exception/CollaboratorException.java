package dao.tron.txverify.exception;

/**
 * Ledger or storage call failed permanently (malformed response, missing object, rejected call).
 * Not retried.
 */
public class CollaboratorException extends RuntimeException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isTransient() {
        return false;
    }
}
