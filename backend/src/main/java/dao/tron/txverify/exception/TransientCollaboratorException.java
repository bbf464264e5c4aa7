package dao.tron.txverify.exception;

/**
 * Ledger or storage call failed in a way that may succeed on retry (timeout, connection reset,
 * node unavailable).
 */
public class TransientCollaboratorException extends CollaboratorException {

    public TransientCollaboratorException(String message) {
        super(message);
    }

    public TransientCollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
