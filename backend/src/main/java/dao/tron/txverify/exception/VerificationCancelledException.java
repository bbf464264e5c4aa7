package dao.tron.txverify.exception;

/**
 * The verifying thread was interrupted (deadline, fail-fast or shutdown).
 */
public class VerificationCancelledException extends RuntimeException {

    public VerificationCancelledException(String message) {
        super(message);
    }

    public VerificationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
