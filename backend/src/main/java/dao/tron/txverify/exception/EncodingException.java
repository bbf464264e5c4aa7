package dao.tron.txverify.exception;

/**
 * A column value has a type the canonical encoding does not support.
 */
public class EncodingException extends RuntimeException {

    public EncodingException(String message) {
        super(message);
    }
}
